package com.eventhub.common.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SanitizersTest {

    @Test
    void text_stripsWhitespaceAndNulBytes() {
        assertThat(Sanitizers.text("  Main\u0000 Hall  ")).isEqualTo("Main Hall");
    }

    @Test
    void text_keepsNull() {
        assertThat(Sanitizers.text(null)).isNull();
    }

    @Test
    void filename_keepsLastPathSegment() {
        assertThat(Sanitizers.filename("../../etc/passwd")).isEqualTo("passwd");
        assertThat(Sanitizers.filename("C:\\uploads\\poster.png")).isEqualTo("poster.png");
    }

    @Test
    void filename_removesUnsafeCharacters() {
        assertThat(Sanitizers.filename("my<poster>?.png")).isEqualTo("myposter.png");
    }

    @Test
    void filename_fallsBackWhenNothingLeft() {
        assertThat(Sanitizers.filename(null)).isEqualTo("file");
        assertThat(Sanitizers.filename("dir/")).isEqualTo("file");
    }

    @Test
    void filename_truncatesLongNames() {
        assertThat(Sanitizers.filename("a".repeat(300) + ".png")).hasSize(Sanitizers.MAX_FILENAME_LENGTH);
    }
}
