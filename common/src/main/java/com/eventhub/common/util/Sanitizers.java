package com.eventhub.common.util;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;

import java.util.regex.Pattern;

@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class Sanitizers {

    public static final int MAX_TEXT_LENGTH = 5000;
    public static final int MAX_FILENAME_LENGTH = 255;

    private static final Pattern UNSAFE_FILENAME_CHARS = Pattern.compile("[<>:\"/\\\\|?*\\x00-\\x1f]");
    private static final String DEFAULT_FILENAME = "file";

    /**
     * Strips NUL bytes and surrounding whitespace. Null stays null.
     */
    public static String text(String value) {
        if (value == null) {
            return null;
        }
        return value.replace("\u0000", "").strip();
    }

    /**
     * Reduces an uploaded file name to a safe, bounded last path segment.
     */
    public static String filename(String original) {
        String name = original == null ? "" : original;
        int lastSeparator = Math.max(name.lastIndexOf('/'), name.lastIndexOf('\\'));
        name = name.substring(lastSeparator + 1);
        name = UNSAFE_FILENAME_CHARS.matcher(name).replaceAll("");
        name = name.replace("..", "");
        if (name.isEmpty()) {
            name = DEFAULT_FILENAME;
        }
        if (name.length() > MAX_FILENAME_LENGTH) {
            name = name.substring(0, MAX_FILENAME_LENGTH);
        }
        return name;
    }
}
