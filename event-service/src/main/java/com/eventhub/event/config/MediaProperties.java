package com.eventhub.event.config;

import com.eventhub.event.domain.MediaKind;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Upload ceilings. A blob is stored inline in one document, so the size limit
 * must stay below the 16 MiB document cap.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "eventhub.media")
public class MediaProperties {

    private long maxSizeBytes = 10L * 1024 * 1024;
    private List<String> posterTypes = new ArrayList<>(List.of("image/jpeg", "image/png", "image/gif", "image/webp"));
    private List<String> videoTypes = new ArrayList<>(List.of("video/mp4", "video/webm", "video/quicktime"));
    private List<String> photoTypes = new ArrayList<>(List.of("image/jpeg", "image/png", "image/webp"));

    public List<String> allowedTypes(MediaKind kind) {
        return switch (kind) {
            case POSTER -> posterTypes;
            case PROMO_VIDEO -> videoTypes;
            case VENUE_PHOTO -> photoTypes;
        };
    }
}
