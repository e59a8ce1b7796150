package com.eventhub.event.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "eventhub.lock")
public class LockProperties {

    private long waitTimeMs = 10_000;
}
