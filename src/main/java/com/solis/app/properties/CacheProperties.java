package com.solis.app.properties;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Getter
@Setter
@ConfigurationProperties(prefix = "cache")
public class CacheProperties {
    private String dir = ".cache";
    private double ttlHours = 12.0;
    private boolean purgeExpired = false;
}
