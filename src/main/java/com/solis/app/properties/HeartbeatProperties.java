package com.solis.app.properties;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Getter
@Setter
@ConfigurationProperties(prefix = "heartbeat")
public class HeartbeatProperties {
    private int hourUtc = 8;
    private String lockFile = "/tmp/solis-heartbeat.lock";
    private String stateFile = ".solis-state.json";
}
