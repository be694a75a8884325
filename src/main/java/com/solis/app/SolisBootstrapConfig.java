package com.solis.app;

import com.solis.app.properties.CacheProperties;
import com.solis.app.properties.HeartbeatProperties;
import com.solis.cache.CacheStore;
import com.solis.config.Config;
import com.solis.heartbeat.HeartbeatScheduler;
import com.solis.heartbeat.PidFileLock;
import com.solis.heartbeat.RunStateStore;
import com.solis.retry.Sleeper;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.context.properties.bind.Bindable;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Lazy;
import org.springframework.core.env.Environment;

import java.nio.file.Path;
import java.time.Clock;
import java.util.Map;

/**
 * Wires the agent inside a Spring context. Heartbeat and cache settings come from the
 * bound property holders; everything else from the flattened {@link Config}.
 */
@Configuration
@EnableConfigurationProperties({HeartbeatProperties.class, CacheProperties.class})
public class SolisBootstrapConfig {
    @Bean
    public Config solisConfig(Environment environment) {
        Map<String, Object> solisRawProperties = Binder.get(environment)
                .bind("", Bindable.mapOf(String.class, Object.class))
                .orElseGet(Map::of);
        Path workingDir = Path.of(".").toAbsolutePath().normalize();
        return Config.fromConfigurationProperties(workingDir, solisRawProperties);
    }

    @Bean
    public CacheStore cacheStore(Config config, CacheProperties cacheProperties) {
        return new CacheStore(resolve(config, cacheProperties.getDir(), ".cache"));
    }

    @Bean
    @Lazy
    public SolisAgent solisAgent(
            Config config,
            CacheStore cacheStore,
            HeartbeatProperties heartbeatProperties,
            CacheProperties cacheProperties
    ) {
        return SolisAgent.assemble(
                config,
                cacheStore,
                new PidFileLock(resolve(config, heartbeatProperties.getLockFile(), "/tmp/solis-heartbeat.lock")),
                new RunStateStore(resolve(config, heartbeatProperties.getStateFile(), ".solis-state.json")),
                heartbeatProperties.getHourUtc(),
                cacheProperties.getTtlHours(),
                cacheProperties.isPurgeExpired(),
                Clock.systemUTC(),
                Sleeper.SYSTEM
        );
    }

    @Bean
    @Lazy
    public HeartbeatScheduler heartbeatScheduler(SolisAgent solisAgent) {
        return solisAgent.scheduler;
    }

    private Path resolve(Config config, String value, String fallback) {
        return config.workingDir().resolve(firstNonBlank(value, fallback)).normalize();
    }

    private String firstNonBlank(String... values) {
        if (values == null) {
            return "";
        }
        for (String value : values) {
            if (value == null) {
                continue;
            }
            String trimmed = value.trim();
            if (!trimmed.isEmpty()) {
                return trimmed;
            }
        }
        return "";
    }
}
