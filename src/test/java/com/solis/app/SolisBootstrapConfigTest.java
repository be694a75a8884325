package com.solis.app;

import com.solis.app.properties.CacheProperties;
import com.solis.app.properties.HeartbeatProperties;
import com.solis.cache.CacheStore;
import com.solis.config.Config;
import com.solis.heartbeat.HeartbeatScheduler;
import com.solis.heartbeat.PidFileLock;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.context.annotation.AnnotationConfigApplicationContext;
import org.springframework.core.env.MapPropertySource;

import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SolisBootstrapConfigTest {

    @TempDir
    Path tempDir;

    @Test
    void contextShouldBindPropertiesAndAssembleAgent() {
        try (AnnotationConfigApplicationContext context = new AnnotationConfigApplicationContext()) {
            context.getEnvironment().getPropertySources().addFirst(new MapPropertySource("solis-test", Map.of(
                    "heartbeat.hour-utc", "5",
                    "heartbeat.lock-file", tempDir.resolve("agent.lock").toString(),
                    "heartbeat.state-file", tempDir.resolve("state.json").toString(),
                    "cache.dir", tempDir.resolve("cache").toString(),
                    "cache.ttl-hours", "6",
                    "reports.dir", tempDir.resolve("reports").toString()
            )));
            context.register(SolisBootstrapConfig.class);
            context.refresh();

            HeartbeatProperties heartbeat = context.getBean(HeartbeatProperties.class);
            CacheProperties cache = context.getBean(CacheProperties.class);
            assertEquals(5, heartbeat.getHourUtc());
            assertEquals(6.0, cache.getTtlHours(), 1e-9);

            Config config = context.getBean(Config.class);
            assertEquals(tempDir.resolve("reports"), config.getPath("reports.dir"));
            assertEquals(tempDir.resolve("cache"), context.getBean(CacheStore.class).cacheDir());

            SolisAgent agent = context.getBean(SolisAgent.class);
            assertSame(context.getBean(CacheStore.class), agent.cache);
            assertEquals(tempDir.resolve("agent.lock"), ((PidFileLock) agent.lock).lockFile());
            assertEquals(tempDir.resolve("state.json"), agent.stateStore.stateFile());
            assertEquals(tempDir.resolve("reports"), agent.reportStore.reportsDir());
            assertSame(agent.scheduler, context.getBean(HeartbeatScheduler.class));
            assertTrue(agent.scheduler.msUntilNextRun() > 0L);
        }
    }
}
