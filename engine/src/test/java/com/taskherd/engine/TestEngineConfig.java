package com.taskherd.engine;

import com.taskherd.engine.plugin.PluginContext;
import com.taskherd.engine.plugin.PluginException;
import com.taskherd.engine.plugin.PluginManifest;
import com.taskherd.engine.plugin.TaskPlugin;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;

import java.time.Duration;
import java.util.Map;

/**
 * Controllable clock plus a few misbehaving plugins for integration tests.
 */
@TestConfiguration
public class TestEngineConfig {

    @Bean
    @Primary
    MutableClock testClock() {
        return new MutableClock();
    }

    /** Fails every attempt. */
    @Bean
    TaskPlugin boomPlugin() {
        return new TaskPlugin() {
            @Override
            public PluginManifest manifest() {
                return PluginManifest.of("boom", "Always fails");
            }

            @Override
            public Map<String, Object> execute(PluginContext ctx) {
                throw new PluginException(PluginException.Kind.EXECUTION_ERROR, "boom on attempt " + ctx.attempt());
            }
        };
    }

    /** Sleeps far past its own timeout; one attempt only. */
    @Bean
    TaskPlugin slowPlugin() {
        return new TaskPlugin() {
            @Override
            public PluginManifest manifest() {
                return PluginManifest.of("slow", "Sleeps past its timeout")
                        .withTimeout(Duration.ofMillis(200))
                        .withMaxAttempts(1);
            }

            @Override
            public Map<String, Object> execute(PluginContext ctx) {
                try {
                    Thread.sleep(5_000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new PluginException(PluginException.Kind.CANCELLED, "interrupted");
                }
                return Map.of("return_value", "too late");
            }
        };
    }
}
