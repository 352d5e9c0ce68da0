package com.taskherd.engine.plugin;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for PluginRegistry: loading, activation order, schema checks
 * and instrumented execution. No Spring context.
 */
class PluginRegistryTest {

    private final SimpleMeterRegistry meters = new SimpleMeterRegistry();

    // ------------------------------------------------------------------
    // Loading and activation
    // ------------------------------------------------------------------

    @Test
    void emptyActivation_loadsWholeCatalogInOrder() {
        PluginRegistry registry = new PluginRegistry(
                List.of(plugin("alpha"), plugin("beta")), List.of(), meters);

        assertThat(registry.list()).extracting(PluginManifest::name).containsExactly("alpha", "beta");
    }

    @Test
    void activationList_decidesOrder_andUnknownNamesAreSkipped() {
        PluginRegistry registry = new PluginRegistry(
                List.of(plugin("alpha"), plugin("beta")), List.of("beta", "ghost", "alpha"), meters);

        assertThat(registry.list()).extracting(PluginManifest::name).containsExactly("beta", "alpha");
        assertThat(registry.contains("ghost")).isFalse();
    }

    @Test
    void invalidManifest_isSkipped_othersStillLoad() {
        TaskPlugin badName = plugin(PluginManifest.of("Bad Name", "x"));
        TaskPlugin badRecurrence = plugin(PluginManifest.of("both", "x")
                .withRecurrence(new RecurrenceDefault("0 * * * * *", Duration.ofMinutes(1))));

        PluginRegistry registry = new PluginRegistry(
                List.of(badName, badRecurrence, plugin("good")), List.of(), meters);

        assertThat(registry.list()).extracting(PluginManifest::name).containsExactly("good");
    }

    @Test
    void duplicateNameInCatalog_firstWins() {
        TaskPlugin first  = plugin(PluginManifest.of("dup", "first"));
        TaskPlugin second = plugin(PluginManifest.of("dup", "second"));

        PluginRegistry registry = new PluginRegistry(List.of(first, second), List.of(), meters);

        assertThat(registry.resolve("dup")).isSameAs(first);
    }

    @Test
    void register_duplicate_throws() {
        PluginRegistry registry = new PluginRegistry(List.of(plugin("alpha")), List.of(), meters);

        assertThatThrownBy(() -> registry.register(plugin("alpha")))
                .isInstanceOf(DuplicatePluginException.class);
    }

    @Test
    void validate_rejectsBadCronAndLimits() {
        assertThatThrownBy(() -> PluginRegistry.validate(PluginManifest.of("p", "x")
                .withRecurrence(RecurrenceDefault.cron("not a cron"))))
                .isInstanceOf(PluginLoadException.class);
        assertThatThrownBy(() -> PluginRegistry.validate(PluginManifest.of("p", "x").withTimeout(Duration.ZERO)))
                .isInstanceOf(PluginLoadException.class);
        assertThatThrownBy(() -> PluginRegistry.validate(PluginManifest.of("p", "x").withMaxAttempts(0)))
                .isInstanceOf(PluginLoadException.class);
        assertThatThrownBy(() -> PluginRegistry.validate(PluginManifest.of("p", "x",
                ParameterSpec.required("a", "string", ""), ParameterSpec.optional("a", "string", null, ""))))
                .isInstanceOf(PluginLoadException.class);
    }

    @Test
    void activationList_mergesConfigAndEnv_dropsRepeats() {
        assertThat(PluginRegistry.activationList("echo:shell", "shell,stats"))
                .containsExactly("echo", "shell", "stats");
        assertThat(PluginRegistry.activationList("", null)).isEmpty();
    }

    // ------------------------------------------------------------------
    // Lookup and schema
    // ------------------------------------------------------------------

    @Test
    void resolve_unknown_throwsPluginNotFound() {
        PluginRegistry registry = new PluginRegistry(List.of(), List.of(), meters);

        assertThatThrownBy(() -> registry.resolve("nope")).isInstanceOf(PluginNotFoundException.class);
    }

    @Test
    void applySchema_mergesDefaults_andReportsMissingRequired() {
        TaskPlugin p = plugin(PluginManifest.of("build", "x",
                ParameterSpec.required("repo", "string", ""),
                ParameterSpec.optional("branch", "string", "main", "")));
        PluginRegistry registry = new PluginRegistry(List.of(p), List.of(), meters);

        Map<String, Object> merged = registry.applySchema("build", Map.of("repo", "org/r", "extra", 1));
        assertThat(merged).containsEntry("repo", "org/r")
                .containsEntry("branch", "main")
                .containsEntry("extra", 1);

        assertThatThrownBy(() -> registry.applySchema("build", Map.of()))
                .isInstanceOfSatisfying(InvalidParametersException.class,
                        e -> assertThat(e.getMissing()).containsExactly("repo"));
    }

    @Test
    void limits_fallBackToEngineDefaults() {
        TaskPlugin tuned = plugin(PluginManifest.of("tuned", "x")
                .withTimeout(Duration.ofSeconds(5)).withMaxAttempts(7));
        PluginRegistry registry = new PluginRegistry(List.of(tuned, plugin("plain")), List.of(), meters);

        assertThat(registry.timeoutFor("tuned", Duration.ofMinutes(10))).isEqualTo(Duration.ofSeconds(5));
        assertThat(registry.timeoutFor("plain", Duration.ofMinutes(10))).isEqualTo(Duration.ofMinutes(10));
        assertThat(registry.maxAttemptsFor("tuned", 3)).isEqualTo(7);
        assertThat(registry.maxAttemptsFor("plain", 3)).isEqualTo(3);
    }

    // ------------------------------------------------------------------
    // execute()
    // ------------------------------------------------------------------

    @Test
    void execute_success_countsCall() {
        PluginRegistry registry = new PluginRegistry(
                List.of(plugin(PluginManifest.of("ok", "x"), ctx -> Map.of("return_value", ctx.param("x")))),
                List.of(), meters);

        Map<String, Object> result = registry.execute("ok", ctx("ok", Map.of("x", "hi")));

        assertThat(result).containsEntry("return_value", "hi");
        assertThat(meters.counter("taskherd.plugin.calls", "plugin", "ok", "status", "success").count())
                .isEqualTo(1.0);
    }

    @Test
    void execute_unexpectedException_isWrappedAsExecutionError() {
        PluginRegistry registry = new PluginRegistry(
                List.of(plugin(PluginManifest.of("npe", "x"), ctx -> { throw new NullPointerException("oops"); })),
                List.of(), meters);

        assertThatThrownBy(() -> registry.execute("npe", ctx("npe", Map.of())))
                .isInstanceOfSatisfying(PluginException.class, e -> {
                    assertThat(e.getKind()).isEqualTo(PluginException.Kind.EXECUTION_ERROR);
                    assertThat(e.getMessage()).contains("oops");
                });
        assertThat(meters.counter("taskherd.plugin.calls", "plugin", "npe", "status", "execution_error").count())
                .isEqualTo(1.0);
    }

    @Test
    void execute_nullResult_becomesEmptyMap() {
        PluginRegistry registry = new PluginRegistry(
                List.of(plugin(PluginManifest.of("quiet", "x"), ctx -> null)), List.of(), meters);

        assertThat(registry.execute("quiet", ctx("quiet", Map.of()))).isEmpty();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static PluginContext ctx(String name, Map<String, Object> params) {
        return new PluginContext(UUID.randomUUID(), name, params, 1, () -> false);
    }

    private static TaskPlugin plugin(String name) {
        return plugin(PluginManifest.of(name, "test plugin"));
    }

    private static TaskPlugin plugin(PluginManifest manifest) {
        return plugin(manifest, ctx -> Map.of());
    }

    private static TaskPlugin plugin(PluginManifest manifest, Function<PluginContext, Map<String, Object>> body) {
        return new TaskPlugin() {
            @Override
            public PluginManifest manifest() {
                return manifest;
            }

            @Override
            public Map<String, Object> execute(PluginContext ctx) {
                return body.apply(ctx);
            }
        };
    }
}
