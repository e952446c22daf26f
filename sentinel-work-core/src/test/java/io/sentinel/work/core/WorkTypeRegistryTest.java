package io.sentinel.work.core;

import io.sentinel.work.WorkType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WorkTypeRegistryTest {

    @Test
    void allShouldOrderByPriorityThenRegistration() {
        WorkTypeRegistry registry = new WorkTypeRegistry();
        registry.register(type("maintenance:backup", Priority.LOW));
        registry.register(type("sync:portfolio", Priority.HIGH));
        registry.register(type("planner:weights", Priority.MEDIUM));
        registry.register(type("sync:prices", Priority.HIGH));
        registry.register(type("trading:execute", Priority.CRITICAL));

        assertThat(registry.all()).extracting(WorkType::id).containsExactly(
                "trading:execute", "sync:portfolio", "sync:prices", "planner:weights", "maintenance:backup");
    }

    @Test
    void registerShouldRejectDuplicateIds() {
        WorkTypeRegistry registry = new WorkTypeRegistry();
        registry.register(type("sync:portfolio", Priority.HIGH));

        assertThatThrownBy(() -> registry.register(type("sync:portfolio", Priority.LOW)))
                .isInstanceOf(WorkConfigurationException.class)
                .hasMessageContaining("Duplicate");
    }

    @Test
    void registerShouldRejectUnknownDependency() {
        WorkTypeRegistry registry = new WorkTypeRegistry();

        assertThatThrownBy(() -> registry.register(type("planner:context", Priority.MEDIUM, "planner:weights")))
                .isInstanceOf(WorkConfigurationException.class)
                .hasMessageContaining("unknown work type: planner:weights");
        assertThat(registry.size()).isZero();
    }

    @Test
    void registerAllShouldAllowForwardReferencesWithinBatch() {
        WorkTypeRegistry registry = new WorkTypeRegistry(List.of(
                type("planner:plan", Priority.MEDIUM, "planner:context"),
                type("planner:context", Priority.MEDIUM, "planner:weights"),
                type("planner:weights", Priority.MEDIUM)));

        assertThat(registry.contains("planner:plan")).isTrue();
        assertThat(registry.getRequired("planner:plan").dependsOn()).containsExactly("planner:context");
    }

    @Test
    void registerAllShouldRejectCyclesAtomically() {
        WorkTypeRegistry registry = new WorkTypeRegistry();
        registry.register(type("sync:portfolio", Priority.HIGH));

        assertThatThrownBy(() -> registry.registerAll(List.of(
                type("a", Priority.MEDIUM, "b"),
                type("b", Priority.MEDIUM, "c"),
                type("c", Priority.MEDIUM, "a"))))
                .isInstanceOf(WorkConfigurationException.class)
                .hasMessageContaining("Circular")
                .hasMessageContaining("a -> b -> c -> a");

        assertThat(registry.all()).extracting(WorkType::id).containsExactly("sync:portfolio");
    }

    @Test
    void frozenRegistryShouldRejectRegistration() {
        WorkTypeRegistry registry = new WorkTypeRegistry();
        registry.freeze();

        assertThatThrownBy(() -> registry.register(type("sync:portfolio", Priority.HIGH)))
                .isInstanceOf(IllegalStateException.class);
        assertThat(registry.get("sync:portfolio")).isEmpty();
    }

    @Test
    void builderShouldRejectSelfDependencyAndMissingBody() {
        assertThatThrownBy(() -> WorkType.builder("x").dependsOn("x"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> WorkType.builder("x").interval("5m").build())
                .isInstanceOf(IllegalStateException.class);
        assertThat(WorkType.builder("x").interval("0").execute((c, s, p) -> {
        }).build().isOnDemand()).isTrue();
    }

    private static WorkType type(String id, Priority priority, String... deps) {
        return WorkType.builder(id)
                .priority(priority)
                .interval("5m")
                .dependsOn(deps)
                .execute((ctx, subject, progress) -> {
                })
                .build();
    }
}
