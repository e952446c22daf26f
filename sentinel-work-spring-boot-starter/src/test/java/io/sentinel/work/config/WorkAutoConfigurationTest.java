package io.sentinel.work.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.sentinel.work.WorkEngine;
import io.sentinel.work.WorkType;
import io.sentinel.work.core.Priority;
import io.sentinel.work.core.WorkTypeRegistry;
import io.sentinel.work.market.ExchangeCalendarMarketHours;
import io.sentinel.work.spi.MarketHours;
import io.sentinel.work.web.EventStreamController;
import io.sentinel.work.web.WorkStatusController;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.boot.test.context.runner.WebApplicationContextRunner;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

class WorkAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(WorkAutoConfiguration.class))
            .withBean(MongoTemplate.class, () -> mock(MongoTemplate.class))
            .withBean(ObjectMapper.class, ObjectMapper::new)
            .withBean("syncPortfolio", WorkType.class, () -> demoWorkType("sync:portfolio", Priority.HIGH))
            .withBean("plannerWeights", WorkType.class, () -> demoWorkType("planner:weights", Priority.MEDIUM))
            .withPropertyValues(
                    "sentinel.work.enabled=true",
                    "sentinel.work.worker-id=test-worker",
                    "sentinel.work.process-every=500ms",
                    "sentinel.work.queue-poll-every=200ms",
                    "sentinel.work.shutdown-grace-period=1s"
            );

    @Test
    void shouldAutoConfigureWorkEngineBeans() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(WorkEngine.class);
            assertThat(context).hasSingleBean(WorkLifecycle.class);
            assertThat(context).hasSingleBean(WorkProperties.class);
            assertThat(context).hasSingleBean(ExchangeCalendarMarketHours.class);
            assertThat(context).doesNotHaveBean(WorkStatusController.class);

            WorkTypeRegistry registry = context.getBean(WorkTypeRegistry.class);
            assertThat(registry.all()).extracting(WorkType::id)
                    .containsExactly("sync:portfolio", "planner:weights");
            assertThat(context.getBean(WorkEngine.class).isRunning()).isTrue();
        });
    }

    @Test
    void shouldBindMarketCalendarsFromProperties() {
        contextRunner
                .withPropertyValues(
                        "sentinel.work.markets[0].code=XNYS",
                        "sentinel.work.markets[0].timezone=America/New_York",
                        "sentinel.work.markets[0].sessions=09:30-16:00",
                        "sentinel.work.markets[0].holidays=2026-12-25",
                        "sentinel.work.default-exchange=XNYS")
                .run(context -> {
                    MarketHours marketHours = context.getBean(MarketHours.class);
                    // Thursday 2026-03-05 15:00 UTC = 10:00 in New York
                    assertThat(marketHours.isAnyMarketOpen(Instant.parse("2026-03-05T15:00:00Z"))).isTrue();
                    assertThat(marketHours.isAnyMarketOpen(Instant.parse("2026-12-25T15:00:00Z"))).isFalse();
                });
    }

    @Test
    void shouldBackOffWhenDisabled() {
        contextRunner
                .withPropertyValues("sentinel.work.enabled=false")
                .run(context -> assertThat(context).doesNotHaveBean(WorkEngine.class));
    }

    @Test
    void shouldKeepUserProvidedMarketHours() {
        MarketHours custom = mock(MarketHours.class);
        contextRunner
                .withBean(MarketHours.class, () -> custom)
                .run(context -> {
                    assertThat(context).doesNotHaveBean(ExchangeCalendarMarketHours.class);
                    assertThat(context.getBean(MarketHours.class)).isSameAs(custom);
                });
    }

    @Test
    void shouldFailStartupOnUnknownDependency() {
        contextRunner
                .withBean("orphan", WorkType.class, () -> WorkType.builder("planner:context")
                        .interval("5m")
                        .dependsOn("planner:missing")
                        .execute((ctx, subject, progress) -> {
                        })
                        .build())
                .run(context -> assertThat(context).hasFailed());
    }

    @Test
    void shouldRegisterControllersInWebApplications() {
        new WebApplicationContextRunner()
                .withConfiguration(AutoConfigurations.of(WorkAutoConfiguration.class))
                .withBean(MongoTemplate.class, () -> mock(MongoTemplate.class))
                .withBean(ObjectMapper.class, ObjectMapper::new)
                .withPropertyValues("sentinel.work.worker-id=test-worker")
                .run(context -> {
                    assertThat(context).hasSingleBean(WorkStatusController.class);
                    assertThat(context).hasSingleBean(EventStreamController.class);
                });
    }

    private static WorkType demoWorkType(String id, Priority priority) {
        return WorkType.builder(id)
                .priority(priority)
                .interval("5m")
                .execute((ctx, subject, progress) -> {
                    // no-op for context bootstrap test
                })
                .build();
    }
}
