package io.sentinel.work.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.sentinel.work.WorkEngine;
import io.sentinel.work.WorkType;
import io.sentinel.work.core.WorkTypeRegistry;
import io.sentinel.work.event.EventBus;
import io.sentinel.work.internal.DefaultWorkEngine;
import io.sentinel.work.internal.mongo.MongoCompletionStore;
import io.sentinel.work.internal.mongo.MongoJobStore;
import io.sentinel.work.market.ExchangeCalendar;
import io.sentinel.work.market.ExchangeCalendarMarketHours;
import io.sentinel.work.market.SubjectExchangeResolver;
import io.sentinel.work.spi.CompletionStore;
import io.sentinel.work.spi.JobStore;
import io.sentinel.work.spi.MarketHours;
import io.sentinel.work.web.EventStreamController;
import io.sentinel.work.web.WorkStatusController;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.List;

/**
 * Spring Boot auto-configuration entrypoint for the work engine.
 *
 * <p>Every {@link WorkType} bean in the context is registered; the engine starts once the context
 * is refreshed. Stores, market hours and the clock can be replaced by declaring a bean of the
 * same type.
 */
@AutoConfiguration
@ConditionalOnClass({WorkEngine.class, MongoTemplate.class})
@EnableConfigurationProperties(WorkProperties.class)
@ConditionalOnProperty(prefix = "sentinel.work", name = "enabled", havingValue = "true", matchIfMissing = true)
public class WorkAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Clock workClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public EventBus workEventBus(WorkProperties props, Clock clock) {
        return new EventBus(props.getEventBufferSize(), clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public WorkTypeRegistry workTypeRegistry(ObjectProvider<WorkType> workTypes) {
        return new WorkTypeRegistry(workTypes.orderedStream().toList());
    }

    @Bean
    @ConditionalOnMissingBean(CompletionStore.class)
    protected MongoCompletionStore mongoCompletionStore(MongoTemplate mongoTemplate) {
        return new MongoCompletionStore(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean(JobStore.class)
    protected MongoJobStore mongoJobStore(MongoTemplate mongoTemplate, ObjectMapper objectMapper) {
        return new MongoJobStore(mongoTemplate, objectMapper);
    }

    @Bean
    @ConditionalOnMissingBean(MarketHours.class)
    public ExchangeCalendarMarketHours exchangeCalendarMarketHours(WorkProperties props) {
        List<ExchangeCalendar> calendars = props.getMarkets().stream()
                .map(WorkProperties.Market::toCalendar)
                .toList();
        return new ExchangeCalendarMarketHours(
                calendars,
                SubjectExchangeResolver.fromMap(props.getSubjectExchanges()),
                props.getDefaultExchange());
    }

    @Bean
    @ConditionalOnMissingBean
    public WorkEngine workEngine(WorkProperties props,
                                 WorkTypeRegistry registry,
                                 CompletionStore completionStore,
                                 JobStore jobStore,
                                 MarketHours marketHours,
                                 EventBus events,
                                 Clock clock) {
        return new DefaultWorkEngine(props, registry, completionStore, jobStore, marketHours, events, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public WorkLifecycle workLifecycle(WorkEngine engine) {
        return new WorkLifecycle(engine);
    }

    @Bean
    @ConditionalOnMissingBean
    protected WorkMongoIndexConfig workMongoIndexConfig(MongoTemplate mongoTemplate) {
        return new WorkMongoIndexConfig(mongoTemplate);
    }

    @Bean
    @ConditionalOnProperty(prefix = "sentinel.work", name = "ensure-indexes-on-startup", havingValue = "true")
    public SmartInitializingSingleton workIndexesInitializer(WorkMongoIndexConfig indexConfig) {
        return indexConfig::ensureIndexes;
    }

    /**
     * HTTP status, trigger and event-stream endpoints, only in servlet web applications.
     */
    @Configuration(proxyBeanMethods = false)
    @ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.SERVLET)
    @ConditionalOnClass(RestController.class)
    static class WorkWebConfiguration {

        @Bean
        @ConditionalOnMissingBean
        public WorkStatusController workStatusController(WorkEngine engine) {
            return new WorkStatusController(engine);
        }

        @Bean
        @ConditionalOnMissingBean
        public EventStreamController eventStreamController(EventBus events,
                                                           ObjectMapper objectMapper,
                                                           Clock clock,
                                                           WorkProperties props) {
            return new EventStreamController(events, objectMapper, clock, props.getHeartbeatInterval());
        }
    }
}
