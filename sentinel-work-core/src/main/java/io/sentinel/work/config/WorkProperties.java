package io.sentinel.work.config;

import io.sentinel.work.market.ExchangeCalendar;
import io.sentinel.work.market.TradingWindow;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Runtime configuration of the work engine.
 */
@ConfigurationProperties(prefix = "sentinel.work")
public class WorkProperties {
    private boolean enabled = true;
    private String workerId;
    private int maxConcurrency = 4; // worker pool size, shared by schedule and queue
    private Duration processEvery = Duration.ofMinutes(1); // failsafe scheduling tick
    private Duration queuePollEvery = Duration.ofSeconds(1);
    private Duration executionTimeout = Duration.ofMinutes(10);
    private Duration shutdownGracePeriod = Duration.ofSeconds(30);
    private Duration jobLockLifetime = Duration.ofMinutes(15);
    private int defaultMaxRetries = 3;
    private Duration retryBaseDelay = Duration.ofSeconds(10);
    private Duration retryMaxDelay = Duration.ofMinutes(10);
    private Duration inFlightDeferDelay = Duration.ofSeconds(5);
    private int historySize = 200;
    private int eventBufferSize = 256;
    private Duration progressThrottle = Duration.ofMillis(100);
    private Duration heartbeatInterval = Duration.ofSeconds(30);
    private boolean ensureIndexesOnStartup = false;
    private String defaultExchange;
    private List<Market> markets = new ArrayList<>();
    private Map<String, String> subjectExchanges = new LinkedHashMap<>();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getWorkerId() {
        return workerId;
    }

    public void setWorkerId(String workerId) {
        this.workerId = workerId;
    }

    public int getMaxConcurrency() {
        return maxConcurrency;
    }

    public void setMaxConcurrency(int maxConcurrency) {
        this.maxConcurrency = maxConcurrency;
    }

    public Duration getProcessEvery() {
        return processEvery;
    }

    public void setProcessEvery(Duration processEvery) {
        this.processEvery = processEvery;
    }

    public Duration getQueuePollEvery() {
        return queuePollEvery;
    }

    public void setQueuePollEvery(Duration queuePollEvery) {
        this.queuePollEvery = queuePollEvery;
    }

    public Duration getExecutionTimeout() {
        return executionTimeout;
    }

    public void setExecutionTimeout(Duration executionTimeout) {
        this.executionTimeout = executionTimeout;
    }

    public Duration getShutdownGracePeriod() {
        return shutdownGracePeriod;
    }

    public void setShutdownGracePeriod(Duration shutdownGracePeriod) {
        this.shutdownGracePeriod = shutdownGracePeriod;
    }

    public Duration getJobLockLifetime() {
        return jobLockLifetime;
    }

    public void setJobLockLifetime(Duration jobLockLifetime) {
        this.jobLockLifetime = jobLockLifetime;
    }

    public int getDefaultMaxRetries() {
        return defaultMaxRetries;
    }

    public void setDefaultMaxRetries(int defaultMaxRetries) {
        this.defaultMaxRetries = defaultMaxRetries;
    }

    public Duration getRetryBaseDelay() {
        return retryBaseDelay;
    }

    public void setRetryBaseDelay(Duration retryBaseDelay) {
        this.retryBaseDelay = retryBaseDelay;
    }

    public Duration getRetryMaxDelay() {
        return retryMaxDelay;
    }

    public void setRetryMaxDelay(Duration retryMaxDelay) {
        this.retryMaxDelay = retryMaxDelay;
    }

    public Duration getInFlightDeferDelay() {
        return inFlightDeferDelay;
    }

    public void setInFlightDeferDelay(Duration inFlightDeferDelay) {
        this.inFlightDeferDelay = inFlightDeferDelay;
    }

    public int getHistorySize() {
        return historySize;
    }

    public void setHistorySize(int historySize) {
        this.historySize = historySize;
    }

    public int getEventBufferSize() {
        return eventBufferSize;
    }

    public void setEventBufferSize(int eventBufferSize) {
        this.eventBufferSize = eventBufferSize;
    }

    public Duration getProgressThrottle() {
        return progressThrottle;
    }

    public void setProgressThrottle(Duration progressThrottle) {
        this.progressThrottle = progressThrottle;
    }

    public Duration getHeartbeatInterval() {
        return heartbeatInterval;
    }

    public void setHeartbeatInterval(Duration heartbeatInterval) {
        this.heartbeatInterval = heartbeatInterval;
    }

    public boolean isEnsureIndexesOnStartup() {
        return ensureIndexesOnStartup;
    }

    public void setEnsureIndexesOnStartup(boolean ensureIndexesOnStartup) {
        this.ensureIndexesOnStartup = ensureIndexesOnStartup;
    }

    public String getDefaultExchange() {
        return defaultExchange;
    }

    public void setDefaultExchange(String defaultExchange) {
        this.defaultExchange = defaultExchange;
    }

    public List<Market> getMarkets() {
        return markets;
    }

    public void setMarkets(List<Market> markets) {
        this.markets = markets;
    }

    public Map<String, String> getSubjectExchanges() {
        return subjectExchanges;
    }

    public void setSubjectExchanges(Map<String, String> subjectExchanges) {
        this.subjectExchanges = subjectExchanges;
    }

    /**
     * Exchange calendar entry, e.g.
     * <pre>
     * sentinel.work.markets[0].code=XNYS
     * sentinel.work.markets[0].timezone=America/New_York
     * sentinel.work.markets[0].sessions=09:30-16:00
     * sentinel.work.markets[0].holidays=2026-01-01,2026-12-25
     * </pre>
     */
    public static class Market {
        private String code;
        private String timezone;
        private List<String> sessions = new ArrayList<>();
        private List<String> holidays = new ArrayList<>();

        public String getCode() {
            return code;
        }

        public void setCode(String code) {
            this.code = code;
        }

        public String getTimezone() {
            return timezone;
        }

        public void setTimezone(String timezone) {
            this.timezone = timezone;
        }

        public List<String> getSessions() {
            return sessions;
        }

        public void setSessions(List<String> sessions) {
            this.sessions = sessions;
        }

        public List<String> getHolidays() {
            return holidays;
        }

        public void setHolidays(List<String> holidays) {
            this.holidays = holidays;
        }

        public ExchangeCalendar toCalendar() {
            if (code == null || code.isBlank()) {
                throw new IllegalArgumentException("sentinel.work.markets[].code must not be blank");
            }
            if (timezone == null || timezone.isBlank()) {
                throw new IllegalArgumentException("sentinel.work.markets[" + code + "].timezone must not be blank");
            }

            List<TradingWindow> windows = new ArrayList<>();
            for (String session : sessions) {
                String[] bounds = session.trim().split("-");
                if (bounds.length != 2) {
                    throw new IllegalArgumentException("Invalid session for " + code + ". Expected HH:mm-HH:mm: " + session);
                }
                windows.add(TradingWindow.of(bounds[0].trim(), bounds[1].trim()));
            }

            List<LocalDate> days = holidays.stream().map(String::trim).map(LocalDate::parse).toList();
            return new ExchangeCalendar(code, ZoneId.of(timezone), windows, Set.copyOf(days));
        }
    }
}
