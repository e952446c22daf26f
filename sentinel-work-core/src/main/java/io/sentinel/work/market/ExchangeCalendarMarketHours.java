package io.sentinel.work.market;

import io.sentinel.work.spi.MarketHours;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * {@link MarketHours} computed from static exchange calendars.
 *
 * <p>Subjects without a known exchange fall back to {@code defaultExchange}; with no default they
 * are rejected with {@link IllegalArgumentException}, which the timing gate treats as "not allowed".
 */
public class ExchangeCalendarMarketHours implements MarketHours {
    private static final Logger log = LoggerFactory.getLogger(ExchangeCalendarMarketHours.class);

    private final Map<String, ExchangeCalendar> calendars;
    private final SubjectExchangeResolver resolver;
    private final String defaultExchange;

    public ExchangeCalendarMarketHours(Collection<ExchangeCalendar> calendars,
                                       SubjectExchangeResolver resolver,
                                       String defaultExchange) {
        Objects.requireNonNull(calendars, "calendars must not be null");
        this.resolver = Objects.requireNonNull(resolver, "resolver must not be null");

        Map<String, ExchangeCalendar> byCode = new LinkedHashMap<>();
        for (ExchangeCalendar c : calendars) {
            if (byCode.putIfAbsent(c.code(), c) != null) {
                throw new IllegalArgumentException("Duplicate exchange calendar: " + c.code());
            }
        }
        this.calendars = Map.copyOf(byCode);

        if (defaultExchange != null && !defaultExchange.isBlank() && !byCode.containsKey(defaultExchange)) {
            throw new IllegalArgumentException("Default exchange has no calendar: " + defaultExchange);
        }
        this.defaultExchange = (defaultExchange == null || defaultExchange.isBlank()) ? null : defaultExchange;

        log.info("Market hours calendars initialized count={} default={}", this.calendars.size(), this.defaultExchange);
    }

    @Override
    public boolean isAnyMarketOpen(Instant at) {
        return calendars.values().stream().anyMatch(c -> c.isOpen(at));
    }

    @Override
    public boolean isSecurityMarketOpen(String subjectKey, Instant at) {
        return calendarFor(subjectKey).isOpen(at);
    }

    @Override
    public boolean areAllMarketsClosed(Instant at) {
        return calendars.values().stream().noneMatch(c -> c.isOpen(at));
    }

    @Override
    public boolean isAfterCloseOnTradingDay(String subjectKey, Instant at) {
        if (subjectKey == null || subjectKey.isBlank()) {
            return areAllMarketsClosed(at)
                    && calendars.values().stream().anyMatch(c -> c.hasClosedForTheDay(at));
        }
        ExchangeCalendar cal = calendarFor(subjectKey);
        return !cal.isOpen(at) && cal.hasClosedForTheDay(at);
    }

    public ExchangeCalendar calendarFor(String subjectKey) {
        String code = resolver.exchangeFor(subjectKey).orElse(null);
        if (code != null) {
            ExchangeCalendar cal = calendars.get(code);
            if (cal != null) {
                return cal;
            }
            log.warn("Unknown exchange for subject={} exchange={}; using default={}", subjectKey, code, defaultExchange);
        }
        if (defaultExchange == null) {
            throw new IllegalArgumentException("No exchange calendar for subject: " + subjectKey);
        }
        return calendars.get(defaultExchange);
    }
}
