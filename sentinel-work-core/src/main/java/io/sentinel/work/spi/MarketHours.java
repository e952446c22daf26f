package io.sentinel.work.spi;

import java.time.Instant;

/**
 * Market-hours collaborator backed by exchange calendars.
 *
 * <p>{@code subjectKey} is a work item subject, typically a security identifier; implementations
 * resolve it to an exchange.
 */
public interface MarketHours {

    boolean isAnyMarketOpen(Instant at);

    boolean isSecurityMarketOpen(String subjectKey, Instant at);

    boolean areAllMarketsClosed(Instant at);

    /**
     * True when the relevant market has closed and the trading day it closed on has not ended yet.
     * A blank subject means every tracked market.
     *
     * <p>The default only checks that the market is closed; calendar-aware implementations should
     * also require a session to have ended earlier on the same trading day.
     */
    default boolean isAfterCloseOnTradingDay(String subjectKey, Instant at) {
        if (subjectKey == null || subjectKey.isBlank()) {
            return areAllMarketsClosed(at);
        }
        return !isSecurityMarketOpen(subjectKey, at);
    }
}
