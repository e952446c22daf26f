package io.sentinel.work.internal;

import io.sentinel.work.WorkType;
import io.sentinel.work.spi.MarketHours;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Decides whether a work type's {@link io.sentinel.work.core.MarketTiming} is satisfied.
 *
 * <p>A failing {@link MarketHours} lookup counts as "not allowed": missing market data must
 * never let timing-constrained work through.
 */
public class MarketTimingGate {
    private static final Logger log = LoggerFactory.getLogger(MarketTimingGate.class);

    private final MarketHours marketHours;
    private final Clock clock;

    public MarketTimingGate(MarketHours marketHours, Clock clock) {
        this.marketHours = Objects.requireNonNull(marketHours, "marketHours must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public boolean isAnyMarketOpen() {
        return safely("isAnyMarketOpen", () -> marketHours.isAnyMarketOpen(clock.instant()));
    }

    public boolean isSecurityMarketOpen(String subjectKey) {
        return safely("isSecurityMarketOpen", () -> marketHours.isSecurityMarketOpen(subjectKey, clock.instant()));
    }

    public boolean areAllMarketsClosed() {
        return safely("areAllMarketsClosed", () -> marketHours.areAllMarketsClosed(clock.instant()));
    }

    public boolean allows(WorkType workType, String subject, Instant now) {
        boolean global = subject == null || subject.isEmpty();
        return switch (workType.marketTiming()) {
            case ANY_TIME -> true;
            case DURING_MARKET_OPEN -> global
                    ? safely(workType.id(), () -> marketHours.isAnyMarketOpen(now))
                    : safely(workType.id(), () -> marketHours.isSecurityMarketOpen(subject, now));
            case AFTER_MARKET_CLOSE -> safely(workType.id(), () -> marketHours.isAfterCloseOnTradingDay(subject, now));
            case ALL_MARKETS_CLOSED -> safely(workType.id(), () -> marketHours.areAllMarketsClosed(now));
        };
    }

    private static boolean safely(String what, Supplier<Boolean> check) {
        try {
            return Boolean.TRUE.equals(check.get());
        } catch (Exception e) {
            log.warn("market timing check failed for={} msg={}; treating as not allowed", what, e.getMessage());
            return false;
        }
    }
}
