package io.sentinel.work.core;

/**
 * Market window during which a work type may run.
 */
public enum MarketTiming {

    /** No market constraint. */
    ANY_TIME,

    /** The relevant market (global, or the subject's exchange) must be open. */
    DURING_MARKET_OPEN,

    /** The relevant market has closed, and it is still the same trading day. */
    AFTER_MARKET_CLOSE,

    /** Every tracked market must be closed. */
    ALL_MARKETS_CLOSED;

    public String label() {
        return name().toLowerCase();
    }
}
