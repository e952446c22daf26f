package io.sentinel.work.internal;

import io.sentinel.work.spi.MarketHours;

import java.time.Instant;

/**
 * Market hours with a single open/closed switch for every market.
 */
class StubMarketHours implements MarketHours {

    private volatile boolean open;

    StubMarketHours(boolean open) {
        this.open = open;
    }

    void setOpen(boolean open) {
        this.open = open;
    }

    @Override
    public boolean isAnyMarketOpen(Instant at) {
        return open;
    }

    @Override
    public boolean isSecurityMarketOpen(String subjectKey, Instant at) {
        return open;
    }

    @Override
    public boolean areAllMarketsClosed(Instant at) {
        return !open;
    }
}
