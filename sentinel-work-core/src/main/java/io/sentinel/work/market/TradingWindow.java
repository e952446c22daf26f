package io.sentinel.work.market;

import java.time.LocalTime;
import java.util.Objects;

/**
 * One continuous trading session within a day, in exchange local time. {@code close} is exclusive.
 */
public record TradingWindow(LocalTime open, LocalTime close) {

    public TradingWindow {
        Objects.requireNonNull(open, "open must not be null");
        Objects.requireNonNull(close, "close must not be null");
        if (!close.isAfter(open)) {
            throw new IllegalArgumentException("close must be after open: " + open + "-" + close);
        }
    }

    public static TradingWindow of(String open, String close) {
        return new TradingWindow(LocalTime.parse(open), LocalTime.parse(close));
    }

    public boolean contains(LocalTime time) {
        return !time.isBefore(open) && time.isBefore(close);
    }
}
