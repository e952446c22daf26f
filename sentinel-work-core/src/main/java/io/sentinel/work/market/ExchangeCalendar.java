package io.sentinel.work.market;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Trading hours and holidays of one exchange.
 */
public record ExchangeCalendar(
        String code,
        ZoneId zone,
        List<TradingWindow> windows,
        Set<LocalDate> holidays
) {

    public ExchangeCalendar {
        Objects.requireNonNull(code, "code must not be null");
        Objects.requireNonNull(zone, "zone must not be null");
        if (windows == null || windows.isEmpty()) {
            throw new IllegalArgumentException("exchange " + code + " must have at least one trading window");
        }
        windows = List.copyOf(windows);
        holidays = holidays == null ? Set.of() : Set.copyOf(holidays);
    }

    public boolean isTradingDay(LocalDate date) {
        DayOfWeek dow = date.getDayOfWeek();
        if (dow == DayOfWeek.SATURDAY || dow == DayOfWeek.SUNDAY) {
            return false;
        }
        return !holidays.contains(date);
    }

    public boolean isOpen(Instant at) {
        ZonedDateTime local = at.atZone(zone);
        if (!isTradingDay(local.toLocalDate())) {
            return false;
        }
        LocalTime time = local.toLocalTime();
        for (TradingWindow w : windows) {
            if (w.contains(time)) {
                return true;
            }
        }
        return false;
    }

    /**
     * True between the final close of a trading day and local midnight.
     */
    public boolean hasClosedForTheDay(Instant at) {
        ZonedDateTime local = at.atZone(zone);
        if (!isTradingDay(local.toLocalDate())) {
            return false;
        }
        return !local.toLocalTime().isBefore(finalClose());
    }

    public LocalTime finalClose() {
        return windows.stream()
                .map(TradingWindow::close)
                .max(Comparator.naturalOrder())
                .orElseThrow();
    }
}
