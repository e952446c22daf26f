package io.sentinel.work.utils;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * Parses and formats work type intervals.
 * <p>
 * Supported input formats:
 * <ul>
 *   <li>Plain seconds: "300"</li>
 *   <li>Compact: "45s", "5m", "2h", "1d", "1w"</li>
 *   <li>Human-readable pairs: "5 minutes", "1 hour 30 minutes", "1 day 3 hours"</li>
 * </ul>
 * Output of {@link #format(Duration)} is compact and lossless at second precision:
 * "0", "45s", "5m", "1h30m", "24h".
 */
public final class IntervalParser {
    private IntervalParser() {
    }

    public static Duration parseDuration(String input) {
        Objects.requireNonNull(input, "input must not be null");
        String s = input.trim().toLowerCase();
        if (s.isEmpty()) {
            throw new IllegalArgumentException("Interval string must not be empty");
        }

        if (s.matches("^\\d+$")) {
            long seconds;
            try {
                seconds = Long.parseLong(s);
            } catch (NumberFormatException ex) {
                throw new IllegalArgumentException("Interval seconds out of range: " + input);
            }
            if (seconds <= 0) {
                throw new IllegalArgumentException("Interval seconds must be positive: " + input);
            }
            return Duration.ofSeconds(seconds);
        }

        if (s.matches("^\\d+\\s*[smhdw]$")) {
            String digits = s.replaceAll("[^0-9]", "");
            char u = s.replaceAll("[0-9\\s]", "").charAt(0);
            long n = Long.parseLong(digits);
            return switch (u) {
                case 's' -> Duration.ofSeconds(n);
                case 'm' -> Duration.ofMinutes(n);
                case 'h' -> Duration.ofHours(n);
                case 'd' -> Duration.ofDays(n);
                case 'w' -> Duration.ofDays(7L * n);
                default -> throw new IllegalArgumentException("Unsupported compact unit: " + u);
            };
        }

        String[] parts = s.split("\\s+");
        if (parts.length % 2 != 0) {
            throw new IllegalArgumentException("Invalid interval format. Expected pairs like '3 minutes': " + input);
        }

        boolean seenWeek = false, seenDay = false, seenHour = false, seenMinute = false, seenSecond = false;
        long totalSeconds = 0;

        for (int i = 0; i < parts.length; i += 2) {
            long n;
            try {
                n = Long.parseLong(parts[i]);
            } catch (NumberFormatException ex) {
                throw new IllegalArgumentException("Invalid number in interval: " + parts[i]);
            }
            if (n < 0) {
                throw new IllegalArgumentException("Interval values must be non-negative");
            }

            String unit = parts[i + 1];
            if (unit.endsWith("s")) {
                unit = unit.substring(0, unit.length() - 1);
            }

            switch (unit) {
                case "week" -> {
                    if (seenWeek) throw new IllegalArgumentException("Duplicate unit: week");
                    seenWeek = true;
                    totalSeconds += ChronoUnit.DAYS.getDuration().toSeconds() * 7L * n;
                }
                case "day" -> {
                    if (seenDay) throw new IllegalArgumentException("Duplicate unit: day");
                    seenDay = true;
                    totalSeconds += ChronoUnit.DAYS.getDuration().toSeconds() * n;
                }
                case "hour" -> {
                    if (seenHour) throw new IllegalArgumentException("Duplicate unit: hour");
                    seenHour = true;
                    totalSeconds += ChronoUnit.HOURS.getDuration().toSeconds() * n;
                }
                case "minute" -> {
                    if (seenMinute) throw new IllegalArgumentException("Duplicate unit: minute");
                    seenMinute = true;
                    totalSeconds += ChronoUnit.MINUTES.getDuration().toSeconds() * n;
                }
                case "second" -> {
                    if (seenSecond) throw new IllegalArgumentException("Duplicate unit: second");
                    seenSecond = true;
                    totalSeconds += n;
                }
                default -> throw new IllegalArgumentException("Unsupported interval unit: " + parts[i + 1]);
            }
        }

        if (totalSeconds <= 0) {
            throw new IllegalArgumentException("Interval must be positive: " + input);
        }
        return Duration.ofSeconds(totalSeconds);
    }

    /**
     * Compact form used by status output. Days are rendered as hours ("24h") and sub-second
     * remainders are dropped.
     */
    public static String format(Duration d) {
        Objects.requireNonNull(d, "duration must not be null");
        long total = d.getSeconds();
        if (total <= 0) {
            return "0";
        }

        long hours = total / 3600;
        long minutes = (total % 3600) / 60;
        long seconds = total % 60;

        StringBuilder sb = new StringBuilder();
        if (hours > 0) {
            sb.append(hours).append('h');
        }
        if (minutes > 0) {
            sb.append(minutes).append('m');
        }
        if (seconds > 0) {
            sb.append(seconds).append('s');
        }
        return sb.toString();
    }
}
