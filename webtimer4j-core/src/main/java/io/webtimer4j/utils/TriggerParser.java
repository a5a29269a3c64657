package io.webtimer4j.utils;

import io.webtimer4j.core.ConfigException;
import io.webtimer4j.core.Trigger;
import io.webtimer4j.core.TriggerKind;
import org.quartz.CronExpression;

import java.text.ParseException;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;
import java.util.Date;
import java.util.Locale;
import java.util.Objects;
import java.util.TimeZone;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Due-time computation for interval and cron triggers.
 * <p>
 * Supported cron formats:
 * <ul>
 *   <li>5 fields: minute hour day-of-month month day-of-week (seconds are fixed to 0)</li>
 *   <li>6 fields: second minute hour day-of-month month day-of-week</li>
 * </ul>
 * Numeric days of week follow Unix cron (0 or 7 = Sunday) and are translated for Quartz.
 */
public final class TriggerParser {

    private static final String[] DAY_NAMES = {"SUN", "MON", "TUE", "WED", "THU", "FRI", "SAT", "SUN"};
    private static final Pattern DAY_NUMBER = Pattern.compile("\\b[0-7]\\b");

    private TriggerParser() {
    }

    /**
     * Next due time of an interval trigger.
     *
     * <p>Drift-corrected: the result lies on the grid {@code lastDue + k * interval}, never on the actual
     * completion time. When several boundaries have already passed, they are skipped and the nearest future
     * boundary is returned, so a late firing never causes catch-up firings.
     *
     * @param lastDue the due time that just fired; null when arming, in which case {@code now + interval}
     */
    public static Instant nextIntervalDue(long intervalSeconds, Instant lastDue, Instant now) {
        Objects.requireNonNull(now, "now must not be null");
        if (intervalSeconds <= 0) {
            throw new IllegalArgumentException("interval seconds must be positive: " + intervalSeconds);
        }
        if (lastDue == null) {
            return now.plusSeconds(intervalSeconds);
        }

        long periodMs = intervalSeconds * 1000L;
        Instant next = lastDue.plusMillis(periodMs);
        if (next.isAfter(now)) {
            return next;
        }
        long elapsedMs = Duration.between(lastDue, now).toMillis();
        long periods = elapsedMs / periodMs + 1;
        return lastDue.plusMillis(periods * periodMs);
    }

    /**
     * Earliest instant strictly after {@code now} matching {@code cron}, evaluated in {@code timezone}.
     */
    public static Instant nextCronDue(String cron, String timezone, Instant now) {
        Objects.requireNonNull(now, "now must not be null");
        CronExpression exp = compile(cron, resolveZone(timezone));
        Date next = exp.getNextValidTimeAfter(Date.from(now));
        if (next == null) {
            throw new ConfigException("Cron expression produced no next execution time: " + cron);
        }
        return next.toInstant();
    }

    /**
     * Reject a trigger that cannot produce due times.
     */
    public static void validate(Trigger trigger) {
        if (trigger == null) {
            throw new ConfigException("trigger is required");
        }
        if (trigger.kind() == TriggerKind.INTERVAL) {
            if (trigger.intervalSeconds() <= 0) {
                throw new ConfigException("interval seconds must be a positive number for interval schedule");
            }
            return;
        }
        if (trigger.cronExpression() == null) {
            throw new ConfigException("cron expression is required for cron schedule");
        }
        nextCronDue(trigger.cronExpression(), trigger.timezone(), Instant.now());
    }

    public static ZoneId resolveZone(String timezone) {
        if (timezone == null || timezone.isBlank()) {
            return ZoneId.systemDefault();
        }
        try {
            return ZoneId.of(timezone.trim());
        } catch (DateTimeException e) {
            throw new ConfigException("Invalid time zone: " + timezone, e);
        }
    }

    /**
     * Normalize a Unix-style cron expression into Quartz syntax.
     * <ul>
     *   <li>5 fields get a leading seconds field "0"</li>
     *   <li>one of day-of-month/day-of-week becomes "?"</li>
     *   <li>numeric days of week become names</li>
     * </ul>
     */
    public static String normalizeCron(String spec) {
        if (spec == null || spec.isBlank()) {
            throw new ConfigException("cron expression must not be empty");
        }
        String[] parts = spec.trim().split("\\s+");
        if (parts.length == 5) {
            return toQuartzCron("0", parts[0], parts[1], parts[2], parts[3], parts[4]);
        }
        if (parts.length == 6) {
            return toQuartzCron(parts[0], parts[1], parts[2], parts[3], parts[4], parts[5]);
        }
        throw new ConfigException("cron expression must have 5 or 6 fields: " + spec);
    }

    private static String toQuartzCron(String sec, String min, String hour, String dayOfMonth, String month,
                                       String dayOfWeek) {
        String dom = dayOfMonth;
        String dow = dayOfWeek;

        if ("*".equals(dow) || "?".equals(dow)) {
            dow = "?";
        } else if ("*".equals(dom) || "?".equals(dom)) {
            dom = "?";
            dow = dayOfWeekNames(dow);
        } else {
            throw new ConfigException("cron expressions restricting both day-of-month and day-of-week are not supported");
        }

        return String.join(" ", sec, min, hour, dom, month, dow);
    }

    private static String dayOfWeekNames(String field) {
        StringBuilder out = new StringBuilder();
        for (String part : field.split(",")) {
            if (out.length() > 0) {
                out.append(',');
            }
            int cut = indexOfAny(part, '/', '#');
            String base = cut < 0 ? part : part.substring(0, cut);
            String suffix = cut < 0 ? "" : part.substring(cut);
            Matcher m = DAY_NUMBER.matcher(base);
            out.append(m.replaceAll(r -> DAY_NAMES[Integer.parseInt(r.group())])).append(suffix);
        }
        return out.toString().toUpperCase(Locale.ROOT);
    }

    private static int indexOfAny(String s, char a, char b) {
        int i = s.indexOf(a);
        int j = s.indexOf(b);
        if (i < 0) return j;
        if (j < 0) return i;
        return Math.min(i, j);
    }

    private static CronExpression compile(String cron, ZoneId zone) {
        String quartz = normalizeCron(cron);
        try {
            CronExpression exp = new CronExpression(quartz);
            exp.setTimeZone(TimeZone.getTimeZone(zone));
            return exp;
        } catch (ParseException ex) {
            throw new ConfigException("Invalid cron expression: " + cron + " (" + ex.getMessage() + ")", ex);
        }
    }

    /**
     * Returns true if the string is a valid 5/6-field cron expression.
     */
    public static boolean looksLikeCron(String spec) {
        try {
            return CronExpression.isValidExpression(normalizeCron(spec));
        } catch (ConfigException ignored) {
            return false;
        }
    }

    /**
     * Parse an interval given as seconds ("300"), a compact unit ("5m", "2h") or pairs ("1 hour 30 minutes").
     */
    public static Duration parseInterval(String input) {
        Objects.requireNonNull(input, "input must not be null");
        String s = input.trim().toLowerCase(Locale.ROOT);
        if (s.isEmpty()) {
            throw new ConfigException("Interval string must not be empty");
        }

        if (s.matches("^\\d+$")) {
            long seconds;
            try {
                seconds = Long.parseLong(s);
            } catch (NumberFormatException ex) {
                throw new ConfigException("Interval seconds out of range: " + input);
            }
            if (seconds <= 0) {
                throw new ConfigException("Interval seconds must be positive: " + input);
            }
            return Duration.ofSeconds(seconds);
        }

        if (s.matches("^\\d+\\s*[smhdw]$")) {
            long n = Long.parseLong(s.replaceAll("[^0-9]", ""));
            char u = s.charAt(s.length() - 1);
            return switch (u) {
                case 's' -> Duration.ofSeconds(n);
                case 'm' -> Duration.ofMinutes(n);
                case 'h' -> Duration.ofHours(n);
                case 'd' -> Duration.ofDays(n);
                default -> Duration.ofDays(7L * n);
            };
        }

        String[] parts = s.split("\\s+");
        if (parts.length % 2 != 0) {
            throw new ConfigException("Invalid interval format. Expected pairs like '3 minutes': " + input);
        }

        long totalSeconds = 0;
        for (int i = 0; i < parts.length; i += 2) {
            long n;
            try {
                n = Long.parseLong(parts[i]);
            } catch (NumberFormatException ex) {
                throw new ConfigException("Invalid number in interval: " + parts[i]);
            }
            if (n < 0) {
                throw new ConfigException("Interval values must be non-negative");
            }

            String unit = parts[i + 1];
            if (unit.endsWith("s")) {
                unit = unit.substring(0, unit.length() - 1);
            }

            totalSeconds += switch (unit) {
                case "week" -> ChronoUnit.WEEKS.getDuration().toSeconds() * n;
                case "day" -> ChronoUnit.DAYS.getDuration().toSeconds() * n;
                case "hour" -> ChronoUnit.HOURS.getDuration().toSeconds() * n;
                case "minute" -> ChronoUnit.MINUTES.getDuration().toSeconds() * n;
                case "second" -> n;
                default -> throw new ConfigException("Unsupported interval unit: " + parts[i + 1]);
            };
        }

        if (totalSeconds <= 0) {
            throw new ConfigException("Interval must be positive: " + input);
        }
        return Duration.ofSeconds(totalSeconds);
    }
}
