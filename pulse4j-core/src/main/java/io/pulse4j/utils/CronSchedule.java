package io.pulse4j.utils;

import io.pulse4j.exception.SchedulingException;
import org.quartz.CronExpression;

import java.text.ParseException;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.TimeZone;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Computes cron occurrences for scheduled jobs.
 * <p>
 * Accepted formats:
 * <ul>
 *   <li>5-field cron: {@code minute hour day-of-month month day-of-week}</li>
 *   <li>6-field cron with leading seconds: {@code second minute hour day-of-month month day-of-week}</li>
 * </ul>
 * Day-of-week uses the Unix numbering ({@code 0} or {@code 7} = Sunday) and is translated to
 * Quartz numbering. When both day-of-month and day-of-week are restricted, a day matching either
 * field fires (Vixie cron semantics); Quartz cannot express that in one expression, so the
 * schedule is evaluated as two expressions and the earlier occurrence wins.
 * <p>
 * Occurrences are evaluated in the job's IANA time zone, so daylight saving transitions shift
 * the gap between two occurrences rather than the wall-clock time.
 */
public final class CronSchedule {

    public static final String DEFAULT_TIMEZONE = "UTC";

    private static final Pattern LEADING_DIGITS = Pattern.compile("^(\\d+)(.*)$");

    private CronSchedule() {
    }

    /**
     * Next occurrence strictly after {@code after}.
     *
     * @param expression 5- or 6-field cron expression
     * @param timezone   IANA time zone id; null or blank means UTC
     * @throws SchedulingException if the expression or the time zone is invalid, or no future occurrence exists
     */
    public static Instant nextOccurrence(String expression, String timezone, Instant after) {
        if (after == null) {
            throw new IllegalArgumentException("after must not be null");
        }
        TimeZone zone = TimeZone.getTimeZone(resolveZone(timezone));

        Date next = null;
        for (CronExpression exp : parse(expression)) {
            exp.setTimeZone(zone);
            Date candidate = exp.getNextValidTimeAfter(Date.from(after));
            if (candidate != null && (next == null || candidate.before(next))) {
                next = candidate;
            }
        }
        if (next == null) {
            throw new SchedulingException("Cron expression produced no next execution time: " + expression);
        }
        return next.toInstant();
    }

    /**
     * The next {@code count} occurrences after {@code after}, in order.
     */
    public static List<Instant> upcoming(String expression, String timezone, Instant after, int count) {
        if (count <= 0) {
            throw new IllegalArgumentException("count must be a positive number");
        }
        List<Instant> out = new ArrayList<>(count);
        Instant cursor = after;
        for (int i = 0; i < count; i++) {
            cursor = nextOccurrence(expression, timezone, cursor);
            out.add(cursor);
        }
        return out;
    }

    /**
     * Returns true if the expression can be scheduled.
     */
    public static boolean isValid(String expression) {
        try {
            return normalizeCron(expression).stream().allMatch(CronExpression::isValidExpression);
        } catch (SchedulingException | IllegalArgumentException ignored) {
            return false;
        }
    }

    public static ZoneId resolveZone(String timezone) {
        if (timezone == null || timezone.isBlank()) {
            return ZoneId.of(DEFAULT_TIMEZONE);
        }
        try {
            return ZoneId.of(timezone.trim());
        } catch (DateTimeException e) {
            throw new SchedulingException("Unresolvable time zone: " + timezone, e);
        }
    }

    /**
     * Translate a 5/6-field Unix cron expression into Quartz syntax.
     *
     * @return one Quartz expression, or two when both day fields are restricted
     */
    public static List<String> normalizeCron(String spec) {
        if (spec == null) {
            throw new SchedulingException("Cron expression must not be null");
        }
        String s = spec.trim();
        if (s.isEmpty()) {
            throw new SchedulingException("Cron expression must not be empty");
        }

        String[] parts = s.split("\\s+");
        if (parts.length == 5) {
            return toQuartzCron("0", parts[0], parts[1], parts[2], parts[3], parts[4]);
        }
        if (parts.length == 6) {
            return toQuartzCron(parts[0], parts[1], parts[2], parts[3], parts[4], parts[5]);
        }
        throw new SchedulingException("Cron expression must have 5 or 6 fields: " + spec);
    }

    private static List<CronExpression> parse(String expression) {
        List<CronExpression> out = new ArrayList<>(2);
        for (String quartz : normalizeCron(expression)) {
            try {
                out.add(new CronExpression(quartz));
            } catch (ParseException e) {
                throw new SchedulingException("Invalid cron expression: " + expression + " (" + e.getMessage() + ")", e);
            }
        }
        return out;
    }

    private static List<String> toQuartzCron(String sec, String min, String hour, String dayOfMonth, String month, String dayOfWeek) {
        boolean anyDom = "*".equals(dayOfMonth) || "?".equals(dayOfMonth);
        boolean anyDow = "*".equals(dayOfWeek) || "?".equals(dayOfWeek);

        if (anyDow) {
            String dom = "?".equals(dayOfMonth) ? "*" : dayOfMonth;
            return List.of(String.join(" ", sec, min, hour, dom, month, "?"));
        }
        String dow = toQuartzDayOfWeek(dayOfWeek);
        if (anyDom) {
            return List.of(String.join(" ", sec, min, hour, "?", month, dow));
        }
        return List.of(
                String.join(" ", sec, min, hour, dayOfMonth, month, "?"),
                String.join(" ", sec, min, hour, "?", month, dow));
    }

    private static String toQuartzDayOfWeek(String field) {
        List<String> out = new ArrayList<>();
        for (String part : field.split(",")) {
            String step = "";
            int slash = part.indexOf('/');
            if (slash >= 0) {
                step = part.substring(slash);
                part = part.substring(0, slash);
            }
            String[] bounds = part.split("-", -1);
            for (int i = 0; i < bounds.length; i++) {
                bounds[i] = shiftDay(bounds[i]);
            }
            out.add(String.join("-", bounds) + step);
        }
        return String.join(",", out);
    }

    // Unix 0..7 (Sunday = 0 or 7) to Quartz 1..7 (Sunday = 1); keeps suffixes like "L" or "#3".
    private static String shiftDay(String token) {
        Matcher m = LEADING_DIGITS.matcher(token);
        if (!m.matches()) {
            return token;
        }
        String digits = m.group(1);
        if (digits.length() > 1 || Integer.parseInt(digits) > 7) {
            throw new SchedulingException("Day-of-week out of range: " + token);
        }
        int n = Integer.parseInt(digits);
        return ((n % 7) + 1) + m.group(2);
    }
}
