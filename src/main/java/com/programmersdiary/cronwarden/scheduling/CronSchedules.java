package com.programmersdiary.cronwarden.scheduling;

import com.programmersdiary.cronwarden.exception.MalformedScheduleException;
import org.springframework.scheduling.Trigger;
import org.springframework.scheduling.TriggerContext;
import org.springframework.scheduling.support.CronTrigger;
import org.springframework.scheduling.support.PeriodicTrigger;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Turns the cron specs stored on entries into Spring triggers.
 * <p>
 * Accepted forms: five-field cron expressions, the {@code @yearly}, {@code @annually},
 * {@code @monthly}, {@code @weekly}, {@code @daily}, {@code @midnight} and {@code @hourly}
 * descriptors, and {@code @every <duration>} with a duration such as {@code 1h30m} or {@code 45s}.
 * As in standard cron, an expression that restricts both day-of-month and day-of-week fires when
 * either of them matches.
 */
public final class CronSchedules {

    private static final String EVERY = "@every";
    private static final Set<String> DESCRIPTORS = Set.of(
            "@yearly", "@annually", "@monthly", "@weekly", "@daily", "@midnight", "@hourly");
    private static final Pattern DURATION = Pattern.compile("((\\d+(\\.\\d+)?)(ms|s|m|h))+");
    private static final Pattern DURATION_PART = Pattern.compile("(\\d+(?:\\.\\d+)?)(ms|s|m|h)");
    private static final Map<String, Long> UNIT_MILLIS = Map.of(
            "ms", 1L, "s", 1_000L, "m", 60_000L, "h", 3_600_000L);

    private CronSchedules() {
    }

    public static Trigger parse(String cronSpec) {
        if (cronSpec == null || cronSpec.isBlank()) {
            throw new MalformedScheduleException(cronSpec, "empty expression");
        }
        var spec = cronSpec.trim();
        if (spec.startsWith(EVERY)) {
            return every(cronSpec, spec.substring(EVERY.length()).trim());
        }
        if (spec.startsWith("@")) {
            if (!DESCRIPTORS.contains(spec)) {
                throw new MalformedScheduleException(cronSpec, "unrecognized descriptor");
            }
            return cron(cronSpec, spec);
        }
        var fields = spec.split("\\s+");
        if (fields.length != 5) {
            throw new MalformedScheduleException(cronSpec, "expected 5 fields, found " + fields.length);
        }
        if (isRestricted(fields[2]) && isRestricted(fields[4])) {
            // Either day field may match: one trigger per day field, first firing wins.
            return new EitherDayTrigger(
                    cron(cronSpec, expression(fields[0], fields[1], fields[2], fields[3], "*")),
                    cron(cronSpec, expression(fields[0], fields[1], "*", fields[3], fields[4])));
        }
        return cron(cronSpec, expression(fields));
    }

    // Spring expressions carry a leading seconds field.
    private static String expression(String... fields) {
        return "0 " + String.join(" ", fields);
    }

    private static boolean isRestricted(String dayField) {
        return !dayField.startsWith("*") && !dayField.startsWith("?");
    }

    private static Trigger cron(String cronSpec, String expression) {
        try {
            return new CronTrigger(expression);
        } catch (IllegalArgumentException e) {
            throw new MalformedScheduleException(cronSpec, e.getMessage());
        }
    }

    private static Trigger every(String cronSpec, String duration) {
        if (!DURATION.matcher(duration).matches()) {
            throw new MalformedScheduleException(cronSpec, "invalid duration '" + duration + "'");
        }
        var millis = BigDecimal.ZERO;
        var matcher = DURATION_PART.matcher(duration);
        while (matcher.find()) {
            millis = millis.add(new BigDecimal(matcher.group(1))
                    .multiply(BigDecimal.valueOf(UNIT_MILLIS.get(matcher.group(2)))));
        }
        // Sub-second periods are rounded up to one second.
        var period = Duration.ofMillis(Math.max(1_000L, millis.longValue()));
        var trigger = new PeriodicTrigger(period);
        trigger.setFixedRate(true);
        trigger.setInitialDelay(period);
        return trigger;
    }

    /**
     * Fires on the earlier of two cron triggers, giving standard cron's day-of-month OR
     * day-of-week matching when both day fields are restricted.
     */
    record EitherDayTrigger(Trigger dayOfMonth, Trigger dayOfWeek) implements Trigger {

        @Override
        public Instant nextExecution(TriggerContext triggerContext) {
            var byMonthDay = dayOfMonth.nextExecution(triggerContext);
            var byWeekDay = dayOfWeek.nextExecution(triggerContext);
            if (byMonthDay == null || byWeekDay == null) {
                return byMonthDay != null ? byMonthDay : byWeekDay;
            }
            return byMonthDay.isBefore(byWeekDay) ? byMonthDay : byWeekDay;
        }
    }
}
