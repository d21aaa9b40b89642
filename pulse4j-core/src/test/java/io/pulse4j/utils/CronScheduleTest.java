package io.pulse4j.utils;

import io.pulse4j.exception.SchedulingException;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneId;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CronScheduleTest {

    @Test
    void hourlyCronShouldFireAtTopOfNextHour() {
        Instant next = CronSchedule.nextOccurrence("0 * * * *", "UTC", Instant.parse("2024-01-01T00:05:00Z"));
        assertEquals(Instant.parse("2024-01-01T01:00:00Z"), next);
    }

    @Test
    void nextOccurrenceShouldBeStrictlyAfterReference() {
        Instant next = CronSchedule.nextOccurrence("0 * * * *", "UTC", Instant.parse("2024-01-01T01:00:00Z"));
        assertEquals(Instant.parse("2024-01-01T02:00:00Z"), next);
    }

    @Test
    void sixFieldCronShouldHonourSeconds() {
        Instant next = CronSchedule.nextOccurrence("30 0 * * * *", "UTC", Instant.parse("2024-01-01T00:05:00Z"));
        assertEquals(Instant.parse("2024-01-01T01:00:30Z"), next);
    }

    @Test
    void wallClockTimeShouldSurviveDaylightSavingChange() {
        List<Instant> runs = CronSchedule.upcoming("0 9 * * *", "America/New_York",
                Instant.parse("2024-03-08T15:00:00Z"), 2);

        // 09:00 EST, then 09:00 EDT
        assertEquals(List.of(
                Instant.parse("2024-03-09T14:00:00Z"),
                Instant.parse("2024-03-10T13:00:00Z")
        ), runs);
    }

    @Test
    void dayOfWeekShouldUseUnixNumbering() {
        Instant mondayMorning = Instant.parse("2024-01-01T09:00:00Z");

        assertEquals(Instant.parse("2024-01-08T08:00:00Z"),
                CronSchedule.nextOccurrence("0 8 * * 1", "UTC", mondayMorning));
        assertEquals(Instant.parse("2024-01-07T08:00:00Z"),
                CronSchedule.nextOccurrence("0 8 * * 0", "UTC", mondayMorning));
        assertEquals(Instant.parse("2024-01-07T08:00:00Z"),
                CronSchedule.nextOccurrence("0 8 * * 7", "UTC", mondayMorning));
    }

    @Test
    void weekdayRangeShouldSkipWeekend() {
        Instant fridayAfterRun = Instant.parse("2024-01-05T09:00:00Z");
        assertEquals(Instant.parse("2024-01-08T08:00:00Z"),
                CronSchedule.nextOccurrence("0 8 * * 1-5", "UTC", fridayAfterRun));
    }

    @Test
    void restrictedDayOfMonthAndDayOfWeekShouldFireOnEither() {
        // first of the month or any Monday
        assertEquals(Instant.parse("2024-01-08T09:00:00Z"),
                CronSchedule.nextOccurrence("0 9 1 * 1", "UTC", Instant.parse("2024-01-02T00:00:00Z")));
        assertEquals(Instant.parse("2024-02-01T09:00:00Z"),
                CronSchedule.nextOccurrence("0 9 1 * 1", "UTC", Instant.parse("2024-01-30T00:00:00Z")));
        assertTrue(CronSchedule.isValid("0 9 1,15 * 1-5"));
    }

    @Test
    void normalizeCronShouldProduceQuartzSyntax() {
        assertEquals(List.of("0 */5 * * * ?"), CronSchedule.normalizeCron("*/5 * * * *"));
        assertEquals(List.of("0 0 8 ? * 2-6"), CronSchedule.normalizeCron("0 8 * * 1-5"));
        assertEquals(List.of("0 0 12 1 * ?"), CronSchedule.normalizeCron("0 12 1 * *"));
        assertEquals(List.of("0 0 9 1 * ?", "0 0 9 ? * 2"), CronSchedule.normalizeCron("0 9 1 * 1"));
    }

    @Test
    void blankTimezoneShouldDefaultToUtc() {
        assertEquals(ZoneId.of("UTC"), CronSchedule.resolveZone(null));
        assertEquals(ZoneId.of("UTC"), CronSchedule.resolveZone("  "));
    }

    @Test
    void malformedExpressionsShouldBeRejected() {
        Instant now = Instant.parse("2024-01-01T00:00:00Z");

        assertThrows(SchedulingException.class, () -> CronSchedule.nextOccurrence("not a cron", "UTC", now));
        assertThrows(SchedulingException.class, () -> CronSchedule.nextOccurrence("0 * * *", "UTC", now));
        assertThrows(SchedulingException.class, () -> CronSchedule.nextOccurrence("61 * * * *", "UTC", now));
        assertThrows(SchedulingException.class, () -> CronSchedule.nextOccurrence("0 8 * * 8", "UTC", now));
        assertThrows(SchedulingException.class, () -> CronSchedule.nextOccurrence(null, "UTC", now));
    }

    @Test
    void unknownTimezoneShouldBeRejected() {
        assertThrows(SchedulingException.class,
                () -> CronSchedule.nextOccurrence("0 * * * *", "Mars/Olympus", Instant.now()));
    }

    @Test
    void isValidShouldRecognizeValidSpec() {
        assertTrue(CronSchedule.isValid("*/10 * * * *"));
        assertTrue(CronSchedule.isValid("0 */10 * * * *"));
        assertFalse(CronSchedule.isValid("every ten minutes"));
        assertFalse(CronSchedule.isValid(""));
    }
}
