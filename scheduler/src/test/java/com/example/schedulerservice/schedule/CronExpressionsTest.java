package com.example.schedulerservice.schedule;

import com.cronutils.model.time.ExecutionTime;
import com.example.schedulerservice.jobs.InvalidScheduleException;
import org.junit.Test;

import java.time.ZoneOffset;
import java.time.ZonedDateTime;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

public class CronExpressionsTest {

    @Test
    public void five_field_expressions_parse() {
        ExecutionTime daily = CronExpressions.parse("0 0 * * *");
        ZonedDateTime from = ZonedDateTime.of(2024, 3, 10, 15, 30, 0, 0, ZoneOffset.UTC);
        assertThat(daily.nextExecution(from).get(), is(ZonedDateTime.of(2024, 3, 11, 0, 0, 0, 0, ZoneOffset.UTC)));

        ExecutionTime every5 = CronExpressions.parse(" */5 * * * * ");
        assertThat(every5.nextExecution(from).get().getMinute(), is(35));
    }

    @Test
    public void nickname_descriptors_parse() {
        ZonedDateTime from = ZonedDateTime.of(2024, 3, 10, 15, 30, 0, 0, ZoneOffset.UTC);
        assertThat(CronExpressions.parse("@daily").nextExecution(from).get(),
                is(ZonedDateTime.of(2024, 3, 11, 0, 0, 0, 0, ZoneOffset.UTC)));
        assertThat(CronExpressions.parse("@midnight").nextExecution(from).get(),
                is(ZonedDateTime.of(2024, 3, 11, 0, 0, 0, 0, ZoneOffset.UTC)));
        assertThat(CronExpressions.parse("@hourly").nextExecution(from).get(),
                is(ZonedDateTime.of(2024, 3, 10, 16, 0, 0, 0, ZoneOffset.UTC)));
        assertThat(CronExpressions.parse("@monthly").nextExecution(from).get(),
                is(ZonedDateTime.of(2024, 4, 1, 0, 0, 0, 0, ZoneOffset.UTC)));
        assertThat(CronExpressions.parse("@yearly").nextExecution(from).get(),
                is(ZonedDateTime.of(2025, 1, 1, 0, 0, 0, 0, ZoneOffset.UTC)));
        assertThat(CronExpressions.parse("@annually").nextExecution(from).get(),
                is(ZonedDateTime.of(2025, 1, 1, 0, 0, 0, 0, ZoneOffset.UTC)));
        assertThat(CronExpressions.parse("@weekly").nextExecution(from).isPresent(), is(true));
        assertThrows(InvalidScheduleException.class, () -> CronExpressions.parse("@fortnightly"));
    }

    @Test
    public void malformed_expressions_are_invalid_schedules() {
        for (String bad : new String[] {"not-a-cron", "60 * * * *", "* * * * * *", "", "   "}) {
            InvalidScheduleException e = assertThrows(InvalidScheduleException.class, () -> CronExpressions.parse(bad));
            assertThat(e.getErrorCode(), is("invalid_schedule"));
        }
        assertThrows(InvalidScheduleException.class, () -> CronExpressions.parse(null));
    }
}
