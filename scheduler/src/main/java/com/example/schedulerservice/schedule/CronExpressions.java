package com.example.schedulerservice.schedule;

import com.cronutils.model.Cron;
import com.cronutils.model.definition.CronDefinition;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.model.time.ExecutionTime;
import com.cronutils.parser.CronParser;
import com.example.schedulerservice.jobs.InvalidScheduleException;

/**
 * Standard 5-field UNIX cron (minute hour day-of-month month day-of-week), plus
 * the {@code @yearly}, {@code @annually}, {@code @monthly}, {@code @weekly},
 * {@code @daily}, {@code @midnight} and {@code @hourly} descriptors.
 */
public final class CronExpressions {
    private static final CronDefinition DEFINITION = CronDefinitionBuilder.defineCron()
            .withMinutes().withValidRange(0, 59).withStrictRange().and()
            .withHours().withValidRange(0, 23).withStrictRange().and()
            .withDayOfMonth().withValidRange(1, 31).withStrictRange().and()
            .withMonth().withValidRange(1, 12).withStrictRange().and()
            .withDayOfWeek().withValidRange(0, 7).withMondayDoWValue(1).withIntMapping(7, 0).withStrictRange().and()
            .withSupportedNicknameYearly()
            .withSupportedNicknameAnnually()
            .withSupportedNicknameMonthly()
            .withSupportedNicknameWeekly()
            .withSupportedNicknameDaily()
            .withSupportedNicknameMidnight()
            .withSupportedNicknameHourly()
            .matchDayOfWeekAndDayOfMonth()
            .instance();
    private static final CronParser PARSER = new CronParser(DEFINITION);

    private CronExpressions() {
    }

    public static ExecutionTime parse(String expression) {
        String expr = expression == null ? "" : expression.trim();
        if (expr.isEmpty()) {
            throw new InvalidScheduleException(String.valueOf(expression),
                    new IllegalArgumentException("cron expression is required"));
        }
        Cron cron;
        try {
            cron = PARSER.parse(expr);
            cron.validate();
        } catch (IllegalArgumentException e) {
            throw new InvalidScheduleException(expr, e);
        }
        return ExecutionTime.forCron(cron);
    }
}
