package dev.mars.autoflow.workflow.schedule;

/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.BitSet;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Standard five-field cron expression: minute, hour, day of month, month, day of week.
 *
 * <p>Fields accept {@code *}, single values, ranges {@code a-b}, steps {@code * /n}
 * and {@code a-b/n}, and comma-separated lists. Months and weekdays accept three-letter
 * names; weekday 0 and 7 are both Sunday. When both day fields are restricted a day
 * matches if either does.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-10
 * @version 1.0
 */
public final class CronExpression {

    private static final Map<String, Integer> MONTH_NAMES = Map.ofEntries(
            Map.entry("JAN", 1), Map.entry("FEB", 2), Map.entry("MAR", 3), Map.entry("APR", 4),
            Map.entry("MAY", 5), Map.entry("JUN", 6), Map.entry("JUL", 7), Map.entry("AUG", 8),
            Map.entry("SEP", 9), Map.entry("OCT", 10), Map.entry("NOV", 11), Map.entry("DEC", 12));

    private static final Map<String, Integer> DAY_NAMES = Map.of(
            "SUN", 0, "MON", 1, "TUE", 2, "WED", 3, "THU", 4, "FRI", 5, "SAT", 6);

    // Upper bound on the search so an impossible date such as 30 February terminates
    private static final int MAX_SEARCH_YEARS = 5;

    private final String expression;
    private final BitSet minutes;
    private final BitSet hours;
    private final BitSet daysOfMonth;
    private final BitSet months;
    private final BitSet daysOfWeek;
    private final boolean dayOfMonthRestricted;
    private final boolean dayOfWeekRestricted;

    private CronExpression(String expression, String[] fields) {
        this.expression = expression;
        this.minutes = parseField(fields[0], 0, 59, Map.of(), "minute");
        this.hours = parseField(fields[1], 0, 23, Map.of(), "hour");
        this.daysOfMonth = parseField(fields[2], 1, 31, Map.of(), "day of month");
        this.months = parseField(fields[3], 1, 12, MONTH_NAMES, "month");
        BitSet weekdays = parseField(fields[4], 0, 7, DAY_NAMES, "day of week");
        if (weekdays.get(7)) {
            weekdays.set(0);
            weekdays.clear(7);
        }
        this.daysOfWeek = weekdays;
        this.dayOfMonthRestricted = !fields[2].equals("*") && !fields[2].equals("?");
        this.dayOfWeekRestricted = !fields[4].equals("*") && !fields[4].equals("?");
    }

    /**
     * @throws IllegalArgumentException if the expression is malformed
     */
    public static CronExpression parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new IllegalArgumentException("Cron expression cannot be blank");
        }
        String[] fields = expression.trim().split("\\s+");
        if (fields.length != 5) {
            throw new IllegalArgumentException("Cron expression must have 5 fields, found " + fields.length
                    + ": '" + expression + "'");
        }
        return new CronExpression(expression.trim(), fields);
    }

    public static boolean isValid(String expression) {
        try {
            parse(expression);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    /**
     * The first matching minute strictly after {@code after}, in the same zone.
     */
    public Optional<ZonedDateTime> next(ZonedDateTime after) {
        ZonedDateTime candidate = after.truncatedTo(ChronoUnit.MINUTES).plusMinutes(1);
        ZonedDateTime limit = after.plusYears(MAX_SEARCH_YEARS);
        while (candidate.isBefore(limit)) {
            if (!months.get(candidate.getMonthValue())) {
                candidate = candidate.withDayOfMonth(1).truncatedTo(ChronoUnit.DAYS).plusMonths(1);
                continue;
            }
            if (!dayMatches(candidate)) {
                candidate = candidate.truncatedTo(ChronoUnit.DAYS).plusDays(1);
                continue;
            }
            if (!hours.get(candidate.getHour())) {
                candidate = candidate.truncatedTo(ChronoUnit.HOURS).plusHours(1);
                continue;
            }
            if (!minutes.get(candidate.getMinute())) {
                candidate = candidate.plusMinutes(1);
                continue;
            }
            return Optional.of(candidate);
        }
        return Optional.empty();
    }

    private boolean dayMatches(ZonedDateTime candidate) {
        boolean domMatch = daysOfMonth.get(candidate.getDayOfMonth());
        boolean dowMatch = daysOfWeek.get(candidate.getDayOfWeek().getValue() % 7);
        if (dayOfMonthRestricted && dayOfWeekRestricted) {
            return domMatch || dowMatch;
        }
        return domMatch && dowMatch;
    }

    private static BitSet parseField(String field, int min, int max, Map<String, Integer> names, String label) {
        BitSet bits = new BitSet(max + 1);
        for (String part : field.split(",")) {
            String range = part;
            int step = 1;
            int slash = part.indexOf('/');
            if (slash >= 0) {
                range = part.substring(0, slash);
                step = parseNumber(part.substring(slash + 1), Map.of(), label);
                if (step <= 0) {
                    throw new IllegalArgumentException("Step must be positive in " + label + " field: '" + field + "'");
                }
            }
            int start;
            int end;
            if (range.equals("*") || range.equals("?")) {
                start = min;
                end = max;
            } else if (range.contains("-")) {
                String[] bounds = range.split("-", 2);
                start = parseNumber(bounds[0], names, label);
                end = parseNumber(bounds[1], names, label);
            } else {
                start = parseNumber(range, names, label);
                end = slash >= 0 ? max : start;
            }
            if (start < min || end > max || start > end) {
                throw new IllegalArgumentException(String.format("Value out of range [%d-%d] in %s field: '%s'",
                        min, max, label, field));
            }
            for (int value = start; value <= end; value += step) {
                bits.set(value);
            }
        }
        return bits;
    }

    private static int parseNumber(String text, Map<String, Integer> names, String label) {
        Integer named = names.get(text.toUpperCase(Locale.ROOT));
        if (named != null) {
            return named;
        }
        try {
            return Integer.parseInt(text);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + label + " value '" + text + "'", e);
        }
    }

    @Override
    public String toString() {
        return expression;
    }
}
