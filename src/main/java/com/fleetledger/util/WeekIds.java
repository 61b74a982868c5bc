package com.fleetledger.util;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Helpers for week ids of the form {@code YYYY-WW} (ISO week-based year and week number).
 */
public final class WeekIds {

    public static final String PATTERN = "\\d{4}-\\d{1,2}";

    private static final Pattern WEEK_ID = Pattern.compile("(\\d{4})-(\\d{1,2})");

    private WeekIds() {}

    public static boolean isValid(String weekId) {
        if (weekId == null) return false;
        Matcher m = WEEK_ID.matcher(weekId.trim());
        if (!m.matches()) return false;
        int week = Integer.parseInt(m.group(2));
        return week >= 1 && week <= 53;
    }

    public static int year(String weekId) {
        return Integer.parseInt(parse(weekId).group(1));
    }

    public static int week(String weekId) {
        return Integer.parseInt(parse(weekId).group(2));
    }

    /** Week number zero-padded to two digits, as printed on invoices. */
    public static String paddedWeek(String weekId) {
        return String.format("%02d", week(weekId));
    }

    private static Matcher parse(String weekId) {
        if (!isValid(weekId)) {
            throw new IllegalArgumentException("Invalid week id (expected YYYY-WW): " + weekId);
        }
        Matcher m = WEEK_ID.matcher(weekId.trim());
        m.matches();
        return m;
    }
}
