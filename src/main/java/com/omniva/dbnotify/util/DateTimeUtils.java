package com.omniva.dbnotify.util;

import java.time.Duration;

public final class DateTimeUtils {

    private DateTimeUtils() {
    }

    /**
     * Format duration for display, e.g. {@code 1h 2m 3s}
     */
    public static String formatDuration(Duration duration) {
        if (duration == null || duration.isZero() || duration.isNegative()) return "0s";

        long seconds = duration.getSeconds();
        if (seconds < 60) {
            return seconds + "s";
        } else if (seconds < 3600) {
            return (seconds / 60) + "m " + (seconds % 60) + "s";
        } else if (seconds < 86400) {
            long hours = seconds / 3600;
            long minutes = (seconds % 3600) / 60;
            long secs = seconds % 60;
            return hours + "h " + minutes + "m " + secs + "s";
        } else {
            long days = seconds / 86400;
            long hours = (seconds % 86400) / 3600;
            long minutes = (seconds % 3600) / 60;
            return days + "d " + hours + "h " + minutes + "m";
        }
    }
}
