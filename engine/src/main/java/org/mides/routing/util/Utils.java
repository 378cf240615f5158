package org.mides.routing.util;

import java.time.Duration;

public class Utils {

    public static double round3(double value) {
        /* Reported totals keep metre / sub-second precision */
        return Math.round(value * 1000.0) / 1000.0;
    }

    public static Duration minutesToDuration(double minutes) {
        return Duration.ofMillis(Math.round(minutes * 60_000.0));
    }
}
