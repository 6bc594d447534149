package com.NutriCare.diet_backend.util;

import java.time.LocalDate;
import java.time.LocalDateTime;

public class DateUtil {

    private DateUtil() {
        // Utility class, no instantiation
    }

    public static LocalDateTime getStartOfDay(LocalDate date) {
        return date.atStartOfDay();
    }

    // Exclusive upper bound, so the last instant of the day is still included.
    public static LocalDateTime getStartOfNextDay(LocalDate date) {
        return date.plusDays(1).atStartOfDay();
    }
}
