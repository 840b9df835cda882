package br.com.analytics.pipeline.retail_warehouse_batch.model;

import java.time.LocalDate;
import java.time.format.TextStyle;
import java.util.Locale;

public record DateDimensionRow(
        long dateKey,
        LocalDate fullDate,
        int year,
        int quarter,
        int month,
        String monthName,
        int day,
        int weekday,
        String weekdayName
) {

    public static DateDimensionRow of(long dateKey, LocalDate date) {
        return new DateDimensionRow(
                dateKey,
                date,
                date.getYear(),
                (date.getMonthValue() - 1) / 3 + 1,
                date.getMonthValue(),
                date.getMonth().getDisplayName(TextStyle.SHORT, Locale.ENGLISH),
                date.getDayOfMonth(),
                date.getDayOfWeek().getValue(),
                date.getDayOfWeek().getDisplayName(TextStyle.FULL, Locale.ENGLISH)
        );
    }
}
