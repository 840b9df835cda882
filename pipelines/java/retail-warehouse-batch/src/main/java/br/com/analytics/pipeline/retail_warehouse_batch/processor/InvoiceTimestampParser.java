package br.com.analytics.pipeline.retail_warehouse_batch.processor;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.List;
import java.util.Optional;

/**
 * Parses invoice timestamps in the layouts the retail extracts have been published with.
 */
public final class InvoiceTimestampParser {

    private static final List<DateTimeFormatter> FORMATS = List.of(
            strict("uuuu-MM-dd HH:mm:ss"),
            strict("uuuu-MM-dd HH:mm"),
            DateTimeFormatter.ISO_LOCAL_DATE_TIME,
            strict("M/d/uuuu H:mm"),
            strict("M/d/uuuu H:mm:ss")
    );

    private InvoiceTimestampParser() {
    }

    public static Optional<LocalDateTime> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String trimmed = value.trim();
        for (DateTimeFormatter format : FORMATS) {
            try {
                return Optional.of(LocalDateTime.parse(trimmed, format));
            } catch (DateTimeParseException ignored) {
                // next layout
            }
        }
        return Optional.empty();
    }

    private static DateTimeFormatter strict(String pattern) {
        return DateTimeFormatter.ofPattern(pattern).withResolverStyle(ResolverStyle.STRICT);
    }
}
