package br.com.analytics.pipeline.retail_warehouse_batch.processor;

import br.com.analytics.pipeline.retail_warehouse_batch.model.RawTransactionLine;
import br.com.analytics.pipeline.retail_warehouse_batch.model.TransactionLine;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.batch.infrastructure.item.ItemProcessor;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Turns raw extract lines into typed transaction lines. A line that cannot be cleaned is
 * filtered out and counted in the {@link CleaningReport}; it never fails the step.
 * <p>
 * Duplicates are detected on the whole cleaned line, so two lines that differ only in
 * formatting ({@code 13085.0} vs {@code 13085}) count as the same line.
 */
public class TransactionCleaningProcessor implements ItemProcessor<RawTransactionLine, TransactionLine> {

    private static final Logger log = LoggerFactory.getLogger(TransactionCleaningProcessor.class);

    static final String UNSPECIFIED_COUNTRY = "Unspecified";

    private static final Set<String> MISSING_MARKERS = Set.of("nan", "none", "null", "<na>");

    private final CleaningReport report;
    private final Set<TransactionLine> acceptedLines = new HashSet<>();

    public TransactionCleaningProcessor(CleaningReport report) {
        this.report = report;
    }

    @Override
    public @Nullable TransactionLine process(RawTransactionLine item) {
        report.lineRead();

        TransactionLine cleaned;
        try {
            cleaned = clean(item);
        } catch (LineRejectedException e) {
            return drop(item, e.reason);
        }

        if (!acceptedLines.add(cleaned)) {
            return drop(item, DropReason.DUPLICATE);
        }
        report.lineAccepted();
        return cleaned;
    }

    private @Nullable TransactionLine drop(RawTransactionLine item, DropReason reason) {
        report.lineDropped(reason);
        log.debug("Dropping line {}: {}", reason, item);
        return null;
    }

    private TransactionLine clean(RawTransactionLine item) throws LineRejectedException {
        String invoice = trimToNull(item.invoice());
        if (invoice == null) {
            throw new LineRejectedException(DropReason.MISSING_INVOICE);
        }
        String stockCode = trimToNull(item.stockCode());
        if (stockCode == null) {
            throw new LineRejectedException(DropReason.MISSING_PRODUCT_CODE);
        }

        int quantity = parseQuantity(item.quantity());
        BigDecimal unitPrice = parsePrice(item.price());
        LocalDateTime invoiceDateTime = InvoiceTimestampParser.parse(item.invoiceDate())
                .orElseThrow(() -> new LineRejectedException(DropReason.INVALID_TIMESTAMP));

        String country = trimToNull(item.country());

        return new TransactionLine(
                invoice,
                stockCode,
                trimToNull(item.description()),
                quantity,
                unitPrice,
                invoiceDateTime,
                normalizeCustomerId(item.customerId()),
                country == null ? UNSPECIFIED_COUNTRY : country
        );
    }

    private static int parseQuantity(String value) throws LineRejectedException {
        String trimmed = trimToNull(value);
        if (trimmed == null) {
            throw new LineRejectedException(DropReason.MISSING_QUANTITY);
        }
        int quantity;
        try {
            quantity = new BigDecimal(trimmed).intValueExact();
        } catch (NumberFormatException | ArithmeticException e) {
            throw new LineRejectedException(DropReason.INVALID_QUANTITY);
        }
        if (quantity == 0) {
            throw new LineRejectedException(DropReason.ZERO_QUANTITY);
        }
        return quantity;
    }

    private static BigDecimal parsePrice(String value) throws LineRejectedException {
        String trimmed = trimToNull(value);
        if (trimmed == null) {
            throw new LineRejectedException(DropReason.INVALID_PRICE);
        }
        BigDecimal price;
        try {
            price = new BigDecimal(trimmed);
        } catch (NumberFormatException e) {
            throw new LineRejectedException(DropReason.INVALID_PRICE);
        }
        if (price.signum() <= 0) {
            throw new LineRejectedException(DropReason.NON_POSITIVE_PRICE);
        }
        // at least cents, so 5, 5.0 and 5.00 compare equal as record components
        int scale = Math.max(2, price.stripTrailingZeros().scale());
        return price.setScale(scale);
    }

    /**
     * Numeric ids lose any fractional zeros ({@code 12345.0} becomes {@code 12345}); anything
     * else, blank or non-numeric, is an unknown customer.
     */
    static @Nullable String normalizeCustomerId(String value) {
        String trimmed = trimToNull(value);
        if (trimmed == null || MISSING_MARKERS.contains(trimmed.toLowerCase(Locale.ROOT))) {
            return null;
        }
        try {
            return new BigDecimal(trimmed).toBigIntegerExact().toString();
        } catch (NumberFormatException | ArithmeticException e) {
            return null;
        }
    }

    private static @Nullable String trimToNull(@Nullable String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    private static final class LineRejectedException extends Exception {

        private final DropReason reason;

        LineRejectedException(DropReason reason) {
            super(reason.name(), null, false, false);
            this.reason = reason;
        }
    }
}
