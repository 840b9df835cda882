package br.com.analytics.pipeline.retail_warehouse_batch.model;

import org.jspecify.annotations.Nullable;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

public record TransactionLine(
        String invoiceNo,
        String stockCode,
        @Nullable String description,
        int quantity,
        BigDecimal unitPrice,
        LocalDateTime invoiceDateTime,
        @Nullable String customerId,
        String country
) {

    public LocalDate invoiceDate() {
        return invoiceDateTime.toLocalDate();
    }

    public BigDecimal netAmount() {
        return unitPrice.multiply(BigDecimal.valueOf(quantity));
    }

    public boolean isReturn() {
        return quantity < 0;
    }
}
