package br.com.analytics.pipeline.retail_warehouse_batch.model;

import java.math.BigDecimal;
import java.time.LocalDateTime;

public record FactSalesRow(
        long salesKey,
        String invoiceNo,
        LocalDateTime invoiceDateTime,
        long dateKey,
        long productKey,
        long customerKey,
        long countryKey,
        int quantity,
        BigDecimal unitPrice,
        BigDecimal netAmount,
        boolean isReturn
) {
}
