package br.com.analytics.pipeline.retail_warehouse_batch.model;

/**
 * One line of the source extract, exactly as read. No field is validated or coerced yet.
 */
public record RawTransactionLine(
        String invoice,
        String stockCode,
        String description,
        String quantity,
        String invoiceDate,
        String price,
        String customerId,
        String country
) {
}
