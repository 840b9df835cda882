package br.com.analytics.pipeline.retail_warehouse_batch.processor;

public enum DropReason {
    MALFORMED_LINE,
    MISSING_INVOICE,
    MISSING_PRODUCT_CODE,
    MISSING_QUANTITY,
    INVALID_QUANTITY,
    ZERO_QUANTITY,
    INVALID_PRICE,
    NON_POSITIVE_PRICE,
    INVALID_TIMESTAMP,
    DUPLICATE
}
