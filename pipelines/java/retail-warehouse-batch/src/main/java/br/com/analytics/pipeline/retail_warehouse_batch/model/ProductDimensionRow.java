package br.com.analytics.pipeline.retail_warehouse_batch.model;

import org.jspecify.annotations.Nullable;

public record ProductDimensionRow(
        long productKey,
        String stockCode,
        @Nullable String description
) {
}
