package br.com.analytics.pipeline.retail_warehouse_batch.model;

import org.jspecify.annotations.Nullable;

/**
 * A customer of the warehouse. Lines without a customer id all share the row whose
 * id is {@link #UNKNOWN_CUSTOMER_ID}; that row has no country.
 */
public record CustomerDimensionRow(
        long customerKey,
        String customerId,
        @Nullable Long countryKey
) {

    public static final String UNKNOWN_CUSTOMER_ID = "GUEST";

    public boolean isUnknown() {
        return UNKNOWN_CUSTOMER_ID.equals(customerId);
    }
}
