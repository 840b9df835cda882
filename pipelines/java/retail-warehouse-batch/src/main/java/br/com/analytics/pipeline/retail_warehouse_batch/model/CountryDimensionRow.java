package br.com.analytics.pipeline.retail_warehouse_batch.model;

public record CountryDimensionRow(
        long countryKey,
        String country
) {
}
