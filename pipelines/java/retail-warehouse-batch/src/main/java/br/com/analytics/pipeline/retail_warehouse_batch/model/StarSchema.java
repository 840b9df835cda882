package br.com.analytics.pipeline.retail_warehouse_batch.model;

import java.util.List;

/**
 * The complete content of the warehouse for one run: four dimensions and the fact table.
 */
public record StarSchema(
        List<DateDimensionRow> dates,
        List<ProductDimensionRow> products,
        List<CustomerDimensionRow> customers,
        List<CountryDimensionRow> countries,
        List<FactSalesRow> facts
) {

    public StarSchema {
        dates = List.copyOf(dates);
        products = List.copyOf(products);
        customers = List.copyOf(customers);
        countries = List.copyOf(countries);
        facts = List.copyOf(facts);
    }
}
