package br.com.analytics.pipeline.retail_warehouse_batch.dimension;

import br.com.analytics.pipeline.retail_warehouse_batch.model.CountryDimensionRow;
import br.com.analytics.pipeline.retail_warehouse_batch.model.CustomerDimensionRow;
import br.com.analytics.pipeline.retail_warehouse_batch.model.DateDimensionRow;
import br.com.analytics.pipeline.retail_warehouse_batch.model.FactSalesRow;
import br.com.analytics.pipeline.retail_warehouse_batch.model.ProductDimensionRow;
import br.com.analytics.pipeline.retail_warehouse_batch.model.StarSchema;
import org.jspecify.annotations.Nullable;

import java.time.LocalDate;
import java.util.List;

/**
 * The four built dimensions together with the key registries used to resolve fact rows.
 */
public class StarSchemaDimensions {

    private final List<DateDimensionRow> dates;
    private final List<ProductDimensionRow> products;
    private final List<CustomerDimensionRow> customers;
    private final List<CountryDimensionRow> countries;

    private final SurrogateKeyRegistry<LocalDate> dateKeys;
    private final SurrogateKeyRegistry<String> productKeys;
    private final SurrogateKeyRegistry<String> customerKeys;
    private final SurrogateKeyRegistry<String> countryKeys;

    StarSchemaDimensions(
            List<DateDimensionRow> dates, SurrogateKeyRegistry<LocalDate> dateKeys,
            List<ProductDimensionRow> products, SurrogateKeyRegistry<String> productKeys,
            List<CustomerDimensionRow> customers, SurrogateKeyRegistry<String> customerKeys,
            List<CountryDimensionRow> countries, SurrogateKeyRegistry<String> countryKeys) {
        this.dates = List.copyOf(dates);
        this.products = List.copyOf(products);
        this.customers = List.copyOf(customers);
        this.countries = List.copyOf(countries);
        this.dateKeys = dateKeys;
        this.productKeys = productKeys;
        this.customerKeys = customerKeys;
        this.countryKeys = countryKeys;
    }

    public long dateKey(LocalDate date) {
        return dateKeys.resolve(date);
    }

    public long productKey(String stockCode) {
        return productKeys.resolve(stockCode);
    }

    /** A missing customer id resolves to the unknown customer row. */
    public long customerKey(@Nullable String customerId) {
        return customerKeys.resolve(customerId == null ? CustomerDimensionRow.UNKNOWN_CUSTOMER_ID : customerId);
    }

    public long countryKey(String country) {
        return countryKeys.resolve(country);
    }

    public StarSchema withFacts(List<FactSalesRow> facts) {
        return new StarSchema(dates, products, customers, countries, facts);
    }

    public List<DateDimensionRow> getDates() {
        return dates;
    }

    public List<ProductDimensionRow> getProducts() {
        return products;
    }

    public List<CustomerDimensionRow> getCustomers() {
        return customers;
    }

    public List<CountryDimensionRow> getCountries() {
        return countries;
    }
}
