package br.com.analytics.pipeline.retail_warehouse_batch.dimension;

import br.com.analytics.pipeline.retail_warehouse_batch.model.CountryDimensionRow;
import br.com.analytics.pipeline.retail_warehouse_batch.model.CustomerDimensionRow;
import br.com.analytics.pipeline.retail_warehouse_batch.model.DateDimensionRow;
import br.com.analytics.pipeline.retail_warehouse_batch.model.ProductDimensionRow;
import br.com.analytics.pipeline.retail_warehouse_batch.model.TransactionLine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Derives the date, product, country and customer dimensions from cleaned lines.
 * <ul>
 *   <li>dates get keys in ascending calendar order</li>
 *   <li>products keep the first non-blank description seen for their stock code</li>
 *   <li>customers keep the country of their first line; the unknown customer always exists and has no country</li>
 * </ul>
 * Other keys follow first appearance in the input, so identical input yields identical keys.
 */
public class DimensionBuilder {

    private static final Logger log = LoggerFactory.getLogger(DimensionBuilder.class);

    public StarSchemaDimensions build(List<TransactionLine> lines) {
        SurrogateKeyRegistry<LocalDate> dateKeys = new SurrogateKeyRegistry<>("dim_date");
        List<DateDimensionRow> dates = buildDates(lines, dateKeys);

        SurrogateKeyRegistry<String> productKeys = new SurrogateKeyRegistry<>("dim_product");
        List<ProductDimensionRow> products = buildProducts(lines, productKeys);

        SurrogateKeyRegistry<String> countryKeys = new SurrogateKeyRegistry<>("dim_country");
        List<CountryDimensionRow> countries = buildCountries(lines, countryKeys);

        SurrogateKeyRegistry<String> customerKeys = new SurrogateKeyRegistry<>("dim_customer");
        List<CustomerDimensionRow> customers = buildCustomers(lines, customerKeys, countryKeys);

        log.info("Built dimensions: {} dates, {} products, {} countries, {} customers",
                dates.size(), products.size(), countries.size(), customers.size());

        return new StarSchemaDimensions(
                dates, dateKeys,
                products, productKeys,
                customers, customerKeys,
                countries, countryKeys);
    }

    private List<DateDimensionRow> buildDates(List<TransactionLine> lines, SurrogateKeyRegistry<LocalDate> keys) {
        TreeSet<LocalDate> distinctDates = new TreeSet<>();
        for (TransactionLine line : lines) {
            distinctDates.add(line.invoiceDate());
        }
        List<DateDimensionRow> rows = new ArrayList<>(distinctDates.size());
        for (LocalDate date : distinctDates) {
            rows.add(DateDimensionRow.of(keys.register(date), date));
        }
        return rows;
    }

    private List<ProductDimensionRow> buildProducts(List<TransactionLine> lines, SurrogateKeyRegistry<String> keys) {
        Map<String, String> descriptions = new LinkedHashMap<>();
        for (TransactionLine line : lines) {
            if (!descriptions.containsKey(line.stockCode()) || descriptions.get(line.stockCode()) == null) {
                descriptions.put(line.stockCode(), line.description());
            }
        }
        List<ProductDimensionRow> rows = new ArrayList<>(descriptions.size());
        descriptions.forEach((stockCode, description) ->
                rows.add(new ProductDimensionRow(keys.register(stockCode), stockCode, description)));
        return rows;
    }

    private List<CountryDimensionRow> buildCountries(List<TransactionLine> lines, SurrogateKeyRegistry<String> keys) {
        List<CountryDimensionRow> rows = new ArrayList<>();
        for (TransactionLine line : lines) {
            if (!keys.contains(line.country())) {
                rows.add(new CountryDimensionRow(keys.register(line.country()), line.country()));
            }
        }
        return rows;
    }

    private List<CustomerDimensionRow> buildCustomers(
            List<TransactionLine> lines,
            SurrogateKeyRegistry<String> keys,
            SurrogateKeyRegistry<String> countryKeys) {

        List<CustomerDimensionRow> rows = new ArrayList<>();
        rows.add(new CustomerDimensionRow(keys.register(CustomerDimensionRow.UNKNOWN_CUSTOMER_ID),
                CustomerDimensionRow.UNKNOWN_CUSTOMER_ID, null));

        for (TransactionLine line : lines) {
            String customerId = line.customerId();
            if (customerId != null && !keys.contains(customerId)) {
                rows.add(new CustomerDimensionRow(keys.register(customerId), customerId,
                        countryKeys.resolve(line.country())));
            }
        }
        return rows;
    }
}
