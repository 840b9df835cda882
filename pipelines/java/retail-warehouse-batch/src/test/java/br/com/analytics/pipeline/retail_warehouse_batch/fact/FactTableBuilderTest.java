package br.com.analytics.pipeline.retail_warehouse_batch.fact;

import br.com.analytics.pipeline.retail_warehouse_batch.dimension.DimensionBuilder;
import br.com.analytics.pipeline.retail_warehouse_batch.dimension.StarSchemaDimensions;
import br.com.analytics.pipeline.retail_warehouse_batch.exception.DimensionLookupException;
import br.com.analytics.pipeline.retail_warehouse_batch.model.CountryDimensionRow;
import br.com.analytics.pipeline.retail_warehouse_batch.model.CustomerDimensionRow;
import br.com.analytics.pipeline.retail_warehouse_batch.model.DateDimensionRow;
import br.com.analytics.pipeline.retail_warehouse_batch.model.FactSalesRow;
import br.com.analytics.pipeline.retail_warehouse_batch.model.ProductDimensionRow;
import br.com.analytics.pipeline.retail_warehouse_batch.model.TransactionLine;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("FactTableBuilder Tests")
class FactTableBuilderTest {

    private final DimensionBuilder dimensionBuilder = new DimensionBuilder();
    private final FactTableBuilder factTableBuilder = new FactTableBuilder();

    private static TransactionLine line(String stockCode, int quantity, String price, String customerId, String country) {
        return new TransactionLine("C489449", stockCode, "ITEM " + stockCode, quantity, new BigDecimal(price),
                LocalDateTime.of(2009, 12, 1, 10, 33), customerId, country);
    }

    private static final List<TransactionLine> LINES = List.of(
            line("22087", -12, "2.95", "16321", "Australia"),
            line("85206A", 6, "1.65", null, "Australia"),
            line("85048", -3, "5.00", "13085", "United Kingdom")
    );

    @Test
    @DisplayName("Should emit one fact per line with resolvable keys")
    void testReferentialIntegrity() {
        StarSchemaDimensions dimensions = dimensionBuilder.build(LINES);
        List<FactSalesRow> facts = factTableBuilder.build(LINES, dimensions);

        assertEquals(LINES.size(), facts.size());

        Set<Long> dateKeys = dimensions.getDates().stream().map(DateDimensionRow::dateKey).collect(Collectors.toSet());
        Set<Long> productKeys = dimensions.getProducts().stream().map(ProductDimensionRow::productKey).collect(Collectors.toSet());
        Set<Long> customerKeys = dimensions.getCustomers().stream().map(CustomerDimensionRow::customerKey).collect(Collectors.toSet());
        Set<Long> countryKeys = dimensions.getCountries().stream().map(CountryDimensionRow::countryKey).collect(Collectors.toSet());

        for (FactSalesRow fact : facts) {
            assertTrue(dateKeys.contains(fact.dateKey()));
            assertTrue(productKeys.contains(fact.productKey()));
            assertTrue(customerKeys.contains(fact.customerKey()));
            assertTrue(countryKeys.contains(fact.countryKey()));
        }
        assertEquals(facts.size(), facts.stream().map(FactSalesRow::salesKey).distinct().count());
    }

    @Test
    @DisplayName("Should carry measures and the return flag")
    void testMeasures() {
        List<FactSalesRow> facts = factTableBuilder.build(LINES, dimensionBuilder.build(LINES));

        FactSalesRow returned = facts.get(2);
        assertEquals(-3, returned.quantity());
        assertEquals(new BigDecimal("5.00"), returned.unitPrice());
        assertEquals(0, new BigDecimal("-15.00").compareTo(returned.netAmount()));
        assertTrue(returned.isReturn());
        assertFalse(facts.get(1).isReturn());
    }

    @Test
    @DisplayName("Should point lines without customer at the unknown customer")
    void testUnknownCustomer() {
        StarSchemaDimensions dimensions = dimensionBuilder.build(LINES);
        List<FactSalesRow> facts = factTableBuilder.build(LINES, dimensions);

        long unknownKey = dimensions.getCustomers().stream()
                .filter(CustomerDimensionRow::isUnknown).findFirst().orElseThrow().customerKey();
        assertEquals(unknownKey, facts.get(1).customerKey());
    }

    @Test
    @DisplayName("Should fail when a line has no dimension row")
    void testLookupFailure() {
        StarSchemaDimensions dimensions = dimensionBuilder.build(LINES.subList(0, 2));

        DimensionLookupException e = assertThrows(DimensionLookupException.class,
                () -> factTableBuilder.build(LINES, dimensions));
        assertEquals("dim_product", e.getDimension());
    }
}
