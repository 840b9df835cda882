package br.com.analytics.pipeline.retail_warehouse_batch.dimension;

import br.com.analytics.pipeline.retail_warehouse_batch.exception.DimensionLookupException;
import br.com.analytics.pipeline.retail_warehouse_batch.model.CustomerDimensionRow;
import br.com.analytics.pipeline.retail_warehouse_batch.model.DateDimensionRow;
import br.com.analytics.pipeline.retail_warehouse_batch.model.ProductDimensionRow;
import br.com.analytics.pipeline.retail_warehouse_batch.model.TransactionLine;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DimensionBuilder Tests")
class DimensionBuilderTest {

    private final DimensionBuilder builder = new DimensionBuilder();

    static TransactionLine line(String stockCode, String description, String timestamp, String customerId, String country) {
        return new TransactionLine("489434", stockCode, description, 1, new BigDecimal("1.00"),
                LocalDateTime.parse(timestamp), customerId, country);
    }

    private static final List<TransactionLine> LINES = List.of(
            line("85048", null, "2009-12-02T10:00:00", "13085", "United Kingdom"),
            line("85048", "GLASS BALL", "2009-12-01T09:00:00", "13085", "France"),
            line("85048", "GLASS BALL RENAMED", "2009-12-01T11:00:00", null, "France"),
            line("22350", "CAT BOWL", "2009-12-02T12:00:00", null, "Australia"),
            line("22350", "CAT BOWL", "2009-12-02T12:30:00", "16321", "Australia")
    );

    @Test
    @DisplayName("Should build one row per distinct natural key")
    void testDistinctNaturalKeys() {
        StarSchemaDimensions dimensions = builder.build(LINES);

        assertEquals(2, dimensions.getDates().size());
        assertEquals(2, dimensions.getProducts().size());
        assertEquals(3, dimensions.getCountries().size());
        assertEquals(3, dimensions.getCustomers().size());

        Set<Long> productKeys = dimensions.getProducts().stream()
                .map(ProductDimensionRow::productKey).collect(Collectors.toSet());
        assertEquals(2, productKeys.size());
    }

    @Test
    @DisplayName("Should map all missing customer ids to the single unknown customer")
    void testUnknownCustomer() {
        StarSchemaDimensions dimensions = builder.build(LINES);

        List<CustomerDimensionRow> unknown = dimensions.getCustomers().stream()
                .filter(CustomerDimensionRow::isUnknown)
                .collect(Collectors.toList());
        assertEquals(1, unknown.size());
        assertNull(unknown.get(0).countryKey());
        assertEquals(unknown.get(0).customerKey(), dimensions.customerKey(null));
    }

    @Test
    @DisplayName("Should create the unknown customer even when every line has a customer")
    void testUnknownCustomerAlwaysPresent() {
        StarSchemaDimensions dimensions = builder.build(List.of(
                line("85048", "GLASS BALL", "2009-12-01T09:00:00", "13085", "France")));

        assertTrue(dimensions.getCustomers().stream().anyMatch(CustomerDimensionRow::isUnknown));
    }

    @Test
    @DisplayName("Should keep the first non-blank description of a product")
    void testProductDescription() {
        StarSchemaDimensions dimensions = builder.build(LINES);

        ProductDimensionRow glassBall = dimensions.getProducts().stream()
                .filter(p -> p.stockCode().equals("85048")).findFirst().orElseThrow();
        assertEquals("GLASS BALL", glassBall.description());
    }

    @Test
    @DisplayName("Should give a customer the country of its first line")
    void testCustomerCountry() {
        StarSchemaDimensions dimensions = builder.build(LINES);

        CustomerDimensionRow customer = dimensions.getCustomers().stream()
                .filter(c -> c.customerId().equals("13085")).findFirst().orElseThrow();
        assertEquals(dimensions.countryKey("United Kingdom"), customer.countryKey());
    }

    @Test
    @DisplayName("Should describe dates in calendar order")
    void testDateAttributes() {
        StarSchemaDimensions dimensions = builder.build(LINES);

        DateDimensionRow first = dimensions.getDates().get(0);
        assertEquals(LocalDate.of(2009, 12, 1), first.fullDate());
        assertEquals(2009, first.year());
        assertEquals(4, first.quarter());
        assertEquals(12, first.month());
        assertEquals("Dec", first.monthName());
        assertEquals(1, first.day());
        assertEquals(2, first.weekday());
        assertEquals("Tuesday", first.weekdayName());
        assertTrue(first.dateKey() < dimensions.getDates().get(1).dateKey());
    }

    @Test
    @DisplayName("Should assign the same keys to the same input")
    void testDeterministicKeys() {
        StarSchemaDimensions first = builder.build(LINES);
        StarSchemaDimensions second = builder.build(LINES);

        assertEquals(first.getDates(), second.getDates());
        assertEquals(first.getProducts(), second.getProducts());
        assertEquals(first.getCountries(), second.getCountries());
        assertEquals(first.getCustomers(), second.getCustomers());
    }

    @Test
    @DisplayName("Should refuse to resolve a key it never built")
    void testUnknownNaturalKey() {
        StarSchemaDimensions dimensions = builder.build(LINES);

        DimensionLookupException e = assertThrows(DimensionLookupException.class,
                () -> dimensions.countryKey("Atlantis"));
        assertEquals("dim_country", e.getDimension());
        assertEquals("Atlantis", e.getNaturalKey());
    }
}
