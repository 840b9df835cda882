package br.com.analytics.pipeline.retail_warehouse_batch.writer;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CsvLineAggregator Tests")
class CsvLineAggregatorTest {

    private final CsvLineAggregator aggregator = new CsvLineAggregator();

    @Test
    @DisplayName("Should join plain values unquoted and nulls as empty fields")
    void testPlainValues() {
        assertEquals("1,85048,,-15.0", aggregator.aggregate(Arrays.asList(1, "85048", null, -15.0)));
    }

    @Test
    @DisplayName("Should quote values with separators and double inner quotes")
    void testQuotedValues() {
        assertEquals("\"CAT BOWL , SMALL\",\"12\"\" RULER\",\"two\nlines\"",
                aggregator.aggregate(Arrays.asList("CAT BOWL , SMALL", "12\" RULER", "two\nlines")));
    }
}
