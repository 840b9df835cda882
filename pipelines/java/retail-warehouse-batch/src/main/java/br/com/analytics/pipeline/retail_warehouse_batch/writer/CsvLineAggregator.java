package br.com.analytics.pipeline.retail_warehouse_batch.writer;

import org.apache.commons.csv.CSVFormat;
import org.springframework.batch.infrastructure.item.file.transform.LineAggregator;

import java.util.List;

/**
 * Formats one row as an RFC 4180 line; nulls become empty fields.
 */
public class CsvLineAggregator implements LineAggregator<List<?>> {

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT;

    @Override
    public String aggregate(List<?> values) {
        return FORMAT.format(values.toArray());
    }
}
