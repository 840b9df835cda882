package br.com.analytics.pipeline.retail_warehouse_batch.fact;

import br.com.analytics.pipeline.retail_warehouse_batch.dimension.StarSchemaDimensions;
import br.com.analytics.pipeline.retail_warehouse_batch.model.FactSalesRow;
import br.com.analytics.pipeline.retail_warehouse_batch.model.TransactionLine;

import java.util.ArrayList;
import java.util.List;

/**
 * Emits one {@code fact_sales} row per cleaned line. Any key that does not resolve
 * throws {@link br.com.analytics.pipeline.retail_warehouse_batch.exception.DimensionLookupException}
 * and no fact table is produced.
 */
public class FactTableBuilder {

    public List<FactSalesRow> build(List<TransactionLine> lines, StarSchemaDimensions dimensions) {
        List<FactSalesRow> facts = new ArrayList<>(lines.size());
        long salesKey = 1;
        for (TransactionLine line : lines) {
            facts.add(new FactSalesRow(
                    salesKey++,
                    line.invoiceNo(),
                    line.invoiceDateTime(),
                    dimensions.dateKey(line.invoiceDate()),
                    dimensions.productKey(line.stockCode()),
                    dimensions.customerKey(line.customerId()),
                    dimensions.countryKey(line.country()),
                    line.quantity(),
                    line.unitPrice(),
                    line.netAmount(),
                    line.isReturn()
            ));
        }
        return facts;
    }
}
