package br.com.analytics.pipeline.retail_warehouse_batch.tasklet;

import br.com.analytics.pipeline.retail_warehouse_batch.dimension.DimensionBuilder;
import br.com.analytics.pipeline.retail_warehouse_batch.dimension.StarSchemaDimensions;
import br.com.analytics.pipeline.retail_warehouse_batch.exception.WarehouseVerificationException;
import br.com.analytics.pipeline.retail_warehouse_batch.fact.FactTableBuilder;
import br.com.analytics.pipeline.retail_warehouse_batch.model.FactSalesRow;
import br.com.analytics.pipeline.retail_warehouse_batch.model.SalesMetrics;
import br.com.analytics.pipeline.retail_warehouse_batch.model.TransactionLine;
import br.com.analytics.pipeline.retail_warehouse_batch.processor.CleaningReport;
import br.com.analytics.pipeline.retail_warehouse_batch.warehouse.SalesMetricsQuery;
import br.com.analytics.pipeline.retail_warehouse_batch.warehouse.WarehouseWriter;
import br.com.analytics.pipeline.retail_warehouse_batch.writer.StagedTransactions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.batch.core.scope.context.ChunkContext;
import org.springframework.batch.core.step.StepContribution;
import org.springframework.batch.core.step.tasklet.Tasklet;
import org.springframework.batch.infrastructure.item.ExecutionContext;
import org.springframework.batch.infrastructure.repeat.RepeatStatus;

import java.util.List;

/**
 * Builds dimensions and facts from the staged lines, replaces the warehouse and checks
 * the loaded tables before the step transaction commits.
 */
public class StarSchemaLoadTasklet implements Tasklet {

    private static final Logger log = LoggerFactory.getLogger(StarSchemaLoadTasklet.class);

    public static final String CONTEXT_FACT_ROWS = "warehouse.factRows";
    public static final String CONTEXT_RETURN_ROWS = "warehouse.returnRows";
    public static final String CONTEXT_TOTAL_NET_SALES = "warehouse.totalNetSales";
    public static final String CONTEXT_RETURN_RATE = "warehouse.returnRate";
    public static final String CONTEXT_LINES_DROPPED = "cleaning.linesDropped";

    private final StagedTransactions stagedTransactions;
    private final CleaningReport cleaningReport;
    private final DimensionBuilder dimensionBuilder;
    private final FactTableBuilder factTableBuilder;
    private final WarehouseWriter warehouseWriter;
    private final SalesMetricsQuery salesMetricsQuery;

    public StarSchemaLoadTasklet(
            StagedTransactions stagedTransactions,
            CleaningReport cleaningReport,
            DimensionBuilder dimensionBuilder,
            FactTableBuilder factTableBuilder,
            WarehouseWriter warehouseWriter,
            SalesMetricsQuery salesMetricsQuery) {
        this.stagedTransactions = stagedTransactions;
        this.cleaningReport = cleaningReport;
        this.dimensionBuilder = dimensionBuilder;
        this.factTableBuilder = factTableBuilder;
        this.warehouseWriter = warehouseWriter;
        this.salesMetricsQuery = salesMetricsQuery;
    }

    @Override
    public RepeatStatus execute(StepContribution contribution, ChunkContext chunkContext) {
        log.info("Cleaning finished: {}", cleaningReport);

        List<TransactionLine> lines = stagedTransactions.getLines();
        StarSchemaDimensions dimensions = dimensionBuilder.build(lines);
        List<FactSalesRow> facts = factTableBuilder.build(lines, dimensions);
        SalesMetrics expected = SalesMetrics.of(facts);

        warehouseWriter.replaceAll(dimensions.withFacts(facts));

        SalesMetrics loaded = verify(expected);
        log.info("Sanity checks passed: {} sales rows, {} returns, total net sales {}, return rate {}",
                loaded.factRows(), loaded.returnRows(), expected.totalNetSales(), loaded.returnRate());

        ExecutionContext jobContext = chunkContext.getStepContext().getStepExecution()
                .getJobExecution().getExecutionContext();
        jobContext.putLong(CONTEXT_FACT_ROWS, expected.factRows());
        jobContext.putLong(CONTEXT_RETURN_ROWS, expected.returnRows());
        jobContext.putString(CONTEXT_TOTAL_NET_SALES, expected.totalNetSales().toPlainString());
        jobContext.putString(CONTEXT_RETURN_RATE, expected.returnRate().toPlainString());
        jobContext.putLong(CONTEXT_LINES_DROPPED, cleaningReport.getTotalDropped());

        return RepeatStatus.FINISHED;
    }

    private SalesMetrics verify(SalesMetrics expected) {
        long orphans = salesMetricsQuery.countOrphanFacts();
        if (orphans > 0) {
            throw new WarehouseVerificationException(orphans + " fact rows reference missing dimension rows");
        }
        SalesMetrics loaded = salesMetricsQuery.currentMetrics();
        if (!loaded.matches(expected)) {
            throw new WarehouseVerificationException(
                    "Loaded warehouse " + loaded + " does not match built fact table " + expected);
        }
        return loaded;
    }
}
