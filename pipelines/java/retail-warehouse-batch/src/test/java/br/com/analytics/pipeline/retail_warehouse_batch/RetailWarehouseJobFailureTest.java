package br.com.analytics.pipeline.retail_warehouse_batch;

import br.com.analytics.pipeline.retail_warehouse_batch.dimension.DimensionBuilder;
import br.com.analytics.pipeline.retail_warehouse_batch.exception.DimensionLookupException;
import br.com.analytics.pipeline.retail_warehouse_batch.exception.WarehouseVerificationException;
import br.com.analytics.pipeline.retail_warehouse_batch.model.SalesMetrics;
import br.com.analytics.pipeline.retail_warehouse_batch.model.TransactionLine;
import br.com.analytics.pipeline.retail_warehouse_batch.runner.RetailWarehouseJobLauncher;
import br.com.analytics.pipeline.retail_warehouse_batch.warehouse.SalesMetricsQuery;
import br.com.analytics.pipeline.retail_warehouse_batch.warehouse.WarehouseTable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.batch.core.BatchStatus;
import org.springframework.batch.core.job.JobExecution;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.bean.override.mockito.MockitoSpyBean;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doReturn;

/**
 * Fatal load failures: each one must fail the job and leave the warehouse of the previous
 * successful run in place.
 */
@SpringBootTest
@DisplayName("Retail warehouse job failure Tests")
class RetailWarehouseJobFailureTest {

    @Autowired
    private RetailWarehouseJobLauncher launcher;

    @Autowired
    @Qualifier("warehouseJdbcTemplate")
    private JdbcTemplate jdbcTemplate;

    @MockitoSpyBean
    private SalesMetricsQuery salesMetricsQuery;

    @MockitoSpyBean
    private DimensionBuilder dimensionBuilder;

    private Map<WarehouseTable, List<Map<String, Object>>> previousWarehouse;

    @BeforeEach
    void loadPreviousWarehouse() throws IOException {
        JobExecution execution = launcher.launch(sampleFile());
        assertEquals(BatchStatus.COMPLETED, execution.getStatus(), () -> execution.getAllFailureExceptions().toString());
        previousWarehouse = snapshot();
    }

    @Test
    @DisplayName("Should fail on an unresolved dimension key and write nothing")
    void testDimensionLookupFailure() throws IOException {
        doAnswer(invocation -> {
            List<TransactionLine> lines = invocation.getArgument(0);
            return new DimensionBuilder().build(lines.subList(0, 1));
        }).when(dimensionBuilder).build(anyList());

        JobExecution execution = launcher.launch(sampleFile());

        assertEquals(BatchStatus.FAILED, execution.getStatus());
        assertTrue(failedWith(execution, DimensionLookupException.class), execution.getAllFailureExceptions().toString());
        assertEquals(previousWarehouse, snapshot());
    }

    @Test
    @DisplayName("Should roll the load back when the loaded metrics do not match")
    void testVerificationFailure() throws IOException {
        doReturn(new SalesMetrics(0, 0, BigDecimal.ZERO)).when(salesMetricsQuery).currentMetrics();

        JobExecution execution = launcher.launch(sampleFile());

        assertEquals(BatchStatus.FAILED, execution.getStatus());
        assertTrue(failedWith(execution, WarehouseVerificationException.class), execution.getAllFailureExceptions().toString());
        assertEquals(previousWarehouse, snapshot());
    }

    private static Path sampleFile() throws IOException {
        return new ClassPathResource("data/online_retail_sample.csv").getFile().toPath();
    }

    private static boolean failedWith(JobExecution execution, Class<? extends Throwable> type) {
        for (Throwable failure : execution.getAllFailureExceptions()) {
            for (Throwable t = failure; t != null; t = t.getCause()) {
                if (type.isInstance(t)) {
                    return true;
                }
            }
        }
        return false;
    }

    private Map<WarehouseTable, List<Map<String, Object>>> snapshot() {
        Map<WarehouseTable, List<Map<String, Object>>> tables = new EnumMap<>(WarehouseTable.class);
        for (WarehouseTable table : WarehouseTable.values()) {
            tables.put(table, jdbcTemplate.queryForList(
                    "SELECT * FROM " + table.tableName() + " ORDER BY " + table.keyColumn()));
        }
        return tables;
    }
}
