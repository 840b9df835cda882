package br.com.analytics.pipeline.retail_warehouse_batch.runner;

import br.com.analytics.pipeline.retail_warehouse_batch.config.RetailEtlProperties;
import br.com.analytics.pipeline.retail_warehouse_batch.tasklet.StarSchemaLoadTasklet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.batch.core.BatchStatus;
import org.springframework.batch.core.job.JobExecution;
import org.springframework.batch.infrastructure.item.ExecutionContext;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * Runs the warehouse job once at startup and turns its outcome into the process exit code.
 */
@Component
@ConditionalOnProperty(prefix = "retail.etl", name = "run-on-startup", havingValue = "true", matchIfMissing = true)
public class RetailWarehouseJobRunner implements ApplicationRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(RetailWarehouseJobRunner.class);

    private final RetailWarehouseJobLauncher launcher;
    private final RetailEtlProperties properties;

    private int exitCode;

    public RetailWarehouseJobRunner(RetailWarehouseJobLauncher launcher, RetailEtlProperties properties) {
        this.launcher = launcher;
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        JobExecution execution = launcher.launch(properties.inputFile() == null ? null : Path.of(properties.inputFile()));

        if (execution.getStatus() == BatchStatus.COMPLETED) {
            ExecutionContext context = execution.getExecutionContext();
            log.info("Warehouse ready: {} sales rows, total net sales {}, return rate {}",
                    context.getLong(StarSchemaLoadTasklet.CONTEXT_FACT_ROWS, 0L),
                    context.getString(StarSchemaLoadTasklet.CONTEXT_TOTAL_NET_SALES, "0"),
                    context.getString(StarSchemaLoadTasklet.CONTEXT_RETURN_RATE, "0"));
            exitCode = 0;
        } else {
            execution.getAllFailureExceptions()
                    .forEach(failure -> log.error("Warehouse run failed", failure));
            exitCode = 1;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
