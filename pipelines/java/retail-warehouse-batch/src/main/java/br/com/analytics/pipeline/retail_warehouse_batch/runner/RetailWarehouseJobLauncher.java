package br.com.analytics.pipeline.retail_warehouse_batch.runner;

import br.com.analytics.pipeline.retail_warehouse_batch.config.RetailWarehouseBatchConfig;
import br.com.analytics.pipeline.retail_warehouse_batch.exception.InvalidSourceFileException;
import br.com.analytics.pipeline.retail_warehouse_batch.exception.RetailEtlException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.batch.core.job.Job;
import org.springframework.batch.core.job.JobExecution;
import org.springframework.batch.core.job.parameters.JobParameters;
import org.springframework.batch.core.job.parameters.JobParametersBuilder;
import org.springframework.batch.core.launch.JobOperator;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Starts one run of the warehouse job over a given extract.
 */
@Component
public class RetailWarehouseJobLauncher {

    private static final Logger log = LoggerFactory.getLogger(RetailWarehouseJobLauncher.class);

    private final JobOperator jobOperator;
    private final Job retailWarehouseJob;

    public RetailWarehouseJobLauncher(
            JobOperator jobOperator,
            @Qualifier(RetailWarehouseBatchConfig.JOB_NAME) Job retailWarehouseJob) {
        this.jobOperator = jobOperator;
        this.retailWarehouseJob = retailWarehouseJob;
    }

    public JobExecution launch(Path inputFile) {
        if (inputFile == null || !Files.isRegularFile(inputFile)) {
            throw new InvalidSourceFileException("Transactions file not found: " + inputFile);
        }

        JobParameters parameters = new JobParametersBuilder()
                .addString(RetailWarehouseBatchConfig.INPUT_FILE_PARAMETER, inputFile.toAbsolutePath().toString())
                .addLong("run.timestamp", System.currentTimeMillis())
                .toJobParameters();

        log.info("Starting {} for {}", retailWarehouseJob.getName(), inputFile.toAbsolutePath());
        try {
            return jobOperator.start(retailWarehouseJob, parameters);
        } catch (Exception e) {
            throw new RetailEtlException("Could not start " + retailWarehouseJob.getName(), e);
        }
    }
}
