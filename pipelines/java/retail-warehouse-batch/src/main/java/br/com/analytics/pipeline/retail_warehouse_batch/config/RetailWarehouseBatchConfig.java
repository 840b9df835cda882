package br.com.analytics.pipeline.retail_warehouse_batch.config;

import br.com.analytics.pipeline.retail_warehouse_batch.dimension.DimensionBuilder;
import br.com.analytics.pipeline.retail_warehouse_batch.fact.FactTableBuilder;
import br.com.analytics.pipeline.retail_warehouse_batch.model.RawTransactionLine;
import br.com.analytics.pipeline.retail_warehouse_batch.model.TransactionLine;
import br.com.analytics.pipeline.retail_warehouse_batch.processor.CleaningReport;
import br.com.analytics.pipeline.retail_warehouse_batch.processor.TransactionCleaningProcessor;
import br.com.analytics.pipeline.retail_warehouse_batch.reader.MalformedLineSkipListener;
import br.com.analytics.pipeline.retail_warehouse_batch.reader.MalformedLineSkipPolicy;
import br.com.analytics.pipeline.retail_warehouse_batch.reader.TransactionFileReaderFactory;
import br.com.analytics.pipeline.retail_warehouse_batch.tasklet.StarSchemaLoadTasklet;
import br.com.analytics.pipeline.retail_warehouse_batch.tasklet.WarehouseExportTasklet;
import br.com.analytics.pipeline.retail_warehouse_batch.warehouse.SalesMetricsQuery;
import br.com.analytics.pipeline.retail_warehouse_batch.warehouse.WarehouseConnectionReleaser;
import br.com.analytics.pipeline.retail_warehouse_batch.warehouse.WarehouseWriter;
import br.com.analytics.pipeline.retail_warehouse_batch.writer.CleanedTransactionCollector;
import br.com.analytics.pipeline.retail_warehouse_batch.writer.StagedTransactions;
import org.springframework.batch.core.configuration.annotation.EnableBatchProcessing;
import org.springframework.batch.core.configuration.annotation.EnableJdbcJobRepository;
import org.springframework.batch.core.configuration.annotation.JobScope;
import org.springframework.batch.core.configuration.annotation.StepScope;
import org.springframework.batch.core.job.Job;
import org.springframework.batch.core.job.builder.JobBuilder;
import org.springframework.batch.core.job.builder.SimpleJobBuilder;
import org.springframework.batch.core.repository.JobRepository;
import org.springframework.batch.core.step.Step;
import org.springframework.batch.core.step.builder.StepBuilder;
import org.springframework.batch.infrastructure.item.file.FlatFileItemReader;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.PlatformTransactionManager;

import javax.sql.DataSource;
import java.nio.file.Path;

@Configuration
@EnableBatchProcessing
@EnableJdbcJobRepository(dataSourceRef = "batchDataSource", transactionManagerRef = "batchTransactionManager")
@EnableConfigurationProperties(RetailEtlProperties.class)
public class RetailWarehouseBatchConfig {

    public static final String JOB_NAME = "retailWarehouseJob";
    public static final String INPUT_FILE_PARAMETER = "input.file";

    private final JobRepository jobRepository;
    private final PlatformTransactionManager transactionManager;
    private final RetailEtlProperties properties;

    public RetailWarehouseBatchConfig(
            JobRepository jobRepository,
            @Qualifier("transactionManager") PlatformTransactionManager transactionManager,
            RetailEtlProperties properties) {
        this.jobRepository = jobRepository;
        this.transactionManager = transactionManager;
        this.properties = properties;
    }

    @Bean
    @StepScope
    public FlatFileItemReader<RawTransactionLine> rawTransactionReader(
            @Value("#{jobParameters['" + INPUT_FILE_PARAMETER + "']}") String inputFile) {
        return TransactionFileReaderFactory.create(Path.of(inputFile), properties.encoding());
    }

    @Bean
    @JobScope
    public CleaningReport cleaningReport() {
        return new CleaningReport();
    }

    @Bean
    @JobScope
    public StagedTransactions stagedTransactions() {
        return new StagedTransactions();
    }

    @Bean
    @StepScope
    public TransactionCleaningProcessor transactionCleaningProcessor(CleaningReport cleaningReport) {
        return new TransactionCleaningProcessor(cleaningReport);
    }

    @Bean
    public MalformedLineSkipListener malformedLineSkipListener(CleaningReport cleaningReport) {
        return new MalformedLineSkipListener(cleaningReport);
    }

    @Bean
    public WarehouseConnectionReleaser warehouseConnectionReleaser(
            @Qualifier("warehouseDataSource") DataSource warehouseDataSource) {
        return new WarehouseConnectionReleaser(warehouseDataSource);
    }

    @Bean
    public CleanedTransactionCollector cleanedTransactionCollector(StagedTransactions stagedTransactions) {
        return new CleanedTransactionCollector(stagedTransactions);
    }

    @Bean
    public DimensionBuilder dimensionBuilder() {
        return new DimensionBuilder();
    }

    @Bean
    public FactTableBuilder factTableBuilder() {
        return new FactTableBuilder();
    }

    @Bean
    public WarehouseWriter warehouseWriter(@Qualifier("warehouseJdbcTemplate") JdbcTemplate warehouseJdbcTemplate) {
        return new WarehouseWriter(warehouseJdbcTemplate, transactionManager, properties.chunkSize());
    }

    @Bean
    public SalesMetricsQuery salesMetricsQuery(@Qualifier("warehouseJdbcTemplate") JdbcTemplate warehouseJdbcTemplate) {
        return new SalesMetricsQuery(warehouseJdbcTemplate);
    }

    @Bean
    public StarSchemaLoadTasklet starSchemaLoadTasklet(
            StagedTransactions stagedTransactions,
            CleaningReport cleaningReport,
            DimensionBuilder dimensionBuilder,
            FactTableBuilder factTableBuilder,
            WarehouseWriter warehouseWriter,
            SalesMetricsQuery salesMetricsQuery) {
        return new StarSchemaLoadTasklet(stagedTransactions, cleaningReport, dimensionBuilder,
                factTableBuilder, warehouseWriter, salesMetricsQuery);
    }

    @Bean
    public WarehouseExportTasklet warehouseExportTasklet(
            @Qualifier("warehouseJdbcTemplate") JdbcTemplate warehouseJdbcTemplate) {
        return new WarehouseExportTasklet(warehouseJdbcTemplate, Path.of(properties.export().directory()));
    }

    @Bean
    public Step extractCleanStep(
            FlatFileItemReader<RawTransactionLine> rawTransactionReader,
            TransactionCleaningProcessor transactionCleaningProcessor,
            CleanedTransactionCollector cleanedTransactionCollector,
            MalformedLineSkipListener malformedLineSkipListener
    ){
        return new StepBuilder("extractCleanStep", jobRepository)
                .<RawTransactionLine, TransactionLine>chunk(properties.chunkSize())
                .reader(rawTransactionReader)
                .processor(transactionCleaningProcessor)
                .writer(cleanedTransactionCollector)
                .faultTolerant()
                .skipPolicy(new MalformedLineSkipPolicy())
                .skipListener(malformedLineSkipListener)
                .build();
    }

    @Bean
    public Step loadWarehouseStep(StarSchemaLoadTasklet starSchemaLoadTasklet){
        return new StepBuilder("loadWarehouseStep", jobRepository)
                .tasklet(starSchemaLoadTasklet, transactionManager)
                .build();
    }

    @Bean
    public Step exportWarehouseStep(WarehouseExportTasklet warehouseExportTasklet){
        return new StepBuilder("exportWarehouseStep", jobRepository)
                .tasklet(warehouseExportTasklet, transactionManager)
                .build();
    }

    @Bean(name = JOB_NAME)
    public Job retailWarehouseJob(
            @Qualifier("extractCleanStep") Step extractCleanStep,
            @Qualifier("loadWarehouseStep") Step loadWarehouseStep,
            @Qualifier("exportWarehouseStep") Step exportWarehouseStep,
            WarehouseConnectionReleaser warehouseConnectionReleaser
    ){
        SimpleJobBuilder job = new JobBuilder(JOB_NAME, jobRepository)
                .listener(warehouseConnectionReleaser)
                .start(extractCleanStep)
                .next(loadWarehouseStep);
        if (properties.export().enabled()) {
            job = job.next(exportWarehouseStep);
        }
        return job.build();
    }

}
