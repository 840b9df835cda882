package br.com.analytics.pipeline.retail_warehouse_batch.tasklet;

import br.com.analytics.pipeline.retail_warehouse_batch.warehouse.WarehouseTable;
import br.com.analytics.pipeline.retail_warehouse_batch.writer.CsvLineAggregator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.batch.core.scope.context.ChunkContext;
import org.springframework.batch.core.step.StepContribution;
import org.springframework.batch.core.step.tasklet.Tasklet;
import org.springframework.batch.infrastructure.item.Chunk;
import org.springframework.batch.infrastructure.item.ExecutionContext;
import org.springframework.batch.infrastructure.item.file.FlatFileItemWriter;
import org.springframework.batch.infrastructure.item.file.builder.FlatFileItemWriterBuilder;
import org.springframework.batch.infrastructure.repeat.RepeatStatus;
import org.springframework.core.io.FileSystemResource;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.ResultSetExtractor;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.ResultSetMetaData;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes every warehouse table to {@code <directory>/<table>.csv} for dashboard tools that
 * import flat files instead of opening the database.
 */
public class WarehouseExportTasklet implements Tasklet {

    private static final Logger log = LoggerFactory.getLogger(WarehouseExportTasklet.class);

    private final JdbcTemplate jdbcTemplate;
    private final Path exportDirectory;
    private final CsvLineAggregator lineAggregator = new CsvLineAggregator();

    public WarehouseExportTasklet(JdbcTemplate jdbcTemplate, Path exportDirectory) {
        this.jdbcTemplate = jdbcTemplate;
        this.exportDirectory = exportDirectory;
    }

    @Override
    public RepeatStatus execute(StepContribution contribution, ChunkContext chunkContext) throws Exception {
        Files.createDirectories(exportDirectory);
        for (WarehouseTable table : WarehouseTable.values()) {
            Path target = exportDirectory.resolve(table.tableName() + ".csv");
            int rows = exportTable(table, target);
            log.info("Exported {} rows of {} to {}", rows, table.tableName(), target);
        }
        return RepeatStatus.FINISHED;
    }

    private int exportTable(WarehouseTable table, Path target) throws Exception {
        List<String> header = new ArrayList<>();
        ResultSetExtractor<List<List<Object>>> extractor = rs -> {
            ResultSetMetaData metaData = rs.getMetaData();
            for (int i = 1; i <= metaData.getColumnCount(); i++) {
                header.add(metaData.getColumnName(i));
            }
            List<List<Object>> rows = new ArrayList<>();
            while (rs.next()) {
                List<Object> row = new ArrayList<>(header.size());
                for (int i = 1; i <= header.size(); i++) {
                    row.add(rs.getObject(i));
                }
                rows.add(row);
            }
            return rows;
        };
        List<List<Object>> rows = jdbcTemplate.query(
                "SELECT * FROM " + table.tableName() + " ORDER BY " + table.keyColumn(), extractor);
        if (rows == null) {
            rows = List.of();
        }

        FlatFileItemWriter<List<Object>> writer = new FlatFileItemWriterBuilder<List<Object>>()
                .name(table.tableName() + "CsvWriter")
                .resource(new FileSystemResource(target))
                .encoding(StandardCharsets.UTF_8.name())
                .headerCallback(out -> out.write(lineAggregator.aggregate(header)))
                .lineAggregator(lineAggregator::aggregate)
                .shouldDeleteIfExists(true)
                .build();

        writer.open(new ExecutionContext());
        try {
            writer.write(new Chunk<>(rows));
        } finally {
            writer.close();
        }
        return rows.size();
    }
}
