package br.com.analytics.pipeline.retail_warehouse_batch.reader;

import br.com.analytics.pipeline.retail_warehouse_batch.exception.InvalidSourceFileException;
import br.com.analytics.pipeline.retail_warehouse_batch.model.RawTransactionLine;
import org.springframework.batch.infrastructure.item.file.FlatFileItemReader;
import org.springframework.batch.infrastructure.item.file.builder.FlatFileItemReaderBuilder;
import org.springframework.core.io.FileSystemResource;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Builds the reader over the raw extract: comma delimited, double-quote quoted, one header line.
 */
public final class TransactionFileReaderFactory {

    private TransactionFileReaderFactory() {
    }

    public static FlatFileItemReader<RawTransactionLine> create(Path inputFile, String encoding) {
        if (!Files.isRegularFile(inputFile) || !Files.isReadable(inputFile)) {
            throw new InvalidSourceFileException("Transactions file not found or not readable: " + inputFile);
        }

        return new FlatFileItemReaderBuilder<RawTransactionLine>()
                .name("rawTransactionReader")
                .resource(new FileSystemResource(inputFile))
                .encoding(encoding)
                .linesToSkip(1)
                .skippedLinesCallback(new TransactionHeaderValidator())
                .delimited()
                .delimiter(",")
                .quoteCharacter('"')
                .names(RawTransactionLineFieldSetMapper.FIELD_NAMES)
                .fieldSetMapper(new RawTransactionLineFieldSetMapper())
                .strict(true)
                .build();
    }
}
