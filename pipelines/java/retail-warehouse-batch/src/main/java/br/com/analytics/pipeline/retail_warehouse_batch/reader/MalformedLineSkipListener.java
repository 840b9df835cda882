package br.com.analytics.pipeline.retail_warehouse_batch.reader;

import br.com.analytics.pipeline.retail_warehouse_batch.model.RawTransactionLine;
import br.com.analytics.pipeline.retail_warehouse_batch.model.TransactionLine;
import br.com.analytics.pipeline.retail_warehouse_batch.processor.CleaningReport;
import br.com.analytics.pipeline.retail_warehouse_batch.processor.DropReason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.batch.core.listener.SkipListener;
import org.springframework.batch.infrastructure.item.file.FlatFileParseException;

/**
 * Counts lines skipped by the reader as {@link DropReason#MALFORMED_LINE}.
 */
public class MalformedLineSkipListener implements SkipListener<RawTransactionLine, TransactionLine> {

    private static final Logger log = LoggerFactory.getLogger(MalformedLineSkipListener.class);

    private final CleaningReport report;

    public MalformedLineSkipListener(CleaningReport report) {
        this.report = report;
    }

    @Override
    public void onSkipInRead(Throwable t) {
        report.lineRead();
        report.lineDropped(DropReason.MALFORMED_LINE);
        if (t instanceof FlatFileParseException) {
            FlatFileParseException parseException = (FlatFileParseException) t;
            log.warn("Dropping malformed line {}: {}", parseException.getLineNumber(), parseException.getInput());
        } else {
            log.warn("Dropping unreadable line: {}", t.getMessage());
        }
    }
}
