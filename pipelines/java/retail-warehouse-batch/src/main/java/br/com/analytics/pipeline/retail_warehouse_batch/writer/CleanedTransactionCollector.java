package br.com.analytics.pipeline.retail_warehouse_batch.writer;

import br.com.analytics.pipeline.retail_warehouse_batch.model.TransactionLine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.batch.infrastructure.item.Chunk;
import org.springframework.batch.infrastructure.item.ItemWriter;

public class CleanedTransactionCollector implements ItemWriter<TransactionLine> {

    private static final Logger log = LoggerFactory.getLogger(CleanedTransactionCollector.class);

    private final StagedTransactions stagedTransactions;

    public CleanedTransactionCollector(StagedTransactions stagedTransactions) {
        this.stagedTransactions = stagedTransactions;
    }

    @Override
    public void write(Chunk<? extends TransactionLine> chunk) {
        stagedTransactions.addAll(chunk.getItems());
        log.debug("Staged {} cleaned lines, {} in total", chunk.size(), stagedTransactions.size());
    }
}
