package br.com.analytics.pipeline.retail_warehouse_batch.writer;

import br.com.analytics.pipeline.retail_warehouse_batch.model.TransactionLine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Cleaned lines of the running job, held in memory until the warehouse load step.
 */
public class StagedTransactions {

    private final List<TransactionLine> lines = new ArrayList<>();

    public void addAll(List<? extends TransactionLine> cleaned) {
        lines.addAll(cleaned);
    }

    public List<TransactionLine> getLines() {
        return Collections.unmodifiableList(lines);
    }

    public int size() {
        return lines.size();
    }
}
