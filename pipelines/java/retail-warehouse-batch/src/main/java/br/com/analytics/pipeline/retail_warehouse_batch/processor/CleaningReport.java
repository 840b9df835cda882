package br.com.analytics.pipeline.retail_warehouse_batch.processor;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Counts what the cleaning stage did with the lines of one run.
 */
public class CleaningReport {

    private long linesRead;
    private long linesAccepted;
    private final Map<DropReason, Long> drops = new EnumMap<>(DropReason.class);

    public void lineRead() {
        linesRead++;
    }

    public void lineAccepted() {
        linesAccepted++;
    }

    public void lineDropped(DropReason reason) {
        drops.merge(reason, 1L, Long::sum);
    }

    public long getLinesRead() {
        return linesRead;
    }

    public long getLinesAccepted() {
        return linesAccepted;
    }

    public long getDropped(DropReason reason) {
        return drops.getOrDefault(reason, 0L);
    }

    public long getTotalDropped() {
        return drops.values().stream().mapToLong(Long::longValue).sum();
    }

    public Map<DropReason, Long> getDrops() {
        return Collections.unmodifiableMap(drops);
    }

    @Override
    public String toString() {
        return "read=" + linesRead + ", accepted=" + linesAccepted + ", dropped=" + getTotalDropped() + " " + drops;
    }
}
