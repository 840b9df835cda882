package br.com.analytics.pipeline.retail_warehouse_batch.reader;

import org.springframework.batch.core.step.skip.SkipPolicy;
import org.springframework.batch.infrastructure.item.file.FlatFileParseException;

/**
 * Skips lines the tokenizer cannot split into the eight columns. Anything else, a bad
 * header or an unreadable file included, still fails the step.
 */
public class MalformedLineSkipPolicy implements SkipPolicy {

    @Override
    public boolean shouldSkip(Throwable t, long skipCount) {
        return t instanceof FlatFileParseException;
    }
}
