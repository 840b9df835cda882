package br.com.analytics.pipeline.retail_warehouse_batch.exception;

/**
 * A cleaned line references a natural key that no dimension row was built for.
 * Dimensions come from the same cleaned lines, so this is always a defect in the build.
 */
public class DimensionLookupException extends RetailEtlException {

    private final String dimension;
    private final Object naturalKey;

    public DimensionLookupException(String dimension, Object naturalKey) {
        super("No " + dimension + " row for natural key '" + naturalKey + "'");
        this.dimension = dimension;
        this.naturalKey = naturalKey;
    }

    public String getDimension() {
        return dimension;
    }

    public Object getNaturalKey() {
        return naturalKey;
    }
}
