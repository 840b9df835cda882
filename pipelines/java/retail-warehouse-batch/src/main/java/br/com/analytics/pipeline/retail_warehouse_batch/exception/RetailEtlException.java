package br.com.analytics.pipeline.retail_warehouse_batch.exception;

/**
 * Base exception for errors that abort a warehouse run.
 */
public class RetailEtlException extends RuntimeException {

    public RetailEtlException(String message) {
        super(message);
    }

    public RetailEtlException(String message, Throwable cause) {
        super(message, cause);
    }
}
