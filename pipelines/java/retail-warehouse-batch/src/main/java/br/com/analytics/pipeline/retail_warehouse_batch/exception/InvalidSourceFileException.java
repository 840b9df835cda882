package br.com.analytics.pipeline.retail_warehouse_batch.exception;

public class InvalidSourceFileException extends RetailEtlException {

    public InvalidSourceFileException(String message) {
        super(message);
    }
}
