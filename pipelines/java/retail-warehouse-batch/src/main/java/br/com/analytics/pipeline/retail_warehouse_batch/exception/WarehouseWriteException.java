package br.com.analytics.pipeline.retail_warehouse_batch.exception;

public class WarehouseWriteException extends RetailEtlException {

    public WarehouseWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
