package br.com.analytics.pipeline.retail_warehouse_batch.exception;

public class WarehouseVerificationException extends RetailEtlException {

    public WarehouseVerificationException(String message) {
        super(message);
    }
}
