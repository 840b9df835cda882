package br.com.analytics.pipeline.retail_warehouse_batch.warehouse;

/**
 * The tables of the star schema, in the order they are created and loaded.
 */
public enum WarehouseTable {
    DIM_DATE("dim_date", "date_key"),
    DIM_PRODUCT("dim_product", "product_key"),
    DIM_COUNTRY("dim_country", "country_key"),
    DIM_CUSTOMER("dim_customer", "customer_key"),
    FACT_SALES("fact_sales", "sales_key");

    private final String tableName;
    private final String keyColumn;

    WarehouseTable(String tableName, String keyColumn) {
        this.tableName = tableName;
        this.keyColumn = keyColumn;
    }

    public String tableName() {
        return tableName;
    }

    public String keyColumn() {
        return keyColumn;
    }
}
