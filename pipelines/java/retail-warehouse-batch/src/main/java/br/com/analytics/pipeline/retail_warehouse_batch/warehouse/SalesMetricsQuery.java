package br.com.analytics.pipeline.retail_warehouse_batch.warehouse;

import br.com.analytics.pipeline.retail_warehouse_batch.model.SalesMetrics;
import org.springframework.jdbc.core.JdbcTemplate;

import java.math.BigDecimal;

/**
 * Reads the dashboard metrics and integrity figures back out of the loaded warehouse.
 */
public class SalesMetricsQuery {

    private static final String SQL_SALES_METRICS =
            "SELECT COUNT(*) AS fact_rows, " +
                    "COALESCE(SUM(is_return), 0) AS return_rows, " +
                    "COALESCE(SUM(net_amount), 0) AS total_net_sales " +
                    "FROM fact_sales";

    private static final String SQL_ORPHAN_FACTS =
            "SELECT COUNT(*) FROM fact_sales f " +
                    "LEFT JOIN dim_date d ON d.date_key = f.date_key " +
                    "LEFT JOIN dim_product p ON p.product_key = f.product_key " +
                    "LEFT JOIN dim_customer c ON c.customer_key = f.customer_key " +
                    "LEFT JOIN dim_country co ON co.country_key = f.country_key " +
                    "WHERE d.date_key IS NULL OR p.product_key IS NULL " +
                    "OR c.customer_key IS NULL OR co.country_key IS NULL";

    private final JdbcTemplate jdbcTemplate;

    public SalesMetricsQuery(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public SalesMetrics currentMetrics() {
        return jdbcTemplate.queryForObject(SQL_SALES_METRICS, (rs, rowNum) -> new SalesMetrics(
                rs.getLong("fact_rows"),
                rs.getLong("return_rows"),
                new BigDecimal(rs.getString("total_net_sales"))
        ));
    }

    public long countOrphanFacts() {
        Long orphans = jdbcTemplate.queryForObject(SQL_ORPHAN_FACTS, Long.class);
        return orphans == null ? 0 : orphans;
    }

    public long countRows(WarehouseTable table) {
        Long rows = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM " + table.tableName(), Long.class);
        return rows == null ? 0 : rows;
    }
}
