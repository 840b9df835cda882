package br.com.analytics.pipeline.retail_warehouse_batch.warehouse;

import br.com.analytics.pipeline.retail_warehouse_batch.exception.WarehouseWriteException;
import br.com.analytics.pipeline.retail_warehouse_batch.model.StarSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.Types;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Replaces the whole warehouse with a freshly built star schema.
 * <p>
 * Drop, create and load run in one transaction. SQLite DDL is transactional, so on any
 * failure the previous tables come back untouched.
 */
public class WarehouseWriter {

    private static final Logger log = LoggerFactory.getLogger(WarehouseWriter.class);

    static final DateTimeFormatter INVOICE_DATETIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private static final List<String> SQL_DROP_TABLES = List.of(
            "DROP TABLE IF EXISTS fact_sales",
            "DROP TABLE IF EXISTS dim_customer",
            "DROP TABLE IF EXISTS dim_country",
            "DROP TABLE IF EXISTS dim_product",
            "DROP TABLE IF EXISTS dim_date"
    );

    private static final List<String> SQL_CREATE_TABLES = List.of(
            "CREATE TABLE dim_date (" +
                    "date_key INTEGER PRIMARY KEY, " +
                    "full_date TEXT NOT NULL UNIQUE, " +
                    "year INTEGER NOT NULL, " +
                    "quarter INTEGER NOT NULL, " +
                    "month INTEGER NOT NULL, " +
                    "month_name TEXT NOT NULL, " +
                    "day INTEGER NOT NULL, " +
                    "weekday INTEGER NOT NULL, " +
                    "weekday_name TEXT NOT NULL)",
            "CREATE TABLE dim_product (" +
                    "product_key INTEGER PRIMARY KEY, " +
                    "stock_code TEXT NOT NULL UNIQUE, " +
                    "description TEXT)",
            "CREATE TABLE dim_country (" +
                    "country_key INTEGER PRIMARY KEY, " +
                    "country TEXT NOT NULL UNIQUE)",
            "CREATE TABLE dim_customer (" +
                    "customer_key INTEGER PRIMARY KEY, " +
                    "customer_id TEXT NOT NULL UNIQUE, " +
                    "country_key INTEGER REFERENCES dim_country(country_key))",
            "CREATE TABLE fact_sales (" +
                    "sales_key INTEGER PRIMARY KEY, " +
                    "invoice_no TEXT NOT NULL, " +
                    "invoice_datetime TEXT NOT NULL, " +
                    "date_key INTEGER NOT NULL REFERENCES dim_date(date_key), " +
                    "product_key INTEGER NOT NULL REFERENCES dim_product(product_key), " +
                    "customer_key INTEGER NOT NULL REFERENCES dim_customer(customer_key), " +
                    "country_key INTEGER NOT NULL REFERENCES dim_country(country_key), " +
                    "quantity INTEGER NOT NULL, " +
                    "unit_price NUMERIC NOT NULL, " +
                    "net_amount NUMERIC NOT NULL, " +
                    "is_return INTEGER NOT NULL CHECK (is_return IN (0, 1)))"
    );

    private static final String SQL_INSERT_DATE =
            "INSERT INTO dim_date (date_key, full_date, year, quarter, month, month_name, day, weekday, weekday_name) " +
                    "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)";

    private static final String SQL_INSERT_PRODUCT =
            "INSERT INTO dim_product (product_key, stock_code, description) VALUES (?, ?, ?)";

    private static final String SQL_INSERT_COUNTRY =
            "INSERT INTO dim_country (country_key, country) VALUES (?, ?)";

    private static final String SQL_INSERT_CUSTOMER =
            "INSERT INTO dim_customer (customer_key, customer_id, country_key) VALUES (?, ?, ?)";

    private static final String SQL_INSERT_FACT =
            "INSERT INTO fact_sales (sales_key, invoice_no, invoice_datetime, date_key, product_key, customer_key, " +
                    "country_key, quantity, unit_price, net_amount, is_return) " +
                    "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final int batchSize;

    public WarehouseWriter(JdbcTemplate jdbcTemplate, PlatformTransactionManager transactionManager, int batchSize) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.batchSize = batchSize;
    }

    public void replaceAll(StarSchema schema) {
        try {
            transactionTemplate.executeWithoutResult(status -> {
                SQL_DROP_TABLES.forEach(jdbcTemplate::execute);
                SQL_CREATE_TABLES.forEach(jdbcTemplate::execute);
                insertDates(schema);
                insertProducts(schema);
                insertCountries(schema);
                insertCustomers(schema);
                insertFacts(schema);
            });
        } catch (DataAccessException | TransactionException e) {
            throw new WarehouseWriteException("Warehouse load failed, previous contents kept", e);
        }

        log.info("Warehouse replaced: {} dates, {} products, {} countries, {} customers, {} sales",
                schema.dates().size(), schema.products().size(), schema.countries().size(),
                schema.customers().size(), schema.facts().size());
    }

    private void insertDates(StarSchema schema) {
        jdbcTemplate.batchUpdate(SQL_INSERT_DATE, schema.dates(), batchSize, (ps, row) -> {
            ps.setLong(1, row.dateKey());
            ps.setString(2, row.fullDate().toString());
            ps.setInt(3, row.year());
            ps.setInt(4, row.quarter());
            ps.setInt(5, row.month());
            ps.setString(6, row.monthName());
            ps.setInt(7, row.day());
            ps.setInt(8, row.weekday());
            ps.setString(9, row.weekdayName());
        });
    }

    private void insertProducts(StarSchema schema) {
        jdbcTemplate.batchUpdate(SQL_INSERT_PRODUCT, schema.products(), batchSize, (ps, row) -> {
            ps.setLong(1, row.productKey());
            ps.setString(2, row.stockCode());
            if (row.description() == null) {
                ps.setNull(3, Types.VARCHAR);
            } else {
                ps.setString(3, row.description());
            }
        });
    }

    private void insertCountries(StarSchema schema) {
        jdbcTemplate.batchUpdate(SQL_INSERT_COUNTRY, schema.countries(), batchSize, (ps, row) -> {
            ps.setLong(1, row.countryKey());
            ps.setString(2, row.country());
        });
    }

    private void insertCustomers(StarSchema schema) {
        jdbcTemplate.batchUpdate(SQL_INSERT_CUSTOMER, schema.customers(), batchSize, (ps, row) -> {
            ps.setLong(1, row.customerKey());
            ps.setString(2, row.customerId());
            if (row.countryKey() == null) {
                ps.setNull(3, Types.INTEGER);
            } else {
                ps.setLong(3, row.countryKey());
            }
        });
    }

    private void insertFacts(StarSchema schema) {
        jdbcTemplate.batchUpdate(SQL_INSERT_FACT, schema.facts(), batchSize, (ps, row) -> {
            ps.setLong(1, row.salesKey());
            ps.setString(2, row.invoiceNo());
            ps.setString(3, row.invoiceDateTime().format(INVOICE_DATETIME_FORMAT));
            ps.setLong(4, row.dateKey());
            ps.setLong(5, row.productKey());
            ps.setLong(6, row.customerKey());
            ps.setLong(7, row.countryKey());
            ps.setInt(8, row.quantity());
            ps.setBigDecimal(9, row.unitPrice());
            ps.setBigDecimal(10, row.netAmount());
            ps.setInt(11, row.isReturn() ? 1 : 0);
        });
    }
}
