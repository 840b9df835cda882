package br.com.analytics.pipeline.retail_warehouse_batch.config;

import com.zaxxer.hikari.HikariDataSource;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.core.env.Environment;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.init.DataSourceInitializer;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;

import javax.sql.DataSource;

@Configuration
public class DataSourceConfig {

    static final String BATCH_SCHEMA = "org/springframework/batch/core/schema-h2.sql";

    @Autowired
    private Environment env;

    /**
     * The embedded SQLite warehouse. At most one connection, with no idle connection kept,
     * so the file is only held while a write runs. Foreign keys are switched on for every
     * connection SQLite hands out.
     */
    @Primary
    @Bean(name = "warehouseDataSource")
    public DataSource warehouseDataSource() {
        HikariDataSource dataSource = new HikariDataSource();
        dataSource.setPoolName("warehouse");
        dataSource.setDriverClassName(env.getProperty("spring.datasource.warehouse.driver-class-name", "org.sqlite.JDBC"));
        dataSource.setJdbcUrl(env.getRequiredProperty("spring.datasource.warehouse.url"));
        dataSource.setMaximumPoolSize(env.getProperty("spring.datasource.warehouse.maximum-pool-size", Integer.class, 1));
        dataSource.setMinimumIdle(0);
        dataSource.setIdleTimeout(env.getProperty("spring.datasource.warehouse.idle-timeout", Long.class, 10_000L));
        dataSource.setConnectionInitSql("PRAGMA foreign_keys = ON");
        return dataSource;
    }

    /** Job repository metadata, kept apart from the warehouse file. */
    @Bean(name = "batchDataSource")
    public DataSource batchDataSource() {
        HikariDataSource dataSource = new HikariDataSource();
        dataSource.setPoolName("batch");
        dataSource.setDriverClassName(env.getProperty("spring.datasource.batch.driver-class-name", "org.h2.Driver"));
        dataSource.setJdbcUrl(env.getRequiredProperty("spring.datasource.batch.url"));
        dataSource.setUsername(env.getProperty("spring.datasource.batch.username", "sa"));
        dataSource.setPassword(env.getProperty("spring.datasource.batch.password", ""));
        return dataSource;
    }

    @Bean(name = "batchSchemaInitializer")
    public DataSourceInitializer batchSchemaInitializer(@Qualifier("batchDataSource") DataSource batchDataSource) {
        DataSourceInitializer initializer = new DataSourceInitializer();
        initializer.setDataSource(batchDataSource);
        initializer.setDatabasePopulator(new ResourceDatabasePopulator(new ClassPathResource(BATCH_SCHEMA)));
        return initializer;
    }

    @Bean(name = "transactionManager")
    public DataSourceTransactionManager transactionManager(@Qualifier("warehouseDataSource") DataSource warehouseDataSource) {
        return new DataSourceTransactionManager(warehouseDataSource);
    }

    @Bean(name = "batchTransactionManager")
    public DataSourceTransactionManager batchTransactionManager(@Qualifier("batchDataSource") DataSource batchDataSource) {
        return new DataSourceTransactionManager(batchDataSource);
    }

    @Bean(name = "warehouseJdbcTemplate")
    public JdbcTemplate warehouseJdbcTemplate(@Qualifier("warehouseDataSource") DataSource warehouseDataSource) {
        return new JdbcTemplate(warehouseDataSource);
    }

}
