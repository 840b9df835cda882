package br.com.analytics.pipeline.retail_warehouse_batch.warehouse;

import com.zaxxer.hikari.HikariDataSource;
import com.zaxxer.hikari.HikariPoolMXBean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.batch.core.job.JobExecution;
import org.springframework.batch.core.listener.JobExecutionListener;

import javax.sql.DataSource;

/**
 * Closes the warehouse connections once a run ends, whatever its outcome, so the SQLite
 * file is not held between runs. The pool stays usable and opens a new connection on demand.
 */
public class WarehouseConnectionReleaser implements JobExecutionListener {

    private static final Logger log = LoggerFactory.getLogger(WarehouseConnectionReleaser.class);

    private final DataSource warehouseDataSource;

    public WarehouseConnectionReleaser(DataSource warehouseDataSource) {
        this.warehouseDataSource = warehouseDataSource;
    }

    @Override
    public void afterJob(JobExecution jobExecution) {
        if (!(warehouseDataSource instanceof HikariDataSource)) {
            return;
        }
        HikariPoolMXBean pool = ((HikariDataSource) warehouseDataSource).getHikariPoolMXBean();
        if (pool != null) {
            pool.softEvictConnections();
            log.debug("Released warehouse connections after {}", jobExecution.getJobInstance().getJobName());
        }
    }
}
