package br.com.analytics.pipeline.retail_warehouse_batch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RetailWarehouseBatchApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(
                SpringApplication.run(RetailWarehouseBatchApplication.class, args)
        ));
    }
}
