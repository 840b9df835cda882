package br.com.analytics.pipeline.retail_warehouse_batch.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Settings of the warehouse pipeline, bound from {@code retail.etl.*}.
 *
 * @param inputFile    the transactions extract to load
 * @param encoding     charset of the extract; the public Online Retail files are Latin-1
 * @param chunkSize    lines per chunk in the cleaning step, also the JDBC batch size of the load
 * @param runOnStartup launch the job when the application starts
 * @param export       CSV export of the loaded tables
 */
@ConfigurationProperties(prefix = "retail.etl")
public record RetailEtlProperties(
        String inputFile,
        @DefaultValue("ISO-8859-1") String encoding,
        @DefaultValue("500") int chunkSize,
        @DefaultValue("true") boolean runOnStartup,
        @DefaultValue Export export
) {

    public record Export(
            @DefaultValue("false") boolean enabled,
            @DefaultValue("exports") String directory
    ) {
    }
}
