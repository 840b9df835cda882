package br.com.analytics.pipeline.retail_warehouse_batch.reader;

import br.com.analytics.pipeline.retail_warehouse_batch.model.RawTransactionLine;
import org.springframework.batch.infrastructure.item.file.mapping.FieldSetMapper;
import org.springframework.batch.infrastructure.item.file.transform.FieldSet;

public class RawTransactionLineFieldSetMapper implements FieldSetMapper<RawTransactionLine> {

    static final String[] FIELD_NAMES = {
            "invoice", "stockCode", "description", "quantity", "invoiceDate", "price", "customerId", "country"
    };

    @Override
    public RawTransactionLine mapFieldSet(FieldSet fieldSet) {
        return new RawTransactionLine(
                fieldSet.readString("invoice"),
                fieldSet.readString("stockCode"),
                fieldSet.readString("description"),
                fieldSet.readString("quantity"),
                fieldSet.readString("invoiceDate"),
                fieldSet.readString("price"),
                fieldSet.readString("customerId"),
                fieldSet.readString("country")
        );
    }
}
