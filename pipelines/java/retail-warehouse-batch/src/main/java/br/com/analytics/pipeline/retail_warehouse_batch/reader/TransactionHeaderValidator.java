package br.com.analytics.pipeline.retail_warehouse_batch.reader;

import br.com.analytics.pipeline.retail_warehouse_batch.exception.InvalidSourceFileException;
import org.springframework.batch.infrastructure.item.file.LineCallbackHandler;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Checks the header line of the extract. Column names are compared ignoring case and
 * whitespace, so both {@code Customer ID} and {@code customerid} are accepted.
 */
public class TransactionHeaderValidator implements LineCallbackHandler {

    static final List<String> EXPECTED_COLUMNS = List.of(
            "Invoice", "StockCode", "Description", "Quantity", "InvoiceDate", "Price", "Customer ID", "Country"
    );

    private static final String BYTE_ORDER_MARK = "\uFEFF";

    // A UTF-8 byte order mark decoded as ISO-8859-1
    private static final String LATIN1_BYTE_ORDER_MARK = "\u00EF\u00BB\u00BF";

    @Override
    public void handleLine(String line) {
        String header = stripByteOrderMark(line);
        List<String> actual = Arrays.stream(header.split(",", -1))
                .map(TransactionHeaderValidator::normalize)
                .collect(Collectors.toList());
        List<String> expected = EXPECTED_COLUMNS.stream()
                .map(TransactionHeaderValidator::normalize)
                .collect(Collectors.toList());

        if (!actual.equals(expected)) {
            throw new InvalidSourceFileException(
                    "Unexpected header '" + line + "', expected columns " + EXPECTED_COLUMNS);
        }
    }

    static String stripByteOrderMark(String line) {
        if (line.startsWith(BYTE_ORDER_MARK)) {
            return line.substring(BYTE_ORDER_MARK.length());
        }
        if (line.startsWith(LATIN1_BYTE_ORDER_MARK)) {
            return line.substring(LATIN1_BYTE_ORDER_MARK.length());
        }
        return line;
    }

    private static String normalize(String column) {
        return column.replace("\"", "").replaceAll("\\s+", "").toLowerCase(Locale.ROOT);
    }
}
