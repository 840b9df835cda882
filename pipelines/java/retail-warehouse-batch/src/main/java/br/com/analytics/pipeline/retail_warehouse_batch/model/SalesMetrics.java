package br.com.analytics.pipeline.retail_warehouse_batch.model;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collection;

/**
 * Headline figures of the sales dashboard: total net sales and return rate.
 */
public record SalesMetrics(
        long factRows,
        long returnRows,
        BigDecimal totalNetSales
) {

    public static final int RETURN_RATE_SCALE = 4;

    /** Largest difference in net sales still treated as equal, absorbs floating point storage. */
    public static final BigDecimal NET_SALES_TOLERANCE = new BigDecimal("0.01");

    public static SalesMetrics of(Collection<FactSalesRow> facts) {
        long returns = 0;
        BigDecimal net = BigDecimal.ZERO;
        for (FactSalesRow fact : facts) {
            if (fact.isReturn()) {
                returns++;
            }
            net = net.add(fact.netAmount());
        }
        return new SalesMetrics(facts.size(), returns, net);
    }

    public BigDecimal returnRate() {
        if (factRows == 0) {
            return BigDecimal.ZERO.setScale(RETURN_RATE_SCALE);
        }
        return BigDecimal.valueOf(returnRows)
                .divide(BigDecimal.valueOf(factRows), RETURN_RATE_SCALE, RoundingMode.HALF_UP);
    }

    public boolean matches(SalesMetrics other) {
        return factRows == other.factRows
                && returnRows == other.returnRows
                && totalNetSales.subtract(other.totalNetSales).abs().compareTo(NET_SALES_TOLERANCE) <= 0;
    }
}
