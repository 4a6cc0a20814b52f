package com.flagship.bank_ledger.observability;

import java.util.UUID;

/**
 * Header and MDC key names used to trace a request through the ledger.
 *
 * The correlation id is set per HTTP request by {@link CorrelationIdFilter};
 * transfer and account ids are added around individual ledger operations.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String TRANSFER_ID_MDC_KEY = "transferId";
    public static final String ACCOUNT_ID_MDC_KEY = "accountId";

    private static final int MAX_INBOUND_LENGTH = 64;

    private CorrelationContext() {
    }

    /**
     * Short random id, readable in log lines.
     */
    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    /**
     * Accepts a client supplied id when it is present and reasonably sized,
     * otherwise generates a fresh one.
     */
    public static String sanitize(String inbound) {
        if (inbound == null || inbound.isBlank() || inbound.length() > MAX_INBOUND_LENGTH) {
            return generateCorrelationId();
        }
        return inbound.trim();
    }
}
