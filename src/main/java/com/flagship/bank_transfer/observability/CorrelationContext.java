package com.flagship.bank_transfer.observability;

import org.slf4j.MDC;

import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Logging context of a banking request: correlation id, authenticated user and
 * the transfer being processed, all carried in the SLF4J MDC and printed by the
 * logback pattern.
 *
 * A caller-supplied correlation id is only accepted if it is short and plain;
 * anything else is replaced so request headers cannot forge log lines.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String USERNAME_MDC_KEY = "username";
    public static final String TRANSFER_ID_MDC_KEY = "transferId";

    private static final Pattern ACCEPTED_ID = Pattern.compile("[A-Za-z0-9._-]{1,64}");

    private CorrelationContext() {
    }

    /**
     * Binds the request's correlation id, generating one when the header is
     * missing or unusable.
     *
     * @return the id now in effect, to be echoed on the response
     */
    public static String begin(String requestedId) {
        String id = requestedId != null && ACCEPTED_ID.matcher(requestedId).matches()
                ? requestedId
                : generateCorrelationId();
        MDC.put(CORRELATION_ID_MDC_KEY, id);
        return id;
    }

    public static String getCorrelationId() {
        return MDC.get(CORRELATION_ID_MDC_KEY);
    }

    public static void bindUser(String username) {
        MDC.put(USERNAME_MDC_KEY, username);
    }

    public static void bindTransfer(String transferId) {
        MDC.put(TRANSFER_ID_MDC_KEY, transferId);
    }

    public static void unbindTransfer() {
        MDC.remove(TRANSFER_ID_MDC_KEY);
    }

    public static void end() {
        MDC.remove(CORRELATION_ID_MDC_KEY);
        MDC.remove(USERNAME_MDC_KEY);
        MDC.remove(TRANSFER_ID_MDC_KEY);
    }

    static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
