package com.netcracker.core.tagsync.client;

import lombok.Getter;

import java.util.List;

/**
 * Failure reported by the remote directory service.
 * <p>
 * {@code status} is the HTTP status, or {@code 0} when the call failed below HTTP, in which case
 * {@code errorCode} names the network condition (e.g. {@code ECONNRESET}). {@code reasons} are the
 * machine-readable reasons of the API error payload.
 */
@Getter
public class RemoteApiException extends RuntimeException {
    private final String operation;
    private final int status;
    private final String errorCode;
    private final List<String> reasons;

    public RemoteApiException(String operation, int status, String errorCode, List<String> reasons, String message) {
        super(format(operation, status, errorCode, reasons, message));
        this.operation = operation;
        this.status = status;
        this.errorCode = errorCode;
        this.reasons = reasons == null ? List.of() : List.copyOf(reasons);
    }

    public static RemoteApiException ofStatus(String operation, int status, String message) {
        return new RemoteApiException(operation, status, null, List.of(), message);
    }

    public static RemoteApiException ofStatus(String operation, int status, List<String> reasons, String message) {
        return new RemoteApiException(operation, status, null, reasons, message);
    }

    public static RemoteApiException ofNetworkError(String operation, String errorCode, String message) {
        return new RemoteApiException(operation, 0, errorCode, List.of(), message);
    }

    private static String format(String operation, int status, String errorCode, List<String> reasons, String message) {
        StringBuilder sb = new StringBuilder(operation == null ? "remote call" : operation).append(" failed: ");
        sb.append(status > 0 ? "status=" + status : "status=unknown");
        if (errorCode != null) {
            sb.append("; code=").append(errorCode);
        }
        sb.append("; message=").append(message);
        if (reasons != null && !reasons.isEmpty()) {
            sb.append("; reasons=").append(reasons);
        }
        return sb.toString();
    }
}
