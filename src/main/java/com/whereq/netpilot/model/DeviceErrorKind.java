package com.whereq.netpilot.model;

import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.util.concurrent.TimeoutException;

/**
 * Classification of per-device execution failures.
 * <p>Transport implementations report the kind explicitly; {@link #categorize(Throwable)}
 * covers exceptions that escape a transport without one.
 */
public enum DeviceErrorKind {

    AUTH_FAILURE("Authentication failed"),
    UNREACHABLE("Device unreachable"),
    TIMEOUT("Timed out"),
    PROTOCOL_ERROR("Protocol error"),
    DEVICE_REJECTED("Rejected by device");

    private final String description;

    DeviceErrorKind(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    /** Order matters: timeouts are checked before generic network errors. */
    public static DeviceErrorKind categorize(Throwable error) {
        if (error == null) {
            return PROTOCOL_ERROR;
        }
        if (error instanceof TimeoutException || error instanceof SocketTimeoutException) {
            return TIMEOUT;
        }
        if (error instanceof ConnectException
                || error instanceof NoRouteToHostException
                || error instanceof UnknownHostException) {
            return UNREACHABLE;
        }
        if (messageContains(error, "authentication", "permission denied", "invalid credentials", "login failed")) {
            return AUTH_FAILURE;
        }
        if (error.getCause() != null && error.getCause() != error) {
            DeviceErrorKind byCause = categorize(error.getCause());
            if (byCause != PROTOCOL_ERROR) {
                return byCause;
            }
        }
        return PROTOCOL_ERROR;
    }

    private static boolean messageContains(Throwable t, String... keywords) {
        String msg = t.getMessage();
        if (msg == null) {
            return false;
        }
        String lower = msg.toLowerCase();
        for (String k : keywords) {
            if (lower.contains(k)) {
                return true;
            }
        }
        return false;
    }
}
