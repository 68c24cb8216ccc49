package com.example.spontaneous.shared.util;

public final class Constants {

    private Constants() {}

    public static final String DLT_SUFFIX = "-dlt";

    public static final String USER_ID_HEADER = "X-User-Id";
    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_KEY = "correlation_id";

    public enum BroadcastStatus {
        ACTIVE,
        EXPIRED
    }

    public enum JoinRequestStatus {
        PENDING,
        ACCEPTED,
        REJECTED;

        public boolean isDecision() {
            return this == ACCEPTED || this == REJECTED;
        }
    }
}
