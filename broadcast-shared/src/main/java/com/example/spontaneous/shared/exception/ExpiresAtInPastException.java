package com.example.spontaneous.shared.exception;

import java.time.OffsetDateTime;

public class ExpiresAtInPastException extends InvalidBroadcastInputException {

    public ExpiresAtInPastException(OffsetDateTime expiresAt, OffsetDateTime now) {
        super("Expiration time " + expiresAt + " must be after the current time " + now);
    }
}
