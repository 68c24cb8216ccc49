package com.example.spontaneous.notification.exception;

import com.example.spontaneous.shared.dto.JoinRequestedEvent;
import lombok.Getter;

/**
 * Raised when a creator notification could not be delivered. The listener container
 * retries the record and finally routes it to the dead-letter topic.
 */
@Getter
public class NotificationDispatchException extends RuntimeException {

    private final transient JoinRequestedEvent failedEvent;

    public NotificationDispatchException(String message, Throwable cause, JoinRequestedEvent failedEvent) {
        super(message, cause);
        this.failedEvent = failedEvent;
    }
}
