package com.chatflow.presence.exception;

/**
 * An inbound frame could not be parsed or failed validation. Reported to the sender only.
 */
public class MalformedPayloadException extends RuntimeException {

    private final String event;

    public MalformedPayloadException(String event, String message) {
        super(message);
        this.event = event;
    }

    public MalformedPayloadException(String event, String message, Throwable cause) {
        super(message, cause);
        this.event = event;
    }

    public String getEvent() {
        return event;
    }
}
