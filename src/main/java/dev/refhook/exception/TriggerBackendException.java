package dev.refhook.exception;

/**
 * A store or transport failure while building a trigger. Propagated to the event bus
 * consumer so the message is redelivered after its visibility timeout.
 */
public class TriggerBackendException extends RuntimeException {

    public TriggerBackendException(String message, Throwable cause) {
        super(message, cause);
    }
}
