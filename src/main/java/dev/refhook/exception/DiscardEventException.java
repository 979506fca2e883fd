package dev.refhook.exception;

/**
 * An entity the event refers to does not exist (principal, pull request, repository
 * or commit). Redelivering the event cannot change that, so the listener logs it and
 * acknowledges the message.
 */
public class DiscardEventException extends RuntimeException {

    public DiscardEventException(String message) {
        super(message);
    }

    public static DiscardEventException of(String format, Object... args) {
        return new DiscardEventException(format.formatted(args));
    }
}
