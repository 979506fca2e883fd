package dev.refhook.exception;

import java.util.concurrent.CancellationException;

/**
 * The trigger was cancelled mid-lookup (thread interrupted, or a collaborator reported
 * cancellation). Not a failure of the event: it is neither logged as an error nor
 * retried here.
 */
public class TriggerCancelledException extends RuntimeException {

    public TriggerCancelledException(String message) {
        super(message);
    }

    public TriggerCancelledException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Wraps a collaborator's cancellation. If an {@link InterruptedException} sits in the
     * cause chain its thrower cleared the interrupt flag, so it is set again here.
     */
    public static TriggerCancelledException wrap(String message, Throwable cause) {
        for (Throwable cur = cause; cur != null; cur = cur.getCause()) {
            if (cur instanceof InterruptedException) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        return new TriggerCancelledException(message, cause);
    }

    /**
     * True if {@code t} or any of its causes signals cancellation. Reactor wraps an
     * interrupted {@code block()} in a plain RuntimeException, hence the cause walk.
     */
    public static boolean isCancellation(Throwable t) {
        for (Throwable cur = t; cur != null; cur = cur.getCause()) {
            if (cur instanceof InterruptedException || cur instanceof CancellationException
                    || cur instanceof TriggerCancelledException) {
                return true;
            }
        }
        return false;
    }
}
