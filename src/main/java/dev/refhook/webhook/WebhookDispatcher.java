package dev.refhook.webhook;

/**
 * Delivery subsystem entry point. Implementations own matching against configured
 * webhooks, HTTP delivery, retries and deduplication by event id. Whether the handoff
 * is synchronous is up to the implementation.
 */
public interface WebhookDispatcher {
    void dispatch(TriggerRequest request);
}
