package dev.refhook.domain.event;

/**
 * Envelope delivered by the event bus. {@code id} is globally unique and is forwarded
 * as the deduplication key for downstream delivery tracking; the bus delivers at least
 * once, so the same id may arrive more than once.
 */
public record Event<T>(String id, T payload) {
    public Event {
        if (id == null || id.isBlank()) throw new IllegalArgumentException("event id required");
        if (payload == null) throw new IllegalArgumentException("event payload required");
    }
}
