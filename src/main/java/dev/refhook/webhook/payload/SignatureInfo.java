package dev.refhook.webhook.payload;

import com.fasterxml.jackson.annotation.JsonFormat;
import dev.refhook.domain.valueobject.Signature;

import java.time.Instant;

/**
 * Commit author or committer. {@code when} is always written as an ISO-8601 instant,
 * whatever the mapper's date settings.
 */
public record SignatureInfo(IdentityInfo identity,
                            @JsonFormat(shape = JsonFormat.Shape.STRING) Instant when) {
    public static SignatureInfo from(Signature signature) {
        if (signature == null) return null;
        IdentityInfo identity = signature.identity() == null ? null
                : new IdentityInfo(signature.identity().name(), signature.identity().email());
        return new SignatureInfo(identity, signature.when());
    }
}
