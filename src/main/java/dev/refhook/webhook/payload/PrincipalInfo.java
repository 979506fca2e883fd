package dev.refhook.webhook.payload;

import com.fasterxml.jackson.annotation.JsonProperty;
import dev.refhook.domain.entity.Principal;
import dev.refhook.domain.enums.PrincipalType;

/**
 * Public shape of a principal inside webhook payloads. The admin flag is not exposed.
 */
public record PrincipalInfo(
        long id,
        String uid,
        @JsonProperty("display_name") String displayName,
        String email,
        PrincipalType type,
        long created,
        long updated
) {
    public static PrincipalInfo from(Principal principal) {
        return new PrincipalInfo(principal.id(), principal.uid(), principal.displayName(),
                principal.email(), principal.type(), principal.created(), principal.updated());
    }
}
