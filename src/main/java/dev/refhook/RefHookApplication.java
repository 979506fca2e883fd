package dev.refhook;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * RefHook: pull-request webhook trigger service.
 *
 * <p>Architecture overview:
 * <pre>
 * [SQS per event kind] → PullReqEventListener → WebhookTriggerService (one handler per kind)
 *   → PullReqTriggerOrchestrator (principal → pull request → target repo → source repo)
 *   → payload builder (commit lookup, segments) → WebhookDispatcher → [SQS delivery queue]
 * </pre>
 *
 * <p>Key design decisions:
 * <ul>
 *   <li>Stateless: every trigger refetches all entities and commit info, so redelivered
 *       or reordered events are handled from scratch</li>
 *   <li>No local retries: NotFound discards the event, everything else goes back to SQS</li>
 *   <li>Delivery is owned downstream; the event id travels with the payload as dedup key</li>
 * </ul>
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class RefHookApplication {

    public static void main(String[] args) {
        SpringApplication.run(RefHookApplication.class, args);
    }
}
