package dev.refhook.infrastructure.aws;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.refhook.config.DeliveryProperties;
import dev.refhook.webhook.TriggerRequest;
import dev.refhook.webhook.WebhookDispatcher;
import io.awspring.cloud.sqs.operations.SqsTemplate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Hands assembled payloads to the delivery subsystem through its SQS queue.
 *
 * <p>The body is serialized here with the application ObjectMapper rather than left
 * to the template's converter, so the delivery side sees exactly the snake_case wire
 * shape. A send failure propagates; the trigger then fails
 * and the source event is redelivered.
 */
@Component
public class SqsWebhookDispatcher implements WebhookDispatcher {

    private static final Logger log = LoggerFactory.getLogger(SqsWebhookDispatcher.class);

    private final SqsTemplate sqsTemplate;
    private final ObjectMapper objectMapper;
    private final String queueName;

    public SqsWebhookDispatcher(SqsTemplate sqsTemplate, ObjectMapper objectMapper,
                                DeliveryProperties properties) {
        this.sqsTemplate = sqsTemplate;
        this.objectMapper = objectMapper;
        this.queueName = properties.queue();
    }

    @Override
    public void dispatch(TriggerRequest request) {
        String body;
        try {
            body = objectMapper.writeValueAsString(DeliveryEnvelope.of(request));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + request.trigger().value()
                    + " payload for event " + request.eventId(), e);
        }

        sqsTemplate.send(queueName, body);

        log.debug("Webhook trigger {} for event {} queued to {}",
                request.trigger().value(), request.eventId(), queueName);
    }
}
