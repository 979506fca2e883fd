package dev.refhook.config;

import io.awspring.cloud.sqs.config.SqsMessageListenerContainerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.services.sqs.SqsAsyncClient;

/**
 * Listener container for the event queues.
 *
 * <p>On shutdown the containers stop polling first, then wait up to
 * {@code refhook.events.shutdown-timeout} for running handlers to return before the
 * context closes. A handler is never cut off mid-lookup; a message whose handler did
 * not finish stays unacknowledged and is redelivered.
 */
@Configuration
public class SqsConfig {

    @Bean
    public SqsMessageListenerContainerFactory<Object> defaultSqsListenerContainerFactory(
            SqsAsyncClient sqsAsyncClient, EventProperties properties) {
        return SqsMessageListenerContainerFactory.builder()
                .configure(options -> options
                        .maxConcurrentMessages(properties.maxConcurrentMessages())
                        .maxMessagesPerPoll(Math.min(10, properties.maxConcurrentMessages()))
                        .listenerShutdownTimeout(properties.shutdownTimeout()))
                .sqsAsyncClient(sqsAsyncClient)
                .build();
    }
}
