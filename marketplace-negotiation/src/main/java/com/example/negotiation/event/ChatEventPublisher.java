package com.example.negotiation.event;

import com.example.negotiation.config.NegotiationProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

/**
 * Best-effort fan-out. A failing listener or broker never propagates to the caller, whose write has
 * already committed.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ChatEventPublisher {

    private final ObjectProvider<ChatEventListener> listeners;
    private final KafkaTemplate<String, ConversationLifecycleEvent> lifecycleEventKafkaTemplate;
    private final KafkaTemplate<String, MessageDeliveryEvent> deliveryEventKafkaTemplate;
    private final NegotiationProperties negotiationProperties;

    public void publishLifecycleEvent(ConversationLifecycleEvent event) {
        listeners.orderedStream().forEach(listener -> {
            try {
                listener.onLifecycleEvent(event);
            } catch (RuntimeException ex) {
                log.warn("Listener {} failed on lifecycle event {}", listener.getClass().getSimpleName(),
                        event.getEventId(), ex);
            }
        });
        send(lifecycleEventKafkaTemplate, negotiationProperties.getKafka().getLifecycleTopic(),
                event.getConversationId(), event, event.getEventId());
    }

    public void publishDeliveryEvent(MessageDeliveryEvent event) {
        listeners.orderedStream().forEach(listener -> {
            try {
                listener.onDeliveryEvent(event);
            } catch (RuntimeException ex) {
                log.warn("Listener {} failed on delivery event {}", listener.getClass().getSimpleName(),
                        event.getEventId(), ex);
            }
        });
        send(deliveryEventKafkaTemplate, negotiationProperties.getKafka().getDeliveryTopic(),
                event.getRecipientId(), event, event.getEventId());
    }

    private <T> void send(KafkaTemplate<String, T> template, String topic, String key, T event, String eventId) {
        try {
            template.send(topic, key, event).whenComplete((result, ex) -> {
                if (ex != null) {
                    log.warn("Failed to publish event {} to topic {}", eventId, topic, ex);
                }
            });
        } catch (RuntimeException ex) {
            log.warn("Failed to hand event {} to the Kafka producer for topic {}", eventId, topic, ex);
        }
    }
}
