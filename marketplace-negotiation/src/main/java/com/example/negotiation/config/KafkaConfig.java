package com.example.negotiation.config;

import com.example.negotiation.event.ConversationLifecycleEvent;
import com.example.negotiation.event.MessageDeliveryEvent;
import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.boot.autoconfigure.kafka.KafkaProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.core.ProducerFactory;

@Configuration
public class KafkaConfig {

    @Bean
    public ProducerFactory<String, ConversationLifecycleEvent> lifecycleEventProducerFactory(KafkaProperties properties) {
        return new DefaultKafkaProducerFactory<>(properties.buildProducerProperties(null));
    }

    @Bean
    public KafkaTemplate<String, ConversationLifecycleEvent> lifecycleEventKafkaTemplate(
            ProducerFactory<String, ConversationLifecycleEvent> lifecycleEventProducerFactory) {
        return new KafkaTemplate<>(lifecycleEventProducerFactory);
    }

    @Bean
    public ProducerFactory<String, MessageDeliveryEvent> deliveryEventProducerFactory(KafkaProperties properties) {
        return new DefaultKafkaProducerFactory<>(properties.buildProducerProperties(null));
    }

    @Bean
    public KafkaTemplate<String, MessageDeliveryEvent> deliveryEventKafkaTemplate(
            ProducerFactory<String, MessageDeliveryEvent> deliveryEventProducerFactory) {
        return new KafkaTemplate<>(deliveryEventProducerFactory);
    }

    @Bean
    public NewTopic lifecycleTopic(NegotiationProperties properties) {
        return TopicBuilder.name(properties.getKafka().getLifecycleTopic())
                .partitions(6)
                .replicas(1)
                .compact()
                .build();
    }

    @Bean
    public NewTopic deliveryTopic(NegotiationProperties properties) {
        return TopicBuilder.name(properties.getKafka().getDeliveryTopic())
                .partitions(12)
                .replicas(1)
                .build();
    }
}
