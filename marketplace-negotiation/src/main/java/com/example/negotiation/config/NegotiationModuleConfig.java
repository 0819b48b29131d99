package com.example.negotiation.config;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.time.Clock;
import org.springframework.boot.autoconfigure.jackson.Jackson2ObjectMapperBuilderCustomizer;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties({NegotiationProperties.class, NegotiationSecurityProperties.class})
public class NegotiationModuleConfig {

    /**
     * ISO-8601 instants and offer amounts written as plain decimals ({@code 100.50}, never {@code 1.005E+2}).
     */
    @Bean
    public Jackson2ObjectMapperBuilderCustomizer negotiationJacksonCustomizer() {
        return builder -> builder
                .modulesToInstall(JavaTimeModule.class)
                .featuresToDisable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .featuresToEnable(JsonGenerator.Feature.WRITE_BIGDECIMAL_AS_PLAIN);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
