package org.example.keygen.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.kafka.common.serialization.Serde;
import org.apache.kafka.common.serialization.Serdes;
import org.example.keygen.deadletter.DeadLetterEntry;
import org.example.keygen.model.JobRequest;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.support.serializer.JsonSerde;

@Configuration
public class JsonSerdeConfig {

    // Dead-lettered records carry the original JobRequest JSON, no type headers
    @Bean
    public Serde<JobRequest> jobRequestSerde(ObjectMapper objectMapper) {
        return new JsonSerde<>(JobRequest.class, objectMapper).noTypeInfo();
    }

    @Bean
    public Serde<DeadLetterEntry> deadLetterEntrySerde(ObjectMapper objectMapper) {
        return new JsonSerde<>(DeadLetterEntry.class, objectMapper).noTypeInfo();
    }

    @Bean
    public Serde<String> stringSerde() {
        return Serdes.String();
    }
}
