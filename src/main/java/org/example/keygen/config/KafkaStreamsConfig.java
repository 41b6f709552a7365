package org.example.keygen.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.annotation.EnableKafkaStreams;

// Streams settings come from spring.kafka.streams.* in application.yml
@Configuration
@EnableKafkaStreams
public class KafkaStreamsConfig {
}
