package org.example.keygen.queue;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.TopicPartition;
import org.example.keygen.config.KeygenProperties;
import org.example.keygen.model.JobRequest;
import org.example.keygen.model.KeyType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class JobPublisherTest {

    @Mock
    private KafkaTemplate<String, String> kafkaTemplate;

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void publishesJsonKeyedByRequestId() throws Exception {
        SendResult<String, String> sendResult = new SendResult<>(
                new ProducerRecord<>("keygen-requests", "req-1", "{}"),
                new RecordMetadata(new TopicPartition("keygen-requests", 0), 0L, 0, 0L, 0, 0));
        when(kafkaTemplate.send(anyString(), anyString(), anyString()))
                .thenReturn(CompletableFuture.completedFuture(sendResult));
        JobPublisher publisher = new JobPublisher(kafkaTemplate, objectMapper, new KeygenProperties());

        publisher.publish(new JobRequest("req-1", KeyType.RSA, 4096));

        ArgumentCaptor<String> value = ArgumentCaptor.forClass(String.class);
        verify(kafkaTemplate).send(eq("keygen-requests"), eq("req-1"), value.capture());
        assertThat(objectMapper.readTree(value.getValue()).get("request_id").asText()).isEqualTo("req-1");
        assertThat(objectMapper.readTree(value.getValue()).get("key_type").asText()).isEqualTo("rsa");
        assertThat(objectMapper.readTree(value.getValue()).get("key_bits").asInt()).isEqualTo(4096);
    }

    @Test
    void omitsKeyBitsForEd25519() throws Exception {
        JsonNode json = objectMapper.readTree(
                objectMapper.writeValueAsString(new JobRequest("req-2", KeyType.ED25519, null)));

        assertThat(json.get("key_type").asText()).isEqualTo("ed25519");
        assertThat(json.has("key_bits")).isFalse();
    }

    @Test
    void brokerFailureBecomesEnqueueException() {
        when(kafkaTemplate.send(anyString(), anyString(), anyString()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("broker down")));
        JobPublisher publisher = new JobPublisher(kafkaTemplate, objectMapper, new KeygenProperties());

        assertThatThrownBy(() -> publisher.publish(new JobRequest("req-3", KeyType.ED25519, null)))
                .isInstanceOf(JobEnqueueException.class)
                .hasRootCauseMessage("broker down")
                .extracting(e -> ((JobEnqueueException) e).getRequestId())
                .isEqualTo("req-3");
    }
}
