package com.acme.dispatch.kafka;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.util.Properties;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("KafkaClientFactory Tests")
class KafkaClientFactoryTest {

  @Test
  @DisplayName("Should configure producer for acknowledged, idempotent String records")
  void testProducerProperties() {
    // Given
    KafkaSettings settings = new KafkaSettings();
    settings.setBootstrapServers("broker-1:9092,broker-2:9092");

    // When
    Properties props = KafkaClientFactory.producerProperties(settings);

    // Then
    assertThat(props.get(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG))
        .isEqualTo("broker-1:9092,broker-2:9092");
    assertThat(props.get(ProducerConfig.ACKS_CONFIG)).isEqualTo("all");
    assertThat(props.get(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG)).isEqualTo(true);
  }

  @Test
  @DisplayName("Should configure consumer with group, offset reset and manual commits")
  void testConsumerProperties() {
    // Given
    KafkaSettings settings = new KafkaSettings();
    settings.setGroupId("dispatch-test");
    settings.setAutoOffsetReset("latest");

    // When
    Properties props = KafkaClientFactory.consumerProperties(settings);

    // Then
    assertThat(props.get(ConsumerConfig.GROUP_ID_CONFIG)).isEqualTo("dispatch-test");
    assertThat(props.get(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG)).isEqualTo("latest");
    assertThat(props.get(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG)).isEqualTo(false);
  }

  @Test
  @DisplayName("Should create a producer without contacting the broker")
  void testKafkaProducer_Creation() {
    // Given
    KafkaClientFactory factory = new KafkaClientFactory();

    // When
    Producer<String, String> producer = factory.kafkaProducer(new KafkaSettings());

    // Then
    try {
      assertThat(producer).isNotNull();
    } finally {
      producer.close(Duration.ZERO);
    }
  }
}
