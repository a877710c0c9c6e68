package com.acme.streams.nats;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.acme.streams.config.DeliverPolicy;
import com.acme.streams.config.ReplayPolicy;
import com.acme.streams.config.StorageType;
import com.acme.streams.spi.AckPolicy;
import com.acme.streams.spi.ConsumerDescriptor;
import com.acme.streams.spi.StreamDescriptor;
import io.nats.client.api.ConsumerConfiguration;
import io.nats.client.api.StreamConfiguration;
import io.nats.client.api.StreamInfo;
import java.time.Duration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("NatsMappers")
class NatsMappersTest {

  @Test
  @DisplayName("should build a stream configuration with the wildcard subject and storage")
  void testStreamConfiguration() {
    StreamConfiguration config =
        NatsMappers.toStreamConfiguration(
            new StreamDescriptor("ORDERS", "orders.>", StorageType.MEMORY));

    assertThat(config.getName()).isEqualTo("ORDERS");
    assertThat(config.getSubjects()).containsExactly("orders.>");
    assertThat(config.getStorageType()).isEqualTo(io.nats.client.api.StorageType.Memory);
  }

  @Test
  @DisplayName("should read a stream descriptor back from stream info")
  void testStreamDescriptor() {
    StreamInfo info = mock(StreamInfo.class);
    when(info.getConfiguration())
        .thenReturn(
            StreamConfiguration.builder()
                .name("ORDERS")
                .subjects("orders.>", "returns.>")
                .storageType(io.nats.client.api.StorageType.File)
                .build());

    assertThat(NatsMappers.toStreamDescriptor(info))
        .isEqualTo(new StreamDescriptor("ORDERS", "orders.>,returns.>", StorageType.FILE));
  }

  @Test
  @DisplayName("should build a durable explicit-ack consumer configuration")
  void testConsumerConfiguration() {
    ConsumerConfiguration config =
        NatsMappers.toConsumerConfiguration(
            new ConsumerDescriptor(
                "order-worker",
                AckPolicy.EXPLICIT,
                Duration.ofSeconds(30),
                3,
                "orders.>",
                DeliverPolicy.LAST_PER_SUBJECT,
                ReplayPolicy.ORIGINAL));

    assertThat(config.getDurable()).isEqualTo("order-worker");
    assertThat(config.getAckPolicy()).isEqualTo(io.nats.client.api.AckPolicy.Explicit);
    assertThat(config.getAckWait()).isEqualTo(Duration.ofSeconds(30));
    assertThat(config.getMaxDeliver()).isEqualTo(3);
    assertThat(config.getFilterSubject()).isEqualTo("orders.>");
    assertThat(config.getDeliverPolicy())
        .isEqualTo(io.nats.client.api.DeliverPolicy.LastPerSubject);
    assertThat(config.getReplayPolicy()).isEqualTo(io.nats.client.api.ReplayPolicy.Original);
  }

  @Test
  @DisplayName("should default missing storage to file")
  void testNullStorage() {
    assertThat(NatsMappers.toNats((StorageType) null))
        .isEqualTo(io.nats.client.api.StorageType.File);
  }
}
