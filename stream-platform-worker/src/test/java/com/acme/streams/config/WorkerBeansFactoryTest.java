package com.acme.streams.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.acme.streams.nats.NatsStreamBroker;
import com.acme.streams.spi.ConsumerDescriptor;
import com.acme.streams.spi.StreamBroker;
import com.acme.streams.spi.StreamDescriptor;
import com.acme.streams.spi.StreamSubscription;
import com.acme.streams.worker.StreamWorker;
import io.micronaut.context.ApplicationContext;
import io.nats.client.Connection;
import io.nats.client.JetStream;
import io.nats.client.JetStreamManagement;
import io.nats.client.Options;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("WorkerBeansFactory")
class WorkerBeansFactoryTest {

  private final WorkerBeansFactory factory = new WorkerBeansFactory();

  @Nested
  @DisplayName("Factory methods")
  class FactoryMethodTests {

    @Test
    @DisplayName("should build a NATS broker over the connection's JetStream contexts")
    void testStreamBroker() throws Exception {
      Connection connection = mock(Connection.class);
      when(connection.jetStreamManagement()).thenReturn(mock(JetStreamManagement.class));
      when(connection.jetStream()).thenReturn(mock(JetStream.class));

      assertThat(factory.streamBroker(connection)).isInstanceOf(NatsStreamBroker.class);
    }

    @Test
    @DisplayName("should provision and bind the worker from the bound properties")
    void testStreamWorker() {
      // Given
      StreamBroker broker = mock(StreamBroker.class);
      StreamSubscription subscription = mock(StreamSubscription.class);
      when(broker.lookupStream("ORDERS"))
          .thenReturn(new StreamDescriptor("ORDERS", "orders.>", StorageType.FILE));
      when(broker.pullSubscribe("ORDERS", "order-worker", "orders.>")).thenReturn(subscription);
      WorkerProperties properties = factory.workerProperties();
      properties.setStreamName("ORDERS");
      properties.setSubject("orders");
      properties.setDurableName("order-worker");

      // When
      StreamWorker worker = factory.streamWorker(broker, properties, (ctx, env) -> {});

      // Then
      assertThat(worker.config().streamName()).isEqualTo("ORDERS");
      verify(broker).addOrUpdateConsumer(eq("ORDERS"), any(ConsumerDescriptor.class));
    }

    @Test
    @DisplayName("should build client options from the NATS properties")
    void testConnectionOptions() {
      NatsProperties properties = factory.natsProperties();
      properties.setUrl("nats://nats.internal:4222");
      properties.setConnectionName("orders-worker");
      properties.setConnectionTimeout(Duration.ofSeconds(3));

      Options options = properties.toConnectionFactory().options();

      assertThat(options.getServers()).hasSize(1);
      assertThat(options.getServers().get(0).toString()).contains("nats.internal:4222");
      assertThat(options.getConnectionName()).isEqualTo("orders-worker");
      assertThat(options.getConnectionTimeout()).isEqualTo(Duration.ofSeconds(3));
      assertThat(options.getMaxReconnect()).isEqualTo(-1);
    }
  }

  @Nested
  @DisplayName("Application context")
  class ContextTests {

    @Test
    @DisplayName("should bind worker and nats properties and skip broker beans when disabled")
    void testBindingWhenDisabled() {
      try (ApplicationContext context =
          ApplicationContext.run(
              Map.of(
                  "worker.enabled", false,
                  "worker.stream-name", "PAYMENTS",
                  "worker.subject", "payments",
                  "worker.concurrency", 3,
                  "worker.ack-wait", "10s",
                  "worker.storage-type", "MEMORY",
                  "nats.url", "nats://broker:4222"),
              "test")) {

        WorkerProperties worker = context.getBean(WorkerProperties.class);
        assertThat(worker.isEnabled()).isFalse();
        assertThat(worker.getStreamName()).isEqualTo("PAYMENTS");
        assertThat(worker.getConcurrency()).isEqualTo(3);
        assertThat(worker.getAckWait()).isEqualTo(Duration.ofSeconds(10));
        assertThat(worker.getStorageType()).isEqualTo(StorageType.MEMORY);
        assertThat(context.getBean(NatsProperties.class).getUrl()).isEqualTo("nats://broker:4222");

        assertThat(context.containsBean(Connection.class)).isFalse();
        assertThat(context.containsBean(StreamWorker.class)).isFalse();
      }
    }
  }
}
