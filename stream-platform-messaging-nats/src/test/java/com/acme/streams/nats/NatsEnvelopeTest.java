package com.acme.streams.nats;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.nats.client.Message;
import io.nats.client.impl.Headers;
import io.nats.client.impl.NatsJetStreamMetaData;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("NatsEnvelope")
class NatsEnvelopeTest {

  @Mock private Message message;

  private NatsEnvelope envelope;

  @BeforeEach
  void setUp() {
    envelope = new NatsEnvelope(message);
  }

  @Test
  @DisplayName("should expose subject and payload")
  void testSubjectAndPayload() {
    when(message.getSubject()).thenReturn("orders.created");
    when(message.getData()).thenReturn("{}".getBytes(StandardCharsets.UTF_8));

    assertThat(envelope.subject()).isEqualTo("orders.created");
    assertThat(new String(envelope.payload(), StandardCharsets.UTF_8)).isEqualTo("{}");
  }

  @Test
  @DisplayName("should return an empty payload when the message has no data")
  void testNullPayload() {
    assertThat(envelope.payload()).isEmpty();
  }

  @Test
  @DisplayName("should keep the first value of multi-valued headers")
  void testHeaders() {
    Headers headers = new Headers().add("trace-id", "t-1", "t-2").add("tenant", "acme");
    when(message.getHeaders()).thenReturn(headers);

    assertThat(envelope.headers()).containsEntry("trace-id", "t-1").containsEntry("tenant", "acme");
  }

  @Test
  @DisplayName("should report no headers when the message has none")
  void testNoHeaders() {
    assertThat(envelope.headers()).isEmpty();
  }

  @Test
  @DisplayName("should read the delivery attempt from JetStream metadata")
  void testDeliveryAttempt() {
    NatsJetStreamMetaData metaData = mock(NatsJetStreamMetaData.class);
    when(metaData.deliveredCount()).thenReturn(3L);
    when(message.metaData()).thenReturn(metaData);

    assertThat(envelope.deliveryAttempt()).isEqualTo(3);
  }

  @Test
  @DisplayName("should count a message without metadata as the first attempt")
  void testDeliveryAttemptWithoutMetadata() {
    when(message.metaData()).thenThrow(new IllegalStateException("not a JetStream message"));

    assertThat(envelope.deliveryAttempt()).isEqualTo(1);
  }

  @Test
  @DisplayName("should delegate ack and nak to the message")
  void testAckAndNak() {
    envelope.ack();
    envelope.nak();

    verify(message).ack();
    verify(message).nak();
  }
}
