package com.acme.streams.sample;

import com.acme.streams.core.Jsons;
import com.acme.streams.core.PermanentException;
import com.acme.streams.spi.Envelope;
import com.acme.streams.worker.MessageHandler;
import com.acme.streams.worker.WorkerContext;
import jakarta.inject.Singleton;
import java.math.BigDecimal;
import lombok.extern.slf4j.Slf4j;

/** Sample handler for {@code orders.*} events; a failure here naks the message. */
@Slf4j
@Singleton
public class OrderEventHandler implements MessageHandler {

  @Override
  public void handle(WorkerContext context, Envelope envelope) {
    OrderEvent event = Jsons.fromBytes(envelope.payload(), OrderEvent.class);
    if (event.orderId() == null || event.orderId().isBlank()) {
      throw new PermanentException("Order event on " + envelope.subject() + " has no orderId");
    }
    if (event.amount() != null && event.amount().compareTo(BigDecimal.ZERO) < 0) {
      throw new PermanentException("Negative amount for order " + event.orderId());
    }
    log.info(
        "Processed order event: orderId={}, status={}, subject={}, attempt={}, loop={}",
        event.orderId(),
        event.status(),
        envelope.subject(),
        envelope.deliveryAttempt(),
        context.loopId());
  }
}
