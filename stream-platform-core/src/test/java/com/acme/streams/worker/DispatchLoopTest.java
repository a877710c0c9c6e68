package com.acme.streams.worker;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.same;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import com.acme.streams.config.WorkerConfig;
import com.acme.streams.core.BrokerException;
import com.acme.streams.core.FetchTimeoutException;
import com.acme.streams.worker.DispatchListener.Signal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("DispatchLoop")
class DispatchLoopTest {

  private CancellationToken token;
  private ScriptedSubscription subscription;
  private List<Duration> sleeps;
  private Sleeper sleeper;
  private DispatchListener listener;

  @BeforeEach
  void setUp() {
    token = new CancellationToken();
    subscription = new ScriptedSubscription();
    sleeps = Collections.synchronizedList(new ArrayList<>());
    sleeper = sleeps::add;
    listener = mock(DispatchListener.class);
  }

  private DispatchLoop loop(MessageHandler handler) {
    WorkerConfig config =
        WorkerConfig.builder()
            .streamName("ORDERS")
            .subject("orders")
            .durableName("order-worker")
            .handler(handler)
            .dispatchListener(listener)
            .build();
    return new DispatchLoop(0, config, subscription, token, sleeper);
  }

  @Nested
  @DisplayName("Dispatching")
  class DispatchingTests {

    @Test
    @DisplayName("should ack exactly once and never nak when the handler succeeds")
    void testSuccessfulMessageIsAcked() {
      TestEnvelope envelope = TestEnvelope.of("{\"id\":1}");
      subscription.thenReturn(envelope).thenCancel(token);

      DispatchLoop loop = loop((ctx, env) -> {});
      loop.call();

      assertThat(envelope.ackCount()).isEqualTo(1);
      assertThat(envelope.nakCount()).isZero();
      assertThat(loop.ackedCount()).isEqualTo(1);
      verify(listener).onAck(envelope);
    }

    @Test
    @DisplayName("should nak exactly once and never ack when the handler throws")
    void testFailedMessageIsNakked() {
      TestEnvelope envelope = TestEnvelope.of("bad");
      IllegalStateException failure = new IllegalStateException("boom");
      subscription.thenReturn(envelope).thenCancel(token);

      DispatchLoop loop =
          loop(
              (ctx, env) -> {
                throw failure;
              });
      loop.call();

      assertThat(envelope.nakCount()).isEqualTo(1);
      assertThat(envelope.ackCount()).isZero();
      assertThat(loop.nakkedCount()).isEqualTo(1);
      verify(listener).onNak(envelope, failure);
    }

    @Test
    @DisplayName("should keep processing the rest of the batch and later batches after a failure")
    void testFailureIsIsolatedPerMessage() {
      TestEnvelope first = TestEnvelope.of("ok-1");
      TestEnvelope poison = TestEnvelope.of("poison");
      TestEnvelope third = TestEnvelope.of("ok-2");
      TestEnvelope later = TestEnvelope.of("ok-3");
      subscription.thenReturn(first, poison, third).thenReturn(later).thenCancel(token);

      DispatchLoop loop =
          loop(
              (ctx, env) -> {
                if (((TestEnvelope) env).text().equals("poison")) {
                  throw new IllegalArgumentException("cannot handle poison");
                }
              });
      loop.call();

      assertThat(first.ackCount()).isEqualTo(1);
      assertThat(poison.nakCount()).isEqualTo(1);
      assertThat(third.ackCount()).isEqualTo(1);
      assertThat(later.ackCount()).isEqualTo(1);
      assertThat(subscription.fetchCount()).isEqualTo(3);
    }

    @Test
    @DisplayName("should dispatch a batch sequentially in fetch order")
    void testBatchOrder() {
      List<String> seen = new ArrayList<>();
      subscription
          .thenReturn(TestEnvelope.of("a"), TestEnvelope.of("b"), TestEnvelope.of("c"))
          .thenCancel(token);

      loop((ctx, env) -> seen.add(((TestEnvelope) env).text())).call();

      assertThat(seen).containsExactly("a", "b", "c");
    }

    @Test
    @DisplayName("should pass a context carrying the stream, loop id and cancellation state")
    void testHandlerContext() {
      List<WorkerContext> contexts = new ArrayList<>();
      subscription.thenReturn(TestEnvelope.of("x")).thenCancel(token);

      loop((ctx, env) -> contexts.add(ctx)).call();

      assertThat(contexts).hasSize(1);
      WorkerContext ctx = contexts.get(0);
      assertThat(ctx.streamName()).isEqualTo("ORDERS");
      assertThat(ctx.loopId()).isZero();
      assertThat(ctx.isCancelled()).isTrue();
    }

    @Test
    @DisplayName("should finish a fetched batch even when cancelled in the middle of it")
    void testBatchCompletesAfterCancellation() {
      TestEnvelope first = TestEnvelope.of("first");
      TestEnvelope second = TestEnvelope.of("second");
      subscription.thenReturn(first, second);

      loop((ctx, env) -> token.cancel()).call();

      assertThat(first.ackCount()).isEqualTo(1);
      assertThat(second.ackCount()).isEqualTo(1);
      assertThat(subscription.fetchCount()).isEqualTo(1);
    }
  }

  @Nested
  @DisplayName("Acknowledgement failures")
  class AckFailureTests {

    @Test
    @DisplayName("should report a failed ack to the listener without retrying or stopping")
    void testAckFailureIsNotRetried() {
      IllegalStateException failure = new IllegalStateException("connection closed");
      TestEnvelope envelope = TestEnvelope.of("x").failingAckWith(failure);
      TestEnvelope next = TestEnvelope.of("y");
      subscription.thenReturn(envelope).thenReturn(next).thenCancel(token);

      DispatchLoop loop = loop((ctx, env) -> {});
      loop.call();

      verify(listener).onAckFailure(same(envelope), eq(Signal.ACK), same(failure));
      verify(listener, never()).onAck(envelope);
      assertThat(next.ackCount()).isEqualTo(1);
      assertThat(loop.ackedCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("should report a failed nak to the listener")
    void testNakFailure() {
      IllegalStateException failure = new IllegalStateException("connection closed");
      TestEnvelope envelope = TestEnvelope.of("x").failingAckWith(failure);
      subscription.thenReturn(envelope).thenCancel(token);

      loop(
              (ctx, env) -> {
                throw new RuntimeException("handler failed");
              })
          .call();

      verify(listener).onAckFailure(same(envelope), eq(Signal.NAK), same(failure));
      verify(listener, never()).onNak(any(), any());
    }
  }

  @Nested
  @DisplayName("Fetching")
  class FetchingTests {

    @Test
    @DisplayName("should retry immediately on three timeouts in a row without sleeping")
    void testTimeoutsRetryImmediately() {
      subscription
          .thenThrow(new FetchTimeoutException("timeout"))
          .thenThrow(new FetchTimeoutException("timeout"))
          .thenThrow(new FetchTimeoutException("timeout"))
          .thenCancel(token);

      DispatchLoop loop = loop((ctx, env) -> {});
      loop.call();

      assertThat(subscription.fetchCount()).isEqualTo(4);
      assertThat(sleeps).isEmpty();
      assertThat(loop.fetchErrorCount()).isZero();
      verify(listener, never()).onFetchError(any());
    }

    @Test
    @DisplayName("should treat an empty batch as an elapsed wait")
    void testEmptyBatchRetriesImmediately() {
      subscription.then(List::of).then(List::of).thenCancel(token);

      DispatchLoop loop = loop((ctx, env) -> {});
      loop.call();

      assertThat(subscription.fetchCount()).isEqualTo(3);
      assertThat(sleeps).isEmpty();
      assertThat(loop.fetchErrorCount()).isZero();
    }

    @Test
    @DisplayName("should back off exactly once per non-timeout fetch error")
    void testFetchErrorBacksOffOnce() {
      BrokerException failure = new BrokerException("no responders");
      TestEnvelope envelope = TestEnvelope.of("after-error");
      subscription.thenThrow(failure).thenReturn(envelope).thenCancel(token);

      DispatchLoop loop = loop((ctx, env) -> {});
      loop.call();

      assertThat(sleeps).containsExactly(Duration.ofSeconds(1));
      assertThat(loop.fetchErrorCount()).isEqualTo(1);
      assertThat(envelope.ackCount()).isEqualTo(1);
      verify(listener, times(1)).onFetchError(failure);
    }

    @Test
    @DisplayName("should not back off for an error raised after cancellation")
    void testErrorAfterCancellationStopsWithoutBackoff() {
      subscription.then(
          () -> {
            token.cancel();
            throw new IllegalStateException("subscription drained");
          });

      DispatchLoop loop = loop((ctx, env) -> {});
      loop.call();

      assertThat(sleeps).isEmpty();
      assertThat(loop.fetchErrorCount()).isZero();
      assertThat(loop.state()).isEqualTo(DispatchLoop.State.STOPPED);
    }

    @Test
    @DisplayName("should stop when interrupted during backoff")
    void testInterruptedBackoffStopsLoop() {
      AtomicInteger sleepCalls = new AtomicInteger();
      sleeper =
          duration -> {
            sleepCalls.incrementAndGet();
            throw new InterruptedException("shutdown");
          };
      subscription.thenThrow(new BrokerException("down"));

      DispatchLoop loop = loop((ctx, env) -> {});
      loop.call();

      assertThat(sleepCalls).hasValue(1);
      assertThat(loop.state()).isEqualTo(DispatchLoop.State.STOPPED);
      assertThat(Thread.interrupted()).isTrue();
    }
  }

  @Nested
  @DisplayName("Lifecycle")
  class LifecycleTests {

    @Test
    @DisplayName("should not fetch at all when cancelled before starting")
    void testCancelledBeforeStart() {
      token.cancel();

      DispatchLoop loop = loop((ctx, env) -> {});
      loop.call();

      assertThat(subscription.fetchCount()).isZero();
      assertThat(loop.state()).isEqualTo(DispatchLoop.State.STOPPED);
    }

    @Test
    @DisplayName("should start in FETCHING state")
    void testInitialState() {
      assertThat(loop((ctx, env) -> {}).state()).isEqualTo(DispatchLoop.State.FETCHING);
    }
  }
}
