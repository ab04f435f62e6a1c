package com.databricks.grpcbase.stream;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.util.NoSuchElementException;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

class StreamReceiverTest {

  @Test
  void testIterationEndsWhenClosedAndDrained() throws InterruptedException {
    ReceiverBuffer<String> buffer = new ReceiverBuffer<>(5);
    StreamReceiver<String> receiver = new StreamReceiver<>(buffer, () -> {});
    buffer.put("a");
    buffer.put("b");
    buffer.close();

    assertTrue(receiver.hasNext());
    assertTrue(receiver.hasNext());
    assertEquals("a", receiver.next());
    assertEquals("b", receiver.next());
    assertFalse(receiver.hasNext());
    assertThrows(NoSuchElementException.class, receiver::next);
    assertThrows(NoSuchElementException.class, receiver::receive);
    assertTrue(receiver.isDone());
  }

  @Test
  void testReceiveAndPollUsePeekedMessage() throws InterruptedException {
    ReceiverBuffer<String> buffer = new ReceiverBuffer<>(5);
    StreamReceiver<String> receiver = new StreamReceiver<>(buffer, () -> {});
    buffer.put("a");
    buffer.put("b");

    assertTrue(receiver.hasNext());
    assertEquals("a", receiver.receive());
    assertTrue(receiver.hasNext());
    assertEquals("b", receiver.poll(Duration.ZERO));
    assertNull(receiver.poll(Duration.ofMillis(10)));
    assertFalse(receiver.isDone());
  }

  @Test
  void testCloseDetachesReceiver() throws InterruptedException {
    AtomicInteger detached = new AtomicInteger();
    ReceiverBuffer<String> buffer = new ReceiverBuffer<>(5);
    StreamReceiver<String> receiver = new StreamReceiver<>(buffer, detached::incrementAndGet);
    buffer.put("a");

    receiver.close();

    assertEquals(1, detached.get());
    assertFalse(buffer.put("b"));
    assertEquals("a", receiver.receive());
    assertFalse(receiver.hasNext());
  }

  @Test
  @Timeout(5)
  void testInterruptEndsIteration() {
    ReceiverBuffer<String> buffer = new ReceiverBuffer<>(5);
    StreamReceiver<String> receiver = new StreamReceiver<>(buffer, () -> {});

    Thread.currentThread().interrupt();
    try {
      assertFalse(receiver.hasNext());
      assertTrue(Thread.currentThread().isInterrupted());
    } finally {
      Thread.interrupted();
    }
  }

  @Test
  void testIteratorIsSelf() {
    StreamReceiver<String> receiver = new StreamReceiver<>(new ReceiverBuffer<>(1), () -> {});
    assertSame(receiver, receiver.iterator());
  }
}
