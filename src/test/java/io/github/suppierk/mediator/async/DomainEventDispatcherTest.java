package io.github.suppierk.mediator.async;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.suppierk.test.OrderEvent.OrderReady;
import org.junit.jupiter.api.Test;

class DomainEventDispatcherTest {
  @Test
  void when_empty_dispatcher_is_requested_it_must_not_be_null_and_it_must_be_functional() {
    final var dispatcher = DomainEventDispatcher.empty();

    assertNotNull(dispatcher);

    final var report = dispatcher.dispatch(new OrderReady("order-1"));
    assertEquals(0, report.delivered());
    assertTrue(report.isFullyDelivered());
  }
}
