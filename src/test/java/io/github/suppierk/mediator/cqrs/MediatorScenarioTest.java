package io.github.suppierk.mediator.cqrs;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.suppierk.mediator.async.SubscriberDomainEventDispatcher;
import io.github.suppierk.mediator.data.EventSourcedRepository;
import io.github.suppierk.mediator.data.InMemoryEventStore;
import io.github.suppierk.mediator.data.StoredEvent;
import io.github.suppierk.mediator.domain.DomainEvent;
import io.github.suppierk.mediator.pipeline.LoggingBehavior;
import io.github.suppierk.mediator.pipeline.UnitOfWorkBehavior;
import io.github.suppierk.mediator.pipeline.ValidationBehavior;
import io.github.suppierk.test.GetOrderStatus;
import io.github.suppierk.test.MarkOrderReady;
import io.github.suppierk.test.Order;
import io.github.suppierk.test.OrderEvent;
import io.github.suppierk.test.OrderEvent.OrderCancelled;
import io.github.suppierk.test.OrderEvent.OrderPlaced;
import io.github.suppierk.test.OrderEvent.OrderReady;
import io.github.suppierk.test.OrderHandlers;
import io.github.suppierk.test.PlaceOrder;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Drives the whole pipeline: validation, logging, unit of work and event dispatch. */
class MediatorScenarioTest {
  InMemoryEventStore eventStore;
  EventSourcedRepository<Order, String, OrderEvent> orders;
  List<OrderEvent> dispatched;

  @BeforeEach
  void setUp() {
    eventStore = new InMemoryEventStore();
    orders = new EventSourcedRepository<>(eventStore, Order::blank, OrderEvent.class);
    dispatched = new CopyOnWriteArrayList<>();
  }

  Mediator mediator(PipelineBehavior... innermost) {
    final var dispatcher =
        SubscriberDomainEventDispatcher.builder()
            .subscribe(OrderPlaced.class, dispatched::add)
            .subscribe(OrderReady.class, dispatched::add)
            .build();

    final var validation =
        ValidationBehavior.builder()
            .addValidator(
                PlaceOrder.class,
                command ->
                    command.customer() == null || command.customer().isBlank()
                        ? List.of("Customer must not be blank")
                        : List.of())
            .build();

    final var builder =
        Mediator.builder()
            .addBehavior(validation)
            .addBehavior(new LoggingBehavior())
            .addBehavior(
                PipelineBehavior.scopedTo(
                    new UnitOfWorkBehavior(dispatcher), PlaceOrder.class, MarkOrderReady.class))
            .addHandler(new OrderHandlers.PlaceOrderHandler(orders))
            .addHandler(new OrderHandlers.MarkOrderReadyHandler(orders))
            .addHandler(new OrderHandlers.GetOrderStatusHandler(orders))
            .eventDispatcher(dispatcher);

    for (PipelineBehavior behavior : innermost) {
      builder.addBehavior(behavior);
    }

    return builder.build();
  }

  List<DomainEvent<?>> storedEvents(String orderId) {
    return eventStore.readStream(orderId).stream().map(StoredEvent::event).toList();
  }

  @Nested
  class HappyPath {
    @Test
    void placing_and_readying_order_must_persist_and_dispatch_both_events() {
      final var mediator = mediator();

      assertEquals(
          OperationResult.created("order-1"),
          mediator.execute(new PlaceOrder("order-1", "alice")));
      assertEquals(OperationResult.ok(2L), mediator.execute(new MarkOrderReady("order-1")));

      assertEquals(
          List.of(new OrderPlaced("order-1", "alice"), new OrderReady("order-1")),
          storedEvents("order-1"));
      assertEquals(
          List.of(new OrderPlaced("order-1", "alice"), new OrderReady("order-1")), dispatched);
      assertEquals(
          OperationResult.ok(Order.Status.READY),
          mediator.execute(new GetOrderStatus("order-1")));
    }

    @Test
    void placing_the_same_order_twice_must_report_conflict() {
      final var mediator = mediator();

      mediator.execute(new PlaceOrder("order-1", "alice"));
      final var second = mediator.execute(new PlaceOrder("order-1", "bob"));

      assertEquals(OperationStatus.CONFLICT, second.getStatus());
      assertEquals(1, eventStore.currentVersion("order-1"));
      assertEquals(List.of(new OrderPlaced("order-1", "alice")), dispatched);
    }
  }

  @Nested
  class Failures {
    @Test
    void invalid_command_must_not_reach_the_handler() {
      final var result = mediator().execute(new PlaceOrder("order-1", " "));

      assertEquals(OperationResult.badRequest("Customer must not be blank"), result);
      assertFalse(eventStore.containsStream("order-1"));
      assertTrue(dispatched.isEmpty());
    }

    @Test
    void business_failure_must_not_persist_or_dispatch_anything() {
      final var mediator = mediator();

      assertEquals(
          OperationStatus.NOT_FOUND, mediator.execute(new MarkOrderReady("order-1")).getStatus());

      mediator.execute(new PlaceOrder("order-1", "alice"));
      mediator.execute(new MarkOrderReady("order-1"));
      dispatched.clear();

      assertEquals(
          OperationStatus.BAD_REQUEST,
          mediator.execute(new MarkOrderReady("order-1")).getStatus());
      assertEquals(2, eventStore.currentVersion("order-1"));
      assertTrue(dispatched.isEmpty());
    }

    @Test
    void concurrent_append_must_turn_into_conflict_without_dispatch() {
      final PipelineBehavior concurrentWriter =
          new PipelineBehavior() {
            @Override
            public <R> OperationResult<R> handle(
                DomainRequest<R> request, RequestHandlerDelegate<R> next) throws Exception {
              final OperationResult<R> result = next.proceed();
              eventStore.append("order-1", 1, List.of(new OrderCancelled("order-1", "No stock")));
              return result;
            }
          };

      mediator().execute(new PlaceOrder("order-1", "alice"));
      dispatched.clear();

      final var result =
          mediator(PipelineBehavior.scopedTo(concurrentWriter, MarkOrderReady.class))
              .execute(new MarkOrderReady("order-1"));

      assertEquals(OperationStatus.CONFLICT, result.getStatus());
      assertEquals(
          List.of(
              new OrderPlaced("order-1", "alice"), new OrderCancelled("order-1", "No stock")),
          storedEvents("order-1"));
      assertTrue(dispatched.isEmpty());
    }
  }
}
