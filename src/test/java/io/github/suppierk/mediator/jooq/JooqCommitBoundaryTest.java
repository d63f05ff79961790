package io.github.suppierk.mediator.jooq;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.suppierk.mediator.async.DomainEventDispatcher;
import io.github.suppierk.mediator.cqrs.OperationResult;
import io.github.suppierk.mediator.cqrs.OperationStatus;
import io.github.suppierk.mediator.data.EventSourcedRepository;
import io.github.suppierk.mediator.pipeline.UnitOfWorkBehavior;
import io.github.suppierk.mediator.serialization.JsonEventSerializer;
import io.github.suppierk.test.Customer;
import io.github.suppierk.test.H2Database;
import io.github.suppierk.test.Order;
import io.github.suppierk.test.OrderEvent;
import io.github.suppierk.test.OrderEvent.OrderCancelled;
import io.github.suppierk.test.OrderEvent.OrderPlaced;
import io.github.suppierk.test.OrderEvent.OrderReady;
import io.github.suppierk.test.PlaceOrder;
import java.util.List;
import org.jooq.DSLContext;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class JooqCommitBoundaryTest {
  static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

  static DSLContext dsl;

  JooqEventStore eventStore;
  EventSourcedRepository<Order, String, OrderEvent> orders;
  JooqStateRepositoryTest.CustomerRepository customers;
  JooqCommitBoundary commitBoundary;

  @BeforeAll
  static void openDatabase() {
    dsl =
        H2Database.open(
            "jooq_commit_boundary_test", H2Database.EVENT_STORE_SQL, H2Database.ENTITY_STATE_SQL);
  }

  @BeforeEach
  void setUp() {
    dsl.deleteFrom(JooqEventStore.EVENT_STORE).execute();
    dsl.deleteFrom(JooqStateRepository.ENTITY_STATE).execute();

    final var provider = DslContextProvider.dslContextIdentity(dsl);
    eventStore =
        new JooqEventStore(
            provider,
            new JsonEventSerializer(
                OBJECT_MAPPER, List.of(OrderPlaced.class, OrderReady.class, OrderCancelled.class)));
    orders = new EventSourcedRepository<>(eventStore, Order::blank, OrderEvent.class);
    customers = new JooqStateRepositoryTest.CustomerRepository(provider);
    commitBoundary = new JooqCommitBoundary(dsl);
  }

  @Test
  void when_any_of_the_arguments_is_null_illegal_argument_must_be_thrown() {
    assertThrows(IllegalArgumentException.class, () -> new JooqCommitBoundary(null));
    assertThrows(IllegalArgumentException.class, () -> commitBoundary.commit(null));
  }

  @Test
  void successful_persistence_must_be_committed() {
    commitBoundary.commit(
        () -> {
          customers.save(new Customer("c-1", "Alice"));
          orders.save(Order.place("order-1", "c-1"));
        });

    assertTrue(customers.contains("c-1"));
    assertEquals(1, eventStore.currentVersion("order-1"));
  }

  @Test
  void failing_persistence_must_roll_back_every_write() {
    final var failure = new IllegalStateException("Disk is full");

    final var thrown =
        assertThrows(
            IllegalStateException.class,
            () ->
                commitBoundary.commit(
                    () -> {
                      customers.save(new Customer("c-1", "Alice"));
                      orders.save(Order.place("order-1", "c-1"));
                      throw failure;
                    }));

    assertSame(failure, thrown);
    assertFalse(customers.contains("c-1"));
    assertFalse(eventStore.containsStream("order-1"));
  }

  @Test
  void conflicting_unit_of_work_must_leave_no_partial_writes() throws Exception {
    eventStore.append("order-1", 0, List.of(new OrderPlaced("order-1", "bob")));
    final var behavior = new UnitOfWorkBehavior(DomainEventDispatcher.empty(), commitBoundary);

    final var result =
        behavior.handle(
            new PlaceOrder("order-1", "c-1"),
            () -> {
              customers.add(new Customer("c-1", "Alice"));
              orders.add(Order.place("order-1", "c-1"));
              return OperationResult.created("order-1");
            });

    assertEquals(OperationStatus.CONFLICT, result.getStatus());
    assertFalse(customers.contains("c-1"));
    assertEquals(1, eventStore.currentVersion("order-1"));
  }
}
