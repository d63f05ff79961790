package io.github.suppierk.mediator.jooq;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.suppierk.mediator.data.ConcurrencyConflictException;
import io.github.suppierk.mediator.data.EventSourcedRepository;
import io.github.suppierk.mediator.data.StoredEvent;
import io.github.suppierk.mediator.serialization.JsonEventSerializer;
import io.github.suppierk.test.H2Database;
import io.github.suppierk.test.Order;
import io.github.suppierk.test.OrderEvent;
import io.github.suppierk.test.OrderEvent.OrderCancelled;
import io.github.suppierk.test.OrderEvent.OrderPlaced;
import io.github.suppierk.test.OrderEvent.OrderReady;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.jooq.DSLContext;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class JooqEventStoreTest {
  static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");
  static final JsonEventSerializer SERIALIZER =
      new JsonEventSerializer(
          new ObjectMapper(), List.of(OrderPlaced.class, OrderReady.class, OrderCancelled.class));

  static DSLContext dsl;

  JooqEventStore eventStore;

  @BeforeAll
  static void openDatabase() {
    dsl = H2Database.open("jooq_event_store_test", H2Database.EVENT_STORE_SQL);
  }

  @BeforeEach
  void setUp() {
    dsl.deleteFrom(JooqEventStore.EVENT_STORE).execute();
    eventStore =
        new JooqEventStore(
            DslContextProvider.dslContextIdentity(dsl),
            SERIALIZER,
            Clock.fixed(NOW, ZoneOffset.UTC));
  }

  @Test
  void when_any_of_the_constructor_arguments_is_null_illegal_argument_must_be_thrown() {
    final var provider = DslContextProvider.dslContextIdentity(dsl);

    assertThrows(IllegalArgumentException.class, () -> new JooqEventStore(null, SERIALIZER));
    assertThrows(IllegalArgumentException.class, () -> new JooqEventStore(provider, null));
    assertThrows(
        IllegalArgumentException.class, () -> new JooqEventStore(provider, SERIALIZER, null));
  }

  @Nested
  class Appending {
    @Test
    void events_must_be_stored_with_consecutive_sequence_numbers() {
      assertEquals(
          2,
          eventStore.append(
              "order-1",
              0,
              List.of(new OrderPlaced("order-1", "alice"), new OrderReady("order-1"))));

      final List<StoredEvent> stream = eventStore.readStream("order-1");

      assertEquals(
          List.of(
              new StoredEvent(
                  "order-1", 1, "OrderPlaced", new OrderPlaced("order-1", "alice"), NOW),
              new StoredEvent("order-1", 2, "OrderReady", new OrderReady("order-1"), NOW)),
          stream);
      assertEquals(2, eventStore.currentVersion("order-1"));
      assertTrue(eventStore.containsStream("order-1"));
    }

    @Test
    void stale_expected_version_must_be_rejected_without_writing() {
      eventStore.append("order-1", 0, List.of(new OrderPlaced("order-1", "alice")));

      final var exception =
          assertThrows(
              ConcurrencyConflictException.class,
              () ->
                  eventStore.append(
                      "order-1", 0, List.of(new OrderCancelled("order-1", "Duplicate"))));

      assertEquals("order-1", exception.getResource());
      assertEquals(0, exception.getExpectedVersion());
      assertEquals(1, exception.getActualVersion());
      assertEquals(1, eventStore.currentVersion("order-1"));
    }

    @Test
    void empty_append_must_only_verify_the_version() {
      assertEquals(0, eventStore.append("order-1", 0, List.of()));
      assertThrows(
          ConcurrencyConflictException.class, () -> eventStore.append("order-1", 3, List.of()));
      assertFalse(eventStore.containsStream("order-1"));
    }

    @Test
    void invalid_arguments_must_be_rejected() {
      assertThrows(
          IllegalArgumentException.class,
          () -> eventStore.append(null, 0, List.of(new OrderReady("order-1"))));
      assertThrows(
          IllegalArgumentException.class,
          () -> eventStore.append("order-1", -1, List.of(new OrderReady("order-1"))));
      assertThrows(IllegalArgumentException.class, () -> eventStore.append("order-1", 0, null));
    }
  }

  @Nested
  class Reading {
    @Test
    void stream_must_be_read_from_the_requested_version() {
      eventStore.append(
          "order-1",
          0,
          List.of(
              new OrderPlaced("order-1", "alice"),
              new OrderReady("order-1"),
              new OrderCancelled("order-1", "Never picked up")));
      eventStore.append("order-2", 0, List.of(new OrderPlaced("order-2", "bob")));

      final var tail = eventStore.readStream("order-1", 1);

      assertEquals(List.of(2L, 3L), tail.stream().map(StoredEvent::sequence).toList());
      assertEquals(new OrderCancelled("order-1", "Never picked up"), tail.get(1).event());
    }

    @Test
    void missing_stream_must_be_empty() {
      assertTrue(eventStore.readStream("order-404").isEmpty());
      assertEquals(0, eventStore.currentVersion("order-404"));
    }
  }

  @Test
  void event_sourced_repository_must_work_on_top_of_the_store() {
    final var orders =
        new EventSourcedRepository<Order, String, OrderEvent>(
            eventStore, Order::blank, OrderEvent.class);

    orders.save(Order.place("order-1", "alice"));
    final var loaded = orders.getById("order-1").orElseThrow();
    loaded.markReady();
    orders.save(loaded);

    final var reloaded = orders.getById("order-1").orElseThrow();
    assertEquals(Order.Status.READY, reloaded.getStatus());
    assertEquals("alice", reloaded.getCustomer());
    assertEquals(2, reloaded.getVersion());
  }
}
