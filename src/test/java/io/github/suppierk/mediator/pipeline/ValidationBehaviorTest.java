package io.github.suppierk.mediator.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.suppierk.mediator.cqrs.OperationResult;
import io.github.suppierk.test.GetOrderStatus;
import io.github.suppierk.test.PlaceOrder;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ValidationBehaviorTest {
  static final PlaceOrder VALID = new PlaceOrder("order-1", "alice");

  @Nested
  class Construction {
    @Test
    void null_arguments_must_be_rejected() {
      final var builder = ValidationBehavior.builder();

      assertThrows(
          IllegalArgumentException.class, () -> builder.addValidator(null, command -> List.of()));
      assertThrows(
          IllegalArgumentException.class, () -> builder.addValidator(PlaceOrder.class, null));
    }

    @Test
    void behavior_must_apply_only_to_validated_requests() {
      final var behavior =
          ValidationBehavior.builder().addValidator(PlaceOrder.class, command -> List.of()).build();

      assertTrue(behavior.appliesTo(VALID));
      assertFalse(behavior.appliesTo(new GetOrderStatus("order-1")));
    }
  }

  @Nested
  class Validation {
    @Test
    void valid_request_must_proceed() throws Exception {
      final var behavior =
          ValidationBehavior.builder().addValidator(PlaceOrder.class, command -> List.of()).build();

      assertEquals(
          OperationResult.created("order-1"),
          behavior.handle(VALID, () -> OperationResult.created("order-1")));
    }

    @Test
    void problems_of_every_validator_must_be_joined_and_stop_the_chain() throws Exception {
      final var proceeded = new AtomicInteger();
      final var behavior =
          ValidationBehavior.builder()
              .addValidator(PlaceOrder.class, command -> List.of("Order ID is too short"))
              .addValidator(
                  PlaceOrder.class, command -> List.of("Customer is unknown", "Kitchen is closed"))
              .build();

      final OperationResult<String> result =
          behavior.handle(
              VALID,
              () -> {
                proceeded.incrementAndGet();
                return OperationResult.created("order-1");
              });

      assertEquals(
          OperationResult.badRequest(
              String.join(
                  ValidationBehavior.MESSAGE_SEPARATOR,
                  "Order ID is too short",
                  "Customer is unknown",
                  "Kitchen is closed")),
          result);
      assertEquals(0, proceeded.get());
    }

    @Test
    void validator_returning_null_must_be_reported() {
      final var behavior =
          ValidationBehavior.builder().addValidator(PlaceOrder.class, command -> null).build();

      assertThrows(
          IllegalStateException.class,
          () -> behavior.handle(VALID, () -> OperationResult.created("order-1")));
    }
  }
}
