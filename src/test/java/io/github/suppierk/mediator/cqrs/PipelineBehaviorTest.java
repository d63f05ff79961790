package io.github.suppierk.mediator.cqrs;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.suppierk.test.GetOrderStatus;
import io.github.suppierk.test.MarkOrderReady;
import io.github.suppierk.test.PlaceOrder;
import org.junit.jupiter.api.Test;

class PipelineBehaviorTest {
  static final PipelineBehavior PASS_THROUGH =
      new PipelineBehavior() {
        @Override
        public <R> OperationResult<R> handle(
            DomainRequest<R> request, RequestHandlerDelegate<R> next) throws Exception {
          return next.proceed();
        }
      };

  @Test
  void behavior_must_apply_to_every_request_by_default() {
    assertTrue(PASS_THROUGH.appliesTo(new PlaceOrder("order-1", "alice")));
    assertTrue(PASS_THROUGH.appliesTo(new GetOrderStatus("order-1")));
  }

  @Test
  void scoped_behavior_must_apply_only_to_listed_request_classes() {
    final var scoped =
        PipelineBehavior.scopedTo(PASS_THROUGH, PlaceOrder.class, MarkOrderReady.class);

    assertTrue(scoped.appliesTo(new PlaceOrder("order-1", "alice")));
    assertTrue(scoped.appliesTo(new MarkOrderReady("order-1")));
    assertFalse(scoped.appliesTo(new GetOrderStatus("order-1")));
  }

  @Test
  void scoping_with_invalid_arguments_must_be_rejected() {
    assertThrows(
        IllegalArgumentException.class, () -> PipelineBehavior.scopedTo(null, PlaceOrder.class));
    assertThrows(IllegalArgumentException.class, () -> PipelineBehavior.scopedTo(PASS_THROUGH));
    assertThrows(
        IllegalArgumentException.class,
        () -> PipelineBehavior.scopedTo(PASS_THROUGH, PlaceOrder.class, null));
  }
}
