package io.github.suppierk.test;

import io.github.suppierk.mediator.domain.DomainEvent;

/** Sample sealed event hierarchy of the {@link Order} aggregate. */
public sealed interface OrderEvent extends DomainEvent<String> {
  record OrderPlaced(String aggregateId, String customer) implements OrderEvent {}

  record OrderReady(String aggregateId) implements OrderEvent {}

  record OrderCancelled(String aggregateId, String reason) implements OrderEvent {}
}
