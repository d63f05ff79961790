package io.github.suppierk.test;

import io.github.suppierk.mediator.domain.DomainEvent;

/** Sample events of the {@link Customer} entity. */
public sealed interface CustomerEvent extends DomainEvent<String> {
  record CustomerRegistered(String aggregateId, String name) implements CustomerEvent {}

  record CustomerRenamed(String aggregateId, String name) implements CustomerEvent {}
}
