package io.github.suppierk.test;

import io.github.suppierk.mediator.cqrs.DomainCommand;

public record MarkOrderReady(String orderId) implements DomainCommand<Long> {}
