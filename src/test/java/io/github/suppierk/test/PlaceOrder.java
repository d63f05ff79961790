package io.github.suppierk.test;

import io.github.suppierk.mediator.cqrs.DomainCommand;

public record PlaceOrder(String orderId, String customer) implements DomainCommand<String> {}
