package io.github.suppierk.test;

import io.github.suppierk.mediator.cqrs.DomainQuery;

public record GetOrderStatus(String orderId) implements DomainQuery<Order.Status> {}
