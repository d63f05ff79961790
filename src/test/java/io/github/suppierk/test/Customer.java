package io.github.suppierk.test;

import io.github.suppierk.mediator.domain.Entity;
import io.github.suppierk.test.CustomerEvent.CustomerRegistered;
import io.github.suppierk.test.CustomerEvent.CustomerRenamed;

/** A sample state-based entity for tests. */
public final class Customer extends Entity<String> {
  private String name;

  public Customer(String id, String name) {
    super(id);
    this.name = name;
  }

  public static Customer register(String id, String name) {
    final var customer = new Customer(id, name);
    customer.registerEvent(new CustomerRegistered(id, name));
    return customer;
  }

  public void rename(String newName) {
    this.name = newName;
    registerEvent(new CustomerRenamed(getId(), newName));
  }

  public String getName() {
    return name;
  }

  /** Copies the state, leaving uncommitted events and version behind. */
  public Customer copy() {
    return new Customer(getId(), name);
  }
}
