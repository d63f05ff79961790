/*
 * Copyright 2024 Roman Khlebnov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.github.suppierk.mediator.async;

import io.github.suppierk.java.Try;
import io.github.suppierk.mediator.async.DispatchReport.DispatchFailure;
import io.github.suppierk.mediator.domain.DomainEvent;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link DomainEventDispatcher} delivering events synchronously to subscribers registered for
 * their exact class, in subscription order.
 *
 * <p>Each subscriber runs in isolation: a failing subscriber is logged and reported, the remaining
 * subscribers still receive the event.
 */
public final class SubscriberDomainEventDispatcher implements DomainEventDispatcher {
  private static final Logger log = LoggerFactory.getLogger(SubscriberDomainEventDispatcher.class);

  private final Map<Class<?>, List<DomainEventHandler<DomainEvent<?>>>> subscribers;

  private SubscriberDomainEventDispatcher(
      final Map<Class<?>, List<DomainEventHandler<DomainEvent<?>>>> subscribers) {
    this.subscribers = subscribers;
  }

  /**
   * @return a new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * @return event classes having at least one subscriber
   */
  public Set<Class<?>> getSubscribedEventClasses() {
    return subscribers.keySet();
  }

  /** {@inheritDoc} */
  @Override
  public DispatchReport dispatch(final DomainEvent<?> event) {
    if (event == null) {
      throw new IllegalArgumentException("Event cannot be null");
    }

    final List<DomainEventHandler<DomainEvent<?>>> handlers =
        subscribers.getOrDefault(event.getClass(), List.of());

    if (handlers.isEmpty()) {
      log.debug("No subscribers for '{}'", event.eventType());
      return new DispatchReport(event, 0, List.of());
    }

    final List<DispatchFailure> failures = new ArrayList<>();
    final AtomicInteger delivered = new AtomicInteger();

    for (DomainEventHandler<DomainEvent<?>> handler : handlers) {
      final Try<Boolean> outcome =
          Try.of(
              () -> {
                handler.handle(event);
                return true;
              });

      outcome.ifSuccess(handled -> delivered.incrementAndGet());
      outcome.ifFailure(
          cause -> {
            log.error(
                "Subscriber {} failed to handle '{}' of '{}'",
                handler,
                event.eventType(),
                event.aggregateId(),
                cause);
            failures.add(new DispatchFailure(handler, cause));
          });
    }

    return new DispatchReport(event, delivered.get(), failures);
  }

  /** Write-once registry of subscribers. */
  public static final class Builder {
    private final Map<Class<?>, List<DomainEventHandler<DomainEvent<?>>>> subscribers;

    private Builder() {
      this.subscribers = new LinkedHashMap<>();
    }

    /**
     * Adds a subscriber for the exact event class, subclasses are not matched.
     *
     * @param eventClass to subscribe to
     * @param handler reacting to the event
     * @param <T> is the type of the event
     * @return this builder
     * @throws IllegalArgumentException if any of the arguments is {@code null}
     */
    @SuppressWarnings("unchecked")
    public <T extends DomainEvent<?>> Builder subscribe(
        final Class<T> eventClass, final DomainEventHandler<? super T> handler) {
      if (eventClass == null) {
        throw new IllegalArgumentException("Event class cannot be null");
      }

      if (handler == null) {
        throw new IllegalArgumentException("Event handler cannot be null");
      }

      subscribers
          .computeIfAbsent(eventClass, key -> new ArrayList<>())
          .add((DomainEventHandler<DomainEvent<?>>) (DomainEventHandler<?>) handler);
      return this;
    }

    /**
     * @return immutable dispatcher
     */
    public SubscriberDomainEventDispatcher build() {
      final Map<Class<?>, List<DomainEventHandler<DomainEvent<?>>>> copy = new LinkedHashMap<>();
      subscribers.forEach((eventClass, handlers) -> copy.put(eventClass, List.copyOf(handlers)));
      return new SubscriberDomainEventDispatcher(Collections.unmodifiableMap(copy));
    }
  }
}
