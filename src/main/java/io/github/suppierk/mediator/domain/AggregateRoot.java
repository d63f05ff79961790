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

package io.github.suppierk.mediator.domain;

import java.lang.reflect.Modifier;
import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Event-sourced {@link Entity}: every state change is expressed as a {@link DomainEvent} which is
 * first applied to the in-memory state and then buffered for persistence.
 *
 * <p>Subclasses register one applier per concrete event class in their constructor:
 *
 * <pre>{@code
 * private Order(String id) {
 *   super(id, OrderEvent.class);
 *   on(OrderPlaced.class, e -> status = Status.PLACED);
 *   on(OrderReady.class, e -> status = Status.READY);
 * }
 * }</pre>
 *
 * <p>When the event type is a {@code sealed} interface, the first application verifies that every
 * permitted concrete event class has an applier, so a forgotten applier fails loudly instead of
 * being silently ignored.
 *
 * <p>{@link #getVersion()} always equals the number of events applied to this instance.
 *
 * @param <K> is the type of the identifier
 * @param <E> is the base type of the events this aggregate understands
 * @see <a href="https://rules.sonarsource.com/java/RSPEC-119/">Suppressed Sonar rule for the sake
 *     to have more readable type names</a>
 */
@SuppressWarnings("squid:S119")
public abstract class AggregateRoot<K, E extends DomainEvent<K>> extends Entity<K> {
  private final Class<E> eventClass;
  private final Map<Class<?>, Consumer<? super E>> appliers;

  private boolean coverageVerified;

  /**
   * Default constructor.
   *
   * @param id of this aggregate
   * @param eventClass is the base type of the events this aggregate understands
   * @throws IllegalArgumentException if any of the arguments is {@code null}
   */
  protected AggregateRoot(final K id, final Class<E> eventClass) {
    super(id);

    if (eventClass == null) {
      throw new IllegalArgumentException("Event class cannot be null");
    }

    this.eventClass = eventClass;
    this.appliers = new HashMap<>();
  }

  /**
   * @return base type of the events this aggregate understands
   */
  public final Class<E> getEventClass() {
    return eventClass;
  }

  /**
   * Registers the state transition for a specific event class.
   *
   * @param type of the event
   * @param applier mutating the state of this aggregate
   * @param <T> is the concrete event type
   * @throws IllegalArgumentException if any of the arguments is {@code null}
   * @throws IllegalStateException if applier for the same event class was already registered
   */
  @SuppressWarnings("unchecked")
  protected final <T extends E> void on(final Class<T> type, final Consumer<? super T> applier) {
    if (type == null) {
      throw new IllegalArgumentException("Event type cannot be null");
    }

    if (applier == null) {
      throw new IllegalArgumentException("Event applier cannot be null");
    }

    if (appliers.putIfAbsent(type, event -> applier.accept((T) event)) != null) {
      throw new IllegalStateException(
          "Applier for '%s' is already registered".formatted(type.getSimpleName()));
    }
  }

  /**
   * Applies the event to the current state, buffers it as uncommitted and increments the version.
   *
   * @param event to raise
   * @throws IllegalArgumentException if event is {@code null} or belongs to a different aggregate
   * @throws IllegalStateException if there is no applier for the event
   */
  protected final void raiseEvent(final E event) {
    if (event == null) {
      throw new IllegalArgumentException("Event cannot be null");
    }

    if (!getId().equals(event.aggregateId())) {
      throw new IllegalArgumentException(
          "Event '%s' belongs to '%s', not to '%s'"
              .formatted(event.eventType(), event.aggregateId(), getId()));
    }

    apply(event);
    appendUncommitted(event);
    assignVersion(getVersion() + 1);
  }

  /**
   * Rebuilds the state by replaying persisted events in stream order.
   *
   * <p>Replayed events never become uncommitted.
   *
   * @param history of this aggregate
   * @throws IllegalArgumentException if history is {@code null} or contains {@code null}s
   * @throws IllegalStateException if this instance already has applied events
   */
  public final void loadFromHistory(final List<? extends E> history) {
    if (history == null) {
      throw new IllegalArgumentException("History cannot be null");
    }

    if (getVersion() != 0 || hasUncommittedEvents()) {
      throw new IllegalStateException(
          "History can only be loaded into a blank '%s'".formatted(getClass().getSimpleName()));
    }

    long replayed = 0;
    for (E event : history) {
      if (event == null) {
        throw new IllegalArgumentException("History event cannot be null");
      }

      apply(event);
      replayed++;
    }

    assignVersion(replayed);
  }

  /**
   * @return version of the last event known to be stored, lower than {@link #getVersion()} while
   *     raised events wait for an append
   */
  public final long getPersistedVersion() {
    return getVersion() - unsavedEventCount();
  }

  /**
   * Hands the events raised since the last append to the appender and marks them as saved once it
   * returns. The events stay buffered for dispatch.
   *
   * @param appender writing events after {@link #getPersistedVersion()}
   * @return version reported by the appender, equal to {@link #getVersion()}
   * @throws IllegalArgumentException if appender is {@code null}
   * @throws IllegalStateException if the appender reports a different version than expected
   */
  public final long appendUnsavedEvents(final EventAppender<K> appender) {
    if (appender == null) {
      throw new IllegalArgumentException("Event appender cannot be null");
    }

    final List<DomainEvent<K>> unsaved = unsavedEvents();
    if (unsaved.isEmpty()) {
      return getVersion();
    }

    final long storedVersion = appender.append(getPersistedVersion(), unsaved);
    if (storedVersion != getVersion()) {
      throw new IllegalStateException(
          "Appending %d event(s) of '%s' reported version %d instead of %d"
              .formatted(unsaved.size(), getId(), storedVersion, getVersion()));
    }

    markAllSaved();
    return storedVersion;
  }

  /**
   * @return concrete event classes permitted by a sealed event type which have no applier
   */
  public final Set<Class<?>> getUnhandledEventClasses() {
    final Set<Class<?>> unhandled = new LinkedHashSet<>();
    for (Class<?> concrete : concreteEventClasses(eventClass)) {
      if (!appliers.containsKey(concrete)) {
        unhandled.add(concrete);
      }
    }

    return unhandled;
  }

  /**
   * Aggregates derive the version from the number of applied events.
   *
   * @throws UnsupportedOperationException always
   */
  @Override
  public final void restoreVersion(final long version) {
    throw new UnsupportedOperationException(
        "Version of '%s' is derived from its events".formatted(getClass().getSimpleName()));
  }

  /**
   * Aggregates are persisted as events.
   *
   * @throws UnsupportedOperationException always
   */
  @Override
  public final long saveState(final StateWriter writer) {
    throw new UnsupportedOperationException(
        "State of '%s' is derived from its events".formatted(getClass().getSimpleName()));
  }

  /**
   * Aggregates must use {@link #raiseEvent(DomainEvent)} so that the state is updated as well.
   *
   * @throws UnsupportedOperationException always
   */
  @Override
  protected final void registerEvent(final DomainEvent<K> event) {
    throw new UnsupportedOperationException(
        "Use raiseEvent for '%s'".formatted(getClass().getSimpleName()));
  }

  private void apply(final E event) {
    if (!coverageVerified) {
      final Set<Class<?>> unhandled = getUnhandledEventClasses();
      if (!unhandled.isEmpty()) {
        throw new IllegalStateException(
            "'%s' has no appliers for %s".formatted(getClass().getSimpleName(), unhandled));
      }

      coverageVerified = true;
    }

    final Consumer<? super E> applier = appliers.get(event.getClass());
    if (applier == null) {
      throw new IllegalStateException(
          "'%s' cannot apply '%s'"
              .formatted(getClass().getSimpleName(), event.getClass().getSimpleName()));
    }

    applier.accept(event);
  }

  private static Collection<Class<?>> concreteEventClasses(final Class<?> root) {
    final Set<Class<?>> concrete = new LinkedHashSet<>();
    if (!root.isSealed()) {
      return concrete;
    }

    final Deque<Class<?>> pending = new ArrayDeque<>(List.of(root.getPermittedSubclasses()));
    while (!pending.isEmpty()) {
      final Class<?> candidate = pending.poll();
      if (candidate.isSealed()) {
        pending.addAll(List.of(candidate.getPermittedSubclasses()));
      } else if (!candidate.isInterface()
          && !Modifier.isAbstract(candidate.getModifiers())) {
        concrete.add(candidate);
      }
    }

    return concrete;
  }

  /**
   * Writes events to the stream of an aggregate.
   *
   * @param <K> is the type of the aggregate identifier
   */
  @FunctionalInterface
  public interface EventAppender<K> {
    /**
     * @param expectedVersion the stream must have before the append
     * @param events to append in order
     * @return version of the stream after the append
     */
    long append(long expectedVersion, List<DomainEvent<K>> events);
  }
}
