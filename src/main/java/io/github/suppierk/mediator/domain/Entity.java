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

import java.util.ArrayList;
import java.util.List;
import java.util.StringJoiner;

/**
 * Domain object with identity.
 *
 * <p>Two entities are equal when they are of the same class and have equal identifiers - their
 * other properties never participate in the comparison.
 *
 * <p>Entities can register {@link DomainEvent}s describing what changed. Registered events stay
 * uncommitted until the unit of work collects them for dispatch after a successful persistence,
 * which is the only moment the buffer is cleared.
 *
 * @param <K> is the type of the identifier
 */
public abstract class Entity<K> {
  private final K id;
  private final List<DomainEvent<K>> uncommittedEvents;

  private long version;
  private int savedEventCount;

  /**
   * Default constructor.
   *
   * @param id of this entity
   * @throws IllegalArgumentException if identifier is {@code null}
   */
  protected Entity(final K id) {
    if (id == null) {
      throw new IllegalArgumentException("Entity identifier cannot be null");
    }

    this.id = id;
    this.uncommittedEvents = new ArrayList<>();
  }

  /**
   * @return identifier of this entity
   */
  public final K getId() {
    return id;
  }

  /**
   * For plain entities this is the number of times the state was persisted, which state-based
   * stores use as an optimistic concurrency token.
   *
   * @return current version of this entity
   */
  public final long getVersion() {
    return version;
  }

  /**
   * Invoked by state-based repositories when the entity is materialized or persisted.
   *
   * @param version known to the underlying store
   * @throws IllegalArgumentException if version is negative
   */
  public void restoreVersion(final long version) {
    if (version < 0) {
      throw new IllegalArgumentException("Version cannot be negative");
    }

    this.version = version;
  }

  /**
   * Writes the state through the given writer and adopts the version it returns.
   *
   * <p>Events registered so far count as saved afterwards, they stay buffered for dispatch.
   *
   * @param writer storing the state under the current version as the expected one
   * @return new state version
   * @throws IllegalArgumentException if writer is {@code null}
   */
  public long saveState(final StateWriter writer) {
    if (writer == null) {
      throw new IllegalArgumentException("State writer cannot be null");
    }

    final long version = writer.write(this.version);
    restoreVersion(version);
    markAllSaved();
    return version;
  }

  /**
   * Adds the event to the uncommitted buffer.
   *
   * @param event to register
   * @throws IllegalArgumentException if event is {@code null} or belongs to a different entity
   */
  protected void registerEvent(final DomainEvent<K> event) {
    appendUncommitted(event);
  }

  /**
   * @return a copy of events raised since the last dispatch, in raise order
   */
  public final List<DomainEvent<K>> getUncommittedEvents() {
    return List.copyOf(uncommittedEvents);
  }

  /**
   * @return {@code true} if there are events waiting to be dispatched
   */
  public final boolean hasUncommittedEvents() {
    return !uncommittedEvents.isEmpty();
  }

  /**
   * @return {@code true} if some events were registered after the last save
   */
  public final boolean hasUnsavedEvents() {
    return savedEventCount < uncommittedEvents.size();
  }

  /**
   * Clears the uncommitted buffer.
   *
   * <p>Must be called only by the unit of work once events were handed over for dispatch.
   */
  public final void clearUncommittedEvents() {
    uncommittedEvents.clear();
    savedEventCount = 0;
  }

  final void appendUncommitted(final DomainEvent<K> event) {
    if (event == null) {
      throw new IllegalArgumentException("Event cannot be null");
    }

    if (!id.equals(event.aggregateId())) {
      throw new IllegalArgumentException(
          "Event '%s' belongs to '%s', not to '%s'"
              .formatted(event.eventType(), event.aggregateId(), id));
    }

    uncommittedEvents.add(event);
  }

  final void assignVersion(final long version) {
    this.version = version;
  }

  final List<DomainEvent<K>> unsavedEvents() {
    return List.copyOf(uncommittedEvents.subList(savedEventCount, uncommittedEvents.size()));
  }

  final int unsavedEventCount() {
    return uncommittedEvents.size() - savedEventCount;
  }

  final void markAllSaved() {
    savedEventCount = uncommittedEvents.size();
  }

  /** Persists the state of an entity with optimistic concurrency. */
  @FunctionalInterface
  public interface StateWriter {
    /**
     * @param expectedVersion the stored state must have
     * @return version of the written state
     */
    long write(long expectedVersion);
  }

  @Override
  public final boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;

    Entity<?> that = (Entity<?>) o;
    return id.equals(that.id);
  }

  @Override
  public final int hashCode() {
    int result = getClass().hashCode();
    result = 31 * result + id.hashCode();
    return result;
  }

  @Override
  public String toString() {
    return new StringJoiner(", ", getClass().getSimpleName() + "[", "]")
        .add("id=" + id)
        .add("version=" + version)
        .toString();
  }
}
