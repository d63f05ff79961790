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

package io.github.suppierk.mediator.data;

import io.github.suppierk.mediator.domain.DomainEvent;
import io.github.suppierk.mediator.domain.Entity;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Request-scoped collection of every {@link Entity} loaded or created while handling a request.
 *
 * <p>A unit of work owns no persistent state: it remembers which entities were touched, which
 * {@link Repository} must write them at commit time and hands over their {@link DomainEvent}s once
 * the writes succeeded.
 *
 * <p>Enlistment is tracked by instance identity rather than {@link Entity#equals(Object)}, so two
 * instances of the same entity loaded independently are both tracked.
 *
 * <p>Instances are not thread-safe: a request is handled sequentially by a single thread, which is
 * the thread {@link #begin()} binds the unit of work to.
 */
public final class UnitOfWork {
  private static final Logger log = LoggerFactory.getLogger(UnitOfWork.class);
  private static final ThreadLocal<UnitOfWork> CURRENT = new ThreadLocal<>();

  private final List<Enlistment> enlistments;
  private final Map<Entity<?>, Enlistment> index;

  public UnitOfWork() {
    this.enlistments = new ArrayList<>();
    this.index = new IdentityHashMap<>();
  }

  /**
   * @return unit of work bound to the current thread
   */
  public static Optional<UnitOfWork> current() {
    return Optional.ofNullable(CURRENT.get());
  }

  /**
   * Binds a fresh unit of work to the current thread until the returned scope is closed.
   *
   * <p>Scopes can be nested: closing the inner scope restores the outer unit of work.
   *
   * @return scope to close once the request is handled
   */
  public static Scope begin() {
    final var scope = new Scope(new UnitOfWork(), CURRENT.get());
    CURRENT.set(scope.unitOfWork);
    return scope;
  }

  /**
   * Tracks the entity so that its events are dispatched after commit.
   *
   * @param entity to track
   * @throws IllegalArgumentException if entity is {@code null}
   */
  public void enlist(final Entity<?> entity) {
    if (entity == null) {
      throw new IllegalArgumentException("Entity cannot be null");
    }

    index.computeIfAbsent(
        entity,
        key -> {
          final var enlistment = new Enlistment(key);
          enlistments.add(enlistment);
          return enlistment;
        });
  }

  /**
   * Tracks the entity and schedules {@link Repository#save(Entity)} for it at commit time.
   *
   * <p>Re-enlisting the same instance keeps its original position and binds the repository only
   * if none was bound before. An entity enlisted through {@link #enlistForChanges(Entity,
   * Repository)} is saved unconditionally from now on.
   *
   * @param entity to track
   * @param repository to save the entity with
   * @param <K> is the type of the entity identifier
   * @param <E> is the type of the entity
   * @throws IllegalArgumentException if any of the arguments is {@code null}
   */
  public <K, E extends Entity<K>> void enlist(final E entity, final Repository<E, K> repository) {
    bind(entity, repository, false);
  }

  /**
   * Tracks a loaded entity and schedules {@link Repository#save(Entity)} for it at commit time
   * only if it registered events which were not saved yet.
   *
   * <p>Entities which were only read are neither written nor version-checked.
   *
   * @param entity to track
   * @param repository to save the entity with
   * @param <K> is the type of the entity identifier
   * @param <E> is the type of the entity
   * @throws IllegalArgumentException if any of the arguments is {@code null}
   */
  public <K, E extends Entity<K>> void enlistForChanges(
      final E entity, final Repository<E, K> repository) {
    bind(entity, repository, true);
  }

  /**
   * @return enlisted entities in enlistment order
   */
  public List<Entity<?>> getEnlisted() {
    final List<Entity<?>> entities = new ArrayList<>(enlistments.size());
    for (Enlistment enlistment : enlistments) {
      entities.add(enlistment.entity);
    }

    return List.copyOf(entities);
  }

  /**
   * Runs every scheduled save in enlistment order.
   *
   * <p>Versions of all entities to save are verified through {@link
   * Repository#verifyVersion(Entity)} before the first write, so a stale entity aborts the commit
   * without writing anything. A conflict raised by a concurrent writer between the verification
   * and the write still stops at the failing entity and leaves the earlier writes in place unless
   * the caller wraps this call into a transaction.
   *
   * @throws ConcurrencyConflictException if any of the entities was modified concurrently
   */
  public void persist() {
    final List<Enlistment> writes = new ArrayList<>();
    for (Enlistment enlistment : enlistments) {
      if (enlistment.writesOnCommit()) {
        writes.add(enlistment);
      }
    }

    for (Enlistment enlistment : writes) {
      enlistment.binding.verification().run();
    }

    final List<Entity<?>> written = new ArrayList<>(writes.size());
    for (Enlistment enlistment : writes) {
      try {
        enlistment.binding.persistence().run();
      } catch (RuntimeException e) {
        if (!written.isEmpty()) {
          log.warn(
              "Persistence stopped at {}, already written: {}", enlistment.entity, written);
        }

        throw e;
      }

      written.add(enlistment.entity);
    }
  }

  /**
   * Drains events of every enlisted entity for dispatch.
   *
   * <p>Must only be called after a successful {@link #persist()}, because it clears the
   * uncommitted buffers of the entities.
   *
   * @return events in enlistment order, then in raise order
   */
  public List<PendingEvent> collectAndClearEvents() {
    final List<PendingEvent> pending = new ArrayList<>();
    for (Enlistment enlistment : enlistments) {
      final Entity<?> entity = enlistment.entity;
      for (DomainEvent<?> event : entity.getUncommittedEvents()) {
        pending.add(new PendingEvent(entity, event));
      }

      entity.clearUncommittedEvents();
    }

    log.debug("Collected {} event(s) from {} entities", pending.size(), enlistments.size());
    return List.copyOf(pending);
  }

  /**
   * Event waiting for dispatch together with its source.
   *
   * @param entity which raised the event
   * @param event to dispatch
   */
  public record PendingEvent(Entity<?> entity, DomainEvent<?> event) {}

  /** Binding of a {@link UnitOfWork} to the current thread. */
  public static final class Scope implements AutoCloseable {
    private final UnitOfWork unitOfWork;
    private final UnitOfWork previous;
    private boolean closed;

    private Scope(final UnitOfWork unitOfWork, final UnitOfWork previous) {
      this.unitOfWork = unitOfWork;
      this.previous = previous;
    }

    /**
     * @return unit of work bound by this scope
     */
    public UnitOfWork getUnitOfWork() {
      return unitOfWork;
    }

    /** Restores the unit of work which was current before this scope. */
    @Override
    public void close() {
      if (closed) {
        return;
      }

      closed = true;
      if (previous == null) {
        CURRENT.remove();
      } else {
        CURRENT.set(previous);
      }
    }
  }

  private <K, E extends Entity<K>> void bind(
      final E entity, final Repository<E, K> repository, final boolean onlyIfChanged) {
    if (repository == null) {
      throw new IllegalArgumentException("Repository cannot be null");
    }

    enlist(entity);

    final Enlistment enlistment = index.get(entity);
    if (enlistment.binding == null) {
      enlistment.binding =
          new Binding(() -> repository.verifyVersion(entity), () -> repository.save(entity));
      enlistment.onlyIfChanged = onlyIfChanged;
    } else if (!onlyIfChanged) {
      enlistment.onlyIfChanged = false;
    }
  }

  private record Binding(Runnable verification, Runnable persistence) {}

  private static final class Enlistment {
    private final Entity<?> entity;
    private Binding binding;
    private boolean onlyIfChanged;

    private Enlistment(final Entity<?> entity) {
      this.entity = entity;
    }

    private boolean writesOnCommit() {
      return binding != null && (!onlyIfChanged || entity.hasUnsavedEvents());
    }
  }
}
