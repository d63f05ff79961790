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

import io.github.suppierk.mediator.domain.Entity;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * {@link StateBasedRepository} keeping entity states in memory.
 *
 * <p>Entities are copied on the way in and on the way out, so callers never share an instance with
 * the repository and concurrent requests never observe each other's uncommitted changes.
 *
 * @param <E> is the type of the entity
 * @param <K> is the type of the entity identifier
 */
public class InMemoryStateRepository<E extends Entity<K>, K> extends StateBasedRepository<E, K> {
  private final Map<K, Snapshot<E>> states;
  private final UnaryOperator<E> copier;

  /**
   * @param copier creating a copy of the entity state without its uncommitted events
   * @throws IllegalArgumentException if copier is {@code null}
   */
  public InMemoryStateRepository(final UnaryOperator<E> copier) {
    if (copier == null) {
      throw new IllegalArgumentException("Copier cannot be null");
    }

    this.states = new ConcurrentHashMap<>();
    this.copier = copier;
  }

  /**
   * Searches stored entities.
   *
   * <p>Results are enlisted into the current unit of work the same way {@link #getById(Object)}
   * does it.
   *
   * @param predicate to match entities with
   * @return copies of matching entities
   * @throws IllegalArgumentException if predicate is {@code null}
   */
  public List<E> find(final Predicate<? super E> predicate) {
    if (predicate == null) {
      throw new IllegalArgumentException("Predicate cannot be null");
    }

    final List<E> found = new ArrayList<>();
    for (Snapshot<E> snapshot : states.values()) {
      final E entity = materialize(snapshot);
      if (predicate.test(entity)) {
        found.add(track(entity));
      }
    }

    return found;
  }

  /** Removes every stored entity. */
  public void clear() {
    states.clear();
  }

  /** {@inheritDoc} */
  @Override
  protected Optional<E> load(final K id) {
    return Optional.ofNullable(states.get(id)).map(this::materialize);
  }

  /** {@inheritDoc} */
  @Override
  public boolean contains(final K id) {
    if (id == null) {
      throw new IllegalArgumentException("Entity ID cannot be null");
    }

    return states.containsKey(id);
  }

  /** {@inheritDoc} */
  @Override
  protected long currentVersion(final K id) {
    final Snapshot<E> snapshot = states.get(id);
    return snapshot == null ? 0 : snapshot.version();
  }

  /** {@inheritDoc} */
  @Override
  protected long store(final E entity, final long expectedVersion) {
    final Snapshot<E> stored =
        states.compute(
            entity.getId(),
            (id, existing) -> {
              final long actualVersion = existing == null ? 0 : existing.version();
              if (actualVersion != expectedVersion) {
                throw new ConcurrencyConflictException(
                    String.valueOf(id), expectedVersion, actualVersion);
              }

              return new Snapshot<>(copy(entity), actualVersion + 1);
            });

    return stored.version();
  }

  /** {@inheritDoc} */
  @Override
  protected boolean remove(final K id) {
    return states.remove(id) != null;
  }

  private E materialize(final Snapshot<E> snapshot) {
    final E entity = copy(snapshot.entity());
    entity.restoreVersion(snapshot.version());
    return entity;
  }

  private E copy(final E entity) {
    final E copy = copier.apply(entity);
    if (copy == null) {
      throw new IllegalStateException("Copier returned null for '%s'".formatted(entity.getId()));
    }

    return copy;
  }

  private record Snapshot<E>(E entity, long version) {}
}
