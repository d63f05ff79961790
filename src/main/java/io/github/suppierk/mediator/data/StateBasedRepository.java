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
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link Repository} storing the latest state of plain {@link Entity}s.
 *
 * <p>The state version of an entity acts as an optimistic concurrency token: a store must refuse to
 * write when the stored version differs from the one the entity was loaded with.
 *
 * <p>Entities loaded inside a unit of work are written at commit time when they registered events
 * since they were loaded, or unconditionally once the handler calls {@link #add(Entity)} or {@link
 * #update(Entity)}. Entities which were only read are left untouched.
 *
 * @param <E> is the type of the entity
 * @param <K> is the type of the entity identifier
 */
public abstract class StateBasedRepository<E extends Entity<K>, K> implements Repository<E, K> {
  private static final Logger log = LoggerFactory.getLogger(StateBasedRepository.class);

  /**
   * @param id of the entity
   * @return entity with its state version restored, {@link Optional#empty()} if it does not exist
   */
  protected abstract Optional<E> load(K id);

  /**
   * Writes the entity state.
   *
   * @param entity to write
   * @param expectedVersion the entity was loaded with, {@code 0} for new entities
   * @return new state version
   * @throws ConcurrencyConflictException if the stored version differs from the expected one
   */
  protected abstract long store(E entity, long expectedVersion);

  /**
   * @param id of the entity
   * @return {@code true} if there was something to remove
   */
  protected abstract boolean remove(K id);

  /**
   * @param id of the entity
   * @return stored state version, {@code 0} if the entity does not exist
   */
  protected long currentVersion(final K id) {
    return load(id).map(Entity::getVersion).orElse(0L);
  }

  /**
   * Enlists a loaded entity into the current unit of work, if there is one.
   *
   * @param entity which was loaded
   * @return the same entity
   */
  protected final E track(final E entity) {
    UnitOfWork.current().ifPresent(unitOfWork -> unitOfWork.enlistForChanges(entity, this));
    return entity;
  }

  /** {@inheritDoc} */
  @Override
  public Optional<E> getById(final K id) {
    if (id == null) {
      throw new IllegalArgumentException("Entity ID cannot be null");
    }

    return load(id).map(this::track);
  }

  /** {@inheritDoc} */
  @Override
  public boolean contains(final K id) {
    if (id == null) {
      throw new IllegalArgumentException("Entity ID cannot be null");
    }

    return load(id).isPresent();
  }

  /** {@inheritDoc} */
  @Override
  public void save(final E entity) {
    if (entity == null) {
      throw new IllegalArgumentException("Entity cannot be null");
    }

    entity.saveState(expectedVersion -> store(entity, expectedVersion));

    log.debug("Saved {}", entity);
    UnitOfWork.current().ifPresent(unitOfWork -> unitOfWork.enlist(entity));
  }

  /** {@inheritDoc} */
  @Override
  public void verifyVersion(final E entity) {
    if (entity == null) {
      throw new IllegalArgumentException("Entity cannot be null");
    }

    final long actualVersion = currentVersion(entity.getId());
    if (actualVersion != entity.getVersion()) {
      throw new ConcurrencyConflictException(
          String.valueOf(entity.getId()), entity.getVersion(), actualVersion);
    }
  }

  /**
   * Removes the entity state, missing entities are ignored.
   *
   * @param id of the entity to delete
   */
  @Override
  public void delete(final K id) {
    if (id == null) {
      throw new IllegalArgumentException("Entity ID cannot be null");
    }

    if (!remove(id)) {
      log.debug("Nothing to delete for '{}'", id);
    }
  }
}
