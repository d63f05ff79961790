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

/**
 * Collection-like access to entities of a single type.
 *
 * <p>Every entity handed out or accepted by a repository is enlisted into the {@link UnitOfWork}
 * bound to the current thread, if there is one.
 *
 * @param <E> is the type of the entity
 * @param <K> is the type of the entity identifier
 */
public interface Repository<E extends Entity<K>, K> {
  /**
   * @param id of the entity
   * @return entity if it exists, {@link Optional#empty()} otherwise
   * @throws IllegalArgumentException if identifier is {@code null}
   */
  Optional<E> getById(K id);

  /**
   * @param id of the entity
   * @return {@code true} if the entity exists
   * @throws IllegalArgumentException if identifier is {@code null}
   */
  boolean contains(K id);

  /**
   * Registers a new entity.
   *
   * <p>Inside a unit of work the entity is saved at commit time, otherwise it is saved right away.
   *
   * @param entity to add
   * @throws IllegalArgumentException if entity is {@code null}
   */
  default void add(E entity) {
    saveOrEnlist(entity);
  }

  /**
   * Registers changes of an existing entity.
   *
   * <p>Inside a unit of work the entity is saved at commit time, otherwise it is saved right away.
   *
   * @param entity to update
   * @throws IllegalArgumentException if entity is {@code null}
   */
  default void update(E entity) {
    saveOrEnlist(entity);
  }

  /**
   * Persists the entity immediately.
   *
   * @param entity to save
   * @throws IllegalArgumentException if entity is {@code null}
   * @throws ConcurrencyConflictException if the entity was modified concurrently
   */
  void save(E entity);

  /**
   * Verifies that the stored version still matches the one the entity was based on.
   *
   * <p>The unit of work calls this for every entity it is about to save before writing any of
   * them. Repositories without a version check accept every entity.
   *
   * @param entity to verify
   * @throws ConcurrencyConflictException if the entity was modified concurrently
   */
  default void verifyVersion(E entity) {
    // No version to compare with
  }

  /**
   * @param id of the entity to delete
   * @throws IllegalArgumentException if identifier is {@code null}
   */
  void delete(K id);

  private void saveOrEnlist(final E entity) {
    if (entity == null) {
      throw new IllegalArgumentException("Entity cannot be null");
    }

    UnitOfWork.current()
        .ifPresentOrElse(unitOfWork -> unitOfWork.enlist(entity, this), () -> save(entity));
  }
}
