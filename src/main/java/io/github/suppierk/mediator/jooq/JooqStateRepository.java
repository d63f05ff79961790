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

package io.github.suppierk.mediator.jooq;

import io.github.suppierk.java.UnsafeFunctions;
import io.github.suppierk.mediator.data.ConcurrencyConflictException;
import io.github.suppierk.mediator.data.StateBasedRepository;
import io.github.suppierk.mediator.domain.Entity;
import java.util.Optional;
import org.jooq.Condition;
import org.jooq.DSLContext;
import org.jooq.Field;
import org.jooq.Record;
import org.jooq.Table;
import org.jooq.exception.DataAccessException;
import org.jooq.exception.SQLStateClass;
import org.jooq.impl.DSL;
import org.jooq.impl.SQLDataType;

/**
 * {@link StateBasedRepository} keeping serialized entity states in the {@code entity_state} table.
 *
 * <p>The table layout is shipped as {@code io/github/suppierk/mediator/jooq/entity_state.sql}.
 * Several entity types can share the table, rows are distinguished by the entity type name given
 * at construction.
 *
 * <p>Optimistic concurrency relies on the {@code version} column: new entities are inserted with
 * version 1 and a duplicate key means somebody else created the entity first, existing entities
 * are updated only where the stored version still equals the loaded one.
 *
 * @param <E> is the type of the entity
 * @param <K> is the type of the entity identifier
 */
public abstract class JooqStateRepository<E extends Entity<K>, K>
    extends StateBasedRepository<E, K> {
  static final Table<Record> ENTITY_STATE = DSL.table(DSL.name("entity_state"));
  static final Field<String> ENTITY_TYPE = DSL.field(DSL.name("entity_type"), SQLDataType.VARCHAR);
  static final Field<String> ENTITY_ID = DSL.field(DSL.name("entity_id"), SQLDataType.VARCHAR);
  static final Field<Long> VERSION = DSL.field(DSL.name("version"), SQLDataType.BIGINT);
  static final Field<String> STATE = DSL.field(DSL.name("state"), SQLDataType.CLOB);

  private final DslContextProvider dslContextProvider;
  private final String entityType;

  /**
   * Default constructor.
   *
   * @param dslContextProvider selecting the database of an entity
   * @param entityType distinguishing rows of this repository in the shared table
   * @throws IllegalArgumentException if any of the arguments is {@code null} or blank
   */
  protected JooqStateRepository(
      final DslContextProvider dslContextProvider, final String entityType) {
    if (dslContextProvider == null) {
      throw new IllegalArgumentException("DSLContext provider cannot be null");
    }

    if (entityType == null || entityType.isBlank()) {
      throw new IllegalArgumentException("Entity type cannot be blank");
    }

    this.dslContextProvider = dslContextProvider;
    this.entityType = entityType;
  }

  /**
   * @param entity to serialize
   * @return state representation to store
   * @throws Exception if the state could not be serialized
   * @see <a href="https://rules.sonarsource.com/java/RSPEC-112/">Suppressed Sonar rule to allow
   *     more flexibility</a>
   */
  @SuppressWarnings("squid:S112")
  protected abstract String writeState(final E entity) throws Exception;

  /**
   * @param id of the entity
   * @param state previously produced by {@link #writeState(Entity)}
   * @return restored entity without uncommitted events
   * @throws Exception if the state could not be deserialized
   * @see <a href="https://rules.sonarsource.com/java/RSPEC-112/">Suppressed Sonar rule to allow
   *     more flexibility</a>
   */
  @SuppressWarnings("squid:S112")
  protected abstract E readState(final K id, final String state) throws Exception;

  /**
   * @param id of the entity
   * @return identifier as stored in the {@code entity_id} column
   */
  protected String entityIdOf(final K id) {
    return String.valueOf(id);
  }

  /**
   * @return entity type name used by this repository
   */
  public final String getEntityType() {
    return entityType;
  }

  /** {@inheritDoc} */
  @Override
  protected Optional<E> load(final K id) {
    final String entityId = entityIdOf(id);
    return dslFor(entityId)
        .select(VERSION, STATE)
        .from(ENTITY_STATE)
        .where(rowOf(entityId))
        .fetchOptional()
        .map(
            UnsafeFunctions.unsafeFunction(
                dbRecord -> {
                  final E entity = readState(id, dbRecord.get(STATE));
                  if (entity == null) {
                    throw new IllegalStateException(
                        "State of '%s' was read as null".formatted(entityId));
                  }

                  entity.restoreVersion(dbRecord.get(VERSION));
                  return entity;
                }));
  }

  /** {@inheritDoc} */
  @Override
  public boolean contains(final K id) {
    if (id == null) {
      throw new IllegalArgumentException("Entity ID cannot be null");
    }

    final String entityId = entityIdOf(id);
    return dslFor(entityId).fetchExists(ENTITY_STATE, rowOf(entityId));
  }

  /** {@inheritDoc} */
  @Override
  protected long currentVersion(final K id) {
    final String entityId = entityIdOf(id);
    final Long version =
        dslFor(entityId)
            .select(VERSION)
            .from(ENTITY_STATE)
            .where(rowOf(entityId))
            .fetchOne(VERSION);

    return version == null ? 0 : version;
  }

  /** {@inheritDoc} */
  @Override
  protected long store(final E entity, final long expectedVersion) {
    final String entityId = entityIdOf(entity.getId());
    final String state = UnsafeFunctions.unsafeFunction(this::writeState).apply(entity);
    final DSLContext dsl = dslFor(entityId);
    final long nextVersion = expectedVersion + 1;

    if (expectedVersion == 0) {
      try {
        dsl.insertInto(ENTITY_STATE, ENTITY_TYPE, ENTITY_ID, VERSION, STATE)
            .values(entityType, entityId, nextVersion, state)
            .execute();
      } catch (DataAccessException e) {
        if (e.sqlStateClass() == SQLStateClass.C23_INTEGRITY_CONSTRAINT_VIOLATION) {
          throw new ConcurrencyConflictException(entityId, expectedVersion, -1, e);
        }

        throw e;
      }

      return nextVersion;
    }

    final int updated =
        dsl.update(ENTITY_STATE)
            .set(VERSION, nextVersion)
            .set(STATE, state)
            .where(rowOf(entityId))
            .and(VERSION.eq(expectedVersion))
            .execute();

    if (updated == 0) {
      throw new ConcurrencyConflictException(
          entityId, expectedVersion, currentVersion(entity.getId()));
    }

    return nextVersion;
  }

  /** {@inheritDoc} */
  @Override
  protected boolean remove(final K id) {
    final String entityId = entityIdOf(id);
    return dslFor(entityId).deleteFrom(ENTITY_STATE).where(rowOf(entityId)).execute() > 0;
  }

  private Condition rowOf(final String entityId) {
    return ENTITY_TYPE.eq(entityType).and(ENTITY_ID.eq(entityId));
  }

  private DSLContext dslFor(final String entityId) {
    final DSLContext dsl = dslContextProvider.apply(entityId);
    if (dsl == null) {
      throw new IllegalStateException("DSLContext for '%s' cannot be null".formatted(entityId));
    }

    return dsl;
  }
}
