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

import io.github.suppierk.mediator.data.ConcurrencyConflictException;
import io.github.suppierk.mediator.data.EventStore;
import io.github.suppierk.mediator.data.StoredEvent;
import io.github.suppierk.mediator.domain.DomainEvent;
import io.github.suppierk.mediator.serialization.JsonEventSerializer;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import org.jooq.DSLContext;
import org.jooq.Field;
import org.jooq.InsertValuesStep5;
import org.jooq.Record;
import org.jooq.Table;
import org.jooq.exception.DataAccessException;
import org.jooq.exception.SQLStateClass;
import org.jooq.impl.DSL;
import org.jooq.impl.SQLDataType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link EventStore} backed by the {@code event_store} table.
 *
 * <p>The table layout is shipped as {@code io/github/suppierk/mediator/jooq/event_store.sql}. The
 * primary key over {@code (stream_id, sequence_number)} is what makes appends safe: the expected
 * version is checked first, and a writer racing past the check fails on the key instead. Both
 * cases are reported as {@link ConcurrencyConflictException} and the batch, written by a single
 * statement, is never partially stored.
 */
public final class JooqEventStore implements EventStore {
  private static final Logger log = LoggerFactory.getLogger(JooqEventStore.class);

  static final Table<Record> EVENT_STORE = DSL.table(DSL.name("event_store"));
  static final Field<String> STREAM_ID = DSL.field(DSL.name("stream_id"), SQLDataType.VARCHAR);
  static final Field<Long> SEQUENCE_NUMBER =
      DSL.field(DSL.name("sequence_number"), SQLDataType.BIGINT);
  static final Field<String> EVENT_TYPE = DSL.field(DSL.name("event_type"), SQLDataType.VARCHAR);
  static final Field<String> PAYLOAD = DSL.field(DSL.name("payload"), SQLDataType.CLOB);
  static final Field<LocalDateTime> RECORDED_AT =
      DSL.field(DSL.name("recorded_at"), SQLDataType.LOCALDATETIME);

  private final DslContextProvider dslContextProvider;
  private final JsonEventSerializer serializer;
  private final Clock clock;

  /**
   * @param dslContextProvider selecting the database of a stream
   * @param serializer converting event payloads
   * @throws IllegalArgumentException if any of the arguments is {@code null}
   */
  public JooqEventStore(
      final DslContextProvider dslContextProvider, final JsonEventSerializer serializer) {
    this(dslContextProvider, serializer, Clock.systemUTC());
  }

  /**
   * @param dslContextProvider selecting the database of a stream
   * @param serializer converting event payloads
   * @param clock used to stamp appended events
   * @throws IllegalArgumentException if any of the arguments is {@code null}
   */
  public JooqEventStore(
      final DslContextProvider dslContextProvider,
      final JsonEventSerializer serializer,
      final Clock clock) {
    if (dslContextProvider == null) {
      throw new IllegalArgumentException("DSLContext provider cannot be null");
    }

    if (serializer == null) {
      throw new IllegalArgumentException("Serializer cannot be null");
    }

    if (clock == null) {
      throw new IllegalArgumentException("Clock cannot be null");
    }

    this.dslContextProvider = dslContextProvider;
    this.serializer = serializer;
    this.clock = clock;
  }

  /** {@inheritDoc} */
  @Override
  public long append(
      final String streamId,
      final long expectedVersion,
      final List<? extends DomainEvent<?>> events) {
    EventStore.requireStreamId(streamId);
    EventStore.requireVersion(expectedVersion);

    if (events == null) {
      throw new IllegalArgumentException("Events cannot be null");
    }

    final DSLContext dsl = dslFor(streamId);
    final long actualVersion = currentVersion(dsl, streamId);
    if (actualVersion != expectedVersion) {
      throw new ConcurrencyConflictException(streamId, expectedVersion, actualVersion);
    }

    if (events.isEmpty()) {
      return actualVersion;
    }

    final LocalDateTime recordedAt = LocalDateTime.ofInstant(clock.instant(), ZoneOffset.UTC);
    InsertValuesStep5<Record, String, Long, String, String, LocalDateTime> insert =
        dsl.insertInto(EVENT_STORE, STREAM_ID, SEQUENCE_NUMBER, EVENT_TYPE, PAYLOAD, RECORDED_AT);

    long sequence = expectedVersion;
    for (DomainEvent<?> event : events) {
      if (event == null) {
        throw new IllegalArgumentException("Event cannot be null");
      }

      insert =
          insert.values(
              streamId, ++sequence, event.eventType(), serializer.serialize(event), recordedAt);
    }

    try {
      insert.execute();
    } catch (DataAccessException e) {
      if (e.sqlStateClass() == SQLStateClass.C23_INTEGRITY_CONSTRAINT_VIOLATION) {
        throw new ConcurrencyConflictException(streamId, expectedVersion, -1, e);
      }

      throw e;
    }

    log.debug("Appended {} event(s) to '{}', version {}", events.size(), streamId, sequence);
    return sequence;
  }

  /** {@inheritDoc} */
  @Override
  public List<StoredEvent> readStream(final String streamId, final long fromVersion) {
    EventStore.requireStreamId(streamId);
    EventStore.requireVersion(fromVersion);

    return dslFor(streamId)
        .select(SEQUENCE_NUMBER, EVENT_TYPE, PAYLOAD, RECORDED_AT)
        .from(EVENT_STORE)
        .where(STREAM_ID.eq(streamId))
        .and(SEQUENCE_NUMBER.gt(fromVersion))
        .orderBy(SEQUENCE_NUMBER.asc())
        .fetch(
            dbRecord ->
                new StoredEvent(
                    streamId,
                    dbRecord.get(SEQUENCE_NUMBER),
                    dbRecord.get(EVENT_TYPE),
                    serializer.deserialize(dbRecord.get(EVENT_TYPE), dbRecord.get(PAYLOAD)),
                    dbRecord.get(RECORDED_AT).toInstant(ZoneOffset.UTC)));
  }

  /** {@inheritDoc} */
  @Override
  public long currentVersion(final String streamId) {
    EventStore.requireStreamId(streamId);
    return currentVersion(dslFor(streamId), streamId);
  }

  private DSLContext dslFor(final String streamId) {
    final DSLContext dsl = dslContextProvider.apply(streamId);
    if (dsl == null) {
      throw new IllegalStateException("DSLContext for '%s' cannot be null".formatted(streamId));
    }

    return dsl;
  }

  private static long currentVersion(final DSLContext dsl, final String streamId) {
    final Long version =
        dsl.select(DSL.max(SEQUENCE_NUMBER))
            .from(EVENT_STORE)
            .where(STREAM_ID.eq(streamId))
            .fetchOne(0, Long.class);

    return version == null ? 0 : version;
  }
}
