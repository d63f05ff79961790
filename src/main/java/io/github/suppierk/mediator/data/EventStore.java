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
import java.util.List;

/**
 * Append-only storage of {@link DomainEvent} streams with optimistic concurrency.
 *
 * <p>Each stream is an ordered sequence of events numbered contiguously from 1. The expected
 * version check performed by {@link #append(String, long, List)} is the only serialization point
 * between concurrent writers of the same stream.
 */
public interface EventStore {
  /**
   * Atomically appends events to the stream.
   *
   * @param streamId to append to
   * @param expectedVersion the writer was based on, {@code 0} for a new stream
   * @param events to append, in order
   * @return new version of the stream
   * @throws IllegalArgumentException if stream ID is blank, expected version is negative or events
   *     are {@code null}
   * @throws ConcurrencyConflictException if current version differs from the expected one
   */
  long append(String streamId, long expectedVersion, List<? extends DomainEvent<?>> events);

  /**
   * @param streamId to read
   * @param fromVersion exclusive lower bound of sequence numbers to return
   * @return events with sequence number greater than {@code fromVersion} in stream order, empty
   *     list for unknown streams
   * @throws IllegalArgumentException if stream ID is blank or version is negative
   */
  List<StoredEvent> readStream(String streamId, long fromVersion);

  /**
   * @param streamId to read
   * @return all events of the stream in order
   * @throws IllegalArgumentException if stream ID is blank
   */
  default List<StoredEvent> readStream(String streamId) {
    return readStream(streamId, 0);
  }

  /**
   * @param streamId to check
   * @return sequence number of the last event, {@code 0} for unknown streams
   * @throws IllegalArgumentException if stream ID is blank
   */
  long currentVersion(String streamId);

  /**
   * @param streamId to check
   * @return {@code true} if at least one event was appended to the stream
   * @throws IllegalArgumentException if stream ID is blank
   */
  default boolean containsStream(String streamId) {
    return currentVersion(streamId) > 0;
  }

  /**
   * Common argument checks for implementations.
   *
   * @param streamId to verify
   * @return the same stream ID
   * @throws IllegalArgumentException if stream ID is {@code null} or blank
   */
  static String requireStreamId(final String streamId) {
    if (streamId == null || streamId.isBlank()) {
      throw new IllegalArgumentException("Stream ID cannot be blank");
    }

    return streamId;
  }

  /**
   * @param version to verify
   * @return the same version
   * @throws IllegalArgumentException if version is negative
   */
  static long requireVersion(final long version) {
    if (version < 0) {
      throw new IllegalArgumentException("Version cannot be negative");
    }

    return version;
  }
}
