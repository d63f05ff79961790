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

import java.io.Serial;

/**
 * A specific {@link Exception} to be thrown when a write was based on a stale version of a stream
 * or an entity state.
 *
 * <p>Nothing is written when this exception is thrown. Callers are expected to reload and retry
 * with the fresh version if it makes sense for them.
 */
public class ConcurrencyConflictException extends RuntimeException {
  @Serial private static final long serialVersionUID = 3620485519305571736L;

  private final String resource;
  private final long expectedVersion;
  private final long actualVersion;

  /**
   * Constructs a new exception describing the version mismatch.
   *
   * @param resource is the stream or entity identifier
   * @param expectedVersion the writer was based on
   * @param actualVersion found in the store
   */
  public ConcurrencyConflictException(
      final String resource, final long expectedVersion, final long actualVersion) {
    this(resource, expectedVersion, actualVersion, null);
  }

  /**
   * Constructs a new exception describing the version mismatch detected by the underlying store.
   *
   * @param resource is the stream or entity identifier
   * @param expectedVersion the writer was based on
   * @param actualVersion found in the store, {@code -1} when unknown
   * @param cause reported by the underlying store
   */
  public ConcurrencyConflictException(
      final String resource,
      final long expectedVersion,
      final long actualVersion,
      final Throwable cause) {
    super(
        "Version conflict on '%s': expected %d, actual %s"
            .formatted(
                resource,
                expectedVersion,
                actualVersion < 0 ? "unknown" : String.valueOf(actualVersion)),
        cause);
    this.resource = resource;
    this.expectedVersion = expectedVersion;
    this.actualVersion = actualVersion;
  }

  /**
   * @return stream or entity identifier
   */
  public String getResource() {
    return resource;
  }

  /**
   * @return version the writer was based on
   */
  public long getExpectedVersion() {
    return expectedVersion;
  }

  /**
   * @return version found in the store, {@code -1} when unknown
   */
  public long getActualVersion() {
    return actualVersion;
  }

  /**
   * @return the most appropriate HTTP status code for this exception for consumer convenience.
   * @see <a href="https://developer.mozilla.org/en-US/docs/Web/HTTP/Status/409">409 Conflict</a>
   * @see <a href="https://rules.sonarsource.com/java/RSPEC-3400/">Suppressed Sonar rule about
   *     declaring a constant instead</a>
   */
  @SuppressWarnings("squid:S3400")
  public final int getStatusCode() {
    return 409;
  }
}
