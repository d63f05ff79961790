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

package io.github.suppierk.mediator.cqrs;

import java.util.Objects;
import java.util.Optional;
import java.util.StringJoiner;
import java.util.function.Function;

/**
 * Outcome of a {@link DomainRequest}: either a success with an optional payload or a failure with
 * a problem detail, tagged with an {@link OperationStatus}.
 *
 * <p>Expected failures, such as a missing entity or a broken business rule, are returned as failed
 * results and never thrown.
 *
 * @param <T> is the type of the payload
 */
public final class OperationResult<T> {
  private final OperationStatus status;
  private final T data;
  private final String detail;

  private OperationResult(final OperationStatus status, final T data, final String detail) {
    this.status = status;
    this.data = data;
    this.detail = detail;
  }

  /**
   * @param status of the success, must be 2xx
   * @param data payload, can be {@code null}
   * @param <T> is the type of the payload
   * @return successful result
   * @throws IllegalArgumentException if status is {@code null} or not a success
   */
  public static <T> OperationResult<T> success(final OperationStatus status, final T data) {
    if (status == null) {
      throw new IllegalArgumentException("Status cannot be null");
    }

    if (!status.isSuccess()) {
      throw new IllegalArgumentException("%s is not a success status".formatted(status));
    }

    return new OperationResult<>(status, data, null);
  }

  /**
   * @param status of the failure, must not be 2xx
   * @param detail describing the problem
   * @param <T> is the type of the payload
   * @return failed result
   * @throws IllegalArgumentException if status is {@code null} or a success
   */
  public static <T> OperationResult<T> failure(final OperationStatus status, final String detail) {
    if (status == null) {
      throw new IllegalArgumentException("Status cannot be null");
    }

    if (status.isSuccess()) {
      throw new IllegalArgumentException("%s is not a failure status".formatted(status));
    }

    return new OperationResult<>(status, null, detail);
  }

  public static <T> OperationResult<T> ok() {
    return success(OperationStatus.OK, null);
  }

  public static <T> OperationResult<T> ok(final T data) {
    return success(OperationStatus.OK, data);
  }

  public static <T> OperationResult<T> created(final T data) {
    return success(OperationStatus.CREATED, data);
  }

  public static <T> OperationResult<T> accepted() {
    return success(OperationStatus.ACCEPTED, null);
  }

  public static <T> OperationResult<T> badRequest(final String detail) {
    return failure(OperationStatus.BAD_REQUEST, detail);
  }

  public static <T> OperationResult<T> forbidden(final String detail) {
    return failure(OperationStatus.FORBIDDEN, detail);
  }

  public static <T> OperationResult<T> notFound(final String detail) {
    return failure(OperationStatus.NOT_FOUND, detail);
  }

  public static <T> OperationResult<T> conflict(final String detail) {
    return failure(OperationStatus.CONFLICT, detail);
  }

  public static <T> OperationResult<T> internalError(final String detail) {
    return failure(OperationStatus.INTERNAL_ERROR, detail);
  }

  public OperationStatus getStatus() {
    return status;
  }

  /**
   * @return HTTP status code of this result
   */
  public int getStatusCode() {
    return status.getStatusCode();
  }

  public boolean isSuccess() {
    return status.isSuccess();
  }

  public boolean isFailure() {
    return !status.isSuccess();
  }

  /**
   * @return payload of a successful result, empty for failures and payload-less successes
   */
  public Optional<T> getData() {
    return Optional.ofNullable(data);
  }

  /**
   * @return problem detail of a failed result
   */
  public Optional<String> getDetail() {
    return Optional.ofNullable(detail);
  }

  /**
   * Transforms the payload of a successful result, failures are carried over as they are.
   *
   * @param mapper to apply to the payload
   * @param <U> is the new payload type
   * @return result with the same status
   * @throws IllegalArgumentException if mapper is {@code null}
   */
  public <U> OperationResult<U> map(final Function<? super T, ? extends U> mapper) {
    if (mapper == null) {
      throw new IllegalArgumentException("Mapper cannot be null");
    }

    if (isFailure()) {
      return new OperationResult<>(status, null, detail);
    }

    return new OperationResult<>(status, data == null ? null : mapper.apply(data), null);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;

    OperationResult<?> that = (OperationResult<?>) o;
    return status == that.status
        && Objects.equals(data, that.data)
        && Objects.equals(detail, that.detail);
  }

  @Override
  public int hashCode() {
    return Objects.hash(status, data, detail);
  }

  @Override
  public String toString() {
    final var joiner =
        new StringJoiner(", ", OperationResult.class.getSimpleName() + "[", "]")
            .add("status=" + status);

    if (data != null) {
      joiner.add("data=" + data);
    }

    if (detail != null) {
      joiner.add("detail='" + detail + "'");
    }

    return joiner.toString();
  }
}
