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

/**
 * Outcome categories of a request, aligned with HTTP status codes for consumer convenience.
 *
 * @see <a href="https://developer.mozilla.org/en-US/docs/Web/HTTP/Status">HTTP response status
 *     codes</a>
 */
public enum OperationStatus {
  OK(200, "OK"),
  CREATED(201, "Created"),
  ACCEPTED(202, "Accepted"),
  BAD_REQUEST(400, "Bad Request"),
  FORBIDDEN(403, "Forbidden"),
  NOT_FOUND(404, "Not Found"),
  CONFLICT(409, "Conflict"),
  INTERNAL_ERROR(500, "Internal Server Error");

  private final int statusCode;
  private final String title;

  OperationStatus(final int statusCode, final String title) {
    this.statusCode = statusCode;
    this.title = title;
  }

  /**
   * @return the most appropriate HTTP status code
   */
  public int getStatusCode() {
    return statusCode;
  }

  /**
   * @return human-readable name of the status
   */
  public String getTitle() {
    return title;
  }

  /**
   * @return {@code true} for 2xx statuses
   */
  public boolean isSuccess() {
    return statusCode >= 200 && statusCode < 300;
  }
}
