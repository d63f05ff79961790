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

import java.io.Serial;

/**
 * A specific {@link Exception} to be thrown when the {@link Mediator} has no handler for a request
 * class.
 *
 * <p>Signals a wiring mistake rather than a business failure, which is why it is thrown instead of
 * being returned as an {@link OperationResult}.
 */
public class HandlerNotFoundException extends UnsupportedOperationException {
  @Serial private static final long serialVersionUID = -2190437786503591642L;

  private final Class<?> requestClass;

  /**
   * @param requestClass which has no registered handler
   */
  public HandlerNotFoundException(final Class<?> requestClass) {
    super(
        "No handler registered for '%s'"
            .formatted(requestClass == null ? "null" : requestClass.getName()));
    this.requestClass = requestClass;
  }

  /**
   * @return request class which has no registered handler
   */
  public Class<?> getRequestClass() {
    return requestClass;
  }

  /**
   * @return the most appropriate HTTP status code for this exception for consumer convenience.
   * @see <a href="https://developer.mozilla.org/en-US/docs/Web/HTTP/Status/501">501 Not
   *     Implemented</a>
   * @see <a href="https://rules.sonarsource.com/java/RSPEC-3400/">Suppressed Sonar rule about
   *     declaring a constant instead</a>
   */
  @SuppressWarnings("squid:S3400")
  public final int getStatusCode() {
    return 501;
  }
}
