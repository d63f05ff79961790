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
 * Defines the common contract of request handlers.
 *
 * <p>Because {@link DomainRequest} leverages new Java {@code sealed} feature, for more type safety
 * this class also makes use of the same feature.
 *
 * <p><b>Design note</b>: whichever parameters can be controlled must be covered with null checks
 * and {@code final} (if possible), whichever parameters are expected to be provided by consumer
 * must be checked with the help of {@link Suspicious} methods.
 *
 * @param <REQUEST> supported by the current handler
 * @param <RESULT> is the type of the payload returned on success
 * @see <a href="https://rules.sonarsource.com/java/RSPEC-119/">Suppressed Sonar rule for the sake
 *     to have more readable type names</a>
 */
@SuppressWarnings("squid:S119")
// @formatter:off
public abstract sealed class DomainRequestHandler<
  REQUEST extends DomainRequest<RESULT>,
  RESULT
>
extends
        Suspicious
permits
  DomainCommandHandler, DomainQueryHandler
{
// @formatter:on
  private final Class<REQUEST> requestClass;

  /**
   * Constructs a new handler for a specific request class.
   *
   * @param requestClass the class of the request to handle
   * @throws IllegalArgumentException if the request class is null
   */
  DomainRequestHandler(final Class<REQUEST> requestClass) {
    this.requestClass = throwIllegalArgumentIfNull(requestClass, "Request class");
  }

  /**
   * @return the class type of the request handled by this handler
   */
  public final Class<REQUEST> getRequestClass() {
    return requestClass;
  }

  /**
   * Business logic of the request.
   *
   * <p>Expected failures must be returned as failed {@link OperationResult}s rather than thrown.
   *
   * @param request being handled
   * @return outcome of the request
   * @throws Exception if an unexpected error occurs during processing
   * @see <a href="https://rules.sonarsource.com/java/RSPEC-112/">Suppressed Sonar rule to allow
   *     more flexibility</a>
   */
  @SuppressWarnings("squid:S112")
  protected abstract OperationResult<RESULT> handle(final REQUEST request) throws Exception;

  /**
   * Executes the handler on behalf of the {@link Mediator}.
   *
   * @param request being handled
   * @return outcome of the request
   * @throws IllegalArgumentException if the request is {@code null}
   * @throws IllegalStateException if the handler returned {@code null}
   * @throws Exception if an unexpected error occurs during processing
   */
  @SuppressWarnings("squid:S112")
  final OperationResult<RESULT> handleInContext(final REQUEST request) throws Exception {
    final REQUEST nonNullRequest = throwIllegalArgumentIfNull(request, "Request");
    return throwIllegalStateIfNull(handle(nonNullRequest), "Handler result");
  }
}
