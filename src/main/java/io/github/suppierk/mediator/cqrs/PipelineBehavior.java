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

import java.util.Arrays;
import java.util.Set;

/**
 * Cross-cutting step wrapped around every request handled by the {@link Mediator}.
 *
 * <p>Behaviors are invoked in registration order, the first registered being the outermost. A
 * behavior can:
 *
 * <ul>
 *   <li>inspect or reject the request before calling {@code next};
 *   <li>inspect or transform the result after calling {@code next};
 *   <li>short-circuit by returning a result without calling {@code next};
 *   <li>let exceptions thrown by {@code next} propagate.
 * </ul>
 */
public interface PipelineBehavior {
  /**
   * @param request being handled
   * @param next continuation of the chain
   * @param <R> is the type of the payload returned on success
   * @return outcome of the request
   * @throws Exception if the behavior or the rest of the chain failed unexpectedly
   * @see <a href="https://rules.sonarsource.com/java/RSPEC-112/">Suppressed Sonar rule to allow
   *     more flexibility</a>
   */
  @SuppressWarnings("squid:S112")
  <R> OperationResult<R> handle(DomainRequest<R> request, RequestHandlerDelegate<R> next)
      throws Exception;

  /**
   * @param request being handled
   * @return {@code false} to leave this behavior out of the chain for the request
   */
  default boolean appliesTo(DomainRequest<?> request) {
    return true;
  }

  /**
   * Restricts a behavior to specific request classes.
   *
   * @param behavior to restrict
   * @param requestClasses the behavior must run for, matched exactly
   * @return behavior which applies only to the given request classes
   * @throws IllegalArgumentException if any of the arguments is {@code null} or no classes given
   */
  static PipelineBehavior scopedTo(
      final PipelineBehavior behavior, final Class<?>... requestClasses) {
    if (behavior == null) {
      throw new IllegalArgumentException("Behavior cannot be null");
    }

    if (requestClasses == null || requestClasses.length == 0) {
      throw new IllegalArgumentException("Request classes cannot be empty");
    }

    if (Arrays.stream(requestClasses).anyMatch(requestClass -> requestClass == null)) {
      throw new IllegalArgumentException("Request class cannot be null");
    }

    return new Scoped(behavior, Set.of(requestClasses));
  }

  /** Behavior restricted to a set of request classes. */
  final class Scoped implements PipelineBehavior {
    private final PipelineBehavior delegate;
    private final Set<Class<?>> requestClasses;

    private Scoped(final PipelineBehavior delegate, final Set<Class<?>> requestClasses) {
      this.delegate = delegate;
      this.requestClasses = requestClasses;
    }

    @Override
    public <R> OperationResult<R> handle(
        final DomainRequest<R> request, final RequestHandlerDelegate<R> next) throws Exception {
      return delegate.handle(request, next);
    }

    @Override
    public boolean appliesTo(final DomainRequest<?> request) {
      return requestClasses.contains(request.getClass()) && delegate.appliesTo(request);
    }

    @Override
    public String toString() {
      return "Scoped[" + delegate + " for " + requestClasses + "]";
    }
  }
}
