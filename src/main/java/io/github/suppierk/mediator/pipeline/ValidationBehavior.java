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

package io.github.suppierk.mediator.pipeline;

import io.github.suppierk.mediator.cqrs.DomainRequest;
import io.github.suppierk.mediator.cqrs.OperationResult;
import io.github.suppierk.mediator.cqrs.PipelineBehavior;
import io.github.suppierk.mediator.cqrs.RequestHandlerDelegate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rejects invalid requests with {@link OperationResult#badRequest(String)} before the handler
 * runs.
 *
 * <p>Every validator registered for the exact request class is run, so the result lists all
 * problems at once, joined with {@code "; "}.
 */
public final class ValidationBehavior implements PipelineBehavior {
  private static final Logger log = LoggerFactory.getLogger(ValidationBehavior.class);

  static final String MESSAGE_SEPARATOR = "; ";

  private final Map<Class<?>, List<RequestValidator<DomainRequest<?>>>> validators;

  private ValidationBehavior(
      final Map<Class<?>, List<RequestValidator<DomainRequest<?>>>> validators) {
    this.validators = validators;
  }

  /**
   * @return a new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /** {@inheritDoc} */
  @Override
  public boolean appliesTo(final DomainRequest<?> request) {
    return validators.containsKey(request.getClass());
  }

  /** {@inheritDoc} */
  @Override
  public <R> OperationResult<R> handle(
      final DomainRequest<R> request, final RequestHandlerDelegate<R> next) throws Exception {
    final List<String> problems = new ArrayList<>();
    for (RequestValidator<DomainRequest<?>> validator :
        validators.getOrDefault(request.getClass(), List.of())) {
      final List<String> found = validator.validate(request);
      if (found == null) {
        throw new IllegalStateException(
            "Validator of '%s' returned null".formatted(request.getClass().getSimpleName()));
      }

      problems.addAll(found);
    }

    if (!problems.isEmpty()) {
      log.debug("Rejected {}: {}", request.getClass().getSimpleName(), problems);
      return OperationResult.badRequest(String.join(MESSAGE_SEPARATOR, problems));
    }

    return next.proceed();
  }

  /** Write-once registry of validators. */
  public static final class Builder {
    private final Map<Class<?>, List<RequestValidator<DomainRequest<?>>>> validators;

    private Builder() {
      this.validators = new LinkedHashMap<>();
    }

    /**
     * @param requestClass to validate, matched exactly
     * @param validator checking the request
     * @param <Q> is the type of the request
     * @return this builder
     * @throws IllegalArgumentException if any of the arguments is {@code null}
     */
    @SuppressWarnings("unchecked")
    public <Q extends DomainRequest<?>> Builder addValidator(
        final Class<Q> requestClass, final RequestValidator<? super Q> validator) {
      if (requestClass == null) {
        throw new IllegalArgumentException("Request class cannot be null");
      }

      if (validator == null) {
        throw new IllegalArgumentException("Validator cannot be null");
      }

      validators
          .computeIfAbsent(requestClass, key -> new ArrayList<>())
          .add((RequestValidator<DomainRequest<?>>) (RequestValidator<?>) validator);
      return this;
    }

    /**
     * @return immutable behavior
     */
    public ValidationBehavior build() {
      final Map<Class<?>, List<RequestValidator<DomainRequest<?>>>> copy = new LinkedHashMap<>();
      validators.forEach((requestClass, list) -> copy.put(requestClass, List.copyOf(list)));
      return new ValidationBehavior(Collections.unmodifiableMap(copy));
    }
  }
}
