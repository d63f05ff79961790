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

import io.github.suppierk.mediator.async.DispatchReport;
import io.github.suppierk.mediator.async.DomainEventDispatcher;
import io.github.suppierk.mediator.domain.DomainEvent;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Routes each {@link DomainRequest} through the ordered {@link PipelineBehavior} chain to the one
 * handler registered for its exact class.
 *
 * <p>The registry is built once through {@link #builder()} and is read-only afterwards, so a single
 * instance can serve concurrent requests without locking.
 *
 * <p>Exceptions are never swallowed: runtime exceptions propagate unchanged, checked ones are
 * wrapped into {@link RequestExecutionException}.
 */
public final class Mediator extends Suspicious {
  private static final Logger log = LoggerFactory.getLogger(Mediator.class);

  private final Map<Class<?>, Supplier<? extends DomainRequestHandler<?, ?>>> handlers;
  private final List<PipelineBehavior> behaviors;
  private final DomainEventDispatcher eventDispatcher;

  private Mediator(final Builder builder) {
    this.handlers = Collections.unmodifiableMap(new LinkedHashMap<>(builder.handlers));
    this.behaviors = List.copyOf(builder.behaviors);
    this.eventDispatcher = builder.eventDispatcher;
  }

  /**
   * @return a new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Executes the request.
   *
   * @param request to execute
   * @param <R> is the type of the payload returned on success
   * @return outcome of the request
   * @throws IllegalArgumentException if the request is {@code null}
   * @throws HandlerNotFoundException if there is no handler for the request class
   * @throws IllegalStateException if the handler or the chain produced {@code null}
   * @throws RequestExecutionException if a checked exception was thrown while handling
   */
  @SuppressWarnings("unchecked")
  public <R> OperationResult<R> execute(final DomainRequest<R> request) {
    final DomainRequest<R> nonNullRequest = throwIllegalArgumentIfNull(request, "Request");
    final Supplier<? extends DomainRequestHandler<?, ?>> handlerFactory =
        handlers.get(nonNullRequest.getClass());

    if (handlerFactory == null) {
      throw new HandlerNotFoundException(nonNullRequest.getClass());
    }

    final DomainRequestHandler<DomainRequest<R>, R> handler =
        (DomainRequestHandler<DomainRequest<R>, R>)
            throwIllegalStateIfNull(handlerFactory.get(), "Handler");

    RequestHandlerDelegate<R> chain = () -> handler.handleInContext(nonNullRequest);
    for (int i = behaviors.size() - 1; i >= 0; i--) {
      final PipelineBehavior behavior = behaviors.get(i);
      if (behavior.appliesTo(nonNullRequest)) {
        final RequestHandlerDelegate<R> next = chain;
        chain = () -> behavior.handle(nonNullRequest, next);
      }
    }

    try {
      return throwIllegalStateIfNull(chain.proceed(), "Request result");
    } catch (RuntimeException e) {
      throw e;
    } catch (Exception e) {
      throw new RequestExecutionException(nonNullRequest.getClass(), e);
    }
  }

  /**
   * Delivers an event straight to the configured dispatcher, bypassing any unit of work.
   *
   * @param event to publish
   * @return delivery outcome
   * @throws IllegalArgumentException if the event is {@code null}
   */
  public DispatchReport publish(final DomainEvent<?> event) {
    return eventDispatcher.dispatch(throwIllegalArgumentIfNull(event, "Event"));
  }

  /**
   * @return request classes which have a handler
   */
  public Set<Class<?>> getSupportedRequestClasses() {
    return handlers.keySet();
  }

  /**
   * @return behaviors in invocation order, outermost first
   */
  public List<PipelineBehavior> getBehaviors() {
    return behaviors;
  }

  /** Write-once registry of handlers and behaviors. */
  public static final class Builder extends Suspicious {
    private final Map<Class<?>, Supplier<? extends DomainRequestHandler<?, ?>>> handlers;
    private final List<PipelineBehavior> behaviors;
    private DomainEventDispatcher eventDispatcher;

    private Builder() {
      this.handlers = new LinkedHashMap<>();
      this.behaviors = new ArrayList<>();
      this.eventDispatcher = DomainEventDispatcher.empty();
    }

    /**
     * Registers a handler instance shared by every request.
     *
     * @param handler to register
     * @return this builder
     * @throws IllegalArgumentException if the handler is {@code null}
     * @throws IllegalStateException if the request class already has a handler
     */
    public Builder addHandler(final DomainRequestHandler<?, ?> handler) {
      final DomainRequestHandler<?, ?> nonNullHandler =
          throwIllegalArgumentIfNull(handler, "Handler");
      return register(nonNullHandler.getRequestClass(), () -> nonNullHandler);
    }

    /**
     * Registers a factory creating a handler for every request.
     *
     * @param requestClass handled by the created handlers
     * @param handlerFactory creating handlers
     * @param <Q> is the type of the request
     * @param <R> is the type of the payload returned on success
     * @return this builder
     * @throws IllegalArgumentException if any of the arguments is {@code null}
     * @throws IllegalStateException if the request class already has a handler
     */
    public <Q extends DomainRequest<R>, R> Builder addHandler(
        final Class<Q> requestClass,
        final Supplier<? extends DomainRequestHandler<Q, R>> handlerFactory) {
      return register(
          throwIllegalArgumentIfNull(requestClass, "Request class"),
          throwIllegalArgumentIfNull(handlerFactory, "Handler factory"));
    }

    /**
     * Appends a behavior, the first added behavior is the outermost one.
     *
     * @param behavior to append
     * @return this builder
     * @throws IllegalArgumentException if the behavior is {@code null}
     */
    public Builder addBehavior(final PipelineBehavior behavior) {
      behaviors.add(throwIllegalArgumentIfNull(behavior, "Behavior"));
      return this;
    }

    /**
     * @param eventDispatcher used by {@link Mediator#publish(DomainEvent)}
     * @return this builder
     * @throws IllegalArgumentException if the dispatcher is {@code null}
     */
    public Builder eventDispatcher(final DomainEventDispatcher eventDispatcher) {
      this.eventDispatcher = throwIllegalArgumentIfNull(eventDispatcher, "Event dispatcher");
      return this;
    }

    /**
     * @return immutable mediator
     */
    public Mediator build() {
      final var mediator = new Mediator(this);
      log.debug(
          "Mediator built with {} handler(s) and {} behavior(s)",
          mediator.handlers.size(),
          mediator.behaviors.size());
      return mediator;
    }

    private Builder register(
        final Class<?> requestClass,
        final Supplier<? extends DomainRequestHandler<?, ?>> handlerFactory) {
      if (handlers.putIfAbsent(requestClass, handlerFactory) != null) {
        throw new IllegalStateException(
            "Handler for '%s' is already registered".formatted(requestClass.getSimpleName()));
      }

      return this;
    }
  }
}
