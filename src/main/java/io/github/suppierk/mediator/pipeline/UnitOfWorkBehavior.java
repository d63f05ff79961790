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

import io.github.suppierk.java.Try;
import io.github.suppierk.mediator.async.DispatchReport;
import io.github.suppierk.mediator.async.DomainEventDispatcher;
import io.github.suppierk.mediator.cqrs.DomainRequest;
import io.github.suppierk.mediator.cqrs.OperationResult;
import io.github.suppierk.mediator.cqrs.PipelineBehavior;
import io.github.suppierk.mediator.cqrs.RequestHandlerDelegate;
import io.github.suppierk.mediator.data.CommitBoundary;
import io.github.suppierk.mediator.data.ConcurrencyConflictException;
import io.github.suppierk.mediator.data.UnitOfWork;
import io.github.suppierk.mediator.data.UnitOfWork.PendingEvent;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Commits the {@link UnitOfWork} of a request.
 *
 * <ol>
 *   <li>Binds a fresh unit of work and calls the rest of the chain.
 *   <li>Failed results are returned unchanged: nothing is written and nothing is dispatched.
 *   <li>Successful results trigger {@link UnitOfWork#persist()} inside the {@link CommitBoundary};
 *       a {@link ConcurrencyConflictException} turns the result into {@link
 *       OperationResult#conflict(String)} and drops the events.
 *   <li>Once the writes succeeded the collected events are handed to the {@link
 *       DomainEventDispatcher} in collection order.
 * </ol>
 *
 * <p>Events are dispatched after the unit of work is unbound, so subscribers run outside of it.
 * Dispatch problems are logged and never change the result.
 */
public final class UnitOfWorkBehavior implements PipelineBehavior {
  private static final Logger log = LoggerFactory.getLogger(UnitOfWorkBehavior.class);

  private final DomainEventDispatcher eventDispatcher;
  private final CommitBoundary commitBoundary;

  /**
   * @param eventDispatcher delivering events after commit
   * @throws IllegalArgumentException if dispatcher is {@code null}
   */
  public UnitOfWorkBehavior(final DomainEventDispatcher eventDispatcher) {
    this(eventDispatcher, CommitBoundary.direct());
  }

  /**
   * @param eventDispatcher delivering events after commit
   * @param commitBoundary wrapping the writes
   * @throws IllegalArgumentException if any of the arguments is {@code null}
   */
  public UnitOfWorkBehavior(
      final DomainEventDispatcher eventDispatcher, final CommitBoundary commitBoundary) {
    if (eventDispatcher == null) {
      throw new IllegalArgumentException("Event dispatcher cannot be null");
    }

    if (commitBoundary == null) {
      throw new IllegalArgumentException("Commit boundary cannot be null");
    }

    this.eventDispatcher = eventDispatcher;
    this.commitBoundary = commitBoundary;
  }

  /** {@inheritDoc} */
  @Override
  public <R> OperationResult<R> handle(
      final DomainRequest<R> request, final RequestHandlerDelegate<R> next) throws Exception {
    final OperationResult<R> result;
    final List<PendingEvent> pendingEvents;

    try (UnitOfWork.Scope scope = UnitOfWork.begin()) {
      final UnitOfWork unitOfWork = scope.getUnitOfWork();
      result = next.proceed();

      if (result == null || result.isFailure()) {
        log.debug("Skipping commit of {}", request.getClass().getSimpleName());
        return result;
      }

      try {
        commitBoundary.commit(unitOfWork::persist);
      } catch (ConcurrencyConflictException e) {
        log.warn("Commit of {} rejected: {}", request.getClass().getSimpleName(), e.getMessage());
        return OperationResult.conflict(e.getMessage());
      }

      pendingEvents = unitOfWork.collectAndClearEvents();
    }

    for (PendingEvent pending : pendingEvents) {
      dispatch(pending);
    }

    return result;
  }

  private void dispatch(final PendingEvent pending) {
    final Try<DispatchReport> report = Try.of(() -> eventDispatcher.dispatch(pending.event()));

    report.ifSuccess(
        delivery -> {
          if (!delivery.isFullyDelivered()) {
            log.warn(
                "'{}' of '{}' was not delivered to {} subscriber(s)",
                pending.event().eventType(),
                pending.entity().getId(),
                delivery.failures().size());
          }
        });

    report.ifFailure(
        cause ->
            log.error(
                "Dispatch of '{}' of '{}' failed",
                pending.event().eventType(),
                pending.entity().getId(),
                cause));
  }
}
