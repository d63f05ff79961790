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
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Logs the start, the outcome and the duration of every request. */
public final class LoggingBehavior implements PipelineBehavior {
  private static final Logger log = LoggerFactory.getLogger(LoggingBehavior.class);

  /** {@inheritDoc} */
  @Override
  public <R> OperationResult<R> handle(
      final DomainRequest<R> request, final RequestHandlerDelegate<R> next) throws Exception {
    final String requestName = request.getClass().getSimpleName();
    log.debug("Handling {}", requestName);

    final long start = System.nanoTime();
    final OperationResult<R> result;
    try {
      result = next.proceed();
    } catch (Exception e) {
      log.error("{} failed after {} ms", requestName, elapsedMillis(start), e);
      throw e;
    }

    if (result == null) {
      return null;
    }

    if (result.isSuccess()) {
      log.info(
          "{} completed with {} in {} ms", requestName, result.getStatus(), elapsedMillis(start));
    } else {
      log.warn(
          "{} completed with {} in {} ms: {}",
          requestName,
          result.getStatus(),
          elapsedMillis(start),
          result.getDetail().orElse(""));
    }

    return result;
  }

  private static long elapsedMillis(final long start) {
    return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
  }
}
