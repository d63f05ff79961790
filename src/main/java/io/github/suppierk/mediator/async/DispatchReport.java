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

package io.github.suppierk.mediator.async;

import io.github.suppierk.mediator.domain.DomainEvent;
import java.util.List;

/**
 * Outcome of a single {@link DomainEvent} delivery.
 *
 * @param event that was delivered
 * @param delivered is the number of subscribers which handled the event successfully
 * @param failures of the remaining subscribers
 */
public record DispatchReport(DomainEvent<?> event, int delivered, List<DispatchFailure> failures) {
  public DispatchReport {
    if (event == null) {
      throw new IllegalArgumentException("Event cannot be null");
    }

    failures = failures == null ? List.of() : List.copyOf(failures);
  }

  /**
   * @return {@code true} if every subscriber handled the event
   */
  public boolean isFullyDelivered() {
    return failures.isEmpty();
  }

  /**
   * Failure of a single subscriber.
   *
   * @param subscriber which failed
   * @param cause of the failure
   */
  public record DispatchFailure(DomainEventHandler<?> subscriber, Throwable cause) {}
}
