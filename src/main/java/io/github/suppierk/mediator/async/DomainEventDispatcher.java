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
 * Abstract contract for delivering {@link DomainEvent}s to interested subscribers.
 *
 * <p>Delivery is fire-and-forget: implementations must not throw because of subscriber failures,
 * reporting them through {@link DispatchReport} instead. Retries and durable delivery, if needed,
 * belong to subscribers or to an outbox placed behind this interface.
 */
public interface DomainEventDispatcher {
  /**
   * @return an instance of dispatcher which does not deliver events anywhere
   */
  static DomainEventDispatcher empty() {
    return NoOp.INSTANCE;
  }

  /**
   * Delivers the event to every subscriber of its exact class.
   *
   * @param event to deliver
   * @return delivery outcome
   * @throws IllegalArgumentException if event is {@code null}
   */
  DispatchReport dispatch(final DomainEvent<?> event);

  /** Default implementation of the fake dispatcher */
  final class NoOp implements DomainEventDispatcher {
    private static final DomainEventDispatcher INSTANCE = new NoOp();

    private NoOp() {
      // Cannot be instantiated from the outside
    }

    @Override
    public DispatchReport dispatch(final DomainEvent<?> event) {
      return new DispatchReport(event, 0, List.of());
    }
  }
}
