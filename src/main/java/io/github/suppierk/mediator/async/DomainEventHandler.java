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

/**
 * Subscriber reacting to a specific {@link DomainEvent} type after it was persisted.
 *
 * <p>Handlers run after the request outcome is already decided, so their failures are reported but
 * never change that outcome.
 *
 * @param <T> is the type of the event
 */
@FunctionalInterface
public interface DomainEventHandler<T extends DomainEvent<?>> {
  /**
   * @param event to react to
   * @throws Exception if the reaction failed
   * @see <a href="https://rules.sonarsource.com/java/RSPEC-112/">Suppressed Sonar rule to allow
   *     more flexibility</a>
   */
  @SuppressWarnings("squid:S112")
  void handle(T event) throws Exception;
}
