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
 * Class to accept and process the work associated to a specific {@link DomainCommand}:
 *
 * <ul>
 *   <li>Load the affected entities through repositories.
 *   <li>Change them through their own methods, letting them raise domain events.
 *   <li>Register new or changed entities with the repositories.
 * </ul>
 *
 * <p>The handler itself never writes anything: entities registered with repositories are persisted
 * when the unit of work commits after a successful result.
 *
 * @param <COMMAND> the type of the particular {@link DomainCommand}
 * @param <RESULT> is the type of the payload returned on success
 * @see <a href="https://rules.sonarsource.com/java/RSPEC-119/">Suppressed Sonar rule for the sake
 *     to have more readable type names</a>
 */
@SuppressWarnings("squid:S119")
// @formatter:off
public abstract non-sealed class DomainCommandHandler<
  COMMAND extends DomainCommand<RESULT>,
  RESULT
> extends DomainRequestHandler<COMMAND, RESULT> {
// @formatter:on

  /**
   * Constructs a new {@link DomainCommandHandler} for a specific {@link DomainCommand} class.
   *
   * @param commandClass the class of the {@link DomainCommand} to handle
   * @throws IllegalArgumentException if the command class is null
   */
  protected DomainCommandHandler(final Class<COMMAND> commandClass) {
    super(commandClass);
  }
}
