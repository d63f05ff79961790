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
 * Class to accept and process the work associated to a specific {@link DomainQuery}.
 *
 * <p>Query handlers should only read: entities loaded through repositories are still enlisted into
 * the unit of work, but nothing is written unless the handler registers changes.
 *
 * @param <QUERY> the type of the particular {@link DomainQuery}
 * @param <RESULT> is the type of the payload returned on success
 * @see <a href="https://rules.sonarsource.com/java/RSPEC-119/">Suppressed Sonar rule for the sake
 *     to have more readable type names</a>
 */
@SuppressWarnings("squid:S119")
// @formatter:off
public abstract non-sealed class DomainQueryHandler<
  QUERY extends DomainQuery<RESULT>,
  RESULT
> extends DomainRequestHandler<QUERY, RESULT> {
// @formatter:on

  /**
   * Constructs a new {@link DomainQueryHandler} for a specific {@link DomainQuery} class.
   *
   * @param queryClass the class of the {@link DomainQuery} to handle
   * @throws IllegalArgumentException if the query class is null
   */
  protected DomainQueryHandler(final Class<QUERY> queryClass) {
    super(queryClass);
  }
}
