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
 * Represents an immutable request routed by the {@link Mediator} to exactly one handler.
 *
 * <p>It is highly recommended to use this interface with Java {@link Record}s.
 *
 * <p>Java {@code sealed} feature restricts requests to be either a {@link DomainCommand} or a
 * {@link DomainQuery}, so that every request clearly states whether it changes the model.
 *
 * @param <RESULT> is the type of the payload returned on success
 * @see <a href="https://rules.sonarsource.com/java/RSPEC-119/">Suppressed Sonar rule for the sake
 *     to have more readable type names</a>
 */
@SuppressWarnings("squid:S119")
public sealed interface DomainRequest<RESULT> permits DomainCommand, DomainQuery {}
