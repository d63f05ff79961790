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

/**
 * Defines the request mediation contract used by the codebase.
 *
 * <p>Here is an example to help explain how the pieces are related to each other - let's assume
 * that we run a small restaurant:
 *
 * <ul>
 *   <li>A guest asking to place an order is a {@link io.github.suppierk.mediator.cqrs.DomainCommand}
 *       - it is an intent to change the state of the restaurant.
 *   <li>A guest asking whether the order is ready is a {@link
 *       io.github.suppierk.mediator.cqrs.DomainQuery} - it only reads the state.
 *   <li>The waiter taking both is the {@link io.github.suppierk.mediator.cqrs.Mediator}: it knows
 *       exactly one cook for each kind of request, the {@link
 *       io.github.suppierk.mediator.cqrs.DomainRequestHandler}.
 *   <li>On the way to the kitchen every request passes the same checkpoints, the {@link
 *       io.github.suppierk.mediator.cqrs.PipelineBehavior}s - a manager rejecting malformed orders,
 *       a ledger noting each order down, and the pass where finished work is handed over only once
 *       it is complete.
 *   <li>Every answer comes back as an {@link io.github.suppierk.mediator.cqrs.OperationResult}: a
 *       dish, or an apology with the reason.
 * </ul>
 */
package io.github.suppierk.mediator.cqrs;
