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
import java.util.List;

/**
 * Checks a request before it reaches its handler.
 *
 * @param <Q> is the type of the request
 */
@FunctionalInterface
public interface RequestValidator<Q extends DomainRequest<?>> {
  /**
   * @param request to check
   * @return problems found, empty list if the request is valid
   */
  List<String> validate(Q request);
}
