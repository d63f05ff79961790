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

import java.io.Serial;

/**
 * Unchecked wrapper for checked exceptions thrown by a handler or a {@link PipelineBehavior}.
 *
 * <p>The original exception is always available via {@link #getCause()}.
 */
public class RequestExecutionException extends RuntimeException {
  @Serial private static final long serialVersionUID = 5315907312640262377L;

  /**
   * @param requestClass being executed
   * @param cause thrown by the pipeline
   */
  public RequestExecutionException(final Class<?> requestClass, final Throwable cause) {
    super(
        "Execution of '%s' failed".formatted(requestClass == null ? "null" : requestClass.getName()),
        cause);
  }
}
