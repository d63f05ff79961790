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

package io.github.suppierk.mediator.jooq;

import io.github.suppierk.mediator.data.CommitBoundary;
import org.jooq.Configuration;
import org.jooq.DSLContext;

/**
 * {@link CommitBoundary} running the writes of a unit of work in one jOOQ transaction.
 *
 * <p>Writes are rolled back together only when the stores execute on the same JDBC connection as
 * the given {@link DSLContext}, e.g. when they were built from it through {@link
 * DslContextProvider#dslContextIdentity(DSLContext)}.
 */
public final class JooqCommitBoundary implements CommitBoundary {
  private final DSLContext dsl;

  /**
   * @param dsl to open transactions on
   * @throws IllegalArgumentException if DSLContext is {@code null}
   */
  public JooqCommitBoundary(final DSLContext dsl) {
    if (dsl == null) {
      throw new IllegalArgumentException("DSLContext is null");
    }

    this.dsl = dsl;
  }

  /** {@inheritDoc} */
  @Override
  public void commit(final Runnable persistence) {
    if (persistence == null) {
      throw new IllegalArgumentException("Persistence cannot be null");
    }

    dsl.transaction((final Configuration trx) -> persistence.run());
  }
}
