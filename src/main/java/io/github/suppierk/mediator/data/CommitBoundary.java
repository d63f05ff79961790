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

package io.github.suppierk.mediator.data;

/**
 * Defines the infrastructure boundary around the persistence step of a unit of work commit.
 *
 * <p>When all repositories share a single transactional resource, an implementation can wrap the
 * writes into one transaction so they are rolled back together.
 */
@FunctionalInterface
public interface CommitBoundary {
  /**
   * Boundary which simply runs the persistence without any extra guarantees.
   *
   * <p>Stale entities are rejected before anything is written, but a concurrent writer which
   * slips in between that check and the write leaves the entities written before the conflict in
   * place. Use a transactional boundary such as {@code JooqCommitBoundary} when all stores share a
   * database and the commit must be all or nothing.
   *
   * @return boundary running the persistence as is
   */
  static CommitBoundary direct() {
    return Runnable::run;
  }

  /**
   * Runs the persistence step.
   *
   * @param persistence writing every enlisted entity
   */
  void commit(Runnable persistence);
}
