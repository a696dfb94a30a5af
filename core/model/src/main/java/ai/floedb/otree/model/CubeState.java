/*
 * Copyright 2026 Yellowbrick Data, Inc.
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

package ai.floedb.otree.model;

/** Role of a stored row within its cube. */
public enum CubeState {
  /** Row owned by the cube: its weight is below the cube's threshold. */
  FLOODED,
  /** Copy left behind in an announced cube by a row that cascaded deeper. */
  ANNOUNCED,
  /** Row copied from the parent cube by an optimization pass. */
  REPLICATED;
}
