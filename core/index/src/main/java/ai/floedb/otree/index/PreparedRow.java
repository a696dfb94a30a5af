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

package ai.floedb.otree.index;

import ai.floedb.otree.model.Row;
import ai.floedb.otree.model.Weight;
import java.util.List;

/**
 * A row ready for placement.
 *
 * @param values indexed values, canonical and with nulls substituted where configured
 * @param identityKey tie breaker between rows of equal weight
 */
public record PreparedRow(Row row, List<Object> values, Weight weight, long identityKey) {}
