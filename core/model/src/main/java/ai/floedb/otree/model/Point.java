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

import java.util.Arrays;

/** Normalized coordinates of a row, one per indexed column, each in [0, 1). */
public final class Point {
  private final double[] coordinates;

  public Point(double... coordinates) {
    if (coordinates.length == 0) {
      throw new IllegalArgumentException("a point needs at least one coordinate");
    }
    for (double c : coordinates) {
      if (!(c >= 0.0 && c < 1.0)) {
        throw new IllegalArgumentException("coordinate out of [0, 1): " + c);
      }
    }
    this.coordinates = coordinates.clone();
  }

  public int dimensionCount() {
    return coordinates.length;
  }

  public double coordinate(int dimension) {
    return coordinates[dimension];
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof Point p && Arrays.equals(coordinates, p.coordinates);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(coordinates);
  }

  @Override
  public String toString() {
    return "Point" + Arrays.toString(coordinates);
  }
}
