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

package ai.floedb.otree.keeper.spi;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;

/**
 * Settings every keeper provider receives.
 *
 * @param reservationTimeout how long an optimization session holds its cubes
 */
public record KeeperSettings(Duration reservationTimeout, Clock clock) {

  public KeeperSettings {
    Objects.requireNonNull(reservationTimeout, "reservationTimeout");
    Objects.requireNonNull(clock, "clock");
    if (reservationTimeout.isNegative() || reservationTimeout.isZero()) {
      throw new IllegalArgumentException(
          "reservationTimeout must be positive: " + reservationTimeout);
    }
  }
}
