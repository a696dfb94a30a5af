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

import java.util.ServiceLoader;

public final class Keepers {
  private static final ServiceLoader<KeeperProvider> LOADER =
      ServiceLoader.load(KeeperProvider.class);

  private Keepers() {}

  /**
   * Creates a keeper with the provider registered under {@code name}.
   *
   * @throws IllegalStateException if no provider has that name
   */
  public static Keeper create(String name, KeeperSettings settings) {
    KeeperProvider p;
    synchronized (LOADER) {
      p =
          LOADER.stream()
              .map(ServiceLoader.Provider::get)
              .filter(kp -> kp.name().equalsIgnoreCase(name))
              .findFirst()
              .orElseThrow(
                  () -> new IllegalStateException("No KeeperProvider for name=" + name));
    }
    return p.create(settings);
  }
}
