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

package ai.floedb.otree.hash;

/**
 * MurmurHash3 x86 32-bit. Each method takes the running hash as seed, so several values chain
 * into one hash.
 */
public final class Murmur3 {
  private static final int C1 = 0xcc9e2d51;
  private static final int C2 = 0x1b873593;

  private Murmur3() {}

  public static int hashInt(int input, int seed) {
    int h1 = mixH1(seed, mixK1(input));
    return fmix(h1, 4);
  }

  public static int hashLong(long input, int seed) {
    int low = (int) input;
    int high = (int) (input >>> 32);
    int h1 = mixH1(seed, mixK1(low));
    h1 = mixH1(h1, mixK1(high));
    return fmix(h1, 8);
  }

  public static int hashBytes(byte[] data, int seed) {
    int len = data.length;
    int h1 = seed;
    int i = 0;
    for (; i + 4 <= len; i += 4) {
      int k1 =
          (data[i] & 0xff)
              | ((data[i + 1] & 0xff) << 8)
              | ((data[i + 2] & 0xff) << 16)
              | ((data[i + 3] & 0xff) << 24);
      h1 = mixH1(h1, mixK1(k1));
    }

    int k1 = 0;
    switch (len - i) {
      case 3:
        k1 ^= (data[i + 2] & 0xff) << 16;
        // fall through
      case 2:
        k1 ^= (data[i + 1] & 0xff) << 8;
        // fall through
      case 1:
        k1 ^= data[i] & 0xff;
        h1 ^= mixK1(k1);
        break;
      default:
        break;
    }
    return fmix(h1, len);
  }

  private static int mixK1(int k1) {
    k1 *= C1;
    k1 = Integer.rotateLeft(k1, 15);
    k1 *= C2;
    return k1;
  }

  private static int mixH1(int h1, int k1) {
    h1 ^= k1;
    h1 = Integer.rotateLeft(h1, 13);
    h1 = h1 * 5 + 0xe6546b64;
    return h1;
  }

  private static int fmix(int h1, int length) {
    h1 ^= length;
    h1 ^= h1 >>> 16;
    h1 *= 0x85ebca6b;
    h1 ^= h1 >>> 13;
    h1 *= 0xc2b2ae35;
    h1 ^= h1 >>> 16;
    return h1;
  }
}
