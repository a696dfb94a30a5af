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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class CubeIdTest {

  @Test
  void rootHasNoParentAndEmptyEncodings() {
    CubeId root = CubeId.root(2);

    assertThat(root.isRoot()).isTrue();
    assertThat(root.depth()).isZero();
    assertThat(root.parent()).isEmpty();
    assertThat(root.string()).isEmpty();
    assertThat(root.bytes()).containsExactly(0, 0);
  }

  @Test
  void containerPicksOneSelectorPerLevel() {
    Point p = new Point(0.75, 0.25);

    CubeId cube = CubeId.container(p, 2);

    // level 0: x upper half, y lower half; level 1: upper halves of both
    assertThat(cube).isEqualTo(CubeId.of(2, 2, 3));
    assertThat(cube.contains(p)).isTrue();
    assertThat(CubeId.root(2).childContaining(p).childContaining(p)).isEqualTo(cube);
  }

  @Test
  void parentIsPrefixOfContainer() {
    Random random = new Random(7);
    for (int i = 0; i < 200; i++) {
      Point p = new Point(random.nextDouble(), random.nextDouble(), random.nextDouble());
      CubeId cube = CubeId.container(p, 1 + random.nextInt(20));
      CubeId parent = cube.parent().orElseThrow();

      assertThat(parent.depth()).isEqualTo(cube.depth() - 1);
      assertThat(parent.isAncestorOf(cube)).isTrue();
      assertThat(parent.contains(p)).isTrue();
      assertThat(parent.childContaining(p)).isEqualTo(cube);
    }
  }

  @Test
  void cornersBoundTheHyperRectangle() {
    CubeId cube = CubeId.of(2, 2, 3);

    assertThat(cube.from()).containsExactly(0.75, 0.25);
    assertThat(cube.to()).containsExactly(1.0, 0.5);
    assertThat(CubeId.root(2).to()).containsExactly(1.0, 1.0);
  }

  @Test
  void childrenAreOrderedAndShareTheParent() {
    CubeId cube = CubeId.of(2, 1);

    List<CubeId> children = cube.children();

    assertThat(children).hasSize(4).isSorted();
    assertThat(children).allSatisfy(c -> assertThat(c.parent()).contains(cube));
  }

  @Test
  void orderingIsPreOrder() {
    List<CubeId> expected =
        List.of(
            CubeId.root(2),
            CubeId.of(2, 0),
            CubeId.of(2, 0, 0),
            CubeId.of(2, 0, 3),
            CubeId.of(2, 0, 3, 1),
            CubeId.of(2, 1),
            CubeId.of(2, 3, 2));
    List<CubeId> shuffled = new ArrayList<>(expected);
    Collections.shuffle(shuffled, new Random(3));

    Collections.sort(shuffled);

    assertThat(shuffled).containsExactlyElementsOf(expected);
  }

  @Test
  void bytesPackDigitsMostSignificantBitFirst() {
    CubeId cube = CubeId.of(2, 3, 1);

    assertThat(cube.bytes()).containsExactly(0, 2, 0xD0);
    assertThat(CubeId.fromBytes(2, cube.bytes())).isEqualTo(cube);
    assertThat(CubeId.fromBytes(2, new byte[] {0, 1, (byte) 0xC0})).isEqualTo(CubeId.of(2, 3));
  }

  @Test
  void malformedBytesAreCorruption() {
    assertThatThrownBy(() -> CubeId.fromBytes(2, new byte[] {0}))
        .isInstanceOf(CorruptIndexDataException.class);
    assertThatThrownBy(() -> CubeId.fromBytes(2, new byte[] {0, 2}))
        .isInstanceOf(CorruptIndexDataException.class)
        .hasMessageContaining("needs 3 bytes");
    assertThatThrownBy(() -> CubeId.fromBytes(2, new byte[] {0, 2, (byte) 0xD1}))
        .isInstanceOf(CorruptIndexDataException.class)
        .hasMessageContaining("pad bits");
  }

  @ParameterizedTest
  @ValueSource(ints = {1, 2, 3, 6, 7, 13})
  void stringFormParsesBack(int dims) {
    Random random = new Random(dims);
    double[] coords = new double[dims];
    for (int i = 0; i < dims; i++) {
      coords[i] = random.nextDouble();
    }
    CubeId cube = CubeId.container(new Point(coords), 9);

    assertThat(cube.string()).hasSize(9 * ((dims + 5) / 6));
    assertThat(CubeId.fromString(dims, cube.string())).isEqualTo(cube);
    assertThat(CubeId.fromBytes(dims, cube.bytes())).isEqualTo(cube);
  }

  @Test
  void stringUsesSixBitsPerCharacter() {
    assertThat(CubeId.of(2, 3, 1).string()).isEqualTo("DB");
    assertThat(CubeId.of(7, 127).string()).isEqualTo("B/");
  }

  @Test
  void malformedStringsAreCorruption() {
    assertThatThrownBy(() -> CubeId.fromString(2, "D!"))
        .isInstanceOf(CorruptIndexDataException.class);
    assertThatThrownBy(() -> CubeId.fromString(2, "Z"))
        .isInstanceOf(CorruptIndexDataException.class);
    assertThatThrownBy(() -> CubeId.fromString(7, "ABC"))
        .isInstanceOf(CorruptIndexDataException.class);
  }

  @Test
  void rejectsInvalidDigitsAndDimensions() {
    assertThatThrownBy(() -> CubeId.of(2, 4)).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> CubeId.root(0)).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> CubeId.root(2).childContaining(new Point(0.1)))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
