/*
 * Copyright 2026 Andrew Aylett
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package eu.aylett.positional;

import org.junit.jupiter.api.Test;

/**
 * This test is kept in step with the example in README.md.
 */
public class ReadmeTest {
  @Test
  void test() {
    var list = PositionalList.<Integer>create();
    var ten = list.addLast(10);
    list.addLast(20);
    list.addFirst(5);
    assert list.toString().equals("PositionalList[5, 10, 20]");

    list.replace(ten, 11);
    assert ten.element() == 11;

    list.delete(ten);
    try {
      ten.element();
      assert false;
    } catch (StalePositionException expected) {
      assert list.size() == 2;
    }
  }
}
