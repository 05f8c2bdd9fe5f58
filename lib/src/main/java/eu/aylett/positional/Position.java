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

import org.jspecify.annotations.NonNull;

/**
 * A handle on the location of one element in a {@link PositionalList}.
 * <p>
 * Positions are issued only by the list, and stay valid until the element
 * they refer to is deleted. Replacing the element, or inserting and deleting
 * elsewhere in the list, leaves a position valid. Two positions are equal when
 * they refer to the same location, whatever the elements there.
 *
 * @param <E>
 *          the type of elements held in the list
 */
public interface Position<E extends @NonNull Object> {

  /**
   * Returns the element currently stored at this position.
   *
   * @throws StalePositionException
   *           if the element has been deleted from the list
   */
  E element();
}
