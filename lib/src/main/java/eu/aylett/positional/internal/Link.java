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

package eu.aylett.positional.internal;

import org.jspecify.annotations.NonNull;

/// The Link interface is implemented by everything that can sit in a
/// [LinkedSequence] chain: the two sentinels and the element-carrying [Node]s
/// between them.
///
/// @param <E>
///            the type of elements held in the chain
public interface Link<E extends @NonNull Object> {

  /// The link immediately before this one.
  ///
  /// @throws UnsupportedOperationException
  ///           on the head sentinel
  Link<E> prev();

  /// The link immediately after this one.
  ///
  /// @throws UnsupportedOperationException
  ///           on the tail sentinel
  Link<E> next();

  void setPrev(Link<E> prev);

  void setNext(Link<E> next);
}
