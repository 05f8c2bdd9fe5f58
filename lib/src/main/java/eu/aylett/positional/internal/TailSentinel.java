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

import org.checkerframework.dataflow.qual.Pure;
import org.jspecify.annotations.NonNull;

/// The TailSentinel class marks the back boundary of a [LinkedSequence]. It
/// never holds an element and has no successor.
///
/// @param <E>
///            the type of elements held in the chain
final class TailSentinel<E extends @NonNull Object> implements Link<E> {

  /// The last node in the chain, or the head sentinel when it is empty.
  private Link<E> prev;

  TailSentinel(Link<E> prev) {
    this.prev = prev;
  }

  @Pure
  @Override
  public Link<E> prev() {
    return prev;
  }

  @Override
  public Link<E> next() {
    throw new UnsupportedOperationException("The tail sentinel has no successor");
  }

  @Override
  public void setPrev(Link<E> prev) {
    this.prev = prev;
  }

  @Override
  public void setNext(Link<E> next) {
    throw new UnsupportedOperationException();
  }

  @Override
  public String toString() {
    return "TailSentinel";
  }
}
