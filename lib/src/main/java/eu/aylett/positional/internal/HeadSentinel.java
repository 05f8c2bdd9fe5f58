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

import org.checkerframework.checker.initialization.qual.NotOnlyInitialized;
import org.checkerframework.dataflow.qual.Pure;
import org.jspecify.annotations.NonNull;

/**
 * The HeadSentinel class marks the front boundary of a {@link LinkedSequence}.
 * It never holds an element and has no predecessor.
 *
 * @param <E>
 *          the type of elements held in the chain
 */
final class HeadSentinel<E extends @NonNull Object> implements Link<E> {

  /** The first node in the chain, or the tail sentinel when it is empty. */
  @NotOnlyInitialized
  private Link<E> next;

  /**
   * Constructs a new HeadSentinel. The next link points back at itself until
   * the owning sequence wires in its tail.
   */
  HeadSentinel() {
    next = this;
  }

  @Override
  public Link<E> prev() {
    throw new UnsupportedOperationException("The head sentinel has no predecessor");
  }

  @Pure
  @Override
  public Link<E> next() {
    return next;
  }

  @Override
  public void setPrev(Link<E> prev) {
    throw new UnsupportedOperationException();
  }

  @Override
  public void setNext(Link<E> next) {
    this.next = next;
  }

  @Override
  public String toString() {
    return "HeadSentinel";
  }
}
