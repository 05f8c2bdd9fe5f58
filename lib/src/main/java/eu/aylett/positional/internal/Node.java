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

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import org.checkerframework.dataflow.qual.Pure;
import org.checkerframework.dataflow.qual.SideEffectFree;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Verify.verifyNotNull;

/**
 * The Node class holds a single element of a {@link LinkedSequence}, along with
 * its links to the neighbouring nodes or sentinels.
 * <p>
 * Once a node has been removed from its sequence all three fields are cleared.
 * A cleared successor link is how callers recognise a removed node.
 *
 * @param <E>
 *          the type of elements held in the chain
 */
public final class Node<E extends @NonNull Object> implements Link<E> {

  private @Nullable E element;
  private @Nullable Link<E> prev;
  private @Nullable Link<E> next;

  @SuppressFBWarnings("EI2")
  Node(E element, Link<E> prev, Link<E> next) {
    this.element = checkNotNull(element, "element cannot be null");
    this.prev = prev;
    this.next = next;
  }

  /**
   * Whether this node is still part of its sequence.
   */
  @Pure
  public boolean isLinked() {
    return next != null;
  }

  @Pure
  public E element() {
    return verifyNotNull(element, "Node has been removed from its sequence");
  }

  /**
   * Swaps the stored element in place, leaving the links untouched.
   *
   * @param newElement
   *          the element to store
   * @return the element previously stored
   */
  public E replaceElement(E newElement) {
    checkNotNull(newElement, "element cannot be null");
    var old = element();
    this.element = newElement;
    return old;
  }

  @Pure
  @Override
  public Link<E> prev() {
    return verifyNotNull(prev, "Node has been removed from its sequence");
  }

  @Pure
  @Override
  public Link<E> next() {
    return verifyNotNull(next, "Node has been removed from its sequence");
  }

  @Override
  public void setPrev(Link<E> prev) {
    this.prev = prev;
  }

  @Override
  public void setNext(Link<E> next) {
    this.next = next;
  }

  /**
   * Clears the links and the element so the node no longer keeps its
   * neighbours or its value reachable.
   *
   * @return the element that was stored
   */
  E unlink() {
    var old = element();
    this.element = null;
    this.prev = null;
    this.next = null;
    return old;
  }

  @SideEffectFree
  @Override
  public String toString() {
    return "Node{" + "element=" + element + ", linked=" + isLinked() + '}';
  }
}
