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

import com.google.common.collect.Iterables;
import org.checkerframework.dataflow.qual.Pure;
import org.checkerframework.dataflow.qual.SideEffectFree;
import org.jetbrains.annotations.Contract;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import java.util.Iterator;

/**
 * A double-ended queue backed by a {@link PositionalList}. Elements can be
 * added and removed at either end in constant time.
 *
 * @param <E>
 *          the type of elements held in the deque
 */
public final class LinkedDeque<E extends @NonNull Object> implements Iterable<E> {

  private final PositionalList<E> list = new PositionalList<>();

  @Contract(" -> new")
  public static <E extends @NonNull Object> LinkedDeque<E> create() {
    return new LinkedDeque<>();
  }

  public LinkedDeque() {
  }

  @Pure
  public int size() {
    return list.size();
  }

  @Pure
  public boolean isEmpty() {
    return list.isEmpty();
  }

  /**
   * Returns the element at the front without removing it.
   *
   * @throws EmptyContainerException
   *           if the deque is empty
   */
  public E first() {
    return nonEmpty(list.first(), "read the front of").element();
  }

  /**
   * Returns the element at the back without removing it.
   *
   * @throws EmptyContainerException
   *           if the deque is empty
   */
  public E last() {
    return nonEmpty(list.last(), "read the back of").element();
  }

  public void addFirst(E element) {
    list.addFirst(element);
  }

  public void addLast(E element) {
    list.addLast(element);
  }

  /**
   * Removes and returns the element at the front.
   *
   * @throws EmptyContainerException
   *           if the deque is empty
   */
  public E removeFirst() {
    return list.delete(nonEmpty(list.first(), "remove from the front of"));
  }

  /**
   * Removes and returns the element at the back.
   *
   * @throws EmptyContainerException
   *           if the deque is empty
   */
  public E removeLast() {
    return list.delete(nonEmpty(list.last(), "remove from the back of"));
  }

  /** Iterates from front to back. */
  @Override
  public Iterator<E> iterator() {
    return list.iterator();
  }

  public void checkSafety() {
    list.checkSafety();
  }

  @SideEffectFree
  @Override
  public String toString() {
    return "LinkedDeque" + Iterables.toString(list);
  }

  private static <E extends @NonNull Object> Position<E> nonEmpty(@Nullable Position<E> position, String action) {
    if (position == null) {
      throw new EmptyContainerException("Cannot " + action + " an empty deque");
    }
    return position;
  }
}
