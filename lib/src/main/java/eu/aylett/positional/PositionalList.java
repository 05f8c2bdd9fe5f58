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
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import eu.aylett.positional.internal.Link;
import eu.aylett.positional.internal.LinkedSequence;
import eu.aylett.positional.internal.Node;
import org.checkerframework.dataflow.qual.Pure;
import org.checkerframework.dataflow.qual.SideEffectFree;
import org.jetbrains.annotations.Contract;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import java.util.ConcurrentModificationException;
import java.util.Iterator;
import java.util.NoSuchElementException;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * The PositionalList class is a sequence of elements that callers address by
 * {@link Position} rather than by index. Inserting or deleting at a known
 * position takes constant time.
 * <p>
 * Every position passed in is validated before the list is touched: it must
 * have been issued by this list, and its element must not have been deleted.
 * A call that fails validation leaves the list unchanged.
 * <p>
 * Instances are not thread-safe.
 *
 * @param <E>
 *          the type of elements held in the list
 */
public final class PositionalList<E extends @NonNull Object> implements Iterable<E> {

  private final LinkedSequence<E> chain = new LinkedSequence<>();

  @Contract(" -> new")
  public static <E extends @NonNull Object> PositionalList<E> create() {
    return new PositionalList<>();
  }

  /**
   * Creates a list holding the given elements, in iteration order.
   *
   * @param elements
   *          the elements to add
   */
  @Contract("_ -> new")
  public static <E extends @NonNull Object> PositionalList<E> copyOf(Iterable<? extends E> elements) {
    checkNotNull(elements, "elements cannot be null");
    var list = new PositionalList<E>();
    for (var element : elements) {
      list.addLast(element);
    }
    return list;
  }

  public PositionalList() {
  }

  @Pure
  public int size() {
    return chain.size();
  }

  @Pure
  public boolean isEmpty() {
    return chain.isEmpty();
  }

  /** The position of the first element, or null if the list is empty. */
  public @Nullable Position<E> first() {
    return makePosition(chain.head().next());
  }

  /** The position of the last element, or null if the list is empty. */
  public @Nullable Position<E> last() {
    return makePosition(chain.tail().prev());
  }

  /**
   * Returns the position just before the given one, or null if it is the first.
   *
   * @throws PositionException
   *           if the position is not a valid position in this list
   */
  public @Nullable Position<E> before(Position<E> position) {
    var node = validate(position);
    return makePosition(node.prev());
  }

  /**
   * Returns the position just after the given one, or null if it is the last.
   *
   * @throws PositionException
   *           if the position is not a valid position in this list
   */
  public @Nullable Position<E> after(Position<E> position) {
    var node = validate(position);
    return makePosition(node.next());
  }

  public Position<E> addFirst(E element) {
    var head = chain.head();
    return insertBetween(element, head, head.next());
  }

  public Position<E> addLast(E element) {
    var tail = chain.tail();
    return insertBetween(element, tail.prev(), tail);
  }

  /**
   * Inserts an element immediately before the given position.
   *
   * @return the position of the new element
   * @throws PositionException
   *           if the position is not a valid position in this list
   */
  public Position<E> addBefore(Position<E> position, E element) {
    var node = validate(position);
    return insertBetween(element, node.prev(), node);
  }

  /**
   * Inserts an element immediately after the given position.
   *
   * @return the position of the new element
   * @throws PositionException
   *           if the position is not a valid position in this list
   */
  public Position<E> addAfter(Position<E> position, E element) {
    var node = validate(position);
    return insertBetween(element, node, node.next());
  }

  /**
   * Removes the element at the given position. The position, and every other
   * position referring to the same element, is no longer valid afterwards.
   *
   * @return the removed element
   * @throws PositionException
   *           if the position is not a valid position in this list
   */
  public E delete(Position<E> position) {
    var node = validate(position);
    return chain.deleteNode(node);
  }

  /**
   * Stores a new element at the given position. The position stays valid.
   *
   * @return the element previously stored there
   * @throws PositionException
   *           if the position is not a valid position in this list
   */
  public E replace(Position<E> position, E element) {
    checkNotNull(element, "element cannot be null");
    var node = validate(position);
    return node.replaceElement(element);
  }

  /**
   * Iterates over the elements from first to last. Each call starts a new
   * iteration; an iteration fails with {@link ConcurrentModificationException}
   * if elements are added or deleted while it is running.
   */
  @Override
  public Iterator<E> iterator() {
    return new ElementIterator();
  }

  /**
   * Verifies the internal structure of the list, throwing
   * {@link com.google.common.base.VerifyException} if it is inconsistent.
   */
  public void checkSafety() {
    chain.checkSafety();
  }

  @SideEffectFree
  @Override
  public String toString() {
    return "PositionalList" + Iterables.toString(this);
  }

  private Position<E> insertBetween(E element, Link<E> predecessor, Link<E> successor) {
    checkNotNull(element, "element cannot be null");
    return new ListPosition<>(this, chain.insertBetween(element, predecessor, successor));
  }

  private Node<E> validate(Position<E> position) {
    checkNotNull(position, "position cannot be null");
    if (!(position instanceof ListPosition<E> listPosition)) {
      throw new WrongPositionTypeException(position);
    }
    if (listPosition.container != this) {
      throw new InvalidPositionException();
    }
    if (!listPosition.node.isLinked()) {
      throw new StalePositionException();
    }
    return listPosition.node;
  }

  private @Nullable Position<E> makePosition(Link<E> link) {
    if (link instanceof Node<E> node) {
      return new ListPosition<>(this, node);
    }
    // One of the sentinels
    return null;
  }

  private static final class ListPosition<E extends @NonNull Object> implements Position<E> {
    private final PositionalList<E> container;
    private final Node<E> node;

    @SuppressFBWarnings("EI2")
    ListPosition(PositionalList<E> container, Node<E> node) {
      this.container = container;
      this.node = node;
    }

    @Override
    public E element() {
      if (!node.isLinked()) {
        throw new StalePositionException();
      }
      return node.element();
    }

    @Override
    public boolean equals(@Nullable Object o) {
      if (o instanceof ListPosition<?> that) {
        return node == that.node;
      }
      return false;
    }

    @Override
    public int hashCode() {
      return System.identityHashCode(node);
    }

    @SideEffectFree
    @Override
    public String toString() {
      return node.isLinked() ? "Position{" + node.element() + '}' : "Position{removed}";
    }
  }

  private final class ElementIterator implements Iterator<E> {
    private final int expectedModCount = chain.modificationCount();
    private @Nullable Position<E> cursor = first();

    @Override
    public boolean hasNext() {
      return cursor != null;
    }

    @Override
    public E next() {
      if (chain.modificationCount() != expectedModCount) {
        throw new ConcurrentModificationException();
      }
      var current = cursor;
      if (current == null) {
        throw new NoSuchElementException();
      }
      cursor = after(current);
      return current.element();
    }
  }
}
