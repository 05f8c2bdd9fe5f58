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
import eu.aylett.positional.EmptyContainerException;
import org.checkerframework.dataflow.qual.Pure;
import org.checkerframework.dataflow.qual.SideEffectFree;
import org.jspecify.annotations.NonNull;

import java.util.ConcurrentModificationException;
import java.util.Iterator;
import java.util.NoSuchElementException;

import static com.google.common.base.Verify.verify;

/**
 * The LinkedSequence class is a doubly linked chain of {@link Node}s bounded
 * by a head and a tail sentinel. The sentinels are always present, so inserting
 * into an empty chain or removing its last node needs no special handling.
 * <p>
 * Only two primitives change the chain: {@link #insertBetween} and
 * {@link #deleteNode}. Both bump a modification count, which iterators use to
 * fail fast if the chain changes under them.
 * <p>
 * Instances are not thread-safe.
 *
 * @param <E>
 *          the type of elements held in the chain
 */
public final class LinkedSequence<E extends @NonNull Object> implements Iterable<E> {

  private final HeadSentinel<E> head;
  private final TailSentinel<E> tail;

  /** The number of nodes strictly between the two sentinels. */
  private int size = 0;

  /** Incremented on every structural change. */
  private int modCount = 0;

  public LinkedSequence() {
    head = new HeadSentinel<>();
    tail = new TailSentinel<>(head);
    head.setNext(tail);
  }

  @Pure
  @SuppressFBWarnings("EI")
  public Link<E> head() {
    return head;
  }

  @Pure
  @SuppressFBWarnings("EI")
  public Link<E> tail() {
    return tail;
  }

  @Pure
  public int size() {
    return size;
  }

  @Pure
  public boolean isEmpty() {
    return size == 0;
  }

  @Pure
  public int modificationCount() {
    return modCount;
  }

  /**
   * Creates a node holding the element and splices it in between two links.
   * <p>
   * The links must be adjacent in this chain; that is not checked here.
   *
   * @param element
   *          the element to store
   * @param predecessor
   *          the link that will precede the new node
   * @param successor
   *          the link that will follow the new node
   * @return the new node
   */
  public Node<E> insertBetween(E element, Link<E> predecessor, Link<E> successor) {
    var node = new Node<>(element, predecessor, successor);
    predecessor.setNext(node);
    successor.setPrev(node);
    size++;
    modCount++;
    return node;
  }

  /**
   * Splices the node out of the chain and clears it.
   *
   * @param node
   *          a node currently linked into this chain
   * @return the element the node held
   * @throws EmptyContainerException
   *           if the chain holds no nodes
   */
  public E deleteNode(Node<E> node) {
    if (isEmpty()) {
      throw new EmptyContainerException("Cannot delete from an empty sequence");
    }
    var predecessor = node.prev();
    var successor = node.next();
    predecessor.setNext(successor);
    successor.setPrev(predecessor);
    size--;
    modCount++;
    return node.unlink();
  }

  /**
   * A forward iterator over the elements from the first node to the last. A
   * fresh iterator is returned on each call.
   * <p>
   * If the chain is structurally modified after the iterator is created, the
   * next call to {@link Iterator#next()} throws
   * {@link ConcurrentModificationException}.
   */
  @Override
  public Iterator<E> iterator() {
    return new SequenceIterator();
  }

  /**
   * Walks the chain in both directions, checking that every link is mirrored
   * by its neighbour and that the node count matches {@link #size()}.
   */
  public void checkSafety() {
    var forward = 0;
    Link<E> previous = head;
    var current = head.next();
    while (current instanceof Node<E> node) {
      verify(node.isLinked(), "Removed node reachable from the head: %s", node);
      verify(node.prev() == previous, "Broken back-link at index %s: %s", forward, node);
      forward++;
      previous = node;
      current = node.next();
    }
    verify(current == tail, "Chain does not end at the tail sentinel: %s", current);
    verify(tail.prev() == previous, "Tail sentinel does not point at the last node: %s", tail.prev());

    var backward = 0;
    Link<E> following = tail;
    current = tail.prev();
    while (current instanceof Node<E> node) {
      verify(node.next() == following, "Broken forward link at %s from the end: %s", backward, node);
      backward++;
      following = node;
      current = node.prev();
    }
    verify(current == head, "Chain does not start at the head sentinel: %s", current);

    verify(forward == size, "Size mismatch: found %s nodes != expected %s", forward, size);
    verify(backward == size, "Size mismatch walking back: found %s nodes != expected %s", backward, size);
  }

  @SideEffectFree
  @Override
  public String toString() {
    return "LinkedSequence (" + size + ")";
  }

  private final class SequenceIterator implements Iterator<E> {
    private final int expectedModCount = modCount;
    private Link<E> cursor = head.next();

    @Override
    public boolean hasNext() {
      return cursor != tail;
    }

    @Override
    public E next() {
      if (modCount != expectedModCount) {
        throw new ConcurrentModificationException();
      }
      if (!(cursor instanceof Node<E> node)) {
        throw new NoSuchElementException();
      }
      cursor = node.next();
      return node.element();
    }
  }
}
