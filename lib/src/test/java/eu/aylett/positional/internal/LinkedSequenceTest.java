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

import com.google.common.base.VerifyException;
import eu.aylett.positional.EmptyContainerException;
import org.junit.jupiter.api.Test;

import java.util.ConcurrentModificationException;
import java.util.NoSuchElementException;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.emptyIterable;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.jupiter.api.Assertions.assertThrows;

class LinkedSequenceTest {

  @Test
  void newSequenceHasOnlySentinels() {
    var sequence = new LinkedSequence<String>();

    assertThat(sequence.size(), equalTo(0));
    assertThat(sequence.isEmpty(), is(true));
    assertThat(sequence, emptyIterable());
    assertThat(sequence.head().next(), sameInstance(sequence.tail()));
    assertThat(sequence.tail().prev(), sameInstance(sequence.head()));

    sequence.checkSafety();
  }

  @Test
  void insertBetweenSplicesTheNodeIn() {
    var sequence = new LinkedSequence<String>();
    var head = sequence.head();
    var tail = sequence.tail();

    var node = sequence.insertBetween("a", head, tail);

    assertThat(head.next(), sameInstance(node));
    assertThat(tail.prev(), sameInstance(node));
    assertThat(node.prev(), sameInstance(head));
    assertThat(node.next(), sameInstance(tail));
    assertThat(node.element(), equalTo("a"));
    assertThat(sequence.size(), equalTo(1));

    sequence.checkSafety();
  }

  @Test
  void insertBetweenInTheMiddle() {
    var sequence = new LinkedSequence<String>();
    var first = sequence.insertBetween("a", sequence.head(), sequence.tail());
    var last = sequence.insertBetween("c", first, sequence.tail());

    var middle = sequence.insertBetween("b", first, last);

    assertThat(sequence, contains("a", "b", "c"));
    assertThat(first.next(), sameInstance(middle));
    assertThat(last.prev(), sameInstance(middle));
    assertThat(sequence.size(), equalTo(3));

    sequence.checkSafety();
  }

  @Test
  void insertBetweenRejectsNull() {
    var sequence = new LinkedSequence<String>();

    assertThrows(NullPointerException.class, () -> sequence.insertBetween(null, sequence.head(), sequence.tail()));
    assertThat(sequence.size(), equalTo(0));
  }

  @Test
  void deleteNodeRelinksNeighboursAndClearsTheNode() {
    var sequence = new LinkedSequence<String>();
    var a = sequence.insertBetween("a", sequence.head(), sequence.tail());
    var b = sequence.insertBetween("b", a, sequence.tail());
    var c = sequence.insertBetween("c", b, sequence.tail());

    assertThat(sequence.deleteNode(b), equalTo("b"));

    assertThat(a.next(), sameInstance(c));
    assertThat(c.prev(), sameInstance(a));
    assertThat(sequence, contains("a", "c"));
    assertThat(sequence.size(), equalTo(2));
    assertThat(b.isLinked(), is(false));
    assertThrows(VerifyException.class, b::element);
    assertThrows(VerifyException.class, b::next);
    assertThrows(VerifyException.class, b::prev);

    sequence.checkSafety();
  }

  @Test
  void deletingTheOnlyNodeLeavesAnEmptyChain() {
    var sequence = new LinkedSequence<Integer>();
    var node = sequence.insertBetween(1, sequence.head(), sequence.tail());

    assertThat(sequence.deleteNode(node), equalTo(1));

    assertThat(sequence.isEmpty(), is(true));
    assertThat(sequence.head().next(), sameInstance(sequence.tail()));
    assertThat(sequence.tail().prev(), sameInstance(sequence.head()));
    sequence.checkSafety();
  }

  @Test
  void deleteNodeOnEmptySequenceThrows() {
    var sequence = new LinkedSequence<Integer>();
    var node = sequence.insertBetween(1, sequence.head(), sequence.tail());
    sequence.deleteNode(node);

    var thrown = assertThrows(EmptyContainerException.class, () -> sequence.deleteNode(node));
    assertThat(thrown.getMessage(), equalTo("Cannot delete from an empty sequence"));
    sequence.checkSafety();
  }

  @Test
  void eachIteratorStartsFromTheFront() {
    var sequence = new LinkedSequence<Integer>();
    var last = sequence.insertBetween(1, sequence.head(), sequence.tail());
    sequence.insertBetween(2, last, sequence.tail());

    var first = sequence.iterator();
    assertThat(first.next(), equalTo(1));

    assertThat(sequence, contains(1, 2));
    assertThat(first.next(), equalTo(2));
    assertThat(first.hasNext(), is(false));
    assertThrows(NoSuchElementException.class, first::next);
  }

  @Test
  void iteratorFailsFastOnStructuralChange() {
    var sequence = new LinkedSequence<Integer>();
    var node = sequence.insertBetween(1, sequence.head(), sequence.tail());
    sequence.insertBetween(2, node, sequence.tail());

    var afterInsert = sequence.iterator();
    sequence.insertBetween(3, sequence.tail().prev(), sequence.tail());
    assertThrows(ConcurrentModificationException.class, afterInsert::next);

    var afterDelete = sequence.iterator();
    afterDelete.next();
    sequence.deleteNode(node);
    assertThrows(ConcurrentModificationException.class, afterDelete::next);
  }

  @Test
  void replacingAnElementIsNotAStructuralChange() {
    var sequence = new LinkedSequence<Integer>();
    var node = sequence.insertBetween(1, sequence.head(), sequence.tail());
    var before = sequence.modificationCount();

    var iterator = sequence.iterator();
    assertThat(node.replaceElement(10), equalTo(1));

    assertThat(sequence.modificationCount(), equalTo(before));
    assertThat(iterator.next(), equalTo(10));
  }

  @Test
  void sentinelsHaveNoOuterNeighbours() {
    var sequence = new LinkedSequence<Integer>();

    assertThrows(UnsupportedOperationException.class, () -> sequence.head().prev());
    assertThrows(UnsupportedOperationException.class, () -> sequence.head().setPrev(sequence.tail()));
    assertThrows(UnsupportedOperationException.class, () -> sequence.tail().next());
    assertThrows(UnsupportedOperationException.class, () -> sequence.tail().setNext(sequence.head()));
  }

  @Test
  void checkSafetyDetectsABrokenBackLink() {
    var sequence = new LinkedSequence<Integer>();
    var a = sequence.insertBetween(1, sequence.head(), sequence.tail());
    var b = sequence.insertBetween(2, a, sequence.tail());

    b.setPrev(sequence.head());

    assertThrows(VerifyException.class, sequence::checkSafety);
  }

  @Test
  void describesItself() {
    var sequence = new LinkedSequence<Integer>();
    sequence.insertBetween(1, sequence.head(), sequence.tail());

    assertThat(sequence.toString(), equalTo("LinkedSequence (1)"));
  }
}
