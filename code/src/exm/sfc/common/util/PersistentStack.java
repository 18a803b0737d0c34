/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */
package exm.sfc.common.util;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Immutable linked stack.  push() returns a new stack sharing the tail
 * with the old one, so a stack captured at some point never changes.
 * Iteration goes from the top of the stack down.
 * @param <T>
 */
public class PersistentStack<T> implements Iterable<T> {
  @SuppressWarnings("rawtypes")
  private static final PersistentStack EMPTY =
                        new PersistentStack<Object>(null, null, 0);

  private final T head;
  private final PersistentStack<T> tail;
  private final int size;

  private PersistentStack(T head, PersistentStack<T> tail, int size) {
    this.head = head;
    this.tail = tail;
    this.size = size;
  }

  @SuppressWarnings("unchecked")
  public static <T> PersistentStack<T> empty() {
    return EMPTY;
  }

  public PersistentStack<T> push(T elem) {
    return new PersistentStack<T>(elem, this, size + 1);
  }

  public T peek() {
    if (size == 0) {
      throw new NoSuchElementException("Empty stack");
    }
    return head;
  }

  public PersistentStack<T> pop() {
    if (size == 0) {
      throw new NoSuchElementException("Empty stack");
    }
    return tail;
  }

  public boolean isEmpty() {
    return size == 0;
  }

  public int size() {
    return size;
  }

  /**
   * @return elements from top to bottom
   */
  public List<T> toList() {
    List<T> result = new ArrayList<T>(size);
    for (T elem: this) {
      result.add(elem);
    }
    return result;
  }

  @Override
  public Iterator<T> iterator() {
    return new Iterator<T>() {
      private PersistentStack<T> curr = PersistentStack.this;

      @Override
      public boolean hasNext() {
        return curr.size > 0;
      }

      @Override
      public T next() {
        if (curr.size == 0) {
          throw new NoSuchElementException();
        }
        T val = curr.head;
        curr = curr.tail;
        return val;
      }

      @Override
      public void remove() {
        throw new UnsupportedOperationException();
      }
    };
  }

  @Override
  public String toString() {
    return toList().toString();
  }
}
