/*
 * Copyright 2025 The Pyrite Authors
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
 * limitations under the License.
 */

package org.pyrite.util;

import com.google.common.base.Preconditions;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.Arrays;
import java.util.NoSuchElementException;
import java.util.PrimitiveIterator;
import java.util.function.IntConsumer;
import java.util.function.IntPredicate;
import java.util.stream.IntStream;

/**
 * A Bits represents an immutable, finite set of non-negative integers.
 *
 * <p>Bits are used as the per-block states of bitset dataflow analyses, so the operations that
 * matter most are the elementwise {@link Op}s and cheap equality tests.
 */
public final class Bits implements IntPredicate, Iterable<Integer> {

  /** A Bits value containing no integers. */
  public static final Bits EMPTY = new Bits(new long[0]);

  /**
   * The words of this set; bit {@code i % 64} of {@code words[i / 64]} is set if {@code i} is an
   * element. The last word is always non-zero (so equal sets have equal arrays).
   */
  private final long[] words;

  private Bits(long[] words) {
    this.words = words;
  }

  /** Returns a Bits backed by {@code words}, which must not be modified after this call. */
  private static Bits fromWords(long[] words) {
    int length = words.length;
    while (length > 0 && words[length - 1] == 0) {
      length--;
    }
    if (length == 0) {
      return EMPTY;
    }
    return new Bits(length == words.length ? words : Arrays.copyOf(words, length));
  }

  /**
   * Returns a Bits containing only the given integer.
   *
   * <p>{@code element} must be non-negative.
   */
  public static Bits of(int element) {
    Preconditions.checkArgument(element >= 0);
    long[] words = new long[element / Long.SIZE + 1];
    words[element / Long.SIZE] = 1L << element;
    return new Bits(words);
  }

  /** Returns a Bits containing each of the given integers. */
  public static Bits of(int... elements) {
    Builder builder = new Builder();
    for (int e : elements) {
      builder.set(e);
    }
    return builder.build();
  }

  /**
   * Returns a Bits containing all integers greater than or equal to min and less than or equal to
   * max.
   *
   * <p>{@code min} must be non-negative.
   */
  public static Bits forRange(int min, int max) {
    Preconditions.checkArgument(min >= 0);
    if (min > max) {
      return EMPTY;
    }
    long[] words = new long[max / Long.SIZE + 1];
    for (int w = min / Long.SIZE; w < words.length; w++) {
      long word = -1L;
      if (w == min / Long.SIZE) {
        word &= -1L << min;
      }
      if (w == max / Long.SIZE) {
        word &= -1L >>> (Long.SIZE - 1 - (max % Long.SIZE));
      }
      words[w] = word;
    }
    return new Bits(words);
  }

  /**
   * Returns a Bits containing the values less than or equal to {@code max} for which the given
   * IntPredicate returns true.
   */
  public static Bits fromPredicate(int max, IntPredicate include) {
    Builder builder = new Builder();
    for (int i = 0; i <= max; i++) {
      if (include.test(i)) {
        builder.set(i);
      }
    }
    return builder.build();
  }

  /** Returns true if this Bits contains no integers. */
  public boolean isEmpty() {
    return words.length == 0;
  }

  /** Returns true if this Bits contains the given integer. */
  @Override
  public boolean test(int i) {
    if (i < 0) {
      return false;
    }
    int w = i / Long.SIZE;
    return w < words.length && (words[w] & (1L << i)) != 0;
  }

  /** Returns true if every element of {@code other} is also an element of this. */
  public boolean testAll(Bits other) {
    if (other.words.length > words.length) {
      return false;
    }
    for (int w = 0; w < other.words.length; w++) {
      if ((other.words[w] & ~words[w]) != 0) {
        return false;
      }
    }
    return true;
  }

  /** Returns true if this and {@code other} have at least one element in common. */
  public boolean testAny(Bits other) {
    int n = Math.min(words.length, other.words.length);
    for (int w = 0; w < n; w++) {
      if ((words[w] & other.words[w]) != 0) {
        return true;
      }
    }
    return false;
  }

  /** Returns the number of integers in this Bits. */
  public int count() {
    int result = 0;
    for (long word : words) {
      result += Long.bitCount(word);
    }
    return result;
  }

  /** Returns the smallest element, or -1 if this Bits is empty. */
  public int min() {
    return nextSetBit(0);
  }

  /** Returns the largest element, or -1 if this Bits is empty. */
  public int max() {
    if (isEmpty()) {
      return -1;
    }
    int last = words.length - 1;
    return last * Long.SIZE + (Long.SIZE - 1 - Long.numberOfLeadingZeros(words[last]));
  }

  /**
   * Returns the smallest element of this Bits that is greater than or equal to {@code start}, or -1
   * if there is none.
   */
  public int nextSetBit(int start) {
    Preconditions.checkArgument(start >= 0);
    int w = start / Long.SIZE;
    if (w >= words.length) {
      return -1;
    }
    long word = words[w] & (-1L << start);
    for (; ; ) {
      if (word != 0) {
        return w * Long.SIZE + Long.numberOfTrailingZeros(word);
      } else if (++w == words.length) {
        return -1;
      }
      word = words[w];
    }
  }

  /** Returns a Bits containing the elements of this plus {@code i}. */
  public Bits set(int i) {
    return test(i) ? this : Op.UNION.apply(this, of(i));
  }

  /** Returns a Bits containing the elements of this except {@code i}. */
  public Bits clear(int i) {
    return test(i) ? Op.DIFFERENCE.apply(this, of(i)) : this;
  }

  /** Returns an IntStream of the values in this Bits, in ascending order. */
  public IntStream stream() {
    IntStream.Builder builder = IntStream.builder();
    forEachInt(builder);
    return builder.build();
  }

  /** Calls {@code action} with each element of this Bits, in ascending order. */
  public void forEachInt(IntConsumer action) {
    for (int i = nextSetBit(0); i >= 0; i = nextSetBit(i + 1)) {
      action.accept(i);
    }
  }

  /** Returns an iterator for the values in this Bits, in ascending order. */
  @Override
  public PrimitiveIterator.OfInt iterator() {
    return new PrimitiveIterator.OfInt() {
      /** The next element to be returned, or -1 if this iterator is exhausted. */
      private int next = nextSetBit(0);

      @Override
      public boolean hasNext() {
        return next >= 0;
      }

      @Override
      public int nextInt() {
        if (next < 0) {
          throw new NoSuchElementException();
        }
        int result = next;
        next = nextSetBit(result + 1);
        return result;
      }
    };
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof Bits other && Arrays.equals(words, other.words);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(words);
  }

  /**
   * Returns a compact string representation; runs of more than two consecutive integers are
   * written using min..max notation, e.g. {@code "{0..3, 5, 7, 8}"}.
   */
  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("{");
    int i = nextSetBit(0);
    while (i >= 0) {
      int runEnd = i;
      while (test(runEnd + 1)) {
        runEnd++;
      }
      if (sb.length() > 1) {
        sb.append(", ");
      }
      sb.append(i);
      if (runEnd != i) {
        sb.append(runEnd == i + 1 ? ", " : "..").append(runEnd);
      }
      i = nextSetBit(runEnd + 1);
    }
    return sb.append("}").toString();
  }

  /** An Op is an elementwise binary operation on Bits. */
  public enum Op {
    /** The elements in either argument (bitwise OR). */
    UNION {
      @Override
      long apply(long x, long y) {
        return x | y;
      }
    },

    /** The elements in both arguments (bitwise AND); the meet of definite-assignment states. */
    INTERSECTION {
      @Override
      long apply(long x, long y) {
        return x & y;
      }
    },

    /** The elements in the first argument but not the second (bitwise AND NOT). */
    DIFFERENCE {
      @Override
      long apply(long x, long y) {
        return x & ~y;
      }
    };

    abstract long apply(long x, long y);

    /** Applies this Op to the given Bits and returns the result. */
    public Bits apply(Bits x, Bits y) {
      long[] result = new long[Math.max(x.words.length, y.words.length)];
      for (int w = 0; w < result.length; w++) {
        result[w] = apply(word(x.words, w), word(y.words, w));
      }
      Bits bits = fromWords(result);
      // Return an existing instance when possible, since callers often compare with ==.
      if (bits.equals(x)) {
        return x;
      } else if (bits.equals(y)) {
        return y;
      }
      return bits;
    }

    private static long word(long[] words, int w) {
      return w < words.length ? words[w] : 0;
    }
  }

  /** A mutable set of non-negative integers, used to incrementally construct a Bits. */
  public static final class Builder implements IntPredicate {
    private long[] words;

    public Builder() {
      words = new long[1];
    }

    /** Creates a Builder initialized with the contents of {@code bits}. */
    public Builder(Bits bits) {
      words = Arrays.copyOf(bits.words, Math.max(1, bits.words.length));
    }

    @Override
    public boolean test(int i) {
      int w = i / Long.SIZE;
      return i >= 0 && w < words.length && (words[w] & (1L << i)) != 0;
    }

    /** Adds {@code i} to this Builder; returns true if it was not already present. */
    @CanIgnoreReturnValue
    public boolean set(int i) {
      Preconditions.checkArgument(i >= 0);
      int w = i / Long.SIZE;
      if (w >= words.length) {
        words = Arrays.copyOf(words, Math.max(w + 1, words.length * 2));
      }
      long prev = words[w];
      words[w] = prev | (1L << i);
      return prev != words[w];
    }

    /** Removes {@code i} from this Builder; returns true if it was present. */
    @CanIgnoreReturnValue
    public boolean clear(int i) {
      if (!test(i)) {
        return false;
      }
      words[i / Long.SIZE] &= ~(1L << i);
      return true;
    }

    /** Replaces the contents of this Builder with the result of {@code op(this, bits)}. */
    @CanIgnoreReturnValue
    public Builder apply(Op op, Bits bits) {
      if (bits.words.length > words.length) {
        words = Arrays.copyOf(words, bits.words.length);
      }
      for (int w = 0; w < words.length; w++) {
        words[w] = op.apply(words[w], Op.word(bits.words, w));
      }
      return this;
    }

    /** Removes all elements from this Builder. */
    @CanIgnoreReturnValue
    public Builder clearAll() {
      Arrays.fill(words, 0);
      return this;
    }

    /** Returns a Bits with the current contents of this Builder. */
    public Bits build() {
      return fromWords(words.clone());
    }

    @Override
    public String toString() {
      return build().toString();
    }
  }
}
