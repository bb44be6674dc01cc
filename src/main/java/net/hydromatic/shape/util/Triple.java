/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.shape.util;

import static java.util.Objects.requireNonNull;

import java.util.Objects;

/**
 * Value of a triple type.
 *
 * @param <A> type of the first component
 * @param <B> type of the second component
 * @param <C> type of the third component
 */
public final class Triple<A, B, C> {
  public final A first;
  public final B second;
  public final C third;

  private Triple(A first, B second, C third) {
    this.first = requireNonNull(first, "first");
    this.second = requireNonNull(second, "second");
    this.third = requireNonNull(third, "third");
  }

  /** Creates a triple. */
  public static <A, B, C> Triple<A, B, C> of(A first, B second, C third) {
    return new Triple<>(first, second, third);
  }

  @Override
  public int hashCode() {
    return Objects.hash(first, second, third);
  }

  @Override
  public boolean equals(Object obj) {
    if (obj == this) {
      return true;
    }
    if (!(obj instanceof Triple)) {
      return false;
    }
    final Triple<?, ?, ?> that = (Triple<?, ?, ?>) obj;
    return first.equals(that.first)
        && second.equals(that.second)
        && third.equals(that.third);
  }

  @Override
  public String toString() {
    return "<" + first + ", " + second + ", " + third + ">";
  }
}

// End Triple.java
