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
 * Value of a pair type.
 *
 * @param <A> type of the first component
 * @param <B> type of the second component
 */
public final class Pair<A, B> {
  public final A first;
  public final B second;

  private Pair(A first, B second) {
    this.first = requireNonNull(first, "first");
    this.second = requireNonNull(second, "second");
  }

  /** Creates a pair. */
  public static <A, B> Pair<A, B> of(A first, B second) {
    return new Pair<>(first, second);
  }

  @Override
  public int hashCode() {
    return Objects.hash(first, second);
  }

  @Override
  public boolean equals(Object obj) {
    return obj == this
        || obj instanceof Pair
            && first.equals(((Pair<?, ?>) obj).first)
            && second.equals(((Pair<?, ?>) obj).second);
  }

  @Override
  public String toString() {
    return "<" + first + ", " + second + ">";
  }
}

// End Pair.java
