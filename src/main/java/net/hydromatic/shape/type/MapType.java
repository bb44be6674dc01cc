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
package net.hydromatic.shape.type;

import static java.util.Objects.requireNonNull;

import java.util.function.Function;

/**
 * Type whose values are represented, for printing and parsing, by values of
 * another type.
 *
 * @param <A> type described
 * @param <B> representee type
 */
public class MapType<A, B> extends BaseType<A> {
  public final Type<B> representee;
  private final Function<? super B, ? extends A> forward;
  private final Function<? super A, ? extends B> backward;

  MapType(
      Type<B> representee,
      Function<? super B, ? extends A> forward,
      Function<? super A, ? extends B> backward) {
    super(Op.MAP);
    this.representee = requireNonNull(representee);
    this.forward = requireNonNull(forward);
    this.backward = requireNonNull(backward);
  }

  /** Converts a representee value to a value of this type. */
  public A forward(B b) {
    return forward.apply(b);
  }

  /** Converts a value of this type to its representee. */
  public B backward(A a) {
    return backward.apply(a);
  }
}

// End MapType.java
