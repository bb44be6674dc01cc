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

import net.hydromatic.shape.util.Triple;

/** The type of a triple value. */
public class TripleType<A, B, C> extends BaseType<Triple<A, B, C>> {
  public final Type<A> firstType;
  public final Type<B> secondType;
  public final Type<C> thirdType;

  TripleType(Type<A> firstType, Type<B> secondType, Type<C> thirdType) {
    super(Op.TRIPLE);
    this.firstType = requireNonNull(firstType);
    this.secondType = requireNonNull(secondType);
    this.thirdType = requireNonNull(thirdType);
  }
}

// End TripleType.java
