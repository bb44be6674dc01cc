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

import java.util.function.IntFunction;

/**
 * The type of an array value.
 *
 * <p>Java cannot create a generic array, so the type carries a factory, such
 * as {@code String[]::new}, for parsers to use.
 */
public class ArrayType<E> extends BaseType<E[]> {
  public final Type<E> elementType;
  public final Len len;
  private final IntFunction<E[]> factory;

  ArrayType(Type<E> elementType, IntFunction<E[]> factory, Len len) {
    super(Op.ARRAY);
    this.elementType = requireNonNull(elementType);
    this.factory = requireNonNull(factory);
    this.len = requireNonNull(len);
  }

  /** Creates an empty array of the given length. */
  public E[] newArray(int length) {
    return factory.apply(length);
  }
}

// End ArrayType.java
