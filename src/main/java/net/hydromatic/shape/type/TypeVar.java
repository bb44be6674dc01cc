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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.cache.CacheBuilder;
import com.google.common.cache.CacheLoader;
import com.google.common.cache.LoadingCache;

/**
 * Type variable (e.g. {@code 'a}).
 *
 * <p>Has a name and nothing else. The type syntax printer substitutes type
 * variables for the self-references of a {@link SelfType}; a type variable
 * never describes a value, and printing or decoding a value against one
 * throws {@link UnboundTypeVariableException}.
 */
public class TypeVar<A> extends BaseType<A> {
  private static final char[] ALPHAS =
      "abcdefghijklmnopqrstuvwxyz".toCharArray();

  private static final LoadingCache<Integer, String> NAME_CACHE =
      CacheBuilder.newBuilder()
          .maximumSize(1_000)
          .build(CacheLoader.from(TypeVar::name));

  public final String name;

  TypeVar(String name) {
    super(Op.VAR);
    this.name = requireNonNull(name);
  }

  /** Returns the name, e.g. "'a". */
  @Override
  public String toString() {
    return name;
  }

  /**
   * Returns the name of the type variable with a given ordinal.
   *
   * <p>0 &rarr; 'a, 25 &rarr; 'z, 26 &rarr; 'aa, 27 &rarr; 'ab, 701 &rarr;
   * 'zz, 702 &rarr; 'aaa, etc. The letters count like spreadsheet columns:
   * there is no zero digit, so every string of letters has exactly one
   * ordinal.
   */
  public static String ordinalName(int ordinal) {
    checkArgument(ordinal >= 0, "negative ordinal %s", ordinal);
    return NAME_CACHE.getUnchecked(ordinal);
  }

  static String name(int i) {
    final StringBuilder s = new StringBuilder();
    for (; ; ) {
      s.append(ALPHAS[i % 26]);
      i = i / 26 - 1;
      if (i < 0) {
        return s.append('\'').reverse().toString();
      }
    }
  }
}

// End TypeVar.java
