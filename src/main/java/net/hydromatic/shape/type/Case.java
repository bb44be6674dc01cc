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

import java.util.function.Function;

/**
 * Case of a {@link VariantType}.
 *
 * <p>A case is either {@link Nullary}, carrying no value, or {@link Unary},
 * carrying a payload of some type.
 *
 * @param <V> variant type
 */
public abstract class Case<V> {
  public final String name;

  /** Position of this case within its variant, starting at 0. */
  public final int ordinal;

  private Case(String name, int ordinal) {
    this.name = requireNonNull(name);
    checkArgument(ordinal >= 0);
    this.ordinal = ordinal;
  }

  /** Returns the name with its first letter upper-case, e.g. "Circle". */
  public String capitalizedName() {
    return capitalize(name);
  }

  /** Upper-cases the first character if it is an ASCII letter. */
  static String capitalize(String s) {
    if (s.isEmpty()) {
      return s;
    }
    final char c = s.charAt(0);
    if (c >= 'a' && c <= 'z') {
      return Character.toUpperCase(c) + s.substring(1);
    }
    return s;
  }

  @Override
  public String toString() {
    return name;
  }

  /** Case that carries no value. */
  public static class Nullary<V> extends Case<V> {
    /** The value of the variant type that this case denotes. */
    public final V constant;

    Nullary(String name, int ordinal, V constant) {
      super(name, ordinal);
      this.constant = requireNonNull(constant);
    }

    /** Returns a tag for use by a discriminant. */
    public CaseValue<V> tag() {
      return new CaseValue<>(this, null);
    }
  }

  /** Case that carries a value. */
  public static class Unary<V, P> extends Case<V> {
    public final Type<P> payloadType;
    private final Function<? super P, ? extends V> constructor;

    Unary(
        String name,
        int ordinal,
        Type<P> payloadType,
        Function<? super P, ? extends V> constructor) {
      super(name, ordinal);
      this.payloadType = requireNonNull(payloadType);
      this.constructor = requireNonNull(constructor);
    }

    /** Creates a value of the variant type from a payload. */
    public V construct(P payload) {
      return requireNonNull(constructor.apply(payload), "constructor");
    }

    /** Returns a tag, holding a payload, for use by a discriminant. */
    public CaseValue<V> tag(P payload) {
      return new CaseValue<>(this, requireNonNull(payload));
    }
  }
}

// End Case.java
