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
import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.HashSet;
import java.util.Set;
import java.util.function.Function;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The type of a variant (sum) value.
 *
 * <p>The discriminant maps each value to its active case; see
 * {@link Builder#build(Function)}.
 */
public class VariantType<V> extends BaseType<V> {
  public final String name;
  public final ImmutableList<Case<V>> cases;
  private final Function<? super V, CaseValue<V>> discriminant;

  VariantType(
      String name,
      ImmutableList<Case<V>> cases,
      Function<? super V, CaseValue<V>> discriminant) {
    super(Op.VARIANT);
    this.name = requireNonNull(name);
    this.cases = requireNonNull(cases);
    this.discriminant = requireNonNull(discriminant);
  }

  /** Returns the active case of a value. */
  public CaseValue<V> caseOf(V value) {
    final CaseValue<V> caseValue =
        requireNonNull(discriminant.apply(value), "discriminant");
    final Case<V> c = caseValue.variantCase;
    checkState(
        c.ordinal < cases.size() && cases.get(c.ordinal) == c,
        "discriminant of %s returned foreign case %s",
        name,
        c);
    return caseValue;
  }

  /**
   * Returns the case with a given name, or null. The name may be as declared
   * or capitalized.
   */
  public @Nullable Case<V> lookup(String caseName) {
    for (Case<V> c : cases) {
      if (c.name.equals(caseName)) {
        return c;
      }
    }
    for (Case<V> c : cases) {
      if (c.capitalizedName().equals(caseName)) {
        return c;
      }
    }
    return null;
  }

  /** Builds a {@link VariantType}; see {@link Types#variant}. */
  public static class Builder<V> {
    private final String name;
    private final ImmutableList.Builder<Case<V>> cases =
        ImmutableList.builder();
    private final Set<String> names = new HashSet<>();

    Builder(String name) {
      this.name = requireNonNull(name);
    }

    private int register(String caseName) {
      checkArgument(
          names.add(caseName),
          "duplicate case '%s' in variant %s",
          caseName,
          name);
      return names.size() - 1;
    }

    /** Adds a case that carries no value. */
    public Case.Nullary<V> case0(String caseName, V constant) {
      final Case.Nullary<V> c =
          new Case.Nullary<>(caseName, register(caseName), constant);
      cases.add(c);
      return c;
    }

    /** Adds a case that carries a value. */
    public <P> Case.Unary<V, P> case1(
        String caseName,
        Type<P> payloadType,
        Function<? super P, ? extends V> constructor) {
      final Case.Unary<V, P> c =
          new Case.Unary<>(
              caseName, register(caseName), payloadType, constructor);
      cases.add(c);
      return c;
    }

    /**
     * Creates the type.
     *
     * <p>The discriminant must return the tag of a case added to this
     * builder.
     */
    public VariantType<V> build(
        Function<? super V, CaseValue<V>> discriminant) {
      return new VariantType<>(name, cases.build(), discriminant);
    }
  }
}

// End VariantType.java
