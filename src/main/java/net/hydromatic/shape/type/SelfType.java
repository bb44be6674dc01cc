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

import com.google.common.base.Suppliers;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Recursive type.
 *
 * <p>The body is a function from "the type being defined" to its definition.
 * For example, a list of integers might be defined as
 *
 * <pre>{@code
 * Types.mu(self -> Types.option(Types.pair(Types.INT, self)))
 * }</pre>
 *
 * <p>Printers and parsers call {@link #fix()}, whose result refers back to this
 * type, and so unroll one level each time they reach this node. The type
 * syntax printer calls {@link #unroll(Type)} with a {@link TypeVar} so that
 * it never sees the cycle.
 */
public class SelfType<A> extends BaseType<A> {
  private final Function<Type<A>, Type<A>> body;
  private final Supplier<Type<A>> fix;

  SelfType(Function<Type<A>, Type<A>> body) {
    super(Op.SELF);
    this.body = requireNonNull(body);
    this.fix = Suppliers.memoize(() -> unroll(this));
  }

  /** Returns the body with {@code placeholder} for each self-reference. */
  public Type<A> unroll(Type<A> placeholder) {
    return requireNonNull(body.apply(placeholder), "body");
  }

  /** Returns the body with this type for each self-reference. */
  public Type<A> fix() {
    return fix.get();
  }
}

// End SelfType.java
