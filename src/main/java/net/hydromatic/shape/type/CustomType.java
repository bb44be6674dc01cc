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
import net.hydromatic.shape.parse.Result;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Type whose values are printed and parsed by functions supplied when the
 * type is built.
 *
 * <p>If the underlying type is known, {@link #underlying} holds it, and the
 * type syntax printer shows it; otherwise the type is opaque.
 */
public class CustomType<A> extends BaseType<A> {
  private final Function<? super A, String> printer;
  private final Function<String, Result<A>> parser;
  public final @Nullable Type<A> underlying;

  CustomType(
      Function<? super A, String> printer,
      Function<String, Result<A>> parser,
      @Nullable Type<A> underlying) {
    super(Op.CUSTOM);
    this.printer = requireNonNull(printer);
    this.parser = requireNonNull(parser);
    this.underlying = underlying;
  }

  /** Renders a value. */
  public String print(A value) {
    return requireNonNull(printer.apply(value), "printer");
  }

  /** Parses a value. */
  public Result<A> parse(String s) {
    return requireNonNull(parser.apply(s), "parser");
  }
}

// End CustomType.java
