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
package net.hydromatic.shape;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableMap;
import java.util.Map;
import net.hydromatic.shape.parse.JsonDecoder;
import net.hydromatic.shape.parse.Result;
import net.hydromatic.shape.parse.ShapeParseException;
import net.hydromatic.shape.parse.StringDecoder;
import net.hydromatic.shape.print.Pretty;
import net.hydromatic.shape.print.TypeSyntax;
import net.hydromatic.shape.type.Type;

/**
 * Entry point: prints values, prints types, and parses values, each directed
 * by a {@link Type}.
 *
 * <p>For example,
 *
 * <pre>{@code
 * Shapes shapes = Shapes.create();
 * shapes.print(Types.list(Types.INT), ImmutableList.of(1, 2));  // "[1; 2]"
 * shapes.describe(Types.list(Types.INT));                      // "int list"
 * shapes.ofString(Types.INT, "42");                             // Ok(42)
 * }</pre>
 *
 * <p>Instances are immutable and may be shared between threads.
 */
public class Shapes {
  private static final Shapes DEFAULT = new Shapes(ImmutableMap.of());

  private final ImmutableMap<Prop, Object> map;
  private final Pretty pretty;
  private final JsonDecoder jsonDecoder;
  private final StringDecoder stringDecoder;

  private Shapes(Map<Prop, Object> map) {
    this.map = ImmutableMap.copyOf(map);
    this.pretty = Pretty.create(this.map);
    this.jsonDecoder = JsonDecoder.create(this.map);
    this.stringDecoder = new StringDecoder(jsonDecoder);
  }

  /** Returns an instance with default properties. */
  public static Shapes create() {
    return DEFAULT;
  }

  /** Returns an instance with the given properties. */
  public static Shapes create(Map<Prop, Object> map) {
    return map.isEmpty() ? DEFAULT : new Shapes(requireNonNull(map));
  }

  /** Returns the properties of this instance. */
  public ImmutableMap<Prop, Object> props() {
    return map;
  }

  /**
   * Prints a value.
   *
   * @throws net.hydromatic.shape.type.UnboundTypeVariableException if the
   *     type contains a type variable
   */
  public <A> String print(Type<A> type, A value) {
    return pretty.toString(type, value);
  }

  /** Prints a type, e.g. "{@code (int * string) list}". */
  public String describe(Type<?> type) {
    return TypeSyntax.toString(type);
  }

  /**
   * Parses a value from a string. Primitive values are in plain form, e.g.
   * "{@code -42}"; composite values are in JSON.
   */
  public <A> Result<A> ofString(Type<A> type, String s) {
    return stringDecoder.decode(type, s);
  }

  /**
   * Parses a value from a string, throwing if it is invalid.
   *
   * @throws ShapeParseException if {@code s} is not a valid value
   */
  public <A> A parse(Type<A> type, String s) {
    return ofString(type, s).orElseThrow();
  }

  /** Parses a value of any type from JSON. */
  public <A> Result<A> ofJson(Type<A> type, String json) {
    return jsonDecoder.decode(type, json);
  }
}

// End Shapes.java
