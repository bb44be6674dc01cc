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
package net.hydromatic.shape.parse;

import static java.util.Objects.requireNonNull;
import static net.hydromatic.shape.parse.Parsers.quote;

import java.util.function.Function;
import net.hydromatic.shape.type.CustomType;
import net.hydromatic.shape.type.MapType;
import net.hydromatic.shape.type.Prim;
import net.hydromatic.shape.type.PrimType;
import net.hydromatic.shape.type.SelfType;
import net.hydromatic.shape.type.Type;
import net.hydromatic.shape.util.Unit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses values of primitive types from strings.
 *
 * <p>Recursive, custom and mapped types are unwrapped here; every other
 * composite type is forwarded to a {@link JsonDecoder}.
 *
 * <p>The accepted forms are plain: "{@code true}", "{@code -42}", "{@code
 * 2.5}". A string is taken as is, without quotes or escapes, so this is not
 * the inverse of the value printer for strings. A character is taken from
 * position 1 of the input, so "{@code 'c'}" parses to {@code c}, and a
 * one-character input fails.
 */
public class StringDecoder {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(StringDecoder.class);

  private final JsonDecoder jsonDecoder;

  public StringDecoder(JsonDecoder jsonDecoder) {
    this.jsonDecoder = requireNonNull(jsonDecoder);
  }

  /** Parses a string as a value of the given type. */
  @SuppressWarnings("unchecked")
  public <A> Result<A> decode(Type<A> type, String s) {
    requireNonNull(s);
    switch (type.op()) {
      case SELF:
        return decode(((SelfType<A>) type).fix(), s);

      case CUSTOM:
        return ((CustomType<A>) type).parse(s);

      case MAP:
        return decodeMapped((MapType<A, ?>) type, s);

      case PRIM:
        return (Result<A>) decodePrimitive((PrimType<A>) type, s);

      default:
        LOGGER.debug("forwarding {} type to structural decoder", type.op());
        return jsonDecoder.decode(type, s);
    }
  }

  private <A, B> Result<A> decodeMapped(MapType<A, B> mapType, String s) {
    return decode(mapType.representee, s)
        .flatMap(b -> forward(mapType, b, s));
  }

  /**
   * Applies the forward function of a map type. If it rejects the value by
   * throwing {@link IllegalArgumentException}, returns a failure.
   */
  static <A, B> Result<A> forward(MapType<A, B> mapType, B b, String s) {
    final A a;
    try {
      a = mapType.forward(b);
    } catch (IllegalArgumentException e) {
      LOGGER.debug("mapping rejected {}", quote(s), e);
      return Result.error(
          "invalid value " + quote(s) + ": " + e.getMessage());
    }
    return Result.ok(requireNonNull(a, "forward"));
  }

  private static Result<?> decodePrimitive(PrimType<?> primType, String s) {
    final Prim prim = primType.prim;
    switch (prim) {
      case UNIT:
        return Result.ok(Unit.INSTANCE);
      case BOOL:
        return convert(prim, s, Parsers::parseBool);
      case CHAR:
        return convert(prim, s, x -> x.charAt(1));
      case INT:
      case INT32:
        return convert(prim, s, Parsers::parseInt);
      case INT64:
        return convert(prim, s, Parsers::parseLong);
      case FLOAT:
        return convert(prim, s, Parsers::parseFloat);
      case STRING:
        return Result.ok(s);
      case BYTES:
        return convert(prim, s, Parsers::latin1Bytes);
      default:
        throw new AssertionError(prim);
    }
  }

  /**
   * Applies a conversion function, converting the exceptions that Java's
   * conversion functions throw for bad input into a failure.
   */
  private static <A> Result<A> convert(
      Prim prim, String s, Function<String, A> fn) {
    try {
      return Result.ok(fn.apply(s));
    } catch (IllegalArgumentException | IndexOutOfBoundsException e) {
      LOGGER.debug("cannot parse {} as {}", quote(s), prim, e);
      return Result.error("invalid " + prim + ": " + quote(s));
    }
  }
}

// End StringDecoder.java
