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

import java.util.List;
import java.util.function.Function;
import java.util.function.IntFunction;
import net.hydromatic.shape.parse.Result;
import net.hydromatic.shape.util.Unit;

/**
 * Factory for {@link Type} objects.
 *
 * <p>For example, the type of a record with two integer fields:
 *
 * <pre>{@code
 * RecordType<Point> point =
 *     Types.<Point>record(
 *             "point", a -> new Point((int) a.get(0), (int) a.get(1)))
 *         .field("x", Types.INT, p -> p.x)
 *         .field("y", Types.INT, p -> p.y)
 *         .build();
 * }</pre>
 */
public final class Types {
  private Types() {}

  public static final PrimType<Unit> UNIT = prim(Prim.UNIT);
  public static final PrimType<Boolean> BOOL = prim(Prim.BOOL);
  public static final PrimType<Character> CHAR = prim(Prim.CHAR);
  public static final PrimType<Integer> INT = prim(Prim.INT);
  public static final PrimType<Integer> INT32 = prim(Prim.INT32);
  public static final PrimType<Long> INT64 = prim(Prim.INT64);
  public static final PrimType<Double> FLOAT = prim(Prim.FLOAT);
  public static final PrimType<String> STRING = string(Len.DEFAULT);
  public static final PrimType<byte[]> BYTES = bytes(Len.DEFAULT);

  private static <A> PrimType<A> prim(Prim prim) {
    return new PrimType<>(prim, Len.DEFAULT);
  }

  /** Returns a string type with a given length hint. */
  public static PrimType<String> string(Len len) {
    return new PrimType<>(Prim.STRING, len);
  }

  /** Returns a bytes type with a given length hint. */
  public static PrimType<byte[]> bytes(Len len) {
    return new PrimType<>(Prim.BYTES, len);
  }

  public static <E> ListType<E> list(Type<E> elementType) {
    return list(elementType, Len.DEFAULT);
  }

  public static <E> ListType<E> list(Type<E> elementType, Len len) {
    return new ListType<>(elementType, len);
  }

  /**
   * Returns an array type.
   *
   * @param factory creates arrays, e.g. {@code Integer[]::new}
   */
  public static <E> ArrayType<E> array(
      Type<E> elementType, IntFunction<E[]> factory) {
    return array(elementType, factory, Len.DEFAULT);
  }

  public static <E> ArrayType<E> array(
      Type<E> elementType, IntFunction<E[]> factory, Len len) {
    return new ArrayType<>(elementType, factory, len);
  }

  public static <E> OptionType<E> option(Type<E> elementType) {
    return new OptionType<>(elementType);
  }

  public static <A, B> PairType<A, B> pair(Type<A> a, Type<B> b) {
    return new PairType<>(a, b);
  }

  public static <A, B, C> TripleType<A, B, C> triple(
      Type<A> a, Type<B> b, Type<C> c) {
    return new TripleType<>(a, b, c);
  }

  /**
   * Returns a type whose values are printed and parsed as values of
   * {@code representee}.
   *
   * @param forward converts a representee value to a value of the new type
   * @param backward converts a value of the new type to a representee value
   */
  public static <A, B> MapType<A, B> map(
      Type<B> representee,
      Function<? super B, ? extends A> forward,
      Function<? super A, ? extends B> backward) {
    return new MapType<>(representee, forward, backward);
  }

  /** Returns an opaque type with its own printer and parser. */
  public static <A> CustomType<A> custom(
      Function<? super A, String> printer,
      Function<String, Result<A>> parser) {
    return new CustomType<>(printer, parser, null);
  }

  /**
   * Returns a type with its own printer and parser, whose structure is
   * {@code underlying}.
   */
  public static <A> CustomType<A> custom(
      Function<? super A, String> printer,
      Function<String, Result<A>> parser,
      Type<A> underlying) {
    return new CustomType<>(printer, parser, underlying);
  }

  /**
   * Returns a recursive type.
   *
   * <p>{@code body} receives the type being defined, and must return its
   * definition without inspecting the argument.
   */
  public static <A> SelfType<A> mu(Function<Type<A>, Type<A>> body) {
    return new SelfType<>(body);
  }

  /**
   * Starts building a record type.
   *
   * @param constructor creates a record from its field values, given in the
   *     order that fields are added
   */
  public static <R> RecordType.Builder<R> record(
      String name, Function<List<Object>, R> constructor) {
    return new RecordType.Builder<>(name, constructor);
  }

  /** Starts building a variant type. */
  public static <V> VariantType.Builder<V> variant(String name) {
    return new VariantType.Builder<>(name);
  }

  /** Returns a type variable; for use only when describing types. */
  public static <A> TypeVar<A> var(String name) {
    return new TypeVar<>(name);
  }
}

// End Types.java
