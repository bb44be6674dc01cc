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
package net.hydromatic.shape.print;

import static java.util.Objects.requireNonNull;

import net.hydromatic.shape.type.ArrayType;
import net.hydromatic.shape.type.Case;
import net.hydromatic.shape.type.CustomType;
import net.hydromatic.shape.type.Field;
import net.hydromatic.shape.type.ListType;
import net.hydromatic.shape.type.MapType;
import net.hydromatic.shape.type.OptionType;
import net.hydromatic.shape.type.PairType;
import net.hydromatic.shape.type.PrimType;
import net.hydromatic.shape.type.RecordType;
import net.hydromatic.shape.type.SelfType;
import net.hydromatic.shape.type.TripleType;
import net.hydromatic.shape.type.Type;
import net.hydromatic.shape.type.TypeVar;
import net.hydromatic.shape.type.Types;
import net.hydromatic.shape.type.VariantType;

/**
 * Prints types.
 *
 * <p>For example, a recursive list of integers prints as
 * "{@code ((int * 'a) option as 'a)}", and a record as
 * "{@code (< x : int; y : int > as point)}".
 *
 * <p>Output is a deterministic function of the type. Type variables are named
 * afresh, starting from 'a, on each call.
 */
public class TypeSyntax {
  private final NameGenerator nameGenerator = new NameGenerator();

  private TypeSyntax() {}

  /** Returns the syntax of a type. */
  public static String toString(Type<?> type) {
    return describe(new StringBuilder(), type).toString();
  }

  /** Appends the syntax of a type to a buffer. */
  public static StringBuilder describe(StringBuilder buf, Type<?> type) {
    return new TypeSyntax().ty(buf, requireNonNull(type));
  }

  @SuppressWarnings("unchecked")
  private <A> StringBuilder ty(StringBuilder buf, Type<A> type) {
    switch (type.op()) {
      case SELF:
        return self(buf, (SelfType<A>) type);

      case CUSTOM:
        final CustomType<A> customType = (CustomType<A>) type;
        buf.append("Custom (");
        if (customType.underlying != null) {
          ty(buf, customType.underlying);
        } else {
          buf.append('-');
        }
        return buf.append(')');

      case MAP:
        buf.append("Map (");
        return ty(buf, ((MapType<A, ?>) type).representee).append(')');

      case PRIM:
        final PrimType<A> primType = (PrimType<A>) type;
        return primType.len.describe(buf.append(primType.prim.moniker));

      case LIST:
        final ListType<?> listType = (ListType<?>) type;
        ty(buf, listType.elementType).append(" list");
        return listType.len.describe(buf);

      case ARRAY:
        final ArrayType<?> arrayType = (ArrayType<?>) type;
        ty(buf, arrayType.elementType).append(" array");
        return arrayType.len.describe(buf);

      case OPTION:
        return ty(buf, ((OptionType<?>) type).elementType).append(" option");

      case PAIR:
        final PairType<?, ?> pairType = (PairType<?, ?>) type;
        buf.append('(');
        ty(buf, pairType.firstType).append(" * ");
        return ty(buf, pairType.secondType).append(')');

      case TRIPLE:
        final TripleType<?, ?, ?> tripleType = (TripleType<?, ?, ?>) type;
        buf.append('(');
        ty(buf, tripleType.firstType).append(" * ");
        ty(buf, tripleType.secondType).append(" * ");
        return ty(buf, tripleType.thirdType).append(')');

      case RECORD:
        return record(buf, (RecordType<A>) type);

      case VARIANT:
        return variant(buf, (VariantType<A>) type);

      case VAR:
        return buf.append(((TypeVar<A>) type).name);

      default:
        throw new AssertionError(type.op());
    }
  }

  /**
   * Prints a recursive type.
   *
   * <p>A record or variant already has a name, and the self-references print
   * as that name. Any other body gets a fresh type variable, drawn before the
   * body is printed: "{@code (<body> as 'a)}".
   */
  private <A> StringBuilder self(StringBuilder buf, SelfType<A> selfType) {
    final Type<A> body = selfType.unroll(Types.var(""));
    switch (body.op()) {
      case RECORD:
        final String recordName = ((RecordType<A>) body).name;
        return ty(buf, selfType.unroll(Types.var(recordName)));

      case VARIANT:
        final String variantName = ((VariantType<A>) body).name;
        return ty(buf, selfType.unroll(Types.var(variantName)));

      default:
        final TypeVar<A> var = Types.var(nameGenerator.get());
        buf.append('(');
        ty(buf, selfType.unroll(var));
        return buf.append(" as ").append(var.name).append(')');
    }
  }

  /**
   * Prints a record type, "{@code (< x : int; y : int > as point)}".
   *
   * <p>A record with no fields prints as "{@code (<> as name)}", keeping both
   * brackets; earlier formatters wrote "{@code (> as name)}".
   */
  private <R> StringBuilder record(StringBuilder buf, RecordType<R> type) {
    buf.append("(<");
    int i = 0;
    for (Field<R, ?> field : type.fields) {
      if (i++ > 0) {
        buf.append(';');
      }
      buf.append(' ').append(field.name).append(" : ");
      ty(buf, field.type);
    }
    if (!type.fields.isEmpty()) {
      buf.append(' ');
    }
    return buf.append("> as ").append(type.name).append(')');
  }

  private <V> StringBuilder variant(StringBuilder buf, VariantType<V> type) {
    if (type.cases.isEmpty()) {
      // empty type
      return buf.append("({} as ").append(type.name).append(')');
    }
    buf.append("([");
    for (Case<V> c : type.cases) {
      if (c.ordinal > 0) {
        buf.append(" |");
      }
      buf.append(' ').append(c.capitalizedName());
      if (c instanceof Case.Unary) {
        buf.append(" of ");
        ty(buf, ((Case.Unary<V, ?>) c).payloadType);
      }
    }
    return buf.append(" ] as ").append(type.name).append(')');
  }
}

// End TypeSyntax.java
