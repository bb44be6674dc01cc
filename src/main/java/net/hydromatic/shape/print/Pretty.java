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

import com.google.common.collect.ImmutableMap;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import net.hydromatic.shape.Prop;
import net.hydromatic.shape.parse.Parsers;
import net.hydromatic.shape.type.ArrayType;
import net.hydromatic.shape.type.Case;
import net.hydromatic.shape.type.CaseValue;
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
import net.hydromatic.shape.type.UnboundTypeVariableException;
import net.hydromatic.shape.type.VariantType;
import net.hydromatic.shape.util.Pair;
import net.hydromatic.shape.util.Triple;

/**
 * Prints values.
 *
 * <p>The type directs printing: records print as "{@code { x: 3; y: -4 }}",
 * lists as "{@code [1; 2; 3]}", and so forth. Printing never fails for a
 * value that agrees with its type, but throws
 * {@link UnboundTypeVariableException} if the type contains a
 * {@link TypeVar}.
 */
public class Pretty {
  private final int lineWidth;
  private final char newline;

  public Pretty(int lineWidth) {
    this.lineWidth = lineWidth;
    this.newline = '\n';
  }

  /** Creates a printer configured by properties. */
  public static Pretty create(Map<Prop, Object> map) {
    return new Pretty(Prop.LINE_WIDTH.intValue(map));
  }

  /** Creates a printer with default properties. */
  public static Pretty create() {
    return create(ImmutableMap.of());
  }

  /** Prints a value to a string. */
  public <A> String toString(Type<A> type, A value) {
    return pretty(new StringBuilder(), type, value).toString();
  }

  /** Prints a value to a buffer. */
  public <A> StringBuilder pretty(StringBuilder buf, Type<A> type, A value) {
    requireNonNull(type);
    requireNonNull(value);
    int lineEnd = lineWidth < 0 ? -1 : (buf.length() + lineWidth);
    return pretty1(buf, 0, new int[] {lineEnd}, type, value);
  }

  /**
   * Prints a value to a buffer. If the first attempt goes beyond {@code
   * lineEnd}, back-tracks, adds a newline and indent, and tries again one time.
   */
  private StringBuilder pretty1(
      StringBuilder buf,
      int indent,
      int[] lineEnd,
      Type<?> type,
      Object value) {
    final int start = buf.length();
    final int end = lineEnd[0];
    pretty2(buf, indent, lineEnd, type, value);
    if (end >= 0 && buf.length() > end) {
      // Reset to start, remove trailing whitespace, add newline
      buf.setLength(start);
      while (buf.length() > 0
          && (buf.charAt(buf.length() - 1) == ' '
              || buf.charAt(buf.length() - 1) == newline)) {
        buf.setLength(buf.length() - 1);
      }
      if (buf.length() > 0) {
        buf.append(newline);
      }

      lineEnd[0] = lineWidth < 0 ? -1 : (buf.length() + lineWidth);
      indent(buf, indent);
      pretty2(buf, indent, lineEnd, type, value);
    }
    return buf;
  }

  private static void indent(StringBuilder buf, int indent) {
    for (int i = 0; i < indent; i++) {
      buf.append(' ');
    }
  }

  @SuppressWarnings("unchecked")
  private StringBuilder pretty2(
      StringBuilder buf,
      int indent,
      int[] lineEnd,
      Type<?> type,
      Object value) {
    if (value instanceof NamedVal) {
      final NamedVal namedVal = (NamedVal) value;
      buf.append(namedVal.name).append(": ");
      return pretty2(buf, indent, lineEnd, type, namedVal.o);
    }

    switch (type.op()) {
      case SELF:
        final Type<?> fixType = ((SelfType<?>) type).fix();
        return pretty2(buf, indent, lineEnd, fixType, value);

      case CUSTOM:
        return buf.append(((CustomType<Object>) type).print(value));

      case MAP:
        return prettyMapped(
            buf, indent, lineEnd, (MapType<Object, ?>) type, value);

      case PRIM:
        return prettyPrimitive(buf, (PrimType<?>) type, value);

      case LIST:
        final ListType<?> listType = (ListType<?>) type;
        return printList(
            buf,
            indent,
            lineEnd,
            "[",
            "]",
            listType.elementType,
            (List<Object>) value);

      case ARRAY:
        final ArrayType<?> arrayType = (ArrayType<?>) type;
        return printList(
            buf,
            indent,
            lineEnd,
            "[|",
            "|]",
            arrayType.elementType,
            Arrays.asList((Object[]) value));

      case OPTION:
        final Optional<?> optional = (Optional<?>) value;
        if (!optional.isPresent()) {
          return buf.append("None");
        }
        buf.append("Some ");
        final Type<?> elementType = ((OptionType<?>) type).elementType;
        return pretty2(buf, indent, lineEnd, elementType, optional.get());

      case PAIR:
        final PairType<?, ?> pairType = (PairType<?, ?>) type;
        final Pair<?, ?> pair = (Pair<?, ?>) value;
        buf.append('(');
        pretty1(buf, indent + 1, lineEnd, pairType.firstType, pair.first);
        buf.append(", ");
        pretty1(buf, indent + 1, lineEnd, pairType.secondType, pair.second);
        return buf.append(')');

      case TRIPLE:
        final TripleType<?, ?, ?> tripleType = (TripleType<?, ?, ?>) type;
        final Triple<?, ?, ?> triple = (Triple<?, ?, ?>) value;
        buf.append('(');
        pretty1(buf, indent + 1, lineEnd, tripleType.firstType, triple.first);
        buf.append(", ");
        pretty1(
            buf, indent + 1, lineEnd, tripleType.secondType, triple.second);
        buf.append(", ");
        pretty1(buf, indent + 1, lineEnd, tripleType.thirdType, triple.third);
        return buf.append(')');

      case RECORD:
        return prettyRecord(
            buf, indent, lineEnd, (RecordType<Object>) type, value);

      case VARIANT:
        return prettyVariant(
            buf, indent, lineEnd, (VariantType<Object>) type, value);

      case VAR:
        throw new UnboundTypeVariableException(((TypeVar<?>) type).name);

      default:
        throw new AssertionError("unknown type " + type.op());
    }
  }

  private <A, B> StringBuilder prettyMapped(
      StringBuilder buf,
      int indent,
      int[] lineEnd,
      MapType<A, B> mapType,
      A value) {
    final B b = mapType.backward(value);
    return pretty2(buf, indent, lineEnd, mapType.representee, b);
  }

  private StringBuilder prettyPrimitive(
      StringBuilder buf, PrimType<?> primType, Object value) {
    switch (primType.prim) {
      case UNIT:
        return buf.append("()");
      case BOOL:
        return buf.append((boolean) (Boolean) value);
      case CHAR:
        return buf.append('\'').append((char) (Character) value).append('\'');
      case INT:
      case INT32:
        return buf.append((int) (Integer) value);
      case INT64:
        return buf.append((long) (Long) value);
      case FLOAT:
        return buf.append(Parsers.floatToString((Double) value));
      case STRING:
        return Parsers.appendQuoted(buf, (String) value);
      case BYTES:
        return Parsers.appendQuoted(buf, (byte[]) value);
      default:
        throw new AssertionError("unknown primitive " + primType.prim);
    }
  }

  private <R> StringBuilder prettyRecord(
      StringBuilder buf,
      int indent,
      int[] lineEnd,
      RecordType<R> recordType,
      R value) {
    if (recordType.fields.isEmpty()) {
      return buf.append("{}");
    }
    buf.append("{ ");
    int i = 0;
    for (Field<R, ?> field : recordType.fields) {
      if (i++ > 0) {
        buf.append("; ");
      }
      final NamedVal namedVal = new NamedVal(field.name, field.get(value));
      pretty1(buf, indent + 2, lineEnd, field.type, namedVal);
    }
    return buf.append(" }");
  }

  private <V> StringBuilder prettyVariant(
      StringBuilder buf,
      int indent,
      int[] lineEnd,
      VariantType<V> variantType,
      V value) {
    final CaseValue<V> caseValue = variantType.caseOf(value);
    buf.append(caseValue.variantCase.capitalizedName());
    if (caseValue.variantCase instanceof Case.Unary) {
      final Case.Unary<V, ?> unary = (Case.Unary<V, ?>) caseValue.variantCase;
      buf.append(" (");
      final Object payload = requireNonNull(caseValue.payload);
      pretty2(buf, indent, lineEnd, unary.payloadType, payload);
      buf.append(')');
    }
    return buf;
  }

  private StringBuilder printList(
      StringBuilder buf,
      int indent,
      int[] lineEnd,
      String open,
      String close,
      Type<?> elementType,
      List<Object> list) {
    buf.append(open);
    int i = 0;
    for (Object o : list) {
      if (i++ > 0) {
        buf.append("; ");
      }
      pretty1(buf, indent + open.length(), lineEnd, elementType, o);
    }
    return buf.append(close);
  }

  /** Wrapper that indicates that a value should be printed "name: value". */
  private static class NamedVal {
    final String name;
    final Object o;

    NamedVal(String name, Object o) {
      this.name = name;
      this.o = o;
    }
  }
}

// End Pretty.java
