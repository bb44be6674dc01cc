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

import static java.nio.charset.StandardCharsets.UTF_8;
import static net.hydromatic.shape.parse.Parsers.quote;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.io.BaseEncoding;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import net.hydromatic.shape.Prop;
import net.hydromatic.shape.type.ArrayType;
import net.hydromatic.shape.type.Case;
import net.hydromatic.shape.type.CustomType;
import net.hydromatic.shape.type.Field;
import net.hydromatic.shape.type.ListType;
import net.hydromatic.shape.type.MapType;
import net.hydromatic.shape.type.Op;
import net.hydromatic.shape.type.OptionType;
import net.hydromatic.shape.type.PairType;
import net.hydromatic.shape.type.Prim;
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
import net.hydromatic.shape.util.Unit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.json.JsonMapper;
import tools.jackson.databind.node.JsonNodeType;

/**
 * Decodes values of any type from JSON.
 *
 * <p>The JSON form of each type:
 *
 * <ul>
 *   <li>unit: {@code {}} or {@code null};
 *   <li>bool, integers, float: JSON booleans and numbers; a float may also be
 *       one of the strings "infinity", "neg_infinity", "nan";
 *   <li>char: a string of length 1;
 *   <li>string, bytes: a string, or {@code {"base64": "..."}};
 *   <li>list, array: an array;
 *   <li>option: {@code null} for none, otherwise the value;
 *   <li>pair, triple: an array of 2 or 3 elements;
 *   <li>record: an object whose members are fields; an absent option field
 *       is none;
 *   <li>variant: the case name as a string if the case carries no value,
 *       otherwise {@code {"name": payload}}.
 * </ul>
 *
 * <p>A failure message gives the path to the offending JSON value, e.g.
 * {@code $.points[2].x}.
 */
public class JsonDecoder {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(JsonDecoder.class);

  private static final String BASE64 = "base64";

  private final ObjectMapper mapper = JsonMapper.builder().build();
  private final boolean strictFields;

  public JsonDecoder(boolean strictFields) {
    this.strictFields = strictFields;
  }

  /** Creates a decoder configured by properties. */
  public static JsonDecoder create(Map<Prop, Object> map) {
    return new JsonDecoder(Prop.STRICT_FIELDS.booleanValue(map));
  }

  /** Creates a decoder with default properties. */
  public static JsonDecoder create() {
    return create(ImmutableMap.of());
  }

  /** Parses JSON text as a value of the given type. */
  public <A> Result<A> decode(Type<A> type, String json) {
    final JsonNode node;
    try {
      node = mapper.readTree(json);
    } catch (JacksonException e) {
      LOGGER.debug("malformed JSON {}", quote(json), e);
      return Result.error(
          "invalid JSON " + quote(json) + ": " + e.getOriginalMessage());
    }
    if (node == null || node.getNodeType() == JsonNodeType.MISSING) {
      return Result.error("invalid JSON " + quote(json) + ": no content");
    }
    return decode(type, node);
  }

  /** Converts a JSON tree to a value of the given type. */
  @SuppressWarnings("unchecked")
  public <A> Result<A> decode(Type<A> type, JsonNode node) {
    try {
      return Result.ok((A) convert(type, node, "$"));
    } catch (ShapeParseException e) {
      LOGGER.debug("cannot decode {}", node, e);
      return Result.error(e.getMessage());
    }
  }

  private static ShapeParseException fail(
      String message, String path, JsonNode node) {
    return new ShapeParseException(message + " at " + path + ": " + node);
  }

  private static void expect(
      JsonNode node, JsonNodeType nodeType, String what, String path) {
    if (node.getNodeType() != nodeType) {
      throw fail("expected " + what, path, node);
    }
  }

  private static void expectSize(
      JsonNode node, int size, String what, String path) {
    expect(node, JsonNodeType.ARRAY, what, path);
    if (node.size() != size) {
      throw fail(
          "expected " + what + " with " + size + " elements", path, node);
    }
  }

  private Object convert(Type<?> type, JsonNode node, String path) {
    switch (type.op()) {
      case SELF:
        return convert(((SelfType<?>) type).fix(), node, path);

      case CUSTOM:
        final CustomType<?> customType = (CustomType<?>) type;
        final String text =
            node.getNodeType() == JsonNodeType.STRING
                ? node.asString()
                : node.toString();
        final Result<?> result = customType.parse(text);
        if (!result.isOk()) {
          throw fail(result.message(), path, node);
        }
        return result.get();

      case MAP:
        return convertMapped((MapType<?, ?>) type, node, path);

      case PRIM:
        return convertPrimitive((PrimType<?>) type, node, path);

      case LIST:
        final ListType<?> listType = (ListType<?>) type;
        expect(node, JsonNodeType.ARRAY, "list", path);
        final ImmutableList.Builder<Object> list = ImmutableList.builder();
        for (int i = 0; i < node.size(); i++) {
          list.add(
              convert(listType.elementType, node.get(i), element(path, i)));
        }
        return list.build();

      case ARRAY:
        return convertArray((ArrayType<?>) type, node, path);

      case OPTION:
        final OptionType<?> optionType = (OptionType<?>) type;
        if (node.getNodeType() == JsonNodeType.NULL) {
          return Optional.empty();
        }
        return Optional.of(convert(optionType.elementType, node, path));

      case PAIR:
        final PairType<?, ?> pairType = (PairType<?, ?>) type;
        expectSize(node, 2, "pair", path);
        return Pair.of(
            convert(pairType.firstType, node.get(0), element(path, 0)),
            convert(pairType.secondType, node.get(1), element(path, 1)));

      case TRIPLE:
        final TripleType<?, ?, ?> tripleType = (TripleType<?, ?, ?>) type;
        expectSize(node, 3, "triple", path);
        return Triple.of(
            convert(tripleType.firstType, node.get(0), element(path, 0)),
            convert(tripleType.secondType, node.get(1), element(path, 1)),
            convert(tripleType.thirdType, node.get(2), element(path, 2)));

      case RECORD:
        return convertRecord((RecordType<?>) type, node, path);

      case VARIANT:
        return convertVariant((VariantType<?>) type, node, path);

      case VAR:
        throw new UnboundTypeVariableException(((TypeVar<?>) type).name);

      default:
        throw new AssertionError(type.op());
    }
  }

  private static String element(String path, int i) {
    return path + "[" + i + "]";
  }

  private static String member(String path, String name) {
    return path + "." + name;
  }

  @SuppressWarnings("unchecked")
  private <A, B> A convertMapped(
      MapType<A, B> mapType, JsonNode node, String path) {
    final B b = (B) convert(mapType.representee, node, path);
    final Result<A> result = StringDecoder.forward(mapType, b, node.toString());
    if (!result.isOk()) {
      throw fail(result.message(), path, node);
    }
    return result.get();
  }

  @SuppressWarnings("unchecked")
  private <E> E[] convertArray(
      ArrayType<E> arrayType, JsonNode node, String path) {
    expect(node, JsonNodeType.ARRAY, "array", path);
    final E[] array = arrayType.newArray(node.size());
    for (int i = 0; i < array.length; i++) {
      array[i] =
          (E) convert(arrayType.elementType, node.get(i), element(path, i));
    }
    return array;
  }

  private <R> R convertRecord(
      RecordType<R> recordType, JsonNode node, String path) {
    expect(node, JsonNodeType.OBJECT, "record " + recordType.name, path);
    if (strictFields) {
      for (Map.Entry<String, JsonNode> entry : node.properties()) {
        if (recordType.field(entry.getKey()) == null) {
          throw fail(
              "unknown field '" + entry.getKey() + "' of record "
                  + recordType.name,
              path,
              node);
        }
      }
    }
    final List<Object> values = new ArrayList<>();
    for (Field<R, ?> field : recordType.fields) {
      final JsonNode fieldNode = node.get(field.name);
      if (fieldNode == null) {
        if (field.type.op() == Op.OPTION) {
          values.add(Optional.empty());
          continue;
        }
        throw fail(
            "missing field '" + field.name + "' of record " + recordType.name,
            path,
            node);
      }
      values.add(convert(field.type, fieldNode, member(path, field.name)));
    }
    return recordType.construct(ImmutableList.copyOf(values));
  }

  private <V> V convertVariant(
      VariantType<V> variantType, JsonNode node, String path) {
    final String what = "case of variant " + variantType.name;
    switch (node.getNodeType()) {
      case STRING:
        final Case<V> c = lookup(variantType, node.asString(), path, node);
        if (!(c instanceof Case.Nullary)) {
          throw fail("case " + c.name + " requires a value", path, node);
        }
        return ((Case.Nullary<V>) c).constant;

      case OBJECT:
        if (node.size() != 1) {
          throw fail("expected " + what, path, node);
        }
        final Map.Entry<String, JsonNode> entry =
            node.properties().iterator().next();
        final Case<V> c1 = lookup(variantType, entry.getKey(), path, node);
        if (!(c1 instanceof Case.Unary)) {
          throw fail("case " + c1.name + " takes no value", path, node);
        }
        return construct(
            (Case.Unary<V, ?>) c1,
            entry.getValue(),
            member(path, entry.getKey()));

      default:
        throw fail("expected " + what, path, node);
    }
  }

  private static <V> Case<V> lookup(
      VariantType<V> variantType, String name, String path, JsonNode node) {
    final Case<V> c = variantType.lookup(name);
    if (c == null) {
      throw fail(
          "unknown case '" + name + "' of variant " + variantType.name,
          path,
          node);
    }
    return c;
  }

  @SuppressWarnings("unchecked")
  private <V, P> V construct(Case.Unary<V, P> c, JsonNode node, String path) {
    return c.construct((P) convert(c.payloadType, node, path));
  }

  private static Object convertPrimitive(
      PrimType<?> primType, JsonNode node, String path) {
    final Prim prim = primType.prim;
    switch (prim) {
      case UNIT:
        if (node.getNodeType() == JsonNodeType.NULL
            || node.getNodeType() == JsonNodeType.OBJECT && node.size() == 0) {
          return Unit.INSTANCE;
        }
        throw fail("expected unit", path, node);

      case BOOL:
        expect(node, JsonNodeType.BOOLEAN, "bool", path);
        return node.booleanValue();

      case CHAR:
        expect(node, JsonNodeType.STRING, "char", path);
        final String s = node.asString();
        if (s.length() != 1) {
          throw fail("expected char", path, node);
        }
        return s.charAt(0);

      case INT:
      case INT32:
        expect(node, JsonNodeType.NUMBER, prim.moniker, path);
        try {
          return Parsers.parseInt(node.asString());
        } catch (NumberFormatException e) {
          throw fail("expected " + prim.moniker, path, node);
        }

      case INT64:
        expect(node, JsonNodeType.NUMBER, prim.moniker, path);
        try {
          return Parsers.parseLong(node.asString());
        } catch (NumberFormatException e) {
          throw fail("expected " + prim.moniker, path, node);
        }

      case FLOAT:
        if (node.getNodeType() != JsonNodeType.NUMBER
            && node.getNodeType() != JsonNodeType.STRING) {
          throw fail("expected float", path, node);
        }
        try {
          return Parsers.parseFloat(node.asString());
        } catch (NumberFormatException e) {
          throw fail("expected float", path, node);
        }

      case STRING:
        if (node.getNodeType() == JsonNodeType.STRING) {
          return node.asString();
        }
        return new String(base64(node, prim, path), UTF_8);

      case BYTES:
        if (node.getNodeType() == JsonNodeType.STRING) {
          return node.asString().getBytes(UTF_8);
        }
        return base64(node, prim, path);

      default:
        throw new AssertionError(prim);
    }
  }

  /** Decodes an object of the form {@code {"base64": "..."}}. */
  private static byte[] base64(JsonNode node, Prim prim, String path) {
    final JsonNode encoded = node.get(BASE64);
    if (node.getNodeType() != JsonNodeType.OBJECT
        || node.size() != 1
        || encoded == null
        || encoded.getNodeType() != JsonNodeType.STRING) {
      throw fail("expected " + prim.moniker, path, node);
    }
    try {
      return BaseEncoding.base64().decode(encoded.asString());
    } catch (IllegalArgumentException e) {
      throw fail("invalid base64", path, node);
    }
  }
}

// End JsonDecoder.java
