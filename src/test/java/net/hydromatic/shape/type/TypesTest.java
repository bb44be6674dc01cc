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

import static net.hydromatic.shape.Fixtures.CHAIN;
import static net.hydromatic.shape.Fixtures.POINT;
import static net.hydromatic.shape.Fixtures.SHAPE;
import static net.hydromatic.shape.Fixtures.TREE;
import static org.hamcrest.CoreMatchers.instanceOf;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.notNullValue;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import net.hydromatic.shape.Fixtures;
import net.hydromatic.shape.util.Unit;
import org.junit.jupiter.api.Test;

/** Tests for type descriptors and {@link Types}. */
public class TypesTest {
  @Test
  void testOp() {
    assertThat(Types.INT.op(), is(Op.PRIM));
    assertThat(Types.list(Types.INT).op(), is(Op.LIST));
    assertThat(Types.array(Types.INT, Integer[]::new).op(), is(Op.ARRAY));
    assertThat(Types.option(Types.INT).op(), is(Op.OPTION));
    assertThat(Types.pair(Types.INT, Types.INT).op(), is(Op.PAIR));
    assertThat(
        Types.triple(Types.INT, Types.INT, Types.INT).op(), is(Op.TRIPLE));
    assertThat(POINT.op(), is(Op.RECORD));
    assertThat(SHAPE.op(), is(Op.VARIANT));
    assertThat(TREE.op(), is(Op.SELF));
    assertThat(Fixtures.COLOR.op(), is(Op.MAP));
    assertThat(Fixtures.HEX.op(), is(Op.CUSTOM));
    assertThat(Types.var("'a").op(), is(Op.VAR));
  }

  @Test
  void testPrim() {
    assertThat(Types.INT.prim, is(Prim.INT));
    assertThat(Types.INT.len, is(Len.DEFAULT));
    assertThat(Types.string(Len.INT8).len, is(Len.INT8));
    assertThat(Prim.STRING.isSized(), is(true));
    assertThat(Prim.BYTES.isSized(), is(true));
    assertThat(Prim.INT64.isSized(), is(false));
    assertThat(Prim.INT32.toString(), is("int32"));
  }

  @Test
  void testLen() {
    assertThat(Len.fixed(4), is(Len.fixed(4)));
    assertThat(Len.fixed(4).kind, is(Len.Kind.FIXED));
    assertThat(Len.fixed(4).toString(), is(":<4>"));
    assertThat(Len.INT16.toString(), is(":16"));
    assertThat(Len.DEFAULT.toString(), is("default"));
    assertThat(Len.DEFAULT.describe(new StringBuilder("x")).toString(),
        is("x"));
    assertThrows(IllegalArgumentException.class, () -> Len.fixed(-1));
  }

  @Test
  void testRecord() {
    assertThat(POINT.name, is("point"));
    assertThat(POINT.fields.size(), is(2));
    assertThat(POINT.fields.get(1).name, is("y"));
    assertThat(POINT.fields.get(1).toString(), is("y : int"));
    assertThat(POINT.field("x"), notNullValue());
    assertThat(POINT.field("z"), nullValue());

    final Fixtures.Point p = POINT.construct(ImmutableList.of(5, 6));
    assertThat(p, is(new Fixtures.Point(5, 6)));
    final Object x = POINT.fields.get(0).get(p);
    assertThat(x, is(5));
    assertThrows(IllegalArgumentException.class,
        () -> POINT.construct(ImmutableList.of(5)));
  }

  @Test
  void testRecordDuplicateField() {
    final RecordType.Builder<Unit> builder =
        Types.<Unit>record("r", args -> Unit.INSTANCE)
            .field("a", Types.INT, r -> 1);
    final IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class,
            () -> builder.field("a", Types.BOOL, r -> true));
    assertThat(e.getMessage(), is("duplicate field 'a' in record r"));
  }

  @Test
  void testVariant() {
    assertThat(SHAPE.name, is("shape"));
    assertThat(SHAPE.cases.size(), is(2));
    assertThat(SHAPE.cases.get(0).ordinal, is(0));
    assertThat(SHAPE.cases.get(0).capitalizedName(), is("Circle"));
    assertThat(SHAPE.lookup("circle"), sameInstance(SHAPE.cases.get(0)));
    assertThat(SHAPE.lookup("Square"), sameInstance(SHAPE.cases.get(1)));
    assertThat(SHAPE.lookup("hexagon"), nullValue());

    final CaseValue<Fixtures.Shape> circle =
        SHAPE.caseOf(new Fixtures.Circle(1.5));
    assertThat(circle.variantCase.name, is("circle"));
    assertThat(circle.payload, is(1.5));
    assertThat(circle.toString(), is("circle 1.5"));

    final CaseValue<Fixtures.Shape> square =
        SHAPE.caseOf(Fixtures.Square.INSTANCE);
    assertThat(square.variantCase, instanceOf(Case.Nullary.class));
    assertThat(square.payload, nullValue());
  }

  @Test
  void testVariantDuplicateCase() {
    final VariantType.Builder<Object> builder = Types.variant("v");
    builder.case0("a", "A");
    assertThrows(IllegalArgumentException.class,
        () -> builder.case1("a", Types.INT, i -> i));
  }

  /** A discriminant must return a case of its own variant. */
  @Test
  void testForeignCase() {
    final VariantType.Builder<String> other = Types.variant("other");
    final Case.Nullary<String> foreign = other.case0("x", "x");
    final VariantType.Builder<String> builder = Types.variant("v");
    builder.case0("y", "y");
    final VariantType<String> v = builder.build(s -> foreign.tag());
    assertThrows(IllegalStateException.class, () -> v.caseOf("y"));
  }

  @Test
  void testCapitalize() {
    assertThat(Case.capitalize("circle"), is("Circle"));
    assertThat(Case.capitalize("Circle"), is("Circle"));
    assertThat(Case.capitalize("_x"), is("_x"));
    assertThat(Case.capitalize(""), is(""));
  }

  @Test
  void testSelf() {
    final Type<Fixtures.Tree> fix = TREE.fix();
    assertThat(fix, sameInstance(TREE.fix()));
    assertThat(fix.op(), is(Op.VARIANT));

    final Type<Fixtures.Chain> unrolled = CHAIN.unroll(Types.var("'x"));
    assertThat(unrolled.op(), is(Op.MAP));
    assertThat(unrolled.toString(), is("Map ((int * 'x) option)"));
  }

  @Test
  void testTypeVar() {
    final TypeVar<Integer> var = Types.var("'b");
    assertThat(var.name, is("'b"));
    assertThat(var.toString(), is("'b"));
    assertThrows(IllegalArgumentException.class,
        () -> TypeVar.ordinalName(-1));
  }

  @Test
  void testUnboundTypeVariableException() {
    final UnboundTypeVariableException e =
        new UnboundTypeVariableException("'c");
    assertThat(e.name(), is("'c"));
    assertThat(e.getMessage(), is("unbound type variable 'c"));
  }
}

// End TypesTest.java
