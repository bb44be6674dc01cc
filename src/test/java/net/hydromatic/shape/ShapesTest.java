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

import static net.hydromatic.shape.Fixtures.POINT;
import static net.hydromatic.shape.Fixtures.SHAPE;
import static net.hydromatic.shape.Matchers.isError;
import static net.hydromatic.shape.Matchers.isOk;
import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import net.hydromatic.shape.parse.ShapeParseException;
import net.hydromatic.shape.type.Types;
import org.junit.jupiter.api.Test;

/** Tests {@link Shapes}. */
public class ShapesTest {
  @Test
  void testDefault() {
    final Shapes shapes = Shapes.create();
    assertThat(Shapes.create(ImmutableMap.of()), sameInstance(shapes));
    assertThat(shapes.props().isEmpty(), is(true));
    assertThat(shapes.print(Types.list(Types.INT), ImmutableList.of(1, 2)),
        is("[1; 2]"));
    assertThat(shapes.describe(Types.list(Types.INT)), is("int list"));
    assertThat(shapes.ofString(Types.INT, "42"), isOk(42));
    assertThat(shapes.parse(Types.INT, "42"), is(42));
    assertThat(shapes.ofJson(POINT, "{\"x\": 1, \"y\": 2}"),
        isOk(new Fixtures.Point(1, 2)));
  }

  /** Prints a value, then reads the printed form back as JSON. */
  @Test
  void testPrintAndParse() {
    final Shapes shapes = Shapes.create();
    final Fixtures.Circle circle = new Fixtures.Circle(2.5);
    assertThat(shapes.print(SHAPE, circle), is("Circle (2.5)"));
    assertThat(shapes.describe(SHAPE),
        is("([ Circle of float | Square ] as shape)"));
    assertThat(shapes.ofString(SHAPE, "{\"Circle\": 2.5}"), isOk(circle));
  }

  @Test
  void testParseThrows() {
    final ShapeParseException e =
        assertThrows(ShapeParseException.class,
            () -> Shapes.create().parse(Types.BOOL, "yes"));
    assertThat(e.getMessage(), is("invalid bool: \"yes\""));
  }

  @Test
  void testProps() {
    final Shapes narrow =
        Shapes.create(
            ImmutableMap.<Prop, Object>of(
                Prop.LINE_WIDTH, 12, Prop.STRICT_FIELDS, false));
    assertThat(narrow.props().get(Prop.LINE_WIDTH), is(12));
    final List<Integer> list = ImmutableList.of(100, 200, 300, 400);
    assertThat(narrow.print(Types.list(Types.INT), list),
        is("[100; 200;\n 300; 400]"));
    assertThat(narrow.ofJson(POINT, "{\"x\": 1, \"y\": 2, \"z\": 0}"),
        isOk(new Fixtures.Point(1, 2)));
    assertThat(Shapes.create().ofJson(POINT, "{\"x\": 1, \"y\": 2, \"z\": 0}"),
        isError("unknown field 'z'"));
  }

  @Test
  void testUnboundVariable() {
    final RuntimeException e =
        assertThrows(RuntimeException.class,
            () -> Shapes.create().print(Types.<String>var("'a"), "x"));
    assertThat(e.getMessage(), containsString("'a"));
  }
}

// End ShapesTest.java
