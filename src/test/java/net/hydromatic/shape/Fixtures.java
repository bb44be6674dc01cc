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

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import net.hydromatic.shape.parse.Result;
import net.hydromatic.shape.type.Case;
import net.hydromatic.shape.type.CustomType;
import net.hydromatic.shape.type.MapType;
import net.hydromatic.shape.type.RecordType;
import net.hydromatic.shape.type.SelfType;
import net.hydromatic.shape.type.Type;
import net.hydromatic.shape.type.Types;
import net.hydromatic.shape.type.VariantType;
import net.hydromatic.shape.util.Pair;
import net.hydromatic.shape.util.Triple;

/** Types and values used in tests. */
public abstract class Fixtures {
  private Fixtures() {}

  /** Record "point" with integer fields "x" and "y". */
  public static final RecordType<Point> POINT =
      Types.<Point>record(
              "point",
              args -> new Point((Integer) args.get(0), (Integer) args.get(1)))
          .field("x", Types.INT, p -> p.x)
          .field("y", Types.INT, p -> p.y)
          .build();

  /** Record "person" with string, option and list fields. */
  public static final RecordType<Person> PERSON =
      Types.<Person>record("person", Fixtures::person)
          .field("name", Types.STRING, p -> p.name)
          .field("age", Types.option(Types.INT), p -> p.age)
          .field("tags", Types.list(Types.STRING), p -> p.tags)
          .build();

  /** Variant "shape" with cases "circle of float" and "square". */
  public static final VariantType<Shape> SHAPE = shapeType();

  /** Recursive variant "tree": leaf, or node of tree * int * tree. */
  public static final SelfType<Tree> TREE = Types.mu(Fixtures::treeBody);

  /**
   * Recursive type without a name: a chain is an optional pair of an integer
   * and another chain.
   */
  public static final SelfType<Chain> CHAIN =
      Types.mu(
          self ->
              Types.map(
                  Types.option(Types.pair(Types.INT, self)),
                  Chain::new,
                  c -> c.next));

  /** Recursive record "node" with a value and an optional next node. */
  public static final SelfType<Node> NODE =
      Types.mu(
          self ->
              Types.<Node>record(
                      "node",
                      args -> node((Integer) args.get(0), args.get(1)))
                  .field("value", Types.INT, n -> n.value)
                  .field("next", Types.option(self), n -> n.next)
                  .build());

  /** Enum mapped to its name. */
  public static final MapType<Color, String> COLOR =
      Types.map(Types.STRING, Color::valueOf, Color::name);

  /** Integer printed and parsed in hexadecimal, e.g. "0xff". */
  public static final CustomType<Integer> HEX =
      Types.custom(
          i -> "0x" + Integer.toHexString(i), Fixtures::parseHex, Types.INT);

  /** As {@link #HEX} but without an underlying type. */
  public static final CustomType<Integer> OPAQUE_HEX =
      Types.custom(i -> "0x" + Integer.toHexString(i), Fixtures::parseHex);

  private static Result<Integer> parseHex(String s) {
    if (!s.startsWith("0x")) {
      return Result.error("invalid hex: " + s);
    }
    try {
      return Result.ok(Integer.parseInt(s.substring(2), 16));
    } catch (NumberFormatException e) {
      return Result.error("invalid hex: " + s);
    }
  }

  @SuppressWarnings("unchecked")
  private static Person person(List<Object> args) {
    return new Person(
        (String) args.get(0),
        (Optional<Integer>) args.get(1),
        (List<String>) args.get(2));
  }

  @SuppressWarnings("unchecked")
  private static Node node(int value, Object next) {
    return new Node(value, (Optional<Node>) next);
  }

  private static VariantType<Shape> shapeType() {
    final VariantType.Builder<Shape> b = Types.variant("shape");
    final Case.Unary<Shape, Double> circle =
        b.case1("circle", Types.FLOAT, Circle::new);
    final Case.Nullary<Shape> square = b.case0("square", Square.INSTANCE);
    return b.build(
        s ->
            s instanceof Circle
                ? circle.tag(((Circle) s).radius)
                : square.tag());
  }

  private static Type<Tree> treeBody(Type<Tree> self) {
    final VariantType.Builder<Tree> b = Types.variant("tree");
    final Case.Nullary<Tree> leaf = b.case0("leaf", Leaf.INSTANCE);
    final Case.Unary<Tree, Triple<Tree, Integer, Tree>> node =
        b.case1(
            "node",
            Types.triple(self, Types.INT, self),
            t -> new Branch(t.first, t.second, t.third));
    return b.build(
        t -> {
          if (t instanceof Branch) {
            final Branch branch = (Branch) t;
            return node.tag(
                Triple.of(branch.left, branch.value, branch.right));
          }
          return leaf.tag();
        });
  }

  /** Creates a chain of integers. */
  public static Chain chain(int... values) {
    Chain chain = new Chain(Optional.empty());
    for (int i = values.length - 1; i >= 0; i--) {
      chain = new Chain(Optional.of(Pair.of(values[i], chain)));
    }
    return chain;
  }

  /** Point. */
  public static class Point {
    public final int x;
    public final int y;

    public Point(int x, int y) {
      this.x = x;
      this.y = y;
    }

    @Override
    public int hashCode() {
      return Objects.hash(x, y);
    }

    @Override
    public boolean equals(Object obj) {
      return obj == this
          || obj instanceof Point
              && x == ((Point) obj).x
              && y == ((Point) obj).y;
    }

    @Override
    public String toString() {
      return "Point(" + x + ", " + y + ")";
    }
  }

  /** Person. */
  public static class Person {
    public final String name;
    public final Optional<Integer> age;
    public final List<String> tags;

    public Person(String name, Optional<Integer> age, List<String> tags) {
      this.name = requireNonNull(name);
      this.age = requireNonNull(age);
      this.tags = requireNonNull(tags);
    }

    @Override
    public int hashCode() {
      return Objects.hash(name, age, tags);
    }

    @Override
    public boolean equals(Object obj) {
      return obj == this
          || obj instanceof Person
              && name.equals(((Person) obj).name)
              && age.equals(((Person) obj).age)
              && tags.equals(((Person) obj).tags);
    }

    @Override
    public String toString() {
      return "Person(" + name + ", " + age + ", " + tags + ")";
    }
  }

  /** Shape. */
  public abstract static class Shape {}

  /** Circle. */
  public static class Circle extends Shape {
    public final double radius;

    public Circle(double radius) {
      this.radius = radius;
    }

    @Override
    public int hashCode() {
      return Double.hashCode(radius);
    }

    @Override
    public boolean equals(Object obj) {
      return obj == this
          || obj instanceof Circle
              && Double.compare(radius, ((Circle) obj).radius) == 0;
    }

    @Override
    public String toString() {
      return "Circle(" + radius + ")";
    }
  }

  /** Square. */
  public static class Square extends Shape {
    public static final Square INSTANCE = new Square();

    private Square() {}

    @Override
    public String toString() {
      return "Square";
    }
  }

  /** Binary tree. */
  public abstract static class Tree {}

  /** Empty tree. */
  public static class Leaf extends Tree {
    public static final Leaf INSTANCE = new Leaf();

    private Leaf() {}

    @Override
    public String toString() {
      return "Leaf";
    }
  }

  /** Tree with a value and two children. */
  public static class Branch extends Tree {
    public final Tree left;
    public final int value;
    public final Tree right;

    public Branch(Tree left, int value, Tree right) {
      this.left = requireNonNull(left);
      this.value = value;
      this.right = requireNonNull(right);
    }

    @Override
    public int hashCode() {
      return Objects.hash(left, value, right);
    }

    @Override
    public boolean equals(Object obj) {
      return obj == this
          || obj instanceof Branch
              && left.equals(((Branch) obj).left)
              && value == ((Branch) obj).value
              && right.equals(((Branch) obj).right);
    }

    @Override
    public String toString() {
      return "Branch(" + left + ", " + value + ", " + right + ")";
    }
  }

  /** Chain of integers. */
  public static class Chain {
    public final Optional<Pair<Integer, Chain>> next;

    public Chain(Optional<Pair<Integer, Chain>> next) {
      this.next = requireNonNull(next);
    }

    @Override
    public int hashCode() {
      return next.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
      return obj == this
          || obj instanceof Chain && next.equals(((Chain) obj).next);
    }

    @Override
    public String toString() {
      return "Chain" + next;
    }
  }

  /** Linked list node. */
  public static class Node {
    public final int value;
    public final Optional<Node> next;

    public Node(int value, Optional<Node> next) {
      this.value = value;
      this.next = requireNonNull(next);
    }
  }

  /** Color. */
  public enum Color {
    RED,
    GREEN,
    BLUE
  }
}

// End Fixtures.java
