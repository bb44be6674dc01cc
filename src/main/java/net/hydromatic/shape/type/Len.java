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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * Length hint of a string, bytes, list or array type.
 *
 * <p>The hint says how a binary encoding would write the length: as a prefix
 * of a given width, or not at all because the length is fixed. Printers and
 * parsers in this library do not enforce it; it only shows in type syntax.
 */
public final class Len {
  /** No constraint; the default. */
  public static final Len DEFAULT = new Len(Kind.DEFAULT, -1);

  public static final Len INT8 = new Len(Kind.INT8, -1);
  public static final Len INT16 = new Len(Kind.INT16, -1);
  public static final Len INT32 = new Len(Kind.INT32, -1);
  public static final Len INT64 = new Len(Kind.INT64, -1);

  public final Kind kind;

  /** Length if {@link #kind} is {@link Kind#FIXED}, otherwise -1. */
  public final int fixed;

  private Len(Kind kind, int fixed) {
    this.kind = requireNonNull(kind);
    this.fixed = fixed;
  }

  /** Returns a hint that values have exactly {@code n} elements. */
  public static Len fixed(int n) {
    checkArgument(n >= 0, "negative fixed length %s", n);
    return new Len(Kind.FIXED, n);
  }

  /** Appends the suffix in type syntax, e.g. "{@code :16}". */
  public StringBuilder describe(StringBuilder buf) {
    switch (kind) {
      case DEFAULT:
        return buf;
      case INT8:
        return buf.append(":8");
      case INT16:
        return buf.append(":16");
      case INT32:
        return buf.append(":32");
      case INT64:
        return buf.append(":64");
      case FIXED:
        return buf.append(":<").append(fixed).append('>');
      default:
        throw new AssertionError(kind);
    }
  }

  @Override
  public int hashCode() {
    return kind.hashCode() * 31 + fixed;
  }

  @Override
  public boolean equals(Object obj) {
    return obj == this
        || obj instanceof Len
            && kind == ((Len) obj).kind
            && fixed == ((Len) obj).fixed;
  }

  @Override
  public String toString() {
    return kind == Kind.DEFAULT
        ? "default"
        : describe(new StringBuilder()).toString();
  }

  /** Kind of length hint. */
  public enum Kind {
    DEFAULT,
    INT8,
    INT16,
    INT32,
    INT64,
    FIXED
  }
}

// End Len.java
