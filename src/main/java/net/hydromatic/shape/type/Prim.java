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

import java.util.Locale;

/** Kind of primitive type. */
public enum Prim {
  UNIT,
  BOOL,
  CHAR,
  INT,
  INT32,
  INT64,
  FLOAT,
  STRING,
  BYTES;

  /** The name in type syntax, e.g. {@code bool}. */
  public final String moniker = name().toLowerCase(Locale.ROOT);

  /** Whether values of this kind have a length, and therefore a {@link Len}. */
  public boolean isSized() {
    return this == STRING || this == BYTES;
  }

  @Override
  public String toString() {
    return moniker;
  }
}

// End Prim.java
