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
 * Primitive type.
 *
 * <p>Instances are created in {@link Types}, which fixes the correspondence
 * between each {@link Prim} and its Java value class.
 */
public class PrimType<A> extends BaseType<A> {
  public final Prim prim;
  public final Len len;

  PrimType(Prim prim, Len len) {
    super(Op.PRIM);
    this.prim = requireNonNull(prim);
    this.len = requireNonNull(len);
    checkArgument(
        prim.isSized() || len == Len.DEFAULT,
        "primitive %s has no length",
        prim);
  }
}

// End PrimType.java
