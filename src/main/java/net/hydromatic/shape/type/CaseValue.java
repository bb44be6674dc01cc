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

import static java.util.Objects.requireNonNull;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The active case of a variant value, and its payload.
 *
 * <p>Created by {@link Case.Nullary#tag()} and {@link Case.Unary#tag(Object)},
 * which ensure that the payload, if any, has the type the case declares.
 */
public final class CaseValue<V> {
  public final Case<V> variantCase;

  /** Payload; null if and only if the case is {@link Case.Nullary}. */
  public final @Nullable Object payload;

  CaseValue(Case<V> variantCase, @Nullable Object payload) {
    this.variantCase = requireNonNull(variantCase);
    this.payload = payload;
  }

  @Override
  public String toString() {
    return payload == null
        ? variantCase.name
        : variantCase.name + " " + payload;
  }
}

// End CaseValue.java
