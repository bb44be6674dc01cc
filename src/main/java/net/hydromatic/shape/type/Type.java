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

/**
 * Describes the shape of values of type {@code A}.
 *
 * <p>A type and a value travel together, both parameterized by {@code A}, so
 * that a printer or parser can never pair a record value with a list type.
 *
 * <p>The set of implementations is closed: one class per {@link Op}. Types are
 * immutable once built (see {@link Types}) and may be shared between threads.
 * The only cycles go through {@link SelfType}.
 *
 * @param <A> Java type of the values described
 */
public interface Type<A> {
  /** Returns the kind of this type. */
  Op op();
}

// End Type.java
