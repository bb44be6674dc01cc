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

import java.util.function.Function;

/**
 * Field of a {@link RecordType}.
 *
 * @param <R> record type
 * @param <F> field type
 */
public class Field<R, F> {
  public final String name;
  public final Type<F> type;
  private final Function<? super R, ? extends F> accessor;

  Field(String name, Type<F> type, Function<? super R, ? extends F> accessor) {
    this.name = requireNonNull(name);
    this.type = requireNonNull(type);
    this.accessor = requireNonNull(accessor);
  }

  /** Returns the value of this field in a record. */
  public F get(R record) {
    return accessor.apply(record);
  }

  @Override
  public String toString() {
    return name + " : " + type;
  }
}

// End Field.java
