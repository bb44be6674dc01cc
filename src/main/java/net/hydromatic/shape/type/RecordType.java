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

import com.google.common.collect.ImmutableList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The type of a record value.
 *
 * <p>Fields are kept in the order they were declared; printers and parsers
 * visit them in that order.
 */
public class RecordType<R> extends BaseType<R> {
  public final String name;
  public final ImmutableList<Field<R, ?>> fields;
  private final Function<List<Object>, R> constructor;

  RecordType(
      String name,
      ImmutableList<Field<R, ?>> fields,
      Function<List<Object>, R> constructor) {
    super(Op.RECORD);
    this.name = requireNonNull(name);
    this.fields = requireNonNull(fields);
    this.constructor = requireNonNull(constructor);
  }

  /** Returns the field with a given name, or null. */
  public @Nullable Field<R, ?> field(String fieldName) {
    for (Field<R, ?> field : fields) {
      if (field.name.equals(fieldName)) {
        return field;
      }
    }
    return null;
  }

  /**
   * Creates a record from the values of its fields, in declaration order.
   */
  public R construct(List<Object> values) {
    checkArgument(
        values.size() == fields.size(),
        "record %s has %s fields, got %s values",
        name,
        fields.size(),
        values.size());
    return requireNonNull(constructor.apply(values), "constructor");
  }

  /** Builds a {@link RecordType}; see {@link Types#record}. */
  public static class Builder<R> {
    private final String name;
    private final Function<List<Object>, R> constructor;
    private final ImmutableList.Builder<Field<R, ?>> fields =
        ImmutableList.builder();
    private final Set<String> names = new HashSet<>();

    Builder(String name, Function<List<Object>, R> constructor) {
      this.name = requireNonNull(name);
      this.constructor = requireNonNull(constructor);
    }

    /** Adds a field. */
    public <F> Builder<R> field(
        String fieldName,
        Type<F> type,
        Function<? super R, ? extends F> accessor) {
      checkArgument(
          names.add(fieldName),
          "duplicate field '%s' in record %s",
          fieldName,
          name);
      fields.add(new Field<>(fieldName, type, accessor));
      return this;
    }

    public RecordType<R> build() {
      return new RecordType<>(name, fields.build(), constructor);
    }
  }
}

// End RecordType.java
