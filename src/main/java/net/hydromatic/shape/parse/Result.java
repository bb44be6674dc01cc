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
package net.hydromatic.shape.parse;

import static java.util.Objects.requireNonNull;

import java.util.Arrays;
import java.util.function.Function;

/**
 * Outcome of parsing: either a value or a failure message.
 *
 * <p>The message of a failure names the input that could not be parsed.
 * Failures pass unchanged through {@link #map} and {@link #flatMap}.
 *
 * @param <A> type of the value
 */
public abstract class Result<A> {
  private Result() {}

  /** Creates a successful result. */
  public static <A> Result<A> ok(A value) {
    return new Success<>(value);
  }

  /** Creates a failed result. */
  public static <A> Result<A> error(String message) {
    return new Failure<>(message);
  }

  /** Returns whether this result holds a value. */
  public abstract boolean isOk();

  /**
   * Returns the value.
   *
   * @throws ShapeParseException if this is a failure
   */
  public abstract A orElseThrow();

  /** Synonym for {@link #orElseThrow()}. */
  public A get() {
    return orElseThrow();
  }

  /**
   * Returns the failure message.
   *
   * @throws IllegalStateException if this result holds a value
   */
  public abstract String message();

  /** Applies a function to the value, if any. */
  public abstract <B> Result<B> map(Function<? super A, ? extends B> fn);

  /** Applies a function that may itself fail to the value, if any. */
  public abstract <B> Result<B> flatMap(Function<? super A, Result<B>> fn);

  /** Successful result. */
  private static class Success<A> extends Result<A> {
    private final A value;

    Success(A value) {
      this.value = requireNonNull(value);
    }

    @Override
    public boolean isOk() {
      return true;
    }

    @Override
    public A orElseThrow() {
      return value;
    }

    @Override
    public String message() {
      throw new IllegalStateException("not a failure: " + this);
    }

    @Override
    public <B> Result<B> map(Function<? super A, ? extends B> fn) {
      return ok(fn.apply(value));
    }

    @Override
    public <B> Result<B> flatMap(Function<? super A, Result<B>> fn) {
      return requireNonNull(fn.apply(value));
    }

    @Override
    public int hashCode() {
      return value instanceof byte[]
          ? Arrays.hashCode((byte[]) value)
          : value.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
      if (obj == this) {
        return true;
      }
      if (!(obj instanceof Success)) {
        return false;
      }
      final Object value2 = ((Success<?>) obj).value;
      return value instanceof byte[] && value2 instanceof byte[]
          ? Arrays.equals((byte[]) value, (byte[]) value2)
          : value.equals(value2);
    }

    @Override
    public String toString() {
      return "Ok(" + value + ")";
    }
  }

  /** Failed result. */
  private static class Failure<A> extends Result<A> {
    private final String message;

    Failure(String message) {
      this.message = requireNonNull(message);
    }

    @Override
    public boolean isOk() {
      return false;
    }

    @Override
    public A orElseThrow() {
      throw new ShapeParseException(message);
    }

    @Override
    public String message() {
      return message;
    }

    @Override
    public <B> Result<B> map(Function<? super A, ? extends B> fn) {
      return error(message);
    }

    @Override
    public <B> Result<B> flatMap(Function<? super A, Result<B>> fn) {
      return error(message);
    }

    @Override
    public int hashCode() {
      return message.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
      return obj == this
          || obj instanceof Failure
              && message.equals(((Failure<?>) obj).message);
    }

    @Override
    public String toString() {
      return "Error(" + message + ")";
    }
  }
}

// End Result.java
