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

import com.google.common.base.CharMatcher;
import com.google.common.collect.ImmutableMap;
import java.math.BigDecimal;
import java.math.MathContext;

/** Utilities for printing and parsing primitive values. */
public final class Parsers {
  private Parsers() {}

  private static final CharMatcher DIGITS = CharMatcher.inRange('0', '9');

  /** Names of special floating-point values, and the values they denote. */
  private static final ImmutableMap<String, Double> FLOAT_NAMES =
      ImmutableMap.<String, Double>builder()
          .put("infinity", Double.POSITIVE_INFINITY)
          .put("+infinity", Double.POSITIVE_INFINITY)
          .put("inf", Double.POSITIVE_INFINITY)
          .put("neg_infinity", Double.NEGATIVE_INFINITY)
          .put("-infinity", Double.NEGATIVE_INFINITY)
          .put("-inf", Double.NEGATIVE_INFINITY)
          .put("nan", Double.NaN)
          .build();

  /**
   * Converts a character to the form in which it appears in a quoted string.
   *
   * <p>For example, {@code charToString('a')} returns "a". Character 9
   * becomes {@code "\t"}. Other control characters become a backslash and
   * three decimal digits; character 0 becomes {@code "\000"}.
   */
  public static String charToString(char c) {
    switch (c) {
      case '\b':
        return "\\b";
      case '\t':
        return "\\t";
      case '\n':
        return "\\n";
      case '\r':
        return "\\r";
      case '"':
        return "\\\"";
      case '\\':
        return "\\\\";
      default:
        if (c < 32 || c == 127) {
          return decimalEscape(c);
        }
        return String.valueOf(c);
    }
  }

  private static String decimalEscape(int c) {
    return String.format("\\%03d", c);
  }

  /** Appends a string in double quotes, escaping where necessary. */
  public static StringBuilder appendQuoted(StringBuilder buf, String s) {
    buf.append('"');
    for (int i = 0; i < s.length(); i++) {
      buf.append(charToString(s.charAt(i)));
    }
    return buf.append('"');
  }

  /**
   * Appends a byte sequence in double quotes, as if it were a string of
   * ISO-8859-1 characters; bytes outside the printable ASCII range are
   * escaped.
   */
  public static StringBuilder appendQuoted(StringBuilder buf, byte[] bytes) {
    buf.append('"');
    for (byte b : bytes) {
      final int c = b & 0xff;
      if (c >= 128) {
        buf.append(decimalEscape(c));
      } else {
        buf.append(charToString((char) c));
      }
    }
    return buf.append('"');
  }

  /**
   * Converts a {@code double} to a string.
   *
   * <p>Infinities become "infinity" and "neg_infinity", not-a-number becomes
   * "nan". A finite value is written with the fewest significant digits
   * that read back to the same value, laid out as {@link
   * Double#toString(double)} lays out its output: "{@code 0.1}", "{@code
   * 3.0}", "{@code 1.0E23}".
   */
  public static String floatToString(double d) {
    if (d == Double.POSITIVE_INFINITY) {
      return "infinity";
    } else if (d == Double.NEGATIVE_INFINITY) {
      return "neg_infinity";
    } else if (Double.isNaN(d)) {
      return "nan";
    } else if (d == 0d) {
      return Double.toString(d);
    }
    for (int precision = 1; precision < 17; precision++) {
      final BigDecimal decimal =
          new BigDecimal(d).round(new MathContext(precision));
      if (decimal.doubleValue() == d) {
        return decimalToString(decimal.stripTrailingZeros(), d);
      }
    }
    return decimalToString(
        new BigDecimal(d).round(new MathContext(17)).stripTrailingZeros(), d);
  }

  /**
   * Writes a decimal in plain notation if its magnitude is in [10<sup>-3</sup>,
   * 10<sup>7</sup>), otherwise in scientific notation; either way with at
   * least one digit after the point.
   */
  private static String decimalToString(BigDecimal decimal, double d) {
    final double abs = Math.abs(d);
    if (abs >= 1e-3 && abs < 1e7) {
      final String s = decimal.toPlainString();
      return s.indexOf('.') < 0 ? s + ".0" : s;
    }
    final String digits = decimal.unscaledValue().abs().toString();
    final int exponent = digits.length() - 1 - decimal.scale();
    final StringBuilder buf = new StringBuilder();
    if (decimal.signum() < 0) {
      buf.append('-');
    }
    buf.append(digits.charAt(0)).append('.');
    if (digits.length() > 1) {
      buf.append(digits, 1, digits.length());
    } else {
      buf.append('0');
    }
    return buf.append('E').append(exponent).toString();
  }

  /**
   * Parses an {@code int} written as an optional sign and ASCII decimal
   * digits.
   *
   * @throws NumberFormatException if {@code s} is not of that form or out of
   *     range
   */
  public static int parseInt(String s) {
    return Integer.parseInt(checkDecimal(s));
  }

  /**
   * Parses a {@code long} written as an optional sign and ASCII decimal
   * digits.
   *
   * @throws NumberFormatException if {@code s} is not of that form or out of
   *     range
   */
  public static long parseLong(String s) {
    return Long.parseLong(checkDecimal(s));
  }

  /** Throws unless a string is an optional sign followed by ASCII digits. */
  private static String checkDecimal(String s) {
    final int start = s.startsWith("-") || s.startsWith("+") ? 1 : 0;
    if (s.length() == start || !DIGITS.matchesAllOf(s.substring(start))) {
      throw new NumberFormatException("For input string: \"" + s + "\"");
    }
    return s;
  }

  /**
   * Parses a {@code double}. Accepts the output of {@link #floatToString}
   * and the usual decimal forms.
   *
   * @throws NumberFormatException if {@code s} is not a valid number
   */
  public static double parseFloat(String s) {
    final Double named = FLOAT_NAMES.get(s);
    if (named != null) {
      return named;
    }
    if (s.isEmpty()
        || Character.isWhitespace(s.charAt(0))
        || !isDigitOrPoint(s.charAt(s.length() - 1))
            && !s.endsWith("Infinity")
            && !s.endsWith("NaN")) {
      // Double.parseDouble would trim spaces and allow suffixes such as "d".
      throw new NumberFormatException("For input string: \"" + s + "\"");
    }
    return Double.parseDouble(s);
  }

  private static boolean isDigitOrPoint(char c) {
    return c >= '0' && c <= '9' || c == '.';
  }

  /**
   * Parses a boolean; unlike {@link Boolean#parseBoolean(String)}, accepts
   * only "true" and "false".
   *
   * @throws IllegalArgumentException if {@code s} is neither
   */
  public static boolean parseBool(String s) {
    switch (s) {
      case "true":
        return true;
      case "false":
        return false;
      default:
        throw new IllegalArgumentException("not a boolean: " + s);
    }
  }

  /**
   * Converts a string to bytes, one byte per character.
   *
   * @throws IllegalArgumentException if a character is above 255
   */
  public static byte[] latin1Bytes(String s) {
    final byte[] bytes = new byte[s.length()];
    for (int i = 0; i < s.length(); i++) {
      final char c = s.charAt(i);
      if (c > 255) {
        throw new IllegalArgumentException(
            "character " + (int) c + " at " + i + " is not a byte");
      }
      bytes[i] = (byte) c;
    }
    return bytes;
  }

  /** Returns a string in double quotes, for use in error messages. */
  public static String quote(String s) {
    return appendQuoted(new StringBuilder(), requireNonNull(s)).toString();
  }
}

// End Parsers.java
