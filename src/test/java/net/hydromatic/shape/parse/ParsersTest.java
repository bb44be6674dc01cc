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

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

/** Tests {@link Parsers}. */
public class ParsersTest {
  @Test
  void testCharToString() {
    assertThat(Parsers.charToString('a'), is("a"));
    assertThat(Parsers.charToString('\t'), is("\\t"));
    assertThat(Parsers.charToString('\b'), is("\\b"));
    assertThat(Parsers.charToString('"'), is("\\\""));
    assertThat(Parsers.charToString('\\'), is("\\\\"));
    assertThat(Parsers.charToString('\u0000'), is("\\000"));
    assertThat(Parsers.charToString('\u001f'), is("\\031"));
    assertThat(Parsers.charToString('\u007f'), is("\\127"));
    assertThat(Parsers.charToString('\''), is("'"));
    assertThat(Parsers.charToString('\u00e9'), is("\u00e9"));
  }

  @Test
  void testQuote() {
    assertThat(Parsers.quote("a\nb"), is("\"a\\nb\""));
    final StringBuilder buf = new StringBuilder();
    Parsers.appendQuoted(buf, new byte[] {'a', (byte) 0x80, 0x7f});
    assertThat(buf.toString(), is("\"a\\128\\127\""));
  }

  @Test
  void testFloat() {
    assertThat(Parsers.floatToString(-0d), is("-0.0"));
    assertThat(Parsers.floatToString(1e-7), is("1.0E-7"));
    assertThat(Parsers.floatToString(1e23), is("1.0E23"));
    assertThat(Parsers.floatToString(2e-3), is("0.002"));
    assertThat(Parsers.floatToString(9999999d), is("9999999.0"));
    assertThat(Parsers.floatToString(1e7), is("1.0E7"));
    assertThat(Parsers.floatToString(Double.MIN_VALUE), is("5.0E-324"));
    assertThat(Parsers.floatToString(Double.MAX_VALUE),
        is("1.7976931348623157E308"));
    assertThat(Parsers.parseFloat("1.0E-7"), is(1e-7));
    assertThat(Parsers.parseFloat(".5"), is(0.5));
    assertThat(Parsers.parseFloat("5."), is(5d));
    assertThat(Parsers.parseFloat("Infinity"), is(Double.POSITIVE_INFINITY));
    assertThrows(NumberFormatException.class, () -> Parsers.parseFloat(""));
    assertThrows(NumberFormatException.class, () -> Parsers.parseFloat("1 "));
    assertThrows(NumberFormatException.class, () -> Parsers.parseFloat("1f"));
  }

  @Test
  void testParseInt() {
    assertThat(Parsers.parseInt("0"), is(0));
    assertThat(Parsers.parseInt("+12"), is(12));
    assertThat(Parsers.parseInt("-2147483648"), is(Integer.MIN_VALUE));
    assertThat(Parsers.parseLong("-9223372036854775808"), is(Long.MIN_VALUE));
    assertThrows(NumberFormatException.class, () -> Parsers.parseInt(""));
    assertThrows(NumberFormatException.class, () -> Parsers.parseInt("+-1"));
    assertThrows(NumberFormatException.class,
        () -> Parsers.parseInt("\u0664\u0662"));
    assertThrows(NumberFormatException.class,
        () -> Parsers.parseLong("\uff17"));
  }

  @Test
  void testLatin1Bytes() {
    assertThat(Parsers.latin1Bytes("a\u00ff"), is(new byte[] {'a', -1}));
    assertThrows(IllegalArgumentException.class,
        () -> Parsers.latin1Bytes("\u20ac"));
  }
}

// End ParsersTest.java
