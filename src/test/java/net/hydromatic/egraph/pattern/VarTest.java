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
package net.hydromatic.egraph.pattern;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.not;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.Matchers.lessThan;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

/** Tests {@link Var}. */
public class VarTest {
  @Test
  void testParse() {
    assertThat(Var.of("?x"), hasToString("?x"));
    assertThat(Var.of("?x"), is(Var.of("?x")));
    assertThat(Var.of("?x"), not(Var.of("?y")));
    assertThat(Var.of("?x").number(), is(-1));

    assertThat(Var.of("?#3"), hasToString("?#3"));
    assertThat(Var.of("?#3").number(), is(3));
    assertThat(Var.of("?#3"), is(Var.of(3)));
    assertThat(Var.of("?#0"), not(Var.of("?#1")));
  }

  @Test
  void testParseErrors() {
    IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class, () -> Var.of("x"));
    assertThat(
        e.getMessage(),
        is("pattern variable x should have a leading question mark"));

    e = assertThrows(IllegalArgumentException.class, () -> Var.of("?"));
    assertThat(
        e.getMessage(),
        is("pattern variable ? should have a leading question mark"));

    e = assertThrows(IllegalArgumentException.class, () -> Var.of("?#x"));
    assertThat(e.getMessage(), is("number pattern variable ?#x was malformed"));

    e = assertThrows(IllegalArgumentException.class, () -> Var.of("?#-1"));
    assertThat(
        e.getMessage(), is("number pattern variable ?#-1 was malformed"));

    assertThrows(IllegalArgumentException.class, () -> Var.of(-2));
  }

  /** Named variables sort before numbered variables. */
  @Test
  void testCompare() {
    assertThat(Var.of("?a").compareTo(Var.of("?b")), lessThan(0));
    assertThat(Var.of("?z").compareTo(Var.of(0)), lessThan(0));
    assertThat(Var.of(1).compareTo(Var.of(2)), lessThan(0));
    assertThat(Var.of(2).compareTo(Var.of(2)), is(0));
  }
}

// End VarTest.java
