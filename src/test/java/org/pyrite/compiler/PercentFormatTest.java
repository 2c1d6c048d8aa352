/*
 * Copyright 2025 The Pyrite Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.pyrite.compiler;

import static com.google.common.truth.Truth.assertThat;

import java.util.Arrays;
import java.util.List;
import junitparams.JUnitParamsRunner;
import junitparams.Parameters;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.pyrite.code.Constants;
import org.pyrite.compiler.PercentFormat.Literal;
import org.pyrite.compiler.PercentFormat.Spec;

@RunWith(JUnitParamsRunner.class)
public class PercentFormatTest {

  /** Returns the tuple constant with the given elements. */
  private static Object tuple(Object... elements) {
    return Constants.of(Arrays.asList(elements));
  }

  private static String format(String format, Object value) {
    return PercentFormat.format(format, Constants.of(value));
  }

  @Test
  public void parse() {
    assertThat(PercentFormat.parse("")).isEmpty();
    assertThat(PercentFormat.parse("a%%b")).containsExactly(new Literal("a%b"));
    assertThat(PercentFormat.parse("x=%-05.3d!"))
        .containsExactly(new Literal("x="), new Spec(null, "-0", 5, 3, 'd'), new Literal("!"))
        .inOrder();
    assertThat(PercentFormat.parse("%(key)s%ld%.f"))
        .containsExactly(
            new Spec("key", "", -1, -1, 's'),
            new Spec(null, "", -1, -1, 'd'),
            new Spec(null, "", -1, 0, 'f'))
        .inOrder();
    assertThat(PercentFormat.parse("%5%")).containsExactly(new Spec(null, "", 5, -1, '%'));
  }

  @Test
  @Parameters({"foo%", "%*d", "%Z", "%(key", "%5", "%.", "%1234567890d"})
  public void invalidFormats(String format) {
    assertThat(PercentFormat.parse(format)).isNull();
    assertThat(format(format, tuple())).isNull();
  }

  @Test
  public void strings() {
    assertThat(format("%s %% foo %r bar %a %s", tuple(1, "baz", 3, 4)))
        .isEqualTo("1 % foo 'baz' bar 3 4");
    assertThat(format("foo", tuple())).isEqualTo("foo");
    assertThat(format("%7s", tuple(4231))).isEqualTo("   4231");
    assertThat(format("%-5s|", "ab")).isEqualTo("ab   |");
    assertThat(format("%05s", "ab")).isEqualTo("   ab");
    assertThat(format("%.2s", "abc")).isEqualTo("ab");
    assertThat(format("%s", Constants.NONE)).isEqualTo("None");
    assertThat(format("%r", 1.0)).isEqualTo("1.0");
    assertThat(format("%s", tuple(tuple(1, 2)))).isEqualTo("(1, 2)");
    assertThat(format("%a", "ሴ")).isEqualTo("'\\u1234'");
    assertThat(format("%c%c", tuple(65, "b"))).isEqualTo("Ab");
    assertThat(format("%5%", tuple())).isEqualTo("%");
  }

  @Test
  public void integers() {
    assertThat(format("%05d", -42)).isEqualTo("-0042");
    assertThat(format("%-6d|", 42)).isEqualTo("42    |");
    assertThat(format("%+d % d", tuple(5, 5))).isEqualTo("+5  5");
    assertThat(format("%+.3d", 7)).isEqualTo("+007");
    assertThat(format("%d %i %u", tuple(3.9, -3.9, true))).isEqualTo("3 -3 1");
    assertThat(format("%5o", -93)).isEqualTo(" -135");
    assertThat(format("%04x", -11)).isEqualTo("-00b");
    assertThat(format("%04X", 51966)).isEqualTo("CAFE");
    assertThat(format("%#x %#o", tuple(255, 8))).isEqualTo("0xff 0o10");
    assertThat(format("%x", true)).isEqualTo("1");
  }

  @Test
  public void floats() {
    assertThat(format("%f", 1.5)).isEqualTo("1.500000");
    assertThat(format("%.3f", 2)).isEqualTo("2.000");
    assertThat(format("%5.1f", 3.14159)).isEqualTo("  3.1");
    assertThat(format("%f", -0.0)).isEqualTo("-0.000000");
    assertThat(format("%e", 12345.678)).isEqualTo("1.234568e+04");
    assertThat(format("%.2E", 0.000123)).isEqualTo("1.23E-04");
    assertThat(format("%e", 0.0)).isEqualTo("0.000000e+00");
    assertThat(format("%.0e", 100.0)).isEqualTo("1e+02");
    assertThat(format("%f", Double.POSITIVE_INFINITY)).isEqualTo("inf");
    assertThat(format("%05F", Double.NEGATIVE_INFINITY)).isEqualTo(" -INF");
  }

  @Test
  public void errors() {
    // Wrong number of arguments
    assertThat(format("%s", tuple(1, 2))).isNull();
    assertThat(format("%s %s", tuple(1))).isNull();
    assertThat(format("foo", "bar")).isNull();
    // Wrong types
    assertThat(format("%d", "1")).isNull();
    assertThat(format("%x", 1.5)).isNull();
    assertThat(format("%f", "1")).isNull();
    assertThat(format("%c", "ab")).isNull();
    assertThat(format("%c", -1)).isNull();
    // Not implemented
    assertThat(format("%(a)s", 1)).isNull();
    assertThat(format("%g", 1.5)).isNull();
  }

  @Test
  public void convert() {
    Spec spec = new Spec(null, "0", 6, -1, 'x');
    assertThat(PercentFormat.convert(spec, Constants.of(255))).isEqualTo("0000ff");
    assertThat(PercentFormat.convert(spec, "ff")).isNull();
    List<Object> values = Arrays.asList(Constants.of(1), 2.5, "x", true);
    Spec repr = new Spec(null, "", 4, -1, 'r');
    assertThat(values.stream().map(v -> PercentFormat.convert(repr, v)).toList())
        .containsExactly("   1", " 2.5", " 'x'", "True")
        .inOrder();
  }
}
