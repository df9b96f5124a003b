// =================================================================================================
// Copyright 2011 Twitter, Inc.
// -------------------------------------------------------------------------------------------------
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this work except in compliance with the License.
// You may obtain a copy of the License in the LICENSE file, or at:
//
//  http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
// =================================================================================================

package com.natu.format;

import com.google.common.collect.ImmutableMap;

import org.junit.Test;

import com.natu.quantity.ExponentVector;

import static org.junit.Assert.assertEquals;

public class UnitStyleTest {

  private static final ExponentVector ENERGY = ExponentVector.parse("kg*m2/s2");
  private static final ExponentVector ROOT_METER = ExponentVector.parse("m(1/2)");

  @Test
  public void testEnergyInEveryStyle() {
    assertEquals("m2*kg/s2", UnitStyle.PLAIN.format(ENERGY));
    assertEquals("m<sup>2</sup>&nbsp;s<sup>-2</sup>&nbsp;kg", UnitStyle.HTML.format(ENERGY));
    assertEquals("\\mathrm{m}^2\\,\\mathrm{s}^{-2}\\,\\mathrm{kg}",
        UnitStyle.LATEX.format(ENERGY));
    assertEquals("m2.kg/s2", UnitStyle.MODELICA.format(ENERGY));
    assertEquals("m² s⁻² kg", UnitStyle.UNICODE.format(ENERGY));
    assertEquals("m**2 * kg / s**2", UnitStyle.VERBOSE.format(ENERGY));
  }

  @Test
  public void testFractionalExponents() {
    assertEquals("m(1/2)", UnitStyle.PLAIN.format(ROOT_METER));
    assertEquals("m<sup>1/2</sup>", UnitStyle.HTML.format(ROOT_METER));
    assertEquals("\\mathrm{m}^{1/2}", UnitStyle.LATEX.format(ROOT_METER));
    assertEquals("m^(1/2)", UnitStyle.UNICODE.format(ROOT_METER));
    assertEquals("m**(1/2)", UnitStyle.VERBOSE.format(ROOT_METER));
  }

  @Test
  public void testDenominators() {
    assertEquals("1/s", UnitStyle.PLAIN.format(ExponentVector.of("s", -1)));
    assertEquals("m/(A*s)", UnitStyle.PLAIN.format(ExponentVector.parse("m/(s*A)")));
    assertEquals("m / (A * s)", UnitStyle.VERBOSE.format(ExponentVector.parse("m/(s*A)")));
    assertEquals("s⁻¹", UnitStyle.UNICODE.format(ExponentVector.of("s", -1)));
  }

  @Test
  public void testEmptyVector() {
    for (UnitStyle style : UnitStyle.values()) {
      assertEquals("", style.format(ExponentVector.EMPTY));
    }
  }

  @Test
  public void testReplacementsAreUsedVerbatim() {
    ImmutableMap<String, String> replacements = ImmutableMap.of("ohm", "\\Omega");
    assertEquals("\\Omega", UnitStyle.LATEX.format(ExponentVector.of("ohm"), replacements));
    assertEquals("\\Omega^2\\,\\mathrm{A}",
        UnitStyle.LATEX.format(ExponentVector.parse("ohm2*A"), replacements));
  }

  @Test
  public void testSeparators() {
    assertEquals(" ", UnitStyle.PLAIN.separator());
    assertEquals("&nbsp;", UnitStyle.HTML.separator());
    assertEquals("\\,", UnitStyle.LATEX.separator());
  }

  @Test
  public void testTrimExponent() {
    assertEquals("5", UnitStyle.trimExponent("+05"));
    assertEquals("-7", UnitStyle.trimExponent("-07"));
    assertEquals("0", UnitStyle.trimExponent("+00"));
    assertEquals("12", UnitStyle.trimExponent("12"));
  }

  @Test
  public void testScientificNotation() {
    assertEquals("1.5", UnitStyle.HTML.formatNumber("1.5"));
    assertEquals("1.5&times;10<sup>-7</sup>", UnitStyle.HTML.formatNumber("1.5E-07"));
    assertEquals("2.0 \\times 10^{30}", UnitStyle.LATEX.formatNumber("2.0e+30"));
    assertEquals("1.5×10⁻⁷", UnitStyle.UNICODE.formatNumber("1.5E-07"));
    assertEquals("1.5E-07", UnitStyle.PLAIN.formatNumber("1.5E-07"));
    assertEquals("6.0 (-2) ", UnitStyle.rewriteScientific("6.0e-2", " (", ") "));
  }
}
