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

package com.natu.units;

import java.util.Arrays;

import org.apache.commons.lang.math.Fraction;
import org.junit.Before;
import org.junit.Test;

import com.natu.quantity.BaseDimension;
import com.natu.quantity.ExponentVector;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

public class CoherentSimplifierTest {

  private static final ExponentVector ENERGY = ExponentVector.parse("M*L2/T2");

  private SymbolTable table;
  private CoherentSimplifier simplifier;

  @Before
  public void setUp() {
    SymbolTable.Builder builder = SymbolTable.builder();
    builder.define(new ScalarUnit("m", 1, ExponentVector.of("L"), true));
    builder.define(new ScalarUnit("ft", 0.3048, ExponentVector.of("L"), false));
    builder.define(new ScalarUnit("s", 1, ExponentVector.of("T"), true));
    builder.define(new ScalarUnit("kg", 1, ExponentVector.of("M"), false));
    builder.define(new ScalarUnit("A", 1, ExponentVector.of("I"), true));
    builder.define(new ScalarUnit("J", 1, ENERGY, true));
    builder.addCoherentRelation(ExponentVector.parse("kg*m2/(s2*J)"));
    builder.define(new ScalarUnit("N", 1, ExponentVector.parse("M*L/T2"), true));
    builder.addCoherentRelation(ExponentVector.parse("kg*m/(s2*N)"));
    builder.define(new ScalarUnit("W", 1, ExponentVector.parse("M*L2/T3"), true));
    builder.addCoherentRelation(ExponentVector.parse("J/(s*W)"));
    builder.define(new ScalarUnit("cal", 4.184, ENERGY, true));
    table = builder.build();
    simplifier = new CoherentSimplifier(table);
  }

  @Test
  public void testAnchorsAreTheEarliestBaseUnits() {
    assertEquals(table.get("m"), simplifier.getAnchors().get(BaseDimension.LENGTH));
    assertEquals(table.get("kg"), simplifier.getAnchors().get(BaseDimension.MASS));
    assertNull(simplifier.getAnchors().get(BaseDimension.TEMPERATURE));
  }

  @Test
  public void testCoherentUnitsSkipScaledUnits() {
    assertEquals(Arrays.asList(table.get("m"), table.get("s"), table.get("kg"), table.get("A"),
        table.get("J"), table.get("N"), table.get("W")), simplifier.getCoherentUnits());
  }

  @Test
  public void testSimplify() {
    assertEquals(ExponentVector.of("J"),
        simplifier.simplify(ExponentVector.parse("kg*m2/s2"), 2));
    assertEquals(ExponentVector.of("W"),
        simplifier.simplify(ExponentVector.parse("J/s"), 2));
    assertEquals(ExponentVector.parse("J/m"),
        simplifier.simplify(ExponentVector.parse("J/m"), 2));
  }

  @Test
  public void testSimplifyLevelZeroIsIdentity() {
    ExponentVector unit = ExponentVector.parse("kg*m2/s2");
    assertSame(unit, simplifier.simplify(unit, 0));
  }

  @Test
  public void testSimplifyNeverIncreasesNorm() {
    ExponentVector unit = ExponentVector.parse("N*m/s");
    ExponentVector simplified = simplifier.simplify(unit, 2);
    assertTrue(simplified.toString(), simplified.norm().compareTo(unit.norm()) <= 0);
  }

  @Test
  public void testFindUnitsForSingleUnit() {
    assertEquals(ExponentVector.of("J"), simplifier.findUnitsFor(ENERGY));
    assertEquals(ExponentVector.of("m"), simplifier.findUnitsFor(ExponentVector.of("L")));
  }

  @Test
  public void testFindUnitsForPrefersFewestSymbolsThenDefinitionOrder() {
    assertEquals(ExponentVector.parse("m/s"), simplifier.findUnitsFor(ExponentVector.parse("L/T")));
    assertEquals(ExponentVector.parse("J*A"),
        simplifier.findUnitsFor(ExponentVector.parse("M*L2*I/T2")));
  }

  @Test
  public void testFindUnitsForPrefersIntegerExponents() {
    assertEquals(ExponentVector.of("m", Fraction.ONE_HALF),
        simplifier.findUnitsFor(ExponentVector.of("L", Fraction.ONE_HALF)));
  }

  @Test
  public void testFindUnitsForUnknownDimension() {
    assertNull(simplifier.findUnitsFor(ExponentVector.of("Theta")));
    assertNull(simplifier.findUnitsFor(ExponentVector.EMPTY));
  }

  @Test
  public void testSolve() {
    Fraction[] exponents = CoherentSimplifier.solve(
        Arrays.asList(ExponentVector.of("L"), ExponentVector.of("T")),
        ExponentVector.parse("L2/T"));
    assertArrayEquals(new Fraction[] {Fraction.getFraction(2, 1), Fraction.getFraction(-1, 1)},
        exponents);

    assertNull("inconsistent systems have no solution", CoherentSimplifier.solve(
        Arrays.asList(ExponentVector.of("L")), ExponentVector.parse("L/T")));
    assertNull("dependent columns have no unique solution", CoherentSimplifier.solve(
        Arrays.asList(ExponentVector.of("L"), ExponentVector.of("L", 2)),
        ExponentVector.of("L")));
  }
}
