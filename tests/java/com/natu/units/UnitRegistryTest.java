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

import org.junit.BeforeClass;
import org.junit.Test;

import com.natu.format.NumberFormats;
import com.natu.format.UnitStyle;
import com.natu.quantity.BaseDimension;
import com.natu.quantity.ExponentVector;
import com.natu.quantity.IncompatibleUnitException;
import com.natu.quantity.Quantity;
import com.natu.units.definitions.DefinitionException;
import com.natu.units.definitions.DefinitionSources;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class UnitRegistryTest {

  private static UnitRegistry si;

  @BeforeClass
  public static void loadDefaults() throws DefinitionException {
    si = UnitRegistry.load(UnitSystemConfig.defaults());
  }

  private static Quantity constant(UnitRegistry registry, String name) {
    return registry.lookup(name).asConstant().getQuantity();
  }

  private static void assertClose(double expected, double actual) {
    assertEquals(expected, actual, Math.abs(expected) * 1e-7);
  }

  @Test
  public void testFormatDefinedUnit() {
    assertEquals("1.0 J", si.format(si.quantity(1, "J")));
    assertEquals("1.0 Hz", si.format(si.quantity(1, "Hz")));
    assertEquals("3.0 km", si.format(si.quantity(3, "km")));
  }

  @Test
  public void testPrefixedConversion() {
    assertEquals(1000.0, si.unit("km").divide(si.unit("m")).getValue(), 0);
    assertClose(1000, si.convert(si.quantity(1, "km"), "m"));
    assertClose(1e-6, si.convert(si.quantity(1, "mg"), "kg"));
    assertClose(100 / 3.6, si.convert(si.quantity(100, "km/hr"), "m/s"));
    assertClose(1000, si.convert(si.quantity(1, "kPa"), "Pa"));
  }

  @Test
  public void testBaseConstants() {
    assertClose(10973731.568539, si.unit("m*R_inf/cyc").getValue());
    assertTrue(si.unit("m*R_inf/cyc").isDimensionless());
    assertClose(299792458, si.convert(constant(si, "c"), "m/s"));
    assertClose(96485.3365, si.convert(constant(si, "k_F"), "C/mol"));
  }

  @Test
  public void testDerivedConstants() {
    assertClose(6.62606957e-34, si.convert(constant(si, "h"), "J*s"));
    assertClose(1.602176565e-19, si.convert(constant(si, "q"), "C"));
    assertClose(7.2973525698e-3, constant(si, "alpha").getValue());
    assertClose(376.730313461, si.convert(constant(si, "Z_0"), "ohm"));
    assertClose(6.02214129e23, si.convert(constant(si, "N_A"), "1/mol"));
    assertClose(1.3806488e-23, si.convert(constant(si, "k_B"), "J/K"));
    assertEquals(9.10938291e-31, si.convert(constant(si, "m_e"), "kg"), 1e-37);
    assertEquals(5.670373e-8, si.convert(constant(si, "sigma"), "W/(m2*K4)"), 1e-13);
    assertEquals(13.60569253, si.convert(si.quantity(1, "E_h"), "eV") / 2, 1e-6);
  }

  @Test
  public void testOtherUnits() {
    assertClose(0.3048, si.convert(si.quantity(1, "ft"), "m"));
    assertEquals(6894.757, si.convert(si.quantity(1, "psi"), "Pa"), 1e-3);
    assertClose(1e5, si.convert(si.quantity(1, "bar"), "Pa"));
    assertClose(3600, si.convert(si.quantity(1, "Wh"), "J"));
    assertClose(0.25, si.convert(si.quantity(25, "%"), "1"));
  }

  @Test
  public void testLambdaUnits() {
    assertClose(273.15, si.convert(si.quantity(0, "degC"), "K"));
    assertClose(212, si.convert(si.quantity(100, "degC"), "degF"));
    assertClose(100, si.convert(si.quantity(20, "dB"), "1"));
    assertEquals("25.00 degC",
        si.format(si.quantity(25, "degC"), UnitStyle.PLAIN, NumberFormats.significant(4)));
  }

  @Test
  public void testLambdaUnitsDoNotCombine() {
    try {
      si.unit("degC/s");
      fail("A lambda unit is not a factor");
    } catch (IllegalArgumentException e) {
      // Expected.
    }
    try {
      si.quantity(1, "degC2");
      fail("A lambda unit can not be raised to a power");
    } catch (IllegalArgumentException e) {
      // Expected.
    }
  }

  @Test
  public void testIncompatibleConversion() {
    try {
      si.convert(si.quantity(1, "m"), "s");
      fail("Expected meters not to convert to seconds");
    } catch (IncompatibleUnitException e) {
      assertEquals(ExponentVector.of("L"), e.getExpected());
      assertEquals(ExponentVector.of("T"), e.getActual());
    }
  }

  @Test(expected = UnitNotFoundException.class)
  public void testUnknownUnit() {
    si.unit("furlong");
  }

  @Test
  public void testParseQuantity() {
    assertClose(9.81, si.convert(si.parseQuantity("9.81 m/s2"), "m/s2"));
    assertClose(298.15, si.convert(si.parseQuantity(" 25 degC "), "K"));
    assertEquals(Quantity.of(-1.5e3), si.parseQuantity("-1.5e3"));
    try {
      si.parseQuantity("m/s");
      fail("A quantity must start with a number");
    } catch (IllegalArgumentException e) {
      // Expected.
    }
  }

  @Test
  public void testFormatSimplifiesDisplayUnit() {
    assertEquals("1.000 J", si.format(si.quantity(1, "kg*m2/s2"), UnitStyle.PLAIN,
        NumberFormats.significant(4)));
    assertEquals("1.000 psi", si.format(si.quantity(1, "lbf/inch2"), UnitStyle.PLAIN,
        NumberFormats.significant(4)));
    assertEquals(ExponentVector.of("J"), si.simplify(ExponentVector.parse("kg*m2/s2")));
    assertEquals(ExponentVector.parse("kg*m2/s2"),
        si.simplify(ExponentVector.parse("kg*m2/s2"), 0));
  }

  @Test
  public void testFormatWithoutDisplayUnit() {
    assertEquals("1.0 J", si.format(Quantity.of(1, BaseDimension.parse("L2*M/T2")),
        UnitStyle.PLAIN, NumberFormats.DEFAULT));
    Quantity energy = Quantity.of(2, BaseDimension.parse("M*L2/T2"));
    assertEquals("2.00 J", si.format(energy, UnitStyle.PLAIN, NumberFormats.significant(3)));
    Quantity speed = Quantity.of(3, BaseDimension.parse("L/T"));
    assertEquals("3.00 m/s", si.format(speed, UnitStyle.PLAIN, NumberFormats.significant(3)));
    assertEquals("0.5", si.format(Quantity.of(0.5)));
  }

  @Test
  public void testFormatStylesAndReplacements() {
    Quantity resistance = si.quantity(1, "ohm");
    assertEquals("1.0\\,\\Omega",
        si.format(resistance, UnitStyle.LATEX, NumberFormats.pattern("%.1f")));
    assertEquals("1.0 Ω", si.format(resistance, UnitStyle.UNICODE, NumberFormats.pattern("%.1f")));
    assertEquals("1.0 ohm", si.format(resistance, UnitStyle.PLAIN, NumberFormats.pattern("%.1f")));

    Quantity wavelength = si.quantity(1.5e-7, "m");
    assertEquals("1.5×10⁻⁷ m",
        si.format(wavelength, UnitStyle.UNICODE, NumberFormats.pattern("%.1e")));
    assertEquals("1.5&times;10<sup>-7</sup>&nbsp;m",
        si.format(wavelength, UnitStyle.HTML, NumberFormats.pattern("%.1e")));
  }

  @Test
  public void testUnitGroups() {
    assertEquals("rational", si.constants().get(0).getName());
    assertEquals("rad", si.units().get(0).getName());

    ExponentVector energy = BaseDimension.parse("M*L2/T2");
    assertEquals("J", si.unitsWithDimension(energy).get(0).getName());
    boolean foundElectronVolt = false;
    for (UnitEntry unit : si.unitsWithDimension(energy)) {
      foundElectronVolt |= unit.getName().equals("eV");
    }
    assertTrue(foundElectronVolt);

    assertTrue(si.prefixableSymbols().contains("m"));
    assertTrue(si.prefixableSymbols().contains("g"));
    assertFalse(si.prefixableSymbols().contains("kg"));

    assertTrue(si.coherentUnits().contains(si.lookup("J").asUnit()));
    assertFalse(si.coherentUnits().contains(si.lookup("cal").asUnit()));
    assertTrue(si.coherentRelations().contains(ExponentVector.parse("V*C/J")));
  }

  @Test
  public void testUnitSystemOfUnity() throws DefinitionException {
    UnitRegistry unity = UnitRegistry.load(UnitSystemConfig.builder()
        .addBundledDefinitions(UnitSystemConfig.BASE_UNITY)
        .build());
    assertEquals(1, constant(unity, "c").getValue(), 0);
    assertClose(299792458, unity.convert(constant(unity, "c"), "m/s"));
    assertClose(1000, unity.convert(unity.quantity(1, "km"), "m"));
    assertClose(2 * Math.PI * 10973731.568539, unity.lookup("m").asUnit().getValue());
    assertClose(6.62606957e-34, unity.convert(constant(unity, "h"), "J*s"));
  }

  @Test
  public void testUnrationalizedUnitSystem() throws DefinitionException {
    UnitRegistry unrationalized = UnitRegistry.load(UnitSystemConfig.builder()
        .addBundledDefinitions(UnitSystemConfig.BASE_SI_UNRATIONALIZED)
        .build());
    double rationalized = si.convert(constant(si, "mu_0"), "N/A2");
    assertClose(4 * Math.PI * 1e-7, rationalized);
    assertClose(4 * Math.PI,
        rationalized / unrationalized.convert(constant(unrationalized, "mu_0"), "N/A2"));
  }

  @Test
  public void testCustomDefinitions() throws DefinitionException {
    UnitRegistry custom = UnitRegistry.load(UnitSystemConfig.builder()
        .addBundledDefinitions(UnitSystemConfig.BASE_SI)
        .addDefinitions(DefinitionSources.fromString("track.ini",
            "[Length]\nfurlong = 201.168*m, False\nft = 0.3*m, False ; a short foot\n"))
        .build());
    assertClose(201.168, custom.convert(custom.quantity(1, "furlong"), "m"));
    assertClose(0.3, custom.convert(custom.quantity(1, "ft"), "m"));
    assertClose(0.3048, si.convert(si.quantity(1, "ft"), "m"));
  }

  @Test
  public void testRedefinedUnitIsNotUsedForSimplification() throws DefinitionException {
    UnitRegistry custom = UnitRegistry.load(UnitSystemConfig.builder()
        .addBundledDefinitions(UnitSystemConfig.BASE_SI)
        .addDefinitions(DefinitionSources.fromString("double-joule.ini", "J = 2*N*m, True"))
        .build());
    ExponentVector simplified = custom.simplify(ExponentVector.parse("N*m"));
    assertFalse(simplified.contains("J"));
    assertClose(custom.unit("N*m").getValue(), custom.unit(simplified.toString()).getValue());
    assertFalse(custom.coherentRelations().contains(ExponentVector.parse("C*V/J")));
    assertEquals(2, custom.convert(custom.quantity(1, "J"), "N*m"), 1e-12);
  }
}
