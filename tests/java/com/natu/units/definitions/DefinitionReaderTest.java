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

package com.natu.units.definitions;

import java.util.List;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class DefinitionReaderTest {

  private static List<DefinitionStatement> read(String text) throws Exception {
    return new DefinitionReader().read(DefinitionSources.fromString("test.ini", text));
  }

  @Test
  public void testStatements() throws Exception {
    List<DefinitionStatement> statements = read(
        "; A comment.\n"
        + "# Another comment.\n"
        + "\n"
        + "c = Quantity(299792458, 'L/T')  ; speed of light\n"
        + "[SI units]\n"
        + "m = 10973731.568539*cyc/R_inf, True\n"
        + "kg = J*s**2/m**2, False\n");
    assertEquals(3, statements.size());

    DefinitionStatement c = statements.get(0);
    assertEquals("c", c.getSymbol());
    assertEquals("Quantity(299792458, 'L/T')", c.getExpression());
    assertEquals("speed of light", c.getNote());
    assertEquals("", c.getSection());
    assertEquals(4, c.getLine());
    assertFalse(c.hasUnitFlag());
    assertNull(c.getPrefixable());
    assertEquals("test.ini:4", c.getLocator());

    DefinitionStatement m = statements.get(1);
    assertEquals("SI units", m.getSection());
    assertEquals("10973731.568539*cyc/R_inf", m.getExpression());
    assertTrue(m.hasUnitFlag());
    assertEquals(Boolean.TRUE, m.getPrefixable());

    assertEquals(Boolean.FALSE, statements.get(2).getPrefixable());
  }

  @Test
  public void testContinuationLines() throws Exception {
    List<DefinitionStatement> statements = read(
        "degC = LambdaUnit(n -> (n + 273.15)*K,\n"
        + "                  x -> x/K - 273.15), False  ; degree Celsius\n"
        + "K2 = K**2\n");
    assertEquals(2, statements.size());
    DefinitionStatement degC = statements.get(0);
    assertEquals("LambdaUnit(n -> (n + 273.15)*K, x -> x/K - 273.15)", degC.getExpression());
    assertEquals(Boolean.FALSE, degC.getPrefixable());
    assertEquals("degree Celsius", degC.getNote());
    assertEquals(1, degC.getLine());
    assertEquals(3, statements.get(1).getLine());
  }

  @Test
  public void testSemicolonInsideStringIsNotANote() throws Exception {
    DefinitionStatement statement = read("x = ScalarUnit(1, 'L;T')\n").get(0);
    assertEquals("ScalarUnit(1, 'L;T')", statement.getExpression());
    assertNull(statement.getNote());
  }

  @Test
  public void testSymbolsNeedNotBeIdentifiers() throws Exception {
    assertEquals("%", read("% = 0.01, False").get(0).getSymbol());
  }

  @Test
  public void testMalformedLines() throws Exception {
    assertParseError("c 299792458\n", 1);
    assertParseError("x = 1\n[units\n", 2);
    assertParseError("[]\n", 1);
    assertParseError("  x = 1\n", 1);
    assertParseError("a b = 1\n", 1);
    assertParseError("x = 1\ny = , True\n", 2);
  }

  private static void assertParseError(String text, int line) throws Exception {
    try {
      read(text);
      fail("Expected a parse error in " + text);
    } catch (DefinitionParseException e) {
      assertEquals(line, e.getLine());
      assertEquals("test.ini", e.getSource());
      assertTrue(e.getMessage(), e.getMessage().startsWith("test.ini:" + line + ": "));
    }
  }
}
