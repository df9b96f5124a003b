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

import org.junit.Test;

import com.natu.units.definitions.Expression.BinaryOperation;
import com.natu.units.definitions.Expression.Call;
import com.natu.units.definitions.Expression.LambdaExpression;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class ExpressionParserTest {

  private static String parsed(String expression) {
    return ExpressionParser.parse(expression).toString();
  }

  @Test
  public void testPrecedence() {
    assertEquals("(1.0 + (2.0 * 3.0))", parsed("1 + 2*3"));
    assertEquals("((1.0 - 2.0) - 3.0)", parsed("1 - 2 - 3"));
    assertEquals("((kg * m) / (s ** 2.0))", parsed("kg*m/s**2"));
    assertEquals("(9.81 * (m / s))", parsed("9.81*(m/s)"));
    assertEquals("(2.99792458E8 * (m / c))", parsed("299792458*(m/c)"));
  }

  @Test
  public void testPowerBindsTighterThanNegationAndIsRightAssociative() {
    assertEquals("-((x ** 2.0))", parsed("-x**2"));
    assertEquals("(s ** -(1.0))", parsed("s**-1"));
    assertEquals("(a ** (b ** c))", parsed("a**b**c"));
  }

  @Test
  public void testNumbers() {
    assertEquals("4.8359787E14", parsed("483597.870e9"));
    assertEquals("0.5", parsed(".5"));
  }

  @Test
  public void testCalls() {
    Expression quantity = ExpressionParser.parse("Quantity(299792458, 'L/T', \"m/s\")");
    assertTrue(quantity instanceof Call);
    assertEquals("Quantity", ((Call) quantity).getFunction());
    assertEquals(3, ((Call) quantity).getArguments().size());
    assertEquals("Quantity(2.99792458E8, 'L/T', 'm/s')", quantity.toString());
    assertEquals("sqrt((2.0 * pi))", parsed("sqrt(2*pi)"));
  }

  @Test
  public void testLambdaUnit() {
    Call call = (Call) ExpressionParser.parse(
        "LambdaUnit(n -> (n + 273.15)*K, x -> x/K - 273.15)");
    LambdaExpression forward = (LambdaExpression) call.getArguments().get(0);
    assertEquals("n", forward.getParameter());
    assertTrue(forward.getBody() instanceof BinaryOperation);
    assertEquals("x -> ((x / K) - 273.15)", call.getArguments().get(1).toString());
  }

  @Test
  public void testOnlyAllowListedFunctionsCanBeCalled() {
    assertSyntaxError("exec('rm')", 0);
    assertSyntaxError("2 * __import__(os)", 4);
  }

  @Test
  public void testLambdasOnlyAsLambdaUnitArguments() {
    assertSyntaxError("sqrt(n -> n)", 5);
    assertSyntaxError("LambdaUnit(2*K, x -> x/K)", 11);
  }

  @Test
  public void testArgumentCounts() {
    assertSyntaxError("exp(1, 2)", 0);
    assertSyntaxError("Quantity(1)", 0);
    assertSyntaxError("log()", 0);
  }

  @Test
  public void testMalformedExpressions() {
    assertSyntaxError("1 +", 3);
    assertSyntaxError("(m / s", 6);
    assertSyntaxError("m s", 2);
    assertSyntaxError("", 0);
  }

  private static void assertSyntaxError(String expression, int offset) {
    try {
      ExpressionParser.parse(expression);
      fail("Expected '" + expression + "' to be rejected");
    } catch (ExpressionSyntaxException e) {
      assertEquals(e.getMessage(), offset, e.getOffset());
    }
  }
}
