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

import com.google.common.base.Function;

import org.junit.Test;

import com.natu.quantity.ExponentVector;
import com.natu.quantity.IncompatibleUnitException;
import com.natu.quantity.Quantity;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class LambdaUnitTest {

  private static final ExponentVector TEMPERATURE = ExponentVector.of("Theta");

  private static LambdaUnit degreesCelsius() {
    return LambdaUnit.create("degC",
        new Function<Double, Quantity>() {
          @Override public Quantity apply(Double number) {
            return Quantity.of(number + 273.15, TEMPERATURE);
          }
        },
        new Function<Quantity, Double>() {
          @Override public Double apply(Quantity quantity) {
            return quantity.getValue() - 273.15;
          }
        },
        false);
  }

  @Test
  public void testDimensionComesFromForwardConversion() {
    assertEquals(TEMPERATURE, degreesCelsius().getDimension());
    assertEquals(UnitEntry.Kind.LAMBDA_UNIT, degreesCelsius().getKind());
  }

  @Test
  public void testRoundTrip() {
    LambdaUnit degC = degreesCelsius();
    Quantity boiling = degC.toQuantity(100);
    assertEquals(373.15, boiling.getValue(), 1e-9);
    assertEquals(ExponentVector.of("degC"), boiling.getDisplay());
    assertEquals(100, degC.toNumber(boiling), 1e-9);
  }

  @Test(expected = IncompatibleUnitException.class)
  public void testToNumberChecksDimension() {
    degreesCelsius().toNumber(Quantity.of(1, "L"));
  }

  @Test
  public void testRename() {
    LambdaUnit renamed = degreesCelsius().rename("celsius", true);
    assertEquals("celsius", renamed.getName());
    assertTrue(renamed.isPrefixable());
    assertFalse(degreesCelsius().isPrefixable());
    assertEquals(ExponentVector.of("celsius"), renamed.toQuantity(0).getDisplay());
  }

  @Test
  public void testWithPrefix() {
    LambdaUnit milliDegC = degreesCelsius().rename("degC", true).withPrefix(Prefix.MILLI);
    assertEquals("mdegC", milliDegC.getName());
    assertEquals(273.151, milliDegC.toQuantity(1).getValue(), 1e-9);
    assertEquals(1000, milliDegC.toNumber(Quantity.of(274.15, TEMPERATURE)), 1e-6);
  }
}
