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

package com.natu.quantity;

import org.apache.commons.lang.math.Fraction;

/**
 * Thrown when a negative value is raised to a non-integer power.
 */
public class FractionalPowerOfNegativeException extends ArithmeticException {

  private final double value;
  private final Fraction power;

  public FractionalPowerOfNegativeException(double value, Fraction power) {
    super(String.format("Cannot raise negative value %s to the fractional power %s", value,
        power));
    this.value = value;
    this.power = power;
  }

  public double getValue() {
    return value;
  }

  public Fraction getPower() {
    return power;
  }
}
