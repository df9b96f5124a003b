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

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import com.google.common.base.Preconditions;

import org.apache.commons.lang.math.Fraction;

/**
 * A physical quantity: a value together with its dimension and the unit it is displayed in.
 *
 * <p>The value is stored in the coherent units of the unit system the quantity was created in, so
 * it never depends on the display unit.  The display vector only records how the quantity was
 * built (for example {@code km/hr}) so that it can be shown that way again.  Quantities are
 * immutable; every arithmetic operation returns a new instance.
 *
 * <p>Addition, subtraction and comparison need operands of equal dimension and throw
 * {@link DimensionException} otherwise.  Display vectors never need to match.
 */
public final class Quantity implements Comparable<Quantity> {

  /**
   * The dimensionless number one.
   */
  public static final Quantity ONE = of(1);

  private final double value;
  private final ExponentVector dimension;
  private final ExponentVector display;

  private Quantity(double value, ExponentVector dimension, ExponentVector display) {
    this.value = value;
    this.dimension = Preconditions.checkNotNull(dimension);
    this.display = Preconditions.checkNotNull(display);
  }

  /**
   * Creates a dimensionless quantity.
   */
  public static Quantity of(double value) {
    return new Quantity(value, ExponentVector.EMPTY, ExponentVector.EMPTY);
  }

  /**
   * Creates a quantity with no display unit.
   *
   * @param value the value in coherent units
   * @param dimension the physical dimension
   * @return a quantity of the given dimension
   */
  public static Quantity of(double value, ExponentVector dimension) {
    return new Quantity(value, dimension, ExponentVector.EMPTY);
  }

  public static Quantity of(double value, ExponentVector dimension, ExponentVector display) {
    return new Quantity(value, dimension, display);
  }

  /**
   * Creates a quantity from a dimension expression over the {@link BaseDimension} symbols, for
   * example {@code Quantity.of(299792458, "L/T")}.
   */
  public static Quantity of(double value, String dimension) {
    return new Quantity(value, BaseDimension.parse(dimension), ExponentVector.EMPTY);
  }

  public double getValue() {
    return value;
  }

  public ExponentVector getDimension() {
    return dimension;
  }

  public ExponentVector getDisplay() {
    return display;
  }

  public boolean isDimensionless() {
    return dimension.isEmpty();
  }

  /**
   * Returns a copy of this quantity that is displayed in {@code newDisplay}.  The value and
   * dimension are unchanged.
   */
  public Quantity withDisplayUnit(ExponentVector newDisplay) {
    return new Quantity(value, dimension, newDisplay);
  }

  public Quantity add(Quantity other) {
    checkSameDimension("add", other);
    return new Quantity(value + other.value, dimension, display);
  }

  public Quantity subtract(Quantity other) {
    checkSameDimension("subtract", other);
    return new Quantity(value - other.value, dimension, display);
  }

  public Quantity multiply(Quantity other) {
    return new Quantity(value * other.value, dimension.multiply(other.dimension),
        display.multiply(other.display));
  }

  public Quantity multiply(double factor) {
    return new Quantity(value * factor, dimension, display);
  }

  public Quantity divide(Quantity other) {
    return new Quantity(value / other.value, dimension.divide(other.dimension),
        display.divide(other.display));
  }

  public Quantity divide(double divisor) {
    return new Quantity(value / divisor, dimension, display);
  }

  /**
   * Returns {@code 1 / this}.
   */
  public Quantity inverse() {
    return new Quantity(1 / value, dimension.negate(), display.negate());
  }

  public Quantity negate() {
    return new Quantity(-value, dimension, display);
  }

  public Quantity abs() {
    return new Quantity(Math.abs(value), dimension, display);
  }

  public Quantity power(int power) {
    return power(Fraction.getFraction(power, 1));
  }

  /**
   * Raises this quantity to a rational power.  The dimension and display exponents are scaled by
   * {@code power}.
   *
   * @param power the exponent
   * @return this quantity raised to {@code power}
   * @throws FractionalPowerOfNegativeException if the value is negative and {@code power} is not
   *     a whole number
   */
  public Quantity power(Fraction power) {
    Preconditions.checkNotNull(power);
    Fraction reduced = power.reduce();
    if (reduced.getNumerator() == 0) {
      return ONE;
    }
    if (value < 0 && reduced.getDenominator() != 1) {
      throw new FractionalPowerOfNegativeException(value, reduced);
    }
    double raised = reduced.getDenominator() == 1
        ? Math.pow(value, reduced.getNumerator())
        : Math.pow(value, reduced.doubleValue());
    return new Quantity(raised, dimension.power(reduced), display.power(reduced));
  }

  /**
   * Returns the number of {@code unit}s in this quantity.
   *
   * @param unit the unit to express this quantity in
   * @return {@code this / unit} as a plain number
   * @throws IncompatibleUnitException if {@code unit} has a different dimension
   */
  public double convertTo(Quantity unit) {
    Preconditions.checkNotNull(unit);
    if (!dimension.equals(unit.dimension)) {
      throw new IncompatibleUnitException(dimension, unit.dimension);
    }
    return value / unit.value;
  }

  /**
   * Returns true if {@code other} has the same dimension and a value within the given relative
   * tolerance of this one.
   */
  public boolean isClose(Quantity other, double relativeTolerance) {
    if (!dimension.equals(other.dimension)) {
      return false;
    }
    double scale = Math.max(Math.abs(value), Math.abs(other.value));
    return Math.abs(value - other.value) <= relativeTolerance * scale;
  }

  private void checkSameDimension(String operation, Quantity other) {
    Preconditions.checkNotNull(other);
    if (!dimension.equals(other.dimension)) {
      throw new DimensionException(operation, dimension, other.dimension);
    }
  }

  @Override
  public int compareTo(Quantity other) {
    checkSameDimension("compare", other);
    return Double.compare(value, other.value);
  }

  /**
   * Two quantities are equal when their values and dimensions are; display units are ignored.
   */
  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Quantity)) {
      return false;
    }
    Quantity other = (Quantity) obj;
    return Double.compare(value, other.value) == 0 && dimension.equals(other.dimension);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(value, dimension);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper("Quantity")
        .addValue(value)
        .add("dimension", dimension)
        .add("display", display)
        .toString();
  }
}
