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
import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;

import com.natu.quantity.ExponentVector;
import com.natu.quantity.IncompatibleUnitException;
import com.natu.quantity.Quantity;

/**
 * A unit that is not a simple scale factor, such as an offset temperature scale or a logarithmic
 * ratio.
 *
 * <p>A lambda unit is defined by a pair of functions: {@code forward} maps a number of the unit to
 * a quantity and {@code inverse} maps a quantity back to a number of the unit.  These two
 * conversions are the only operations a lambda unit supports; it can not be multiplied, divided or
 * raised to a power together with other units.
 */
public final class LambdaUnit extends UnitEntry {

  private final Function<Double, Quantity> forward;
  private final Function<Quantity, Double> inverse;
  private final ExponentVector dimension;
  private final boolean prefixable;

  private LambdaUnit(String name, Function<Double, Quantity> forward,
      Function<Quantity, Double> inverse, ExponentVector dimension, boolean prefixable) {
    super(name);
    this.forward = Preconditions.checkNotNull(forward);
    this.inverse = Preconditions.checkNotNull(inverse);
    this.dimension = Preconditions.checkNotNull(dimension);
    this.prefixable = prefixable;
  }

  /**
   * Creates a lambda unit.  Its dimension is the dimension of {@code forward(0)}.
   *
   * @param name the unit symbol
   * @param forward maps a number of this unit to a quantity
   * @param inverse maps a quantity to a number of this unit
   * @param prefixable whether SI prefixes may be applied to the unit
   * @return the new unit
   */
  public static LambdaUnit create(String name, Function<Double, Quantity> forward,
      Function<Quantity, Double> inverse, boolean prefixable) {
    Quantity zero = Preconditions.checkNotNull(forward.apply(0.0),
        "The forward conversion of %s returned null", name);
    return new LambdaUnit(name, forward, inverse, zero.getDimension(), prefixable);
  }

  /**
   * Returns a copy of this unit under another name and prefixable flag.
   */
  public LambdaUnit rename(String newName, boolean newPrefixable) {
    return new LambdaUnit(newName, forward, inverse, dimension, newPrefixable);
  }

  /**
   * Returns the unit with {@code prefix} applied.  The forward conversion scales its argument by
   * the prefix and the inverse conversion divides by it.
   */
  public LambdaUnit withPrefix(final Prefix prefix) {
    Function<Double, Quantity> prefixedForward = new Function<Double, Quantity>() {
      @Override public Quantity apply(Double number) {
        return forward.apply(prefix.multiplier() * number);
      }
    };
    Function<Quantity, Double> prefixedInverse = new Function<Quantity, Double>() {
      @Override public Double apply(Quantity quantity) {
        return inverse.apply(quantity) / prefix.multiplier();
      }
    };
    return new LambdaUnit(prefix.getSymbol() + getName(), prefixedForward, prefixedInverse,
        dimension, false);
  }

  /**
   * Evaluates {@code number} of this unit, as in {@code 25 degC}.  The result is displayed in this
   * unit.
   */
  public Quantity toQuantity(double number) {
    Quantity quantity = forward.apply(number);
    return quantity.withDisplayUnit(ExponentVector.of(getName()));
  }

  /**
   * Expresses {@code quantity} as a number of this unit.
   *
   * @throws IncompatibleUnitException if the quantity's dimension is not this unit's dimension
   */
  public double toNumber(Quantity quantity) {
    Preconditions.checkNotNull(quantity);
    if (!dimension.equals(quantity.getDimension())) {
      throw new IncompatibleUnitException(quantity.getDimension(), dimension);
    }
    return inverse.apply(quantity);
  }

  @Override
  public Kind getKind() {
    return Kind.LAMBDA_UNIT;
  }

  @Override
  public ExponentVector getDimension() {
    return dimension;
  }

  @Override
  public boolean isPrefixable() {
    return prefixable;
  }

  @Override
  public LambdaUnit asLambdaUnit() {
    return this;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper("LambdaUnit")
        .addValue(getName())
        .add("dimension", dimension)
        .add("prefixable", prefixable)
        .toString();
  }
}
