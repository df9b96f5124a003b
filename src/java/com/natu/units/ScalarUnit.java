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

import com.google.common.base.MoreObjects;

import com.natu.quantity.ExponentVector;
import com.natu.quantity.Quantity;

/**
 * A unit that is a pure scale factor of the coherent units, such as {@code ft} or {@code J}.
 *
 * <p>The unit's quantity is displayed as the unit's own symbol, so {@code 3 * ft} shows as
 * {@code 3.0 ft}.
 */
public final class ScalarUnit extends UnitEntry {

  private final Quantity quantity;
  private final boolean prefixable;

  public ScalarUnit(String name, double value, ExponentVector dimension, boolean prefixable) {
    super(name);
    this.quantity = Quantity.of(value, dimension, ExponentVector.of(name));
    this.prefixable = prefixable;
  }

  /**
   * Returns the unit scaled by {@code prefix} under the prefixed symbol.  The result is not
   * prefixable itself.
   */
  public ScalarUnit withPrefix(Prefix prefix) {
    return new ScalarUnit(prefix.getSymbol() + getName(), prefix.multiplier() * getValue(),
        getDimension(), false);
  }

  /**
   * Returns the value of one of this unit in coherent units.
   */
  public double getValue() {
    return quantity.getValue();
  }

  public Quantity getQuantity() {
    return quantity;
  }

  @Override
  public Kind getKind() {
    return Kind.UNIT;
  }

  @Override
  public ExponentVector getDimension() {
    return quantity.getDimension();
  }

  @Override
  public boolean isPrefixable() {
    return prefixable;
  }

  @Override
  public ScalarUnit asUnit() {
    return this;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper("ScalarUnit")
        .addValue(getName())
        .addValue(getValue())
        .add("dimension", getDimension())
        .add("prefixable", prefixable)
        .toString();
  }
}
