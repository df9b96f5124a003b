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
import com.google.common.base.Preconditions;

import com.natu.quantity.ExponentVector;
import com.natu.quantity.Quantity;

/**
 * A named physical constant, such as the speed of light.  Constants take part in arithmetic like
 * any quantity but can not be prefixed.
 */
public final class Constant extends UnitEntry {

  private final Quantity quantity;

  public Constant(String name, Quantity quantity) {
    super(name);
    this.quantity = Preconditions.checkNotNull(quantity);
  }

  public Quantity getQuantity() {
    return quantity;
  }

  @Override
  public Kind getKind() {
    return Kind.CONSTANT;
  }

  @Override
  public ExponentVector getDimension() {
    return quantity.getDimension();
  }

  @Override
  public Constant asConstant() {
    return this;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper("Constant")
        .addValue(getName())
        .addValue(quantity)
        .toString();
  }
}
