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

import javax.annotation.Nullable;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;

import com.natu.quantity.Quantity;
import com.natu.units.LambdaUnit;

/**
 * The result of evaluating a definition expression.
 */
final class Value {

  enum Kind {
    NUMBER,
    QUANTITY,
    LAMBDA_UNIT,
    STRING
  }

  private final Kind kind;
  private final double number;
  @Nullable private final Quantity quantity;
  private final boolean unitProduct;
  private final boolean explicitUnit;
  @Nullable private final LambdaUnit lambdaUnit;
  @Nullable private final String string;

  private Value(Kind kind, double number, @Nullable Quantity quantity, boolean unitProduct,
      boolean explicitUnit, @Nullable LambdaUnit lambdaUnit, @Nullable String string) {
    this.kind = kind;
    this.number = number;
    this.quantity = quantity;
    this.unitProduct = unitProduct;
    this.explicitUnit = explicitUnit;
    this.lambdaUnit = lambdaUnit;
    this.string = string;
  }

  static Value number(double number) {
    return new Value(Kind.NUMBER, number, null, false, false, null, null);
  }

  /**
   * Wraps a quantity.
   *
   * @param quantity the quantity
   * @param unitProduct true if the quantity is a product of powers of units with no other factor
   */
  static Value quantity(Quantity quantity, boolean unitProduct) {
    return new Value(Kind.QUANTITY, 0, Preconditions.checkNotNull(quantity), unitProduct, false,
        null, null);
  }

  /**
   * Wraps the result of an arithmetic operation, collapsing a dimensionless quantity to a plain
   * number unless it is a product of units.
   */
  static Value arithmetic(Quantity quantity, boolean unitProduct) {
    if (quantity.isDimensionless() && !unitProduct) {
      return number(quantity.getValue());
    }
    return quantity(quantity, unitProduct);
  }

  /**
   * Wraps the result of an explicit {@code ScalarUnit(...)} call.
   */
  static Value explicitUnit(Quantity quantity) {
    return new Value(Kind.QUANTITY, 0, Preconditions.checkNotNull(quantity), false, true, null,
        null);
  }

  static Value lambdaUnit(LambdaUnit lambdaUnit) {
    return new Value(Kind.LAMBDA_UNIT, 0, null, false, false,
        Preconditions.checkNotNull(lambdaUnit), null);
  }

  static Value string(String string) {
    return new Value(Kind.STRING, 0, null, false, false, null, Preconditions.checkNotNull(string));
  }

  Kind getKind() {
    return kind;
  }

  boolean isNumeric() {
    return kind == Kind.NUMBER || kind == Kind.QUANTITY;
  }

  boolean isUnitProduct() {
    return unitProduct;
  }

  boolean isExplicitUnit() {
    return explicitUnit;
  }

  /**
   * Returns this value as a quantity; a number becomes a dimensionless quantity.
   *
   * @throws EvaluationException if this value is not numeric
   */
  Quantity asQuantity() {
    switch (kind) {
      case NUMBER:
        return Quantity.of(number);
      case QUANTITY:
        return quantity;
      default:
        throw new EvaluationException("Expected a number or quantity but got " + describe());
    }
  }

  /**
   * Returns this value as a plain number.
   *
   * @throws EvaluationException if this value is not a number or a dimensionless quantity
   */
  double asNumber() {
    if (kind == Kind.NUMBER) {
      return number;
    }
    if (kind == Kind.QUANTITY && quantity.isDimensionless()) {
      return quantity.getValue();
    }
    throw new EvaluationException("Expected a dimensionless number but got " + describe());
  }

  LambdaUnit asLambdaUnit() {
    if (kind != Kind.LAMBDA_UNIT) {
      throw new EvaluationException("Expected a lambda unit but got " + describe());
    }
    return lambdaUnit;
  }

  String asString() {
    if (kind != Kind.STRING) {
      throw new EvaluationException("Expected a quoted string but got " + describe());
    }
    return string;
  }

  String describe() {
    switch (kind) {
      case NUMBER:
        return "the number " + number;
      case QUANTITY:
        return "a quantity of dimension '" + quantity.getDimension() + "'";
      case LAMBDA_UNIT:
        return "the lambda unit " + lambdaUnit.getName();
      default:
        return "the string '" + string + "'";
    }
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("kind", kind)
        .add("value", kind == Kind.NUMBER ? Double.valueOf(number) : null)
        .add("quantity", quantity)
        .add("lambdaUnit", lambdaUnit)
        .add("string", string)
        .add("unitProduct", unitProduct)
        .omitNullValues()
        .toString();
  }
}
