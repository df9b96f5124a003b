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

import java.util.Map;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;

/**
 * The fixed alphabet of physical dimensions that a {@link Quantity} dimension vector is expressed
 * over.  Angle is tracked as an explicit dimension.
 */
public enum BaseDimension {
  CURRENT("I", "current"),
  LENGTH("L", "length"),
  MASS("M", "mass"),
  AMOUNT("N", "amount of substance"),
  TIME("T", "time"),
  TEMPERATURE("Theta", "temperature"),
  ANGLE("A", "angle");

  private static final Map<String, BaseDimension> BY_SYMBOL;
  static {
    ImmutableMap.Builder<String, BaseDimension> builder = ImmutableMap.builder();
    for (BaseDimension dimension : values()) {
      builder.put(dimension.symbol, dimension);
    }
    BY_SYMBOL = builder.build();
  }

  private final String symbol;
  private final String description;

  private BaseDimension(String symbol, String description) {
    this.symbol = symbol;
    this.description = description;
  }

  public String getSymbol() {
    return symbol;
  }

  public String getDescription() {
    return description;
  }

  /**
   * Returns the dimension vector of this base dimension raised to the first power.
   */
  public ExponentVector asVector() {
    return ExponentVector.of(symbol);
  }

  /**
   * Finds the base dimension with the given symbol.
   *
   * @param symbol a dimension symbol such as {@code "L"} or {@code "Theta"}
   * @return the matching base dimension, or {@code null} if there is none
   */
  @Nullable
  public static BaseDimension fromSymbol(String symbol) {
    return BY_SYMBOL.get(symbol);
  }

  /**
   * Parses a dimension expression like {@code "L2*M/T2"} and checks that it only uses symbols from
   * this alphabet.
   *
   * @param expression the dimension expression in exponent-vector text form
   * @return the parsed dimension vector
   * @throws IllegalArgumentException if the text is malformed or names an unknown dimension
   */
  public static ExponentVector parse(String expression) {
    ExponentVector dimension = ExponentVector.parse(expression);
    for (String symbol : dimension.symbols()) {
      Preconditions.checkArgument(BY_SYMBOL.containsKey(symbol),
          "Unknown dimension '%s' in '%s'; expected one of %s", symbol, expression,
          BY_SYMBOL.keySet());
    }
    return dimension;
  }

  @Override
  public String toString() {
    return symbol;
  }
}
