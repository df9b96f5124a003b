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

import java.util.Map;

import javax.annotation.Nullable;

import com.google.common.collect.ImmutableMap;

/**
 * The SI prefixes that may be put in front of a prefixable unit symbol.
 *
 * <p>All prefixes are one character long except {@link #DECA}.  When a symbol can be split either
 * way, the one-character reading is tried first.
 */
public enum Prefix {
  YOTTA("Y", 24),
  ZETTA("Z", 21),
  EXA("E", 18),
  PETA("P", 15),
  TERA("T", 12),
  GIGA("G", 9),
  MEGA("M", 6),
  KILO("k", 3),
  HECTO("h", 2),
  DECA("da", 1),
  DECI("d", -1),
  CENTI("c", -2),
  MILLI("m", -3),
  MICRO("u", -6),
  NANO("n", -9),
  PICO("p", -12),
  FEMTO("f", -15),
  ATTO("a", -18),
  ZEPTO("z", -21),
  YOCTO("y", -24);

  /**
   * The longest prefix symbol, in characters.
   */
  public static final int MAX_LENGTH = 2;

  private static final Map<String, Prefix> BY_SYMBOL;
  static {
    ImmutableMap.Builder<String, Prefix> builder = ImmutableMap.builder();
    for (Prefix prefix : values()) {
      builder.put(prefix.symbol, prefix);
    }
    BY_SYMBOL = builder.build();
  }

  private final String symbol;
  private final int exponent;
  private final double multiplier;

  private Prefix(String symbol, int exponent) {
    this.symbol = symbol;
    this.exponent = exponent;
    // Parsed rather than computed so that the multiplier is the closest double to 10^exponent.
    this.multiplier = Double.parseDouble("1e" + exponent);
  }

  public String getSymbol() {
    return symbol;
  }

  /**
   * Returns the power of ten this prefix stands for.
   */
  public int getExponent() {
    return exponent;
  }

  public double multiplier() {
    return multiplier;
  }

  @Nullable
  public static Prefix fromSymbol(String symbol) {
    return BY_SYMBOL.get(symbol);
  }

  @Override
  public String toString() {
    return symbol;
  }
}
