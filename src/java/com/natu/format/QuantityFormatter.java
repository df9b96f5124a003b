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

package com.natu.format;

import java.util.Map;

import javax.annotation.Nullable;

import com.google.common.base.Function;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;

import org.apache.commons.lang.math.Fraction;

import com.natu.base.MorePreconditions;
import com.natu.quantity.ExponentVector;
import com.natu.quantity.Quantity;
import com.natu.units.CoherentSimplifier;
import com.natu.units.PrefixResolver;
import com.natu.units.UnitEntry;

/**
 * Renders quantities as a number followed by a unit, such as {@code 9.81 m/s2}.
 *
 * <p>The unit is chosen in this order:
 * <ol>
 *   <li>The quantity's display unit, if it has one: a single lambda unit is shown through its
 *       inverse conversion ({@code 25.0 degC}); any other display unit is first simplified
 *       ({@code kg*m2/s2} becomes {@code J}) and used if its dimension matches the quantity's.
 *   <li>A combination of coherent units that reproduces the quantity's dimension.
 *   <li>The bare dimension symbols, with the value in coherent units.
 * </ol>
 */
public class QuantityFormatter {

  private final PrefixResolver symbols;
  private final CoherentSimplifier simplifier;
  private final int simplificationLevel;
  private final ImmutableMap<UnitStyle, ImmutableMap<String, String>> replacements;

  /**
   * Creates a formatter for one unit system.
   *
   * @param symbols resolves unit symbols of the unit system
   * @param simplifier the unit system's simplifier
   * @param simplificationLevel how hard to try simplifying display units; zero disables it
   * @param replacements per style, symbols to render differently
   */
  public QuantityFormatter(PrefixResolver symbols, CoherentSimplifier simplifier,
      int simplificationLevel, Map<UnitStyle, ? extends Map<String, String>> replacements) {
    this.symbols = Preconditions.checkNotNull(symbols);
    this.simplifier = Preconditions.checkNotNull(simplifier);
    this.simplificationLevel =
        MorePreconditions.checkNotNegative(simplificationLevel, "simplificationLevel");
    ImmutableMap.Builder<UnitStyle, ImmutableMap<String, String>> copy = ImmutableMap.builder();
    for (Map.Entry<UnitStyle, ? extends Map<String, String>> entry : replacements.entrySet()) {
      copy.put(entry.getKey(), ImmutableMap.copyOf(entry.getValue()));
    }
    this.replacements = copy.build();
  }

  /**
   * Formats {@code quantity} in the given style.
   *
   * @param quantity the quantity to render
   * @param style the text style
   * @param numberFormat renders the number in front of the unit
   * @return the rendered quantity
   */
  public String format(Quantity quantity, UnitStyle style, Function<Double, String> numberFormat) {
    Preconditions.checkNotNull(quantity);
    Preconditions.checkNotNull(style);
    Preconditions.checkNotNull(numberFormat);

    Rendering rendering = choose(quantity);
    String number = style.formatNumber(numberFormat.apply(rendering.number));
    ImmutableMap<String, String> styleReplacements = replacements.get(style);
    String unit = style.format(rendering.unit,
        styleReplacements == null ? ImmutableMap.<String, String>of() : styleReplacements);
    return unit.isEmpty() ? number : number + style.separator() + unit;
  }

  /**
   * Returns the unit {@code quantity} would be shown in, without its number.
   */
  public ExponentVector chooseUnit(Quantity quantity) {
    return choose(quantity).unit;
  }

  private Rendering choose(Quantity quantity) {
    ExponentVector display = quantity.getDisplay();
    if (!display.isEmpty()) {
      Rendering lambda = asLambdaUnit(quantity, display);
      if (lambda != null) {
        return lambda;
      }
      ExponentVector simplified = simplifier.simplify(display, simplificationLevel);
      Rendering rendering = inUnits(quantity, simplified);
      if (rendering != null) {
        return rendering;
      }
    }

    if (quantity.isDimensionless()) {
      return new Rendering(quantity.getValue(), ExponentVector.EMPTY);
    }
    ExponentVector coherent = simplifier.findUnitsFor(quantity.getDimension());
    if (coherent != null) {
      Rendering rendering = inUnits(quantity, coherent);
      if (rendering != null) {
        return rendering;
      }
    }
    return new Rendering(quantity.getValue(), quantity.getDimension());
  }

  @Nullable
  private Rendering asLambdaUnit(Quantity quantity, ExponentVector display) {
    if (display.size() != 1) {
      return null;
    }
    String symbol = display.symbols().iterator().next();
    if (!display.get(symbol).equals(Fraction.ONE)) {
      return null;
    }
    UnitEntry entry = symbols.find(symbol);
    if (entry == null || entry.getKind() != UnitEntry.Kind.LAMBDA_UNIT
        || !entry.getDimension().equals(quantity.getDimension())) {
      return null;
    }
    return new Rendering(entry.asLambdaUnit().toNumber(quantity), display);
  }

  @Nullable
  private Rendering inUnits(Quantity quantity, ExponentVector units) {
    Quantity unit = symbols.findProduct(units);
    if (unit == null || !unit.getDimension().equals(quantity.getDimension())) {
      return null;
    }
    return new Rendering(quantity.getValue() / unit.getValue(), units);
  }

  private static final class Rendering {
    final double number;
    final ExponentVector unit;

    Rendering(double number, ExponentVector unit) {
      this.number = number;
      this.unit = unit;
    }
  }
}
