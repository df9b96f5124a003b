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
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import javax.annotation.Nullable;

import com.google.common.base.Function;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import org.apache.commons.lang.math.Fraction;

import com.natu.format.NumberFormats;
import com.natu.format.QuantityFormatter;
import com.natu.format.UnitStyle;
import com.natu.quantity.ExponentVector;
import com.natu.quantity.IncompatibleUnitException;
import com.natu.quantity.Quantity;
import com.natu.units.definitions.DefinitionException;
import com.natu.units.definitions.DefinitionLoader;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * One unit system: the constants and units defined by a {@link UnitSystemConfig}, with lookup,
 * conversion and formatting.
 *
 * <pre>
 * UnitRegistry si = UnitRegistry.load(UnitSystemConfig.defaults());
 * Quantity speed = si.quantity(100, "km/hr");
 * double mps = si.convert(speed, "m/s");          // 27.77...
 * String text = si.format(si.quantity(1, "J"));   // "1.0 J"
 * </pre>
 *
 * <p>A registry is immutable and thread safe.  Registries of different unit systems are fully
 * independent; quantities from one should not be mixed with quantities from another.
 */
public final class UnitRegistry {

  private static final Pattern QUANTITY_TEXT = Pattern.compile(
      "\\s*([-+]?(?:\\d+\\.?\\d*|\\.\\d+)(?:[eE][-+]?\\d+)?)\\s*(.*?)\\s*");

  private final UnitSystemConfig config;
  private final SymbolTable table;
  private final PrefixResolver resolver;
  private final CoherentSimplifier simplifier;
  private final QuantityFormatter formatter;

  private UnitRegistry(UnitSystemConfig config, SymbolTable table) {
    this.config = Preconditions.checkNotNull(config);
    this.table = Preconditions.checkNotNull(table);
    this.resolver = PrefixResolver.forTable(table);
    this.simplifier = new CoherentSimplifier(table);
    this.formatter = new QuantityFormatter(resolver, simplifier,
        config.getSimplificationLevel(), config.getUnitReplacements());
  }

  /**
   * Builds the unit system described by {@code config}.
   *
   * @param config the definition sources and settings
   * @return the new registry
   * @throws DefinitionException if the definitions can not be loaded; no registry is created
   */
  public static UnitRegistry load(UnitSystemConfig config) throws DefinitionException {
    SymbolTable table = new DefinitionLoader().load(config.getDefinitions());
    return new UnitRegistry(config, table);
  }

  /**
   * Wraps a table that has already been built.
   */
  public static UnitRegistry of(UnitSystemConfig config, SymbolTable table) {
    return new UnitRegistry(config, table);
  }

  public UnitSystemConfig getConfig() {
    return config;
  }

  public SymbolTable getSymbolTable() {
    return table;
  }

  /**
   * Looks up a constant or unit, trying SI prefixes if {@code name} is not defined exactly.
   *
   * @param name the symbol, such as {@code c}, {@code m} or {@code km}
   * @return the entry
   * @throws UnitNotFoundException if the name is unknown
   */
  public UnitEntry lookup(String name) {
    return resolver.lookup(name);
  }

  @Nullable
  public UnitEntry find(String name) {
    return resolver.find(name);
  }

  public boolean contains(String name) {
    return resolver.find(name) != null;
  }

  /**
   * Evaluates a compound unit expression such as {@code lbf/inch2} or {@code km/hr}.  The result
   * is displayed as the expression.
   *
   * @param expression a product of powers of units and constants
   * @return one of the compound unit
   * @throws IllegalArgumentException if the expression is malformed or uses a lambda unit
   * @throws UnitNotFoundException if a symbol is unknown
   */
  public Quantity unit(String expression) {
    ExponentVector units = parseUnits(expression);
    for (String symbol : units.symbols()) {
      UnitEntry entry = lookup(symbol);
      checkArgument(entry.getKind() != UnitEntry.Kind.LAMBDA_UNIT,
          "The lambda unit %s can not be combined with other units in '%s'", symbol, expression);
    }
    Quantity unit = resolver.findProduct(units);
    Preconditions.checkState(unit != null, "Unresolvable units in '%s'", expression);
    return unit;
  }

  /**
   * A defined name is taken as a single unit even where it is not a valid factor of a unit
   * expression, as with {@code %}.
   */
  private ExponentVector parseUnits(String expression) {
    Preconditions.checkNotNull(expression);
    String name = expression.trim();
    if (!name.isEmpty() && resolver.find(name) != null) {
      return ExponentVector.of(name);
    }
    return ExponentVector.parse(expression);
  }

  /**
   * Returns {@code number} of the given unit, as in {@code 25 degC} or {@code 3 ft/s}.
   */
  public Quantity quantity(double number, String unitExpression) {
    LambdaUnit lambda = asLambdaUnit(unitExpression);
    if (lambda != null) {
      return lambda.toQuantity(number);
    }
    Quantity unit = unit(unitExpression);
    return unit.multiply(number);
  }

  /**
   * Expresses {@code quantity} as a number of the given unit.
   *
   * @param quantity the quantity to convert
   * @param unitExpression a unit name or compound unit expression
   * @return the number of units
   * @throws IncompatibleUnitException if the unit has another dimension
   */
  public double convert(Quantity quantity, String unitExpression) {
    LambdaUnit lambda = asLambdaUnit(unitExpression);
    if (lambda != null) {
      return lambda.toNumber(quantity);
    }
    return quantity.convertTo(unit(unitExpression));
  }

  @Nullable
  private LambdaUnit asLambdaUnit(String unitExpression) {
    ExponentVector units = parseUnits(unitExpression);
    if (units.size() != 1) {
      return null;
    }
    Map.Entry<String, Fraction> only = units.asMap().entrySet().iterator().next();
    UnitEntry entry = lookup(only.getKey());
    if (entry.getKind() != UnitEntry.Kind.LAMBDA_UNIT) {
      return null;
    }
    checkArgument(only.getValue().equals(Fraction.ONE),
        "The lambda unit %s can not be raised to a power", only.getKey());
    return entry.asLambdaUnit();
  }

  /**
   * Parses text such as {@code "9.81 m/s2"} or {@code "25 degC"}: a number optionally followed by
   * a unit expression.
   *
   * @throws IllegalArgumentException if the text does not start with a number
   */
  public Quantity parseQuantity(String text) {
    Preconditions.checkNotNull(text);
    Matcher matcher = QUANTITY_TEXT.matcher(text);
    checkArgument(matcher.matches(),
        "Value '%s' must be a number followed by a unit, such as 9.81 m/s2", text);
    double number = Double.parseDouble(matcher.group(1));
    String unit = matcher.group(2);
    return unit.isEmpty() ? Quantity.of(number) : quantity(number, unit);
  }

  /**
   * Formats {@code quantity} as plain text, as in {@code 1.0 J}.
   */
  public String format(Quantity quantity) {
    return format(quantity, UnitStyle.PLAIN);
  }

  public String format(Quantity quantity, UnitStyle style) {
    return format(quantity, style, NumberFormats.DEFAULT);
  }

  /**
   * Formats {@code quantity} in the given style.
   *
   * @param quantity the quantity to format
   * @param style the text style
   * @param numberFormat renders the number, see {@link NumberFormats}
   * @return the formatted quantity
   */
  public String format(Quantity quantity, UnitStyle style, Function<Double, String> numberFormat) {
    return formatter.format(quantity, style, numberFormat);
  }

  /**
   * Simplifies a display unit at the configured simplification level.
   */
  public ExponentVector simplify(ExponentVector unit) {
    return simplifier.simplify(unit, config.getSimplificationLevel());
  }

  public ExponentVector simplify(ExponentVector unit, int level) {
    return simplifier.simplify(unit, level);
  }

  /**
   * Finds a product of coherent units with the given dimension.
   *
   * @return the units, or {@code null} if there is no such product
   */
  @Nullable
  public ExponentVector findUnitsFor(ExponentVector dimension) {
    return simplifier.findUnitsFor(dimension);
  }

  /**
   * Returns the constants in definition order.
   */
  public ImmutableList<Constant> constants() {
    ImmutableList.Builder<Constant> constants = ImmutableList.builder();
    for (UnitEntry entry : table.entries()) {
      if (entry.getKind() == UnitEntry.Kind.CONSTANT) {
        constants.add(entry.asConstant());
      }
    }
    return constants.build();
  }

  /**
   * Returns the scalar and lambda units in definition order.
   */
  public ImmutableList<UnitEntry> units() {
    ImmutableList.Builder<UnitEntry> units = ImmutableList.builder();
    for (UnitEntry entry : table.entries()) {
      if (entry.getKind() != UnitEntry.Kind.CONSTANT) {
        units.add(entry);
      }
    }
    return units.build();
  }

  /**
   * Returns the units of the given dimension in definition order, as in all units of energy.
   */
  public ImmutableList<UnitEntry> unitsWithDimension(ExponentVector dimension) {
    Preconditions.checkNotNull(dimension);
    ImmutableList.Builder<UnitEntry> units = ImmutableList.builder();
    for (UnitEntry entry : units()) {
      if (entry.getDimension().equals(dimension)) {
        units.add(entry);
      }
    }
    return units.build();
  }

  public ImmutableSet<String> prefixableSymbols() {
    ImmutableSet.Builder<String> symbols = ImmutableSet.builder();
    for (UnitEntry entry : table.entries()) {
      if (entry.isPrefixable()) {
        symbols.add(entry.getName());
      }
    }
    return symbols.build();
  }

  public ImmutableList<ExponentVector> coherentRelations() {
    return table.getCoherentRelations();
  }

  public ImmutableList<ScalarUnit> coherentUnits() {
    return simplifier.getCoherentUnits();
  }

  @Override
  public String toString() {
    return String.format("UnitRegistry(%d symbols from %s)", table.size(),
        config.getDefinitions());
  }
}
