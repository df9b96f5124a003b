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

import java.io.IOException;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.google.common.base.Preconditions;

import com.natu.quantity.ExponentVector;
import com.natu.quantity.Quantity;
import com.natu.units.Constant;
import com.natu.units.PrefixResolver;
import com.natu.units.ScalarUnit;
import com.natu.units.SymbolTable;
import com.natu.units.UnitEntry;

/**
 * Builds a {@link SymbolTable} by evaluating the statements of one or more definition sources in
 * order.
 *
 * <p>Each statement is evaluated against the symbols bound by all statements before it, including
 * those of earlier sources.  What gets bound depends on the statement:
 * <ul>
 *   <li>{@code symbol = expression, True} or {@code , False} binds a unit, prefixable or not.
 *   <li>{@code symbol = expression} binds a constant, unless the expression evaluates to a lambda
 *       unit or an explicit {@code ScalarUnit(...)}, which bind a unit that is not prefixable.
 * </ul>
 * A unit defined purely as a product of powers of other units, such as {@code J = N*m, True},
 * also records the coherent relation {@code N*m/J = 1}.
 *
 * <p>A symbol that is defined again replaces the earlier definition; the replacement is logged as
 * a warning.  Any error aborts the whole load.
 */
public class DefinitionLoader {

  private static final Logger LOG = Logger.getLogger(DefinitionLoader.class.getName());

  private final DefinitionReader reader;

  public DefinitionLoader() {
    this(new DefinitionReader());
  }

  public DefinitionLoader(DefinitionReader reader) {
    this.reader = Preconditions.checkNotNull(reader);
  }

  /**
   * Loads the given sources, in order, into a new symbol table.
   *
   * @param sources the definition sources
   * @return the frozen table
   * @throws DefinitionException if a source can not be read or a statement can not be parsed,
   *     evaluated or bound
   */
  public SymbolTable load(List<DefinitionSource> sources) throws DefinitionException {
    Preconditions.checkNotNull(sources);
    SymbolTable.Builder builder = SymbolTable.builder();
    Evaluator evaluator = new Evaluator(PrefixResolver.forBuilder(builder));

    for (DefinitionSource source : sources) {
      List<DefinitionStatement> statements;
      try {
        statements = reader.read(source);
      } catch (IOException e) {
        throw new DefinitionException("Failed to read definitions: " + e.getMessage(),
            source.getName(), 0, null, e);
      }
      for (DefinitionStatement statement : statements) {
        define(builder, evaluator, statement);
      }
      LOG.info(String.format("Loaded %d definitions from %s", statements.size(),
          source.getName()));
    }

    SymbolTable table = builder.build();
    LOG.info(String.format("Unit system has %d symbols and %d coherent relations", table.size(),
        table.getCoherentRelations().size()));
    return table;
  }

  private void define(SymbolTable.Builder builder, Evaluator evaluator,
      DefinitionStatement statement) throws DefinitionException {
    Value value = evaluate(evaluator, statement);
    UnitEntry entry = bind(statement, value);
    UnitEntry previous = builder.define(entry);
    if (previous != null) {
      LOG.warning(String.format("In section %s of %s, overriding previous value of %s",
          statement.getSection(), statement.getSource(), statement.getSymbol()));
    }
    if (statement.hasUnitFlag() && value.isUnitProduct()) {
      ExponentVector relation =
          value.asQuantity().getDisplay().divide(ExponentVector.of(statement.getSymbol()));
      if (!relation.isEmpty()) {
        builder.addCoherentRelation(relation);
      }
    }
    if (LOG.isLoggable(Level.FINE)) {
      LOG.fine(String.format("%s: %s", statement.getLocator(), entry));
    }
  }

  private static Value evaluate(Evaluator evaluator, DefinitionStatement statement)
      throws DefinitionException {
    Expression expression;
    try {
      expression = ExpressionParser.parse(statement.getExpression());
    } catch (ExpressionSyntaxException e) {
      throw new DefinitionParseException(
          "Malformed expression '" + statement.getExpression() + "': " + e.getMessage(),
          statement, e);
    }

    try {
      return evaluator.evaluate(expression);
    } catch (EvaluationException e) {
      if (e.getUndefinedName() != null) {
        throw new UndefinedSymbolException(e.getUndefinedName(), statement);
      }
      throw new DefinitionException(e.getMessage(), statement, e);
    } catch (IllegalArgumentException e) {
      throw new DefinitionException(e.getMessage(), statement, e);
    } catch (ArithmeticException e) {
      throw new DefinitionException(e.getMessage(), statement, e);
    }
  }

  private static UnitEntry bind(DefinitionStatement statement, Value value)
      throws DefinitionException {
    String symbol = statement.getSymbol();
    switch (value.getKind()) {
      case LAMBDA_UNIT:
        return value.asLambdaUnit().rename(symbol, Boolean.TRUE.equals(statement.getPrefixable()));
      case STRING:
        throw new DefinitionException("A string can not be bound to a symbol", statement, null);
      default:
        break;
    }

    Quantity quantity = value.asQuantity();
    if (!statement.hasUnitFlag()) {
      return value.isExplicitUnit()
          ? new ScalarUnit(symbol, quantity.getValue(), quantity.getDimension(), false)
          : new Constant(symbol, quantity);
    }
    return new ScalarUnit(symbol, quantity.getValue(), quantity.getDimension(),
        statement.getPrefixable());
  }
}
