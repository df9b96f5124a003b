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

import java.util.List;
import java.util.Map;

import com.google.common.base.Function;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;

import org.apache.commons.lang.math.Fraction;

import com.natu.quantity.BaseDimension;
import com.natu.quantity.ExponentVector;
import com.natu.quantity.Quantity;
import com.natu.units.LambdaUnit;
import com.natu.units.PrefixResolver;
import com.natu.units.UnitEntry;
import com.natu.units.definitions.Expression.BinaryOperation;
import com.natu.units.definitions.Expression.Call;
import com.natu.units.definitions.Expression.LambdaExpression;
import com.natu.units.definitions.Expression.NameReference;
import com.natu.units.definitions.Expression.Negation;
import com.natu.units.definitions.Expression.NumberLiteral;
import com.natu.units.definitions.Expression.StringLiteral;

/**
 * Evaluates parsed definition expressions against the symbols defined so far.
 *
 * <p>A name resolves, in order, to a lambda parameter in scope, a defined or prefixed symbol, or
 * one of the mathematical constants {@code pi} and {@code e}.  Only the {@link Builtin}s can be
 * called; nothing else in the JVM is reachable from an expression.
 */
class Evaluator implements Expression.Visitor<Value> {

  private static final Map<String, Double> MATH_CONSTANTS =
      ImmutableMap.of("pi", Math.PI, "e", Math.E);

  private static final double RATIONAL_TOLERANCE = 1e-9;

  private final PrefixResolver symbols;
  private final ImmutableMap<String, Value> parameters;

  Evaluator(PrefixResolver symbols) {
    this(symbols, ImmutableMap.<String, Value>of());
  }

  private Evaluator(PrefixResolver symbols, ImmutableMap<String, Value> parameters) {
    this.symbols = Preconditions.checkNotNull(symbols);
    this.parameters = parameters;
  }

  /**
   * Evaluates {@code expression}.
   *
   * @throws EvaluationException if the expression can not be evaluated
   * @throws com.natu.quantity.DimensionException if quantities of different dimensions are added
   * @throws ArithmeticException if a negative quantity is raised to a fractional power
   */
  Value evaluate(Expression expression) {
    return expression.accept(this);
  }

  @Override
  public Value visitNumber(NumberLiteral number) {
    return Value.number(number.getValue());
  }

  @Override
  public Value visitString(StringLiteral string) {
    return Value.string(string.getValue());
  }

  @Override
  public Value visitName(NameReference reference) {
    String name = reference.getName();
    Value parameter = parameters.get(name);
    if (parameter != null) {
      return parameter;
    }
    UnitEntry entry = symbols.find(name);
    if (entry != null) {
      return valueOf(entry);
    }
    Double constant = MATH_CONSTANTS.get(name);
    if (constant != null) {
      return Value.number(constant);
    }
    throw EvaluationException.undefined(name);
  }

  private static Value valueOf(UnitEntry entry) {
    switch (entry.getKind()) {
      case CONSTANT:
        Quantity constant = entry.asConstant().getQuantity();
        return constant.isDimensionless() && constant.getDisplay().isEmpty()
            ? Value.number(constant.getValue())
            : Value.quantity(constant, false);
      case UNIT:
        return Value.quantity(entry.asUnit().getQuantity(), true);
      default:
        return Value.lambdaUnit(entry.asLambdaUnit());
    }
  }

  @Override
  public Value visitNegation(Negation negation) {
    Value operand = evaluate(negation.getOperand());
    if (operand.getKind() == Value.Kind.NUMBER) {
      return Value.number(-operand.asNumber());
    }
    return Value.arithmetic(numeric(operand, "Negation").negate(), false);
  }

  @Override
  public Value visitBinary(BinaryOperation operation) {
    Value left = evaluate(operation.getLeft());
    Value right = evaluate(operation.getRight());
    switch (operation.getOperator()) {
      case ADD:
        return add(left, right, false);
      case SUBTRACT:
        return add(left, right, true);
      case MULTIPLY:
        return multiply(left, right);
      case DIVIDE:
        return divide(left, right);
      default:
        return power(left, right);
    }
  }

  private static Value add(Value left, Value right, boolean subtract) {
    String operation = subtract ? "Subtraction" : "Addition";
    Quantity a = numeric(left, operation);
    Quantity b = numeric(right, operation);
    if (left.getKind() == Value.Kind.NUMBER && right.getKind() == Value.Kind.NUMBER) {
      return Value.number(subtract ? a.getValue() - b.getValue() : a.getValue() + b.getValue());
    }
    return Value.arithmetic(subtract ? a.subtract(b) : a.add(b), false);
  }

  private static Value multiply(Value left, Value right) {
    if (right.getKind() == Value.Kind.LAMBDA_UNIT) {
      if (left.getKind() != Value.Kind.NUMBER) {
        throw new EvaluationException(
            "Only a plain number can be multiplied by the lambda unit " + right.describe());
      }
      return Value.quantity(right.asLambdaUnit().toQuantity(left.asNumber()), false);
    }
    if (left.getKind() == Value.Kind.LAMBDA_UNIT) {
      throw new EvaluationException("A lambda unit can only be on the right side of a product");
    }
    Quantity a = numeric(left, "Multiplication");
    Quantity b = numeric(right, "Multiplication");
    if (left.getKind() == Value.Kind.NUMBER && right.getKind() == Value.Kind.NUMBER) {
      return Value.number(a.getValue() * b.getValue());
    }
    return Value.arithmetic(a.multiply(b), left.isUnitProduct() && right.isUnitProduct());
  }

  private static Value divide(Value left, Value right) {
    if (right.getKind() == Value.Kind.LAMBDA_UNIT) {
      Quantity dividend = numeric(left, "Division by a lambda unit");
      return Value.number(right.asLambdaUnit().toNumber(dividend));
    }
    if (left.getKind() == Value.Kind.LAMBDA_UNIT) {
      throw new EvaluationException("A lambda unit can only be the denominator of a quotient");
    }
    Quantity a = numeric(left, "Division");
    Quantity b = numeric(right, "Division");
    if (left.getKind() == Value.Kind.NUMBER && right.getKind() == Value.Kind.NUMBER) {
      return Value.number(a.getValue() / b.getValue());
    }
    return Value.arithmetic(a.divide(b), left.isUnitProduct() && right.isUnitProduct());
  }

  private static Value power(Value base, Value exponent) {
    Quantity quantity = numeric(base, "Exponentiation");
    if (!exponent.isNumeric()) {
      throw new EvaluationException("An exponent must be a number, not " + exponent.describe());
    }
    double power = exponent.asNumber();
    if (base.getKind() == Value.Kind.NUMBER) {
      return Value.number(Math.pow(base.asNumber(), power));
    }
    return Value.arithmetic(quantity.power(toFraction(power)), base.isUnitProduct());
  }

  /**
   * Converts an exponent to the nearest simple fraction, failing if there is none.
   */
  private static Fraction toFraction(double power) {
    if (power == Math.rint(power) && Math.abs(power) <= Integer.MAX_VALUE) {
      return Fraction.getFraction((int) power, 1);
    }
    Fraction fraction;
    try {
      fraction = Fraction.getFraction(power);
    } catch (ArithmeticException e) {
      throw new EvaluationException("The exponent " + power + " is not a rational number");
    }
    if (Math.abs(fraction.doubleValue() - power) > RATIONAL_TOLERANCE * Math.abs(power)) {
      throw new EvaluationException("The exponent " + power + " is not a rational number");
    }
    return fraction;
  }

  private static Quantity numeric(Value value, String operation) {
    if (!value.isNumeric()) {
      throw new EvaluationException(operation + " is not supported for " + value.describe());
    }
    return value.asQuantity();
  }

  @Override
  public Value visitCall(Call call) {
    Builtin builtin = Builtin.fromName(call.getFunction());
    Preconditions.checkState(builtin != null, "Parser accepted unknown function %s", call);
    List<Expression> arguments = call.getArguments();
    switch (builtin) {
      case EXP:
        return Value.number(Math.exp(evaluate(arguments.get(0)).asNumber()));
      case LOG:
        return Value.number(Math.log(evaluate(arguments.get(0)).asNumber()));
      case LOG10:
        return Value.number(Math.log10(evaluate(arguments.get(0)).asNumber()));
      case SQRT:
        Value radicand = evaluate(arguments.get(0));
        return Value.arithmetic(numeric(radicand, "sqrt").power(Fraction.ONE_HALF),
            radicand.isUnitProduct());
      case QUANTITY:
        return Value.quantity(construct(arguments), false);
      case SCALAR_UNIT:
        return Value.explicitUnit(construct(arguments));
      default:
        return Value.lambdaUnit(lambdaUnit(arguments));
    }
  }

  private Quantity construct(List<Expression> arguments) {
    double value = evaluate(arguments.get(0)).asNumber();
    String dimensionText = evaluate(arguments.get(1)).asString();
    String displayText = arguments.size() > 2 ? evaluate(arguments.get(2)).asString() : "";
    try {
      return Quantity.of(value, BaseDimension.parse(dimensionText),
          ExponentVector.parse(displayText));
    } catch (IllegalArgumentException e) {
      throw new EvaluationException(e.getMessage());
    }
  }

  private LambdaUnit lambdaUnit(List<Expression> arguments) {
    final LambdaExpression forward = (LambdaExpression) arguments.get(0);
    final LambdaExpression inverse = (LambdaExpression) arguments.get(1);
    Function<Double, Quantity> toQuantity = new Function<Double, Quantity>() {
      @Override public Quantity apply(Double number) {
        return bind(forward, Value.number(number)).asQuantity();
      }
    };
    Function<Quantity, Double> toNumber = new Function<Quantity, Double>() {
      @Override public Double apply(Quantity quantity) {
        return bind(inverse, Value.arithmetic(quantity, false)).asNumber();
      }
    };
    return LambdaUnit.create(Builtin.LAMBDA_UNIT.getFunctionName(), toQuantity, toNumber, false);
  }

  private Value bind(LambdaExpression lambda, Value argument) {
    Map<String, Value> scope = Maps.newHashMap(parameters);
    scope.put(lambda.getParameter(), argument);
    return new Evaluator(symbols, ImmutableMap.copyOf(scope)).evaluate(lambda.getBody());
  }

  @Override
  public Value visitLambda(LambdaExpression lambda) {
    throw new EvaluationException("A lambda expression can only be an argument of LambdaUnit");
  }
}
