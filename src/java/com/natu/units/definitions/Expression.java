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

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * A node of a parsed definition expression.  Expressions are immutable trees built by
 * {@link ExpressionParser}.
 */
public abstract class Expression {

  /**
   * Visits each kind of expression node.
   *
   * @param <R> the result type of the visit
   */
  public interface Visitor<R> {
    R visitNumber(NumberLiteral number);

    R visitString(StringLiteral string);

    R visitName(NameReference name);

    R visitNegation(Negation negation);

    R visitBinary(BinaryOperation operation);

    R visitCall(Call call);

    R visitLambda(LambdaExpression lambda);
  }

  /**
   * The binary arithmetic operators.
   */
  public enum Operator {
    ADD("+"),
    SUBTRACT("-"),
    MULTIPLY("*"),
    DIVIDE("/"),
    POWER("**");

    private final String symbol;

    private Operator(String symbol) {
      this.symbol = symbol;
    }

    @Override
    public String toString() {
      return symbol;
    }
  }

  private Expression() {
    // Closed hierarchy.
  }

  public abstract <R> R accept(Visitor<R> visitor);

  public static final class NumberLiteral extends Expression {
    private final double value;

    NumberLiteral(double value) {
      this.value = value;
    }

    public double getValue() {
      return value;
    }

    @Override public <R> R accept(Visitor<R> visitor) {
      return visitor.visitNumber(this);
    }

    @Override public String toString() {
      return String.valueOf(value);
    }
  }

  public static final class StringLiteral extends Expression {
    private final String value;

    StringLiteral(String value) {
      this.value = Preconditions.checkNotNull(value);
    }

    public String getValue() {
      return value;
    }

    @Override public <R> R accept(Visitor<R> visitor) {
      return visitor.visitString(this);
    }

    @Override public String toString() {
      return "'" + value + "'";
    }
  }

  public static final class NameReference extends Expression {
    private final String name;

    NameReference(String name) {
      this.name = Preconditions.checkNotNull(name);
    }

    public String getName() {
      return name;
    }

    @Override public <R> R accept(Visitor<R> visitor) {
      return visitor.visitName(this);
    }

    @Override public String toString() {
      return name;
    }
  }

  public static final class Negation extends Expression {
    private final Expression operand;

    Negation(Expression operand) {
      this.operand = Preconditions.checkNotNull(operand);
    }

    public Expression getOperand() {
      return operand;
    }

    @Override public <R> R accept(Visitor<R> visitor) {
      return visitor.visitNegation(this);
    }

    @Override public String toString() {
      return "-(" + operand + ")";
    }
  }

  public static final class BinaryOperation extends Expression {
    private final Operator operator;
    private final Expression left;
    private final Expression right;

    BinaryOperation(Operator operator, Expression left, Expression right) {
      this.operator = Preconditions.checkNotNull(operator);
      this.left = Preconditions.checkNotNull(left);
      this.right = Preconditions.checkNotNull(right);
    }

    public Operator getOperator() {
      return operator;
    }

    public Expression getLeft() {
      return left;
    }

    public Expression getRight() {
      return right;
    }

    @Override public <R> R accept(Visitor<R> visitor) {
      return visitor.visitBinary(this);
    }

    @Override public String toString() {
      return "(" + left + " " + operator + " " + right + ")";
    }
  }

  public static final class Call extends Expression {
    private final String function;
    private final ImmutableList<Expression> arguments;

    Call(String function, List<Expression> arguments) {
      this.function = Preconditions.checkNotNull(function);
      this.arguments = ImmutableList.copyOf(arguments);
    }

    public String getFunction() {
      return function;
    }

    public ImmutableList<Expression> getArguments() {
      return arguments;
    }

    @Override public <R> R accept(Visitor<R> visitor) {
      return visitor.visitCall(this);
    }

    @Override public String toString() {
      return function + "(" + Joiner.on(", ").join(arguments) + ")";
    }
  }

  /**
   * A one-parameter function such as {@code n -> (n + 273.15)*K}.  Lambdas only appear as the
   * arguments of {@code LambdaUnit(...)}.
   */
  public static final class LambdaExpression extends Expression {
    private final String parameter;
    private final Expression body;

    LambdaExpression(String parameter, Expression body) {
      this.parameter = Preconditions.checkNotNull(parameter);
      this.body = Preconditions.checkNotNull(body);
    }

    public String getParameter() {
      return parameter;
    }

    public Expression getBody() {
      return body;
    }

    @Override public <R> R accept(Visitor<R> visitor) {
      return visitor.visitLambda(this);
    }

    @Override public String toString() {
      return parameter + " -> " + body;
    }
  }
}
