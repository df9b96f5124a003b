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
import com.google.common.collect.Lists;

import com.natu.units.definitions.Expression.BinaryOperation;
import com.natu.units.definitions.Expression.Call;
import com.natu.units.definitions.Expression.LambdaExpression;
import com.natu.units.definitions.Expression.NameReference;
import com.natu.units.definitions.Expression.Negation;
import com.natu.units.definitions.Expression.NumberLiteral;
import com.natu.units.definitions.Expression.Operator;
import com.natu.units.definitions.Expression.StringLiteral;
import com.natu.units.definitions.ExpressionLexer.Token;
import com.natu.units.definitions.ExpressionLexer.Type;

/**
 * Parses the restricted expression language of definition statements.
 *
 * <pre>
 * additive       := multiplicative (('+' | '-') multiplicative)*
 * multiplicative := unary (('*' | '/') unary)*
 * unary          := ('-' | '+') unary | power
 * power          := primary ('**' unary)?
 * primary        := NUMBER | STRING | NAME | call | '(' additive ')'
 * call           := BUILTIN '(' argument (',' argument)* ')'
 * argument       := NAME '->' additive | additive
 * </pre>
 *
 * <p>{@code **} is right-associative and binds tighter than a leading minus, so {@code -2**2} is
 * {@code -4} and {@code s**-1} is a reciprocal second.  Only the {@link Builtin}s may be called,
 * and lambda arguments are only accepted by {@code LambdaUnit}.
 */
public class ExpressionParser {

  private final List<Token> tokens;
  private int position;

  private ExpressionParser(List<Token> tokens) {
    this.tokens = tokens;
  }

  /**
   * Parses {@code expression} into a tree.
   *
   * @param expression the text to parse
   * @return the root of the parsed tree
   * @throws ExpressionSyntaxException if the text is not a valid expression
   */
  public static Expression parse(String expression) {
    ExpressionParser parser = new ExpressionParser(ExpressionLexer.tokenize(expression));
    Expression result = parser.additive();
    parser.expect(Type.END);
    return result;
  }

  private Token peek() {
    return tokens.get(position);
  }

  private Token peekNext() {
    return tokens.get(Math.min(position + 1, tokens.size() - 1));
  }

  private Token advance() {
    Token token = tokens.get(position);
    if (token.type != Type.END) {
      position++;
    }
    return token;
  }

  private boolean accept(Type type) {
    if (peek().type == type) {
      advance();
      return true;
    }
    return false;
  }

  private Token expect(Type type) {
    Token token = peek();
    if (token.type != type) {
      throw unexpected(token);
    }
    return advance();
  }

  private static ExpressionSyntaxException unexpected(Token token) {
    return new ExpressionSyntaxException("Unexpected " + token, token.offset);
  }

  private Expression additive() {
    Expression left = multiplicative();
    while (true) {
      if (accept(Type.PLUS)) {
        left = new BinaryOperation(Operator.ADD, left, multiplicative());
      } else if (accept(Type.MINUS)) {
        left = new BinaryOperation(Operator.SUBTRACT, left, multiplicative());
      } else {
        return left;
      }
    }
  }

  private Expression multiplicative() {
    Expression left = unary();
    while (true) {
      if (accept(Type.STAR)) {
        left = new BinaryOperation(Operator.MULTIPLY, left, unary());
      } else if (accept(Type.SLASH)) {
        left = new BinaryOperation(Operator.DIVIDE, left, unary());
      } else {
        return left;
      }
    }
  }

  private Expression unary() {
    if (accept(Type.MINUS)) {
      return new Negation(unary());
    }
    if (accept(Type.PLUS)) {
      return unary();
    }
    return power();
  }

  private Expression power() {
    Expression base = primary();
    if (accept(Type.POWER)) {
      return new BinaryOperation(Operator.POWER, base, unary());
    }
    return base;
  }

  private Expression primary() {
    Token token = advance();
    switch (token.type) {
      case NUMBER:
        return new NumberLiteral(Double.parseDouble(token.text));
      case STRING:
        return new StringLiteral(token.text);
      case NAME:
        return peek().type == Type.LEFT_PAREN ? call(token) : new NameReference(token.text);
      case LEFT_PAREN:
        Expression inner = additive();
        expect(Type.RIGHT_PAREN);
        return inner;
      default:
        throw unexpected(token);
    }
  }

  private Expression call(Token name) {
    Builtin builtin = Builtin.fromName(name.text);
    if (builtin == null) {
      throw new ExpressionSyntaxException(
          String.format("'%s' can not be called; expected one of %s", name.text,
              Joiner.on(", ").join(Builtin.names())),
          name.offset);
    }
    expect(Type.LEFT_PAREN);
    List<Expression> arguments = Lists.newArrayList();
    if (!accept(Type.RIGHT_PAREN)) {
      do {
        arguments.add(argument(builtin));
      } while (accept(Type.COMMA));
      expect(Type.RIGHT_PAREN);
    }
    if (!builtin.acceptsArgumentCount(arguments.size())) {
      throw new ExpressionSyntaxException(String.format("%s does not take %d arguments",
          builtin, arguments.size()), name.offset);
    }
    return new Call(builtin.getFunctionName(), arguments);
  }

  private Expression argument(Builtin builtin) {
    Token token = peek();
    boolean lambda = token.type == Type.NAME && peekNext().type == Type.ARROW;
    if (lambda != builtin.takesLambdas()) {
      throw new ExpressionSyntaxException(lambda
          ? "Lambda expressions are only allowed as LambdaUnit arguments"
          : builtin + " takes lambda expressions such as 'n -> n*K'", token.offset);
    }
    if (lambda) {
      advance();
      advance();
      return new LambdaExpression(token.text, additive());
    }
    return additive();
  }
}
