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
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.google.common.base.CharMatcher;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * Splits a definition expression into tokens.
 */
class ExpressionLexer {

  /**
   * The kinds of token in an expression.
   */
  enum Type {
    NUMBER,
    STRING,
    NAME,
    PLUS,
    MINUS,
    STAR,
    SLASH,
    POWER,
    LEFT_PAREN,
    RIGHT_PAREN,
    COMMA,
    ARROW,
    END
  }

  static final class Token {
    final Type type;
    final String text;
    final int offset;

    Token(Type type, String text, int offset) {
      this.type = type;
      this.text = text;
      this.offset = offset;
    }

    @Override
    public String toString() {
      return type == Type.END ? "end of expression" : "'" + text + "'";
    }
  }

  private static final Pattern NUMBER =
      Pattern.compile("(?:\\d+\\.?\\d*|\\.\\d+)(?:[eE][+-]?\\d+)?");
  private static final Pattern NAME = Pattern.compile("[A-Za-z_][A-Za-z_0-9]*");

  private ExpressionLexer() {
    // Utility.
  }

  /**
   * Tokenizes {@code expression}.  The returned list always ends with an {@link Type#END} token.
   *
   * @throws ExpressionSyntaxException if the expression contains an unexpected character or an
   *     unterminated string
   */
  static List<Token> tokenize(String expression) {
    Preconditions.checkNotNull(expression);
    ImmutableList.Builder<Token> tokens = ImmutableList.builder();
    int position = 0;
    int length = expression.length();
    while (position < length) {
      char c = expression.charAt(position);
      if (CharMatcher.whitespace().matches(c)) {
        position++;
        continue;
      }

      Matcher number = NUMBER.matcher(expression).region(position, length);
      Matcher name = NAME.matcher(expression).region(position, length);
      if ((Character.isDigit(c) || c == '.') && number.lookingAt()) {
        tokens.add(new Token(Type.NUMBER, number.group(), position));
        position = number.end();
      } else if (name.lookingAt()) {
        tokens.add(new Token(Type.NAME, name.group(), position));
        position = name.end();
      } else if (c == '\'' || c == '"') {
        int close = expression.indexOf(c, position + 1);
        if (close < 0) {
          throw new ExpressionSyntaxException("Unterminated string", position);
        }
        tokens.add(new Token(Type.STRING, expression.substring(position + 1, close), position));
        position = close + 1;
      } else if (expression.startsWith("**", position)) {
        tokens.add(new Token(Type.POWER, "**", position));
        position += 2;
      } else if (expression.startsWith("->", position)) {
        tokens.add(new Token(Type.ARROW, "->", position));
        position += 2;
      } else {
        tokens.add(new Token(single(c, position), String.valueOf(c), position));
        position++;
      }
    }
    tokens.add(new Token(Type.END, "", length));
    return tokens.build();
  }

  private static Type single(char c, int position) {
    switch (c) {
      case '+':
        return Type.PLUS;
      case '-':
        return Type.MINUS;
      case '*':
        return Type.STAR;
      case '/':
        return Type.SLASH;
      case '(':
        return Type.LEFT_PAREN;
      case ')':
        return Type.RIGHT_PAREN;
      case ',':
        return Type.COMMA;
      default:
        throw new ExpressionSyntaxException("Unexpected character '" + c + "'", position);
    }
  }
}
