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

import java.util.List;
import java.util.Map;
import java.util.Map.Entry;

import javax.annotation.Nullable;

import com.google.common.base.CharMatcher;
import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;

import org.apache.commons.lang.StringUtils;
import org.apache.commons.lang.math.Fraction;

import com.natu.quantity.ExponentVector;

/**
 * The text styles a unit or quantity can be rendered in.
 *
 * <p>Factors are listed largest exponent magnitude first.  An exponent of one is omitted.  Styles
 * with a division sign show negative exponents as a denominator, grouping several factors in
 * parentheses; the others show them as negative exponents.
 */
public enum UnitStyle {
  /**
   * {@code kg*m2/s2}, with fractional exponents as {@code m(1/2)}.
   */
  PLAIN("*", "/", " "),

  /**
   * {@code kg&nbsp;m<sup>2</sup>&nbsp;s<sup>-2</sup>}.
   */
  HTML("&nbsp;", null, "&nbsp;") {
    @Override String exponent(Fraction exponent) {
      return "<sup>" + number(exponent) + "</sup>";
    }

    @Override String formatNumber(String number) {
      return rewriteScientific(number, "&times;10<sup>", "</sup>");
    }
  },

  /**
   * LaTeX math mode: {@code \mathrm{kg}\,\mathrm{m}^2\,\mathrm{s}^{-2}}.
   */
  LATEX("\\,", null, "\\,") {
    @Override String symbol(String symbol) {
      return "\\mathrm{" + symbol + "}";
    }

    @Override String exponent(Fraction exponent) {
      return exponent.getDenominator() != 1 || exponent.getNumerator() < 0
          ? "^{" + number(exponent) + "}"
          : "^" + number(exponent);
    }

    @Override String group(String text) {
      return "\\left(" + text + "\\right)";
    }

    @Override String formatNumber(String number) {
      return rewriteScientific(number, " \\times 10^{", "}");
    }
  },

  /**
   * The unit syntax of the Modelica language: {@code kg.m2/s2}.
   */
  MODELICA(".", "/", " "),

  /**
   * {@code kg m² s⁻²}.  Fractional exponents fall back to {@code m^(1/2)}.
   */
  UNICODE(" ", null, " ") {
    @Override String exponent(Fraction exponent) {
      return exponent.getDenominator() == 1
          ? superscript(number(exponent))
          : "^(" + number(exponent) + ")";
    }

    @Override String formatNumber(String number) {
      int exponentStart = StringUtils.indexOfAny(number, "eE");
      if (exponentStart < 0) {
        return number;
      }
      return number.substring(0, exponentStart) + "×10"
          + superscript(trimExponent(number.substring(exponentStart + 1)));
    }
  },

  /**
   * {@code kg * m**2 / s**2}.
   */
  VERBOSE(" * ", " / ", " ") {
    @Override String exponent(Fraction exponent) {
      return exponent.getDenominator() == 1
          ? "**" + number(exponent)
          : "**(" + number(exponent) + ")";
    }
  };

  private static final Map<Character, Character> SUPERSCRIPTS =
      ImmutableMap.<Character, Character>builder()
          .put('0', '⁰').put('1', '¹').put('2', '²').put('3', '³')
          .put('4', '⁴').put('5', '⁵').put('6', '⁶').put('7', '⁷')
          .put('8', '⁸').put('9', '⁹').put('-', '⁻')
          .build();

  private final String multiplication;
  @Nullable private final String division;
  private final String separator;

  private UnitStyle(String multiplication, @Nullable String division, String separator) {
    this.multiplication = multiplication;
    this.division = division;
    this.separator = separator;
  }

  /**
   * Returns the text placed between a number and its unit.
   */
  public String separator() {
    return separator;
  }

  String symbol(String symbol) {
    return symbol;
  }

  String exponent(Fraction exponent) {
    return exponent.getDenominator() == 1
        ? number(exponent)
        : "(" + number(exponent) + ")";
  }

  String group(String text) {
    return "(" + text + ")";
  }

  /**
   * Rewrites the scientific notation of a formatted number for this style.
   */
  String formatNumber(String number) {
    return number;
  }

  /**
   * Renders a unit.
   *
   * @param unit the factors to render
   * @param replacements symbols to show differently in this style, such as {@code ohm} as
   *     {@code Ω}; a replaced symbol is used verbatim
   * @return the rendered unit, or the empty string for an empty vector
   */
  public String format(ExponentVector unit, Map<String, String> replacements) {
    Preconditions.checkNotNull(unit);
    Preconditions.checkNotNull(replacements);
    if (unit.isEmpty()) {
      return "";
    }

    List<String> numerator = Lists.newArrayList();
    List<String> denominator = Lists.newArrayList();
    for (Entry<String, Fraction> factor : unit.factors()) {
      String replaced = replacements.get(factor.getKey());
      String base = replaced != null ? replaced : symbol(factor.getKey());
      Fraction exponent = factor.getValue();
      boolean positive = exponent.getNumerator() > 0;
      if (division != null) {
        exponent = exponent.abs();
      }
      String term = exponent.equals(Fraction.ONE) ? base : base + exponent(exponent);
      (positive || division == null ? numerator : denominator).add(term);
    }

    if (division == null) {
      return Joiner.on(multiplication).join(numerator);
    }
    String top = numerator.isEmpty() ? "1" : Joiner.on(multiplication).join(numerator);
    if (denominator.isEmpty()) {
      return top;
    }
    String bottom = Joiner.on(multiplication).join(denominator);
    return top + division + (denominator.size() > 1 ? group(bottom) : bottom);
  }

  public String format(ExponentVector unit) {
    return format(unit, ImmutableMap.<String, String>of());
  }

  static String number(Fraction exponent) {
    return exponent.getDenominator() == 1
        ? String.valueOf(exponent.getNumerator())
        : exponent.getNumerator() + "/" + exponent.getDenominator();
  }

  static String superscript(String digits) {
    StringBuilder result = new StringBuilder(digits.length());
    for (char c : digits.toCharArray()) {
      Character superscript = SUPERSCRIPTS.get(c);
      result.append(superscript != null ? superscript.charValue() : c);
    }
    return result.toString();
  }

  static String rewriteScientific(String number, String before, String after) {
    int exponentStart = StringUtils.indexOfAny(number, "eE");
    if (exponentStart < 0) {
      return number;
    }
    return number.substring(0, exponentStart) + before
        + trimExponent(number.substring(exponentStart + 1)) + after;
  }

  /**
   * Drops a plus sign and leading zeros from a decimal exponent: {@code +05} becomes {@code 5}.
   */
  static String trimExponent(String exponent) {
    String unsigned = CharMatcher.is('+').trimLeadingFrom(exponent);
    boolean negative = unsigned.startsWith("-");
    String digits =
        CharMatcher.is('0').trimLeadingFrom(negative ? unsigned.substring(1) : unsigned);
    if (digits.isEmpty()) {
      digits = "0";
    }
    return negative ? "-" + digits : digits;
  }
}
