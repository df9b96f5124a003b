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

import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.ComparisonChain;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

import org.apache.commons.lang.StringUtils;
import org.apache.commons.lang.math.Fraction;

/**
 * An immutable product of named symbols raised to rational exponents, such as {@code kg*m2/s2}.
 *
 * <p>The same type expresses both the physical dimension of a quantity (over the
 * {@link BaseDimension} alphabet) and its display unit (over unit symbols).  All operations act on
 * the exponents: multiplying two vectors adds exponents per symbol, dividing subtracts them and
 * raising to a power scales them.  Symbols whose exponent becomes zero are dropped, so two vectors
 * are equal exactly when they hold the same set of (symbol, exponent) pairs.
 */
public final class ExponentVector {

  /**
   * The vector with no factors; the dimension of a pure number.
   */
  public static final ExponentVector EMPTY =
      new ExponentVector(ImmutableSortedMap.<String, Fraction>of());

  /**
   * Orders factors for display: largest exponent magnitude first, then alphabetically.
   */
  public static final Comparator<Entry<String, Fraction>> DISPLAY_ORDER =
      new Comparator<Entry<String, Fraction>>() {
        @Override public int compare(Entry<String, Fraction> a, Entry<String, Fraction> b) {
          return ComparisonChain.start()
              .compare(b.getValue().abs(), a.getValue().abs())
              .compare(a.getKey(), b.getKey())
              .result();
        }
      };

  private final ImmutableSortedMap<String, Fraction> exponents;

  private ExponentVector(ImmutableSortedMap<String, Fraction> exponents) {
    this.exponents = exponents;
  }

  /**
   * Creates a vector of a single symbol raised to the first power.
   */
  public static ExponentVector of(String symbol) {
    return of(symbol, Fraction.ONE);
  }

  public static ExponentVector of(String symbol, int exponent) {
    return of(symbol, Fraction.getFraction(exponent, 1));
  }

  public static ExponentVector of(String symbol, Fraction exponent) {
    Preconditions.checkArgument(StringUtils.isNotBlank(symbol), "A symbol must be non-blank");
    Preconditions.checkNotNull(exponent);
    return copyOf(ImmutableSortedMap.of(symbol, exponent));
  }

  /**
   * Creates a vector from a map of symbols to exponents.  Zero exponents are dropped.
   *
   * @param exponents the exponent of each symbol
   * @return the canonical vector for {@code exponents}
   */
  public static ExponentVector copyOf(Map<String, Fraction> exponents) {
    Preconditions.checkNotNull(exponents);
    ImmutableSortedMap.Builder<String, Fraction> builder = ImmutableSortedMap.naturalOrder();
    for (Entry<String, Fraction> entry : exponents.entrySet()) {
      Fraction exponent = Preconditions.checkNotNull(entry.getValue()).reduce();
      if (exponent.getNumerator() != 0) {
        builder.put(entry.getKey(), exponent);
      }
    }
    ImmutableSortedMap<String, Fraction> canonical = builder.build();
    return canonical.isEmpty() ? EMPTY : new ExponentVector(canonical);
  }

  /**
   * Returns the exponent of {@code symbol}, which is zero for symbols not in this vector.
   */
  public Fraction get(String symbol) {
    Fraction exponent = exponents.get(symbol);
    return exponent == null ? Fraction.ZERO : exponent;
  }

  public boolean contains(String symbol) {
    return exponents.containsKey(symbol);
  }

  public Set<String> symbols() {
    return exponents.keySet();
  }

  public ImmutableSortedMap<String, Fraction> asMap() {
    return exponents;
  }

  public boolean isEmpty() {
    return exponents.isEmpty();
  }

  public int size() {
    return exponents.size();
  }

  /**
   * Returns true if every exponent in this vector is a whole number.
   */
  public boolean hasIntegerExponents() {
    for (Fraction exponent : exponents.values()) {
      if (exponent.getDenominator() != 1) {
        return false;
      }
    }
    return true;
  }

  /**
   * Returns the sum of the absolute values of the exponents.  A smaller norm reads as a simpler
   * unit.
   */
  public Fraction norm() {
    Fraction sum = Fraction.ZERO;
    for (Fraction exponent : exponents.values()) {
      sum = sum.add(exponent.abs());
    }
    return sum;
  }

  public ExponentVector multiply(ExponentVector other) {
    return combine(other, false);
  }

  public ExponentVector divide(ExponentVector other) {
    return combine(other, true);
  }

  private ExponentVector combine(ExponentVector other, boolean subtract) {
    Preconditions.checkNotNull(other);
    if (other.isEmpty()) {
      return this;
    }
    Map<String, Fraction> sum = new TreeMap<String, Fraction>(exponents);
    for (Entry<String, Fraction> entry : other.exponents.entrySet()) {
      Fraction exponent = subtract ? entry.getValue().negate() : entry.getValue();
      Fraction current = sum.get(entry.getKey());
      sum.put(entry.getKey(), current == null ? exponent : current.add(exponent));
    }
    return copyOf(sum);
  }

  public ExponentVector power(int power) {
    return power(Fraction.getFraction(power, 1));
  }

  public ExponentVector power(Fraction power) {
    Preconditions.checkNotNull(power);
    if (power.getNumerator() == 0) {
      return EMPTY;
    }
    Map<String, Fraction> scaled = Maps.newTreeMap();
    for (Entry<String, Fraction> entry : exponents.entrySet()) {
      scaled.put(entry.getKey(), entry.getValue().multiplyBy(power));
    }
    return copyOf(scaled);
  }

  public ExponentVector negate() {
    return power(-1);
  }

  /**
   * Returns the factors of this vector in display order.
   */
  public List<Entry<String, Fraction>> factors() {
    List<Entry<String, Fraction>> factors = Lists.newArrayList(exponents.entrySet());
    Collections.sort(factors, DISPLAY_ORDER);
    return ImmutableList.copyOf(factors);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof ExponentVector)) {
      return false;
    }
    return exponents.equals(((ExponentVector) obj).exponents);
  }

  @Override
  public int hashCode() {
    return exponents.hashCode();
  }

  /**
   * Renders the vector with {@code *} for multiplication and {@code /} for division, grouping a
   * multi-factor denominator in parentheses.  Exponents follow their symbols directly; fractional
   * exponents are parenthesized, as in {@code m(1/2)}.  The result can be read back with
   * {@link #parse(String)}.
   */
  @Override
  public String toString() {
    if (isEmpty()) {
      return "";
    }
    List<String> numerator = Lists.newArrayList();
    List<String> denominator = Lists.newArrayList();
    for (Entry<String, Fraction> factor : factors()) {
      Fraction exponent = factor.getValue();
      String term = factor.getKey() + exponentText(factor.getKey(), exponent.abs());
      (exponent.getNumerator() > 0 ? numerator : denominator).add(term);
    }
    StringBuilder text = new StringBuilder(
        numerator.isEmpty() ? "1" : Joiner.on('*').join(numerator));
    if (!denominator.isEmpty()) {
      text.append('/');
      String joined = Joiner.on('*').join(denominator);
      text.append(denominator.size() > 1 ? "(" + joined + ")" : joined);
    }
    return text.toString();
  }

  private static String exponentText(String symbol, Fraction exponent) {
    if (exponent.equals(Fraction.ONE)) {
      return "";
    }
    // A bare integer after a numeric subscript such as mu_0 would read as part of the symbol.
    boolean subscripted = Character.isDigit(symbol.charAt(symbol.length() - 1));
    if (exponent.getDenominator() != 1) {
      return "(" + exponent.getNumerator() + "/" + exponent.getDenominator() + ")";
    }
    return subscripted
        ? "(" + exponent.getNumerator() + ")"
        : String.valueOf(exponent.getNumerator());
  }

  private static final Pattern FACTOR = Pattern.compile(
      "([A-Za-z](?:[A-Za-z]|_(?:\\d+|[A-Za-z0-9]*[A-Za-z]))*)"
      + "(?:\\(([+-]?\\d+(?:/\\d+)?)\\)"
      + "|([+-]?\\d+\\.\\d*(?:[eE][+-]?\\d+)?|[+-]?\\d+[eE][+-]?\\d+)"
      + "|([+-]?\\d+))?");

  /**
   * Parses the text form of an exponent vector.
   *
   * <p>Each symbol may be followed directly by its exponent: an integer ({@code s2}), a decimal
   * ({@code m0.5}) or a parenthesized fraction ({@code m(1/2)}).  Factors are joined by {@code *}
   * or {@code /} and may be grouped in parentheses; a {@code /} applies to the factor or group
   * immediately following it.  A symbol may carry {@code _} subscripts: a subscript of digits
   * only belongs to the symbol ({@code mu_0}), otherwise trailing digits are the exponent
   * ({@code m_e2} is {@code m_e} squared).  {@code 1} stands for unity, so {@code a/b/(c*d2)} and
   * {@code 1/(d2*c*b)*a} denote the same vector.  Whitespace is ignored.
   *
   * @param text the expression to parse
   * @return the parsed vector; {@link #EMPTY} for a blank or unity expression
   * @throws IllegalArgumentException if the text is malformed
   */
  public static ExponentVector parse(String text) {
    Preconditions.checkNotNull(text);
    String stripped = StringUtils.deleteWhitespace(text);
    if (stripped.isEmpty()) {
      return EMPTY;
    }
    Parser parser = new Parser(text, stripped);
    Map<String, Fraction> exponents = parser.parseProduct();
    if (!parser.atEnd()) {
      throw parser.error("unexpected '" + parser.peek() + "'");
    }
    return copyOf(exponents);
  }

  private static final class Parser {
    private final String original;
    private final String text;
    private int position;

    Parser(String original, String text) {
      this.original = original;
      this.text = text;
    }

    boolean atEnd() {
      return position >= text.length();
    }

    char peek() {
      return text.charAt(position);
    }

    IllegalArgumentException error(String problem) {
      return new IllegalArgumentException(
          String.format("Malformed exponent expression '%s' at offset %d: %s",
              original, position, problem));
    }

    Map<String, Fraction> parseProduct() {
      Map<String, Fraction> exponents = Maps.newTreeMap();
      boolean multiply = true;
      while (true) {
        if (atEnd()) {
          throw error("expected a factor");
        }
        accumulate(exponents, parseTerm(), multiply);
        if (atEnd() || peek() == ')') {
          return exponents;
        }
        char operator = peek();
        if (operator != '*' && operator != '/') {
          throw error("the operation must be '*' or '/'");
        }
        multiply = operator == '*';
        position++;
      }
    }

    private Map<String, Fraction> parseTerm() {
      char next = peek();
      if (next == '(') {
        position++;
        Map<String, Fraction> group = parseProduct();
        if (atEnd() || peek() != ')') {
          throw error("unbalanced parentheses");
        }
        position++;
        return group;
      }
      if (next == '1') {
        position++;
        return ImmutableSortedMap.of();
      }
      Matcher matcher = FACTOR.matcher(text);
      matcher.region(position, text.length());
      if (!matcher.lookingAt()) {
        throw error("expected a symbol");
      }
      position = matcher.end();
      return ImmutableSortedMap.of(matcher.group(1), exponent(matcher));
    }

    private Fraction exponent(Matcher matcher) {
      if (matcher.group(2) != null) {
        return Fraction.getFraction(matcher.group(2)).reduce();
      } else if (matcher.group(3) != null) {
        return Fraction.getFraction(Double.parseDouble(matcher.group(3)));
      } else if (matcher.group(4) != null) {
        return Fraction.getFraction(Integer.parseInt(matcher.group(4)), 1);
      }
      return Fraction.ONE;
    }

    private static void accumulate(Map<String, Fraction> into, Map<String, Fraction> term,
        boolean add) {
      for (Entry<String, Fraction> entry : term.entrySet()) {
        Fraction exponent = add ? entry.getValue() : entry.getValue().negate();
        Fraction current = into.get(entry.getKey());
        into.put(entry.getKey(), current == null ? exponent : current.add(exponent));
      }
    }
  }
}
