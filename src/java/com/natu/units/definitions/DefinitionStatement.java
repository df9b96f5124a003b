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

import javax.annotation.Nullable;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;

/**
 * One {@code symbol = expression[, True|False][; note]} statement read from a definition source.
 */
public final class DefinitionStatement {

  private final String source;
  private final String section;
  private final int line;
  private final String symbol;
  private final String expression;
  @Nullable private final Boolean prefixable;
  @Nullable private final String note;

  public DefinitionStatement(String source, String section, int line, String symbol,
      String expression, @Nullable Boolean prefixable, @Nullable String note) {
    this.source = Preconditions.checkNotNull(source);
    this.section = Preconditions.checkNotNull(section);
    this.line = line;
    this.symbol = Preconditions.checkNotNull(symbol);
    this.expression = Preconditions.checkNotNull(expression);
    this.prefixable = prefixable;
    this.note = note;
  }

  public String getSource() {
    return source;
  }

  /**
   * Returns the section the statement appears in, or the empty string before the first section
   * header.
   */
  public String getSection() {
    return section;
  }

  /**
   * Returns the one-based line number the statement starts on.
   */
  public int getLine() {
    return line;
  }

  public String getSymbol() {
    return symbol;
  }

  public String getExpression() {
    return expression;
  }

  /**
   * Returns true if the statement carries a {@code True} or {@code False} flag and so defines a
   * unit rather than a constant.
   */
  public boolean hasUnitFlag() {
    return prefixable != null;
  }

  /**
   * Returns the flag value, or {@code null} if the statement has none.
   */
  @Nullable
  public Boolean getPrefixable() {
    return prefixable;
  }

  @Nullable
  public String getNote() {
    return note;
  }

  public String getLocator() {
    return source + ":" + line;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("at", getLocator())
        .add("section", section)
        .add("symbol", symbol)
        .add("expression", expression)
        .add("prefixable", prefixable)
        .omitNullValues()
        .toString();
  }
}
