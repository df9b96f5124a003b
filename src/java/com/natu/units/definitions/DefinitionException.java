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

/**
 * Thrown when a unit system can not be built from its definition sources.  The exception names
 * the source and line of the offending statement and, where known, the symbol being defined.
 */
public class DefinitionException extends Exception {

  private final String source;
  private final int line;
  @Nullable private final String symbol;

  public DefinitionException(String message, String source, int line, @Nullable String symbol,
      @Nullable Throwable cause) {
    super(String.format("%s:%d: %s%s", source, line, message,
        symbol == null ? "" : " (while defining '" + symbol + "')"), cause);
    this.source = source;
    this.line = line;
    this.symbol = symbol;
  }

  public DefinitionException(String message, DefinitionStatement statement,
      @Nullable Throwable cause) {
    this(message, statement.getSource(), statement.getLine(), statement.getSymbol(), cause);
  }

  /**
   * Returns the name of the definition source the error was found in.
   */
  public String getSource() {
    return source;
  }

  /**
   * Returns the one-based line number of the offending statement, or 0 if the error is not tied
   * to a line.
   */
  public int getLine() {
    return line;
  }

  @Nullable
  public String getSymbol() {
    return symbol;
  }
}
