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
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import javax.annotation.Nullable;

import com.google.common.base.CharMatcher;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import org.apache.commons.lang.StringUtils;

/**
 * Splits the lines of a {@link DefinitionSource} into {@link DefinitionStatement}s.
 *
 * <p>The format is INI-like:
 * <pre>
 * [Section name]
 * ; A comment line.  Lines starting with '#' are comments too.
 * c = Quantity(299792458, 'L/T')  ; An inline note.
 * m = 10973731.568539*cyc/R_inf, True
 * J = N*m,
 *     True
 * </pre>
 * A line that starts with whitespace continues the previous statement.  Sections only organize
 * the file; they have no effect on the definitions.
 */
public class DefinitionReader {

  private static final Pattern SYMBOL = Pattern.compile("[^\\s=;\\[\\]]+");
  private static final Pattern FLAG = Pattern.compile("(?s)(.*),\\s*(True|False)");

  /**
   * Reads all statements of {@code source} in order.
   *
   * @param source the source to read
   * @return the statements of the source
   * @throws IOException if the source can not be read
   * @throws DefinitionParseException if a line is malformed
   */
  public List<DefinitionStatement> read(DefinitionSource source)
      throws IOException, DefinitionParseException {
    Preconditions.checkNotNull(source);
    String name = source.getName();
    ImmutableList.Builder<DefinitionStatement> statements = ImmutableList.builder();

    String section = "";
    Pending pending = null;
    int lineNumber = 0;
    for (String line : source.readLines()) {
      lineNumber++;
      String trimmed = line.trim();
      if (trimmed.isEmpty() || trimmed.startsWith(";") || trimmed.startsWith("#")) {
        continue;
      }

      if (CharMatcher.whitespace().matches(line.charAt(0))) {
        if (pending == null) {
          throw new DefinitionParseException("Continuation line without a statement to continue",
              name, lineNumber, null);
        }
        pending.append(withoutNote(trimmed), note(trimmed));
        continue;
      }

      if (pending != null) {
        statements.add(pending.finish(name, section));
        pending = null;
      }

      if (trimmed.startsWith("[")) {
        if (!trimmed.endsWith("]")
            || StringUtils.isBlank(trimmed.substring(1, trimmed.length() - 1))) {
          throw new DefinitionParseException("Malformed section header '" + trimmed + "'", name,
              lineNumber, null);
        }
        section = trimmed.substring(1, trimmed.length() - 1).trim();
        continue;
      }

      int equals = trimmed.indexOf('=');
      if (equals < 0) {
        throw new DefinitionParseException(
            "Expected 'symbol = expression' but found '" + trimmed + "'", name, lineNumber, null);
      }
      String symbol = trimmed.substring(0, equals).trim();
      if (!SYMBOL.matcher(symbol).matches()) {
        throw new DefinitionParseException("Invalid symbol '" + symbol + "'", name, lineNumber,
            null);
      }
      String rest = trimmed.substring(equals + 1);
      pending = new Pending(lineNumber, symbol, withoutNote(rest), note(rest));
    }
    if (pending != null) {
      statements.add(pending.finish(name, section));
    }
    return statements.build();
  }

  /**
   * Returns the offset of the first ';' outside of a quoted string, or -1.
   */
  private static int noteStart(String text) {
    char quote = 0;
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      if (quote != 0) {
        if (c == quote) {
          quote = 0;
        }
      } else if (c == '\'' || c == '"') {
        quote = c;
      } else if (c == ';') {
        return i;
      }
    }
    return -1;
  }

  private static String withoutNote(String text) {
    int start = noteStart(text);
    return (start < 0 ? text : text.substring(0, start)).trim();
  }

  @Nullable
  private static String note(String text) {
    int start = noteStart(text);
    return start < 0 ? null : StringUtils.trimToNull(text.substring(start + 1));
  }

  private static final class Pending {
    private final int line;
    private final String symbol;
    private final StringBuilder expression;
    @Nullable private String note;

    Pending(int line, String symbol, String expression, @Nullable String note) {
      this.line = line;
      this.symbol = symbol;
      this.expression = new StringBuilder(expression);
      this.note = note;
    }

    void append(String text, @Nullable String moreNote) {
      if (!text.isEmpty()) {
        expression.append(' ').append(text);
      }
      if (moreNote != null) {
        note = note == null ? moreNote : note + " " + moreNote;
      }
    }

    DefinitionStatement finish(String source, String section) throws DefinitionParseException {
      String text = expression.toString().trim();
      Boolean prefixable = null;
      Matcher flag = FLAG.matcher(text);
      if (flag.matches()) {
        text = flag.group(1).trim();
        prefixable = Boolean.valueOf("True".equals(flag.group(2)));
      }
      if (text.isEmpty()) {
        throw new DefinitionParseException("Missing expression", source, line, symbol);
      }
      return new DefinitionStatement(source, section, line, symbol, text, prefixable, note);
    }
  }
}
