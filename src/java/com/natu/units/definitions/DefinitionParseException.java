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
 * Thrown for a structurally malformed definition statement or expression.
 */
public class DefinitionParseException extends DefinitionException {

  public DefinitionParseException(String message, String source, int line,
      @Nullable String symbol) {
    super(message, source, line, symbol, null);
  }

  public DefinitionParseException(String message, DefinitionStatement statement,
      @Nullable Throwable cause) {
    super(message, statement, cause);
  }
}
