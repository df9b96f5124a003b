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

/**
 * Thrown when a definition refers to a name that has not been defined by any earlier statement.
 */
public class UndefinedSymbolException extends DefinitionException {

  private final String undefinedName;

  public UndefinedSymbolException(String undefinedName, DefinitionStatement statement) {
    super(String.format("'%s' is not defined in '%s = %s'", undefinedName,
        statement.getSymbol(), statement.getExpression()), statement, null);
    this.undefinedName = undefinedName;
  }

  /**
   * Returns the name that could not be resolved.
   */
  public String getUndefinedName() {
    return undefinedName;
  }
}
