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
 * Thrown when a well-formed definition expression can not be evaluated, for example because it
 * names an undefined symbol or multiplies a lambda unit.
 */
public class EvaluationException extends IllegalArgumentException {

  @Nullable private final String undefinedName;

  public EvaluationException(String message) {
    this(message, null);
  }

  private EvaluationException(String message, @Nullable String undefinedName) {
    super(message);
    this.undefinedName = undefinedName;
  }

  public static EvaluationException undefined(String name) {
    return new EvaluationException("'" + name + "' is not defined", name);
  }

  /**
   * Returns the name that could not be resolved, or {@code null} if the evaluation failed for
   * another reason.
   */
  @Nullable
  public String getUndefinedName() {
    return undefinedName;
  }
}
