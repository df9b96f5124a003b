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

import java.util.Map;

import javax.annotation.Nullable;

import com.google.common.collect.ImmutableMap;

/**
 * The functions and constructors a definition expression may call.  No other calls are accepted.
 */
public enum Builtin {
  EXP("exp", 1, 1),
  LOG("log", 1, 1),
  LOG10("log10", 1, 1),
  SQRT("sqrt", 1, 1),
  /** {@code Quantity(value, 'dimension'[, 'display unit'])} */
  QUANTITY("Quantity", 2, 3),
  /** {@code ScalarUnit(value, 'dimension'[, 'display unit'])} */
  SCALAR_UNIT("ScalarUnit", 2, 3),
  /** {@code LambdaUnit(n -> forward, x -> inverse)} */
  LAMBDA_UNIT("LambdaUnit", 2, 2);

  private static final Map<String, Builtin> BY_NAME;
  static {
    ImmutableMap.Builder<String, Builtin> builder = ImmutableMap.builder();
    for (Builtin builtin : values()) {
      builder.put(builtin.functionName, builtin);
    }
    BY_NAME = builder.build();
  }

  private final String functionName;
  private final int minArguments;
  private final int maxArguments;

  private Builtin(String functionName, int minArguments, int maxArguments) {
    this.functionName = functionName;
    this.minArguments = minArguments;
    this.maxArguments = maxArguments;
  }

  public String getFunctionName() {
    return functionName;
  }

  public boolean acceptsArgumentCount(int count) {
    return minArguments <= count && count <= maxArguments;
  }

  /**
   * Returns true if this builtin takes lambda expressions as its arguments.
   */
  public boolean takesLambdas() {
    return this == LAMBDA_UNIT;
  }

  @Nullable
  public static Builtin fromName(String name) {
    return BY_NAME.get(name);
  }

  public static Iterable<String> names() {
    return BY_NAME.keySet();
  }

  @Override
  public String toString() {
    return functionName;
  }
}
