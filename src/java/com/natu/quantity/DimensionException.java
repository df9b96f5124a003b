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

/**
 * Thrown when an operation needs operands of the same physical dimension but gets different ones.
 */
public class DimensionException extends IllegalArgumentException {

  private final ExponentVector expected;
  private final ExponentVector actual;

  public DimensionException(String operation, ExponentVector expected, ExponentVector actual) {
    this(expected, actual, String.format("Cannot %s quantities of dimension '%s' and '%s'",
        operation, expected, actual));
  }

  protected DimensionException(ExponentVector expected, ExponentVector actual,
      String message) {
    super(message);
    this.expected = expected;
    this.actual = actual;
  }

  public ExponentVector getExpected() {
    return expected;
  }

  public ExponentVector getActual() {
    return actual;
  }
}
