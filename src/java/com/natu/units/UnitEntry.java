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

package com.natu.units;

import com.google.common.base.Preconditions;

import com.natu.quantity.ExponentVector;

/**
 * A named entry of a {@link SymbolTable}: a constant, a scalar unit or a lambda unit.
 *
 * <p>Callers branch on {@link #getKind()} and then narrow with {@link #asConstant()},
 * {@link #asUnit()} or {@link #asLambdaUnit()}.
 */
public abstract class UnitEntry {

  /**
   * The variants of a symbol table entry.
   */
  public enum Kind {
    CONSTANT,
    UNIT,
    LAMBDA_UNIT
  }

  private final String name;

  UnitEntry(String name) {
    this.name = Preconditions.checkNotNull(name);
  }

  public String getName() {
    return name;
  }

  public abstract Kind getKind();

  /**
   * Returns the physical dimension of this entry.
   */
  public abstract ExponentVector getDimension();

  /**
   * Returns true if SI prefixes may be put in front of this entry's name.  Constants never are.
   */
  public boolean isPrefixable() {
    return false;
  }

  public Constant asConstant() {
    throw wrongKind(Kind.CONSTANT);
  }

  public ScalarUnit asUnit() {
    throw wrongKind(Kind.UNIT);
  }

  public LambdaUnit asLambdaUnit() {
    throw wrongKind(Kind.LAMBDA_UNIT);
  }

  private IllegalStateException wrongKind(Kind wanted) {
    return new IllegalStateException(
        String.format("'%s' is a %s, not a %s", name, getKind(), wanted));
  }
}
