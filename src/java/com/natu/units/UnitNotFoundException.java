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

import java.util.NoSuchElementException;

/**
 * Thrown when a name is neither a defined symbol nor a valid prefixed form of one.
 */
public class UnitNotFoundException extends NoSuchElementException {

  private final String name;

  public UnitNotFoundException(String name, String reason) {
    super(String.format("No unit or constant named '%s': %s", name, reason));
    this.name = name;
  }

  public String getName() {
    return name;
  }
}
