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

/**
 * A named, ordered source of definition lines, such as a bundled resource or a file on disk.
 */
public interface DefinitionSource {

  /**
   * Returns a name for this source that is used in log and error messages.
   */
  String getName();

  /**
   * Reads all lines of this source.
   *
   * @return the lines, in order, without line terminators
   * @throws IOException if the source could not be read
   */
  List<String> readLines() throws IOException;
}
