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

import java.io.File;
import java.io.IOException;
import java.net.URL;
import java.util.List;

import com.google.common.base.Charsets;
import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.io.Files;
import com.google.common.io.Resources;

import com.natu.base.MorePreconditions;

/**
 * Factory methods for common {@link DefinitionSource}s.  All sources are read as UTF-8.
 */
public final class DefinitionSources {

  private DefinitionSources() {
    // Utility.
  }

  /**
   * Creates a source that reads a classpath resource relative to {@code contextClass}.
   *
   * @param contextClass the class whose package the resource name is relative to
   * @param resourceName the resource to read
   * @return a source for the resource
   * @throws IllegalArgumentException if the resource does not exist
   */
  public static DefinitionSource fromResource(Class<?> contextClass, final String resourceName) {
    Preconditions.checkNotNull(contextClass);
    MorePreconditions.checkNotBlank(resourceName);
    final URL url = Resources.getResource(contextClass, resourceName);
    return new DefinitionSource() {
      @Override public String getName() {
        return resourceName;
      }

      @Override public List<String> readLines() throws IOException {
        return Resources.readLines(url, Charsets.UTF_8);
      }

      @Override public String toString() {
        return url.toString();
      }
    };
  }

  public static DefinitionSource fromFile(final File file) {
    Preconditions.checkNotNull(file);
    return new DefinitionSource() {
      @Override public String getName() {
        return file.getPath();
      }

      @Override public List<String> readLines() throws IOException {
        return Files.readLines(file, Charsets.UTF_8);
      }

      @Override public String toString() {
        return file.getPath();
      }
    };
  }

  /**
   * Creates an in-memory source.
   *
   * @param name the name used in messages
   * @param lines the definition lines
   * @return a source that returns {@code lines}
   */
  public static DefinitionSource fromLines(final String name, List<String> lines) {
    MorePreconditions.checkNotBlank(name);
    final List<String> copy = ImmutableList.copyOf(lines);
    return new DefinitionSource() {
      @Override public String getName() {
        return name;
      }

      @Override public List<String> readLines() {
        return copy;
      }

      @Override public String toString() {
        return name;
      }
    };
  }

  public static DefinitionSource fromString(String name, String text) {
    return fromLines(name, Splitter.onPattern("\r?\n").splitToList(text));
  }
}
