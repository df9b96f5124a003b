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

package com.natu.base;

import com.google.common.base.Preconditions;
import com.google.common.collect.Iterables;

import org.apache.commons.lang.StringUtils;

/**
 * Argument checks used across the unit system that {@link Preconditions} does not offer.
 */
public final class MorePreconditions {

  private static final String BLANK_ARGUMENT = "Argument cannot be blank";

  private MorePreconditions() {
    // Utility.
  }

  public static String checkNotBlank(String argument) {
    return checkNotBlank(argument, BLANK_ARGUMENT);
  }

  /**
   * Checks that a string is non-null and contains a non-whitespace character.
   *
   * @param argument the string to check
   * @param message the exception message template, formatted with {@code args}
   * @param args arguments for the message template
   * @return {@code argument}
   * @throws NullPointerException if the argument is null
   * @throws IllegalArgumentException if the argument is empty or all whitespace
   */
  public static String checkNotBlank(String argument, String message, Object... args) {
    Preconditions.checkNotNull(argument, message, args);
    Preconditions.checkArgument(!StringUtils.isBlank(argument), message, args);
    return argument;
  }

  /**
   * Checks that an iterable is non-null and has at least one element.
   */
  public static <S, T extends Iterable<S>> T checkNotEmpty(T argument, String message,
      Object... args) {
    Preconditions.checkNotNull(argument, message, args);
    Preconditions.checkArgument(!Iterables.isEmpty(argument), message, args);
    return argument;
  }

  /**
   * Checks that an int is zero or positive.
   *
   * @return {@code argument}
   * @throws IllegalArgumentException if the argument is negative
   */
  public static int checkNotNegative(int argument, String name) {
    Preconditions.checkArgument(argument >= 0, "%s must not be negative, got %s", name, argument);
    return argument;
  }
}
