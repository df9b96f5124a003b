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

package com.natu.format;

import java.util.Locale;

import com.google.common.base.Function;
import com.google.common.base.Preconditions;

import com.natu.base.MorePreconditions;

/**
 * Number formatting policies for {@link QuantityFormatter}.  A policy turns the number shown in
 * front of a unit into text; scientific notation in the result is rewritten by the chosen
 * {@link UnitStyle}.
 */
public final class NumberFormats {

  /**
   * Java's shortest round-tripping representation, as in {@code 1.0} or {@code 6.62606957E-34}.
   */
  public static final Function<Double, String> DEFAULT = new Function<Double, String>() {
    @Override public String apply(Double number) {
      return Double.toString(number);
    }

    @Override public String toString() {
      return "NumberFormats.DEFAULT";
    }
  };

  private NumberFormats() {
    // Utility.
  }

  /**
   * Rounds to the given number of significant digits using {@code %g}.
   */
  public static Function<Double, String> significant(int digits) {
    Preconditions.checkArgument(digits > 0, "At least one significant digit is needed");
    return pattern("%." + digits + "g");
  }

  /**
   * Formats with a {@link String#format(String, Object...)} pattern that takes a single double,
   * such as {@code "%.3f"}.  The root locale is used.
   */
  public static Function<Double, String> pattern(final String pattern) {
    MorePreconditions.checkNotBlank(pattern);
    return new Function<Double, String>() {
      @Override public String apply(Double number) {
        return String.format(Locale.ROOT, pattern, number);
      }

      @Override public String toString() {
        return "NumberFormats.pattern(" + pattern + ")";
      }
    };
  }
}
