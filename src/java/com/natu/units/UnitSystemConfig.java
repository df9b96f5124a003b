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

import java.util.List;
import java.util.Map;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;

import com.natu.base.MorePreconditions;
import com.natu.format.UnitStyle;
import com.natu.units.definitions.DefinitionSource;
import com.natu.units.definitions.DefinitionSources;

/**
 * Everything needed to build a {@link UnitRegistry}: the ordered definition sources and the
 * formatting settings.
 *
 * <p>The bundled definitions consist of a base file that assigns values to the base physical
 * constants, followed by {@value #DERIVED}, {@value #BIPM} and {@value #OTHER}.  Choosing another
 * base file gives another unit system:
 * <pre>
 * UnitSystemConfig unity = UnitSystemConfig.builder()
 *     .addBundledDefinitions(UnitSystemConfig.BASE_UNITY)
 *     .build();
 * </pre>
 */
public final class UnitSystemConfig {

  /** Base constants of the rationalized SI. */
  public static final String BASE_SI = "base-SI.ini";

  /** Base constants of the SI without the rationalization factor of 4 pi. */
  public static final String BASE_SI_UNRATIONALIZED = "base-SI-unrationalized.ini";

  /** Base constants that are all numerically one. */
  public static final String BASE_UNITY = "base-unity.ini";

  public static final String DERIVED = "derived.ini";
  public static final String BIPM = "BIPM.ini";
  public static final String OTHER = "other.ini";

  public static final int DEFAULT_SIMPLIFICATION_LEVEL = 2;

  private static final ImmutableMap<UnitStyle, ImmutableMap<String, String>> DEFAULT_REPLACEMENTS =
      ImmutableMap.of(
          UnitStyle.LATEX, ImmutableMap.of(
              "deg", "^{\\circ}",
              "ohm", "\\Omega",
              "angstrom", "\\AA"),
          UnitStyle.UNICODE, ImmutableMap.of(
              "deg", "°",
              "ohm", "Ω",
              "angstrom", "Å"));

  private final ImmutableList<DefinitionSource> definitions;
  private final int simplificationLevel;
  private final ImmutableMap<UnitStyle, ImmutableMap<String, String>> unitReplacements;

  private UnitSystemConfig(List<DefinitionSource> definitions, int simplificationLevel,
      Map<UnitStyle, Map<String, String>> unitReplacements) {
    this.definitions = ImmutableList.copyOf(definitions);
    this.simplificationLevel = simplificationLevel;
    ImmutableMap.Builder<UnitStyle, ImmutableMap<String, String>> replacements =
        ImmutableMap.builder();
    for (Map.Entry<UnitStyle, Map<String, String>> entry : unitReplacements.entrySet()) {
      replacements.put(entry.getKey(), ImmutableMap.copyOf(entry.getValue()));
    }
    this.unitReplacements = replacements.build();
  }

  /**
   * Returns the configuration of the rationalized SI with the default settings.
   */
  public static UnitSystemConfig defaults() {
    return builder().addBundledDefinitions(BASE_SI).build();
  }

  /**
   * Returns a source for one of the definition files bundled with this library.
   */
  public static DefinitionSource bundled(String name) {
    return DefinitionSources.fromResource(UnitSystemConfig.class, name);
  }

  public ImmutableList<DefinitionSource> getDefinitions() {
    return definitions;
  }

  /**
   * Returns the number of non-minimizing substitutions allowed while simplifying a display unit.
   */
  public int getSimplificationLevel() {
    return simplificationLevel;
  }

  public ImmutableMap<UnitStyle, ImmutableMap<String, String>> getUnitReplacements() {
    return unitReplacements;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("definitions", definitions)
        .add("simplificationLevel", simplificationLevel)
        .toString();
  }

  public static Builder builder() {
    return new Builder();
  }

  public static class Builder {
    private final List<DefinitionSource> definitions = Lists.newArrayList();
    private int simplificationLevel = DEFAULT_SIMPLIFICATION_LEVEL;
    private final Map<UnitStyle, Map<String, String>> unitReplacements =
        Maps.newEnumMap(UnitStyle.class);

    Builder() {
      for (Map.Entry<UnitStyle, ImmutableMap<String, String>> entry
          : DEFAULT_REPLACEMENTS.entrySet()) {
        unitReplacements.put(entry.getKey(), Maps.newLinkedHashMap(entry.getValue()));
      }
    }

    /**
     * Appends the bundled definitions, starting from the given base file.
     *
     * @param baseFile one of {@link #BASE_SI}, {@link #BASE_SI_UNRATIONALIZED} or
     *     {@link #BASE_UNITY}, or another bundled file that defines the same base constants
     */
    public Builder addBundledDefinitions(String baseFile) {
      MorePreconditions.checkNotBlank(baseFile);
      for (String name : ImmutableList.of(baseFile, DERIVED, BIPM, OTHER)) {
        definitions.add(bundled(name));
      }
      return this;
    }

    /**
     * Appends sources that are loaded after those added so far.  Their statements may refer to
     * and redefine earlier symbols.
     */
    public Builder addDefinitions(DefinitionSource... sources) {
      for (DefinitionSource source : sources) {
        definitions.add(Preconditions.checkNotNull(source));
      }
      return this;
    }

    public Builder simplificationLevel(int level) {
      this.simplificationLevel = MorePreconditions.checkNotNegative(level, "simplificationLevel");
      return this;
    }

    /**
     * Renders {@code symbol} as {@code replacement} in the given style.
     */
    public Builder unitReplacement(UnitStyle style, String symbol, String replacement) {
      Preconditions.checkNotNull(style);
      MorePreconditions.checkNotBlank(symbol);
      Preconditions.checkNotNull(replacement);
      Map<String, String> forStyle = unitReplacements.get(style);
      if (forStyle == null) {
        forStyle = Maps.newLinkedHashMap();
        unitReplacements.put(style, forStyle);
      }
      forStyle.put(symbol, replacement);
      return this;
    }

    /**
     * Removes all symbol replacements, including the default ones.
     */
    public Builder clearUnitReplacements() {
      unitReplacements.clear();
      return this;
    }

    public UnitSystemConfig build() {
      MorePreconditions.checkNotEmpty(definitions, "At least one definition source is needed");
      return new UnitSystemConfig(definitions, simplificationLevel, unitReplacements);
    }
  }
}
