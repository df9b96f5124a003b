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
import java.util.Set;
import java.util.SortedSet;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;

import org.apache.commons.lang.math.Fraction;

import com.natu.quantity.BaseDimension;
import com.natu.quantity.ExponentVector;

/**
 * Chooses readable display units for a unit system.
 *
 * <p>Two searches are offered.  {@link #simplify(ExponentVector, int)} rewrites a display-unit
 * vector such as {@code kg*m2/s2} into a shorter one such as {@code J} by substituting the
 * coherent relations recorded while the unit system was loaded.
 * {@link #findUnitsFor(ExponentVector)} starts from a bare physical dimension instead and looks
 * for a product of coherent units that reproduces it exactly.
 *
 * <p>A unit is coherent when its value is exactly the product of the base-dimension anchors raised
 * to its dimension exponents, so it can stand in for the bare dimension without changing the
 * number shown.  The anchor of a base dimension is the earliest defined unit whose dimension is
 * that base dimension alone.
 */
public class CoherentSimplifier {

  /**
   * The largest number of distinct unit symbols the dimension search will combine.
   */
  public static final int MAX_SYMBOLS = 5;

  private static final double COHERENCE_TOLERANCE = 1e-9;

  private final ImmutableList<ExponentVector> relations;
  private final ImmutableMap<BaseDimension, ScalarUnit> anchors;
  private final ImmutableList<ScalarUnit> coherentUnits;

  public CoherentSimplifier(SymbolTable table) {
    Preconditions.checkNotNull(table);
    this.relations = table.getCoherentRelations();
    this.anchors = findAnchors(table);
    this.coherentUnits = findCoherentUnits(table, anchors);
  }

  private static ImmutableMap<BaseDimension, ScalarUnit> findAnchors(SymbolTable table) {
    Map<BaseDimension, ScalarUnit> anchors = Maps.newEnumMap(BaseDimension.class);
    for (UnitEntry entry : table.entries()) {
      if (entry.getKind() != UnitEntry.Kind.UNIT || entry.getDimension().size() != 1) {
        continue;
      }
      String symbol = entry.getDimension().symbols().iterator().next();
      BaseDimension base = BaseDimension.fromSymbol(symbol);
      if (base != null && entry.getDimension().get(symbol).equals(Fraction.ONE)
          && !anchors.containsKey(base)) {
        anchors.put(base, entry.asUnit());
      }
    }
    return ImmutableMap.copyOf(anchors);
  }

  private static ImmutableList<ScalarUnit> findCoherentUnits(SymbolTable table,
      Map<BaseDimension, ScalarUnit> anchors) {
    ImmutableList.Builder<ScalarUnit> coherent = ImmutableList.builder();
    for (UnitEntry entry : table.entries()) {
      if (entry.getKind() == UnitEntry.Kind.UNIT && !entry.getDimension().isEmpty()
          && isCoherent(entry.asUnit(), anchors)) {
        coherent.add(entry.asUnit());
      }
    }
    return coherent.build();
  }

  private static boolean isCoherent(ScalarUnit unit, Map<BaseDimension, ScalarUnit> anchors) {
    double expected = 1;
    for (Map.Entry<String, Fraction> factor : unit.getDimension().asMap().entrySet()) {
      BaseDimension base = BaseDimension.fromSymbol(factor.getKey());
      ScalarUnit anchor = base == null ? null : anchors.get(base);
      if (anchor == null) {
        return false;
      }
      expected *= Math.pow(anchor.getValue(), factor.getValue().doubleValue());
    }
    return Math.abs(unit.getValue() - expected) <= COHERENCE_TOLERANCE * Math.abs(expected);
  }

  /**
   * Returns the coherent units in definition order.
   */
  public ImmutableList<ScalarUnit> getCoherentUnits() {
    return coherentUnits;
  }

  /**
   * Returns the anchor unit of each base dimension that has one.
   */
  public ImmutableMap<BaseDimension, ScalarUnit> getAnchors() {
    return anchors;
  }

  /**
   * Rewrites a display-unit vector to reduce the sum of the magnitudes of its exponents.
   *
   * <p>Each coherent relation that shares enough symbols with the unit is tried in turn and
   * substituted by the whole multiple that cancels one of the shared symbols.  A substitution is
   * kept if it lowers the norm, possibly after up to {@code level - 1} further substitutions that
   * on their own do not.  The search is greedy, so it may miss the simplest form.
   *
   * @param unit the display-unit vector to simplify
   * @param level the number of non-minimizing substitutions allowed; zero disables simplification
   * @return the simplified vector, which equals {@code unit} in value
   */
  public ExponentVector simplify(ExponentVector unit, int level) {
    Preconditions.checkNotNull(unit);
    if (level <= 0 || unit.norm().compareTo(Fraction.ONE) <= 0) {
      return unit;
    }

    ExponentVector current = unit;
    boolean simpler = true;
    while (simpler) {
      simpler = false;
      for (ExponentVector relation : relations) {
        Set<String> common =
            ImmutableSet.copyOf(Sets.intersection(relation.symbols(), current.symbols()));
        // Relations sharing few symbols with the unit rarely help.
        if (common.size() < relation.size() / 2.0 - 0.5) {
          continue;
        }
        for (String symbol : common) {
          Fraction multiple = current.get(symbol).divideBy(relation.get(symbol));
          if (multiple.getDenominator() != 1) {
            continue;
          }
          ExponentVector candidate = current.divide(relation.power(multiple));
          if (level > 1) {
            candidate = simplify(candidate, level - 1);
          }
          if (candidate.norm().compareTo(current.norm()) < 0) {
            current = candidate;
            simpler = true;
            break;
          }
        }
      }
    }
    return current;
  }

  /**
   * Finds a product of coherent units whose dimension is exactly {@code dimension}.
   *
   * <p>Combinations with whole-number exponents are preferred over those needing fractional
   * ones.  Among those, fewer distinct symbols win, and ties go to the combination of earliest
   * defined units.  At most {@link #MAX_SYMBOLS} symbols are combined.
   *
   * @param dimension the physical dimension to express
   * @return a vector over unit symbols, or {@code null} if no combination was found
   */
  @Nullable
  public ExponentVector findUnitsFor(ExponentVector dimension) {
    Preconditions.checkNotNull(dimension);
    if (dimension.isEmpty()) {
      return null;
    }
    ExponentVector firstFractional = null;
    int available = coherentUnits.size();
    for (int count = 1; count <= Math.min(available, MAX_SYMBOLS); count++) {
      int[] chosen = new int[count];
      for (int i = 0; i < count; i++) {
        chosen[i] = i;
      }
      do {
        ExponentVector found = trySolve(chosen, dimension);
        if (found != null) {
          if (found.hasIntegerExponents()) {
            return found;
          } else if (firstFractional == null) {
            firstFractional = found;
          }
        }
      } while (nextCombination(chosen, available));
    }
    return firstFractional;
  }

  @Nullable
  private ExponentVector trySolve(int[] chosen, ExponentVector target) {
    List<ExponentVector> columns = Lists.newArrayListWithCapacity(chosen.length);
    Set<String> covered = Sets.newHashSet();
    Set<String> shared = Sets.newHashSet();
    for (int index : chosen) {
      ExponentVector column = coherentUnits.get(index).getDimension();
      columns.add(column);
      for (String symbol : column.symbols()) {
        if (!covered.add(symbol)) {
          shared.add(symbol);
        }
      }
    }
    if (!covered.containsAll(target.symbols())) {
      return null;
    }
    // A symbol outside the target that only one unit carries can not cancel.
    for (String symbol : covered) {
      if (!target.contains(symbol) && !shared.contains(symbol)) {
        return null;
      }
    }
    Fraction[] exponents = solve(columns, target);
    if (exponents == null) {
      return null;
    }
    Map<String, Fraction> units = Maps.newTreeMap();
    for (int i = 0; i < chosen.length; i++) {
      if (exponents[i].getNumerator() == 0) {
        return null;
      }
      units.put(coherentUnits.get(chosen[i]).getName(), exponents[i]);
    }
    return ExponentVector.copyOf(units);
  }

  /**
   * Advances {@code chosen} to the next combination in lexicographic order.
   */
  private static boolean nextCombination(int[] chosen, int available) {
    int count = chosen.length;
    int i = count - 1;
    while (i >= 0 && chosen[i] == available - count + i) {
      i--;
    }
    if (i < 0) {
      return false;
    }
    chosen[i]++;
    for (int j = i + 1; j < count; j++) {
      chosen[j] = chosen[j - 1] + 1;
    }
    return true;
  }

  /**
   * Solves {@code sum(x[i] * columns[i]) == target} for a unique rational {@code x} by Gaussian
   * elimination.  Returns {@code null} if there is no solution or more than one.
   */
  @Nullable
  static Fraction[] solve(List<ExponentVector> columns, ExponentVector target) {
    SortedSet<String> symbols = Sets.newTreeSet(target.symbols());
    for (ExponentVector column : columns) {
      symbols.addAll(column.symbols());
    }
    List<String> rows = ImmutableList.copyOf(symbols);
    int width = columns.size();
    if (rows.size() < width) {
      return null;
    }

    Fraction[][] matrix = new Fraction[rows.size()][width + 1];
    for (int r = 0; r < rows.size(); r++) {
      for (int c = 0; c < width; c++) {
        matrix[r][c] = columns.get(c).get(rows.get(r));
      }
      matrix[r][width] = target.get(rows.get(r));
    }

    for (int col = 0; col < width; col++) {
      int pivot = col;
      while (pivot < rows.size() && matrix[pivot][col].getNumerator() == 0) {
        pivot++;
      }
      if (pivot == rows.size()) {
        return null;
      }
      Fraction[] swap = matrix[pivot];
      matrix[pivot] = matrix[col];
      matrix[col] = swap;

      Fraction lead = matrix[col][col];
      for (int c = col; c <= width; c++) {
        matrix[col][c] = matrix[col][c].divideBy(lead);
      }
      for (int r = 0; r < rows.size(); r++) {
        Fraction factor = matrix[r][col];
        if (r == col || factor.getNumerator() == 0) {
          continue;
        }
        for (int c = col; c <= width; c++) {
          matrix[r][c] = matrix[r][c].subtract(factor.multiplyBy(matrix[col][c]));
        }
      }
    }
    for (int r = width; r < rows.size(); r++) {
      if (matrix[r][width].getNumerator() != 0) {
        return null;
      }
    }

    Fraction[] solution = new Fraction[width];
    for (int c = 0; c < width; c++) {
      solution[c] = matrix[c][width];
    }
    return solution;
  }
}
