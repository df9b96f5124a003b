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

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;

import com.natu.quantity.ExponentVector;

/**
 * The frozen, ordered set of constants and units that make up one unit system, together with the
 * coherent relations found among its units while it was built.
 *
 * <p>Entries are kept in definition order.  A table is immutable once built and may be shared
 * freely between threads.
 */
public final class SymbolTable {

  private final ImmutableMap<String, UnitEntry> entries;
  private final ImmutableList<ExponentVector> coherentRelations;

  private SymbolTable(Map<String, UnitEntry> entries, List<ExponentVector> coherentRelations) {
    this.entries = ImmutableMap.copyOf(entries);
    this.coherentRelations = ImmutableList.copyOf(coherentRelations);
  }

  /**
   * Returns the entry defined under {@code name}, without trying prefixes.
   */
  @Nullable
  public UnitEntry get(String name) {
    return entries.get(name);
  }

  public boolean contains(String name) {
    return entries.containsKey(name);
  }

  /**
   * Returns all entries in definition order.
   */
  public ImmutableList<UnitEntry> entries() {
    return entries.values().asList();
  }

  public int size() {
    return entries.size();
  }

  /**
   * Returns the relations among units that evaluate to unity, in the order they were found.  A
   * relation {@code {kg: 1, m: 2, s: -2, J: -1}} records that {@code J = kg*m2/s2}.
   */
  public ImmutableList<ExponentVector> getCoherentRelations() {
    return coherentRelations;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Accumulates entries in definition order.  A builder is not thread safe.
   */
  public static class Builder {
    private final Map<String, UnitEntry> entries = new LinkedHashMap<String, UnitEntry>();
    private final List<ExponentVector> coherentRelations = Lists.newArrayList();

    /**
     * Binds {@code entry} under its name.  A name that is already bound is replaced and the new
     * entry moves to the end of the definition order; coherent relations that mention the
     * replaced symbol no longer hold and are dropped.
     *
     * @param entry the entry to bind
     * @return the entry previously bound to the same name, or {@code null}
     */
    @Nullable
    public UnitEntry define(UnitEntry entry) {
      Preconditions.checkNotNull(entry);
      UnitEntry previous = entries.remove(entry.getName());
      entries.put(entry.getName(), entry);
      if (previous != null) {
        Iterator<ExponentVector> relations = coherentRelations.iterator();
        while (relations.hasNext()) {
          if (relations.next().contains(entry.getName())) {
            relations.remove();
          }
        }
      }
      return previous;
    }

    @Nullable
    public UnitEntry get(String name) {
      return entries.get(name);
    }

    public Builder addCoherentRelation(ExponentVector relation) {
      Preconditions.checkArgument(!relation.isEmpty(), "A coherent relation must not be empty");
      coherentRelations.add(relation);
      return this;
    }

    public int size() {
      return entries.size();
    }

    public SymbolTable build() {
      return new SymbolTable(entries, coherentRelations);
    }
  }
}
