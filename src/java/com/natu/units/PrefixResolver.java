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

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.logging.Level;
import java.util.logging.Logger;

import javax.annotation.Nullable;

import com.google.common.base.Function;
import com.google.common.base.Preconditions;

import org.apache.commons.lang.math.Fraction;

import com.natu.quantity.ExponentVector;
import com.natu.quantity.Quantity;

/**
 * Looks up names that may carry an SI prefix, such as {@code km} or {@code ns}.
 *
 * <p>A name that is defined exactly always resolves to its own entry, so an explicitly defined
 * {@code kg} is never read as kilo-{@code g}.  Otherwise the name is split into a prefix and a
 * base symbol, trying a one-character prefix before the two-character {@code da}.  The split only
 * succeeds if the base symbol is a prefixable unit; constants are never prefixable.
 */
public class PrefixResolver {

  private static final Logger LOG = Logger.getLogger(PrefixResolver.class.getName());

  private final Function<String, UnitEntry> exactLookup;
  @Nullable private final ConcurrentMap<String, UnitEntry> synthesized;

  /**
   * Creates a resolver over the given exact-match lookup.
   *
   * @param exactLookup returns the entry defined under a name, or {@code null}
   * @param memoize whether synthesized units may be cached; only safe if the entries behind
   *     {@code exactLookup} never change
   */
  public PrefixResolver(Function<String, UnitEntry> exactLookup, boolean memoize) {
    this.exactLookup = Preconditions.checkNotNull(exactLookup);
    this.synthesized = memoize ? new ConcurrentHashMap<String, UnitEntry>() : null;
  }

  /**
   * Creates a caching resolver over a frozen table.
   */
  public static PrefixResolver forTable(final SymbolTable table) {
    return new PrefixResolver(new Function<String, UnitEntry>() {
      @Override public UnitEntry apply(String name) {
        return table.get(name);
      }
    }, true);
  }

  /**
   * Creates a resolver over a table that is still being built.  Nothing is cached.
   */
  public static PrefixResolver forBuilder(final SymbolTable.Builder builder) {
    return new PrefixResolver(new Function<String, UnitEntry>() {
      @Override public UnitEntry apply(String name) {
        return builder.get(name);
      }
    }, false);
  }

  /**
   * Resolves {@code name} to an entry.
   *
   * @param name a symbol, possibly prefixed
   * @return the resolved entry
   * @throws UnitNotFoundException if the name can not be resolved
   */
  public UnitEntry lookup(String name) {
    StringBuilder reason = new StringBuilder();
    UnitEntry entry = resolve(name, reason);
    if (entry == null) {
      throw new UnitNotFoundException(name, reason.toString());
    }
    return entry;
  }

  /**
   * Resolves {@code name} to an entry, returning {@code null} if it can not be resolved.
   */
  @Nullable
  public UnitEntry find(String name) {
    return resolve(name, new StringBuilder());
  }

  /**
   * Evaluates a product of powers of constants and scalar units, such as {@code lbf/inch2}.  The
   * result is displayed as {@code units}.
   *
   * @param units the factors, over symbol names
   * @return the product, or {@code null} if a symbol can not be resolved or is a lambda unit
   */
  @Nullable
  public Quantity findProduct(ExponentVector units) {
    Preconditions.checkNotNull(units);
    Quantity product = Quantity.ONE;
    for (Map.Entry<String, Fraction> factor : units.asMap().entrySet()) {
      UnitEntry entry = find(factor.getKey());
      if (entry == null) {
        return null;
      }
      Quantity quantity;
      switch (entry.getKind()) {
        case CONSTANT:
          quantity = entry.asConstant().getQuantity();
          break;
        case UNIT:
          quantity = entry.asUnit().getQuantity();
          break;
        default:
          return null;
      }
      product = product.multiply(quantity.power(factor.getValue()));
    }
    return product.withDisplayUnit(units);
  }

  @Nullable
  private UnitEntry resolve(String name, StringBuilder reason) {
    Preconditions.checkNotNull(name);
    UnitEntry exact = exactLookup.apply(name);
    if (exact != null) {
      return exact;
    }
    if (synthesized != null) {
      UnitEntry cached = synthesized.get(name);
      if (cached != null) {
        return cached;
      }
    }

    reason.append("it isn't a defined symbol");
    for (int length = 1; length <= Prefix.MAX_LENGTH && length < name.length(); length++) {
      String baseSymbol = name.substring(length);
      UnitEntry base = exactLookup.apply(baseSymbol);
      if (base == null) {
        continue;
      }
      if (!base.isPrefixable()) {
        replace(reason, "'" + baseSymbol + "' isn't prefixable");
        continue;
      }
      Prefix prefix = Prefix.fromSymbol(name.substring(0, length));
      if (prefix == null) {
        replace(reason, "'" + name.substring(0, length) + "' isn't a valid prefix");
        continue;
      }

      UnitEntry prefixed = applyPrefix(prefix, base);
      if (synthesized != null) {
        UnitEntry raced = synthesized.putIfAbsent(name, prefixed);
        if (raced != null) {
          return raced;
        }
        if (LOG.isLoggable(Level.FINEST)) {
          LOG.finest(String.format("Synthesized %s as %s-%s", name, prefix.name(), baseSymbol));
        }
      }
      return prefixed;
    }
    return null;
  }

  private static UnitEntry applyPrefix(Prefix prefix, UnitEntry base) {
    switch (base.getKind()) {
      case UNIT:
        return base.asUnit().withPrefix(prefix);
      case LAMBDA_UNIT:
        return base.asLambdaUnit().withPrefix(prefix);
      default:
        throw new IllegalStateException("Only units can be prefixed, got " + base);
    }
  }

  private static void replace(StringBuilder builder, String text) {
    builder.setLength(0);
    builder.append(text);
  }
}
