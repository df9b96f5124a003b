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

import com.google.common.collect.ImmutableList;

import org.junit.Test;

import com.natu.quantity.ExponentVector;
import com.natu.quantity.Quantity;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.fail;

public class SymbolTableTest {

  @Test
  public void testDefinitionOrder() {
    SymbolTable.Builder builder = SymbolTable.builder();
    ScalarUnit m = new ScalarUnit("m", 1, ExponentVector.of("L"), true);
    ScalarUnit s = new ScalarUnit("s", 1, ExponentVector.of("T"), true);
    Constant c = new Constant("c", Quantity.of(299792458, "L/T"));
    assertNull(builder.define(m));
    assertNull(builder.define(s));
    assertNull(builder.define(c));

    SymbolTable table = builder.build();
    assertEquals(ImmutableList.<UnitEntry>of(m, s, c), table.entries());
    assertEquals(3, table.size());
    assertSame(s, table.get("s"));
    assertNull(table.get("km"));
  }

  @Test
  public void testRedefinitionReplacesAndMovesToEnd() {
    SymbolTable.Builder builder = SymbolTable.builder();
    Constant first = new Constant("x", Quantity.of(5));
    Constant y = new Constant("y", Quantity.of(6));
    Constant second = new Constant("x", Quantity.of(7));
    builder.define(first);
    builder.define(y);
    assertSame(first, builder.define(second));

    SymbolTable table = builder.build();
    assertEquals(ImmutableList.<UnitEntry>of(y, second), table.entries());
    assertEquals(7, table.get("x").asConstant().getQuantity().getValue(), 0);
  }

  @Test
  public void testBuiltTableIsIndependentOfBuilder() {
    SymbolTable.Builder builder = SymbolTable.builder();
    builder.define(new Constant("x", Quantity.of(5)));
    SymbolTable table = builder.build();
    builder.define(new Constant("z", Quantity.of(1)));
    builder.addCoherentRelation(ExponentVector.parse("J/(N*m)"));

    assertEquals(1, table.size());
    assertEquals(0, table.getCoherentRelations().size());
    assertEquals(1, builder.build().getCoherentRelations().size());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testEmptyRelationRejected() {
    SymbolTable.builder().addCoherentRelation(ExponentVector.EMPTY);
  }

  @Test
  public void testWrongKindAccess() {
    UnitEntry c = new Constant("c", Quantity.of(299792458, "L/T"));
    try {
      c.asUnit();
      fail("A constant is not a unit");
    } catch (IllegalStateException e) {
      assertEquals("'c' is a CONSTANT, not a UNIT", e.getMessage());
    }
  }
}
