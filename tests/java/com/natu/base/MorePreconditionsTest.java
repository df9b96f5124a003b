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

import java.util.List;

import com.google.common.collect.ImmutableList;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.fail;

public class MorePreconditionsTest {

  @Test(expected = NullPointerException.class)
  public void testCheckNotBlankStringNull() {
    MorePreconditions.checkNotBlank((String) null);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testCheckNotBlankStringEmpty() {
    MorePreconditions.checkNotBlank("");
  }

  @Test(expected = IllegalArgumentException.class)
  public void testCheckNotBlankWhitespace() {
    MorePreconditions.checkNotBlank("\t\r\n ");
  }

  @Test
  public void testCheckNotBlankStringValid() {
    String argument = new String("base-SI.ini");
    assertSame(argument, MorePreconditions.checkNotBlank(argument));
  }

  @Test
  public void testCheckNotBlankStringExceptionFormatting() {
    try {
      MorePreconditions.checkNotBlank((String) null, "unit %s has no symbol", "meter");
      fail();
    } catch (NullPointerException e) {
      assertEquals("unit meter has no symbol", e.getMessage());
    }

    try {
      MorePreconditions.checkNotBlank("", "prefix %s is blank", 3);
      fail();
    } catch (IllegalArgumentException e) {
      assertEquals("prefix 3 is blank", e.getMessage());
    }
  }

  @Test(expected = IllegalArgumentException.class)
  public void testCheckNotEmptyIterableEmpty() {
    MorePreconditions.checkNotEmpty(ImmutableList.<String>of(), "no sources");
  }

  @Test
  public void testCheckNotEmptyIterableValid() {
    List<String> sources = ImmutableList.of("derived.ini");
    assertSame(sources, MorePreconditions.checkNotEmpty(sources, "no sources"));
  }

  @Test
  public void testCheckNotNegative() {
    assertEquals(0, MorePreconditions.checkNotNegative(0, "level"));
    try {
      MorePreconditions.checkNotNegative(-1, "level");
      fail();
    } catch (IllegalArgumentException e) {
      assertEquals("level must not be negative, got -1", e.getMessage());
    }
  }
}
