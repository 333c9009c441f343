// This file is part of Downstore.
// Copyright (C) 2026  The Downstore Authors.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package net.downstore.query.filter;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.List;
import java.util.Map;

import org.junit.Test;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import net.downstore.utils.JSON;

public class TestLabelFilters {
  private static final Map<String, String> LABELS = ImmutableMap.of(
      "host", "web01", "dc", "phx");

  @Test
  public void literalOrBuilder() throws Exception {
    LabelValueLiteralOrFilter filter = LabelValueLiteralOrFilter.newBuilder()
        .setLabel("host")
        .setFilter("web01| web02 |web01")
        .build();
    assertEquals("host", filter.getLabel());
    assertEquals(ImmutableList.of("web01", "web02"), filter.literals());
    assertTrue(filter.matches("web01"));
    assertTrue(filter.matches("web02"));
    assertFalse(filter.matches("web03"));
    assertFalse(filter.matches(""));

    try {
      LabelValueLiteralOrFilter.newBuilder()
          .setFilter("web01")
          .build();
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    try {
      LabelValueLiteralOrFilter.newBuilder()
          .setLabel("host")
          .setFilter("|")
          .build();
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }

  @Test
  public void regexIsAnchored() throws Exception {
    LabelFilter filter = LabelFilters.regex("host", "web0[12]");
    assertTrue(filter.matches("web01"));
    assertFalse(filter.matches("web011"));
    assertFalse(filter.matches("xweb01"));

    LabelValueRegexFilter all = (LabelValueRegexFilter)
        LabelFilters.regex("host", ".*");
    assertTrue(all.matchesAll());
    assertTrue(all.matches(""));

    try {
      LabelFilters.regex("host", "web[");
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }

  @Test
  public void absentLabelsMatchTheEmptyValue() throws Exception {
    assertTrue(LabelFilters.equalTo("host", "web01").matches(LABELS));
    assertFalse(LabelFilters.equalTo("app", "db").matches(LABELS));
    assertTrue(LabelFilters.notEqualTo("app", "db").matches(LABELS));
    assertFalse(LabelFilters.notEqualTo("host", "web01").matches(LABELS));
    assertTrue(LabelFilters.notRegex("app", "d.*").matches(LABELS));
    assertFalse(LabelFilters.regex("app", "d.*").matches(LABELS));
    assertTrue(LabelFilters.regex("app", "d.*|").matches(LABELS));
  }

  @Test
  public void matchesAllIsAConjunction() throws Exception {
    assertTrue(LabelFilters.matchesAll(ImmutableList.<LabelFilter>of(), LABELS));
    assertTrue(LabelFilters.matchesAll(ImmutableList.of(
        LabelFilters.equalTo("host", "web01"),
        LabelFilters.regex("dc", "p.*")), LABELS));
    assertFalse(LabelFilters.matchesAll(ImmutableList.of(
        LabelFilters.equalTo("host", "web01"),
        LabelFilters.equalTo("dc", "lga")), LABELS));
  }

  @Test
  public void parse() throws Exception {
    LabelFilter filter = LabelFilters.parse(JSON.parseToTree(
        "{\"type\":\"LabelValueLiteralOr\",\"label\":\"host\",\"filter\":\"web01|web02\"}"));
    assertTrue(filter instanceof LabelValueLiteralOrFilter);
    assertEquals("host", filter.getLabel());
    assertEquals("web01|web02", filter.getFilter());

    filter = LabelFilters.parse(JSON.parseToTree(
        "{\"type\":\"Not\",\"filter\":"
        + "{\"type\":\"LabelValueRegex\",\"label\":\"dc\",\"filter\":\"p.*\"}}"));
    assertTrue(filter instanceof NotLabelFilter);
    assertTrue(((NotLabelFilter) filter).getWrapped() instanceof LabelValueRegexFilter);
    assertFalse(filter.matches("phx"));
    assertTrue(filter.matches("lga"));

    // no type
    try {
      LabelFilters.parse(JSON.parseToTree("{\"label\":\"host\",\"filter\":\"a\"}"));
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    // unknown type
    try {
      LabelFilters.parse(JSON.parseToTree(
          "{\"type\":\"Nope\",\"label\":\"host\",\"filter\":\"a\"}"));
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }

    // null nested filter
    try {
      LabelFilters.parse(JSON.parseToTree("{\"type\":\"Not\",\"filter\":null}"));
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }

  @Test
  public void parseList() throws Exception {
    List<LabelFilter> filters = LabelFilters.parseList("["
        + "{\"type\":\"LabelValueLiteralOr\",\"label\":\"host\",\"filter\":\"web01\"},"
        + "{\"type\":\"LabelValueRegex\",\"label\":\"dc\",\"filter\":\"p.*\"}]");
    assertEquals(2, filters.size());
    assertEquals(LabelFilters.equalTo("host", "web01"), filters.get(0));
    assertEquals(LabelFilters.regex("dc", "p.*"), filters.get(1));

    try {
      LabelFilters.parseList("{\"type\":\"LabelValueRegex\"}");
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }

  @Test
  public void serialize() throws Exception {
    final String json = JSON.serializeToString(LabelFilters.equalTo("host", "web01"));
    assertTrue(json.contains("\"type\":\"LabelValueLiteralOr\""));
    assertTrue(json.contains("\"label\":\"host\""));
    assertTrue(json.contains("\"filter\":\"web01\""));
  }

  @Test
  public void equalsAndHashCode() throws Exception {
    assertEquals(LabelFilters.equalTo("host", "web01"),
        LabelFilters.equalTo("host", "web01"));
    assertEquals(LabelFilters.equalTo("host", "web01").hashCode(),
        LabelFilters.equalTo("host", "web01").hashCode());
    assertNotEquals(LabelFilters.equalTo("host", "web01"),
        LabelFilters.regex("host", "web01"));
    assertEquals(LabelFilters.notEqualTo("host", "web01"),
        LabelFilters.notEqualTo("host", "web01"));
    assertNotEquals(LabelFilters.notEqualTo("host", "web01"),
        LabelFilters.equalTo("host", "web01"));
  }
}
