/*
 * Copyright 2015 VMware, Inc. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License"); you may not
 * use this file except in compliance with the License.  You may obtain a copy of
 * the License at http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software distributed
 * under the License is distributed on an "AS IS" BASIS, without warranties or
 * conditions of any kind, EITHER EXPRESS OR IMPLIED.  See the License for the
 * specific language governing permissions and limitations under the License.
 */

package com.edgemetal.dhcp.store;

import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableMap;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Equality based label selector, written {@code key=value[,key=value...]}. All terms must match.
 */
public class LabelSelector {

  private static final LabelSelector EVERYTHING = new LabelSelector(ImmutableMap.<String, String>of());

  private final ImmutableMap<String, String> terms;

  private LabelSelector(ImmutableMap<String, String> terms) {
    this.terms = terms;
  }

  public static LabelSelector everything() {
    return EVERYTHING;
  }

  public static LabelSelector of(String key, String value) {
    Preconditions.checkArgument(key != null && !key.isEmpty(), "label key is empty");
    Preconditions.checkArgument(value != null, "label value is null");
    return new LabelSelector(ImmutableMap.of(key, value));
  }

  public static LabelSelector of(Map<String, String> terms) {
    return new LabelSelector(ImmutableMap.copyOf(terms));
  }

  /**
   * Parses a selector string.
   *
   * @param selector selector such as {@code oob=true}
   * @return parsed selector
   * @throws IllegalArgumentException if a term is not of the form {@code key=value}
   */
  public static LabelSelector parse(String selector) {
    Preconditions.checkArgument(selector != null && !selector.trim().isEmpty(), "label selector is empty");

    ImmutableMap.Builder<String, String> builder = ImmutableMap.builder();
    for (String term : Splitter.on(',').trimResults().split(selector)) {
      List<String> parts = Splitter.on('=').limit(2).trimResults().splitToList(term);
      if (parts.size() != 2 || parts.get(0).isEmpty()) {
        throw new IllegalArgumentException(
            String.format("Invalid label selector term '%s' in '%s', expected key=value", term, selector));
      }
      builder.put(parts.get(0), parts.get(1));
    }
    return new LabelSelector(builder.build());
  }

  public ImmutableMap<String, String> getTerms() {
    return terms;
  }

  public boolean matches(Map<String, String> labels) {
    for (Map.Entry<String, String> term : terms.entrySet()) {
      if (labels == null || !Objects.equals(labels.get(term.getKey()), term.getValue())) {
        return false;
      }
    }
    return true;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    return terms.equals(((LabelSelector) o).terms);
  }

  @Override
  public int hashCode() {
    return terms.hashCode();
  }

  @Override
  public String toString() {
    return Joiner.on(',').withKeyValueSeparator("=").join(terms);
  }
}
