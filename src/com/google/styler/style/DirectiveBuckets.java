/*
 * Copyright 2025 The Styler Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.google.styler.style;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.styler.ast.Node;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * The directives of one scope body split by category, plus everything else in document order.
 * Immutable; each pipeline stage produces a new instance.
 */
final class DirectiveBuckets {

  private final ImmutableMap<DirectiveCategory, ImmutableList<Node>> directives;
  private final ImmutableList<Node> other;

  private DirectiveBuckets(
      Map<DirectiveCategory, ImmutableList<Node>> directives, ImmutableList<Node> other) {
    this.directives = ImmutableMap.copyOf(directives);
    this.other = other;
  }

  ImmutableList<Node> get(DirectiveCategory category) {
    return directives.getOrDefault(category, ImmutableList.of());
  }

  ImmutableList<Node> getOther() {
    return other;
  }

  DirectiveBuckets with(DirectiveCategory category, List<Node> nodes) {
    Map<DirectiveCategory, ImmutableList<Node>> copy = new EnumMap<>(DirectiveCategory.class);
    copy.putAll(directives);
    copy.put(category, ImmutableList.copyOf(nodes));
    return new DirectiveBuckets(copy, other);
  }

  DirectiveBuckets withOther(List<Node> nodes) {
    return new DirectiveBuckets(directives, ImmutableList.copyOf(nodes));
  }

  /** Returns every directive, category by category in {@code order}. */
  ImmutableList<Node> directivesInOrder(List<DirectiveCategory> order) {
    ImmutableList.Builder<Node> result = ImmutableList.builder();
    for (DirectiveCategory category : order) {
      result.addAll(get(category));
    }
    return result.build();
  }

  static Builder builder() {
    return new Builder();
  }

  /** Accumulates directives in document order. */
  static final class Builder {
    private final Map<DirectiveCategory, List<Node>> directives =
        new EnumMap<>(DirectiveCategory.class);
    private final List<Node> other = new ArrayList<>();

    void add(DirectiveCategory category, Node n) {
      directives.computeIfAbsent(category, k -> new ArrayList<>()).add(n);
    }

    void addAll(DirectiveCategory category, List<Node> nodes) {
      directives.computeIfAbsent(category, k -> new ArrayList<>()).addAll(nodes);
    }

    List<Node> peek(DirectiveCategory category) {
      return directives.getOrDefault(category, ImmutableList.of());
    }

    void addOther(Node n) {
      other.add(n);
    }

    DirectiveBuckets build() {
      Map<DirectiveCategory, ImmutableList<Node>> result = new EnumMap<>(DirectiveCategory.class);
      for (Map.Entry<DirectiveCategory, List<Node>> entry : directives.entrySet()) {
        result.put(entry.getKey(), ImmutableList.copyOf(entry.getValue()));
      }
      return new DirectiveBuckets(result, ImmutableList.copyOf(other));
    }
  }
}
