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

import com.google.common.base.Ascii;
import com.google.common.collect.ImmutableList;
import com.google.styler.ast.Node;
import com.google.styler.style.StyleOptions.SortOrder;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Orders the directives of one category. Directives compare by a sort key, which is their printed
 * form except for grouped directives, then by their printed form. Two directives equal on both are
 * duplicates and only the first is kept.
 */
final class DirectiveSorter {

  private final SortOrder sortOrder;

  DirectiveSorter(SortOrder sortOrder) {
    this.sortOrder = sortOrder;
  }

  /** Returns the deduplicated directives in sorted order. The input is not modified. */
  ImmutableList<Node> sort(List<Node> directives) {
    Map<String, Entry> unique = new LinkedHashMap<>();
    for (Node directive : directives) {
      Entry entry = new Entry(directive, sortKey(directive), tieBreak(directive));
      unique.putIfAbsent(entry.key + '\n' + entry.tie, entry);
    }
    List<Entry> entries = new ArrayList<>(unique.values());
    // List.sort is stable.
    entries.sort(
        Comparator.<Entry, String>comparing(e -> e.key).thenComparing(e -> e.tie));
    ImmutableList.Builder<Node> result = ImmutableList.builder();
    for (Entry entry : entries) {
      result.add(entry.node);
    }
    return result.build();
  }

  /**
   * Returns a copy of a grouped directive with its targets in sorted order. Any other directive is
   * returned as is.
   */
  Node sortGroupTargets(Node directive) {
    if (!directive.hasChildren() || !directive.getFirstChild().isGroup()) {
      return directive;
    }
    Node result = directive.cloneTree();
    Node group = result.getFirstChild();
    List<Node> targets = new ArrayList<>();
    for (Node target = group.getSecondChild(); target != null; target = target.getNext()) {
      targets.add(target);
    }
    targets.sort(Comparator.comparing(t -> fold(CodePrinter.print(t))));
    for (Node target : targets) {
      target.detach();
      group.addChildToBack(target);
    }
    return result;
  }

  /**
   * The primary key. A grouped directive sorts as if it were its alphabetically first expansion, so
   * {@code alias A.{C, B}} sorts as {@code alias A.B}.
   */
  String sortKey(Node directive) {
    Node target = directive.getFirstChild();
    if (!directive.isDirective() || target == null || !target.isGroup()) {
      return fold(CodePrinter.print(directive));
    }
    String prefix = CodePrinter.print(target.getFirstChild());
    String first = null;
    for (Node t = target.getSecondChild(); t != null; t = t.getNext()) {
      String printed = fold(CodePrinter.print(t));
      if (first == null || printed.compareTo(first) < 0) {
        first = printed;
      }
    }
    String key = first == null ? prefix : prefix + "." + first;
    return fold(directive.getToken().keyword() + " " + key);
  }

  String tieBreak(Node directive) {
    return fold(CodePrinter.print(directive));
  }

  private String fold(String s) {
    return sortOrder == SortOrder.ASCII ? s : Ascii.toLowerCase(s);
  }

  private static final class Entry {
    final Node node;
    final String key;
    final String tie;

    Entry(Node node, String key, String tie) {
      this.node = node;
      this.key = key;
      this.tie = tie;
    }
  }
}
