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
import com.google.styler.ast.Node;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Expands grouped directives and splits the statements of a scope body into directive categories
 * and other content.
 */
final class DirectiveClassifier {

  private final StyleOptions options;
  private final DirectiveSorter sorter;

  DirectiveClassifier(StyleOptions options, DirectiveSorter sorter) {
    this.options = options;
    this.sorter = sorter;
  }

  /**
   * Rewrites each grouped directive either into one directive per target or, when grouped forms are
   * kept, into the same group with its targets sorted. Other statements pass through.
   */
  ImmutableList<Node> expandAll(List<Node> statements) {
    ImmutableList.Builder<Node> result = ImmutableList.builder();
    for (Node statement : statements) {
      if (!statement.isDirective()) {
        result.add(statement);
      } else if (options.getRewriteMultiAlias()) {
        result.addAll(expand(statement));
      } else if (isExpandableGroup(statement)) {
        result.add(sorter.sortGroupTargets(statement));
      } else {
        result.add(statement);
      }
    }
    return result.build();
  }

  /**
   * Expands {@code alias A.{B, C.D}} into {@code alias A.B} and {@code alias A.C.D}. Each expansion
   * takes the line of its target and the last one the trailing newlines of the group. An empty
   * group and a bare {@code alias A} expand to nothing.
   */
  static ImmutableList<Node> expand(Node directive) {
    if (isRedundantAlias(directive)) {
      return ImmutableList.of();
    }
    if (!isExpandableGroup(directive)) {
      return ImmutableList.of(directive);
    }
    Node group = directive.getFirstChild();
    Node prefix = group.getFirstChild();
    ImmutableList.Builder<Node> expanded = ImmutableList.builder();
    Node last = null;
    for (Node target = group.getSecondChild(); target != null; target = target.getNext()) {
      Node qname = prefix.cloneTree();
      qname.shiftLines(target.getLineno() - prefix.getLineno());
      for (Node segment : target.children()) {
        qname.addChildToBack(segment.cloneTree());
      }
      last = new Node(directive.getToken(), qname).setLineno(target.getLineno());
      expanded.add(last);
    }
    if (last != null) {
      NodeUtil.setNewlines(last, NodeUtil.getNewlines(directive));
    }
    return expanded.build();
  }

  /**
   * Splits {@code statements} into directive categories and other content, preserving document
   * order within each. Directives of categories laid out ahead of aliases are spelled out against
   * the aliases seen so far, since they will no longer be able to see them.
   */
  DirectiveBuckets classify(List<Node> statements) {
    List<DirectiveCategory> order = options.getLayoutOrder();
    int aliasIndex = order.indexOf(DirectiveCategory.ALIAS);
    DirectiveBuckets.Builder buckets = DirectiveBuckets.builder();
    AliasEnv env = AliasEnv.empty();
    for (Node statement : statements) {
      DirectiveCategory category = categorize(statement);
      if (category == null) {
        buckets.addOther(statement);
        continue;
      }
      if (category.isDoc() && containsEquivalent(buckets.peek(category), statement)) {
        continue;
      }
      Node directive = statement;
      if (order.indexOf(category) < aliasIndex) {
        directive = env.expand(directive);
      }
      if (category == DirectiveCategory.ALIAS) {
        env = env.define(directive);
      }
      buckets.add(category, directive);
    }
    return buckets.build();
  }

  /**
   * Returns the category of {@code n}, or null when it belongs with the other content. Directives
   * without a target and groups that cannot be expanded are other content.
   */
  static @Nullable DirectiveCategory categorize(Node n) {
    DirectiveCategory category = DirectiveCategory.of(n);
    if (category == null || !n.hasChildren()) {
      return null;
    }
    if (n.getFirstChild().isGroup() && !isExpandableGroup(n)) {
      return null;
    }
    return category;
  }

  /** Whether {@code n} is a directive with a single group target whose members are all names. */
  static boolean isExpandableGroup(Node n) {
    if (!n.isDirective() || !n.hasOneChild() || !n.getFirstChild().isGroup()) {
      return false;
    }
    Node group = n.getFirstChild();
    if (!group.hasChildren() || !group.getFirstChild().isQualifiedName()) {
      return false;
    }
    for (Node target = group.getSecondChild(); target != null; target = target.getNext()) {
      if (!target.isQualifiedName()) {
        return false;
      }
    }
    return true;
  }

  /** {@code alias A} binds A to itself. */
  private static boolean isRedundantAlias(Node n) {
    if (!n.isAlias() || !n.hasOneChild()) {
      return false;
    }
    Node target = n.getFirstChild();
    return target.isQualifiedName() && target.hasOneChild() && target.getFirstChild().isName();
  }

  private static boolean containsEquivalent(List<Node> nodes, Node n) {
    for (Node existing : nodes) {
      if (existing.isEquivalentTo(n)) {
        return true;
      }
    }
    return false;
  }
}
