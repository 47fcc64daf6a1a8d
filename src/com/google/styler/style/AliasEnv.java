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
import com.google.common.collect.ImmutableSet;
import com.google.styler.ast.Node;
import java.util.LinkedHashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * The short names bound by {@code alias} directives, in effect at one point of a scope. Each
 * binding maps the alias's last segment (or its {@code as:} name) to the full qualified name.
 *
 * <p>Instances are immutable; {@link #define} returns an extended copy, with later aliases of the
 * same short name shadowing earlier ones as they would when the directives run in order.
 */
final class AliasEnv {

  private static final AliasEnv EMPTY = new AliasEnv(ImmutableMap.of());

  // Values are detached QUALIFIED_NAME nodes that are never handed out without cloning.
  private final ImmutableMap<String, Node> bindings;

  private AliasEnv(ImmutableMap<String, Node> bindings) {
    this.bindings = bindings;
  }

  static AliasEnv empty() {
    return EMPTY;
  }

  /** Builds the environment of a sequence of directives. */
  static AliasEnv of(Iterable<Node> directives) {
    return EMPTY.define(directives);
  }

  AliasEnv define(Iterable<Node> directives) {
    Map<String, Node> result = new LinkedHashMap<>(bindings);
    for (Node directive : directives) {
      defineInto(result, directive);
    }
    return new AliasEnv(ImmutableMap.copyOf(result));
  }

  AliasEnv define(Node directive) {
    return define(ImmutableList.of(directive));
  }

  private static void defineInto(Map<String, Node> result, Node directive) {
    if (!directive.isAlias() || !directive.hasChildren()) {
      return;
    }
    Node target = directive.getFirstChild();
    if (target.isGroup()) {
      Node prefix = target.getFirstChild();
      for (Node child = prefix.getNext(); child != null; child = child.getNext()) {
        if (child.isQualifiedName()) {
          bind(result, lastLiteral(child), concat(prefix, child));
        }
      }
      return;
    }
    if (!target.isQualifiedName()) {
      // `alias __MODULE__` and other shapes bind nothing we can name.
      return;
    }
    Node as = NodeUtil.getOption(directive, "as");
    if (as != null) {
      bind(result, as.isQualifiedName() && as.hasOneChild() ? lastLiteral(as) : null, target);
    } else if (directive.hasOneChild()) {
      bind(result, lastLiteral(target), target);
    }
  }

  private static void bind(Map<String, Node> result, @Nullable String shortName, Node target) {
    if (shortName != null) {
      result.put(shortName, target.cloneTree());
    }
  }

  private static @Nullable String lastLiteral(Node qname) {
    Node last = qname.getLastChild();
    return last != null && last.isName() ? last.getString() : null;
  }

  private static Node concat(Node prefix, Node suffix) {
    Node result = prefix.cloneTree();
    for (Node segment : suffix.children()) {
      result.addChildToBack(segment.cloneTree());
    }
    return result;
  }

  boolean isBound(String shortName) {
    return bindings.containsKey(shortName);
  }

  ImmutableSet<String> shortNames() {
    return bindings.keySet();
  }

  /** Returns the literal path bound to {@code shortName}, or null if unbound or computed. */
  @Nullable ImmutableList<String> getPath(String shortName) {
    Node target = bindings.get(shortName);
    return target == null ? null : NodeUtil.getLiteralSegments(target);
  }

  /** Returns the literal first segments of every bound path. */
  ImmutableSet<String> firstSegments() {
    ImmutableSet.Builder<String> firsts = ImmutableSet.builder();
    for (Node target : bindings.values()) {
      Node first = target.getFirstChild();
      if (first != null && first.isName()) {
        firsts.add(first.getString());
      }
    }
    return firsts.build();
  }

  /**
   * Returns a copy of {@code n} in which every qualified name that starts with a bound short name
   * is spelled out in full. Group prefixes are expanded; group targets are relative to their
   * prefix and stay as they are, as do {@code as:} names.
   *
   * <p>Expanding a fully expanded name is a no-op unless its first segment is itself bound.
   */
  Node expand(Node n) {
    Node result = n.cloneTree();
    if (bindings.isEmpty()) {
      return result;
    }
    expandInPlace(result);
    return result;
  }

  private void expandInPlace(Node n) {
    if (n.isQualifiedName()) {
      Node first = n.getFirstChild();
      if (first != null && first.isName()) {
        Node target = bindings.get(first.getString());
        if (target != null) {
          int lineno = first.getLineno();
          first.detach();
          Node anchor = null;
          for (Node segment : target.children()) {
            Node copy = segment.cloneTree().setLineno(lineno);
            if (anchor == null) {
              n.addChildToFront(copy);
            } else {
              copy.insertAfter(anchor);
            }
            anchor = copy;
          }
        }
      }
      return;
    }
    if (n.isGroup()) {
      expandInPlace(n.getFirstChild());
      return;
    }
    if (n.isKeyword() && "as".equals(n.getString()) && n.getParent() != null
        && n.getParent().isAlias()) {
      return;
    }
    for (Node c = n.getFirstChild(); c != null; c = c.getNext()) {
      expandInPlace(c);
    }
  }
}
