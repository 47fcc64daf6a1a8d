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
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Iterables;
import com.google.styler.ast.IR;
import com.google.styler.ast.Node;
import com.google.styler.style.NodeTraversal.Step;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;

/**
 * Finds deep module names that are referenced often enough to deserve an alias at the top of their
 * scope, and shortens their references once the alias exists.
 *
 * <p>A name is only lifted when the short name it would introduce cannot change the meaning of any
 * other reference: it must not be bound already, be the name of a submodule, or be the first
 * segment of some other name in the scope.
 */
final class AliasLifter {

  /**
   * Short names of standard library modules. Aliasing anything to one of these would shadow the
   * standard module for the whole scope.
   */
  static final ImmutableSet<String> RESERVED_NAMES =
      ImmutableSet.of(
          "Access",
          "Agent",
          "Application",
          "Atom",
          "Base",
          "Behaviour",
          "Bitwise",
          "Code",
          "Date",
          "DateTime",
          "Dict",
          "Enum",
          "Exception",
          "File",
          "Float",
          "GenEvent",
          "GenServer",
          "HashDict",
          "HashSet",
          "Integer",
          "IO",
          "Kernel",
          "Keyword",
          "List",
          "Macro",
          "Map",
          "MapSet",
          "Module",
          "NaiveDateTime",
          "Node",
          "OptionParser",
          "Path",
          "Port",
          "Process",
          "Protocol",
          "Range",
          "Record",
          "Regex",
          "Registry",
          "Set",
          "Stream",
          "String",
          "StringIO",
          "Supervisor",
          "System",
          "Task",
          "Time",
          "Tuple",
          "URI",
          "Version");

  private final StyleOptions options;

  AliasLifter(StyleOptions options) {
    this.options = options;
  }

  /** Why a short name can never be lifted. */
  private enum Collision {
    SUBMODULE,
    FIRST_SEGMENT,
  }

  /** What is known so far about one short name: either a collision or a path and its count. */
  private static final class Tally {
    final @Nullable Collision collision;
    final @Nullable ImmutableList<String> path;
    final int count;

    Tally(Collision collision) {
      this.collision = collision;
      this.path = null;
      this.count = 0;
    }

    Tally(ImmutableList<String> path, int count) {
      this.collision = null;
      this.path = path;
      this.count = count;
    }
  }

  /**
   * Returns the paths referenced in {@code nodes} often enough to be lifted, in the order they were
   * first seen.
   *
   * @param env the aliases already present in the scope
   */
  ImmutableSet<ImmutableList<String>> findLiftable(Iterable<Node> nodes, AliasEnv env) {
    Set<String> excluded =
        ImmutableSet.<String>builder()
            .addAll(env.shortNames())
            .addAll(options.getLiftAliasExcludedLastnames())
            .addAll(RESERVED_NAMES)
            .build();
    ImmutableSet<String> firsts = env.firstSegments();
    Map<String, Tally> lifts = new LinkedHashMap<>();

    for (Node root : nodes) {
      NodeTraversal.traverse(
          root,
          cursor -> {
            Node n = cursor.node();
            if (n.isScope()) {
              Node name = NodeUtil.getScopeName(n);
              ImmutableList<String> segments = NodeUtil.getLiteralSegments(name);
              if (n.isModule() && segments != null && !segments.isEmpty()) {
                lifts.put(Iterables.getLast(segments), new Tally(Collision.SUBMODULE));
              }
              cursor.moveTo(NodeUtil.getScopeBody(n));
              return Step.CONTINUE;
            }
            if (n.isQuote()) {
              return Step.SKIP;
            }
            if (isUnliftableTarget(n)) {
              // The target is skipped, the options are walked.
              cursor.moveTo(n.getFirstChild());
              return Step.SKIP;
            }
            if (n.isQualifiedName()) {
              ImmutableList<String> path = NodeUtil.getLiteralSegments(n);
              if (path != null && path.size() >= 2) {
                count(path, env, excluded, firsts, lifts);
              }
              return Step.SKIP;
            }
            return Step.CONTINUE;
          });
    }

    ImmutableSet.Builder<ImmutableList<String>> liftable = ImmutableSet.builder();
    for (Tally tally : lifts.values()) {
      if (tally.path != null && tally.count > options.getLiftAliasFrequency()) {
        liftable.add(tally.path);
      }
    }
    return liftable.build();
  }

  private void count(
      ImmutableList<String> path,
      AliasEnv env,
      Set<String> excluded,
      Set<String> firsts,
      Map<String, Tally> lifts) {
    String first = path.get(0);
    String last = Iterables.getLast(path);
    Tally seen = lifts.get(last);
    if (path.equals(env.getPath(last))) {
      // Already aliased; keep the alias in play.
      lifts.put(last, new Tally(path, options.getLiftAliasFrequency() + 1));
    } else if (excluded.contains(last)
        || isExcludedNamespace(path)
        || path.size() <= options.getLiftAliasDepth()) {
      // Shadows a binding, excluded, or too shallow.
    } else if (last.compareTo(first) > 0 && firsts.contains(last)) {
      // The new alias would sort above an existing alias starting with the same name.
    } else if (!isIncluded(path)) {
      // Filtered out.
    } else if (seen == null) {
      lifts.put(last, new Tally(path, 1));
    } else if (path.equals(seen.path)) {
      lifts.put(last, new Tally(path, seen.count + 1));
    }
    lifts.put(first, new Tally(Collision.FIRST_SEGMENT));
  }

  private boolean isExcludedNamespace(List<String> path) {
    String dotted = NodeUtil.join(path);
    for (String namespace : options.getLiftAliasExcludedNamespaces()) {
      if (dotted.startsWith(namespace + ".")) {
        return true;
      }
    }
    return false;
  }

  private boolean isIncluded(List<String> path) {
    if (options.getLiftAliasOnly().isEmpty()) {
      return true;
    }
    String dotted = NodeUtil.join(path);
    for (Pattern pattern : options.getLiftAliasOnly()) {
      if (pattern.matcher(dotted).find()) {
        return true;
      }
    }
    return false;
  }

  /** Targets of {@code use}, {@code import} and {@code @behaviour} keep their full names. */
  private static boolean isUnliftableTarget(Node n) {
    return (n.isUse() || n.isImport() || n.isAttribute("behaviour"))
        && n.hasChildren()
        && n.getFirstChild().isQualifiedName();
  }

  /**
   * Returns copies of {@code nodes} with every reference to a lifted path shortened to its last
   * segment. Nested aliases of lifted paths are dropped, the lifted alias covers them. Scope names
   * are left alone.
   */
  ImmutableList<Node> lift(List<Node> nodes, Set<ImmutableList<String>> liftable) {
    if (liftable.isEmpty()) {
      return ImmutableList.copyOf(nodes);
    }
    Node holder = IR.block();
    for (Node n : nodes) {
      holder.addChildToBack(n.cloneTree());
    }
    NodeTraversal.traverse(
        holder,
        cursor -> {
          Node n = cursor.node();
          if (n.isScope()) {
            cursor.moveTo(NodeUtil.getScopeBody(n));
            return Step.CONTINUE;
          }
          if (n.isAlias() && n.hasOneChild() && isLifted(n.getFirstChild(), liftable)) {
            cursor.remove();
            return Step.SKIP;
          }
          if (isLifted(n, liftable)) {
            Node name = n.getLastChild();
            cursor.replace(new Node(n.getToken(), name.cloneTree()).setLineno(n.getLineno()));
            return Step.SKIP;
          }
          return Step.CONTINUE;
        });
    ImmutableList<Node> result = holder.childList();
    holder.detachChildren();
    return result;
  }

  private boolean isLifted(Node n, Set<ImmutableList<String>> liftable) {
    if (!n.isQualifiedName()) {
      return false;
    }
    ImmutableList<String> path = NodeUtil.getLiteralSegments(n);
    return path != null
        && path.size() >= 2
        && path.size() > options.getLiftAliasDepth()
        && liftable.contains(path);
  }

  /** Returns a new alias for {@code path}, spelled out against the existing aliases. */
  static Node newAlias(List<String> path, AliasEnv env) {
    int line = LineNumberReconciler.MAX_LINE;
    Node alias = IR.alias(NodeUtil.newQualifiedName(path, line)).setLineno(line);
    return env.expand(alias);
  }
}
