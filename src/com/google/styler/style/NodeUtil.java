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

import static com.google.common.base.Preconditions.checkState;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.styler.ast.IR;
import com.google.styler.ast.Node;
import com.google.styler.ast.Token;
import java.util.List;
import org.jspecify.annotations.Nullable;

/** NodeUtil contains generally useful tree utilities. */
public final class NodeUtil {

  static final Joiner DOT_JOINER = Joiner.on('.');

  private NodeUtil() {}

  /**
   * Returns the segments of a qualified name, or null when {@code n} is not a qualified name or any
   * of its segments is computed rather than literal.
   */
  public static @Nullable ImmutableList<String> getLiteralSegments(Node n) {
    if (!n.isQualifiedName()) {
      return null;
    }
    ImmutableList.Builder<String> segments = ImmutableList.builder();
    for (Node segment : n.children()) {
      if (!segment.isName()) {
        return null;
      }
      segments.add(segment.getString());
    }
    return segments.build();
  }

  public static Node newQualifiedName(List<String> segments, int lineno) {
    Node qname = new Node(Token.QUALIFIED_NAME);
    for (String segment : segments) {
      qname.addChildToBack(IR.name(segment).setLineno(lineno));
    }
    return qname.setLineno(lineno);
  }

  public static String join(List<String> segments) {
    return DOT_JOINER.join(segments);
  }

  public static Node getScopeName(Node scope) {
    checkState(scope.isScope(), scope);
    return scope.getFirstChild();
  }

  public static Node getScopeBody(Node scope) {
    checkState(scope.isScope(), scope);
    Node body = scope.getLastChild();
    checkState(body.isBlock(), "Malformed scope body: %s", body);
    return body;
  }

  public static Node getDirectiveTarget(Node directive) {
    checkState(directive.isDirective() || directive.isAttribute(), directive);
    checkState(directive.hasChildren(), "Directive without a target: %s", directive);
    return directive.getFirstChild();
  }

  /** Returns the value of the {@code key:} option of a directive, if it has one. */
  public static @Nullable Node getOption(Node directive, String key) {
    for (Node c = directive.getSecondChild(); c != null; c = c.getNext()) {
      if (c.isKeyword() && key.equals(c.getString())) {
        return c.getOnlyChild();
      }
    }
    return null;
  }

  /** Moves {@code n} and its whole subtree to {@code lineno}. */
  public static void setLines(Node n, int lineno) {
    n.setLineno(lineno);
    for (Node c = n.getFirstChild(); c != null; c = c.getNext()) {
      setLines(c, lineno);
    }
  }

  /** Sets how many newlines follow {@code n}; two or more leave a blank line. */
  public static void setNewlines(Node n, int newlines) {
    n.putIntProp(Node.Prop.NEWLINES_AFTER, newlines);
  }

  public static int getNewlines(Node n) {
    return n.getIntProp(Node.Prop.NEWLINES_AFTER);
  }

  /** Gives each node one trailing newline and the last one a blank line. */
  static void resetNewlines(List<Node> nodes) {
    for (int i = 0; i < nodes.size(); i++) {
      setNewlines(nodes.get(i), i == nodes.size() - 1 ? 2 : 1);
    }
  }
}
