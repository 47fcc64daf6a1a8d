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

import com.google.styler.ast.Comment;
import com.google.styler.ast.Node;
import com.google.styler.ast.NodeCursor;
import com.google.styler.style.NodeTraversal.Step;
import java.util.List;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/**
 * Organizes the directives at the top of modules and other blocks: expands grouped directives,
 * sorts them into their categories, lifts frequently used names into aliases, and moves
 * {@code @derive} ahead of the struct it applies to.
 *
 * <p>A module is left alone when one of its comments contains {@value #SKIP_DIRECTIVES}. When one
 * contains {@value #SKIP_DIRECTIVE_REORDERING}, directives are expanded and aliases lifted, but
 * nothing is reordered.
 */
public final class ModuleDirectives implements Style {

  static final String NAME = "module_directives";

  static final String SKIP_DIRECTIVES = "styler:skip-module-directives";
  static final String SKIP_DIRECTIVE_REORDERING = "styler:skip-module-directive-reordering";

  /** Replaced by {@link #SKIP_DIRECTIVES}. */
  static final String DEPRECATED_SKIP_REORDERING = "styler:skip-module-reordering";

  private static final Logger logger = Logger.getLogger(ModuleDirectives.class.getName());

  @Override
  public Step run(NodeCursor cursor, StyleContext context) {
    Node n = cursor.node();
    if (n.isModule()) {
      return visitModule(cursor, context);
    }
    if (n.isDirective()) {
      Node parent = n.getParent();
      if (parent == null || !parent.isBlock() || context.isOrganized(parent)) {
        return Step.CONTINUE;
      }
      return organize(cursor.moveTo(parent), context);
    }
    if (n.isAttribute("derive")) {
      return placeDerive(cursor);
    }
    return Step.CONTINUE;
  }

  private Step visitModule(NodeCursor cursor, StyleContext context) {
    Node module = cursor.node();
    if (hasSkipComment(context.getComments(module))
        || module.getBooleanProp(Node.Prop.KEYWORD_FORM)) {
      return Step.SKIP;
    }
    Node body = NodeUtil.getScopeBody(module);
    if (!body.hasChildren()) {
      return Step.SKIP;
    }
    if (body.hasOneChild()) {
      // A module holding only its documentation is common for root namespaces.
      return body.getFirstChild().isAttribute("moduledoc") ? Step.SKIP : Step.CONTINUE;
    }
    return organize(cursor.moveTo(body), context);
  }

  private static boolean hasSkipComment(List<Comment> comments) {
    boolean skip = false;
    for (Comment comment : comments) {
      if (comment.contains(DEPRECATED_SKIP_REORDERING)) {
        logger.warning(
            DEPRECATED_SKIP_REORDERING + " is deprecated in favor of " + SKIP_DIRECTIVES);
        skip = true;
      } else if (comment.contains(SKIP_DIRECTIVES)) {
        skip = true;
      }
    }
    return skip;
  }

  /**
   * Organizes the children of the focused block. The walk then resumes right after the directives,
   * so the directives are not visited again.
   */
  private static Step organize(NodeCursor cursor, StyleContext context) {
    Node block = cursor.node();
    context.markOrganized(block);
    Node scope = enclosingScope(block);
    List<Comment> comments =
        scope != null ? context.getComments(scope) : context.getComments();
    int lineno = scope != null ? scope.getLineno() : block.getLineno();
    DirectiveOrganizer organizer = new DirectiveOrganizer(context.getOptions(), lineno);

    if (hasComment(comments, SKIP_DIRECTIVE_REORDERING)) {
      cursor.replaceChildren(organizer.organizePreservingOrder(block.childList()));
      return Step.CONTINUE;
    }
    DirectiveOrganizer.Result result = organizer.organize(block.childList());
    cursor.replaceChildren(result.getStatements());
    if (result.getDirectiveCount() == 0) {
      return Step.CONTINUE;
    }
    cursor.moveTo(result.getStatements().get(result.getDirectiveCount() - 1));
    return Step.SKIP;
  }

  private static @Nullable Node enclosingScope(Node n) {
    for (Node p = n.getParent(); p != null; p = p.getParent()) {
      if (p.isScope()) {
        return p;
      }
    }
    return null;
  }

  private static boolean hasComment(List<Comment> comments, String marker) {
    for (Comment comment : comments) {
      if (comment.contains(marker)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Moves a {@code @derive} that follows a struct definition to directly above the nearest such
   * definition, where it takes effect.
   */
  private static Step placeDerive(NodeCursor cursor) {
    Node derive = cursor.node();
    Node parent = derive.getParent();
    if (parent == null || !parent.isBlock()) {
      return Step.CONTINUE;
    }
    Node struct = null;
    for (Node p = derive.getPrevious(); p != null; p = p.getPrevious()) {
      if (p.isStruct()) {
        struct = p;
        break;
      }
    }
    if (struct == null) {
      return Step.CONTINUE;
    }
    Node resume = derive.getPrevious();
    derive.detach();
    NodeUtil.setLines(derive, struct.getLineno() - 1);
    derive.insertBefore(struct);
    cursor.moveTo(resume);
    return Step.SKIP;
  }
}
