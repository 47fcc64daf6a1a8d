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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Sets;
import com.google.styler.ast.Comment;
import com.google.styler.ast.Node;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.jspecify.annotations.Nullable;

/**
 * State shared by the callbacks of one style run over one file: the file's comments, the options,
 * and the options of the plugin being run.
 */
public final class StyleContext {

  private final @Nullable String file;
  private final ImmutableList<Comment> comments;
  private final StyleOptions options;
  private final ImmutableMap<String, Object> pluginOptions;

  // Blocks whose directives were organized during this run.
  private final Set<Node> organizedBlocks = Sets.newIdentityHashSet();

  StyleContext(
      @Nullable String file,
      ImmutableList<Comment> comments,
      StyleOptions options,
      ImmutableMap<String, Object> pluginOptions) {
    this.file = file;
    this.comments = checkNotNull(comments);
    this.options = checkNotNull(options);
    this.pluginOptions = checkNotNull(pluginOptions);
  }

  public static StyleContext create(
      @Nullable String file, ImmutableList<Comment> comments, StyleOptions options) {
    return new StyleContext(file, comments, options, ImmutableMap.of());
  }

  public @Nullable String getFile() {
    return file;
  }

  public ImmutableList<Comment> getComments() {
    return comments;
  }

  /**
   * Returns the comments that belong to {@code scope}: those between its first and last line,
   * minus those inside a nested scope that has an end line. A scope without an end line owns
   * every comment.
   */
  public ImmutableList<Comment> getComments(Node scope) {
    int start = scope.getLineno();
    int end = scope.getIntProp(Node.Prop.END_LINENO);
    if (end == 0) {
      return comments;
    }
    List<Node> nested = new ArrayList<>();
    for (Node child : scope.children()) {
      collectNestedScopes(child, nested);
    }
    ImmutableList.Builder<Comment> result = ImmutableList.builder();
    for (Comment comment : comments) {
      if (comment.getLine() >= start
          && comment.getLine() <= end
          && !isInside(comment, nested)) {
        result.add(comment);
      }
    }
    return result.build();
  }

  private static void collectNestedScopes(Node n, List<Node> nested) {
    if (n.isScope() && n.getIntProp(Node.Prop.END_LINENO) != 0) {
      nested.add(n);
      return;
    }
    for (Node child : n.children()) {
      collectNestedScopes(child, nested);
    }
  }

  private static boolean isInside(Comment comment, List<Node> scopes) {
    for (Node scope : scopes) {
      if (comment.getLine() >= scope.getLineno()
          && comment.getLine() <= scope.getIntProp(Node.Prop.END_LINENO)) {
        return true;
      }
    }
    return false;
  }

  public StyleOptions getOptions() {
    return options;
  }

  /** The options the running plugin was registered with; empty for built-in styles. */
  public ImmutableMap<String, Object> getPluginOptions() {
    return pluginOptions;
  }

  boolean markOrganized(Node block) {
    return organizedBlocks.add(block);
  }

  boolean isOrganized(Node block) {
    return organizedBlocks.contains(block);
  }
}
