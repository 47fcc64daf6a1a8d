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
import com.google.styler.ast.Comment;
import com.google.styler.ast.Node;
import com.google.styler.ast.NodeCursor;
import com.google.styler.style.NodeTraversal.Step;
import com.google.styler.style.StyleOptions.ErrorMode;
import com.google.styler.style.StyleOptions.PluginEntry;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;

/** Entry point: runs the built-in styles and then the configured plugins over a tree. */
public final class Styler {

  private static final Logger logger = Logger.getLogger(Styler.class.getName());

  /** Built-in styles by name, in the order they run. */
  static final ImmutableMap<String, Supplier<Style>> BUILT_IN_STYLES =
      ImmutableMap.of(ModuleDirectives.NAME, ModuleDirectives::new);

  private Styler() {}

  /**
   * Styles {@code root} in place and returns it. Each style is one full traversal of the tree.
   *
   * @param comments the comments of the file, which styles consult by line
   * @param file the name of the file, for error messages, or null
   * @throws StyleException when a style fails and {@link ErrorMode#RAISE} is set
   */
  public static Node style(
      Node root, List<Comment> comments, @Nullable String file, StyleOptions options) {
    ImmutableList<Comment> fileComments = ImmutableList.copyOf(comments);
    for (PluginEntry entry : getStyles(options)) {
      StyleContext context = new StyleContext(file, fileComments, options, entry.getOptions());
      Style style = entry.getPlugin();
      String name = Plugins.describe(style);
      logger.fine("Running " + name);
      NodeTraversal.traverse(root, cursor -> runGuarded(style, name, cursor, context));
    }
    return root;
  }

  /** Returns the enabled built-in styles followed by the plugins. */
  static ImmutableList<PluginEntry> getStyles(StyleOptions options) {
    ImmutableList.Builder<PluginEntry> styles = ImmutableList.builder();
    for (Map.Entry<String, Supplier<Style>> entry : BUILT_IN_STYLES.entrySet()) {
      String name = entry.getKey();
      boolean enabled =
          (options.getOnly().isEmpty() || options.getOnly().contains(name))
              && !options.getExclude().contains(name);
      if (enabled) {
        styles.add(PluginEntry.create(entry.getValue().get(), ImmutableMap.of()));
      }
    }
    return styles.addAll(options.getPlugins()).build();
  }

  private static Step runGuarded(
      Style style, String name, NodeCursor cursor, StyleContext context) {
    try {
      return style.run(cursor, context);
    } catch (RuntimeException e) {
      StyleException error = new StyleException(name, context.getFile(), e);
      if (context.getOptions().getOnError() == ErrorMode.RAISE) {
        throw error;
      }
      logger.log(Level.SEVERE, error.getMessage() + "; skipping node and continuing", error);
      return Step.SKIP;
    }
  }
}
