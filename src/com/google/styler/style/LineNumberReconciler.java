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

import com.google.styler.ast.Node;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Repairs line numbers after directives have been reordered. Comments are attached to statements by
 * line, so a directive that moved ahead of the code it used to follow must not keep a line number
 * from below that code.
 */
final class LineNumberReconciler {

  /** Line given to nodes that have no source position yet. */
  static final int MAX_LINE = 999_999;

  /** Gap left above the ceiling, so a comment on the ceiling's line keeps its place. */
  static final int COMMENT_MARGIN = 2;

  private LineNumberReconciler() {}

  /**
   * Walks {@code nodes} from the last to the first. Each node whose line is past the running
   * ceiling is shifted, with its subtree, to sit just above it; any other node lowers the ceiling
   * to its own line.
   *
   * @param following the first node after {@code nodes}, or null when nothing follows
   */
  static void reconcile(List<Node> nodes, @Nullable Node following) {
    int ceiling = following != null ? following.getLineno() : MAX_LINE;
    for (int i = nodes.size() - 1; i >= 0; i--) {
      Node n = nodes.get(i);
      if (n.getLineno() > ceiling) {
        n.shiftLines(ceiling - COMMENT_MARGIN - n.getLineno());
      } else {
        ceiling = n.getLineno();
      }
    }
  }
}
