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
import com.google.styler.ast.NodeCursor;

/**
 * NodeTraversal walks a tree depth-first in pre-order, calling back for every node. The callback
 * may move or edit through the cursor; the walk resumes from wherever the cursor was left and never
 * leaves the root it started from. A node the callback moves to is not called back again: the walk
 * applies the returned step to it directly.
 */
public final class NodeTraversal {

  /** What the walk does after a callback returns. */
  public enum Step {
    /** Descend into the focused node's children, then carry on. */
    CONTINUE,
    /** Carry on without visiting the focused node's children. */
    SKIP,
    /** Stop the walk. */
    HALT,
  }

  /** Callback for tree-based traversals. */
  public interface Callback {
    Step visit(NodeCursor cursor);
  }

  private NodeTraversal() {}

  /** Traverses {@code root} and returns the cursor, left where the walk ended. */
  public static NodeCursor traverse(Node root, Callback callback) {
    NodeCursor cursor = new NodeCursor(root);
    while (true) {
      Step step = callback.visit(cursor);
      if (step == Step.HALT || !cursor.advance(step == Step.CONTINUE)) {
        return cursor;
      }
    }
  }
}
