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

import com.google.styler.ast.NodeCursor;
import com.google.styler.style.NodeTraversal.Step;

/**
 * A rewrite applied to every node of a tree. Implementations look at the focused node, may edit or
 * move through the cursor, and tell the traversal how to carry on.
 *
 * <p>Built-in styles run first; plugins supplied through {@link StyleOptions} run after them, in
 * the order they were declared, so they observe a tree whose directives are settled.
 */
public interface Style {

  Step run(NodeCursor cursor, StyleContext context);
}
