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

package com.google.styler.ast;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import org.jspecify.annotations.Nullable;

/**
 * A movable focus over a tree rooted at a fixed node. Moves are O(1) through the node's parent and
 * sibling links; edits go through the cursor so that a depth-first walk driven by {@link #advance}
 * stays consistent when the focus is replaced or removed.
 */
public final class NodeCursor {

  private final Node root;
  private Node focus;

  // Set by remove(): where a walk resumes, since the removed node has no successor of its own.
  private boolean resumePending;
  private @Nullable Node resumeAt;
  private @Nullable Node resumeParent;

  public NodeCursor(Node root) {
    this.root = checkNotNull(root);
    this.focus = root;
  }

  public Node getRoot() {
    return root;
  }

  public Node node() {
    return focus;
  }

  public boolean isRoot() {
    return focus == root;
  }

  @CanIgnoreReturnValue
  public NodeCursor up() {
    checkState(focus != root && focus.getParent() != null, "Cannot move above the root");
    focus = focus.getParent();
    return this;
  }

  @CanIgnoreReturnValue
  public NodeCursor down() {
    checkState(focus.hasChildren(), "No children: %s", focus);
    focus = focus.getFirstChild();
    return this;
  }

  @CanIgnoreReturnValue
  public NodeCursor right() {
    checkState(focus != root && focus.getNext() != null, "No right sibling: %s", focus);
    focus = focus.getNext();
    return this;
  }

  @CanIgnoreReturnValue
  public NodeCursor left() {
    checkState(focus != root && focus.getPrevious() != null, "No left sibling: %s", focus);
    focus = focus.getPrevious();
    return this;
  }

  @CanIgnoreReturnValue
  public NodeCursor rightmost() {
    if (focus != root) {
      focus = focus.getParent().getLastChild();
    }
    return this;
  }

  /** Moves the focus to {@code n}, which must be inside this cursor's tree. */
  @CanIgnoreReturnValue
  public NodeCursor moveTo(Node n) {
    checkArgument(isWithinRoot(n), "%s is outside of %s", n, root);
    focus = n;
    return this;
  }

  public ImmutableList<Node> children() {
    return focus.childList();
  }

  /** Swaps the focused node for {@code replacement}, which becomes the focus. */
  @CanIgnoreReturnValue
  public NodeCursor replace(Node replacement) {
    checkState(focus != root, "Cannot replace the root");
    focus.replaceWith(replacement);
    focus = replacement;
    return this;
  }

  /**
   * Removes the focused node. The focus moves to the previous sibling, or to the parent when there
   * is none, and the next {@link #advance} continues with the removed node's next sibling.
   */
  @CanIgnoreReturnValue
  public NodeCursor remove() {
    checkState(focus != root, "Cannot remove the root");
    Node removed = focus;
    Node parent = removed.getParent();
    Node previous = removed.getPrevious();
    resumePending = true;
    resumeAt = removed.getNext();
    resumeParent = parent;
    removed.detach();
    focus = previous != null ? previous : parent;
    return this;
  }

  /** Inserts {@code siblings} after the focus, in order. The focus does not move. */
  @CanIgnoreReturnValue
  public NodeCursor insertSiblingsAfter(Iterable<Node> siblings) {
    checkState(focus != root, "The root has no siblings");
    Node anchor = focus;
    for (Node sibling : siblings) {
      sibling.insertAfter(anchor);
      anchor = sibling;
    }
    return this;
  }

  @CanIgnoreReturnValue
  public NodeCursor insertLeft(Node sibling) {
    checkState(focus != root, "The root has no siblings");
    sibling.insertBefore(focus);
    return this;
  }

  /** Replaces all children of the focus with {@code children}, which must be detached. */
  @CanIgnoreReturnValue
  public NodeCursor replaceChildren(Iterable<Node> children) {
    focus.detachChildren();
    focus.addChildrenToBack(children);
    return this;
  }

  /**
   * Moves the focus to the next node of a depth-first pre-order walk of the root.
   *
   * @param descend whether the walk enters the focus's children
   * @return false once the walk has left the root
   */
  public boolean advance(boolean descend) {
    if (resumePending) {
      resumePending = false;
      Node target = resumeAt;
      Node parent = resumeParent;
      resumeAt = null;
      resumeParent = null;
      if (target != null) {
        focus = target;
        return true;
      }
      return advanceFrom(parent);
    }
    if (descend && focus.hasChildren()) {
      focus = focus.getFirstChild();
      return true;
    }
    return advanceFrom(focus);
  }

  private boolean advanceFrom(Node n) {
    while (n != root) {
      if (n.getNext() != null) {
        focus = n.getNext();
        return true;
      }
      n = n.getParent();
      if (n == null) {
        return false;
      }
    }
    focus = root;
    return false;
  }

  private boolean isWithinRoot(Node n) {
    for (Node p = n; p != null; p = p.getParent()) {
      if (p == root) {
        return true;
      }
    }
    return false;
  }
}
