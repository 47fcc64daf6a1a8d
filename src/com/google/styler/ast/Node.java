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
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * This class implements the root of the intermediate representation.
 *
 * <p>Children are kept in a doubly linked list: {@code first.previous} points at the last child so
 * that appending is constant time, and {@code last.next} is null.
 */
public class Node {

  /** Metadata attached to a node and carried through reorganization. */
  public enum Prop {
    // Newlines the printer emits after this expression; 2 or more means a blank line follows.
    NEWLINES_AFTER,
    // Last line covered by a scope, used to attach comments to it.
    END_LINENO,
    // A `do:` one-liner scope.
    KEYWORD_FORM,
  }

  private final Token token;

  private @Nullable String string;

  private int lineno;

  private @Nullable Node parent;
  private @Nullable Node first;
  private @Nullable Node next;
  private @Nullable Node previous;

  private @Nullable PropListItem propListHead;

  private static final class PropListItem {
    final @Nullable PropListItem next;
    final Prop prop;
    final int intValue;

    PropListItem(Prop prop, int intValue, @Nullable PropListItem next) {
      checkState(intValue != 0);
      this.prop = prop;
      this.intValue = intValue;
      this.next = next;
    }

    PropListItem chain(@Nullable PropListItem next) {
      return new PropListItem(prop, intValue, next);
    }
  }

  public Node(Token token) {
    this.token = checkNotNull(token);
  }

  public Node(Token token, Node... children) {
    this(token);
    for (Node child : children) {
      addChildToBack(child);
    }
  }

  public static Node newString(Token token, String str) {
    Node n = new Node(token);
    n.string = checkNotNull(str);
    return n;
  }

  public final Token getToken() {
    return token;
  }

  public final String getString() {
    checkState(string != null, "%s has no string payload", token);
    return string;
  }

  public final @Nullable String getStringOrNull() {
    return string;
  }

  public final void setString(String str) {
    this.string = checkNotNull(str);
  }

  public final int getLineno() {
    return lineno;
  }

  public final Node setLineno(int lineno) {
    this.lineno = lineno;
    return this;
  }

  /** Moves the line of every node in this subtree by {@code delta}. */
  public final void shiftLines(int delta) {
    lineno += delta;
    for (Node c = first; c != null; c = c.next) {
      c.shiftLines(delta);
    }
  }

  // Children

  public final boolean hasChildren() {
    return first != null;
  }

  public final boolean hasOneChild() {
    return first != null && first.next == null;
  }

  public final Node getOnlyChild() {
    checkState(hasOneChild(), "Expected one child: %s", this);
    return first;
  }

  public final @Nullable Node getFirstChild() {
    return first;
  }

  public final @Nullable Node getSecondChild() {
    return first != null ? first.next : null;
  }

  public final @Nullable Node getLastChild() {
    return first != null ? first.previous : null;
  }

  public final @Nullable Node getNext() {
    return next;
  }

  public final @Nullable Node getPrevious() {
    return parent == null || this == parent.first ? null : previous;
  }

  public final @Nullable Node getParent() {
    return parent;
  }

  public final boolean hasParent() {
    return parent != null;
  }

  /**
   * Gets the ith child, note that this is O(N) where N is the number of children.
   *
   * @param i The index
   * @return The ith child
   */
  public final Node getChildAtIndex(int i) {
    Node n = first;
    while (i > 0) {
      n = n.next;
      i--;
    }
    return n;
  }

  public final int getIndexOfChild(Node child) {
    Node n = first;
    int i = 0;
    while (n != null) {
      if (child == n) {
        return i;
      }
      n = n.next;
      i++;
    }
    return -1;
  }

  public final int getChildCount() {
    int c = 0;
    for (Node n = first; n != null; n = n.next) {
      c++;
    }
    return c;
  }

  /** Returns a snapshot of the children, safe to hold across mutations. */
  public final ImmutableList<Node> childList() {
    ImmutableList.Builder<Node> builder = ImmutableList.builder();
    for (Node n = first; n != null; n = n.next) {
      builder.add(n);
    }
    return builder.build();
  }

  public final Iterable<Node> children() {
    return () ->
        new Iterator<Node>() {
          private @Nullable Node current = first;

          @Override
          public boolean hasNext() {
            return current != null;
          }

          @Override
          public Node next() {
            if (current == null) {
              throw new NoSuchElementException();
            }
            Node n = current;
            current = current.next;
            return n;
          }
        };
  }

  public final void addChildToFront(Node child) {
    child.checkDetached();
    child.parent = this;
    if (first == null) {
      // NOTE: child.next remains null
      child.previous = child;
    } else {
      Node last = first.previous;
      child.previous = last;
      child.next = first;
      first.previous = child;
    }
    first = child;
  }

  public final void addChildToBack(Node child) {
    checkArgument(
        child.parent == null,
        "Cannot add already-owned child node.\nChild: %s\nExisting parent: %s\nNew parent: %s",
        child,
        child.parent,
        this);
    child.checkDetached();

    if (first == null) {
      // NOTE: child.next remains null
      child.previous = child;
      first = child;
    } else {
      Node last = first.previous;
      last.next = child;
      // NOTE: child.next remains null
      child.previous = last;
      first.previous = child;
    }

    child.parent = this;
  }

  public final void addChildrenToBack(Iterable<Node> children) {
    for (Node child : children) {
      addChildToBack(child);
    }
  }

  public final void insertAfter(Node existing) {
    existing.checkAttached();
    this.checkDetached();

    final Node existingParent = existing.parent;
    final Node existingNext = existing.next;

    this.parent = existingParent;

    existing.next = this;
    this.previous = existing;

    if (existingNext == null) {
      existingParent.first.previous = this;
      // this.next remains null
    } else {
      existingNext.previous = this;
      this.next = existingNext;
    }
  }

  public final void insertBefore(Node existing) {
    existing.checkAttached();
    this.checkDetached();

    final Node existingParent = existing.parent;
    final Node existingPrevious = existing.previous;

    this.parent = existingParent;

    this.next = existing;
    existing.previous = this;

    this.previous = existingPrevious;
    if (existingPrevious.next == null) {
      existingParent.first = this;
      // existingPrevious.next remains null
    } else {
      existingPrevious.next = this;
    }
  }

  /** Swaps `replacement` and its subtree into the position of `this`. */
  public final void replaceWith(Node replacement) {
    this.checkAttached();
    replacement.checkDetached();

    final Node existingParent = this.parent;
    final Node existingNext = this.next;
    final Node existingPrevious = this.previous;

    // The sequence below also has to work when `this` is an only child, which can cause many of the
    // variables to point to the same object.

    this.parent = null;
    replacement.parent = existingParent;

    this.previous = null;
    replacement.previous = existingPrevious == this ? replacement : existingPrevious;
    if (existingPrevious.next == null) {
      existingParent.first = replacement;
    } else {
      existingPrevious.next = replacement;
    }

    if (existingNext == null) {
      existingParent.first.previous = replacement;
    } else {
      this.next = null;
      existingNext.previous = replacement;
      replacement.next = existingNext;
    }
  }

  /** Removes this node from its parent, but retains its subtree. */
  public final Node detach() {
    this.checkAttached();

    final Node existingParent = this.parent;
    final Node existingNext = this.next;
    final Node existingPrevious = this.previous;

    this.parent = null;

    if (existingNext == null) {
      existingParent.first.previous = existingPrevious;
    } else {
      this.next = null;
      existingNext.previous = existingPrevious;
    }

    this.previous = null;
    if (existingPrevious.next == null) {
      existingParent.first = existingNext;
    } else {
      existingPrevious.next = existingNext;
    }

    return this;
  }

  /** Removes all children from this node and isolates the children from each other. */
  public final void detachChildren() {
    for (Node child = first; child != null; ) {
      Node nextChild = child.next;
      child.parent = null;
      child.next = null;
      child.previous = null;
      child = nextChild;
    }
    first = null;
  }

  private void checkAttached() {
    checkState(this.parent != null, "Has no parent: %s", this);
  }

  private void checkDetached() {
    checkState(this.parent == null, "Has parent: %s", this);
    checkState(this.next == null, "Has next: %s", this);
    checkState(this.previous == null, "Has previous: %s", this);
  }

  // Properties

  public final int getIntProp(Prop prop) {
    for (PropListItem x = propListHead; x != null; x = x.next) {
      if (x.prop == prop) {
        return x.intValue;
      }
    }
    return 0;
  }

  public final boolean getBooleanProp(Prop prop) {
    return getIntProp(prop) != 0;
  }

  public final Node putIntProp(Prop prop, int value) {
    this.propListHead = rebuildListWithoutProp(this.propListHead, prop);
    if (value != 0) {
      this.propListHead = new PropListItem(prop, value, this.propListHead);
    }
    return this;
  }

  public final Node putBooleanProp(Prop prop, boolean value) {
    return putIntProp(prop, value ? 1 : 0);
  }

  /**
   * @param item The item to inspect
   * @param prop The property to look for
   * @return The replacement list if the property was removed, or 'item' otherwise.
   */
  private static @Nullable PropListItem rebuildListWithoutProp(
      @Nullable PropListItem item, Prop prop) {
    if (item == null) {
      return null;
    } else if (item.prop == prop) {
      return item.next;
    } else {
      PropListItem result = rebuildListWithoutProp(item.next, prop);
      return (result == item.next) ? item : item.chain(result);
    }
  }

  // Copying and comparison

  /** Returns a detached copy of this node without its children. */
  public final Node cloneNode() {
    Node clone = new Node(token);
    clone.string = string;
    clone.lineno = lineno;
    // The property list is persistent, so it can be shared.
    clone.propListHead = propListHead;
    return clone;
  }

  /** Returns a detached deep copy of this subtree. */
  public final Node cloneTree() {
    Node result = cloneNode();
    for (Node c = first; c != null; c = c.next) {
      result.addChildToBack(c.cloneTree());
    }
    return result;
  }

  /**
   * Returns true if this subtree has the same shape and payloads as {@code node}. Lines and
   * properties are metadata and are not compared.
   */
  public final boolean isEquivalentTo(Node node) {
    if (token != node.token || !Objects.equals(string, node.string)) {
      return false;
    }
    Node a = first;
    Node b = node.first;
    while (a != null && b != null) {
      if (!a.isEquivalentTo(b)) {
        return false;
      }
      a = a.next;
      b = b.next;
    }
    return a == null && b == null;
  }

  // Token predicates

  public final boolean isBlock() {
    return token == Token.BLOCK;
  }

  public final boolean isModule() {
    return token == Token.MODULE;
  }

  public final boolean isScope() {
    return token.isScope();
  }

  public final boolean isDirective() {
    return token.isDirective();
  }

  public final boolean isAlias() {
    return token == Token.ALIAS;
  }

  public final boolean isUse() {
    return token == Token.USE;
  }

  public final boolean isImport() {
    return token == Token.IMPORT;
  }

  public final boolean isAttribute() {
    return token == Token.ATTRIBUTE;
  }

  public final boolean isAttribute(String name) {
    return token == Token.ATTRIBUTE && name.equals(string);
  }

  public final boolean isQualifiedName() {
    return token == Token.QUALIFIED_NAME;
  }

  public final boolean isGroup() {
    return token == Token.GROUP;
  }

  public final boolean isName() {
    return token == Token.NAME;
  }

  public final boolean isKeyword() {
    return token == Token.KEYWORD;
  }

  public final boolean isStruct() {
    return token == Token.STRUCT;
  }

  public final boolean isQuote() {
    return token == Token.QUOTE;
  }

  // Debugging

  @Override
  public final String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append(token);
    if (string != null) {
      sb.append(' ').append(string);
    }
    if (lineno != 0) {
      sb.append(" [line ").append(lineno).append(']');
    }
    return sb.toString();
  }

  public final String toStringTree() {
    StringBuilder sb = new StringBuilder();
    appendStringTree(sb, 0);
    return sb.toString();
  }

  private void appendStringTree(StringBuilder sb, int level) {
    for (int i = 0; i != level; ++i) {
      sb.append("    ");
    }
    sb.append(this).append('\n');
    for (Node c = first; c != null; c = c.next) {
      c.appendStringTree(sb, level + 1);
    }
  }
}
