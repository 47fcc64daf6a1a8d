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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class NodeTest {

  @Test
  public void testInsertBeforeFirstChild() {
    Node a = IR.name("a");
    Node b = IR.name("b");
    Node block = IR.block(a, b);
    Node c = IR.name("c");
    c.insertBefore(a);

    assertThat(block.getFirstChild()).isSameInstanceAs(c);
    assertThat(block.getLastChild()).isSameInstanceAs(b);
    assertThat(a.getPrevious()).isSameInstanceAs(c);
    assertThat(c.getPrevious()).isNull();
    assertThat(block.getChildCount()).isEqualTo(3);
  }

  @Test
  public void testInsertAfterLastChild() {
    Node a = IR.name("a");
    Node block = IR.block(a);
    Node b = IR.name("b");
    b.insertAfter(a);

    assertThat(block.getLastChild()).isSameInstanceAs(b);
    assertThat(b.getPrevious()).isSameInstanceAs(a);
    assertThat(block.getIndexOfChild(b)).isEqualTo(1);
  }

  @Test
  public void testReplaceOnlyChild() {
    Node a = IR.name("a");
    Node block = IR.block(a);
    Node b = IR.name("b");
    a.replaceWith(b);

    assertThat(block.getOnlyChild()).isSameInstanceAs(b);
    assertThat(a.hasParent()).isFalse();
    assertThat(b.getPrevious()).isNull();
  }

  @Test
  public void testDetachMiddleChild() {
    Node a = IR.name("a");
    Node b = IR.name("b");
    Node c = IR.name("c");
    Node block = IR.block(a, b, c);
    b.detach();

    assertThat(block.childList()).containsExactly(a, c).inOrder();
    assertThat(c.getPrevious()).isSameInstanceAs(a);
    assertThat(b.getNext()).isNull();
  }

  @Test
  public void testAddChildRequiresDetachedNode() {
    Node a = IR.name("a");
    IR.block(a);
    assertThrows(IllegalArgumentException.class, () -> IR.block(a));
  }

  @Test
  public void testShiftLinesMovesSubtree() {
    Node qname = IR.qname("A.B");
    qname.setLineno(4);
    qname.getFirstChild().setLineno(4);
    qname.getLastChild().setLineno(5);
    qname.shiftLines(-2);

    assertThat(qname.getLineno()).isEqualTo(2);
    assertThat(qname.getFirstChild().getLineno()).isEqualTo(2);
    assertThat(qname.getLastChild().getLineno()).isEqualTo(3);
  }

  @Test
  public void testProps() {
    Node n = IR.name("a");
    assertThat(n.getIntProp(Node.Prop.NEWLINES_AFTER)).isEqualTo(0);
    n.putIntProp(Node.Prop.NEWLINES_AFTER, 2);
    n.putBooleanProp(Node.Prop.KEYWORD_FORM, true);
    assertThat(n.getIntProp(Node.Prop.NEWLINES_AFTER)).isEqualTo(2);
    assertThat(n.getBooleanProp(Node.Prop.KEYWORD_FORM)).isTrue();

    n.putIntProp(Node.Prop.NEWLINES_AFTER, 0);
    assertThat(n.getIntProp(Node.Prop.NEWLINES_AFTER)).isEqualTo(0);
    assertThat(n.getBooleanProp(Node.Prop.KEYWORD_FORM)).isTrue();
  }

  @Test
  public void testCloneSharesPropsButNotChanges() {
    Node n = IR.alias(IR.qname("A.B")).setLineno(3);
    n.putIntProp(Node.Prop.NEWLINES_AFTER, 2);
    Node clone = n.cloneTree();

    assertThat(clone.getIntProp(Node.Prop.NEWLINES_AFTER)).isEqualTo(2);
    assertThat(clone.getLineno()).isEqualTo(3);
    clone.putIntProp(Node.Prop.NEWLINES_AFTER, 1);
    assertThat(n.getIntProp(Node.Prop.NEWLINES_AFTER)).isEqualTo(2);
    assertThat(clone.isEquivalentTo(n)).isTrue();
    assertThat(clone.hasParent()).isFalse();
  }

  @Test
  public void testEquivalenceIgnoresLines() {
    Node a = IR.alias(IR.qname("A.B")).setLineno(1);
    Node b = IR.alias(IR.qname("A.B")).setLineno(7);
    assertThat(a.isEquivalentTo(b)).isTrue();
    assertThat(a.isEquivalentTo(IR.alias(IR.qname("A.C")))).isFalse();
    assertThat(a.isEquivalentTo(IR.importNode(IR.qname("A.B")))).isFalse();
  }

  @Test
  public void testPredicates() {
    assertThat(IR.alias(IR.qname("A")).isDirective()).isTrue();
    assertThat(IR.attribute("moduledoc").isDirective()).isFalse();
    assertThat(IR.attribute("derive").isAttribute("derive")).isTrue();
    assertThat(IR.module(IR.qname("M"), IR.block()).isScope()).isTrue();
    assertThat(IR.impl(IR.qname("P"), IR.qname("T"), IR.block()).isScope()).isTrue();
    assertThat(IR.block().isScope()).isFalse();
  }

  @Test
  public void testToStringTree() {
    Node n = IR.alias(IR.qname("A")).setLineno(2);
    assertThat(n.toStringTree())
        .isEqualTo("ALIAS [line 2]\n    QUALIFIED_NAME\n        NAME A\n");
  }
}
