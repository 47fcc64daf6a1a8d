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

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import com.google.styler.ast.IR;
import com.google.styler.ast.Node;
import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class DirectiveClassifierTest {

  private static List<String> print(List<Node> nodes) {
    List<String> result = new ArrayList<>();
    for (Node n : nodes) {
      result.add(CodePrinter.print(n));
    }
    return result;
  }

  private static DirectiveClassifier classifier(StyleOptions options) {
    return new DirectiveClassifier(options, new DirectiveSorter(options.getSortOrder()));
  }

  @Test
  public void testExpandGroup() {
    Node bar = IR.qname("Bar").setLineno(3);
    Node baz = IR.qname("Baz").setLineno(4);
    Node directive = IR.importNode(IR.group(IR.qname("Foo"), bar, baz)).setLineno(2);
    NodeUtil.setNewlines(directive, 2);

    ImmutableList<Node> expanded = DirectiveClassifier.expand(directive);

    assertThat(print(expanded)).containsExactly("import Foo.Bar", "import Foo.Baz").inOrder();
    assertThat(expanded.get(0).getLineno()).isEqualTo(3);
    assertThat(expanded.get(1).getLineno()).isEqualTo(4);
    assertThat(NodeUtil.getNewlines(expanded.get(0))).isEqualTo(0);
    assertThat(NodeUtil.getNewlines(expanded.get(1))).isEqualTo(2);
  }

  @Test
  public void testExpandNestedTargets() {
    Node directive =
        IR.alias(IR.group(IR.qname(IR.moduleRef()), IR.qname("A"), IR.qname("B.C")));
    assertThat(print(DirectiveClassifier.expand(directive)))
        .containsExactly("alias __MODULE__.A", "alias __MODULE__.B.C")
        .inOrder();
  }

  @Test
  public void testExpandToNothing() {
    assertThat(DirectiveClassifier.expand(IR.alias(IR.group(IR.qname("Foo"))))).isEmpty();
    assertThat(DirectiveClassifier.expand(IR.alias(IR.qname("Foo")))).isEmpty();
  }

  @Test
  public void testExpandKeepsOtherDirectives() {
    Node require = IR.require(IR.qname("Foo"));
    assertThat(DirectiveClassifier.expand(require)).containsExactly(require);
    Node as = IR.alias(IR.qname("Foo"), IR.keyword("as", IR.qname("F")));
    assertThat(DirectiveClassifier.expand(as)).containsExactly(as);
  }

  @Test
  public void testGroupWithOptionsIsOtherContent() {
    Node directive =
        IR.importNode(
            IR.group(IR.qname("Foo"), IR.qname("Bar")), IR.keyword("only", IR.list()));
    assertThat(DirectiveClassifier.expand(directive)).containsExactly(directive);
    assertThat(DirectiveClassifier.categorize(directive)).isNull();
  }

  @Test
  public void testGroupWithComputedTargetIsOtherContent() {
    Node directive = IR.alias(IR.group(IR.qname("Foo"), IR.name("bar")));
    assertThat(DirectiveClassifier.categorize(directive)).isNull();
  }

  @Test
  public void testCategorize() {
    assertThat(DirectiveClassifier.categorize(IR.attribute("shortdoc", IR.string("s"))))
        .isEqualTo(DirectiveCategory.SHORTDOC);
    assertThat(DirectiveClassifier.categorize(IR.attribute("behaviour", IR.qname("B"))))
        .isEqualTo(DirectiveCategory.BEHAVIOUR);
    assertThat(DirectiveClassifier.categorize(IR.use(IR.qname("U"))))
        .isEqualTo(DirectiveCategory.USE);
    assertThat(DirectiveClassifier.categorize(IR.attribute("derive", IR.qname("D")))).isNull();
    assertThat(DirectiveClassifier.categorize(IR.attribute("moduledoc"))).isNull();
    assertThat(DirectiveClassifier.categorize(IR.call(IR.empty(), "alias"))).isNull();
  }

  @Test
  public void testExpandAllKeepsGroupsWhenNotRewriting() {
    StyleOptions options = StyleOptions.builder().setRewriteMultiAlias(false).build();
    Node group = IR.alias(IR.group(IR.qname("A"), IR.qname("C"), IR.qname("B")));
    assertThat(print(classifier(options).expandAll(ImmutableList.of(group))))
        .containsExactly("alias A.{B, C}");
  }

  @Test
  public void testClassify() {
    Node function = IR.function("run", IR.list(), IR.block());
    Node derive = IR.attribute("derive", IR.qname("Jason.Encoder"));
    DirectiveBuckets buckets =
        classifier(StyleOptions.defaults())
            .classify(
                ImmutableList.of(
                    IR.attribute("moduledoc", IR.string("Docs")),
                    IR.alias(IR.qname("Foo.Bar")),
                    function,
                    IR.importNode(IR.qname("Bar.Baz")),
                    IR.attribute("moduledoc", IR.string("Docs")),
                    derive,
                    IR.require(IR.qname("Bar"))));

    assertThat(print(buckets.get(DirectiveCategory.MODULEDOC)))
        .containsExactly("@moduledoc \"Docs\"");
    assertThat(print(buckets.get(DirectiveCategory.ALIAS))).containsExactly("alias Foo.Bar");
    // Imports go above aliases, so they no longer see them.
    assertThat(print(buckets.get(DirectiveCategory.IMPORT)))
        .containsExactly("import Foo.Bar.Baz");
    // Requires stay below aliases.
    assertThat(print(buckets.get(DirectiveCategory.REQUIRE))).containsExactly("require Bar");
    assertThat(buckets.getOther()).containsExactly(function, derive).inOrder();
  }

  @Test
  public void testClassifyFollowsLayoutOrder() {
    StyleOptions options =
        StyleOptions.builder()
            .setLayoutOrder(ImmutableList.of(DirectiveCategory.ALIAS, DirectiveCategory.IMPORT))
            .build();
    DirectiveBuckets buckets =
        classifier(options)
            .classify(
                ImmutableList.of(
                    IR.alias(IR.qname("Foo.Bar")), IR.importNode(IR.qname("Bar.Baz"))));
    assertThat(print(buckets.get(DirectiveCategory.IMPORT))).containsExactly("import Bar.Baz");
  }

  @Test
  public void testDifferentDocsAreKept() {
    DirectiveBuckets buckets =
        classifier(StyleOptions.defaults())
            .classify(
                ImmutableList.of(
                    IR.attribute("moduledoc", IR.string("One")),
                    IR.attribute("moduledoc", IR.string("Two"))));
    assertThat(buckets.get(DirectiveCategory.MODULEDOC)).hasSize(2);
  }
}
