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
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.styler.ast.Comment;
import com.google.styler.ast.IR;
import com.google.styler.ast.Node;
import com.google.styler.ast.Token;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class ModuleDirectivesTest {

  private StyleOptions options = StyleOptions.defaults();
  private ImmutableList<Comment> comments = ImmutableList.of();

  private static Node module(Node... body) {
    return IR.module(IR.qname("M"), IR.block(body)).setLineno(1);
  }

  private static Node ref(String dotted, String fun) {
    return IR.call(IR.qname(dotted), fun);
  }

  private static String expected(String... lines) {
    StringBuilder sb = new StringBuilder("defmodule M do\n");
    for (String line : lines) {
      sb.append("  ").append(line).append('\n');
    }
    return sb.append("end").toString();
  }

  /** Runs the style over a file holding {@code root} and returns the printed result. */
  private String style(Node root) {
    Node file = root.getParent() != null ? root.getParent() : IR.block(root);
    StyleContext context = StyleContext.create(null, comments, options);
    ModuleDirectives style = new ModuleDirectives();
    NodeTraversal.traverse(file, cursor -> style.run(cursor, context));
    return CodePrinter.print(file);
  }

  private void assertStyled(Node root, String expected) {
    assertThat(style(root)).isEqualTo(expected);
  }

  @Test
  public void testExpandsAndSortsGroupedImport() {
    assertStyled(
        module(IR.importNode(IR.group(IR.qname("Foo"), IR.qname("Baz"), IR.qname("Bar")))),
        expected("import Foo.Bar", "import Foo.Baz"));
  }

  @Test
  public void testLiftsRepeatedReference() {
    assertStyled(
        module(IR.require(IR.qname("A.B.C")), ref("A.B.C", "foo"), ref("A.B.C", "bar")),
        expected("alias A.B.C", "require C", "C.foo()", "C.bar()"));
  }

  @Test
  public void testSkipMarkerLeavesModuleAlone() {
    comments = ImmutableList.of(Comment.create(1, "# styler:skip-module-directives"));
    assertStyled(
        module(IR.alias(IR.qname("B.X")), IR.alias(IR.qname("A.Y"))),
        expected("alias B.X", "alias A.Y"));
  }

  @Test
  public void testExactDuplicatesCollapse() {
    assertStyled(
        module(IR.alias(IR.qname("A.A")), IR.alias(IR.qname("A.A"))), expected("alias A.A"));
  }

  @Test
  public void testLayoutOrder() {
    assertStyled(
        module(
            IR.function("run", IR.list(), IR.block()),
            IR.alias(IR.qname("Foo.B")),
            IR.use(IR.qname("X")),
            IR.importNode(IR.qname("Y")),
            IR.attribute("moduledoc", IR.string("Docs")),
            IR.require(IR.qname("Z")),
            IR.attribute("behaviour", IR.qname("W")),
            IR.attribute("shortdoc", IR.string("Short"))),
        "defmodule M do\n"
            + "  @shortdoc \"Short\"\n"
            + "  @moduledoc \"Docs\"\n"
            + "  @behaviour W\n"
            + "  use X\n"
            + "  import Y\n"
            + "  alias Foo.B\n"
            + "  require Z\n"
            + "  def run() do\n"
            + "  end\n"
            + "end");
  }

  @Test
  public void testConfiguredLayoutOrder() {
    options =
        StyleOptions.builder()
            .setLayoutOrder(ImmutableList.of(DirectiveCategory.ALIAS, DirectiveCategory.REQUIRE))
            .build();
    assertStyled(
        module(
            IR.use(IR.qname("X")), IR.require(IR.qname("Z")), IR.alias(IR.qname("Foo.B"))),
        expected("alias Foo.B", "require Z", "use X"));
  }

  @Test
  public void testDirectivesMovedAboveAliasesAreSpelledOut() {
    assertStyled(
        module(IR.alias(IR.qname("Foo.Bar")), IR.importNode(IR.qname("Bar.Baz"))),
        expected("import Foo.Bar.Baz", "alias Foo.Bar"));
  }

  @Test
  public void testUseKeepsDocumentOrder() {
    assertStyled(
        module(IR.use(IR.qname("Zed")), IR.use(IR.qname("Alpha"))),
        expected("use Zed", "use Alpha"));
  }

  @Test
  public void testStylingTwiceChangesNothing() {
    Node root =
        module(
            IR.require(IR.qname("A.B.C")),
            IR.alias(IR.group(IR.qname("X"), IR.qname("Z"), IR.qname("Y"))),
            ref("A.B.C", "foo"),
            IR.importNode(IR.qname("Y.Q")),
            ref("A.B.C", "bar"));
    String once = style(root);
    assertThat(once)
        .isEqualTo(
            expected(
                "import X.Y.Q",
                "alias A.B.C",
                "alias X.Y",
                "alias X.Z",
                "require C",
                "C.foo()",
                "C.bar()"));
    assertThat(style(root)).isEqualTo(once);
  }

  @Test
  public void testNestedModulesAreOrganizedSeparately() {
    Node inner =
        IR.module(
            IR.qname("Inner"), IR.block(IR.require(IR.qname("Z")), IR.alias(IR.qname("C.D"))));
    assertStyled(
        module(IR.alias(IR.qname("B.Y")), IR.alias(IR.qname("A.X")), inner),
        "defmodule M do\n"
            + "  alias A.X\n"
            + "  alias B.Y\n"
            + "  defmodule Inner do\n"
            + "    alias C.D\n"
            + "    require Z\n"
            + "  end\n"
            + "end");
  }

  @Test
  public void testSkipMarkerInNestedModuleOnlySkipsThatModule() {
    comments = ImmutableList.of(Comment.create(5, "# styler:skip-module-directives"));
    Node inner =
        IR.module(
                IR.qname("Inner"), IR.block(IR.require(IR.qname("Z")), IR.alias(IR.qname("C.D"))))
            .setLineno(4);
    inner.putIntProp(Node.Prop.END_LINENO, 7);
    Node root = module(IR.alias(IR.qname("B.Y")), IR.alias(IR.qname("A.X")), inner);
    root.putIntProp(Node.Prop.END_LINENO, 8);
    assertStyled(
        root,
        "defmodule M do\n"
            + "  alias A.X\n"
            + "  alias B.Y\n"
            + "  defmodule Inner do\n"
            + "    require Z\n"
            + "    alias C.D\n"
            + "  end\n"
            + "end");
  }

  @Test
  public void testDirectivesInsideFunctions() {
    Node function =
        IR.function(
            "run", IR.list(), IR.block(IR.require(IR.qname("Z")), IR.alias(IR.qname("B.C"))));
    assertStyled(
        module(function),
        "defmodule M do\n"
            + "  def run() do\n"
            + "    alias B.C\n"
            + "    require Z\n"
            + "  end\n"
            + "end");
  }

  @Test
  public void testModulesLeftAlone() {
    assertStyled(module(), "defmodule M do\nend");
    assertStyled(
        module(IR.attribute("moduledoc", IR.string("Docs"))), expected("@moduledoc \"Docs\""));

    Node keywordForm = module(IR.alias(IR.qname("B.X")), IR.alias(IR.qname("A.Y")));
    keywordForm.putBooleanProp(Node.Prop.KEYWORD_FORM, true);
    assertStyled(keywordForm, expected("alias B.X", "alias A.Y"));
  }

  @Test
  public void testDeriveMovesAboveStruct() {
    Node struct = IR.struct("defstruct", IR.list(IR.name(":a"))).setLineno(3);
    Node derive = IR.attribute("derive", IR.qname("Jason.Encoder")).setLineno(7);
    Node root = module(struct, IR.function("run", IR.list(), IR.block()), derive);
    assertThat(style(root))
        .isEqualTo(
            "defmodule M do\n"
                + "  @derive Jason.Encoder\n"
                + "  defstruct [:a]\n"
                + "  def run() do\n"
                + "  end\n"
                + "end");
    Node placed = NodeUtil.getScopeBody(root).getFirstChild();
    assertThat(placed.isAttribute("derive")).isTrue();
    assertThat(placed.getLineno()).isEqualTo(2);
  }

  @Test
  public void testDeriveWithoutStructStays() {
    assertStyled(
        module(IR.attribute("derive", IR.qname("Jason.Encoder")), IR.struct("defstruct")),
        expected("@derive Jason.Encoder", "defstruct"));
  }

  @Test
  public void testPreserveOrderMarker() {
    comments =
        ImmutableList.of(Comment.create(1, "# styler:skip-module-directive-reordering"));
    assertStyled(
        module(
            IR.alias(IR.qname("B.C")),
            IR.use(IR.qname("A")),
            IR.alias(IR.qname("Z.Y")),
            ref("P.Q.R", "foo"),
            ref("P.Q.R", "bar")),
        expected("alias B.C", "use A", "alias Z.Y", "alias P.Q.R", "R.foo()", "R.bar()"));
  }

  @Test
  public void testPreserveOrderKeepsStatementsAboveNewAliasQualified() {
    comments =
        ImmutableList.of(Comment.create(1, "# styler:skip-module-directive-reordering"));
    assertStyled(
        module(
            IR.importNode(IR.qname("A.B.C")),
            ref("A.B.C", "foo"),
            ref("A.B.C", "bar")),
        expected("import A.B.C", "alias A.B.C", "C.foo()", "C.bar()"));
    assertStyled(
        module(
            ref("A.B.C", "foo"),
            IR.require(IR.qname("Z")),
            ref("A.B.C", "bar"),
            ref("A.B.C", "baz")),
        expected("A.B.C.foo()", "require Z", "alias A.B.C", "C.bar()", "C.baz()"));
  }

  @Test
  public void testPreserveOrderWithoutDirectivesInsertsAtTop() {
    comments =
        ImmutableList.of(Comment.create(1, "# styler:skip-module-directive-reordering"));
    assertStyled(
        module(ref("A.B.C", "foo"), ref("A.B.C", "bar")),
        expected("alias A.B.C", "C.foo()", "C.bar()"));
  }

  @Test
  public void testPreserveOrderStillExpands() {
    comments =
        ImmutableList.of(Comment.create(1, "# styler:skip-module-directive-reordering"));
    assertStyled(
        module(
            IR.require(IR.qname("Z")),
            IR.alias(IR.group(IR.qname("A"), IR.qname("C"), IR.qname("B")))),
        expected("require Z", "alias A.C", "alias A.B"));
  }

  @Test
  public void testDeprecatedSkipMarker() {
    comments = ImmutableList.of(Comment.create(1, "# styler:skip-module-reordering"));
    List<LogRecord> records = new ArrayList<>();
    Handler handler =
        new Handler() {
          @Override
          public void publish(LogRecord record) {
            records.add(record);
          }

          @Override
          public void flush() {}

          @Override
          public void close() {}
        };
    Logger logger = Logger.getLogger(ModuleDirectives.class.getName());
    logger.addHandler(handler);
    try {
      assertStyled(
          module(IR.alias(IR.qname("B.X")), IR.alias(IR.qname("A.Y"))),
          expected("alias B.X", "alias A.Y"));
    } finally {
      logger.removeHandler(handler);
    }
    assertThat(records).hasSize(1);
    assertThat(records.get(0).getLevel()).isEqualTo(Level.WARNING);
    assertThat(records.get(0).getMessage()).contains("deprecated");
  }

  @Test
  public void testFailedStageLeavesScopeUntouched() {
    Node malformed = new Node(Token.MODULE, IR.qname("Bad"), IR.name("x"));
    Node root = module(IR.require(IR.qname("Z")), IR.alias(IR.qname("B.A")), malformed);
    Node file = IR.block(root);
    String before = CodePrinter.print(file);

    DirectiveStageException e = assertThrows(DirectiveStageException.class, () -> style(root));

    assertThat(e.getStage()).isEqualTo(DirectiveStage.LIFT);
    assertThat(e.getLineno()).isEqualTo(1);
    assertThat(CodePrinter.print(file)).isEqualTo(before);
  }

  @Test
  public void testLiftingDisabled() {
    options = StyleOptions.builder().setLiftAlias(false).build();
    assertStyled(
        module(ref("A.B.C", "foo"), IR.require(IR.qname("A.B.C")), ref("A.B.C", "bar")),
        expected("require A.B.C", "A.B.C.foo()", "A.B.C.bar()"));
  }

  @Test
  public void testGroupsKeptWhenNotRewriting() {
    options = StyleOptions.builder().setRewriteMultiAlias(false).build();
    assertStyled(
        module(
            IR.require(IR.qname("Z")),
            IR.alias(IR.group(IR.qname("A"), IR.qname("C"), IR.qname("B")))),
        expected("alias A.{B, C}", "require Z"));
  }

  @Test
  public void testAsciiSortOrder() {
    options = StyleOptions.builder().setSortOrder(StyleOptions.SortOrder.ASCII).build();
    assertStyled(
        module(IR.alias(IR.qname("Foo.bar")), IR.alias(IR.qname("Foo.Baz"))),
        expected("alias Foo.Baz", "alias Foo.bar"));
  }

  @Test
  public void testMovedDirectivesSitAboveFollowingCode() {
    Node function = IR.function("run", IR.list(), IR.block()).setLineno(2);
    Node alias = IR.alias(IR.qname("B.C"));
    NodeUtil.setLines(alias, 5);
    Node root = module(function, alias);
    style(root);

    Node body = NodeUtil.getScopeBody(root);
    assertThat(body.getFirstChild().isAlias()).isTrue();
    assertThat(body.getFirstChild().getLineno()).isEqualTo(0);
    assertThat(body.getLastChild().getLineno()).isEqualTo(2);
  }

  @Test
  public void testNewlinesAreReset() {
    Node root =
        module(
            IR.alias(IR.qname("B.Y")),
            IR.alias(IR.qname("A.X")),
            IR.require(IR.qname("Z")),
            IR.call(IR.empty(), "run"));
    style(root);
    List<Node> statements = NodeUtil.getScopeBody(root).childList();
    assertThat(NodeUtil.getNewlines(statements.get(0))).isEqualTo(1);
    assertThat(NodeUtil.getNewlines(statements.get(1))).isEqualTo(2);
    assertThat(NodeUtil.getNewlines(statements.get(2))).isEqualTo(2);
  }
}
