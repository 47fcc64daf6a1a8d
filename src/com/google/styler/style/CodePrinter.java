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

import com.google.common.base.Strings;
import com.google.styler.ast.Node;
import com.google.styler.ast.Token;

/**
 * Prints a tree in source form. The output is the canonical text that directives are compared by
 * when they are sorted; whitespace and comments are left to the real formatter.
 */
public final class CodePrinter {

  private static final String INDENT = "  ";

  private final StringBuilder sb = new StringBuilder();

  private CodePrinter() {}

  /** Prints {@code n}. A block prints one statement per line. */
  public static String print(Node n) {
    CodePrinter printer = new CodePrinter();
    if (n.isBlock()) {
      printer.addStatements(n, 0);
      int length = printer.sb.length();
      if (length > 0 && printer.sb.charAt(length - 1) == '\n') {
        printer.sb.setLength(length - 1);
      }
    } else {
      printer.add(n, 0);
    }
    return printer.sb.toString();
  }

  private void addStatements(Node block, int depth) {
    for (Node statement : block.children()) {
      sb.append(Strings.repeat(INDENT, depth));
      add(statement, depth);
      sb.append('\n');
    }
  }

  private void add(Node n, int depth) {
    switch (n.getToken()) {
      case BLOCK:
        sb.append("(");
        addList(n, "; ", depth);
        sb.append(")");
        break;
      case MODULE:
      case PROTOCOL:
        sb.append(n.getToken().keyword()).append(' ');
        add(n.getFirstChild(), depth);
        addDoBlock(n.getLastChild(), depth);
        break;
      case IMPL:
        sb.append(n.getToken().keyword()).append(' ');
        add(n.getFirstChild(), depth);
        if (n.getChildCount() == 3) {
          sb.append(", for: ");
          add(n.getSecondChild(), depth);
        }
        addDoBlock(n.getLastChild(), depth);
        break;
      case QUOTE:
        sb.append(n.getToken().keyword());
        addDoBlock(n.getOnlyChild(), depth);
        break;
      case ALIAS:
      case IMPORT:
      case REQUIRE:
      case USE:
        sb.append(n.getToken().keyword()).append(' ');
        addList(n, ", ", depth);
        break;
      case ATTRIBUTE:
        sb.append('@').append(n.getString());
        if (n.hasChildren()) {
          sb.append(' ');
          addList(n, ", ", depth);
        }
        break;
      case QUALIFIED_NAME:
        addList(n, ".", depth);
        break;
      case GROUP:
        add(n.getFirstChild(), depth);
        sb.append(".{");
        for (Node target = n.getSecondChild(); target != null; target = target.getNext()) {
          add(target, depth);
          if (target.getNext() != null) {
            sb.append(", ");
          }
        }
        sb.append('}');
        break;
      case MODULE_REF:
        sb.append("__MODULE__");
        break;
      case STRUCT:
        sb.append(n.getString());
        if (n.hasChildren()) {
          sb.append(' ');
          addList(n, ", ", depth);
        }
        break;
      case FUNCTION:
        sb.append("def ").append(n.getString()).append('(');
        addList(n.getFirstChild(), ", ", depth);
        sb.append(')');
        addDoBlock(n.getLastChild(), depth);
        break;
      case CALL:
        Node receiver = n.getFirstChild();
        if (receiver.getToken() != Token.EMPTY) {
          add(receiver, depth);
          sb.append('.');
        }
        sb.append(n.getString()).append('(');
        for (Node arg = receiver.getNext(); arg != null; arg = arg.getNext()) {
          add(arg, depth);
          if (arg.getNext() != null) {
            sb.append(", ");
          }
        }
        sb.append(')');
        break;
      case KEYWORD:
        sb.append(n.getString()).append(": ");
        add(n.getOnlyChild(), depth);
        break;
      case LIST:
        sb.append('[');
        addList(n, ", ", depth);
        sb.append(']');
        break;
      case STRINGLIT:
        sb.append('"').append(n.getString()).append('"');
        break;
      case NAME:
      case NUMBER:
        sb.append(n.getString());
        break;
      case EMPTY:
        break;
    }
  }

  private void addDoBlock(Node body, int depth) {
    sb.append(" do\n");
    addStatements(body, depth + 1);
    sb.append(Strings.repeat(INDENT, depth)).append("end");
  }

  private void addList(Node parent, String separator, int depth) {
    for (Node c = parent.getFirstChild(); c != null; c = c.getNext()) {
      add(c, depth);
      if (c.getNext() != null) {
        sb.append(separator);
      }
    }
  }
}
