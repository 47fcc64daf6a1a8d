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

/** The node types of the directive tree. */
public enum Token {
  BLOCK,

  // Nested scopes. Name first, body block last.
  MODULE,
  PROTOCOL,
  IMPL,

  // Directives. Target first, options after.
  ALIAS,
  IMPORT,
  REQUIRE,
  USE,

  ATTRIBUTE,

  QUALIFIED_NAME,
  GROUP,
  MODULE_REF,

  STRUCT,
  FUNCTION,
  CALL,
  QUOTE,

  KEYWORD,
  LIST,
  NAME,
  STRINGLIT,
  NUMBER,
  EMPTY;

  /** Whether nodes of this type introduce a namespace declaration. */
  public boolean isDirective() {
    switch (this) {
      case ALIAS:
      case IMPORT:
      case REQUIRE:
      case USE:
        return true;
      default:
        return false;
    }
  }

  /** Whether nodes of this type open a nested scope with a name and a body. */
  public boolean isScope() {
    return this == MODULE || this == PROTOCOL || this == IMPL;
  }

  /** Returns the keyword a directive or scope of this type is written with. */
  public String keyword() {
    switch (this) {
      case ALIAS:
        return "alias";
      case IMPORT:
        return "import";
      case REQUIRE:
        return "require";
      case USE:
        return "use";
      case MODULE:
        return "defmodule";
      case PROTOCOL:
        return "defprotocol";
      case IMPL:
        return "defimpl";
      case QUOTE:
        return "quote";
      default:
        throw new IllegalStateException("No keyword for " + this);
    }
  }
}
