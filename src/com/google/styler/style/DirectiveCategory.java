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

import com.google.common.collect.ImmutableList;
import com.google.styler.ast.Node;
import org.jspecify.annotations.Nullable;

/** The categories that directives at the top of a scope are grouped into. */
public enum DirectiveCategory {
  SHORTDOC("shortdoc"),
  MODULEDOC("moduledoc"),
  BEHAVIOUR("behaviour"),
  USE("use"),
  IMPORT("import"),
  ALIAS("alias"),
  REQUIRE("require");

  static final ImmutableList<DirectiveCategory> DEFAULT_ORDER =
      ImmutableList.of(SHORTDOC, MODULEDOC, BEHAVIOUR, USE, IMPORT, ALIAS, REQUIRE);

  private final String configName;

  DirectiveCategory(String configName) {
    this.configName = configName;
  }

  public String getConfigName() {
    return configName;
  }

  /** Doc attributes keep their first occurrence only. */
  boolean isDoc() {
    return this == SHORTDOC || this == MODULEDOC;
  }

  /**
   * Whether the category is sorted. {@code use} runs code at the point of inclusion and docs are
   * read in order, so both keep document order.
   */
  boolean isSorted() {
    return !isDoc() && this != USE;
  }

  /** Returns the category of {@code n}, or null when it is not a directive. */
  static @Nullable DirectiveCategory of(Node n) {
    switch (n.getToken()) {
      case ALIAS:
        return ALIAS;
      case IMPORT:
        return IMPORT;
      case REQUIRE:
        return REQUIRE;
      case USE:
        return USE;
      case ATTRIBUTE:
        switch (n.getString()) {
          case "shortdoc":
            return SHORTDOC;
          case "moduledoc":
            return MODULEDOC;
          case "behaviour":
            return BEHAVIOUR;
          default:
            return null;
        }
      default:
        return null;
    }
  }

  /**
   * Looks up categories by configuration name. {@code doc} stands for both doc attributes and
   * {@code capability} for {@code use}.
   */
  static ImmutableList<DirectiveCategory> forConfigName(String name) {
    switch (name) {
      case "doc":
        return ImmutableList.of(SHORTDOC, MODULEDOC);
      case "capability":
        return ImmutableList.of(USE);
      default:
        for (DirectiveCategory category : values()) {
          if (category.configName.equals(name)) {
            return ImmutableList.of(category);
          }
        }
        throw new IllegalArgumentException("Unknown directive category: " + name);
    }
  }
}
