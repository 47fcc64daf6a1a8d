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
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class StyleOptionsTest {

  @Test
  public void testDefaults() {
    StyleOptions options = StyleOptions.defaults();
    assertThat(options.getLayoutOrder()).isEqualTo(DirectiveCategory.DEFAULT_ORDER);
    assertThat(options.getSortOrder()).isEqualTo(StyleOptions.SortOrder.DEFAULT);
    assertThat(options.getRewriteMultiAlias()).isTrue();
    assertThat(options.getLiftAlias()).isTrue();
    assertThat(options.getLiftAliasDepth()).isEqualTo(1);
    assertThat(options.getLiftAliasFrequency()).isEqualTo(1);
    assertThat(options.getLiftAliasOnly()).isEmpty();
    assertThat(options.getOnError()).isEqualTo(StyleOptions.ErrorMode.LOG);
    assertThat(options.getPlugins()).isEmpty();
  }

  @Test
  public void testPartialLayoutOrderIsCompleted() {
    StyleOptions options =
        StyleOptions.builder()
            .setLayoutOrder(ImmutableList.of(DirectiveCategory.REQUIRE, DirectiveCategory.ALIAS))
            .build();
    assertThat(options.getLayoutOrder())
        .containsExactly(
            DirectiveCategory.REQUIRE,
            DirectiveCategory.ALIAS,
            DirectiveCategory.SHORTDOC,
            DirectiveCategory.MODULEDOC,
            DirectiveCategory.BEHAVIOUR,
            DirectiveCategory.USE,
            DirectiveCategory.IMPORT)
        .inOrder();
  }

  @Test
  public void testNegativeThresholdsAreRejected() {
    assertThrows(
        IllegalStateException.class,
        () -> StyleOptions.builder().setLiftAliasDepth(-1).build());
    assertThrows(
        IllegalStateException.class,
        () -> StyleOptions.builder().setLiftAliasFrequency(-1).build());
  }

  @Test
  public void testToBuilder() {
    StyleOptions options = StyleOptions.builder().setLiftAlias(false).build();
    StyleOptions copy = options.toBuilder().setLiftAliasDepth(3).build();
    assertThat(copy.getLiftAlias()).isFalse();
    assertThat(copy.getLiftAliasDepth()).isEqualTo(3);
  }

  @Test
  public void testCategoryConfigNames() {
    assertThat(DirectiveCategory.forConfigName("doc"))
        .containsExactly(DirectiveCategory.SHORTDOC, DirectiveCategory.MODULEDOC)
        .inOrder();
    assertThat(DirectiveCategory.forConfigName("capability"))
        .containsExactly(DirectiveCategory.USE);
    assertThat(DirectiveCategory.forConfigName("alias")).containsExactly(DirectiveCategory.ALIAS);
    assertThrows(IllegalArgumentException.class, () -> DirectiveCategory.forConfigName("bogus"));
  }
}
