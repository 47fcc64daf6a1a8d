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

import static com.google.common.base.Preconditions.checkState;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Options for a styling run. Instances are immutable; every style reads them from its {@link
 * StyleContext} rather than from any global.
 */
@AutoValue
public abstract class StyleOptions {

  /** How directives are compared when they are sorted. */
  public enum SortOrder {
    /** Raw character comparison, upper case before lower case. */
    ASCII,
    /** Case-insensitive comparison. */
    DEFAULT,
  }

  /** What happens when a style fails on a node. */
  public enum ErrorMode {
    /** Log the failure, leave the node as it was and carry on. */
    LOG,
    /** Propagate the failure to the caller. */
    RAISE,
  }

  /** A plugin together with the options it was registered with. */
  @AutoValue
  public abstract static class PluginEntry {
    public static PluginEntry create(Style plugin, Map<String, ?> options) {
      return new AutoValue_StyleOptions_PluginEntry(plugin, ImmutableMap.copyOf(options));
    }

    public abstract Style getPlugin();

    public abstract ImmutableMap<String, Object> getOptions();
  }

  public static StyleOptions defaults() {
    return builder().build();
  }

  public static Builder builder() {
    return new AutoValue_StyleOptions.Builder()
        .setLayoutOrder(DirectiveCategory.DEFAULT_ORDER)
        .setSortOrder(SortOrder.DEFAULT)
        .setRewriteMultiAlias(true)
        .setLiftAlias(true)
        .setLiftAliasDepth(1)
        .setLiftAliasFrequency(1)
        .setLiftAliasOnly(ImmutableList.of())
        .setLiftAliasExcludedNamespaces(ImmutableSet.of())
        .setLiftAliasExcludedLastnames(ImmutableSet.of())
        .setOnly(ImmutableSet.of())
        .setExclude(ImmutableSet.of())
        .setOnError(ErrorMode.LOG);
  }

  public abstract Builder toBuilder();

  /** Category order of directives; categories not listed follow in their default order. */
  public abstract ImmutableList<DirectiveCategory> getLayoutOrder();

  public abstract SortOrder getSortOrder();

  /** Whether grouped directives such as {@code alias Foo.{Bar, Baz}} are expanded. */
  public abstract boolean getRewriteMultiAlias();

  /** Whether frequently used deep names are lifted into new aliases. */
  public abstract boolean getLiftAlias();

  /** Names with this many segments or fewer are never lifted. */
  public abstract int getLiftAliasDepth();

  /** Names seen this many times or fewer are never lifted. */
  public abstract int getLiftAliasFrequency();

  /** When non-empty, only names matching one of these patterns are lifted. */
  public abstract ImmutableList<Pattern> getLiftAliasOnly();

  /** Names under these namespaces are never lifted. */
  public abstract ImmutableSet<String> getLiftAliasExcludedNamespaces();

  /** Names ending in these segments are never lifted. */
  public abstract ImmutableSet<String> getLiftAliasExcludedLastnames();

  /** When non-empty, only the built-in styles named here run. */
  public abstract ImmutableSet<String> getOnly();

  /** Built-in styles that do not run. */
  public abstract ImmutableSet<String> getExclude();

  public abstract ErrorMode getOnError();

  public abstract ImmutableList<PluginEntry> getPlugins();

  /** Builder for {@link StyleOptions}. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder setLayoutOrder(List<DirectiveCategory> layoutOrder);

    abstract ImmutableList<DirectiveCategory> getLayoutOrder();

    public abstract Builder setSortOrder(SortOrder sortOrder);

    public abstract Builder setRewriteMultiAlias(boolean rewriteMultiAlias);

    public abstract Builder setLiftAlias(boolean liftAlias);

    public abstract Builder setLiftAliasDepth(int depth);

    public abstract Builder setLiftAliasFrequency(int frequency);

    public abstract Builder setLiftAliasOnly(List<Pattern> patterns);

    public abstract Builder setLiftAliasExcludedNamespaces(Set<String> namespaces);

    public abstract Builder setLiftAliasExcludedLastnames(Set<String> lastnames);

    public abstract Builder setOnly(Set<String> styles);

    public abstract Builder setExclude(Set<String> styles);

    public abstract Builder setOnError(ErrorMode onError);

    abstract ImmutableList.Builder<PluginEntry> pluginsBuilder();

    @CanIgnoreReturnValue
    public Builder addPlugin(Style plugin) {
      return addPlugin(plugin, ImmutableMap.of());
    }

    @CanIgnoreReturnValue
    public Builder addPlugin(Style plugin, Map<String, ?> options) {
      pluginsBuilder().add(PluginEntry.create(plugin, options));
      return this;
    }

    abstract StyleOptions autoBuild();

    public StyleOptions build() {
      setLayoutOrder(completeLayoutOrder(getLayoutOrder()));
      StyleOptions options = autoBuild();
      checkState(options.getLiftAliasDepth() >= 0, "Negative lift depth");
      checkState(options.getLiftAliasFrequency() >= 0, "Negative lift frequency");
      return options;
    }

    private static ImmutableList<DirectiveCategory> completeLayoutOrder(
        List<DirectiveCategory> configured) {
      Set<DirectiveCategory> order = new LinkedHashSet<>(configured);
      order.addAll(DirectiveCategory.DEFAULT_ORDER);
      return ImmutableList.copyOf(order);
    }
  }
}
