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

import com.google.common.base.Ascii;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Reads {@link StyleOptions} from JSON. Every key is optional:
 *
 * <pre>{@code
 * {
 *   "layoutOrder": ["shortdoc", "moduledoc", "behaviour", "use", "import", "alias", "require"],
 *   "sortOrder": "ascii",
 *   "rewriteMultiAlias": true,
 *   "liftAlias": true,
 *   "liftAliasDepth": 1,
 *   "liftAliasFrequency": 1,
 *   "liftAliasOnly": ["^MyApp\\."],
 *   "liftAliasExcludedNamespaces": ["Ecto"],
 *   "liftAliasExcludedLastnames": ["Repo"],
 *   "only": ["module_directives"],
 *   "exclude": [],
 *   "onError": "raise",
 *   "plugins": ["com.example.MyStyle", {"class": "com.example.Other", "options": {"k": 1}}]
 * }
 * }</pre>
 */
public final class StyleOptionsParser {

  private static final ImmutableSet<String> KEYS =
      ImmutableSet.of(
          "layoutOrder",
          "sortOrder",
          "rewriteMultiAlias",
          "liftAlias",
          "liftAliasDepth",
          "liftAliasFrequency",
          "liftAliasOnly",
          "liftAliasExcludedNamespaces",
          "liftAliasExcludedLastnames",
          "only",
          "exclude",
          "onError",
          "plugins");

  private StyleOptionsParser() {}

  public static StyleOptions parse(String contents) throws StyleOptionsParseException {
    Gson gson = new Gson();
    StyleOptions.Builder builder = StyleOptions.builder();
    try {
      JsonObject root = gson.fromJson(contents, JsonObject.class);
      if (root == null) {
        return builder.build();
      }
      for (String key : root.keySet()) {
        if (!KEYS.contains(key)) {
          throw new StyleOptionsParseException("Unknown option: " + key);
        }
      }
      if (root.has("layoutOrder")) {
        Set<DirectiveCategory> order = new LinkedHashSet<>();
        for (String name : getStrings(root, "layoutOrder")) {
          order.addAll(categoriesFor(name));
        }
        builder.setLayoutOrder(ImmutableList.copyOf(order));
      }
      if (root.has("sortOrder")) {
        builder.setSortOrder(getEnum(root, "sortOrder", StyleOptions.SortOrder.class));
      }
      if (root.has("rewriteMultiAlias")) {
        builder.setRewriteMultiAlias(getBoolean(root, "rewriteMultiAlias"));
      }
      if (root.has("liftAlias")) {
        builder.setLiftAlias(getBoolean(root, "liftAlias"));
      }
      if (root.has("liftAliasDepth")) {
        builder.setLiftAliasDepth(getInt(root, "liftAliasDepth"));
      }
      if (root.has("liftAliasFrequency")) {
        builder.setLiftAliasFrequency(getInt(root, "liftAliasFrequency"));
      }
      if (root.has("liftAliasOnly")) {
        ImmutableList.Builder<Pattern> patterns = ImmutableList.builder();
        for (String regex : getStrings(root, "liftAliasOnly")) {
          patterns.add(Pattern.compile(regex));
        }
        builder.setLiftAliasOnly(patterns.build());
      }
      if (root.has("liftAliasExcludedNamespaces")) {
        builder.setLiftAliasExcludedNamespaces(getStrings(root, "liftAliasExcludedNamespaces"));
      }
      if (root.has("liftAliasExcludedLastnames")) {
        builder.setLiftAliasExcludedLastnames(getStrings(root, "liftAliasExcludedLastnames"));
      }
      if (root.has("only")) {
        builder.setOnly(getStrings(root, "only"));
      }
      if (root.has("exclude")) {
        builder.setExclude(getStrings(root, "exclude"));
      }
      if (root.has("onError")) {
        builder.setOnError(getEnum(root, "onError", StyleOptions.ErrorMode.class));
      }
      if (root.has("plugins")) {
        for (JsonElement plugin : getArray(root, "plugins")) {
          addPlugin(gson, builder, plugin);
        }
      }
    } catch (JsonParseException
        | IllegalStateException
        | UnsupportedOperationException
        | NumberFormatException
        | PatternSyntaxException e) {
      throw new StyleOptionsParseException("Invalid options: " + e.getMessage(), e);
    }
    try {
      return builder.build();
    } catch (IllegalStateException e) {
      throw new StyleOptionsParseException("Invalid options: " + e.getMessage(), e);
    }
  }

  private static ImmutableList<DirectiveCategory> categoriesFor(String name)
      throws StyleOptionsParseException {
    try {
      return DirectiveCategory.forConfigName(name);
    } catch (IllegalArgumentException e) {
      throw new StyleOptionsParseException(e.getMessage(), e);
    }
  }

  private static void addPlugin(Gson gson, StyleOptions.Builder builder, JsonElement plugin)
      throws StyleOptionsParseException {
    String className;
    Map<String, Object> options = ImmutableMap.of();
    if (plugin.isJsonObject()) {
      JsonObject object = plugin.getAsJsonObject();
      if (!object.has("class")) {
        throw new StyleOptionsParseException("Plugin entry without a class: " + plugin);
      }
      className = getString(object, "class");
      if (object.has("options")) {
        if (!object.get("options").isJsonObject()) {
          throw new StyleOptionsParseException("Plugin options must be an object: " + plugin);
        }
        options =
            gson.fromJson(
                object.get("options"), new TypeToken<Map<String, Object>>() {}.getType());
      }
    } else if (isString(plugin)) {
      className = plugin.getAsString();
    } else {
      throw new StyleOptionsParseException("Invalid plugin entry: " + plugin);
    }
    try {
      builder.addPlugin(Plugins.validate(className), options);
    } catch (IllegalArgumentException e) {
      throw new StyleOptionsParseException(e.getMessage(), e);
    }
  }

  private static ImmutableSet<String> getStrings(JsonObject object, String key)
      throws StyleOptionsParseException {
    ImmutableSet.Builder<String> result = ImmutableSet.builder();
    for (JsonElement element : getArray(object, key)) {
      if (!isString(element)) {
        throw new StyleOptionsParseException("Expected strings in " + key + ": " + element);
      }
      result.add(element.getAsString());
    }
    return result.build();
  }

  private static JsonArray getArray(JsonObject object, String key)
      throws StyleOptionsParseException {
    JsonElement value = object.get(key);
    if (!value.isJsonArray()) {
      throw new StyleOptionsParseException("Expected an array for " + key + ": " + value);
    }
    return value.getAsJsonArray();
  }

  private static String getString(JsonObject object, String key)
      throws StyleOptionsParseException {
    JsonElement value = object.get(key);
    if (!isString(value)) {
      throw new StyleOptionsParseException("Expected a string for " + key + ": " + value);
    }
    return value.getAsString();
  }

  private static boolean getBoolean(JsonObject object, String key)
      throws StyleOptionsParseException {
    JsonElement value = object.get(key);
    if (!value.isJsonPrimitive() || !value.getAsJsonPrimitive().isBoolean()) {
      throw new StyleOptionsParseException("Expected a boolean for " + key + ": " + value);
    }
    return value.getAsBoolean();
  }

  private static int getInt(JsonObject object, String key) throws StyleOptionsParseException {
    JsonElement value = object.get(key);
    if (!value.isJsonPrimitive() || !value.getAsJsonPrimitive().isNumber()) {
      throw new StyleOptionsParseException("Expected an integer for " + key + ": " + value);
    }
    double number = value.getAsDouble();
    if (number != Math.rint(number) || number < Integer.MIN_VALUE || number > Integer.MAX_VALUE) {
      throw new StyleOptionsParseException("Expected an integer for " + key + ": " + value);
    }
    return (int) number;
  }

  private static boolean isString(JsonElement element) {
    return element.isJsonPrimitive() && element.getAsJsonPrimitive().isString();
  }

  private static <E extends Enum<E>> E getEnum(JsonObject object, String key, Class<E> type)
      throws StyleOptionsParseException {
    String value = getString(object, key);
    try {
      return Enum.valueOf(type, Ascii.toUpperCase(value));
    } catch (IllegalArgumentException e) {
      throw new StyleOptionsParseException("Invalid value for " + key + ": " + value, e);
    }
  }
}
