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

import java.lang.reflect.InvocationTargetException;

/** Loads plugin styles by class name. */
public final class Plugins {

  private Plugins() {}

  /**
   * Returns a new instance of the named plugin.
   *
   * @throws IllegalArgumentException when the class cannot be loaded or instantiated, or is not a
   *     {@link Style}
   */
  public static Style validate(String className) {
    Class<?> clazz;
    try {
      clazz = Class.forName(className);
    } catch (ClassNotFoundException | LinkageError e) {
      throw new IllegalArgumentException("Plugin " + className + " could not be loaded", e);
    }
    if (!Style.class.isAssignableFrom(clazz)) {
      throw new IllegalArgumentException("Plugin " + className + " must implement Style");
    }
    try {
      return (Style) clazz.getConstructor().newInstance();
    } catch (NoSuchMethodException
        | InstantiationException
        | IllegalAccessException
        | InvocationTargetException e) {
      throw new IllegalArgumentException("Plugin " + className + " could not be loaded", e);
    }
  }

  /** Returns the description of a plugin, or its class name when it has none. */
  public static String describe(Style style) {
    if (style instanceof ModuleDirectives) {
      return ModuleDirectives.NAME;
    }
    if (style instanceof StylePlugin) {
      return ((StylePlugin) style).getDescription();
    }
    return style.getClass().getName();
  }
}
