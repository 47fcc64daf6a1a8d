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

import org.jspecify.annotations.Nullable;

/** Thrown when a style fails on a node and failures are configured to propagate. */
public final class StyleException extends RuntimeException {

  private final String style;
  private final @Nullable String file;

  StyleException(String style, @Nullable String file, Throwable cause) {
    super(
        "Style " + style + " failed" + (file != null ? " in " + file : "") + ": "
            + cause.getMessage(),
        cause);
    this.style = style;
    this.file = file;
  }

  /** The name of the failing style. */
  public String getStyle() {
    return style;
  }

  public @Nullable String getFile() {
    return file;
  }
}
