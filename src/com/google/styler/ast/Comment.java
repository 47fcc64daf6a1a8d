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

import com.google.auto.value.AutoValue;
import com.google.errorprone.annotations.Immutable;

/**
 * A source comment. Comments live beside the tree, not in it; the printer anchors each one before
 * the first node whose line is at or after the comment's line.
 */
@AutoValue
@Immutable
public abstract class Comment {

  public static Comment create(int line, String text) {
    return new AutoValue_Comment(line, text);
  }

  public abstract int getLine();

  public abstract String getText();

  public final boolean contains(String marker) {
    return getText().contains(marker);
  }
}
