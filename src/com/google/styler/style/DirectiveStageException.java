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

/**
 * Thrown when organizing the directives of a scope fails. The scope is left exactly as it was
 * before the attempt.
 */
public final class DirectiveStageException extends RuntimeException {

  private final DirectiveStage stage;
  private final int lineno;

  DirectiveStageException(DirectiveStage stage, int lineno, Throwable cause) {
    super(
        "Failed to "
            + Ascii.toLowerCase(stage.name())
            + " the directives of the scope at line "
            + lineno
            + ": "
            + cause.getMessage(),
        cause);
    this.stage = stage;
    this.lineno = lineno;
  }

  public DirectiveStage getStage() {
    return stage;
  }

  /** The line of the scope whose directives were being organized. */
  public int getLineno() {
    return lineno;
  }
}
