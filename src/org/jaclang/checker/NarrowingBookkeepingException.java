/*
 * Copyright 2026 The Jac Checker Authors.
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

package org.jaclang.checker;

import org.jaclang.tree.Node;
import org.jspecify.annotations.Nullable;

/**
 * Thrown when narrowing frames are not pushed and popped in matching pairs. This is a bug in the
 * narrowing controller, never a problem with the analyzed code, and aborts the pass.
 */
public final class NarrowingBookkeepingException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final transient @Nullable Node construct;

  NarrowingBookkeepingException(String message, @Nullable Node construct) {
    super(construct == null ? message : message + " at " + describe(construct));
    this.construct = construct;
  }

  /** The conditional construct or clause whose bookkeeping failed, if known. */
  public @Nullable Node getConstruct() {
    return construct;
  }

  static String describe(Node n) {
    String source = n.getSourceFileName();
    return n.getToken()
        + " ("
        + (source != null ? source : "(unknown source)")
        + ":"
        + n.getLineno()
        + ":"
        + n.getCharno()
        + ")";
  }
}
