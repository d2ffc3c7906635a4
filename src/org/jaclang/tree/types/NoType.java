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

package org.jaclang.tree.types;

import org.jspecify.annotations.Nullable;

/**
 * The empty type. It is what remains of a union once every alternate has been excluded, so a
 * variable of this type lives in code that cannot be reached.
 */
public final class NoType extends JacType {
  private static final long serialVersionUID = 1L;

  NoType() {}

  @Override
  public boolean isNoType() {
    return true;
  }

  @Override
  public <T> T visit(Visitor<T> visitor) {
    return visitor.caseNoType();
  }

  @Override
  public String getDisplayName() {
    return "Never";
  }

  @Override
  public boolean equals(@Nullable Object other) {
    return other instanceof NoType;
  }

  @Override
  public int hashCode() {
    return 41;
  }
}
