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
 * The type of a value the resolver knows nothing about. Narrowing never refines it away: excluding
 * anything from the unknown type leaves the unknown type.
 */
public final class UnknownType extends JacType {
  private static final long serialVersionUID = 1L;

  UnknownType() {}

  @Override
  public boolean isUnknownType() {
    return true;
  }

  @Override
  public boolean isNullable() {
    return true;
  }

  @Override
  public <T> T visit(Visitor<T> visitor) {
    return visitor.caseUnknownType();
  }

  @Override
  public String getDisplayName() {
    return "?";
  }

  @Override
  public boolean equals(@Nullable Object other) {
    return other instanceof UnknownType;
  }

  @Override
  public int hashCode() {
    return 37;
  }
}
