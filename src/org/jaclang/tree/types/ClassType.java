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

import static com.google.common.base.Preconditions.checkArgument;

import org.jspecify.annotations.Nullable;

/**
 * A named class or primitive type. Two class types are equal when they have the same name; there
 * is no subtyping between class types.
 */
public final class ClassType extends JacType {
  private static final long serialVersionUID = 1L;

  private final String referenceName;

  ClassType(String referenceName) {
    checkArgument(!referenceName.isEmpty(), "Class type needs a name");
    this.referenceName = referenceName;
  }

  public String getReferenceName() {
    return referenceName;
  }

  @Override
  public boolean isClassType() {
    return true;
  }

  @Override
  public ClassType toMaybeClassType() {
    return this;
  }

  @Override
  public <T> T visit(Visitor<T> visitor) {
    return visitor.caseClassType(this);
  }

  @Override
  public String getDisplayName() {
    return referenceName;
  }

  @Override
  public boolean equals(@Nullable Object other) {
    return other instanceof ClassType && ((ClassType) other).referenceName.equals(referenceName);
  }

  @Override
  public int hashCode() {
    return referenceName.hashCode();
  }
}
