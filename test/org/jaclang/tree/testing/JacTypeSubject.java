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

package org.jaclang.tree.testing;

import static com.google.common.truth.Fact.fact;
import static com.google.common.truth.Fact.simpleFact;
import static com.google.common.truth.Truth.assertAbout;

import com.google.common.truth.FailureMetadata;
import com.google.common.truth.Subject;
import org.jaclang.tree.types.JacType;
import org.jaclang.tree.types.UnionType;
import org.jspecify.annotations.Nullable;

/** A Truth Subject for {@link JacType}. */
public final class JacTypeSubject extends Subject {

  private final @Nullable JacType actual;

  public static JacTypeSubject assertType(@Nullable JacType type) {
    return assertAbout(types()).that(type);
  }

  public static Subject.Factory<JacTypeSubject, JacType> types() {
    return JacTypeSubject::new;
  }

  private JacTypeSubject(FailureMetadata metadata, @Nullable JacType actual) {
    super(metadata, actual);
    this.actual = actual;
  }

  private JacType actualNonNull() {
    isNotNull();
    return actual;
  }

  public void isNoType() {
    if (!actualNonNull().isNoType()) {
      failWithActual(simpleFact("expected to be the empty type"));
    }
  }

  public void isUnknown() {
    if (!actualNonNull().isUnknownType()) {
      failWithActual(simpleFact("expected to be the unknown type"));
    }
  }

  public void isNullType() {
    if (!actualNonNull().isNullType()) {
      failWithActual(simpleFact("expected to be None"));
    }
  }

  public void hasDisplayName(String displayName) {
    check("getDisplayName()").that(actualNonNull().getDisplayName()).isEqualTo(displayName);
  }

  /** Asserts that the type is a union with exactly {@code alternates}, in any order. */
  public void isUnionOf(JacType... alternates) {
    UnionType union = actualNonNull().toMaybeUnionType();
    if (union == null) {
      failWithActual(simpleFact("expected to be a union type"));
      return;
    }
    check("getAlternates()").that(union.getAlternates()).containsExactlyElementsIn(alternates);
  }

  public void isNullable() {
    if (!actualNonNull().isNullable()) {
      failWithActual(fact("expected to include", "None"));
    }
  }

  public void isNotNullable() {
    if (actualNonNull().isNullable()) {
      failWithActual(fact("expected not to include", "None"));
    }
  }
}
