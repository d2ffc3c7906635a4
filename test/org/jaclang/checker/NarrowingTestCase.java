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

import static com.google.common.truth.Truth.assertWithMessage;

import org.jaclang.tree.IR;
import org.jaclang.tree.Node;
import org.jaclang.tree.types.ClassType;
import org.jaclang.tree.types.JacType;
import org.jaclang.tree.types.JacTypeNative;
import org.jaclang.tree.types.TypeRegistry;
import org.junit.Before;

/** Base class for tests that run narrowing over hand-built trees. */
public abstract class NarrowingTestCase {

  protected TypeRegistry registry;
  protected NarrowingOptions options;
  protected SortingErrorManager errorManager;

  protected JacType nullType;
  protected JacType unknownType;
  protected JacType noType;
  protected JacType strType;
  protected JacType intType;
  protected ClassType dogType;
  protected ClassType catType;

  @Before
  public void setUp() throws Exception {
    registry = new TypeRegistry();
    options = new NarrowingOptions();
    errorManager = new SortingErrorManager();
    nullType = registry.getNativeType(JacTypeNative.NULL_TYPE);
    unknownType = registry.getNativeType(JacTypeNative.UNKNOWN_TYPE);
    noType = registry.getNativeType(JacTypeNative.NO_TYPE);
    strType = registry.getNativeType(JacTypeNative.STRING_TYPE);
    intType = registry.getNativeType(JacTypeNative.INT_TYPE);
    dogType = registry.createClassType("Dog");
    catType = registry.createClassType("Cat");
  }

  protected JacType union(JacType... variants) {
    return registry.createUnionType(variants);
  }

  protected JacType nullable(JacType type) {
    return registry.createNullableType(type);
  }

  /** Runs the default narrowing pass over {@code script}. */
  protected NarrowingResult analyze(Node script) {
    NarrowingResult result = new NarrowingPass(registry, options, errorManager).analyze(script);
    for (NarrowingResult.BodyStats stats : result.getBodyStats()) {
      assertWithMessage("pushes and pops of %s", stats.root())
          .that(stats.pushCount())
          .isEqualTo(stats.popCount());
    }
    return result;
  }

  /** {@code def name(params): stmts} */
  protected static Node function(String name, Node params, Node... stmts) {
    return IR.function(name, params, IR.block(stmts));
  }

  /** A statement reading {@code ref}, which the test keeps to look its type up afterwards. */
  protected static Node use(Node ref) {
    return IR.exprResult(ref);
  }
}
