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

import static com.google.common.truth.Truth.assertThat;
import static org.jaclang.tree.testing.JacTypeSubject.assertType;
import static org.junit.Assert.assertThrows;

import org.jaclang.tree.IR;
import org.jaclang.tree.Node;
import org.jaclang.tree.types.JacType;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class ConditionalNarrowingCallbackTest extends NarrowingTestCase {

  @Test
  public void testTypeTestIfElse() {
    // def speak(pet: Dog | Cat):
    //   if isinstance(pet, Dog): pet
    //   else: pet
    //   pet
    Node inCondition = IR.name("pet");
    Node inThen = IR.name("pet");
    Node inElse = IR.name("pet");
    Node after = IR.name("pet");
    Node script =
        IR.script(
            function(
                "speak",
                IR.paramList(IR.param("pet", union(dogType, catType))),
                IR.ifNode(
                    IR.call(IR.name("isinstance"), inCondition, IR.name("Dog")),
                    IR.block(use(inThen)),
                    IR.elseNode(IR.block(use(inElse)))),
                use(after)));

    NarrowingResult result = analyze(script);

    assertThat(result.getTypeAt(inCondition)).isEqualTo(union(dogType, catType));
    assertThat(result.getTypeAt(inThen)).isSameInstanceAs(dogType);
    assertThat(result.getTypeAt(inElse)).isSameInstanceAs(catType);
    assertThat(result.getTypeAt(after)).isEqualTo(union(dogType, catType));
    assertThat(result.getReferencedTypes("pet"))
        .containsExactly(union(dogType, catType), dogType, catType, union(dogType, catType))
        .inOrder();
    assertThat(errorManager.getWarnings()).isEmpty();
  }

  @Test
  public void testNullGuardWithEarlyReturn() {
    // def greet(s: str | None):
    //   if s is None: return
    //   s
    Node after = IR.name("s");
    Node script =
        IR.script(
            function(
                "greet",
                IR.paramList(IR.param("s", nullable(strType))),
                IR.ifNode(IR.is(IR.name("s"), IR.nullNode()), IR.block(IR.returnNode())),
                use(after)));

    NarrowingResult result = analyze(script);

    assertThat(result.getTypeAt(after)).isSameInstanceAs(strType);
  }

  @Test
  public void testEarlyRaise() {
    Node after = IR.name("s");
    Node script =
        IR.script(
            function(
                "greet",
                IR.paramList(IR.param("s", nullable(strType))),
                IR.ifNode(
                    IR.is(IR.name("s"), IR.nullNode()),
                    IR.block(IR.raise(IR.call(IR.name("ValueError"))))),
                use(after)));

    assertThat(analyze(script).getTypeAt(after)).isSameInstanceAs(strType);
  }

  @Test
  public void testNoEarlyExitWhenBodyFallsThrough() {
    Node after = IR.name("s");
    Node script =
        IR.script(
            function(
                "greet",
                IR.paramList(IR.param("s", nullable(strType))),
                IR.ifNode(
                    IR.is(IR.name("s"), IR.nullNode()),
                    IR.block(IR.ifNode(IR.trueNode(), IR.block(IR.returnNode())))),
                use(after)));

    assertThat(analyze(script).getTypeAt(after)).isEqualTo(nullable(strType));
  }

  @Test
  public void testEarlyExitCanBeDisabled() {
    options.setEarlyExitPropagation(false);
    Node after = IR.name("s");
    Node script =
        IR.script(
            function(
                "greet",
                IR.paramList(IR.param("s", nullable(strType))),
                IR.ifNode(IR.is(IR.name("s"), IR.nullNode()), IR.block(IR.returnNode())),
                use(after)));

    assertThat(analyze(script).getTypeAt(after)).isEqualTo(nullable(strType));
  }

  @Test
  public void testNoEarlyExitWithElse() {
    Node after = IR.name("s");
    Node script =
        IR.script(
            function(
                "greet",
                IR.paramList(IR.param("s", nullable(strType))),
                IR.ifNode(
                    IR.is(IR.name("s"), IR.nullNode()),
                    IR.block(IR.returnNode()),
                    IR.elseNode(IR.block(IR.pass()))),
                use(after)));

    assertThat(analyze(script).getTypeAt(after)).isEqualTo(nullable(strType));
  }

  @Test
  public void testElifAccumulation() {
    // def h(x: int | str | None):
    //   if x is None: x
    //   elif isinstance(x, int): x
    //   else: x
    Node inIf = IR.name("x");
    Node inElifCondition = IR.name("x");
    Node inElif = IR.name("x");
    Node inElse = IR.name("x");
    Node after = IR.name("x");
    JacType declared = union(intType, strType, nullType);
    Node script =
        IR.script(
            function(
                "h",
                IR.paramList(IR.param("x", declared)),
                IR.ifNode(
                    IR.is(IR.name("x"), IR.nullNode()),
                    IR.block(use(inIf)),
                    IR.elif(
                        IR.call(IR.name("isinstance"), inElifCondition, IR.name("int")),
                        IR.block(use(inElif)),
                        IR.elseNode(IR.block(use(inElse))))),
                use(after)));

    NarrowingResult result = analyze(script);

    assertType(result.getTypeAt(inIf)).isNullType();
    assertThat(result.getTypeAt(inElifCondition)).isEqualTo(union(intType, strType));
    assertThat(result.getTypeAt(inElif)).isSameInstanceAs(intType);
    assertThat(result.getTypeAt(inElse)).isSameInstanceAs(strType);
    assertThat(result.getTypeAt(after)).isEqualTo(declared);
  }

  @Test
  public void testElifOnAnotherSymbol() {
    // if isinstance(pet, Dog): ... elif s is not None: pet, s  else: pet, s
    Node petInElif = IR.name("pet");
    Node sInElif = IR.name("s");
    Node petInElse = IR.name("pet");
    Node sInElse = IR.name("s");
    Node script =
        IR.script(
            function(
                "f",
                IR.paramList(
                    IR.param("pet", union(dogType, catType)), IR.param("s", nullable(strType))),
                IR.ifNode(
                    IR.isinstance(IR.name("pet"), "Dog"),
                    IR.block(IR.pass()),
                    IR.elif(
                        IR.isNot(IR.name("s"), IR.nullNode()),
                        IR.block(use(petInElif), use(sInElif)),
                        IR.elseNode(IR.block(use(petInElse), use(sInElse)))))));

    NarrowingResult result = analyze(script);

    assertThat(result.getTypeAt(petInElif)).isSameInstanceAs(catType);
    assertThat(result.getTypeAt(sInElif)).isSameInstanceAs(strType);
    assertThat(result.getTypeAt(petInElse)).isSameInstanceAs(catType);
    assertType(result.getTypeAt(sInElse)).isNullType();
  }

  @Test
  public void testIfElifChainThatAlwaysExits() {
    // if x is None: return
    // elif isinstance(x, int): return
    // x
    Node after = IR.name("x");
    Node script =
        IR.script(
            function(
                "f",
                IR.paramList(IR.param("x", union(intType, strType, nullType))),
                IR.ifNode(
                    IR.is(IR.name("x"), IR.nullNode()),
                    IR.block(IR.returnNode()),
                    IR.elif(IR.isinstance(IR.name("x"), "int"), IR.block(IR.returnNode()))),
                use(after)));

    assertThat(analyze(script).getTypeAt(after)).isSameInstanceAs(strType);
  }

  @Test
  public void testRestorationAfterJoin() {
    Node after = IR.name("s");
    Node script =
        IR.script(
            function(
                "f",
                IR.paramList(IR.param("s", nullable(strType))),
                IR.ifNode(IR.isNot(IR.name("s"), IR.nullNode()), IR.block(use(IR.name("s")))),
                use(after)));

    NarrowingResult result = analyze(script);

    assertThat(result.getTypeAt(after)).isEqualTo(nullable(strType));
    assertThat(result.getReferencedTypes("s"))
        .containsExactly(nullable(strType), strType, nullable(strType))
        .inOrder();
  }

  @Test
  public void testNestedConstructs() {
    // if a is not None:
    //   if isinstance(b, Dog): a, b
    //   b
    // a
    Node aInner = IR.name("a");
    Node bInner = IR.name("b");
    Node bOuter = IR.name("b");
    Node aAfter = IR.name("a");
    Node function =
        function(
            "f",
            IR.paramList(IR.param("a", nullable(strType)), IR.param("b", union(dogType, catType))),
            IR.ifNode(
                IR.isNot(IR.name("a"), IR.nullNode()),
                IR.block(
                    IR.ifNode(
                        IR.isinstance(IR.name("b"), "Dog"), IR.block(use(aInner), use(bInner))),
                    use(bOuter))),
            use(aAfter));

    NarrowingResult result = analyze(IR.script(function));

    assertThat(result.getTypeAt(aInner)).isSameInstanceAs(strType);
    assertThat(result.getTypeAt(bInner)).isSameInstanceAs(dogType);
    assertThat(result.getTypeAt(bOuter)).isEqualTo(union(dogType, catType));
    assertThat(result.getTypeAt(aAfter)).isEqualTo(nullable(strType));
    NarrowingResult.BodyStats stats = result.getBodyStats().get(1);
    assertThat(stats.root()).isSameInstanceAs(function);
    assertThat(stats.maxDepth()).isEqualTo(2);
    assertThat(stats.pushCount()).isEqualTo(2);
  }

  @Test
  public void testNestedTypeTestOfAnotherClass() {
    // if isinstance(pet, Dog):
    //   if isinstance(pet, Cat): pet
    //   else: pet
    Node inCat = IR.name("pet");
    Node inElse = IR.name("pet");
    JacType declared = union(dogType, catType);
    Node script =
        IR.script(
            function(
                "f",
                IR.paramList(IR.param("pet", declared)),
                IR.ifNode(
                    IR.isinstance(IR.name("pet"), "Dog"),
                    IR.block(
                        IR.ifNode(
                            IR.isinstance(IR.name("pet"), "Cat"),
                            IR.block(use(inCat)),
                            IR.elseNode(IR.block(use(inElse))))))));

    NarrowingResult result = analyze(script);

    assertType(result.getTypeAt(inCat)).isNoType();
    assertThat(result.getTypeAt(inElse)).isSameInstanceAs(dogType);
    TypeAlgebra algebra = new TypeAlgebra(registry);
    for (JacType type : result.getReferencedTypes("pet")) {
      assertThat(algebra.isNarrowingOf(type, declared)).isTrue();
    }
  }

  @Test
  public void testDeepNestingIsBalanced() {
    Node innermost = IR.name("s");
    Node body = IR.block(use(innermost));
    for (int i = 0; i < 20; i++) {
      body =
          IR.block(
              IR.ifNode(
                  IR.isNot(IR.name("s"), IR.nullNode()),
                  body,
                  IR.elif(IR.trueNode(), IR.block(IR.pass()), IR.elseNode(IR.block(IR.pass())))));
    }
    Node script =
        IR.script(
            IR.function("f", IR.paramList(IR.param("s", nullable(strType))), body));

    NarrowingResult result = analyze(script);

    assertThat(result.getTypeAt(innermost)).isSameInstanceAs(strType);
    NarrowingResult.BodyStats stats = result.getBodyStats().get(1);
    assertThat(stats.maxDepth()).isEqualTo(20);
    // Each construct pushes for if, elif condition, elif body and else.
    assertThat(stats.pushCount()).isEqualTo(80);
  }

  @Test
  public void testResidualScopedToEnclosingBlock() {
    // if flag:
    //   if a is None: raise ValueError()
    //   a
    // a
    Node inBlock = IR.name("a");
    Node after = IR.name("a");
    Node script =
        IR.script(
            function(
                "f",
                IR.paramList(
                    IR.param("a", nullable(strType)),
                    IR.param("flag", registry.getType("bool"))),
                IR.ifNode(
                    IR.name("flag"),
                    IR.block(
                        IR.ifNode(
                            IR.is(IR.name("a"), IR.nullNode()),
                            IR.block(IR.raise(IR.call(IR.name("ValueError"))))),
                        use(inBlock))),
                use(after)));

    NarrowingResult result = analyze(script);

    assertThat(result.getTypeAt(inBlock)).isSameInstanceAs(strType);
    assertThat(result.getTypeAt(after)).isEqualTo(nullable(strType));
  }

  @Test
  public void testEarlyExitsStack() {
    // if a is None: return
    // if isinstance(pet, Dog): return
    // a, pet
    Node a = IR.name("a");
    Node pet = IR.name("pet");
    Node script =
        IR.script(
            function(
                "f",
                IR.paramList(
                    IR.param("a", nullable(strType)), IR.param("pet", union(dogType, catType))),
                IR.ifNode(IR.is(IR.name("a"), IR.nullNode()), IR.block(IR.returnNode())),
                IR.ifNode(IR.isinstance(IR.name("pet"), "Dog"), IR.block(IR.returnNode())),
                use(a),
                use(pet)));

    NarrowingResult result = analyze(script);

    assertThat(result.getTypeAt(a)).isSameInstanceAs(strType);
    assertThat(result.getTypeAt(pet)).isSameInstanceAs(catType);
  }

  @Test
  public void testModuleLevelEarlyExit() {
    Node after = IR.name("config");
    Node script =
        IR.script(
            IR.var("config", nullable(strType)),
            IR.ifNode(
                IR.is(IR.name("config"), IR.nullNode()),
                IR.block(IR.raise(IR.call(IR.name("RuntimeError"))))),
            IR.exprResult(after));

    assertThat(analyze(script).getTypeAt(after)).isSameInstanceAs(strType);
  }

  @Test
  public void testNotGuard() {
    Node inThen = IR.name("s");
    Node inElse = IR.name("s");
    Node script =
        IR.script(
            function(
                "f",
                IR.paramList(IR.param("s", nullable(strType))),
                IR.ifNode(
                    IR.not(IR.is(IR.name("s"), IR.nullNode())),
                    IR.block(use(inThen)),
                    IR.elseNode(IR.block(use(inElse))))));

    NarrowingResult result = analyze(script);

    assertThat(result.getTypeAt(inThen)).isSameInstanceAs(strType);
    assertType(result.getTypeAt(inElse)).isNullType();
  }

  @Test
  public void testCompoundConditionDoesNotNarrow() {
    Node inThen = IR.name("pet");
    Node script =
        IR.script(
            function(
                "f",
                IR.paramList(
                    IR.param("pet", union(dogType, catType)), IR.param("s", nullable(strType))),
                IR.ifNode(
                    IR.and(
                        IR.isinstance(IR.name("pet"), "Dog"), IR.is(IR.name("s"), IR.nullNode())),
                    IR.block(use(inThen)))));

    assertThat(analyze(script).getTypeAt(inThen)).isEqualTo(union(dogType, catType));
  }

  @Test
  public void testEqualityWithNoneDoesNotNarrow() {
    Node inThen = IR.name("s");
    Node script =
        IR.script(
            function(
                "f",
                IR.paramList(IR.param("s", nullable(strType))),
                IR.ifNode(IR.eq(IR.name("s"), IR.nullNode()), IR.block(use(inThen)))));

    assertThat(analyze(script).getTypeAt(inThen)).isEqualTo(nullable(strType));
  }

  @Test
  public void testUnannotatedParameterIsUnknown() {
    Node inThen = IR.name("v");
    Node inElse = IR.name("v");
    Node script =
        IR.script(
            function(
                "f",
                IR.paramList(IR.name("v")),
                IR.ifNode(
                    IR.isinstance(IR.name("v"), "Dog"),
                    IR.block(use(inThen)),
                    IR.elseNode(IR.block(use(inElse))))));

    NarrowingResult result = analyze(script);

    assertThat(result.getTypeAt(inThen)).isSameInstanceAs(dogType);
    assertType(result.getTypeAt(inElse)).isUnknown();
  }

  @Test
  public void testUndeclaredNamesAreNotRecorded() {
    Node stranger = IR.name("stranger");
    Node script =
        IR.script(
            function(
                "f",
                IR.paramList(),
                IR.ifNode(IR.is(stranger, IR.nullNode()), IR.block(IR.pass()))));

    NarrowingResult result = analyze(script);

    assertThat(result.getTypeAt(stranger)).isNull();
    assertThat(result.getResolvedTypes()).isEmpty();
  }

  @Test
  public void testDeclarationsAreNotReferences() {
    Node param = IR.param("s", nullable(strType));
    Node script =
        IR.script(
            function(
                "f",
                IR.paramList(param),
                IR.var("t", strType, IR.name("s")),
                IR.exprResult(IR.assign(IR.name("t"), IR.string("x")))));

    NarrowingResult result = analyze(script);

    assertThat(result.getTypeAt(param)).isNull();
    assertThat(result.getReferencedTypes("s")).containsExactly(nullable(strType));
    assertThat(result.getReferencedTypes("t")).isEmpty();
  }

  @Test
  public void testUnreachableElse() {
    Node elseNode = IR.elseNode(IR.block(use(IR.name("pet")))).setLinenoCharno(5, 2);
    Node construct =
        IR.ifNode(
            IR.isinstance(IR.name("pet"), "Dog"),
            IR.block(IR.pass()),
            IR.elif(IR.isinstance(IR.name("pet"), "Cat"), IR.block(IR.pass()), elseNode));
    Node script =
        IR.script(function("f", IR.paramList(IR.param("pet", union(dogType, catType))), construct));
    script.setSourceFileName("pets.jac");

    NarrowingResult result = analyze(script);

    assertType(result.getReferencedTypes("pet").get(2)).isNoType();
    assertThat(result.getWarnings()).hasSize(1);
    JacError warning = result.getWarnings().get(0);
    assertThat(warning.type()).isEqualTo(NarrowingPass.JAC_UNREACHABLE_BRANCH);
    assertThat(warning.node()).isSameInstanceAs(elseNode);
    assertThat(warning.format(CheckLevel.WARNING))
        .isEqualTo(
            "pets.jac:5:2: WARNING - [JAC_UNREACHABLE_BRANCH] This else branch is unreachable:"
                + " no type is left for 'pet' after the earlier conditions");
  }

  @Test
  public void testUnreachableElif() {
    Node elif = IR.elif(IR.isinstance(IR.name("pet"), "Dog"), IR.block(IR.pass()));
    Node script =
        IR.script(
            function(
                "f",
                IR.paramList(IR.param("pet", dogType)),
                IR.ifNode(IR.isinstance(IR.name("pet"), "Dog"), IR.block(IR.pass()), elif)));

    NarrowingResult result = analyze(script);

    assertThat(result.getWarnings()).hasSize(1);
    assertThat(result.getWarnings().get(0).node()).isSameInstanceAs(elif);
  }

  @Test
  public void testUnreachableBranchLevel() {
    options.setUnreachableBranchLevel(CheckLevel.ERROR);
    NarrowingResult result = analyze(unreachableElseScript());
    assertThat(result.getErrors()).hasSize(1);
    assertThat(result.getWarnings()).isEmpty();
    assertThat(result.isAborted()).isFalse();
  }

  @Test
  public void testUnreachableBranchOff() {
    options.setUnreachableBranchLevel(CheckLevel.OFF);
    NarrowingResult result = analyze(unreachableElseScript());
    assertThat(result.getErrors()).isEmpty();
    assertThat(result.getWarnings()).isEmpty();
  }

  private Node unreachableElseScript() {
    return IR.script(
        function(
            "f",
            IR.paramList(IR.param("s", nullable(strType))),
            IR.ifNode(
                IR.is(IR.name("s"), IR.nullNode()),
                IR.block(IR.pass()),
                IR.elif(
                    IR.isNot(IR.name("s"), IR.nullNode()),
                    IR.block(IR.pass()),
                    IR.elseNode(IR.block(IR.pass()))))));
  }

  @Test
  public void testExitingAConstructThatWasNeverEnteredFails() {
    Node ifNode = IR.ifNode(IR.trueNode(), IR.block());
    Node script = IR.script(ifNode);
    TypedScope scope = new TypedScopeCreator(registry).createScope(script, null);
    NarrowingContext context =
        new NarrowingContext(
            scope, registry, NarrowingPass.createDefaultExtractor(registry), options);
    ConditionalNarrowingCallback callback = new ConditionalNarrowingCallback(context);
    NodeTraversal t = NodeTraversal.builder().setCallback(callback).setScope(scope).build();

    NarrowingBookkeepingException e =
        assertThrows(NarrowingBookkeepingException.class, () -> callback.exitConstruct(t, ifNode));
    assertThat(e.getConstruct()).isSameInstanceAs(ifNode);
  }

  @Test
  public void testUnbalancedBodyIsDetected() {
    Node ifNode = IR.ifNode(IR.trueNode(), IR.block());
    Node script = IR.script(ifNode);
    TypedScope scope = new TypedScopeCreator(registry).createScope(script, null);
    NarrowingContext context =
        new NarrowingContext(
            scope, registry, NarrowingPass.createDefaultExtractor(registry), options);
    ConditionalNarrowingCallback callback = new ConditionalNarrowingCallback(context);
    NodeTraversal t = NodeTraversal.builder().setCallback(callback).setScope(scope).build();

    ConditionalClause clause = ConditionalClause.create(ifNode, ifNode, 0);
    callback.enterClause(t, clause);
    callback.enterClauseBody(t, clause);

    assertThrows(NarrowingBookkeepingException.class, () -> callback.exitScope(t));
  }

  @Test
  public void testResidualFrameIsDischargedWithItsBlock() {
    Node ifNode = IR.ifNode(IR.is(IR.name("s"), IR.nullNode()), IR.block(IR.returnNode()));
    Node script = IR.script(IR.var("s", nullable(strType)), ifNode);
    TypedScope scope = new TypedScopeCreator(registry).createScope(script, null);
    NarrowingContext context =
        new NarrowingContext(
            scope, registry, NarrowingPass.createDefaultExtractor(registry), options);
    ConditionalNarrowingCallback callback = new ConditionalNarrowingCallback(context);
    NodeTraversal t = NodeTraversal.builder().setCallback(callback).setScope(scope).build();

    ConditionalClause clause = ConditionalClause.create(ifNode, ifNode, 0);
    callback.enterClause(t, clause);
    callback.enterClauseBody(t, clause);
    callback.exitClauseBody(t, clause);
    callback.exitConstruct(t, ifNode);
    assertThat(context.getOutstandingResidualCount()).isEqualTo(1);
    assertThat(context.getStack().depth()).isEqualTo(1);

    callback.visit(t, script, null);
    assertThat(context.getOutstandingResidualCount()).isEqualTo(0);
    assertThat(context.getStack().depth()).isEqualTo(0);
    callback.exitScope(t);
  }

  @Test
  public void testIllegalStateChangeNamesTheElif() {
    Node ifNode = IR.ifNode(IR.trueNode(), IR.block()).setLinenoCharno(3, 0);
    IR.script(ifNode).setSourceFileName("c.jac");
    ConstructState state = new ConstructState(ifNode);
    state.transition(ConstructState.State.IN_TRUE_BRANCH);
    state.transition(ConstructState.State.IN_ELSEIF_BRANCH);
    state.transition(ConstructState.State.IN_ELSEIF_BRANCH);

    assertThat(state.toString()).isEqualTo("ConstructState{IF (c.jac:3:0), IN_ELSEIF_BRANCH(2)}");
    NarrowingBookkeepingException e =
        assertThrows(
            NarrowingBookkeepingException.class,
            () -> state.transition(ConstructState.State.IN_TRUE_BRANCH));
    assertThat(e)
        .hasMessageThat()
        .isEqualTo(
            "Illegal conditional state change IN_ELSEIF_BRANCH(2) -> IN_TRUE_BRANCH"
                + " at IF (c.jac:3:0)");
  }
}
