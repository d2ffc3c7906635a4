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

import com.google.common.collect.ImmutableList;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.jaclang.checker.ConditionalClause.ElifClause;
import org.jaclang.checker.ConditionalClause.ElseClause;
import org.jaclang.checker.ConditionalClause.IfClause;
import org.jaclang.checker.ConstructState.State;
import org.jaclang.tree.Node;
import org.jaclang.tree.types.JacType;
import org.jspecify.annotations.Nullable;

/**
 * Drives narrowing through the conditional constructs of one body. On entering a guarded clause
 * it pushes the types its guard proves, on leaving it pops them, and before an {@code elif} or
 * {@code else} it pushes the types proven by every earlier guard having failed. Every name
 * reference in between is resolved through the stack.
 *
 * <p>When the clauses of a construct without {@code else} all end in {@code return} or {@code
 * raise}, the failed-guard types stay in effect for the rest of the block holding the construct.
 */
final class ConditionalNarrowingCallback
    implements NodeTraversal.ScopedCallback, NodeTraversal.ConditionalCallback {

  private static final Logger logger =
      Logger.getLogger(ConditionalNarrowingCallback.class.getName());

  static final DiagnosticType JAC_UNREACHABLE_BRANCH =
      DiagnosticType.warning(
          "JAC_UNREACHABLE_BRANCH",
          "This {0} branch is unreachable: no type is left for ''{1}'' after the earlier"
              + " conditions");

  private final NarrowingContext context;

  private final ConditionalClause.Visitor<Void> enterClauseVisitor = new EnterClauseVisitor();
  private final ConditionalClause.Visitor<Void> enterBodyVisitor = new EnterBodyVisitor();
  private final ConditionalClause.Visitor<Void> exitBodyVisitor = new ExitBodyVisitor();

  private @Nullable NodeTraversal traversal;

  ConditionalNarrowingCallback(NarrowingContext context) {
    this.context = context;
  }

  @Override
  public void enterScope(NodeTraversal t) {
    if (logger.isLoggable(Level.FINE)) {
      logger.fine("Narrowing " + NarrowingBookkeepingException.describe(t.getScopeRoot()));
    }
  }

  @Override
  public void exitScope(NodeTraversal t) {
    context.finish();
  }

  @Override
  public boolean shouldTraverse(NodeTraversal t, Node n, @Nullable Node parent) {
    // Nested functions and classes are bodies of their own.
    return !(n.isFunction() || n.isClass()) || n == t.getScopeRoot();
  }

  @Override
  public void visit(NodeTraversal t, Node n, @Nullable Node parent) {
    switch (n.getToken()) {
      case NAME:
        if (NodeUtil.isReferenceName(n) && context.getResolver().isDeclared(n.getString())) {
          context.recordType(n, context.getResolver().resolve(n));
        }
        break;
      case BLOCK:
      case SCRIPT:
        context.dischargeResiduals(n);
        break;
      default:
        break;
    }
  }

  @Override
  public void enterClause(NodeTraversal t, ConditionalClause clause) {
    visitClause(t, clause, enterClauseVisitor);
  }

  @Override
  public void enterClauseBody(NodeTraversal t, ConditionalClause clause) {
    visitClause(t, clause, enterBodyVisitor);
  }

  @Override
  public void exitClauseBody(NodeTraversal t, ConditionalClause clause) {
    visitClause(t, clause, exitBodyVisitor);
  }

  @Override
  public void exitConstruct(NodeTraversal t, Node construct) {
    ConstructState state = context.getConstructState(construct);
    state.transition(State.AFTER);
    context.exitConstruct(construct);

    Map<String, JacType> falseTypes = state.getCumulativeFalseTypes();
    Node owner = construct.getParent();
    if (context.getOptions().isEarlyExitPropagation()
        && !state.hasElse()
        && state.everyClauseExits()
        && !falseTypes.isEmpty()
        && owner != null) {
      context.pushResidual(
          owner, new NarrowingFrame(NarrowingFrame.Kind.RESIDUAL, construct, falseTypes));
    }
  }

  private void visitClause(
      NodeTraversal t, ConditionalClause clause, ConditionalClause.Visitor<Void> visitor) {
    traversal = t;
    try {
      clause.accept(visitor);
    } finally {
      traversal = null;
    }
  }

  private ImmutableList<NarrowingPredicate> extractPredicates(Node condition) {
    return context.getExtractor().extractPredicates(condition, context.getResolver());
  }

  private void push(ConstructState state, NarrowingFrame frame) {
    context.getStack().push(frame);
    state.setActiveFrame(frame);
  }

  private void popActiveFrame(ConstructState state) {
    context.getStack().pop(state.takeActiveFrame());
  }

  /** Reports the clause of {@code frame} if the frame leaves some symbol with no type at all. */
  private void checkReachable(ConditionalClause clause, NarrowingFrame frame) {
    for (Map.Entry<String, JacType> entry : frame.getTypes().entrySet()) {
      if (entry.getValue().isNoType()) {
        traversal.report(
            context.getOptions().getUnreachableBranchLevel(),
            clause.getNode(),
            JAC_UNREACHABLE_BRANCH,
            clause.getNode().isElse() ? "else" : "elif",
            entry.getKey());
        return;
      }
    }
  }

  /** Runs before the condition of a clause is traversed. */
  private final class EnterClauseVisitor implements ConditionalClause.Visitor<Void> {
    @Override
    public Void visitIf(IfClause clause) {
      context.enterConstruct(clause.getConstruct());
      return null;
    }

    @Override
    public Void visitElif(ElifClause clause) {
      ConstructState state = context.getConstructState(clause.getConstruct());
      state.transition(State.IN_ELSEIF_BRANCH);
      NarrowingFrame frame =
          new NarrowingFrame(
              NarrowingFrame.Kind.ELIF_CONDITION,
              clause.getNode(),
              state.getCumulativeFalseTypes());
      push(state, frame);
      checkReachable(clause, frame);
      return null;
    }

    @Override
    public Void visitElse(ElseClause clause) {
      ConstructState state = context.getConstructState(clause.getConstruct());
      state.transition(State.IN_ELSE_BRANCH);
      NarrowingFrame frame =
          new NarrowingFrame(
              NarrowingFrame.Kind.ELSE_BRANCH, clause.getNode(), state.getCumulativeFalseTypes());
      push(state, frame);
      checkReachable(clause, frame);
      return null;
    }
  }

  /** Runs after the condition of a clause is traversed, before its body. */
  private final class EnterBodyVisitor implements ConditionalClause.Visitor<Void> {
    @Override
    public Void visitIf(IfClause clause) {
      ConstructState state = context.getConstructState(clause.getConstruct());
      ImmutableList<NarrowingPredicate> predicates = extractPredicates(clause.getCondition());
      state.transition(State.IN_TRUE_BRANCH);
      push(state, NarrowingFrame.ofTrueTypes(clause.getNode(), predicates));
      state.addClausePredicates(predicates);
      return null;
    }

    @Override
    public Void visitElif(ElifClause clause) {
      ConstructState state = context.getConstructState(clause.getConstruct());
      // The condition frame is still on the stack, so the guard is read against the types left
      // by every earlier guard failing.
      ImmutableList<NarrowingPredicate> predicates = extractPredicates(clause.getCondition());
      popActiveFrame(state);
      push(
          state,
          NarrowingFrame.ofTrueTypes(
              clause.getNode(), state.getCumulativeFalseTypes(), predicates));
      state.addClausePredicates(predicates);
      return null;
    }

    @Override
    public Void visitElse(ElseClause clause) {
      return null;
    }
  }

  /** Runs after the body of a clause is traversed. */
  private final class ExitBodyVisitor implements ConditionalClause.Visitor<Void> {
    @Override
    public Void visitIf(IfClause clause) {
      exitGuardedBody(clause);
      return null;
    }

    @Override
    public Void visitElif(ElifClause clause) {
      exitGuardedBody(clause);
      return null;
    }

    @Override
    public Void visitElse(ElseClause clause) {
      popActiveFrame(context.getConstructState(clause.getConstruct()));
      return null;
    }

    private void exitGuardedBody(ConditionalClause clause) {
      ConstructState state = context.getConstructState(clause.getConstruct());
      popActiveFrame(state);
      if (!NodeUtil.endsWithAbnormalExit(clause.getBody())) {
        state.markFallsThrough();
      }
    }
  }
}
