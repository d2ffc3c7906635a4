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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

import org.jaclang.tree.Node;
import org.jspecify.annotations.Nullable;

/**
 * One clause of a conditional construct: the leading {@code if}, one of the {@code elif} clauses,
 * or the final {@code else}. The kinds are closed; callers that need to act per kind implement
 * {@link Visitor}, so a new kind fails to compile until every visitor handles it.
 *
 * <p>In the tree, a construct is {@code IF(cond, BLOCK[, next])} where {@code next} is {@code
 * ELIF(cond, BLOCK[, next])} or {@code ELSE(BLOCK)}.
 */
public abstract class ConditionalClause {

  /** Per-kind behavior for conditional clauses. */
  public interface Visitor<T> {
    T visitIf(IfClause clause);

    T visitElif(ElifClause clause);

    T visitElse(ElseClause clause);
  }

  private final Node construct;
  private final Node node;
  private final int index;

  private ConditionalClause(Node construct, Node node, int index) {
    checkArgument(construct.isIf(), construct);
    this.construct = construct;
    this.node = node;
    this.index = index;
  }

  /**
   * Creates the clause for {@code node}, the {@code index}th clause (0 for the {@code if}) of the
   * construct rooted at {@code construct}.
   */
  static ConditionalClause create(Node construct, Node node, int index) {
    switch (node.getToken()) {
      case IF:
        checkState(node == construct && index == 0, node);
        return new IfClause(node);
      case ELIF:
        checkState(index > 0, node);
        return new ElifClause(construct, node, index);
      case ELSE:
        checkState(index > 0, node);
        return new ElseClause(construct, node, index);
      default:
        throw new IllegalArgumentException("Not a conditional clause: " + node);
    }
  }

  public abstract <T> T accept(Visitor<T> visitor);

  /** The IF node of the construct this clause belongs to. */
  public final Node getConstruct() {
    return construct;
  }

  /** The IF, ELIF or ELSE node of this clause. */
  public final Node getNode() {
    return node;
  }

  /** Position of this clause in the construct, 0 for the {@code if}. */
  public final int getIndex() {
    return index;
  }

  /** The guard of this clause, or null for an {@code else}. */
  public abstract @Nullable Node getCondition();

  public abstract Node getBody();

  /** The ELIF or ELSE node following this clause, if any. */
  public @Nullable Node getNextClause() {
    return null;
  }

  public final boolean isLast() {
    return getNextClause() == null;
  }

  @Override
  public String toString() {
    return node.getToken()
        + "#"
        + index
        + " of "
        + NarrowingBookkeepingException.describe(construct);
  }

  /** The leading {@code if cond:} clause. */
  public static final class IfClause extends ConditionalClause {
    private IfClause(Node ifNode) {
      super(ifNode, ifNode, 0);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitIf(this);
    }

    @Override
    public Node getCondition() {
      return getNode().getFirstChild();
    }

    @Override
    public Node getBody() {
      return getNode().getSecondChild();
    }

    @Override
    public @Nullable Node getNextClause() {
      return getBody().getNext();
    }
  }

  /** An {@code elif cond:} clause. */
  public static final class ElifClause extends ConditionalClause {
    private ElifClause(Node construct, Node elifNode, int index) {
      super(construct, elifNode, index);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitElif(this);
    }

    @Override
    public Node getCondition() {
      return getNode().getFirstChild();
    }

    @Override
    public Node getBody() {
      return getNode().getSecondChild();
    }

    @Override
    public @Nullable Node getNextClause() {
      return getBody().getNext();
    }
  }

  /** The final {@code else:} clause. */
  public static final class ElseClause extends ConditionalClause {
    private ElseClause(Node construct, Node elseNode, int index) {
      super(construct, elseNode, index);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
      return visitor.visitElse(this);
    }

    @Override
    public @Nullable Node getCondition() {
      return null;
    }

    @Override
    public Node getBody() {
      return getNode().getOnlyChild();
    }
  }
}
