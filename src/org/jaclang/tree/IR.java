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

package org.jaclang.tree;

import static com.google.common.base.Preconditions.checkState;

import java.util.List;
import org.jaclang.tree.types.JacType;

/**
 * An AST construction helper class
 */
public class IR {

  private IR() {}

  public static Node script(Node... stmts) {
    Node script = new Node(Token.SCRIPT);
    for (Node stmt : stmts) {
      checkState(mayBeStatement(stmt), "Script cannot contain %s", stmt.getToken());
      script.addChildToBack(stmt);
    }
    return script;
  }

  public static Node classNode(String name, Node... members) {
    Node cls = Node.newString(Token.CLASS, name);
    for (Node member : members) {
      checkState(member.isFunction() || member.isVar(), member);
      cls.addChildToBack(member);
    }
    return cls;
  }

  public static Node function(String name, Node params, Node body) {
    checkState(params.isParamList());
    checkState(body.isBlock());
    return new Node(Token.FUNCTION, name(name), params, body);
  }

  public static Node paramList(Node... params) {
    Node paramList = new Node(Token.PARAM_LIST);
    for (Node param : params) {
      checkState(param.isName());
      paramList.addChildToBack(param);
    }
    return paramList;
  }

  /** A parameter with a declared type annotation. */
  public static Node param(String name, JacType type) {
    return name(name).setDeclaredType(type);
  }

  public static Node block(Node... stmts) {
    Node block = new Node(Token.BLOCK);
    for (Node stmt : stmts) {
      checkState(mayBeStatement(stmt), "Block node cannot contain %s", stmt.getToken());
      block.addChildToBack(stmt);
    }
    return block;
  }

  public static Node block(List<Node> stmts) {
    return block(stmts.toArray(new Node[0]));
  }

  /** A variable declaration {@code name: type} with no initial value. */
  public static Node var(String name, JacType type) {
    return new Node(Token.VAR, param(name, type));
  }

  /** A variable declaration {@code name: type = value}. */
  public static Node var(String name, JacType type, Node value) {
    checkState(mayBeExpression(value));
    Node nameNode = param(name, type);
    nameNode.addChildToBack(value);
    return new Node(Token.VAR, nameNode);
  }

  public static Node ifNode(Node cond, Node then) {
    checkState(mayBeExpression(cond));
    checkState(then.isBlock());
    return new Node(Token.IF, cond, then);
  }

  /**
   * Creates {@code if cond: then} followed by an {@code elif} chain or an {@code else} clause.
   */
  public static Node ifNode(Node cond, Node then, Node nextClause) {
    checkState(mayBeExpression(cond));
    checkState(then.isBlock());
    checkState(nextClause.isElif() || nextClause.isElse(), nextClause);
    return new Node(Token.IF, cond, then, nextClause);
  }

  public static Node elif(Node cond, Node then) {
    checkState(mayBeExpression(cond));
    checkState(then.isBlock());
    return new Node(Token.ELIF, cond, then);
  }

  public static Node elif(Node cond, Node then, Node nextClause) {
    checkState(mayBeExpression(cond));
    checkState(then.isBlock());
    checkState(nextClause.isElif() || nextClause.isElse(), nextClause);
    return new Node(Token.ELIF, cond, then, nextClause);
  }

  public static Node elseNode(Node body) {
    checkState(body.isBlock());
    return new Node(Token.ELSE, body);
  }

  public static Node whileNode(Node cond, Node body) {
    checkState(mayBeExpression(cond));
    checkState(body.isBlock());
    return new Node(Token.WHILE, cond, body);
  }

  public static Node returnNode() {
    return new Node(Token.RETURN);
  }

  public static Node returnNode(Node expr) {
    checkState(mayBeExpression(expr));
    return new Node(Token.RETURN, expr);
  }

  public static Node raise(Node expr) {
    checkState(mayBeExpression(expr));
    return new Node(Token.RAISE, expr);
  }

  public static Node exprResult(Node expr) {
    checkState(mayBeExpression(expr), expr);
    return new Node(Token.EXPR_RESULT, expr);
  }

  public static Node pass() {
    return new Node(Token.PASS);
  }

  public static Node assign(Node target, Node expr) {
    checkState(target.isName() || target.getToken() == Token.GETPROP, target);
    checkState(mayBeExpression(expr));
    return new Node(Token.ASSIGN, target, expr);
  }

  public static Node call(Node target, Node... args) {
    Node call = new Node(Token.CALL, target);
    for (Node arg : args) {
      checkState(mayBeExpression(arg), arg);
      call.addChildToBack(arg);
    }
    return call;
  }

  /** Shorthand for {@code isinstance(name, typeName)}. */
  public static Node isinstance(Node value, String typeName) {
    return call(name("isinstance"), value, name(typeName));
  }

  public static Node getprop(Node target, String prop) {
    checkState(mayBeExpression(target));
    Node n = Node.newString(Token.GETPROP, prop);
    n.addChildToBack(target);
    return n;
  }

  public static Node name(String name) {
    return Node.newString(Token.NAME, name);
  }

  public static Node nullNode() {
    return new Node(Token.NULL);
  }

  public static Node trueNode() {
    return new Node(Token.TRUE);
  }

  public static Node falseNode() {
    return new Node(Token.FALSE);
  }

  public static Node number(double d) {
    return Node.newNumber(d);
  }

  public static Node string(String s) {
    return Node.newString(s);
  }

  public static Node is(Node expr1, Node expr2) {
    return binaryOp(Token.IS, expr1, expr2);
  }

  public static Node isNot(Node expr1, Node expr2) {
    return binaryOp(Token.ISNOT, expr1, expr2);
  }

  public static Node eq(Node expr1, Node expr2) {
    return binaryOp(Token.EQ, expr1, expr2);
  }

  public static Node ne(Node expr1, Node expr2) {
    return binaryOp(Token.NE, expr1, expr2);
  }

  public static Node lt(Node expr1, Node expr2) {
    return binaryOp(Token.LT, expr1, expr2);
  }

  public static Node and(Node expr1, Node expr2) {
    return binaryOp(Token.AND, expr1, expr2);
  }

  public static Node or(Node expr1, Node expr2) {
    return binaryOp(Token.OR, expr1, expr2);
  }

  public static Node not(Node expr) {
    checkState(mayBeExpression(expr));
    return new Node(Token.NOT, expr);
  }

  private static Node binaryOp(Token token, Node expr1, Node expr2) {
    checkState(mayBeExpression(expr1), expr1);
    checkState(mayBeExpression(expr2), expr2);
    return new Node(token, expr1, expr2);
  }

  static boolean mayBeStatement(Node n) {
    return n.getToken().isStatement();
  }

  static boolean mayBeExpression(Node n) {
    return n.getToken().isExpression();
  }
}
