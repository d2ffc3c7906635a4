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

/**
 * The node kinds of a Jac syntax tree as handed over by the parser.
 */
public enum Token {
  ROOT,
  SCRIPT,
  CLASS,
  FUNCTION,
  PARAM_LIST,
  BLOCK,
  VAR,

  // Conditional construct: IF(cond, BLOCK[, ELIF | ELSE]), ELIF(cond, BLOCK[, ELIF | ELSE]),
  // ELSE(BLOCK).
  IF,
  ELIF,
  ELSE,

  WHILE,
  FOR,
  RETURN,
  RAISE,
  EXPR_RESULT,
  PASS,

  ASSIGN,
  CALL,
  GETPROP,
  NAME,
  NULL, // None
  TRUE,
  FALSE,
  NUMBER,
  STRINGLIT,

  IS,
  ISNOT, // is not
  EQ,
  NE,
  LT,
  LE,
  GT,
  GE,
  AND,
  OR,
  NOT;

  /** Whether this token may appear as the condition of a conditional clause. */
  public boolean isExpression() {
    switch (this) {
      case ASSIGN:
      case CALL:
      case GETPROP:
      case NAME:
      case NULL:
      case TRUE:
      case FALSE:
      case NUMBER:
      case STRINGLIT:
      case IS:
      case ISNOT:
      case EQ:
      case NE:
      case LT:
      case LE:
      case GT:
      case GE:
      case AND:
      case OR:
      case NOT:
        return true;
      default:
        return false;
    }
  }

  /** Whether this token may appear directly inside a block. */
  public boolean isStatement() {
    switch (this) {
      case CLASS:
      case FUNCTION:
      case BLOCK:
      case VAR:
      case IF:
      case WHILE:
      case FOR:
      case RETURN:
      case RAISE:
      case EXPR_RESULT:
      case PASS:
        return true;
      default:
        return false;
    }
  }
}
