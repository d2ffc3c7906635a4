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

import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import org.jaclang.tree.types.TypeRegistry;
import org.jspecify.annotations.Nullable;

/**
 * Reads a syntax tree that the Jac parser serialized to JSON. Each node is an object:
 *
 * <pre>
 * {"token": "NAME", "string": "x", "type": "str | None", "line": 3, "column": 4, "children": []}
 * </pre>
 *
 * <p>Only {@code token} is required. {@code string} is the identifier of NAME, CLASS and GETPROP
 * nodes and the value of STRINGLIT nodes; {@code number} the value of NUMBER nodes; {@code type}
 * the declared type annotation of a parameter or variable name. The root object may carry a
 * {@code source} file name. Declared class names are registered in the type registry.
 */
public class JsonTreeReader {

  private final TypeRegistry typeRegistry;

  public JsonTreeReader(TypeRegistry typeRegistry) {
    this.typeRegistry = typeRegistry;
  }

  /**
   * Parses a tree.
   *
   * @param contents the JSON text
   * @param sourceName the file name to attribute the nodes to, unless the root names its own
   */
  public Node parse(String contents, @Nullable String sourceName) throws TreeParseException {
    JsonObject root;
    try {
      root = new Gson().fromJson(contents, JsonObject.class);
    } catch (JsonParseException ex) {
      throw new TreeParseException("JSON parse exception: " + ex.getMessage(), ex);
    }
    if (root == null) {
      throw new TreeParseException("Empty tree");
    }
    Node tree = readNode(root);
    String declaredSource = getStringOrNull(root, "source");
    tree.setSourceFileName(declaredSource != null ? declaredSource : sourceName);
    return tree;
  }

  private Node readNode(JsonObject object) throws TreeParseException {
    Token token = readToken(object);
    Node n;
    String string = getStringOrNull(object, "string");
    if (token == Token.NUMBER) {
      n = Node.newNumber(getNumber(object));
    } else if (string != null) {
      n = Node.newString(token, string);
    } else {
      n = new Node(token);
    }
    if (token == Token.CLASS) {
      if (string == null) {
        throw new TreeParseException("CLASS node without a name");
      }
      typeRegistry.createClassType(string);
    }

    String type = getStringOrNull(object, "type");
    if (type != null) {
      try {
        n.setDeclaredType(typeRegistry.parseTypeString(type));
      } catch (IllegalArgumentException e) {
        throw new TreeParseException("Bad type annotation '" + type + "'", e);
      }
    }
    if (object.has("line")) {
      int column = object.has("column") ? getInt(object, "column") : -1;
      n.setLinenoCharno(getInt(object, "line"), column);
    }

    if (object.has("children")) {
      for (JsonElement child : getChildren(object)) {
        if (!child.isJsonObject()) {
          throw new TreeParseException("Child of " + token + " is not an object: " + child);
        }
        n.addChildToBack(readNode(child.getAsJsonObject()));
      }
    }
    checkShape(n);
    return n;
  }

  private static Token readToken(JsonObject object) throws TreeParseException {
    String name = getStringOrNull(object, "token");
    if (name == null) {
      throw new TreeParseException("Node without a token: " + object);
    }
    try {
      return Token.valueOf(name);
    } catch (IllegalArgumentException e) {
      throw new TreeParseException("Unknown token " + name, e);
    }
  }

  private static double getNumber(JsonObject object) throws TreeParseException {
    if (!object.has("number")) {
      throw new TreeParseException("NUMBER node without a value");
    }
    try {
      return object.get("number").getAsDouble();
    } catch (IllegalStateException | UnsupportedOperationException | NumberFormatException e) {
      throw badField(object, "number", e);
    }
  }

  private static int getInt(JsonObject object, String key) throws TreeParseException {
    try {
      return object.get(key).getAsInt();
    } catch (IllegalStateException | UnsupportedOperationException | NumberFormatException e) {
      throw badField(object, key, e);
    }
  }

  private static JsonArray getChildren(JsonObject object) throws TreeParseException {
    JsonElement children = object.get("children");
    if (!children.isJsonArray()) {
      throw new TreeParseException("'children' is not an array: " + children);
    }
    return children.getAsJsonArray();
  }

  private static TreeParseException badField(JsonObject object, String key, RuntimeException e) {
    return new TreeParseException("Bad '" + key + "' field: " + object.get(key), e);
  }

  /** Checks the shapes that narrowing relies on. */
  private static void checkShape(Node n) throws TreeParseException {
    switch (n.getToken()) {
      case IF:
      case ELIF:
        int count = n.getChildCount();
        if (count < 2 || count > 3 || !n.getSecondChild().isBlock()) {
          throw new TreeParseException(n.getToken() + " must be (condition, BLOCK[, ELIF|ELSE])");
        }
        if (count == 3 && !(n.getLastChild().isElif() || n.getLastChild().isElse())) {
          throw new TreeParseException(
              n.getToken() + " followed by " + n.getLastChild().getToken());
        }
        if (!n.getFirstChild().getToken().isExpression()) {
          throw new TreeParseException(
              n.getToken() + " condition is a " + n.getFirstChild().getToken());
        }
        break;
      case SCRIPT:
      case BLOCK:
        for (Node stmt : n.children()) {
          if (!stmt.getToken().isStatement()) {
            throw new TreeParseException(n.getToken() + " holds " + stmt.getToken());
          }
        }
        break;
      case ELSE:
        if (!n.hasOneChild() || !n.getFirstChild().isBlock()) {
          throw new TreeParseException("ELSE must hold exactly one BLOCK");
        }
        break;
      case FUNCTION:
        if (n.getChildCount() != 3
            || !n.getFirstChild().isName()
            || !n.getSecondChild().isParamList()
            || !n.getLastChild().isBlock()) {
          throw new TreeParseException("FUNCTION must be (NAME, PARAM_LIST, BLOCK)");
        }
        break;
      case VAR:
        if (!n.hasOneChild() || !n.getFirstChild().isName()) {
          throw new TreeParseException("VAR must hold exactly one NAME");
        }
        break;
      case PARAM_LIST:
        for (Node param : n.children()) {
          if (!param.isName()) {
            throw new TreeParseException("PARAM_LIST holds " + param.getToken());
          }
        }
        break;
      case NOT:
      case GETPROP:
        if (!n.hasOneChild()) {
          throw new TreeParseException(n.getToken() + " must have exactly one operand");
        }
        break;
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
      case ASSIGN:
        if (n.getChildCount() != 2) {
          throw new TreeParseException(n.getToken() + " must have exactly two operands");
        }
        break;
      case CALL:
        if (!n.hasChildren()) {
          throw new TreeParseException("CALL without a callee");
        }
        break;
      default:
        break;
    }
    switch (n.getToken()) {
      case NAME:
      case CLASS:
      case GETPROP:
      case STRINGLIT:
        if (!n.hasStringValue()) {
          throw new TreeParseException(n.getToken() + " node without a string");
        }
        break;
      default:
        break;
    }
  }

  private static @Nullable String getStringOrNull(JsonObject object, String key)
      throws TreeParseException {
    if (!object.has(key)) {
      return null;
    }
    JsonElement value = object.get(key);
    if (!value.isJsonPrimitive() || !value.getAsJsonPrimitive().isString()) {
      throw new TreeParseException("Bad '" + key + "' field: " + value);
    }
    return value.getAsString();
  }
}
