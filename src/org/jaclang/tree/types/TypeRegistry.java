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

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.Arrays;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.jspecify.annotations.Nullable;

/**
 * The type registry is used to resolve named types and to construct unions. Once populated it is
 * safe to share between threads analyzing different function bodies.
 */
public class TypeRegistry {

  private static final Splitter UNION_SPLITTER = Splitter.on('|').trimResults().omitEmptyStrings();

  private final NullType nullType = new NullType();
  private final UnknownType unknownType = new UnknownType();
  private final NoType noType = new NoType();

  private final Map<JacTypeNative, JacType> nativeTypes = new EnumMap<>(JacTypeNative.class);

  /** Class types by reference name. */
  private final Map<String, ClassType> namesToTypes = new ConcurrentHashMap<>();

  public TypeRegistry() {
    nativeTypes.put(JacTypeNative.NULL_TYPE, nullType);
    nativeTypes.put(JacTypeNative.UNKNOWN_TYPE, unknownType);
    nativeTypes.put(JacTypeNative.NO_TYPE, noType);
    nativeTypes.put(JacTypeNative.OBJECT_TYPE, createClassType("object"));
    nativeTypes.put(JacTypeNative.BOOL_TYPE, createClassType("bool"));
    nativeTypes.put(JacTypeNative.INT_TYPE, createClassType("int"));
    nativeTypes.put(JacTypeNative.FLOAT_TYPE, createClassType("float"));
    nativeTypes.put(JacTypeNative.STRING_TYPE, createClassType("str"));
    nativeTypes.put(JacTypeNative.BYTES_TYPE, createClassType("bytes"));
  }

  public JacType getNativeType(JacTypeNative typeId) {
    return nativeTypes.get(typeId);
  }

  /** Returns the class type registered under {@code name}, or null if there is none. */
  public @Nullable ClassType getType(String name) {
    return namesToTypes.get(name);
  }

  /** Returns the class type named {@code name}, registering it on first use. */
  public ClassType createClassType(String name) {
    return namesToTypes.computeIfAbsent(name, ClassType::new);
  }

  public JacType createNullableType(JacType type) {
    return createUnionType(type, nullType);
  }

  /**
   * Creates a union type whose variants are the arguments.
   *
   * @see #createUnionType(Collection)
   */
  public JacType createUnionType(JacType... variants) {
    return createUnionType(Arrays.asList(variants));
  }

  /**
   * Creates the union of {@code variants}. Nested unions are flattened, duplicates and the empty
   * type are dropped, and the unknown type absorbs everything else. A single remaining variant is
   * returned as is; no variants at all yields the empty type.
   */
  public JacType createUnionType(Collection<? extends JacType> variants) {
    Set<JacType> alternates = new LinkedHashSet<>();
    for (JacType variant : variants) {
      UnionType union = variant.toMaybeUnionType();
      if (union != null) {
        alternates.addAll(union.getAlternates());
      } else if (variant.isUnknownType()) {
        return unknownType;
      } else if (!variant.isNoType()) {
        alternates.add(variant);
      }
    }
    switch (alternates.size()) {
      case 0:
        return noType;
      case 1:
        return alternates.iterator().next();
      default:
        return new UnionType(ImmutableSet.copyOf(alternates));
    }
  }

  /**
   * Parses a type as written in an annotation: {@code None}, {@code ?} (unknown), {@code Never},
   * a class name, or a {@code |}-separated union of those. Class names are registered on first
   * use.
   */
  public JacType parseTypeString(String typeString) {
    ImmutableList<String> parts = ImmutableList.copyOf(UNION_SPLITTER.split(typeString));
    checkArgument(!parts.isEmpty(), "Empty type annotation");
    ImmutableList.Builder<JacType> variants = ImmutableList.builder();
    for (String part : parts) {
      switch (part) {
        case "None":
          variants.add(nullType);
          break;
        case "?":
          variants.add(unknownType);
          break;
        case "Never":
          variants.add(noType);
          break;
        default:
          checkArgument(isIdentifier(part), "Not a type name: %s", part);
          variants.add(createClassType(part));
      }
    }
    return createUnionType(variants.build());
  }

  private static boolean isIdentifier(String s) {
    if (!Character.isJavaIdentifierStart(s.charAt(0))) {
      return false;
    }
    for (int i = 1; i < s.length(); i++) {
      char c = s.charAt(i);
      if (!Character.isJavaIdentifierPart(c) && c != '.') {
        return false;
      }
    }
    return true;
  }
}
