/*
 * Copyright 2026 The Closure Compiler Authors.
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

package org.purescript.pcc.codegen;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import org.purescript.pcc.env.ModuleName;

/**
 * Converts source identifiers into valid C++ identifiers:
 *
 * <ul>
 *   <li>Alphanumeric characters are kept unmodified.
 *   <li>Reserved C++ identifiers get a {@code "__"} suffix.
 *   <li>Symbols are replaced by a readable name followed by {@code "_"}, or by their code point
 *       followed by {@code "__"} when they have no name.
 * </ul>
 *
 * <p>The mapping is not injective: {@code a'symbol'} and {@code a_} both become {@code a_symbol_},
 * and the euro sign and {@code 8364''} both become {@code 8364__}. Such collisions are accepted.
 */
public final class NameMangler {

  /** Appended to reserved words. */
  static final String RESERVED_SUFFIX = "__";

  private static final ImmutableMap<Character, String> SYMBOL_NAMES =
      ImmutableMap.<Character, String>builder()
          .put('_', "_symbol_")
          .put('.', "dot_symbol_")
          .put('$', "dollar_symbol_")
          .put('~', "tilde_symbol_")
          .put('=', "eq_symbol_")
          .put('<', "less_symbol_")
          .put('>', "greater_symbol_")
          .put('!', "bang_symbol_")
          .put('#', "hash_symbol_")
          .put('%', "percent_symbol_")
          .put('^', "up_symbol_")
          .put('&', "amp_symbol_")
          .put('|', "bar_symbol_")
          .put('*', "times_symbol_")
          .put('/', "div_symbol_")
          .put('+', "plus_symbol_")
          .put('-', "minus_symbol_")
          .put(':', "colon_symbol_")
          .put('\\', "bslash_symbol_")
          .put('?', "qmark_symbol_")
          .put('@', "at_symbol_")
          .buildOrThrow();

  // C++17 keywords and alternative tokens, then globals the runtime or the C library claims.
  private static final ImmutableSet<String> RESERVED_NAMES =
      ImmutableSet.of(
          "alignas", "alignof", "and", "and_eq", "asm", "auto", "bitand", "bitor", "bool",
          "break", "case", "catch", "char", "char16_t", "char32_t", "class", "compl", "const",
          "constexpr", "const_cast", "continue", "decltype", "default", "delete", "do", "double",
          "dynamic_cast", "else", "enum", "explicit", "export", "extern", "false", "float", "for",
          "friend", "goto", "if", "inline", "int", "long", "mutable", "namespace", "new",
          "noexcept", "not", "not_eq", "nullptr", "operator", "or", "or_eq", "private",
          "protected", "public", "register", "reinterpret_cast", "return", "short", "signed",
          "sizeof", "static", "static_assert", "static_cast", "struct", "switch", "template",
          "this", "thread_local", "throw", "true", "try", "typedef", "typeid", "typename",
          "union", "unsigned", "using", "virtual", "void", "volatile", "wchar_t", "while", "xor",
          "xor_eq",
          "assert", "cast", "errno", "main", "managed", "NULL", "stdin", "stdout", "stderr",
          "EOF", "std", "PureScript");

  private NameMangler() {}

  /** Converts an identifier into a valid C++ identifier. */
  public static String mangle(String name) {
    if (isReserved(name)) {
      return name + RESERVED_SUFFIX;
    }
    return escapeCharacters(name);
  }

  /** Converts a symbolic operator name, such as {@code <>}, into a valid C++ identifier. */
  public static String mangleOperator(String op) {
    return escapeCharacters(op);
  }

  /** Whether {@code name} is changed by {@link #mangle}, i.e. is not already a safe identifier. */
  public static boolean needsEscaping(String name) {
    return !name.equals(mangle(name));
  }

  /** Whether {@code name} is a C++ keyword or a global name generated code must not shadow. */
  public static boolean isReserved(String name) {
    return RESERVED_NAMES.contains(name);
  }

  /** The C++ namespace name for a module: its segments joined with underscores. */
  public static String moduleNameToCpp(ModuleName moduleName) {
    return Joiner.on('_').join(moduleName.getSegments());
  }

  /** Returns the text that replaces one code point of a source identifier. */
  static String escapeCodePoint(int codePoint) {
    if (Character.isLetterOrDigit(codePoint)) {
      return new String(Character.toChars(codePoint));
    }
    if (codePoint == '\'') {
      return "_";
    }
    if (Character.isBmpCodePoint(codePoint)) {
      String symbolName = SYMBOL_NAMES.get((char) codePoint);
      if (symbolName != null) {
        return symbolName;
      }
    }
    return codePoint + "__";
  }

  private static String escapeCharacters(String name) {
    StringBuilder sb = new StringBuilder(name.length() + 8);
    name.codePoints().forEach(codePoint -> sb.append(escapeCodePoint(codePoint)));
    return sb.toString();
  }

  /** The reserved words, for tests. */
  static ImmutableSet<String> reservedNames() {
    return RESERVED_NAMES;
  }

  /** The characters that have a readable replacement, for tests. */
  static ImmutableSet<Character> namedSymbols() {
    return SYMBOL_NAMES.keySet();
  }
}
