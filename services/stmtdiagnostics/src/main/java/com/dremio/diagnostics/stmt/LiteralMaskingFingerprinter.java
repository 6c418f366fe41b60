/*
 * Copyright (C) 2017-2019 Dremio Corporation
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
package com.dremio.diagnostics.stmt;

import com.google.common.base.CharMatcher;

/**
 * Replaces numeric and string literals with {@code _} and rewrites the spacing between tokens
 * into one canonical form, keeping keywords, identifiers and quoted identifiers as they are.
 *
 * <p>{@code SELECT * FROM t WHERE x = 5} and {@code SELECT * FROM t WHERE x=5} both become {@code
 * SELECT * FROM t WHERE x = _}. Operators are surrounded by one space, a comma is followed by one,
 * and no space is kept inside parentheses or around a qualifying dot. Whether an opening
 * parenthesis directly follows a word is kept, so {@code count(x)} and {@code IN (1)} keep their
 * shape.
 */
public class LiteralMaskingFingerprinter implements StatementFingerprinter {

  static final char PLACEHOLDER = '_';

  private static final char STRING_QUOTE = '\'';
  private static final char IDENTIFIER_QUOTE = '"';

  private static final CharMatcher DIGIT = CharMatcher.inRange('0', '9').precomputed();
  private static final CharMatcher NUMBER_PART =
      CharMatcher.inRange('0', '9').or(CharMatcher.anyOf(".eE")).precomputed();
  private static final CharMatcher WHITESPACE = CharMatcher.whitespace();
  private static final CharMatcher COMPARISON = CharMatcher.anyOf("<>=!|:").precomputed();
  private static final CharMatcher ARITHMETIC = CharMatcher.anyOf("+-*/%").precomputed();
  private static final CharMatcher OPEN = CharMatcher.anyOf("([").precomputed();
  private static final CharMatcher CLOSE = CharMatcher.anyOf(")]").precomputed();
  private static final CharMatcher WORD_PART =
      WHITESPACE
          .or(COMPARISON)
          .or(ARITHMETIC)
          .or(OPEN)
          .or(CLOSE)
          .or(CharMatcher.anyOf(",;.'\""))
          .negate()
          .precomputed();

  private enum Kind {
    WORD,
    OPERATOR,
    OPEN,
    CLOSE,
    COMMA,
    DOT,
    SEMICOLON
  }

  @Override
  public String fingerprint(String statement) {
    final Writer out = new Writer(statement.length());
    int i = 0;
    while (i < statement.length()) {
      final char c = statement.charAt(i);
      final int next;
      if (WHITESPACE.matches(c)) {
        next = skip(statement, i, WHITESPACE);
        out.spaced = true;
      } else if (c == STRING_QUOTE) {
        next = endOfQuoted(statement, i, STRING_QUOTE);
        out.append(Kind.WORD, String.valueOf(PLACEHOLDER));
      } else if (c == IDENTIFIER_QUOTE) {
        next = endOfQuoted(statement, i, IDENTIFIER_QUOTE);
        out.append(Kind.WORD, statement.substring(i, next));
      } else if (DIGIT.matches(c)) {
        next = skip(statement, i, NUMBER_PART);
        out.append(Kind.WORD, String.valueOf(PLACEHOLDER));
      } else if (WORD_PART.matches(c)) {
        next = skip(statement, i, WORD_PART);
        out.append(Kind.WORD, statement.substring(i, next));
      } else if (COMPARISON.matches(c)) {
        next = skip(statement, i, COMPARISON);
        out.append(Kind.OPERATOR, statement.substring(i, next));
      } else {
        next = i + 1;
        out.append(kindOf(c), String.valueOf(c));
      }
      i = next;
    }
    return out.toString();
  }

  private static Kind kindOf(char c) {
    if (ARITHMETIC.matches(c)) {
      return Kind.OPERATOR;
    } else if (OPEN.matches(c)) {
      return Kind.OPEN;
    } else if (CLOSE.matches(c)) {
      return Kind.CLOSE;
    } else if (c == ',') {
      return Kind.COMMA;
    } else if (c == ';') {
      return Kind.SEMICOLON;
    }
    return Kind.DOT;
  }

  private static int skip(String text, int start, CharMatcher matcher) {
    int i = start;
    while (i < text.length() && matcher.matches(text.charAt(i))) {
      i++;
    }
    return i;
  }

  /** Index just past the closing quote; a doubled quote is an escaped one. */
  private static int endOfQuoted(String text, int start, char quote) {
    int i = start + 1;
    while (i < text.length()) {
      if (text.charAt(i) == quote) {
        if (i + 1 < text.length() && text.charAt(i + 1) == quote) {
          i += 2;
          continue;
        }
        return i + 1;
      }
      i++;
    }
    // unterminated, runs to the end of the statement
    return i;
  }

  /** Joins tokens with canonical spacing. */
  private static final class Writer {
    private final StringBuilder sb;
    private Kind previous;
    // whitespace seen since the previous token
    private boolean spaced;

    private Writer(int capacity) {
      this.sb = new StringBuilder(capacity);
    }

    private void append(Kind kind, String token) {
      if (previous != null && needsSpace(previous, kind, spaced)) {
        sb.append(' ');
      }
      sb.append(token);
      previous = kind;
      spaced = false;
    }

    private static boolean needsSpace(Kind previous, Kind current, boolean spaced) {
      switch (current) {
        case CLOSE:
        case COMMA:
        case DOT:
        case SEMICOLON:
          return false;
        default:
          break;
      }
      if (previous == Kind.OPEN || previous == Kind.DOT) {
        return false;
      }
      if (current == Kind.OPEN && previous == Kind.WORD) {
        return spaced;
      }
      return true;
    }

    @Override
    public String toString() {
      return sb.toString();
    }
  }
}
