/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
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
 * limitations under the License
 */
package exm.sfc.ast.parser;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import exm.sfc.ast.parser.Token.TokenType;
import exm.sfc.common.exceptions.InvalidSyntaxException;

/**
 * Converts source text to tokens.  Indentation at the start of each
 * logical line becomes INDENT/DEDENT tokens; line breaks inside brackets
 * and after a backslash are joined.
 */
public class Lexer {
  public static final Set<String> KEYWORDS = new HashSet<String>(
      Arrays.asList("False", "None", "True", "and", "as", "assert", "async",
          "await", "break", "class", "continue", "def", "del", "elif", "else",
          "except", "finally", "for", "from", "global", "if", "import", "in",
          "is", "lambda", "nonlocal", "not", "or", "pass", "raise", "return",
          "try", "while", "with", "yield"));

  /** Longest operators first */
  private static final String[] OPERATORS = {
    "**=", "//=", ">>=", "<<=",
    "**", "//", "==", "!=", "<=", ">=", "+=", "-=", "*=", "/=", "%=",
    "&=", "|=", "^=", "->", "<<", ">>",
    "+", "-", "*", "/", "%", "<", ">", "=", "(", ")", "[", "]", "{", "}",
    ",", ":", ".", ";", "@", "&", "|", "^", "~",
  };

  private static final int TAB_WIDTH = 8;

  private final String file;
  private final String src;
  private int pos = 0;
  private int line = 1;
  private int col = 1;

  /** Open brackets: newlines are insignificant when > 0 */
  private int depth = 0;
  private final List<Integer> indents = new ArrayList<Integer>();
  private final List<Token> tokens = new ArrayList<Token>();

  public Lexer(String file, String src) {
    this.file = file;
    this.src = src;
    this.indents.add(0);
  }

  public List<Token> tokenize() throws InvalidSyntaxException {
    boolean lineStart = true;
    while (true) {
      if (lineStart && depth == 0) {
        if (!startLine()) {
          break;
        }
        lineStart = false;
      }
      if (atEnd()) {
        break;
      }

      char c = peek(0);
      if (c == '\n') {
        if (depth == 0) {
          add(TokenType.NEWLINE, "\n", null, line, col);
          lineStart = true;
        }
        advance();
      } else if (c == ' ' || c == '\t' || c == '\r' || c == '\f') {
        advance();
      } else if (c == '#') {
        skipComment();
      } else if (c == '\\') {
        continuation();
      } else if (isNameStart(c)) {
        if (isStringPrefix()) {
          string();
        } else {
          name();
        }
      } else if (Character.isDigit(c) ||
                 (c == '.' && Character.isDigit(peek(1)))) {
        number();
      } else if (c == '\'' || c == '"') {
        string();
      } else {
        operator();
      }
    }

    if (depth > 0) {
      throw error(line, col, "unexpected end of file inside brackets");
    }

    // Close final line and any open blocks
    if (!tokens.isEmpty() &&
        tokens.get(tokens.size() - 1).type != TokenType.NEWLINE) {
      add(TokenType.NEWLINE, "\n", null, line, col);
    }
    while (indents.size() > 1) {
      indents.remove(indents.size() - 1);
      add(TokenType.DEDENT, "", null, line, col);
    }
    add(TokenType.EOF, "", null, line, col);
    return tokens;
  }

  /**
   * Process indentation at start of line, skipping blank and comment lines.
   * @return false if end of input reached
   */
  private boolean startLine() throws InvalidSyntaxException {
    while (true) {
      int width = 0;
      while (!atEnd()) {
        char c = peek(0);
        if (c == ' ') {
          width++;
        } else if (c == '\t') {
          width = (width / TAB_WIDTH + 1) * TAB_WIDTH;
        } else if (c != '\f' && c != '\r') {
          break;
        }
        advance();
      }
      if (atEnd()) {
        return false;
      }
      char c = peek(0);
      if (c == '#') {
        skipComment();
      }
      if (atEnd()) {
        return false;
      }
      if (peek(0) == '\n') {
        // Blank line
        advance();
        continue;
      }
      indent(width);
      return true;
    }
  }

  private void indent(int width) throws InvalidSyntaxException {
    int current = indents.get(indents.size() - 1);
    if (width > current) {
      indents.add(width);
      add(TokenType.INDENT, "", null, line, col);
    } else {
      while (width < indents.get(indents.size() - 1)) {
        indents.remove(indents.size() - 1);
        add(TokenType.DEDENT, "", null, line, col);
      }
      if (width != indents.get(indents.size() - 1)) {
        throw error(line, col,
            "unindent does not match any outer indentation level");
      }
    }
  }

  private void skipComment() {
    while (!atEnd() && peek(0) != '\n') {
      advance();
    }
  }

  private void continuation() throws InvalidSyntaxException {
    int startLine = line, startCol = col;
    advance();
    if (!atEnd() && peek(0) == '\r') {
      advance();
    }
    if (atEnd() || peek(0) != '\n') {
      throw error(startLine, startCol,
                  "unexpected character after line continuation");
    }
    advance();
  }

  private void name() {
    int start = pos, startLine = line, startCol = col;
    while (!atEnd() && isNamePart(peek(0))) {
      advance();
    }
    String text = src.substring(start, pos);
    TokenType type = KEYWORDS.contains(text) ? TokenType.KEYWORD
                                             : TokenType.NAME;
    add(type, text, null, startLine, startCol);
  }

  private void number() throws InvalidSyntaxException {
    int start = pos, startLine = line, startCol = col;
    int radix = peek(0) == '0' ? radix(peek(1)) : 10;
    if (radix != 10) {
      advance();
      advance();
      if (Character.digit(peek(0), radix) < 0 && peek(0) != '_') {
        throw error(startLine, startCol, "malformed number literal");
      }
      while (!atEnd() && (Character.digit(peek(0), radix) >= 0
                          || peek(0) == '_')) {
        advance();
      }
    } else {
      digits();
      if (!atEnd() && peek(0) == '.') {
        advance();
        digits();
      }
      if (!atEnd() && (peek(0) == 'e' || peek(0) == 'E')) {
        advance();
        if (!atEnd() && (peek(0) == '+' || peek(0) == '-')) {
          advance();
        }
        if (atEnd() || !Character.isDigit(peek(0))) {
          throw error(startLine, startCol, "malformed number literal");
        }
        digits();
      }
    }
    if (!atEnd() && isNamePart(peek(0))) {
      throw error(startLine, startCol, "malformed number literal");
    }
    add(TokenType.NUMBER, src.substring(start, pos), null,
        startLine, startCol);
  }

  /**
   * @param c character after a leading 0
   * @return radix of a prefixed integer literal, or 10 if unprefixed
   */
  private static int radix(char c) {
    switch (c) {
      case 'x':
      case 'X':
        return 16;
      case 'o':
      case 'O':
        return 8;
      case 'b':
      case 'B':
        return 2;
      default:
        return 10;
    }
  }

  private void digits() {
    while (!atEnd() && (Character.isDigit(peek(0)) || peek(0) == '_')) {
      advance();
    }
  }

  private boolean isStringPrefix() {
    char c = peek(0);
    if (c == 'r' || c == 'R') {
      char next = peek(1);
      return next == '\'' || next == '"';
    }
    return false;
  }

  private void string() throws InvalidSyntaxException {
    int start = pos, startLine = line, startCol = col;
    boolean raw = false;
    if (peek(0) == 'r' || peek(0) == 'R') {
      raw = true;
      advance();
    }
    char quote = peek(0);
    boolean triple = peek(1) == quote && peek(2) == quote;
    int quoteLen = triple ? 3 : 1;
    for (int i = 0; i < quoteLen; i++) {
      advance();
    }

    StringBuilder value = new StringBuilder();
    while (true) {
      if (atEnd()) {
        throw error(startLine, startCol, "unterminated string literal");
      }
      char c = peek(0);
      if (c == quote && (!triple ||
                         (peek(1) == quote && peek(2) == quote))) {
        for (int i = 0; i < quoteLen; i++) {
          advance();
        }
        break;
      } else if (c == '\n' && !triple) {
        throw error(startLine, startCol, "unterminated string literal");
      } else if (c == '\\') {
        escape(value, raw);
      } else {
        value.append(c);
        advance();
      }
    }
    add(TokenType.STRING, src.substring(start, pos), value.toString(),
        startLine, startCol);
  }

  private void escape(StringBuilder value, boolean raw)
                                            throws InvalidSyntaxException {
    int escLine = line, escCol = col;
    advance();
    if (atEnd()) {
      throw error(escLine, escCol, "unterminated string literal");
    }
    char c = peek(0);
    advance();
    if (raw) {
      value.append('\\').append(c);
      return;
    }
    switch (c) {
      case '\n':
        break;
      case 'n':
        value.append('\n');
        break;
      case 't':
        value.append('\t');
        break;
      case 'r':
        value.append('\r');
        break;
      case '0':
        value.append('\0');
        break;
      case '\\':
      case '\'':
      case '"':
        value.append(c);
        break;
      case 'x':
        value.append((char)hexEscape(2, escLine, escCol));
        break;
      case 'u':
        value.append((char)hexEscape(4, escLine, escCol));
        break;
      default:
        // Unknown escapes are kept as is
        value.append('\\').append(c);
    }
  }

  private int hexEscape(int len, int escLine, int escCol)
                                            throws InvalidSyntaxException {
    if (pos + len > src.length()) {
      throw error(escLine, escCol, "truncated escape sequence");
    }
    String hex = src.substring(pos, pos + len);
    try {
      int val = Integer.parseInt(hex, 16);
      for (int i = 0; i < len; i++) {
        advance();
      }
      return val;
    } catch (NumberFormatException e) {
      throw error(escLine, escCol, "invalid escape sequence \\" + hex);
    }
  }

  private void operator() throws InvalidSyntaxException {
    int startLine = line, startCol = col;
    for (String op: OPERATORS) {
      if (src.startsWith(op, pos)) {
        for (int i = 0; i < op.length(); i++) {
          advance();
        }
        if (op.equals("(") || op.equals("[") || op.equals("{")) {
          depth++;
        } else if (op.equals(")") || op.equals("]") || op.equals("}")) {
          if (depth == 0) {
            throw error(startLine, startCol, "unmatched '" + op + "'");
          }
          depth--;
        }
        add(TokenType.OP, op, null, startLine, startCol);
        return;
      }
    }
    throw error(startLine, startCol,
                "unexpected character '" + peek(0) + "'");
  }

  private void add(TokenType type, String text, String value,
                   int tokLine, int tokCol) {
    tokens.add(new Token(type, text, value, tokLine, tokCol));
  }

  private boolean atEnd() {
    return pos >= src.length();
  }

  private char peek(int offset) {
    int i = pos + offset;
    return i < src.length() ? src.charAt(i) : '\0';
  }

  private void advance() {
    if (src.charAt(pos) == '\n') {
      line++;
      col = 1;
    } else {
      col++;
    }
    pos++;
  }

  private static boolean isNameStart(char c) {
    return Character.isLetter(c) || c == '_';
  }

  private static boolean isNamePart(char c) {
    return Character.isLetterOrDigit(c) || c == '_';
  }

  private InvalidSyntaxException error(int errLine, int errCol, String msg) {
    return new InvalidSyntaxException(file, errLine, errCol, msg);
  }
}
