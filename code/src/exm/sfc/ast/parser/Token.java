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

/**
 * Lexical token
 */
public class Token {
  public static enum TokenType {
    NAME,
    KEYWORD,
    NUMBER,
    STRING,
    OP,
    NEWLINE,
    INDENT,
    DEDENT,
    EOF,
  }

  public final TokenType type;
  /** Source text of token */
  public final String text;
  /** Decoded value for string literals, otherwise null */
  public final String value;
  public final int line;
  public final int column;

  public Token(TokenType type, String text, String value,
               int line, int column) {
    this.type = type;
    this.text = text;
    this.value = value;
    this.line = line;
    this.column = column;
  }

  public boolean is(TokenType type, String text) {
    return this.type == type && this.text.equals(text);
  }

  public boolean isOp(String op) {
    return is(TokenType.OP, op);
  }

  public boolean isKeyword(String kw) {
    return is(TokenType.KEYWORD, kw);
  }

  /**
   * @return description for error messages
   */
  public String describe() {
    switch (type) {
      case NEWLINE:
        return "end of line";
      case INDENT:
        return "indent";
      case DEDENT:
        return "dedent";
      case EOF:
        return "end of file";
      default:
        return "'" + text + "'";
    }
  }

  @Override
  public String toString() {
    return type + "(" + text + ")@" + line + ":" + column;
  }
}
