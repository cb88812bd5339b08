package com.github.automata;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits specification text into tokens. Never fails: characters that do not start any token of the
 * grammar come out as {@link Kind#INVALID} tokens so that the parser can report them alongside every
 * other syntax error. Whitespace and {@code //} line comments are skipped.
 */
final class SpecificationTokenizer {

  enum Kind {
    IDENTIFIER, LEFT_PAREN, RIGHT_PAREN, COMMA, ARROW, COLON, PATH_SEPARATOR, DOT, EQUALS, NOT, AND,
    OR, INVALID, END
  }

  static final class Token {
    final Kind kind;
    final String text;
    final int line;
    final int column;

    Token(final Kind kind, final String text, final int line, final int column) {
      this.kind = kind;
      this.text = text;
      this.line = line;
      this.column = column;
    }

    boolean is(final Kind expected) {
      return kind == expected;
    }

    String describe() {
      return kind == Kind.END ? "end of input" : "'" + text + "'";
    }

    @Override
    public String toString() {
      return kind + "(" + text + ")@" + line + ":" + column;
    }
  }

  private final String source;
  private int position;
  private int line = 1;
  private int column = 1;

  SpecificationTokenizer(final String source) {
    this.source = source == null ? "" : source;
  }

  List<Token> tokenize() {
    final List<Token> tokens = new ArrayList<>();
    Token token;
    do {
      token = next();
      tokens.add(token);
    } while (token.kind != Kind.END);
    return tokens;
  }

  private Token next() {
    skipWhitespaceAndComments();
    if (position >= source.length()) {
      return new Token(Kind.END, "", line, column);
    }
    final int startLine = line;
    final int startColumn = column;
    final char current = source.charAt(position);
    if (Character.isLetter(current) || current == '_') {
      final int start = position;
      while (position < source.length()
          && (Character.isLetterOrDigit(source.charAt(position)) || source.charAt(position) == '_')) {
        advance();
      }
      return new Token(Kind.IDENTIFIER, source.substring(start, position), startLine, startColumn);
    }
    switch (current) {
      case '(':
        return single(Kind.LEFT_PAREN, startLine, startColumn);
      case ')':
        return single(Kind.RIGHT_PAREN, startLine, startColumn);
      case ',':
        return single(Kind.COMMA, startLine, startColumn);
      case '.':
        return single(Kind.DOT, startLine, startColumn);
      case ':':
        return peek(1) == ':' ? pair(Kind.PATH_SEPARATOR, startLine, startColumn)
            : single(Kind.COLON, startLine, startColumn);
      case '-':
        return peek(1) == '>' ? pair(Kind.ARROW, startLine, startColumn)
            : single(Kind.INVALID, startLine, startColumn);
      case '&':
        return peek(1) == '&' ? pair(Kind.AND, startLine, startColumn)
            : single(Kind.INVALID, startLine, startColumn);
      case '|':
        return peek(1) == '|' ? pair(Kind.OR, startLine, startColumn)
            : single(Kind.INVALID, startLine, startColumn);
      case '=':
        // '==' is a comparison, which guards do not support
        return peek(1) == '=' ? pair(Kind.INVALID, startLine, startColumn)
            : single(Kind.EQUALS, startLine, startColumn);
      case '!':
        return peek(1) == '=' ? pair(Kind.INVALID, startLine, startColumn)
            : single(Kind.NOT, startLine, startColumn);
      default:
        return invalidRun(startLine, startColumn);
    }
  }

  private Token single(final Kind kind, final int startLine, final int startColumn) {
    final String text = source.substring(position, position + 1);
    advance();
    return new Token(kind, text, startLine, startColumn);
  }

  private Token pair(final Kind kind, final int startLine, final int startColumn) {
    final String text = source.substring(position, position + 2);
    advance();
    advance();
    return new Token(kind, text, startLine, startColumn);
  }

  // numbers, operators like '<' and friends: swallow the whole run so it is reported once
  private Token invalidRun(final int startLine, final int startColumn) {
    final int start = position;
    do {
      advance();
    } while (position < source.length() && !Character.isWhitespace(source.charAt(position))
        && "(),:=!&|-".indexOf(source.charAt(position)) < 0
        && !Character.isLetter(source.charAt(position)) && source.charAt(position) != '_');
    return new Token(Kind.INVALID, source.substring(start, position), startLine, startColumn);
  }

  private char peek(final int offset) {
    final int index = position + offset;
    return index < source.length() ? source.charAt(index) : '\0';
  }

  private void advance() {
    if (source.charAt(position) == '\n') {
      line++;
      column = 1;
    } else {
      column++;
    }
    position++;
  }

  private void skipWhitespaceAndComments() {
    while (position < source.length()) {
      final char current = source.charAt(position);
      if (Character.isWhitespace(current)) {
        advance();
      } else if (current == '/' && peek(1) == '/') {
        while (position < source.length() && source.charAt(position) != '\n') {
          advance();
        }
      } else {
        return;
      }
    }
  }
}
