package org.breadnbutter.compiler;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

import org.breadnbutter.model.Pivot;

/**
 * Splits breadboard source text into tokens.
 *
 * <p>Lexing is lazy and line oriented: each source line is turned into tokens only when the
 * consumer reaches it. Every {@link #iterator()} starts over from the first line, and every
 * stream ends with a single {@link TokenType#EOF}. Malformed input never disappears silently;
 * it comes out as an {@link TokenType#ERROR} token carrying the message.
 */
public class Lexer implements Iterable<Token> {
  private static final String UNUSABLE_MARKERS = "\"[/-(";

  private final String[] lines;
  private final char marker;

  public Lexer(String text, char marker) {
    if (text == null) {
      throw new IllegalArgumentException("Source text is required");
    }
    checkMarker(marker);
    this.lines = text.split("\\r?\\n", -1);
    this.marker = marker;
  }

  public Lexer(String text) {
    this(text, CompilerOptions.DEFAULT_MARKER);
  }

  /**
   * Rejects characters that can also start another kind of line.
   *
   * @throws IllegalArgumentException if {@code marker} cannot be used as a nesting marker
   */
  static void checkMarker(char marker) {
    if (marker == '\0' || Character.isWhitespace(marker) || Character.isLetterOrDigit(marker)
        || UNUSABLE_MARKERS.indexOf(marker) >= 0) {
      throw new IllegalArgumentException("Unusable nesting marker: '" + marker + "'");
    }
  }

  @Override
  public Iterator<Token> iterator() {
    return new TokenIterator();
  }

  // Drains a fresh iterator, EOF included
  public List<Token> tokens() {
    List<Token> out = new ArrayList<>();
    for (Token t : this) {
      out.add(t);
    }
    return out;
  }

  private class TokenIterator implements Iterator<Token> {
    private final Deque<Token> pending = new ArrayDeque<>();
    private int next = 0;
    private boolean done = false;

    @Override
    public boolean hasNext() {
      return !done;
    }

    @Override
    public Token next() {
      if (done) {
        throw new NoSuchElementException();
      }
      while (pending.isEmpty() && next < lines.length) {
        new LineLexer(lines[next], next + 1, pending).lex();
        next++;
      }
      if (pending.isEmpty()) {
        done = true;
        return new Token(TokenType.EOF, "", lines.length + 1, 1);
      }
      return pending.poll();
    }
  }

  // Lexes a single line into the shared queue
  private class LineLexer {
    final String s;
    final int line;
    final Deque<Token> out;
    int i = 0;

    LineLexer(String s, int line, Deque<Token> out) {
      this.s = s;
      this.line = line;
      this.out = out;
    }

    void lex() {
      skipBlanks();
      if (atEnd()) {
        return;
      }
      if (s.startsWith("///", i)) {
        emit(TokenType.DESCRIPTION, s.substring(i + 3).trim(), i);
        emit(TokenType.NEWLINE, "", s.length());
        return;
      }
      if (s.startsWith("//", i)) {
        return;
      }

      int start = i;
      while (!atEnd() && s.charAt(i) == marker) {
        i++;
      }
      if (i > start) {
        emit(TokenType.MARKER, s.substring(start, i), start);
      }
      skipBlanks();

      if (!atEnd()) {
        String word = wordAt(i);
        TokenType keyword = TokenType.keyword(word);
        if (keyword != null) {
          emit(keyword, word, i);
          i += word.length();
          skipBlanks();
          if (keyword == TokenType.POSITION) {
            lexPosition();
          } else {
            lexRestAsText();
          }
        } else if (s.charAt(i) == '[') {
          lexRegion();
        } else {
          lexAffordance();
        }
      }
      emit(TokenType.NEWLINE, "", s.length());
    }

    // `place`, `component`, `include` and `sketch` take the rest of the line as one name
    void lexRestAsText() {
      if (atEnd()) {
        return;
      }
      if (peek() == '"') {
        int start = i;
        String value = readQuoted();
        if (value == null) {
          return;
        }
        emit(TokenType.TEXT, value, start);
        skipBlanks();
        if (!atEnd()) {
          error("Unexpected text after quoted string: '" + s.substring(i).trim() + "'", i);
        }
        return;
      }
      emit(TokenType.TEXT, s.substring(i).trim(), i);
      i = s.length();
    }

    void lexAffordance() {
      if (!s.startsWith("->", i)) {
        if (!lexName()) {
          return;
        }
      }

      while (true) {
        skipBlanks();
        if (atEnd()) {
          return;
        }
        if (!s.startsWith("->", i)) {
          error("Expected '->' but found '" + s.substring(i).trim() + "'", i);
          return;
        }
        emit(TokenType.ARROW, "->", i);
        i += 2;
        skipBlanks();

        if (!atEnd() && peek() == '(') {
          if (!lexLabel()) {
            return;
          }
          skipBlanks();
        }
        if (atEnd() || s.startsWith("->", i)) {
          continue; // missing target, reported by the parser
        }
        if (!lexName()) {
          return;
        }
      }
    }

    // An affordance label or connection target: quoted, or free text up to the next arrow
    boolean lexName() {
      int start = i;
      if (peek() == '"') {
        String value = readQuoted();
        if (value == null) {
          return false;
        }
        emit(TokenType.TEXT, value, start);
        return true;
      }
      int end = s.indexOf("->", i);
      if (end < 0) {
        end = s.length();
      }
      emit(TokenType.TEXT, s.substring(i, end).trim(), start);
      i = end;
      return true;
    }

    boolean lexLabel() {
      int start = i;
      i++; // (
      skipBlanks();
      String value;
      if (!atEnd() && peek() == '"') {
        value = readQuoted();
        if (value == null) {
          return false;
        }
        skipBlanks();
        if (atEnd() || peek() != ')') {
          error("Unterminated connection label", start);
          return false;
        }
      } else {
        int close = s.indexOf(')', i);
        if (close < 0) {
          error("Unterminated connection label", start);
          return false;
        }
        value = s.substring(i, close).trim();
        i = close;
      }
      i++; // )
      emit(TokenType.LABEL, value, start);
      return true;
    }

    void lexPosition() {
      boolean coordinateStart = true;
      while (true) {
        skipBlanks();
        if (atEnd()) {
          return;
        }
        char c = peek();
        if (coordinateStart && Pivot.isSymbol(c)) {
          emit(TokenType.PIVOT, String.valueOf(c), i++);
          coordinateStart = false;
          continue;
        }
        coordinateStart = false;

        if (c == ',') {
          emit(TokenType.COMMA, ",", i++);
          coordinateStart = true;
        } else if (c == '+') {
          emit(TokenType.PLUS, "+", i++);
        } else if (c == '-') {
          emit(TokenType.MINUS, "-", i++);
        } else if (Character.isDigit(c) || c == '.') {
          lexNumber();
        } else if (c == '"') {
          int start = i;
          String value = readQuoted();
          if (value == null) {
            return;
          }
          emit(TokenType.TEXT, value, start);
        } else {
          int start = i;
          while (!atEnd() && "+-,".indexOf(peek()) < 0) {
            i++;
          }
          emit(TokenType.TEXT, s.substring(start, i).trim(), start);
        }
      }
    }

    void lexRegion() {
      int open = i;
      emit(TokenType.REGION_OPEN, "[", i++);
      while (true) {
        skipBlanks();
        if (atEnd()) {
          error("Unterminated clickable region", open);
          return;
        }
        char c = peek();
        if (c == ']') {
          emit(TokenType.REGION_CLOSE, "]", i++);
          break;
        } else if (c == ',') {
          emit(TokenType.COMMA, ",", i++);
        } else if (Character.isDigit(c)) {
          lexNumber();
        } else {
          error("Unexpected '" + c + "' in clickable region", i);
          return;
        }
      }
      skipBlanks();
      lexRestAsText();
    }

    void lexNumber() {
      int start = i;
      boolean dot = false;
      while (!atEnd()) {
        char c = peek();
        if (Character.isDigit(c)) {
          i++;
        } else if (c == '.' && !dot) {
          dot = true;
          i++;
        } else {
          break;
        }
      }
      emit(TokenType.NUMBER, s.substring(start, i), start);
    }

    // Reads a "quoted string" starting at i; on failure emits an ERROR and returns null.
    // A backslash stops the next character from closing the string; both are kept as written.
    String readQuoted() {
      int start = i;
      i++; // opening quote
      boolean escaped = false;
      while (!atEnd()) {
        char c = s.charAt(i++);
        if (c == '"' && !escaped) {
          return s.substring(start + 1, i - 1);
        }
        escaped = c == '\\' && !escaped;
      }
      error("Unterminated quoted string", start);
      return null;
    }

    String wordAt(int from) {
      int end = from;
      while (end < s.length() && !Character.isWhitespace(s.charAt(end))) {
        end++;
      }
      return s.substring(from, end);
    }

    void skipBlanks() {
      while (!atEnd() && (s.charAt(i) == ' ' || s.charAt(i) == '\t')) {
        i++;
      }
    }

    boolean atEnd() {
      return i >= s.length();
    }

    char peek() {
      return s.charAt(i);
    }

    void error(String msg, int col) {
      emit(TokenType.ERROR, msg, col);
      i = s.length();
    }

    void emit(TokenType type, String text, int col) {
      out.add(new Token(type, text, line, col + 1));
    }
  }
}
