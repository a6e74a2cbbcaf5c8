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

package exm.pylower.frontend.tree;

import java.io.ByteArrayOutputStream;
import java.math.BigInteger;
import java.util.Locale;

import exm.pylower.common.Logging;
import exm.pylower.common.exceptions.InvalidLiteralException;
import exm.pylower.common.lang.LiteralEvaluator;
import exm.pylower.pyast.Bytes;
import exm.pylower.pyast.Imaginary;

/**
 * Evaluates NUMBER and STRING tokens with Python 3 literal rules
 */
public class Literals implements LiteralEvaluator {

  @Override
  public Object evalNumber(String text) throws InvalidLiteralException {
    String number = text.replace("_", "");
    if (number.isEmpty()) {
      throw new InvalidLiteralException("Invalid number literal: " + text);
    }
    char last = number.charAt(number.length() - 1);
    if (last == 'j' || last == 'J') {
      return new Imaginary(parseFloat(text,
                              number.substring(0, number.length() - 1)));
    }
    String lower = number.toLowerCase(Locale.ROOT);
    if (lower.startsWith("0x")) {
      return parseInt(text, number.substring(2), 16, "hexadecimal");
    } else if (lower.startsWith("0o")) {
      return parseInt(text, number.substring(2), 8, "octal");
    } else if (lower.startsWith("0b")) {
      return parseInt(text, number.substring(2), 2, "binary");
    } else if (lower.indexOf('.') >= 0 || lower.indexOf('e') >= 0) {
      return parseFloat(text, number);
    }
    // Decimal integer: only zero may have leading zeros
    if (number.length() > 1 && number.charAt(0) == '0' &&
        !number.matches("0+")) {
      throw new InvalidLiteralException("leading zeros in decimal integer " +
          "literals are not permitted; use an 0o prefix for octal integers");
    }
    return parseInt(text, number, 10, "decimal");
  }

  private static BigInteger parseInt(String text, String digits, int base,
          String literalType) throws InvalidLiteralException {
    try {
      return new BigInteger(digits, base);
    } catch (NumberFormatException e) {
      throw new InvalidLiteralException("Invalid " + literalType +
                                        " literal: " + text);
    }
  }

  private static double parseFloat(String text, String number)
                                      throws InvalidLiteralException {
    try {
      return Double.parseDouble(number);
    } catch (NumberFormatException e) {
      throw new InvalidLiteralException("Invalid float literal: " + text);
    }
  }

  @Override
  public Object evalString(String text) throws InvalidLiteralException {
    int quoteStart = 0;
    while (quoteStart < text.length() && text.charAt(quoteStart) != '\'' &&
           text.charAt(quoteStart) != '"') {
      quoteStart++;
    }
    String prefix = text.substring(0, quoteStart).toLowerCase(Locale.ROOT);
    boolean raw = prefix.indexOf('r') >= 0;
    boolean bytes = prefix.indexOf('b') >= 0;
    if (prefix.indexOf('f') >= 0) {
      throw new InvalidLiteralException("f-strings are not literals: " + text);
    }

    String body = unquote(text.substring(quoteStart));
    if (bytes) {
      return unescapeBytes(body, raw);
    } else if (raw) {
      return body;
    } else {
      return unescapeString(body);
    }
  }

  /**
   * Strip one or three quote characters from each end
   */
  public static String unquote(String s) throws InvalidLiteralException {
    if (s.length() >= 6 && (s.startsWith("'''") || s.startsWith("\"\"\"")) &&
        s.endsWith(s.substring(0, 3))) {
      return s.substring(3, s.length() - 3);
    }
    if (s.length() >= 2 && (s.charAt(0) == '\'' || s.charAt(0) == '"') &&
        s.charAt(s.length() - 1) == s.charAt(0)) {
      return s.substring(1, s.length() - 1);
    }
    throw new InvalidLiteralException("String not quoted: " + s);
  }

  /**
   * Take the body of a string literal with Python escape sequences and
   * unescape it.
   */
  public static String unescapeString(String escaped)
                                    throws InvalidLiteralException {
    StringBuilder result = new StringBuilder(escaped.length());
    int i = 0;
    while (i < escaped.length()) {
      char c = escaped.charAt(i);
      if (c != '\\') {
        result.append(c);
        i++;
        continue;
      }
      // Escape code!
      i++;
      if (i >= escaped.length()) {
        throw new InvalidLiteralException("'\\' cannot appear at end of " +
                                          "string");
      }
      c = escaped.charAt(i);
      int simple = simpleEscape(c);
      if (simple >= 0) {
        if (simple != NO_CHAR) {
          result.append((char)simple);
        }
        i++;
      } else if (isOctalDigit(c)) {
        int end = octalEnd(escaped, i);
        result.appendCodePoint(Integer.parseInt(escaped.substring(i, end), 8));
        i = end;
      } else if (c == 'x') {
        result.appendCodePoint(hexEscape(escaped, i + 1, 2, "\\xXX"));
        i += 3;
      } else if (c == 'u') {
        result.appendCodePoint(hexEscape(escaped, i + 1, 4, "\\uXXXX"));
        i += 5;
      } else if (c == 'U') {
        int cp = hexEscape(escaped, i + 1, 8, "\\UXXXXXXXX");
        if (cp < 0 || cp > Character.MAX_CODE_POINT) {
          throw new InvalidLiteralException("illegal Unicode character in " +
                                            "\\U escape");
        }
        result.appendCodePoint(cp);
        i += 9;
      } else if (c == 'N') {
        int close = escaped.indexOf('}', i);
        if (i + 1 >= escaped.length() || escaped.charAt(i + 1) != '{' ||
            close < 0) {
          throw new InvalidLiteralException("malformed \\N character escape");
        }
        String name = escaped.substring(i + 2, close);
        try {
          result.appendCodePoint(Character.codePointOf(name));
        } catch (IllegalArgumentException e) {
          throw new InvalidLiteralException("unknown Unicode character name: "
                                            + name);
        }
        i = close + 1;
      } else {
        // Unrecognised escapes are kept as written
        Logging.uniqueWarn("invalid escape sequence '\\" + c + "'");
        result.append('\\');
      }
    }
    return result.toString();
  }

  public static Bytes unescapeBytes(String escaped, boolean raw)
                                      throws InvalidLiteralException {
    ByteArrayOutputStream result = new ByteArrayOutputStream(escaped.length());
    int i = 0;
    while (i < escaped.length()) {
      char c = escaped.charAt(i);
      if (c >= 0x80) {
        throw new InvalidLiteralException("bytes can only contain ASCII " +
                                          "literal characters");
      }
      if (c != '\\' || raw) {
        result.write(c);
        i++;
        continue;
      }
      i++;
      if (i >= escaped.length()) {
        throw new InvalidLiteralException("'\\' cannot appear at end of " +
                                          "bytes");
      }
      c = escaped.charAt(i);
      int simple = simpleEscape(c);
      if (simple >= 0) {
        if (simple != NO_CHAR) {
          result.write(simple);
        }
        i++;
      } else if (isOctalDigit(c)) {
        int end = octalEnd(escaped, i);
        result.write(Integer.parseInt(escaped.substring(i, end), 8) & 0xff);
        i = end;
      } else if (c == 'x') {
        result.write(hexEscape(escaped, i + 1, 2, "\\xXX"));
        i += 3;
      } else {
        Logging.uniqueWarn("invalid escape sequence '\\" + c + "'");
        result.write('\\');
      }
    }
    return new Bytes(result.toByteArray());
  }

  /** Escaped line break: contributes no character */
  private static final int NO_CHAR = Integer.MAX_VALUE;

  /**
   * @return character for a single-character escape, NO_CHAR for an
   *         escaped line break, or -1 if c does not start one
   */
  private static int simpleEscape(char c) {
    switch (c) {
      case '\n':
        return NO_CHAR;
      case '\\':
      case '\'':
      case '"':
        return c;
      case 'a':
        return '\007';
      case 'b':
        return '\b';
      case 'f':
        return '\f';
      case 'n':
        return '\n';
      case 'r':
        return '\r';
      case 't':
        return '\t';
      case 'v':
        return '\013';
      default:
        return -1;
    }
  }

  private static boolean isOctalDigit(char c) {
    return c >= '0' && c <= '7';
  }

  /**
   * @return index after up to three octal digits starting at start
   */
  private static int octalEnd(String s, int start) {
    int end = start;
    while (end < s.length() && end < start + 3 && isOctalDigit(s.charAt(end))) {
      end++;
    }
    return end;
  }

  /**
   * Parse exactly the given number of hex digits
   */
  private static int hexEscape(String s, int start, int digits,
                    String form) throws InvalidLiteralException {
    if (start + digits > s.length()) {
      throw new InvalidLiteralException("truncated " + form + " escape");
    }
    String hex = s.substring(start, start + digits);
    for (int i = 0; i < hex.length(); i++) {
      if (Character.digit(hex.charAt(i), 16) < 0) {
        throw new InvalidLiteralException("truncated " + form + " escape");
      }
    }
    return (int)Long.parseLong(hex, 16);
  }
}
