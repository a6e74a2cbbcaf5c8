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

package exm.pylower.pyast;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.List;

import org.apache.commons.lang3.StringUtils;

import exm.pylower.ast.SourceRange;
import exm.pylower.common.exceptions.PyLowerRuntimeError;
import exm.pylower.common.lang.TargetVersion;

/**
 * Renders a tree in the single-line format of the reference
 * <code>ast.dump()</code>, e.g.
 * <pre>
 * Module(body=[Expr(value=Name(id='a', ctx=Load()))], type_ignores=[])
 * </pre>
 * Absent optional fields are left out.  Fields that the schema of the
 * target version does not have are left out as well.
 */
public class AstDump {

  private final boolean includeAttributes;
  private final boolean showEmpty;
  private final TargetVersion version;

  private static final TargetVersion POSONLYARGS_VERSION =
                                              TargetVersion.of(3, 8);
  private static final TargetVersion DEFAULT_VALUE_VERSION =
                                              TargetVersion.of(3, 13);

  /**
   * @param includeAttributes append lineno, col_offset, end_lineno and
   *                end_col_offset to nodes that have positions
   * @param showEmpty if false, leave out fields holding empty lists
   * @param version schema version to render
   */
  public AstDump(boolean includeAttributes, boolean showEmpty,
                 TargetVersion version) {
    this.includeAttributes = includeAttributes;
    this.showEmpty = showEmpty;
    this.version = version;
  }

  public AstDump(boolean includeAttributes, boolean showEmpty) {
    this(includeAttributes, showEmpty, TargetVersion.LATEST);
  }

  public String dump(PyNode node) {
    StringBuilder sb = new StringBuilder();
    format(sb, node);
    return sb.toString();
  }

  private void format(StringBuilder sb, PyNode node) {
    sb.append(node.typeName()).append('(');
    boolean first = true;
    for (Field f: node.fields()) {
      if (!inSchema(f.name)) {
        continue;
      }
      if (f.value == null) {
        continue;
      }
      if (!showEmpty && f.value instanceof List &&
          ((List<?>)f.value).isEmpty()) {
        continue;
      }
      if (!first) {
        sb.append(", ");
      }
      first = false;
      sb.append(f.name).append('=');
      formatValue(sb, f.value);
    }
    if (includeAttributes && node.hasAttributes()) {
      SourceRange r = node.range();
      if (!first) {
        sb.append(", ");
      }
      sb.append("lineno=").append(r.lineno)
        .append(", col_offset=").append(r.colOffset)
        .append(", end_lineno=").append(r.endLineno)
        .append(", end_col_offset=").append(r.endColOffset);
    }
    sb.append(')');
  }

  private boolean inSchema(String fieldName) {
    if (fieldName.equals("posonlyargs")) {
      return version.atLeast(POSONLYARGS_VERSION);
    } else if (fieldName.equals("default_value")) {
      return version.atLeast(DEFAULT_VALUE_VERSION);
    }
    return true;
  }

  private void formatValue(StringBuilder sb, Object value) {
    if (value == null) {
      sb.append("None");
    } else if (value instanceof PyNode) {
      format(sb, (PyNode)value);
    } else if (value instanceof List) {
      sb.append('[');
      boolean first = true;
      for (Object elem: (List<?>)value) {
        if (!first) {
          sb.append(", ");
        }
        first = false;
        formatValue(sb, elem);
      }
      sb.append(']');
    } else if (value instanceof AstEnum) {
      sb.append(((AstEnum)value).astName()).append("()");
    } else {
      sb.append(repr(value));
    }
  }

  /**
   * Reference representation of a constant value
   */
  public static String repr(Object value) {
    if (value instanceof String) {
      return reprStr((String)value);
    } else if (value instanceof Bytes) {
      return reprBytes((Bytes)value);
    } else if (value instanceof BigInteger || value instanceof Integer ||
               value instanceof Long) {
      return value.toString();
    } else if (value instanceof Boolean) {
      return ((Boolean)value) ? "True" : "False";
    } else if (value instanceof Double) {
      return reprFloat((Double)value);
    } else if (value instanceof Imaginary) {
      return reprImaginary((Imaginary)value);
    } else if (value instanceof ConstantSingleton) {
      return ((ConstantSingleton)value).repr();
    } else {
      throw new PyLowerRuntimeError("No representation for " +
                                    value.getClass().getName());
    }
  }

  public static String reprStr(String s) {
    char quote = (s.indexOf('\'') >= 0 && s.indexOf('"') < 0) ? '"' : '\'';
    StringBuilder sb = new StringBuilder(s.length() + 2);
    sb.append(quote);
    int i = 0;
    while (i < s.length()) {
      int cp = s.codePointAt(i);
      i += Character.charCount(cp);
      if (cp == quote || cp == '\\') {
        sb.append('\\').appendCodePoint(cp);
      } else if (cp == '\t') {
        sb.append("\\t");
      } else if (cp == '\n') {
        sb.append("\\n");
      } else if (cp == '\r') {
        sb.append("\\r");
      } else if (cp < ' ' || cp == 0x7f) {
        hexEscape(sb, 'x', cp, 2);
      } else if (cp < 0x7f || isPrintable(cp)) {
        sb.appendCodePoint(cp);
      } else if (cp <= 0xff) {
        hexEscape(sb, 'x', cp, 2);
      } else if (cp <= 0xffff) {
        hexEscape(sb, 'u', cp, 4);
      } else {
        hexEscape(sb, 'U', cp, 8);
      }
    }
    sb.append(quote);
    return sb.toString();
  }

  public static String reprBytes(Bytes b) {
    boolean hasSingle = false, hasDouble = false;
    for (int i = 0; i < b.length(); i++) {
      if (b.get(i) == '\'') {
        hasSingle = true;
      } else if (b.get(i) == '"') {
        hasDouble = true;
      }
    }
    char quote = (hasSingle && !hasDouble) ? '"' : '\'';
    StringBuilder sb = new StringBuilder(b.length() + 3);
    sb.append('b').append(quote);
    for (int i = 0; i < b.length(); i++) {
      int c = b.get(i);
      if (c == quote || c == '\\') {
        sb.append('\\').append((char)c);
      } else if (c == '\t') {
        sb.append("\\t");
      } else if (c == '\n') {
        sb.append("\\n");
      } else if (c == '\r') {
        sb.append("\\r");
      } else if (c < ' ' || c >= 0x7f) {
        hexEscape(sb, 'x', c, 2);
      } else {
        sb.append((char)c);
      }
    }
    sb.append(quote);
    return sb.toString();
  }

  public static String reprFloat(double d) {
    if (Double.isNaN(d)) {
      return "nan";
    } else if (Double.isInfinite(d)) {
      return d > 0 ? "inf" : "-inf";
    } else if (d == 0.0) {
      return Double.doubleToRawLongBits(d) == 0 ? "0.0" : "-0.0";
    }
    return shortestRepr(d, true);
  }

  public static String reprImaginary(Imaginary value) {
    double d = value.imag;
    String text;
    if (Double.isNaN(d)) {
      text = "nan";
    } else if (Double.isInfinite(d)) {
      text = d > 0 ? "inf" : "-inf";
    } else if (d == 0.0) {
      text = Double.doubleToRawLongBits(d) == 0 ? "0" : "-0";
    } else {
      text = shortestRepr(d, false);
    }
    return text + "j";
  }

  /**
   * Shortest digits that read back as d, positioned the way the
   * reference repr does: scientific notation for decimal exponents below
   * -4 or above 16.
   * @param pointZero append ".0" to integral values in positional form
   */
  private static String shortestRepr(double d, boolean pointZero) {
    String sign = d < 0 ? "-" : "";
    BigDecimal exact = shortestDecimal(Math.abs(d));
    String digits = exact.unscaledValue().toString();
    // value is 0.<digits> * 10^decpt
    int decpt = digits.length() - exact.scale();
    if (decpt > 16 || decpt <= -4) {
      int exp = decpt - 1;
      StringBuilder sb = new StringBuilder(sign);
      sb.append(digits.charAt(0));
      if (digits.length() > 1) {
        sb.append('.').append(digits, 1, digits.length());
      }
      sb.append('e').append(exp < 0 ? '-' : '+');
      int absExp = Math.abs(exp);
      if (absExp < 10) {
        sb.append('0');
      }
      sb.append(absExp);
      return sb.toString();
    } else if (decpt <= 0) {
      return sign + "0." + StringUtils.repeat('0', -decpt) + digits;
    } else if (decpt >= digits.length()) {
      return sign + digits + StringUtils.repeat('0', decpt - digits.length())
             + (pointZero ? ".0" : "");
    } else {
      return sign + digits.substring(0, decpt) + "." +
             digits.substring(decpt);
    }
  }

  /**
   * Fewest significant digits that read back as d, rounding half-even
   */
  private static BigDecimal shortestDecimal(double d) {
    BigDecimal exact = new BigDecimal(d);
    for (int precision = 1; precision < 17; precision++) {
      BigDecimal rounded = exact.round(
                  new MathContext(precision, RoundingMode.HALF_EVEN));
      if (Double.parseDouble(rounded.toString()) == d) {
        return rounded.stripTrailingZeros();
      }
    }
    return exact.round(new MathContext(17, RoundingMode.HALF_EVEN))
                .stripTrailingZeros();
  }

  /**
   * Code points shown as-is by the reference repr: everything except
   * controls, format characters, surrogates, private use, unassigned
   * and separators other than the ASCII space.
   */
  private static boolean isPrintable(int cp) {
    if (cp == ' ') {
      return true;
    }
    switch (Character.getType(cp)) {
      case Character.CONTROL:
      case Character.FORMAT:
      case Character.SURROGATE:
      case Character.PRIVATE_USE:
      case Character.UNASSIGNED:
      case Character.LINE_SEPARATOR:
      case Character.PARAGRAPH_SEPARATOR:
      case Character.SPACE_SEPARATOR:
        return false;
      default:
        return true;
    }
  }

  private static void hexEscape(StringBuilder sb, char kind, int value,
                                int width) {
    String hex = Integer.toHexString(value);
    sb.append('\\').append(kind);
    sb.append(StringUtils.repeat('0', width - hex.length())).append(hex);
  }
}
