package exm.pylower.pyast;

import static org.junit.Assert.assertEquals;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.Test;

import exm.pylower.ast.SourceRange;
import exm.pylower.common.lang.TargetVersion;
import exm.pylower.pyast.Expressions.Constant;
import exm.pylower.pyast.Expressions.Lambda;
import exm.pylower.pyast.Expressions.Name;
import exm.pylower.pyast.TypeParam.TypeVar;

public class AstDumpTest {

  private static final SourceRange R = new SourceRange(1, 0, 1, 1);

  @Test
  public void testFloatRepr() {
    assertEquals("1.0", AstDump.reprFloat(1.0));
    assertEquals("0.1", AstDump.reprFloat(0.1));
    assertEquals("1e+16", AstDump.reprFloat(1e16));
    assertEquals("1234567890123456.0", AstDump.reprFloat(1234567890123456.0));
    assertEquals("0.0001", AstDump.reprFloat(1e-4));
    assertEquals("1e-05", AstDump.reprFloat(1e-5));
    assertEquals("-2.5", AstDump.reprFloat(-2.5));
    assertEquals("inf", AstDump.reprFloat(Double.POSITIVE_INFINITY));
    assertEquals("-0.0", AstDump.reprFloat(-0.0));
  }

  @Test
  public void testFloatReprRoundTripsWithFewestDigits() {
    // The nearest double to 1e23 prints as 17 digits in Java
    assertEquals("1e+23", AstDump.reprFloat(1e23));
    assertEquals("2e+23", AstDump.reprFloat(2e23));
    assertEquals("5e-324", AstDump.reprFloat(Double.MIN_VALUE));
    assertEquals("1.7976931348623157e+308",
                 AstDump.reprFloat(Double.MAX_VALUE));
    assertEquals("0.30000000000000004", AstDump.reprFloat(0.1 + 0.2));
  }

  @Test
  public void testImaginaryRepr() {
    assertEquals("2j", AstDump.reprImaginary(new Imaginary(2.0)));
    assertEquals("1.5j", AstDump.reprImaginary(new Imaginary(1.5)));
    assertEquals("0j", AstDump.reprImaginary(new Imaginary(0.0)));
  }

  @Test
  public void testStringRepr() {
    assertEquals("'abc'", AstDump.reprStr("abc"));
    assertEquals("\"it's\"", AstDump.reprStr("it's"));
    assertEquals("'both \\' and \"'", AstDump.reprStr("both ' and \""));
    assertEquals("'a\\nb\\tc'", AstDump.reprStr("a\nb\tc"));
    assertEquals("'\\x00'", AstDump.reprStr("\0"));
    assertEquals("'é'", AstDump.reprStr("é"));
    assertEquals("'\\xa0'", AstDump.reprStr("\u00a0"));
  }

  @Test
  public void testBytesRepr() {
    assertEquals("b'a\\x00\\xff'",
        AstDump.reprBytes(new Bytes(new byte[] {'a', 0, (byte)0xff})));
    assertEquals("b\"'\"", AstDump.reprBytes(new Bytes(new byte[] {'\''})));
  }

  @Test
  public void testConstantValues() {
    assertEquals("True", AstDump.repr(Boolean.TRUE));
    assertEquals("None", AstDump.repr(ConstantSingleton.NONE));
    assertEquals("Ellipsis", AstDump.repr(ConstantSingleton.ELLIPSIS));
    assertEquals("12", AstDump.repr(BigInteger.valueOf(12)));
  }

  @Test
  public void testAttributes() {
    Name name = new Name(new SourceRange(2, 4, 2, 7), "abc",
                         ExprContext.LOAD);
    assertEquals("Name(id='abc', ctx=Load(), lineno=2, col_offset=4, " +
                 "end_lineno=2, end_col_offset=7)",
                 new AstDump(true, true).dump(name));
    assertEquals("Name(id='abc', ctx=Load())",
                 new AstDump(false, true).dump(name));
  }

  @Test
  public void testShowEmpty() {
    List<Statement> none = new ArrayList<Statement>();
    List<TypeIgnore> ignores = new ArrayList<TypeIgnore>();
    Module empty = new Module(none, ignores);
    assertEquals("Module(body=[], type_ignores=[])",
                 new AstDump(false, true).dump(empty));
    assertEquals("Module()", new AstDump(false, false).dump(empty));
  }

  @Test
  public void testStringKind() {
    Constant u = new Constant(R, "x", "u");
    assertEquals("Constant(value='x', kind='u')",
                 new AstDump(false, true).dump(u));
  }

  @Test
  public void testPositionalOnlySchema() {
    Lambda lambda = new Lambda(R, Arguments.empty(),
                               new Constant(R, BigInteger.ZERO));
    assertEquals("Lambda(args=arguments(args=[], kwonlyargs=[], " +
        "kw_defaults=[], defaults=[]), body=Constant(value=0))",
        new AstDump(false, true, TargetVersion.of(3, 7)).dump(lambda));
    assertEquals("Lambda(args=arguments(posonlyargs=[], args=[], " +
        "kwonlyargs=[], kw_defaults=[], defaults=[]), " +
        "body=Constant(value=0))",
        new AstDump(false, true, TargetVersion.of(3, 8)).dump(lambda));
  }

  @Test
  public void testTypeVarDefaultSchema() {
    TypeVar t = new TypeVar(R, "T", null, new Name(R, "int", ExprContext.LOAD));
    assertEquals("TypeVar(name='T')",
        new AstDump(false, true, TargetVersion.of(3, 12)).dump(t));
    assertEquals("TypeVar(name='T', default_value=Name(id='int', ctx=Load()))",
        new AstDump(false, true, TargetVersion.of(3, 13)).dump(t));
  }

  @Test
  public void testNullListItems() {
    List<Arg> none = new ArrayList<Arg>();
    List<Expression> noDefaults = new ArrayList<Expression>();
    Arguments args = new Arguments(none, none, null,
        Arrays.asList(new Arg(R, "k")), Arrays.<Expression>asList((Expression)null),
        null, noDefaults);
    assertEquals("arguments(posonlyargs=[], args=[], " +
        "kwonlyargs=[arg(arg='k')], kw_defaults=[None], defaults=[])",
        new AstDump(false, true).dump(args));
  }
}
