package exm.pylower.frontend;

import static exm.pylower.frontend.Trees.leaf;
import static exm.pylower.frontend.Trees.line;
import static exm.pylower.frontend.Trees.module;
import static exm.pylower.frontend.Trees.name;
import static exm.pylower.frontend.Trees.node;
import static exm.pylower.frontend.Trees.number;
import static exm.pylower.frontend.Trees.op;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExpectedException;

import exm.pylower.ast.Cst;
import exm.pylower.ast.CstNode;
import exm.pylower.ast.SourceRange;
import exm.pylower.ast.Symbol;
import exm.pylower.ast.TokenKind;
import exm.pylower.common.exceptions.MalformedTreeException;
import exm.pylower.common.exceptions.UnimplementedConstructException;
import exm.pylower.common.exceptions.UnsupportedSyntaxException;
import exm.pylower.common.exceptions.UserException;
import exm.pylower.common.lang.TargetVersion;
import exm.pylower.frontend.tree.Literals;
import exm.pylower.pyast.AstDump;
import exm.pylower.pyast.ExprContext;
import exm.pylower.pyast.Module;
import exm.pylower.pyast.PyNode;
import exm.pylower.pyast.Statements.ExprStmt;

public class CstWalkerTest {

  private static final CstWalker WALKER = new CstWalker(new Literals());

  @Rule
  public ExpectedException exception = ExpectedException.none();

  private static LoweringContext latest() {
    return new LoweringContext("test.py", TargetVersion.LATEST);
  }

  private static LoweringContext target(int minor) {
    return new LoweringContext("test.py", TargetVersion.of(3, minor));
  }

  private static String dump(PyNode node) {
    return new AstDump(false, true).dump(node);
  }

  private static String lower(Cst tree) throws UserException {
    return dump(WALKER.lower(latest(), tree));
  }

  @Test
  public void testSingleName() throws UserException {
    Module m = WALKER.lowerModule(latest(), module(line(name("a", 0), 1)));
    assertEquals("Module(body=[Expr(value=Name(id='a', ctx=Load()))], " +
                 "type_ignores=[])", dump(m));
    assertEquals("Expression statement spans the expression",
                 new SourceRange(1, 0, 1, 1), m.body.get(0).range());
  }

  @Test
  public void testPrecedence() throws UserException {
    // 1 + 2 * 3
    CstNode tree = node(Symbol.ARITH_EXPR, number("1", 0),
        op(TokenKind.PLUS, 2),
        node(Symbol.TERM, number("2", 4), op(TokenKind.STAR, 6),
             number("3", 8)));
    PyNode result = WALKER.lower(latest(), tree);
    assertEquals("BinOp(left=Constant(value=1), op=Add(), " +
        "right=BinOp(left=Constant(value=2), op=Mult(), " +
        "right=Constant(value=3)))", dump(result));
    assertEquals(new SourceRange(1, 0, 1, 9), result.range());
  }

  @Test
  public void testLeftAssociative() throws UserException {
    // a - b - c
    CstNode tree = node(Symbol.ARITH_EXPR, name("a", 0),
        op(TokenKind.MINUS, 2), name("b", 4), op(TokenKind.MINUS, 6),
        name("c", 8));
    PyNode result = WALKER.lower(latest(), tree);
    assertEquals("BinOp(left=BinOp(left=Name(id='a', ctx=Load()), " +
        "op=Sub(), right=Name(id='b', ctx=Load())), op=Sub(), " +
        "right=Name(id='c', ctx=Load()))", dump(result));
    String withPositions = new AstDump(true, true).dump(result);
    assertTrue("Inner operation ends at b: " + withPositions,
        withPositions.contains("lineno=1, col_offset=0, end_lineno=1, " +
                               "end_col_offset=5)"));
  }

  @Test
  public void testListComprehension() throws UserException {
    // [x for x in y if x]
    CstNode tree = node(Symbol.ATOM, op(TokenKind.LSQB, 0),
        node(Symbol.LISTMAKER, name("x", 1),
            node(Symbol.OLD_COMP_FOR, name("for", 3), name("x", 7),
                 name("in", 9), name("y", 12),
                 node(Symbol.OLD_COMP_IF, name("if", 14), name("x", 17)))),
        op(TokenKind.RSQB, 18));
    PyNode result = WALKER.lower(latest(), tree);
    assertEquals("ListComp(elt=Name(id='x', ctx=Load()), " +
        "generators=[comprehension(target=Name(id='x', ctx=Store()), " +
        "iter=Name(id='y', ctx=Load()), ifs=[Name(id='x', ctx=Load())], " +
        "is_async=0)])", dump(result));
    assertEquals(new SourceRange(1, 0, 1, 19), result.range());
  }

  @Test
  public void testComprehensionNeedsSingleElement() throws UserException {
    // [a, b for x in y]
    CstNode tree = node(Symbol.ATOM, op(TokenKind.LSQB, 0),
        node(Symbol.LISTMAKER, name("a", 1), op(TokenKind.COMMA, 2),
            name("b", 4),
            node(Symbol.OLD_COMP_FOR, name("for", 6), name("x", 10),
                 name("in", 12), name("y", 15))),
        op(TokenKind.RSQB, 16));
    exception.expect(MalformedTreeException.class);
    WALKER.lower(latest(), tree);
  }

  @Test
  public void testCallArguments() throws UserException {
    // f(*a, **b, c=1)
    CstNode tree = node(Symbol.POWER, name("f", 0),
        node(Symbol.TRAILER, op(TokenKind.LPAR, 1),
            node(Symbol.ARGLIST,
                node(Symbol.ARGUMENT, op(TokenKind.STAR, 2), name("a", 3)),
                op(TokenKind.COMMA, 4),
                node(Symbol.ARGUMENT, op(TokenKind.DOUBLESTAR, 6),
                     name("b", 8)),
                op(TokenKind.COMMA, 9),
                node(Symbol.ARGUMENT, name("c", 11), op(TokenKind.EQUAL, 12),
                     number("1", 13))),
            op(TokenKind.RPAR, 14)));
    PyNode result = WALKER.lower(latest(), tree);
    assertEquals("Call(func=Name(id='f', ctx=Load()), " +
        "args=[Starred(value=Name(id='a', ctx=Load()), ctx=Load())], " +
        "keywords=[keyword(value=Name(id='b', ctx=Load())), " +
        "keyword(arg='c', value=Constant(value=1))])", dump(result));
    assertEquals(new SourceRange(1, 0, 1, 15), result.range());
  }

  @Test
  public void testPositionalAfterKeyword() throws UserException {
    // f(c=1, a)
    CstNode tree = node(Symbol.POWER, name("f", 0),
        node(Symbol.TRAILER, op(TokenKind.LPAR, 1),
            node(Symbol.ARGLIST,
                node(Symbol.ARGUMENT, name("c", 2), op(TokenKind.EQUAL, 3),
                     number("1", 4)),
                op(TokenKind.COMMA, 5), name("a", 7)),
            op(TokenKind.RPAR, 8)));
    exception.expect(UnsupportedSyntaxException.class);
    exception.expectMessage("positional argument follows keyword argument");
    WALKER.lower(latest(), tree);
  }

  @Test
  public void testExtendedSlice() throws UserException {
    // a[1:2:3]
    CstNode tree = node(Symbol.POWER, name("a", 0),
        node(Symbol.TRAILER, op(TokenKind.LSQB, 1),
            node(Symbol.SUBSCRIPT, number("1", 2), op(TokenKind.COLON, 3),
                number("2", 4),
                node(Symbol.SLICEOP, op(TokenKind.COLON, 5),
                     number("3", 6))),
            op(TokenKind.RSQB, 7)));
    PyNode result = WALKER.lower(latest(), tree);
    assertEquals("Subscript(value=Name(id='a', ctx=Load()), " +
        "slice=Slice(lower=Constant(value=1), upper=Constant(value=2), " +
        "step=Constant(value=3)), ctx=Load())", dump(result));
    assertEquals(new SourceRange(1, 0, 1, 8), result.range());
  }

  @Test
  public void testEmptySlice() throws UserException {
    // a[::]: the sliceop without a step is collapsed to its colon
    CstNode tree = node(Symbol.POWER, name("a", 0),
        node(Symbol.TRAILER, op(TokenKind.LSQB, 1),
            node(Symbol.SUBSCRIPT, op(TokenKind.COLON, 2),
                 op(TokenKind.COLON, 3)),
            op(TokenKind.RSQB, 4)));
    assertEquals("Subscript(value=Name(id='a', ctx=Load()), " +
        "slice=Slice(), ctx=Load())", lower(tree));
  }

  @Test
  public void testTypeVarDefault() throws UserException {
    // type A[T = int] = list
    CstNode tree = node(Symbol.TYPE_STMT, name("type", 0), name("A", 5),
        node(Symbol.TYPEPARAMS, op(TokenKind.LSQB, 6),
            node(Symbol.TYPEVAR, name("T", 7), op(TokenKind.EQUAL, 9),
                 name("int", 11)),
            op(TokenKind.RSQB, 14)),
        op(TokenKind.EQUAL, 16), name("list", 18));
    assertEquals("TypeAlias(name=Name(id='A', ctx=Store()), " +
        "type_params=[TypeVar(name='T', default_value=Name(id='int', " +
        "ctx=Load()))], value=Name(id='list', ctx=Load()))", lower(tree));

    try {
      WALKER.lower(target(12), tree);
      fail("TypeVar default accepted for 3.12");
    } catch (UnsupportedSyntaxException e) {
      assertEquals("TypeVar default", e.construct());
      assertTrue(e.getMessage(), e.getMessage().contains("default"));
      assertTrue(e.getMessage(), e.getMessage().contains("3.13"));
    }
  }

  @Test
  public void testTypeAliasNeedsPython312() throws UserException {
    CstNode tree = node(Symbol.TYPE_STMT, name("type", 0), name("A", 5),
        op(TokenKind.EQUAL, 7), name("int", 9));
    exception.expect(UnsupportedSyntaxException.class);
    exception.expectMessage("type alias requires Python 3.12 or newer " +
                            "(target version is 3.11)");
    WALKER.lower(target(11), tree);
  }

  @Test
  public void testUnimplementedNode() throws UserException {
    CstNode trailer = node(Symbol.TRAILER, op(TokenKind.DOT, 0),
                           name("b", 1));
    try {
      WALKER.lower(latest(), trailer);
      fail("trailer lowered outside of power");
    } catch (UnimplementedConstructException e) {
      assertEquals("trailer", e.kindName());
    }
  }

  @Test
  public void testUnimplementedLeaf() throws UserException {
    try {
      WALKER.lower(latest(), op(TokenKind.COMMA, 0));
      fail("comma lowered");
    } catch (UnimplementedConstructException e) {
      assertEquals("COMMA", e.kindName());
    }
  }

  @Test
  public void testModuleWithoutEndMarker() throws UserException {
    CstNode root = node(Symbol.FILE_INPUT, line(name("a", 0), 1));
    exception.expect(MalformedTreeException.class);
    WALKER.lowerModule(latest(), root);
  }

  @Test
  public void testSingleStatementExpected() throws UserException {
    CstNode stmt = node(Symbol.SIMPLE_STMT, name("a", 0),
        op(TokenKind.SEMI, 1), name("b", 3),
        leaf(TokenKind.NEWLINE, "\n", 1, 4));
    exception.expect(MalformedTreeException.class);
    WALKER.lower(latest(), stmt);
  }

  @Test
  public void testSemicolonsFlattened() throws UserException {
    // a; b; pass;
    CstNode stmt = node(Symbol.SIMPLE_STMT, name("a", 0),
        op(TokenKind.SEMI, 1), name("b", 3), op(TokenKind.SEMI, 4),
        name("pass", 6), op(TokenKind.SEMI, 10),
        leaf(TokenKind.NEWLINE, "\n", 1, 11));
    Module m = WALKER.lowerModule(latest(), module(stmt));
    assertEquals("Module(body=[Expr(value=Name(id='a', ctx=Load())), " +
        "Expr(value=Name(id='b', ctx=Load())), Pass()], type_ignores=[])",
        dump(m));
  }

  @Test
  public void testAttributeTarget() throws UserException {
    // a.b = c
    CstNode stmt = node(Symbol.EXPR_STMT,
        node(Symbol.POWER, name("a", 0),
             node(Symbol.TRAILER, op(TokenKind.DOT, 1), name("b", 2))),
        op(TokenKind.EQUAL, 4), name("c", 6));
    assertEquals("Assign(targets=[Attribute(value=Name(id='a', " +
        "ctx=Load()), attr='b', ctx=Store())], value=Name(id='c', " +
        "ctx=Load()))", lower(stmt));
  }

  @Test
  public void testSubscriptTargetIndexIsLoaded() throws UserException {
    // a[i] = v
    CstNode stmt = node(Symbol.EXPR_STMT,
        node(Symbol.POWER, name("a", 0),
             node(Symbol.TRAILER, op(TokenKind.LSQB, 1), name("i", 2),
                  op(TokenKind.RSQB, 3))),
        op(TokenKind.EQUAL, 5), name("v", 7));
    assertEquals("Assign(targets=[Subscript(value=Name(id='a', " +
        "ctx=Load()), slice=Name(id='i', ctx=Load()), ctx=Store())], " +
        "value=Name(id='v', ctx=Load()))", lower(stmt));
  }

  @Test
  public void testStarredTarget() throws UserException {
    // a, *b = c
    CstNode stmt = node(Symbol.EXPR_STMT,
        node(Symbol.TESTLIST_STAR_EXPR, name("a", 0),
             op(TokenKind.COMMA, 1),
             node(Symbol.STAR_EXPR, op(TokenKind.STAR, 3), name("b", 4))),
        op(TokenKind.EQUAL, 6), name("c", 8));
    assertEquals("Assign(targets=[Tuple(elts=[Name(id='a', ctx=Store()), " +
        "Starred(value=Name(id='b', ctx=Store()), ctx=Store())], " +
        "ctx=Store())], value=Name(id='c', ctx=Load()))", lower(stmt));
  }

  @Test
  public void testBareStarredTarget() throws UserException {
    // *a = b
    CstNode stmt = node(Symbol.EXPR_STMT,
        node(Symbol.STAR_EXPR, op(TokenKind.STAR, 0), name("a", 1)),
        op(TokenKind.EQUAL, 3), name("b", 5));
    assertEquals("Assign(targets=[Starred(value=Name(id='a', ctx=Store()), " +
        "ctx=Store())], value=Name(id='b', ctx=Load()))", lower(stmt));
  }

  @Test
  public void testMultipleStarredTargets() throws UserException {
    // a, *b, *c = d
    CstNode stmt = node(Symbol.EXPR_STMT,
        node(Symbol.TESTLIST_STAR_EXPR, name("a", 0),
             op(TokenKind.COMMA, 1),
             node(Symbol.STAR_EXPR, op(TokenKind.STAR, 3), name("b", 4)),
             op(TokenKind.COMMA, 5),
             node(Symbol.STAR_EXPR, op(TokenKind.STAR, 7), name("c", 8))),
        op(TokenKind.EQUAL, 10), name("d", 12));
    assertEquals("Assign(targets=[Tuple(elts=[Name(id='a', ctx=Store()), " +
        "Starred(value=Name(id='b', ctx=Store()), ctx=Store()), " +
        "Starred(value=Name(id='c', ctx=Store()), ctx=Store())], " +
        "ctx=Store())], value=Name(id='d', ctx=Load()))", lower(stmt));
  }

  @Test
  public void testStarredValue() throws UserException {
    // x = *a
    CstNode stmt = node(Symbol.EXPR_STMT, name("x", 0),
        op(TokenKind.EQUAL, 2),
        node(Symbol.STAR_EXPR, op(TokenKind.STAR, 4), name("a", 5)));
    assertEquals("Assign(targets=[Name(id='x', ctx=Store())], " +
        "value=Starred(value=Name(id='a', ctx=Load()), ctx=Load()))",
        lower(stmt));
  }

  @Test
  public void testDeleteStarred() throws UserException {
    // del *a
    CstNode stmt = node(Symbol.DEL_STMT, name("del", 0),
        node(Symbol.STAR_EXPR, op(TokenKind.STAR, 4), name("a", 5)));
    exception.expect(UnsupportedSyntaxException.class);
    exception.expectMessage("cannot delete starred");
    WALKER.lower(latest(), stmt);
  }

  @Test
  public void testAugmentedAssignmentToStarred() throws UserException {
    // *a += 1
    CstNode stmt = node(Symbol.EXPR_STMT,
        node(Symbol.STAR_EXPR, op(TokenKind.STAR, 0), name("a", 1)),
        op(TokenKind.PLUSEQUAL, 3), number("1", 6));
    exception.expect(UnsupportedSyntaxException.class);
    exception.expectMessage("illegal expression for augmented assignment");
    WALKER.lower(latest(), stmt);
  }

  @Test
  public void testChainedAssignment() throws UserException {
    // a = b = 1
    CstNode stmt = node(Symbol.EXPR_STMT, name("a", 0),
        op(TokenKind.EQUAL, 2), name("b", 4), op(TokenKind.EQUAL, 6),
        number("1", 8));
    assertEquals("Assign(targets=[Name(id='a', ctx=Store()), " +
        "Name(id='b', ctx=Store())], value=Constant(value=1))",
        lower(stmt));
  }

  @Test
  public void testAssignToCall() throws UserException {
    // f() = 1
    CstNode stmt = node(Symbol.EXPR_STMT,
        node(Symbol.POWER, name("f", 0),
             node(Symbol.TRAILER, op(TokenKind.LPAR, 1),
                  op(TokenKind.RPAR, 2))),
        op(TokenKind.EQUAL, 4), number("1", 6));
    exception.expect(UnsupportedSyntaxException.class);
    exception.expectMessage("cannot assign to function call");
    WALKER.lower(latest(), stmt);
  }

  @Test
  public void testAugmentedAssignment() throws UserException {
    // x += 1
    CstNode stmt = node(Symbol.EXPR_STMT, name("x", 0),
        op(TokenKind.PLUSEQUAL, 2), number("1", 5));
    assertEquals("AugAssign(target=Name(id='x', ctx=Store()), op=Add(), " +
                 "value=Constant(value=1))", lower(stmt));
  }

  @Test
  public void testAugmentedAssignmentToTuple() throws UserException {
    // a, b += 1
    CstNode stmt = node(Symbol.EXPR_STMT,
        node(Symbol.TESTLIST_STAR_EXPR, name("a", 0),
             op(TokenKind.COMMA, 1), name("b", 3)),
        op(TokenKind.PLUSEQUAL, 5), number("1", 8));
    exception.expect(UnsupportedSyntaxException.class);
    exception.expectMessage("illegal expression for augmented assignment");
    WALKER.lower(latest(), stmt);
  }

  @Test
  public void testAnnotatedAssignment() throws UserException {
    // x: int = 1
    CstNode stmt = node(Symbol.EXPR_STMT, name("x", 0),
        node(Symbol.ANNASSIGN, op(TokenKind.COLON, 1), name("int", 3),
             op(TokenKind.EQUAL, 7), number("1", 9)));
    assertEquals("AnnAssign(target=Name(id='x', ctx=Store()), " +
        "annotation=Name(id='int', ctx=Load()), value=Constant(value=1), " +
        "simple=1)", lower(stmt));

    try {
      WALKER.lower(target(5), stmt);
      fail("annotation accepted for 3.5");
    } catch (UnsupportedSyntaxException e) {
      assertEquals("annotated assignment", e.construct());
    }
  }

  @Test
  public void testAnnotatedTuple() throws UserException {
    // a, b: int
    CstNode stmt = node(Symbol.EXPR_STMT,
        node(Symbol.TESTLIST_STAR_EXPR, name("a", 0),
             op(TokenKind.COMMA, 1), name("b", 3)),
        node(Symbol.ANNASSIGN, op(TokenKind.COLON, 4), name("int", 6)));
    exception.expect(UnsupportedSyntaxException.class);
    exception.expectMessage("only single target (not tuple) can be annotated");
    WALKER.lower(latest(), stmt);
  }

  @Test
  public void testDelete() throws UserException {
    // del a, b[0]
    CstNode stmt = node(Symbol.DEL_STMT, name("del", 0),
        node(Symbol.EXPRLIST, name("a", 4), op(TokenKind.COMMA, 5),
            node(Symbol.POWER, name("b", 7),
                 node(Symbol.TRAILER, op(TokenKind.LSQB, 8),
                      number("0", 9), op(TokenKind.RSQB, 10)))));
    assertEquals("Delete(targets=[Name(id='a', ctx=Del()), " +
        "Subscript(value=Name(id='b', ctx=Load()), slice=Constant(value=0), " +
        "ctx=Del())])", lower(stmt));
  }

  @Test
  public void testNamedExpression() throws UserException {
    // x := 1
    CstNode tree = node(Symbol.NAMEDEXPR_TEST, name("x", 0),
        op(TokenKind.COLONEQUAL, 2), number("1", 5));
    assertEquals("NamedExpr(target=Name(id='x', ctx=Store()), " +
                 "value=Constant(value=1))", lower(tree));
    exception.expect(UnsupportedSyntaxException.class);
    exception.expectMessage("assignment expression requires Python 3.8");
    WALKER.lower(target(7), tree);
  }

  @Test
  public void testMatrixMultiplication() throws UserException {
    // a @ b
    CstNode tree = node(Symbol.TERM, name("a", 0), op(TokenKind.AT, 2),
                        name("b", 4));
    assertEquals("BinOp(left=Name(id='a', ctx=Load()), op=MatMult(), " +
        "right=Name(id='b', ctx=Load()))",
        dump(WALKER.lower(target(5), tree)));
    exception.expect(UnsupportedSyntaxException.class);
    WALKER.lower(target(4), tree);
  }

  @Test
  public void testLambdaParameters() throws UserException {
    // lambda x, y=1, *args, z, **kw: x
    CstNode params = node(Symbol.VARARGSLIST, name("x", 7),
        op(TokenKind.COMMA, 8), name("y", 10), op(TokenKind.EQUAL, 11),
        number("1", 12), op(TokenKind.COMMA, 13), op(TokenKind.STAR, 15),
        name("args", 16), op(TokenKind.COMMA, 20), name("z", 22),
        op(TokenKind.COMMA, 23), op(TokenKind.DOUBLESTAR, 25),
        name("kw", 27));
    CstNode tree = node(Symbol.LAMBDEF, name("lambda", 0), params,
        op(TokenKind.COLON, 29), name("x", 31));
    assertEquals("Lambda(args=arguments(posonlyargs=[], " +
        "args=[arg(arg='x'), arg(arg='y')], vararg=arg(arg='args'), " +
        "kwonlyargs=[arg(arg='z')], kw_defaults=[None], " +
        "kwarg=arg(arg='kw'), defaults=[Constant(value=1)]), " +
        "body=Name(id='x', ctx=Load()))", lower(tree));
  }

  @Test
  public void testNonDefaultAfterDefault() throws UserException {
    // lambda x=1, y: 0
    CstNode params = node(Symbol.VARARGSLIST, name("x", 7),
        op(TokenKind.EQUAL, 8), number("1", 9), op(TokenKind.COMMA, 10),
        name("y", 12));
    CstNode tree = node(Symbol.LAMBDEF, name("lambda", 0), params,
        op(TokenKind.COLON, 13), number("0", 15));
    exception.expect(UnsupportedSyntaxException.class);
    exception.expectMessage("non-default argument follows default argument");
    WALKER.lower(latest(), tree);
  }

  @Test
  public void testDictDisplay() throws UserException {
    // {**a, b: c}
    CstNode tree = node(Symbol.ATOM, op(TokenKind.LBRACE, 0),
        node(Symbol.DICTSETMAKER, op(TokenKind.DOUBLESTAR, 1), name("a", 3),
             op(TokenKind.COMMA, 4), name("b", 6), op(TokenKind.COLON, 7),
             name("c", 9)),
        op(TokenKind.RBRACE, 10));
    assertEquals("Dict(keys=[None, Name(id='b', ctx=Load())], " +
        "values=[Name(id='a', ctx=Load()), Name(id='c', ctx=Load())])",
        lower(tree));
  }

  @Test
  public void testDictAndSetMixed() throws UserException {
    // {a: b, c}
    CstNode tree = node(Symbol.ATOM, op(TokenKind.LBRACE, 0),
        node(Symbol.DICTSETMAKER, name("a", 1), op(TokenKind.COLON, 2),
             name("b", 4), op(TokenKind.COMMA, 5), name("c", 7)),
        op(TokenKind.RBRACE, 8));
    exception.expect(UnsupportedSyntaxException.class);
    WALKER.lower(latest(), tree);
  }

  @Test
  public void testParenthesesKeepInnerRange() throws UserException {
    // (a)
    CstNode tree = node(Symbol.ATOM, op(TokenKind.LPAR, 0), name("a", 1),
                        op(TokenKind.RPAR, 2));
    PyNode result = WALKER.lower(latest(), tree);
    assertEquals("Name(id='a', ctx=Load())", dump(result));
    assertEquals(new SourceRange(1, 1, 1, 2), result.range());
  }

  @Test
  public void testStarredExpressionStatement() throws UserException {
    CstNode stmt = node(Symbol.STAR_EXPR, op(TokenKind.STAR, 0),
                        name("a", 1));
    Module m = WALKER.lowerModule(latest(), module(line(stmt, 2)));
    assertEquals("Module(body=[Expr(value=Starred(value=Name(id='a', " +
        "ctx=Load()), ctx=Load()))], type_ignores=[])", dump(m));
  }

  @Test
  public void testDeterministic() throws UserException {
    CstNode root = module(line(node(Symbol.ARITH_EXPR, number("1", 0),
        op(TokenKind.PLUS, 2), name("x", 4)), 5));
    AstDump full = new AstDump(true, true);
    String first = full.dump(WALKER.lowerModule(latest(), root));
    String second = full.dump(WALKER.lowerModule(latest(), root));
    assertEquals(first, second);
  }

  @Test
  public void testExpressionStatementRange() throws UserException {
    Module m = WALKER.lowerModule(latest(), module(line(
        node(Symbol.ARITH_EXPR, number("1", 0), op(TokenKind.PLUS, 2),
             name("x", 4)), 5)));
    ExprStmt stmt = (ExprStmt)m.body.get(0);
    assertEquals(new SourceRange(1, 0, 1, 5), stmt.range());
    assertEquals(stmt.range(), stmt.value.range());
  }

  @Test
  public void testChainedComparison() throws UserException {
    // a < b is not c not in d
    CstNode tree = node(Symbol.COMPARISON, name("a", 0),
        op(TokenKind.LESS, 2), name("b", 4),
        node(Symbol.COMP_OP, name("is", 6), name("not", 9)), name("c", 13),
        node(Symbol.COMP_OP, name("not", 15), name("in", 19)),
        name("d", 22));
    assertEquals("Compare(left=Name(id='a', ctx=Load()), " +
        "ops=[Lt(), IsNot(), NotIn()], comparators=[Name(id='b', " +
        "ctx=Load()), Name(id='c', ctx=Load()), Name(id='d', ctx=Load())])",
        lower(tree));
  }

  @Test
  public void testConditionalExpression() throws UserException {
    // a if b else c
    CstNode tree = node(Symbol.TEST, name("a", 0), name("if", 2),
        name("b", 5), name("else", 7), name("c", 12));
    assertEquals("IfExp(test=Name(id='b', ctx=Load()), " +
        "body=Name(id='a', ctx=Load()), orelse=Name(id='c', ctx=Load()))",
        lower(tree));
  }

  @Test
  public void testBooleanOperationIsFlat() throws UserException {
    // a or b or c
    CstNode tree = node(Symbol.OR_TEST, name("a", 0), name("or", 2),
        name("b", 5), name("or", 7), name("c", 10));
    assertEquals("BoolOp(op=Or(), values=[Name(id='a', ctx=Load()), " +
        "Name(id='b', ctx=Load()), Name(id='c', ctx=Load())])", lower(tree));
  }

  @Test
  public void testUnaryOperators() throws UserException {
    // -x
    CstNode negative = node(Symbol.FACTOR, op(TokenKind.MINUS, 0),
                            name("x", 1));
    assertEquals("UnaryOp(op=USub(), operand=Name(id='x', ctx=Load()))",
                 lower(negative));
    // not x
    CstNode not = node(Symbol.NOT_TEST, name("not", 0), name("x", 4));
    assertEquals("UnaryOp(op=Not(), operand=Name(id='x', ctx=Load()))",
                 lower(not));
  }

  @Test
  public void testAwait() throws UserException {
    // await x
    CstNode tree = node(Symbol.POWER,
        leaf(TokenKind.AWAIT, "await", 1, 0), name("x", 6));
    PyNode result = WALKER.lower(latest(), tree);
    assertEquals("Await(value=Name(id='x', ctx=Load()))", dump(result));
    assertEquals(new SourceRange(1, 0, 1, 7), result.range());

    try {
      WALKER.lower(target(4), tree);
      fail("await accepted for 3.4");
    } catch (UnsupportedSyntaxException e) {
      assertEquals("await expression", e.construct());
    }
  }

  @Test
  public void testBackquote() throws UserException {
    // `x`
    CstNode tree = node(Symbol.ATOM, leaf(TokenKind.BACKQUOTE, "`", 1, 0),
        name("x", 1), leaf(TokenKind.BACKQUOTE, "`", 1, 2));
    assertEquals("Call(func=Name(id='repr', ctx=Load()), " +
        "args=[Name(id='x', ctx=Load())], keywords=[])", lower(tree));
  }

  @Test
  public void testEllipsis() throws UserException {
    CstNode tree = node(Symbol.ATOM, op(TokenKind.DOT, 0),
        op(TokenKind.DOT, 1), op(TokenKind.DOT, 2));
    PyNode result = WALKER.lower(latest(), tree);
    assertEquals("Constant(value=Ellipsis)", dump(result));
    assertEquals(new SourceRange(1, 0, 1, 3), result.range());
  }

  @Test
  public void testSetComprehension() throws UserException {
    // {x for x in y}
    CstNode tree = node(Symbol.ATOM, op(TokenKind.LBRACE, 0),
        node(Symbol.DICTSETMAKER, name("x", 1),
            node(Symbol.COMP_FOR, name("for", 3), name("x", 7),
                 name("in", 9), name("y", 12))),
        op(TokenKind.RBRACE, 13));
    assertEquals("SetComp(elt=Name(id='x', ctx=Load()), " +
        "generators=[comprehension(target=Name(id='x', ctx=Store()), " +
        "iter=Name(id='y', ctx=Load()), ifs=[], is_async=0)])", lower(tree));
  }

  @Test
  public void testDictComprehension() throws UserException {
    // {k: v for k in y}
    CstNode tree = node(Symbol.ATOM, op(TokenKind.LBRACE, 0),
        node(Symbol.DICTSETMAKER, name("k", 1), op(TokenKind.COLON, 2),
            name("v", 4),
            node(Symbol.COMP_FOR, name("for", 6), name("k", 10),
                 name("in", 12), name("y", 15))),
        op(TokenKind.RBRACE, 16));
    assertEquals("DictComp(key=Name(id='k', ctx=Load()), " +
        "value=Name(id='v', ctx=Load()), " +
        "generators=[comprehension(target=Name(id='k', ctx=Store()), " +
        "iter=Name(id='y', ctx=Load()), ifs=[], is_async=0)])", lower(tree));
  }

  @Test
  public void testAsyncComprehension() throws UserException {
    // {x async for x in y}
    CstNode tree = node(Symbol.ATOM, op(TokenKind.LBRACE, 0),
        node(Symbol.DICTSETMAKER, name("x", 1),
            node(Symbol.COMP_FOR, leaf(TokenKind.ASYNC, "async", 1, 3),
                 name("for", 9), name("x", 13), name("in", 15),
                 name("y", 18))),
        op(TokenKind.RBRACE, 19));
    assertEquals("SetComp(elt=Name(id='x', ctx=Load()), " +
        "generators=[comprehension(target=Name(id='x', ctx=Store()), " +
        "iter=Name(id='y', ctx=Load()), ifs=[], is_async=1)])", lower(tree));

    exception.expect(UnsupportedSyntaxException.class);
    exception.expectMessage("asynchronous comprehension requires Python 3.6");
    WALKER.lower(target(5), tree);
  }

  private static CstNode generatorArgument(int col) {
    // x for x in y, starting at col
    return node(Symbol.ARGUMENT, name("x", col),
        node(Symbol.COMP_FOR, name("for", col + 2), name("x", col + 6),
             name("in", col + 8), name("y", col + 11)));
  }

  @Test
  public void testGeneratorArgument() throws UserException {
    // f(x for x in y)
    CstNode tree = node(Symbol.POWER, name("f", 0),
        node(Symbol.TRAILER, op(TokenKind.LPAR, 1), generatorArgument(2),
             op(TokenKind.RPAR, 14)));
    assertEquals("Call(func=Name(id='f', ctx=Load()), " +
        "args=[GeneratorExp(elt=Name(id='x', ctx=Load()), " +
        "generators=[comprehension(target=Name(id='x', ctx=Store()), " +
        "iter=Name(id='y', ctx=Load()), ifs=[], is_async=0)])], " +
        "keywords=[])", lower(tree));
  }

  @Test
  public void testGeneratorArgumentWithTrailingComma() throws UserException {
    // f(x for x in y,)
    CstNode tree = node(Symbol.POWER, name("f", 0),
        node(Symbol.TRAILER, op(TokenKind.LPAR, 1),
             node(Symbol.ARGLIST, generatorArgument(2),
                  op(TokenKind.COMMA, 14)),
             op(TokenKind.RPAR, 15)));
    assertEquals("Trailing comma allowed before 3.7",
        "Call(func=Name(id='f', ctx=Load()), " +
        "args=[GeneratorExp(elt=Name(id='x', ctx=Load()), " +
        "generators=[comprehension(target=Name(id='x', ctx=Store()), " +
        "iter=Name(id='y', ctx=Load()), ifs=[], is_async=0)])], " +
        "keywords=[])", dump(WALKER.lower(target(6), tree)));

    exception.expect(UnsupportedSyntaxException.class);
    exception.expectMessage("Generator expression must be parenthesized");
    WALKER.lower(latest(), tree);
  }

  @Test
  public void testGeneratorArgumentNotAlone() throws UserException {
    // f(x for x in y, z)
    CstNode tree = node(Symbol.POWER, name("f", 0),
        node(Symbol.TRAILER, op(TokenKind.LPAR, 1),
             node(Symbol.ARGLIST, generatorArgument(2),
                  op(TokenKind.COMMA, 14), name("z", 16)),
             op(TokenKind.RPAR, 17)));
    exception.expect(UnsupportedSyntaxException.class);
    exception.expectMessage("Generator expression must be parenthesized");
    WALKER.lower(target(6), tree);
  }

  @Test
  public void testNamedExpressionGeneratorArgument() throws UserException {
    // f(y := x for x in z)
    CstNode tree = node(Symbol.POWER, name("f", 0),
        node(Symbol.TRAILER, op(TokenKind.LPAR, 1),
            node(Symbol.ARGUMENT, name("y", 2), op(TokenKind.COLONEQUAL, 4),
                name("x", 7),
                node(Symbol.COMP_FOR, name("for", 9), name("x", 13),
                     name("in", 15), name("z", 18))),
            op(TokenKind.RPAR, 19)));
    assertEquals("Call(func=Name(id='f', ctx=Load()), " +
        "args=[GeneratorExp(elt=NamedExpr(target=Name(id='y', " +
        "ctx=Store()), value=Name(id='x', ctx=Load())), " +
        "generators=[comprehension(target=Name(id='x', ctx=Store()), " +
        "iter=Name(id='z', ctx=Load()), ifs=[], is_async=0)])], " +
        "keywords=[])", lower(tree));
  }

  private static CstNode attribute(String base, String attr, int col) {
    return node(Symbol.POWER, name(base, col),
        node(Symbol.TRAILER, op(TokenKind.DOT, col + base.length()),
             name(attr, col + base.length() + 1)));
  }

  @Test
  public void testKeywordTargetMustBeName() throws UserException {
    // f(a.b=1)
    CstNode tree = node(Symbol.POWER, name("f", 0),
        node(Symbol.TRAILER, op(TokenKind.LPAR, 1),
            node(Symbol.ARGUMENT, attribute("a", "b", 2),
                 op(TokenKind.EQUAL, 5), number("1", 6)),
            op(TokenKind.RPAR, 7)));
    exception.expect(UnsupportedSyntaxException.class);
    exception.expectMessage("keyword argument target must be a name");
    WALKER.lower(latest(), tree);
  }

  @Test
  public void testNamedExpressionTargetMustBeName() throws UserException {
    // a.b := 1
    CstNode tree = node(Symbol.NAMEDEXPR_TEST, attribute("a", "b", 0),
        op(TokenKind.COLONEQUAL, 4), number("1", 7));
    exception.expect(UnsupportedSyntaxException.class);
    exception.expectMessage("assignment expression target must be a name");
    WALKER.lower(latest(), tree);
  }

  @Test
  public void testSubscriptList() throws UserException {
    // a[1, 2]
    CstNode tree = node(Symbol.POWER, name("a", 0),
        node(Symbol.TRAILER, op(TokenKind.LSQB, 1),
            node(Symbol.SUBSCRIPTLIST, number("1", 2),
                 op(TokenKind.COMMA, 3), number("2", 5)),
            op(TokenKind.RSQB, 6)));
    assertEquals("Subscript(value=Name(id='a', ctx=Load()), " +
        "slice=Tuple(elts=[Constant(value=1), Constant(value=2)], " +
        "ctx=Load()), ctx=Load())", lower(tree));
  }

  private static CstNode typeAlias(Cst param) {
    // type A[param] = list
    return node(Symbol.TYPE_STMT, name("type", 0), name("A", 5),
        node(Symbol.TYPEPARAMS, op(TokenKind.LSQB, 6), param,
             op(TokenKind.RSQB, 17)),
        op(TokenKind.EQUAL, 19), name("list", 21));
  }

  @Test
  public void testParamSpecDefault() throws UserException {
    // **P = int
    CstNode tree = typeAlias(node(Symbol.PARAMSPEC,
        op(TokenKind.DOUBLESTAR, 7), name("P", 9), op(TokenKind.EQUAL, 11),
        name("int", 13)));
    assertEquals("TypeAlias(name=Name(id='A', ctx=Store()), " +
        "type_params=[ParamSpec(name='P', default_value=Name(id='int', " +
        "ctx=Load()))], value=Name(id='list', ctx=Load()))", lower(tree));

    try {
      WALKER.lower(target(12), tree);
      fail("ParamSpec default accepted for 3.12");
    } catch (UnsupportedSyntaxException e) {
      assertEquals("ParamSpec default", e.construct());
      assertTrue(e.getMessage(), e.getMessage().contains("3.13"));
    }
  }

  @Test
  public void testTypeVarTupleDefault() throws UserException {
    // *Ts = int
    CstNode tree = typeAlias(node(Symbol.TYPEVARTUPLE,
        op(TokenKind.STAR, 7), name("Ts", 8), op(TokenKind.EQUAL, 11),
        name("int", 13)));
    assertEquals("TypeAlias(name=Name(id='A', ctx=Store()), " +
        "type_params=[TypeVarTuple(name='Ts', default_value=Name(id='int', " +
        "ctx=Load()))], value=Name(id='list', ctx=Load()))", lower(tree));

    try {
      WALKER.lower(target(12), tree);
      fail("TypeVarTuple default accepted for 3.12");
    } catch (UnsupportedSyntaxException e) {
      assertEquals("TypeVarTuple default", e.construct());
    }
  }

  @Test
  public void testContextUnchangedAfterFailedTarget() throws UserException {
    LoweringContext context = latest();
    // f() = 1
    CstNode bad = node(Symbol.EXPR_STMT,
        node(Symbol.POWER, name("f", 0),
             node(Symbol.TRAILER, op(TokenKind.LPAR, 1),
                  op(TokenKind.RPAR, 2))),
        op(TokenKind.EQUAL, 4), number("1", 6));
    try {
      WALKER.lower(context, bad);
      fail("assignment to a call accepted");
    } catch (UnsupportedSyntaxException e) {
      assertEquals(ExprContext.LOAD, context.getExprContext());
    }
    assertEquals("Name(id='f', ctx=Load())",
                 dump(WALKER.lower(context, name("f", 0))));
  }
}
