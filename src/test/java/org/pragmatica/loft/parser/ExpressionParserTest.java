package org.pragmatica.loft.parser;

import org.junit.jupiter.api.Test;
import org.pragmatica.loft.Loft;
import org.pragmatica.loft.ast.Expr;
import org.pragmatica.loft.ast.FieldInit;
import org.pragmatica.loft.ast.LambdaParam;
import org.pragmatica.loft.ast.MatchArm;
import org.pragmatica.loft.ast.Stmt;
import org.pragmatica.loft.ast.TemplatePart;
import org.pragmatica.loft.ast.Type;
import org.pragmatica.loft.error.ParseError;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ExpressionParserTest {

    private static Expr parse(String source) throws ParseError {
        return Loft.parseExpression(source, "test");
    }

    private static Expr num(String value) {
        return new Expr.NumberLiteral(new BigDecimal(value));
    }

    private static Expr id(String name) {
        return new Expr.Identifier(name);
    }

    private static Expr bin(String op, Expr left, Expr right) {
        return new Expr.BinOp(op, left, right);
    }

    private static Expr call(Expr callee, Expr... args) {
        return new Expr.Call(callee, List.of(args));
    }

    @Test
    void multiplication_bindsTighterThanAddition() throws ParseError {
        assertEquals(bin("+", num("2"), bin("*", num("3"), num("4"))), parse("2 + 3 * 4"));
        assertEquals(bin("+", bin("*", num("2"), num("3")), num("4")), parse("2 * 3 + 4"));
    }

    @Test
    void sameLevelOperators_associateLeft() throws ParseError {
        assertEquals(bin("-", bin("-", id("a"), id("b")), id("c")), parse("a - b - c"));
        assertEquals(bin("/", bin("*", id("a"), id("b")), id("c")), parse("a * b / c"));
    }

    @Test
    void logicalAndComparison_nestByPrecedence() throws ParseError {
        assertEquals(bin("||", id("a"), bin("&&", id("b"), bin("==", id("c"), id("d")))),
                     parse("a || b && c == d"));
        assertEquals(bin("<", id("a"), bin("|", id("b"), id("c"))), parse("a < b | c"));
        assertEquals(bin("!=", bin("<=", id("a"), id("b")), new Expr.BooleanLiteral(true)),
                     parse("a <= b != true"));
    }

    @Test
    void parentheses_overridePrecedence() throws ParseError {
        assertEquals(bin("*", bin("+", id("a"), id("b")), id("c")), parse("(a + b) * c"));
    }

    @Test
    void unaryOperators_applyToTheirPostfixOperand() throws ParseError {
        assertEquals(bin("*", new Expr.UnaryOp("-", id("a")), id("b")), parse("-a * b"));
        assertEquals(new Expr.UnaryOp("!", call(id("f"), id("x"))), parse("!f(x)"));
        assertEquals(new Expr.UnaryOp("-", new Expr.FieldAccess(id("p"), "x")), parse("-p.x"));
    }

    @Test
    void postfixChain_appliesLeftToRight() throws ParseError {
        var expected = new Expr.Try(
            call(new Expr.Index(new Expr.FieldAccess(id("a"), "b"), num("0")), id("c")));

        assertEquals(expected, parse("a.b[0](c)?"));
    }

    @Test
    void call_acceptsEmptyAndTrailingCommaArgumentLists() throws ParseError {
        assertEquals(call(id("f")), parse("f()"));
        assertEquals(call(id("f"), num("1"), new Expr.StringLiteral("s")), parse("f(1, \"s\",)"));
    }

    @Test
    void singleIdentifierLambda() throws ParseError {
        var expected = new Expr.Lambda(List.of(new LambdaParam("v", Optional.empty())),
                                       Optional.empty(),
                                       bin("+", id("v"), num("1")));

        assertEquals(expected, parse("v => v + 1"));
    }

    @Test
    void parenthesizedLambda_withOptionalParameterTypes() throws ParseError {
        var expected = new Expr.Lambda(List.of(new LambdaParam("a", Optional.of(new Type.Named("num"))),
                                               new LambdaParam("b", Optional.empty())),
                                       Optional.empty(),
                                       id("a"));

        assertEquals(expected, parse("(a: num, b) => a"));
        assertEquals(new Expr.Lambda(List.of(), Optional.empty(), num("1")), parse("() => 1"));
    }

    @Test
    void lambda_withBlockBody() throws ParseError {
        var expected = new Expr.Lambda(List.of(new LambdaParam("x", Optional.empty())),
                                       Optional.empty(),
                                       new Expr.Block(List.of(new Stmt.Return(Optional.of(id("x"))))));

        assertEquals(expected, parse("x => { return x; }"));
    }

    @Test
    void parenthesizedCallee_isNotMistakenForLambda() throws ParseError {
        assertEquals(call(id("f"), id("x")), parse("(f)(x)"));
        assertEquals(call(call(id("g"), id("a")), id("b")), parse("(g(a))(b)"));
    }

    @Test
    void lambdaLookahead_givesUpAtConfiguredLimit() throws ParseError {
        var source = "(a, b, c) => a";

        assertInstanceOf(Expr.Lambda.class, parse(source));

        var error = assertThrows(ParseError.class,
                                 () -> Loft.builder()
                                           .lambdaLookaheadLimit(3)
                                           .parseExpression(source, "test"));
        assertEquals("Expected ')' but got ','", error.reason());
    }

    @Test
    void arrayLiteral_keepsCallElements() throws ParseError {
        assertEquals(new Expr.ArrayLiteral(List.of(num("1"), num("2"), call(id("f"), id("x")))),
                     parse("[1, 2, f(x)]"));
        assertEquals(new Expr.ArrayLiteral(List.of()), parse("[]"));
    }

    @Test
    void structLiteral_afterIdentifier() throws ParseError {
        var expected = new Expr.StructLiteral("Point", List.of(new FieldInit("x", num("1")),
                                                               new FieldInit("y", bin("+", id("a"), num("2")))));

        assertEquals(expected, parse("Point { x: 1, y: a + 2 }"));
    }

    @Test
    void matchExpression_withConstructorAndWildcardPatterns() throws ParseError {
        var expected = new Expr.Match(id("result"),
                                      List.of(new MatchArm<>(call(id("Ok"), id("v")), id("v")),
                                              new MatchArm<>(id("_"), num("0"))));

        assertEquals(expected, parse("match result { Ok(v) => v, _ => 0 }"));
    }

    @Test
    void templateLiteral_alternatesTextAndInterpolation() throws ParseError {
        var expected = new Expr.TemplateLiteral(List.of(new TemplatePart.Text("Hi "),
                                                        new TemplatePart.Interpolation(bin("+", id("a"), id("b"))),
                                                        new TemplatePart.Text("!")));

        assertEquals(expected, parse("`Hi ${a + b}!`"));
    }

    @Test
    void asyncPrefixes_nestAroundTheirOperand() throws ParseError {
        assertEquals(new Expr.Await(new Expr.Async(call(id("fetch")))), parse("await async fetch()"));
        assertEquals(new Expr.Lazy(id("value")), parse("lazy value"));
    }

    @Test
    void blockExpression_containsStatements() throws ParseError {
        assertEquals(new Expr.Block(List.of(new Stmt.Expression(num("1")))), parse("{ 1 }"));
    }

    @Test
    void missingOperand_isReported() {
        var atEnd = assertThrows(ParseError.class, () -> parse("1 +"));
        assertEquals("Unexpected end of input in expression", atEnd.reason());
        assertEquals(4, atEnd.column());

        var empty = assertThrows(ParseError.class, () -> parse(""));
        assertEquals("Unexpected end of input in expression", empty.reason());
    }

    @Test
    void unexpectedTokens_areReportedWithTheirSymbol() {
        var punct = assertThrows(ParseError.class, () -> parse(";"));
        assertEquals("Unexpected token in expression: ';'", punct.reason());

        var keyword = assertThrows(ParseError.class, () -> parse("let"));
        assertEquals("Unexpected token in expression: 'let'", keyword.reason());
    }

    @Test
    void malformedPostfix_isReported() {
        var args = assertThrows(ParseError.class, () -> parse("f(a b)"));
        assertEquals("Expected ',' or ')' in function call", args.reason());
        assertEquals(5, args.column());

        var field = assertThrows(ParseError.class, () -> parse("a.1"));
        assertEquals("Expected field name after '.'", field.reason());
    }

    @Test
    void trailingInput_isRejected() {
        var error = assertThrows(ParseError.class, () -> parse("a b"));

        assertEquals("Unexpected token after expression: 'b'", error.reason());
        assertEquals(3, error.column());
    }

    @Test
    void compoundAssignment_foldsAtLowestPrecedence() throws ParseError {
        assertEquals(bin("+=", id("x"), num("1")), parse("x += 1"));
        assertEquals(bin("*=", id("x"), bin("+", id("y"), num("2"))), parse("x *= y + 2"));
    }

    @Test
    void fieldAssignment_targetsFieldAccess() throws ParseError {
        assertEquals(
            bin("=", new Expr.FieldAccess(id("a"), "b"), bin("+", id("c"), num("1"))),
            parse("a.b = c + 1"));
    }

    @Test
    void indexAssignment_targetsIndex() throws ParseError {
        assertEquals(bin("=", new Expr.Index(id("arr"), num("0")), num("5")), parse("arr[0] = 5"));
    }

    @Test
    void assignment_isLeftAssociative() throws ParseError {
        assertEquals(bin("=", bin("=", id("a"), id("b")), id("c")), parse("a = b = c"));
    }

    @Test
    void structLiteral_fieldValueMayBeNestedStructLiteral() throws ParseError {
        var expected = new Expr.StructLiteral("Outer", List.of(
            new FieldInit("inner", new Expr.StructLiteral("Inner", List.of(new FieldInit("x", num("1")))))));

        assertEquals(expected, parse("Outer { inner: Inner { x: 1 } }"));
    }
}
