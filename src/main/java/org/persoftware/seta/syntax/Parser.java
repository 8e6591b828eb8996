package org.persoftware.seta.syntax;

import org.persoftware.seta.error.SetaError;
import org.persoftware.seta.lang.Result;
import org.persoftware.seta.tree.SourceLocation;
import org.persoftware.seta.tree.SourceSpan;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * Recursive-descent parser for Seta scripts.
 *
 * <p>Grammar, precedence from low to high:
 * <pre>
 * Program     := Statement*
 * Statement   := SymbolDecl | Assignment | CallStmt
 * SymbolDecl  := "symbol" Identifier ("," Identifier)* ";"
 * Assignment  := Identifier "=" Expr ";"
 * CallStmt    := Identifier "(" ArgList? ")" ";"?
 * Expr        := Term (("+" | "-") Term)*
 * Term        := Unary (("*" | "/" | "÷") Unary)*
 * Unary       := "-" Unary | Power
 * Power       := Primary ("^" Exponent)?
 * Exponent    := "-" Exponent | Power
 * Primary     := Number | Identifier | Identifier "(" ArgList ")" | "(" Expr ")"
 * ArgList     := Expr ("," Expr)*
 * </pre>
 * Parsing stops at the first error.
 */
public final class Parser {

    private final List<Token> tokens;
    private int pos;

    private Parser(List<Token> tokens) {
        this.tokens = tokens;
        this.pos = 0;
    }

    /**
     * Parse script text into a program.
     */
    public static Result<Program> parse(String text) {
        return Lexer.tokenize(text).flatMap(tokens -> new Parser(tokens).parseProgram());
    }

    /**
     * Parse a token list ending with {@link Token.Eof}.
     */
    public static Result<Program> parse(List<Token> tokens) {
        return new Parser(tokens).parseProgram();
    }

    /**
     * Parse text holding a single expression and nothing else.
     */
    public static Result<Syntax> parseExpression(String text) {
        return Lexer.tokenize(text).flatMap(tokens -> new Parser(tokens).parseStandaloneExpression());
    }

    private Result<Program> parseProgram() {
        var statements = new ArrayList<Statement>();
        while (!isAtEnd()) {
            var result = parseStatement();
            if (result.isFailure()) {
                return result.fold(Result::failure, unused -> null);
            }
            statements.add(result.unwrap());
        }
        return Result.success(new Program(statements));
    }

    private Result<Syntax> parseStandaloneExpression() {
        var result = parseExpr();
        if (result.isFailure() || isAtEnd()) {
            return result;
        }
        return unexpected("end of input");
    }

    // === Statements ===

    private Result<Statement> parseStatement() {
        var token = peek();
        if (token instanceof Token.SymbolKeyword) {
            return parseSymbolDeclaration();
        }
        if (!(token instanceof Token.Identifier id)) {
            return unexpected("statement");
        }
        var next = peekAhead();
        if (next instanceof Token.Equals) {
            return parseAssignment(id);
        }
        if (next instanceof Token.LParen) {
            return parseCallStatement(id);
        }
        advance();
        return unexpected("'=' or '('");
    }

    private Result<Statement> parseSymbolDeclaration() {
        var start = advance().span();
        var names = new ArrayList<Syntax.Identifier>();
        do {
            if (!(peek() instanceof Token.Identifier id)) {
                return unexpected("symbol name");
            }
            advance();
            names.add(new Syntax.Identifier(id.span(), id.name()));
        } while (match(Token.Comma.class));
        if (!(peek() instanceof Token.Semicolon)) {
            return unexpected("',' or ';'");
        }
        var end = advance().span();
        return Result.success(new Statement.SymbolDeclaration(start.to(end), names));
    }

    private Result<Statement> parseAssignment(Token.Identifier id) {
        advance();
        advance(); // skip =
        var value = parseExpr();
        if (value.isFailure()) {
            return value.fold(Result::failure, unused -> null);
        }
        if (!(peek() instanceof Token.Semicolon)) {
            return unexpected("';'");
        }
        var end = advance().span();
        var target = new Syntax.Identifier(id.span(), id.name());
        return Result.success(new Statement.Assignment(id.span().to(end), target, value.unwrap()));
    }

    private Result<Statement> parseCallStatement(Token.Identifier id) {
        advance();
        var arguments = parseArguments(true);
        if (arguments.isFailure()) {
            return arguments.fold(Result::failure, unused -> null);
        }
        var end = tokens.get(pos - 1).span();
        if (peek() instanceof Token.Semicolon) {
            end = advance().span();
        }
        var function = new Syntax.Identifier(id.span(), id.name());
        return Result.success(new Statement.CallStatement(id.span().to(end), function, arguments.unwrap()));
    }

    /**
     * Parenthesized argument list, the opening parenthesis being the current token.
     */
    private Result<List<Syntax>> parseArguments(boolean allowEmpty) {
        advance(); // skip (
        var arguments = new ArrayList<Syntax>();
        if (peek() instanceof Token.RParen && allowEmpty) {
            advance();
            return Result.success(arguments);
        }
        do {
            var argument = parseExpr();
            if (argument.isFailure()) {
                return argument.fold(Result::failure, unused -> null);
            }
            arguments.add(argument.unwrap());
        } while (match(Token.Comma.class));
        if (!(peek() instanceof Token.RParen)) {
            return unexpected("',' or ')'");
        }
        advance();
        return Result.success(arguments);
    }

    // === Expressions ===

    private Result<Syntax> parseExpr() {
        var left = parseTerm();
        if (left.isFailure()) {
            return left;
        }
        var result = left.unwrap();
        while (peek() instanceof Token.Plus || peek() instanceof Token.Minus) {
            var operator = advance() instanceof Token.Plus ? Syntax.Operator.ADD : Syntax.Operator.SUBTRACT;
            var right = parseTerm();
            if (right.isFailure()) {
                return right;
            }
            result = binary(operator, result, right.unwrap());
        }
        return Result.success(result);
    }

    private Result<Syntax> parseTerm() {
        var left = parseUnary();
        if (left.isFailure()) {
            return left;
        }
        var result = left.unwrap();
        while (peek() instanceof Token.Star || peek() instanceof Token.Slash) {
            var operator = advance() instanceof Token.Star ? Syntax.Operator.MULTIPLY : Syntax.Operator.DIVIDE;
            var right = parseUnary();
            if (right.isFailure()) {
                return right;
            }
            result = binary(operator, result, right.unwrap());
        }
        return Result.success(result);
    }

    private Result<Syntax> parseUnary() {
        if (peek() instanceof Token.Minus) {
            return negate(advance().span(), this::parseUnary);
        }
        return parsePower();
    }

    private Result<Syntax> parsePower() {
        var base = parsePrimary();
        if (base.isFailure() || !(peek() instanceof Token.Caret)) {
            return base;
        }
        advance();
        var exponent = parseExponent();
        if (exponent.isFailure()) {
            return exponent;
        }
        return Result.success(binary(Syntax.Operator.POWER, base.unwrap(), exponent.unwrap()));
    }

    private Result<Syntax> parseExponent() {
        if (peek() instanceof Token.Minus) {
            return negate(advance().span(), this::parseExponent);
        }
        return parsePower();
    }

    private Result<Syntax> parsePrimary() {
        var token = peek();
        if (token instanceof Token.NumberLiteral number) {
            advance();
            return Result.success(new Syntax.NumberLiteral(number.span(), number.text()));
        }
        if (token instanceof Token.Identifier id) {
            advance();
            if (!(peek() instanceof Token.LParen)) {
                return Result.success(new Syntax.Identifier(id.span(), id.name()));
            }
            var arguments = parseArguments(false);
            if (arguments.isFailure()) {
                return arguments.fold(Result::failure, unused -> null);
            }
            var span = id.span().to(tokens.get(pos - 1).span());
            return Result.success(new Syntax.Invocation(span, id.name(), arguments.unwrap()));
        }
        if (token instanceof Token.LParen) {
            advance();
            var inner = parseExpr();
            if (inner.isFailure()) {
                return inner;
            }
            if (!(peek() instanceof Token.RParen)) {
                return unexpected("')'");
            }
            advance();
            return inner;
        }
        return unexpected("expression");
    }

    private Result<Syntax> negate(SourceSpan minus, Supplier<Result<Syntax>> operand) {
        var result = operand.get();
        if (result.isFailure()) {
            return result;
        }
        var value = result.unwrap();
        return Result.success(new Syntax.Negate(minus.to(value.span()), value));
    }

    private static Syntax binary(Syntax.Operator operator, Syntax left, Syntax right) {
        return new Syntax.Binary(left.span().to(right.span()), operator, left, right);
    }

    // === Token navigation ===

    private boolean isAtEnd() {
        return peek() instanceof Token.Eof;
    }

    private Token peek() {
        return tokens.get(pos);
    }

    private Token peekAhead() {
        return pos + 1 < tokens.size() ? tokens.get(pos + 1) : tokens.get(tokens.size() - 1);
    }

    private Token advance() {
        var token = tokens.get(pos);
        if (!(token instanceof Token.Eof)) {
            pos++;
        }
        return token;
    }

    private boolean match(Class<? extends Token> type) {
        if (type.isInstance(peek())) {
            advance();
            return true;
        }
        return false;
    }

    private SourceLocation currentLocation() {
        return peek().span().start();
    }

    private <T> Result<T> unexpected(String expected) {
        return Result.failure(new SetaError.ParseError(currentLocation(), expected, tokenDescription(peek())));
    }

    private static String tokenDescription(Token token) {
        if (token instanceof Token.Identifier id) {
            return "identifier '" + id.name() + "'";
        }
        if (token instanceof Token.NumberLiteral n) {
            return "number " + n.text();
        }
        if (token instanceof Token.SymbolKeyword) {
            return "keyword 'symbol'";
        }
        if (token instanceof Token.Plus) {
            return "'+'";
        }
        if (token instanceof Token.Minus) {
            return "'-'";
        }
        if (token instanceof Token.Star) {
            return "'*'";
        }
        if (token instanceof Token.Slash) {
            return "'/'";
        }
        if (token instanceof Token.Caret) {
            return "'^'";
        }
        if (token instanceof Token.Equals) {
            return "'='";
        }
        if (token instanceof Token.Comma) {
            return "','";
        }
        if (token instanceof Token.Semicolon) {
            return "';'";
        }
        if (token instanceof Token.LParen) {
            return "'('";
        }
        if (token instanceof Token.RParen) {
            return "')'";
        }
        return "end of input";
    }
}
