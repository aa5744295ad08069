package com.plexus.core.ast;

import com.plexus.core.error.SourceSyntaxException;
import com.plexus.core.error.UnsupportedSyntaxException;
import com.plexus.core.ops.ArithmeticOperator;
import com.plexus.core.ops.ComparisonOperator;
import com.plexus.core.ops.PyLiterals;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Recursive-descent parser for the supported statement/expression subset.
 *
 * Text that is not valid source raises {@link SourceSyntaxException}. Valid source using a
 * construct the graph cannot express raises {@link UnsupportedSyntaxException}, so the
 * returned AST only ever holds supported shapes.
 */
public class SourceParser {

    private static final Set<String> KEYWORDS = Set.of(
        "False", "None", "True", "and", "as", "assert", "async", "await", "break", "class",
        "continue", "def", "del", "elif", "else", "except", "finally", "for", "from", "global",
        "if", "import", "in", "is", "lambda", "nonlocal", "not", "or", "pass", "raise",
        "return", "try", "while", "with", "yield"
    );

    private static final Set<String> UNSUPPORTED_STATEMENTS = Set.of(
        "while", "def", "class", "return", "import", "from", "with", "try", "del", "global",
        "nonlocal", "raise", "assert", "break", "continue", "async", "yield"
    );

    private static final Set<String> AUGMENTED = Set.of(
        "+=", "-=", "*=", "/=", "//=", "%=", "**=", "&=", "|=", "^=", ">>=", "<<=", "@="
    );

    private static final Set<String> BITWISE = Set.of("|", "&", "^", "<<", ">>");

    private final List<Token> tokens;
    private final ExpressionArena arena;
    private int index;

    public SourceParser(String source) {
        this(source, new ExpressionArena());
    }

    public SourceParser(String source, ExpressionArena arena) {
        this.tokens = new Tokenizer(source).tokenize();
        this.arena = arena;
    }

    /** True if {@code name} can stand as a variable or function name in generated source. */
    public static boolean isIdentifier(String name) {
        if (name == null || name.isEmpty() || KEYWORDS.contains(name)) return false;
        if (!Character.isLetter(name.charAt(0)) && name.charAt(0) != '_') return false;
        return name.chars().allMatch(c -> Character.isLetterOrDigit(c) || c == '_');
    }

    public Ast.Module parseModule() {
        List<Ast.Statement> body = new ArrayList<>();
        while (peek().type() != Token.Type.EOF) {
            if (peek().type() == Token.Type.NEWLINE) {
                advance();
                continue;
            }
            body.addAll(parseStatement());
        }
        return new Ast.Module(body);
    }

    /** Parses text holding one expression (or a bare tuple) and nothing else. */
    public Ast.Expression parseStandaloneExpression() {
        ExprList list = parseExprList();
        while (peek().type() == Token.Type.NEWLINE) advance();
        if (peek().type() != Token.Type.EOF) {
            throw syntaxError("unexpected " + peek().describe() + " after expression", peek());
        }
        return toExpression(list);
    }

    // -----------------------------------------------------------------------
    // Statements
    // -----------------------------------------------------------------------

    private List<Ast.Statement> parseStatement() {
        Token tok = peek();
        if (tok.type() == Token.Type.INDENT) {
            throw syntaxError("unexpected indent", tok);
        }
        if (tok.type() == Token.Type.NAME) {
            switch (tok.text()) {
                case "if":
                    return List.of(parseIf());
                case "for":
                    return List.of(parseFor());
                case "elif":
                case "else":
                    throw syntaxError("'" + tok.text() + "' without a matching 'if'", tok);
                default:
                    if (UNSUPPORTED_STATEMENTS.contains(tok.text())) {
                        throw unsupported("'" + tok.text() + "' statements are not supported", tok);
                    }
            }
        }
        return parseSimpleStatementLine();
    }

    private List<Ast.Statement> parseSimpleStatementLine() {
        List<Ast.Statement> out = new ArrayList<>();
        while (true) {
            out.add(parseSmallStatement());
            if (peek().isOp(";")) {
                advance();
                if (peek().type() == Token.Type.NEWLINE) break;
                continue;
            }
            break;
        }
        expectNewline();
        return out;
    }

    private Ast.Statement parseSmallStatement() {
        Token start = peek();
        if (start.isName("pass")) {
            advance();
            return new Ast.Pass(start.line());
        }
        if (start.type() == Token.Type.NAME && UNSUPPORTED_STATEMENTS.contains(start.text())) {
            throw unsupported("'" + start.text() + "' statements are not supported", start);
        }

        ExprList first = parseExprList();
        Token next = peek();
        if (next.isOp("=")) {
            if (first.tuple || !(first.items.get(0) instanceof Ast.VariableRef)) {
                throw unsupported("Assignment to non-simple targets is not supported", start);
            }
            advance();
            ExprList value = parseExprList();
            if (peek().isOp("=")) {
                throw unsupported("Assignment to non-simple targets is not supported", start);
            }
            String target = ((Ast.VariableRef) first.items.get(0)).name();
            return new Ast.Assign(start.line(), target, toExpression(value));
        }
        if (next.type() == Token.Type.OP && AUGMENTED.contains(next.text())) {
            throw unsupported("Augmented assignment ('" + next.text() + "') is not supported", next);
        }
        if (next.isOp(":")) {
            throw unsupported("Annotated assignments are not supported", next);
        }
        return new Ast.ExpressionStatement(start.line(), toExpression(first));
    }

    private Ast.IfStatement parseIf() {
        Token kw = advance(); // 'if' or 'elif'
        Ast.Expression test = parseExpression();
        expectOp(":");
        List<Ast.Statement> body = parseBlock();
        List<Ast.Statement> orelse = new ArrayList<>();
        if (peek().isName("elif")) {
            orelse.add(parseIf());
        } else if (peek().isName("else")) {
            advance();
            expectOp(":");
            orelse = parseBlock();
        }
        return new Ast.IfStatement(kw.line(), test, body, orelse);
    }

    private Ast.ForStatement parseFor() {
        Token kw = advance();
        Token target = peek();
        if (target.type() != Token.Type.NAME || KEYWORDS.contains(target.text())
                || !peekAt(1).isName("in")) {
            throw unsupported("For-loop targets other than a simple name are not supported", kw);
        }
        advance();
        advance(); // 'in'
        Ast.Expression iterable = toExpression(parseExprList());
        expectOp(":");
        List<Ast.Statement> body = parseBlock();
        if (peek().isName("else")) {
            throw unsupported("For-loop else clauses are not supported", peek());
        }
        return new Ast.ForStatement(kw.line(), target.text(), iterable, body);
    }

    /** Block after ':' - either an indented suite or simple statements on the same line. */
    private List<Ast.Statement> parseBlock() {
        if (peek().type() != Token.Type.NEWLINE) {
            return parseSimpleStatementLine();
        }
        advance();
        if (peek().type() != Token.Type.INDENT) {
            throw syntaxError("expected an indented block", peek());
        }
        advance();
        List<Ast.Statement> body = new ArrayList<>();
        while (peek().type() != Token.Type.DEDENT && peek().type() != Token.Type.EOF) {
            body.addAll(parseStatement());
        }
        if (peek().type() == Token.Type.DEDENT) advance();
        return body;
    }

    // -----------------------------------------------------------------------
    // Expressions
    // -----------------------------------------------------------------------

    private static final class ExprList {
        final List<Ast.Expression> items = new ArrayList<>();
        boolean tuple;
    }

    private ExprList parseExprList() {
        ExprList list = new ExprList();
        list.items.add(parseExpression());
        while (peek().isOp(",")) {
            advance();
            list.tuple = true;
            if (!canStartExpression(peek())) break;
            list.items.add(parseExpression());
        }
        return list;
    }

    private Ast.Expression toExpression(ExprList list) {
        if (!list.tuple) return list.items.get(0);
        return tupleLiteral(list.items, peek());
    }

    private Ast.Expression parseExpression() {
        Token start = peek();
        if (start.isName("lambda")) {
            throw unsupported("Lambda expressions are not supported", start);
        }
        Ast.Expression expr = parseComparison();
        Token next = peek();
        if (next.isName("and") || next.isName("or")) {
            throw unsupported("Boolean operators ('and', 'or', 'not') are not supported", next);
        }
        if (next.isName("if")) {
            throw unsupported("Conditional expressions are not supported", next);
        }
        if (next.isOp(":=")) {
            throw unsupported("Assignment expressions are not supported", next);
        }
        return expr;
    }

    private Ast.Expression parseComparison() {
        Ast.Expression left = parseArith();
        ComparisonOperator op = comparisonAt(peek());
        if (op == null) return left;
        advance();
        Ast.Expression right = parseArith();
        Token next = peek();
        if (comparisonAt(next) != null) {
            throw unsupported("Chained comparisons are not supported", next);
        }
        return new Ast.CompareOp(arena.nextSlot(), op, left, right);
    }

    private ComparisonOperator comparisonAt(Token tok) {
        if (tok.isName("in") || tok.isName("is") || (tok.isName("not") && peekAt(1).isName("in"))) {
            throw unsupported("Operator '" + tok.text() + "' is not supported", tok);
        }
        return tok.type() == Token.Type.OP ? ComparisonOperator.fromSymbol(tok.text()) : null;
    }

    private Ast.Expression parseArith() {
        Ast.Expression left = parseTerm();
        while (true) {
            Token tok = peek();
            if (tok.isOp("+") || tok.isOp("-")) {
                advance();
                Ast.Expression right = parseTerm();
                left = new Ast.BinaryOp(arena.nextSlot(), ArithmeticOperator.fromSymbol(tok.text()), left, right);
            } else if (tok.type() == Token.Type.OP && BITWISE.contains(tok.text())) {
                throw unsupported("Operator '" + tok.text() + "' is not supported", tok);
            } else {
                return left;
            }
        }
    }

    private Ast.Expression parseTerm() {
        Ast.Expression left = parseFactor();
        while (true) {
            Token tok = peek();
            if (tok.isOp("*") || tok.isOp("/")) {
                advance();
                Ast.Expression right = parseFactor();
                left = new Ast.BinaryOp(arena.nextSlot(), ArithmeticOperator.fromSymbol(tok.text()), left, right);
            } else if (tok.isOp("%") || tok.isOp("//") || tok.isOp("@")) {
                throw unsupported("Operator '" + tok.text() + "' is not supported", tok);
            } else {
                return left;
            }
        }
    }

    private Ast.Expression parseFactor() {
        Token tok = peek();
        if (tok.isOp("-") || tok.isOp("+")) {
            advance();
            Ast.Expression operand = parseFactor();
            if (operand instanceof Ast.Literal && ((Ast.Literal) operand).isNumeric()) {
                return new Ast.Literal(arena.nextSlot(), tok.text() + ((Ast.Literal) operand).text());
            }
            throw unsupported("Unary operator '" + tok.text() + "' is only supported on numeric literals", tok);
        }
        if (tok.isOp("~")) {
            throw unsupported("Operator '~' is not supported", tok);
        }
        if (tok.isName("not")) {
            throw unsupported("Boolean operators ('and', 'or', 'not') are not supported", tok);
        }
        if (tok.isName("await")) {
            throw unsupported("'await' expressions are not supported", tok);
        }
        Ast.Expression base = parsePostfix();
        if (peek().isOp("**")) {
            throw unsupported("Operator '**' is not supported", peek());
        }
        return base;
    }

    private Ast.Expression parsePostfix() {
        Ast.Expression expr = parseAtom();
        while (true) {
            Token tok = peek();
            if (tok.isOp("(")) {
                if (!(expr instanceof Ast.VariableRef)) {
                    throw unsupported("Only calls to plain function names are supported", tok);
                }
                List<Ast.Expression> args = parseCallArgs();
                expr = new Ast.Call(arena.nextSlot(), ((Ast.VariableRef) expr).name(), args);
            } else if (tok.isOp(".")) {
                throw unsupported("Attribute access is not supported", tok);
            } else if (tok.isOp("[")) {
                throw unsupported("Subscript expressions are not supported", tok);
            } else {
                return expr;
            }
        }
    }

    private List<Ast.Expression> parseCallArgs() {
        advance(); // '('
        List<Ast.Expression> args = new ArrayList<>();
        while (!peek().isOp(")")) {
            Token tok = peek();
            if (tok.isOp("*") || tok.isOp("**")) {
                throw unsupported("Starred arguments are not supported", tok);
            }
            if (tok.type() == Token.Type.NAME && peekAt(1).isOp("=")) {
                throw unsupported("Keyword arguments are not yet supported", tok);
            }
            args.add(parseExpression());
            rejectComprehension();
            if (!peek().isOp(",")) break;
            advance();
        }
        expectOp(")");
        return args;
    }

    private Ast.Expression parseAtom() {
        Token tok = peek();
        switch (tok.type()) {
            case NUMBER:
                advance();
                return numberLiteral(tok);
            case STRING:
                return stringLiteral();
            case NAME:
                return nameAtom(tok);
            case OP:
                switch (tok.text()) {
                    case "(":
                        return parenthesized();
                    case "[":
                        return listDisplay();
                    case "{":
                        return braceDisplay();
                    case "...":
                        throw unsupported("Ellipsis is not supported", tok);
                    default:
                        throw syntaxError("invalid syntax near " + tok.describe(), tok);
                }
            default:
                throw syntaxError("invalid syntax near " + tok.describe(), tok);
        }
    }

    private Ast.Expression nameAtom(Token tok) {
        advance();
        switch (tok.text()) {
            case "True":
            case "False":
            case "None":
                return new Ast.Literal(arena.nextSlot(), tok.text());
            case "yield":
                throw unsupported("'yield' expressions are not supported", tok);
            default:
                if (KEYWORDS.contains(tok.text())) {
                    throw syntaxError("invalid syntax near " + tok.describe(), tok);
                }
                return new Ast.VariableRef(arena.nextSlot(), tok.text());
        }
    }

    private Ast.Expression numberLiteral(Token tok) {
        String text = tok.text();
        if (text.endsWith("j") || text.endsWith("J")) {
            throw unsupported("Complex literals are not supported", tok);
        }
        try {
            String canonical = PyLiterals.isFloatToken(text)
                    ? PyLiterals.canonicalFloat(text)
                    : PyLiterals.canonicalInt(text);
            return new Ast.Literal(arena.nextSlot(), canonical);
        } catch (IllegalArgumentException e) {
            throw syntaxError(e.getMessage(), tok);
        }
    }

    /** Adjacent string tokens concatenate into one constant. */
    private Ast.Expression stringLiteral() {
        StringBuilder value = new StringBuilder();
        while (peek().type() == Token.Type.STRING) {
            Token tok = advance();
            String prefix = PyLiterals.stringPrefix(tok.text());
            if (prefix.indexOf('f') >= 0) {
                throw unsupported("f-strings are not supported", tok);
            }
            if (prefix.indexOf('b') >= 0) {
                throw unsupported("Bytes literals are not supported", tok);
            }
            try {
                value.append(PyLiterals.decodeString(tok.text()));
            } catch (IllegalArgumentException e) {
                throw syntaxError(e.getMessage(), tok);
            }
        }
        return new Ast.Literal(arena.nextSlot(), PyLiterals.stringRepr(value.toString()));
    }

    private Ast.Expression parenthesized() {
        Token open = advance();
        if (peek().isOp(")")) {
            advance();
            return new Ast.Literal(arena.nextSlot(), "()");
        }
        Ast.Expression first = parseExpression();
        rejectComprehension();
        if (peek().isOp(")")) {
            advance();
            return first;
        }
        List<Ast.Expression> items = new ArrayList<>();
        items.add(first);
        while (peek().isOp(",")) {
            advance();
            if (peek().isOp(")")) break;
            items.add(parseExpression());
        }
        expectOp(")");
        return tupleLiteral(items, open);
    }

    private Ast.Expression listDisplay() {
        Token open = advance();
        List<Ast.Expression> items = new ArrayList<>();
        while (!peek().isOp("]")) {
            items.add(parseExpression());
            rejectComprehension();
            if (!peek().isOp(",")) break;
            advance();
        }
        expectOp("]");
        return new Ast.Literal(arena.nextSlot(), "[" + joinLiterals(items, open) + "]");
    }

    private Ast.Expression braceDisplay() {
        Token open = advance();
        if (peek().isOp("}")) {
            advance();
            return new Ast.Literal(arena.nextSlot(), "{}");
        }
        if (peek().isOp("**") || peek().isOp("*")) {
            throw unsupported("Unpacking in displays is not supported", peek());
        }
        Ast.Expression first = parseExpression();
        if (peek().isOp(":")) {
            List<String> entries = new ArrayList<>();
            Ast.Expression key = first;
            while (true) {
                expectOp(":");
                Ast.Expression value = parseExpression();
                rejectComprehension();
                entries.add(literalText(key, open) + ": " + literalText(value, open));
                if (!peek().isOp(",")) break;
                advance();
                if (peek().isOp("}")) break;
                if (peek().isOp("**")) {
                    throw unsupported("Unpacking in displays is not supported", peek());
                }
                key = parseExpression();
            }
            expectOp("}");
            return new Ast.Literal(arena.nextSlot(), "{" + String.join(", ", entries) + "}");
        }
        rejectComprehension();
        List<Ast.Expression> items = new ArrayList<>();
        items.add(first);
        while (peek().isOp(",")) {
            advance();
            if (peek().isOp("}")) break;
            items.add(parseExpression());
        }
        expectOp("}");
        return new Ast.Literal(arena.nextSlot(), "{" + joinLiterals(items, open) + "}");
    }

    private Ast.Literal tupleLiteral(List<Ast.Expression> items, Token at) {
        String joined = joinLiterals(items, at);
        String text = items.size() == 1 ? "(" + joined + ",)" : "(" + joined + ")";
        return new Ast.Literal(arena.nextSlot(), text);
    }

    private String joinLiterals(List<Ast.Expression> items, Token at) {
        return items.stream().map(e -> literalText(e, at)).collect(Collectors.joining(", "));
    }

    private String literalText(Ast.Expression expr, Token at) {
        if (!(expr instanceof Ast.Literal)) {
            throw unsupported("Collection displays may only contain literal values", at);
        }
        return ((Ast.Literal) expr).text();
    }

    private void rejectComprehension() {
        if (peek().isName("for") || peek().isName("async")) {
            throw unsupported("Comprehensions are not supported", peek());
        }
    }

    private static boolean canStartExpression(Token tok) {
        switch (tok.type()) {
            case NUMBER:
            case STRING:
                return true;
            case NAME:
                return !KEYWORDS.contains(tok.text())
                        || Set.of("True", "False", "None", "not", "lambda", "await", "yield").contains(tok.text());
            case OP:
                return Set.of("(", "[", "{", "-", "+", "~", "...").contains(tok.text());
            default:
                return false;
        }
    }

    // -----------------------------------------------------------------------
    // Token helpers
    // -----------------------------------------------------------------------

    private Token peek() {
        return tokens.get(index);
    }

    private Token peekAt(int offset) {
        return tokens.get(Math.min(index + offset, tokens.size() - 1));
    }

    private Token advance() {
        Token tok = tokens.get(index);
        if (index < tokens.size() - 1) index++;
        return tok;
    }

    private void expectOp(String op) {
        if (!peek().isOp(op)) {
            throw syntaxError("expected '" + op + "' but found " + peek().describe(), peek());
        }
        advance();
    }

    private void expectNewline() {
        Token tok = peek();
        if (tok.type() == Token.Type.NEWLINE) {
            advance();
        } else if (tok.type() != Token.Type.EOF && tok.type() != Token.Type.DEDENT) {
            throw syntaxError("invalid syntax near " + tok.describe(), tok);
        }
    }

    private static SourceSyntaxException syntaxError(String message, Token at) {
        return new SourceSyntaxException(message + " (line " + at.line() + ")");
    }

    private static UnsupportedSyntaxException unsupported(String message, Token at) {
        return new UnsupportedSyntaxException(message, at.line());
    }
}
