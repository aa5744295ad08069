package com.plexus.core.ast;

import com.plexus.core.error.SourceSyntaxException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Splits source text into logical-line tokens, emitting INDENT/DEDENT for block structure.
 * Newlines inside brackets and after a trailing backslash do not end a logical line.
 */
public class Tokenizer {

    private static final String[] OPERATORS = {
        "**=", "//=", ">>=", "<<=", "...",
        "->", ":=", "==", "!=", "<=", ">=", "**", "//", "<<", ">>",
        "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=", "@=",
        "+", "-", "*", "/", "%", "@", "<", ">", "=", "(", ")", "[", "]", "{", "}",
        ",", ":", ".", ";", "&", "|", "^", "~"
    };

    private static final Set<String> STRING_PREFIXES = Set.of("", "r", "u", "b", "br", "rb", "f", "fr", "rf");

    private final String src;
    private final List<Token> tokens = new ArrayList<>();
    private final Deque<Integer> indents = new ArrayDeque<>();
    private final Deque<Character> brackets = new ArrayDeque<>();
    private int pos;
    private int line = 1;

    public Tokenizer(String source) {
        this.src = source.replace("\r\n", "\n").replace('\r', '\n');
    }

    /**
     * @throws SourceSyntaxException on an unterminated string, unbalanced bracket, bad
     *         dedent or a character outside the language
     */
    public List<Token> tokenize() {
        indents.push(0);
        boolean atLineStart = true;

        while (pos < src.length()) {
            if (atLineStart && brackets.isEmpty()) {
                atLineStart = false;
                if (handleIndentation()) {
                    atLineStart = true;
                    continue;
                }
            }
            char c = src.charAt(pos);
            if (c == '\n') {
                pos++;
                if (brackets.isEmpty()) {
                    addLogicalNewline();
                    atLineStart = true;
                }
                line++;
            } else if (c == ' ' || c == '\t' || c == '\f') {
                pos++;
            } else if (c == '#') {
                skipComment();
            } else if (c == '\\') {
                if (pos + 1 < src.length() && src.charAt(pos + 1) == '\n') {
                    pos += 2;
                    line++;
                } else {
                    throw error("unexpected character after line continuation character");
                }
            } else if (isStringStart()) {
                readString();
            } else if (isAsciiDigit(c) || (c == '.' && pos + 1 < src.length()
                    && isAsciiDigit(src.charAt(pos + 1)))) {
                readNumber();
            } else if (Character.isLetter(c) || c == '_') {
                readName();
            } else {
                readOperator();
            }
        }

        if (!brackets.isEmpty()) {
            throw error("'" + brackets.peek() + "' was never closed");
        }
        addLogicalNewline();
        while (indents.peek() > 0) {
            indents.pop();
            tokens.add(new Token(Token.Type.DEDENT, "", line));
        }
        tokens.add(new Token(Token.Type.EOF, "", line));
        return tokens;
    }

    /** Returns true if the physical line is blank or comment-only and was consumed. */
    private boolean handleIndentation() {
        int col = 0;
        int p = pos;
        while (p < src.length()) {
            char c = src.charAt(p);
            if (c == ' ') col++;
            else if (c == '\t') col = (col / 8 + 1) * 8;
            else if (c == '\f') col = 0;
            else break;
            p++;
        }
        if (p >= src.length()) {
            pos = p;
            return true;
        }
        char c = src.charAt(p);
        if (c == '\n' || c == '#') {
            pos = p;
            if (c == '#') skipComment();
            if (pos < src.length()) {
                pos++;
                line++;
            }
            return true;
        }
        pos = p;
        if (col > indents.peek()) {
            indents.push(col);
            tokens.add(new Token(Token.Type.INDENT, "", line));
        } else {
            while (col < indents.peek()) {
                indents.pop();
                tokens.add(new Token(Token.Type.DEDENT, "", line));
            }
            if (col != indents.peek()) {
                throw error("unindent does not match any outer indentation level");
            }
        }
        return false;
    }

    private void addLogicalNewline() {
        if (tokens.isEmpty()) return;
        Token.Type last = tokens.get(tokens.size() - 1).type();
        if (last == Token.Type.NEWLINE || last == Token.Type.INDENT || last == Token.Type.DEDENT) return;
        tokens.add(new Token(Token.Type.NEWLINE, "", line));
    }

    private void skipComment() {
        while (pos < src.length() && src.charAt(pos) != '\n') pos++;
    }

    private boolean isStringStart() {
        int p = pos;
        while (p < src.length() && p - pos < 2 && "rRbBuUfF".indexOf(src.charAt(p)) >= 0) p++;
        return p < src.length() && (src.charAt(p) == '\'' || src.charAt(p) == '"')
                && STRING_PREFIXES.contains(src.substring(pos, p).toLowerCase(Locale.ROOT));
    }

    private void readString() {
        int start = pos;
        int startLine = line;
        while (src.charAt(pos) != '\'' && src.charAt(pos) != '"') pos++;
        char q = src.charAt(pos);
        boolean triple = src.startsWith(String.valueOf(q).repeat(3), pos);
        pos += triple ? 3 : 1;
        while (true) {
            if (pos >= src.length()) {
                line = startLine;
                throw error(triple ? "unterminated triple-quoted string literal" : "unterminated string literal");
            }
            char c = src.charAt(pos);
            if (c == '\\') {
                if (pos + 1 < src.length() && src.charAt(pos + 1) == '\n') line++;
                pos += 2;
                continue;
            }
            if (c == '\n') {
                if (!triple) {
                    line = startLine;
                    throw error("unterminated string literal");
                }
                line++;
            }
            if (c == q && (!triple || src.startsWith(String.valueOf(q).repeat(3), pos))) {
                pos += triple ? 3 : 1;
                break;
            }
            pos++;
        }
        tokens.add(new Token(Token.Type.STRING, src.substring(start, pos), startLine));
    }

    private void readNumber() {
        int start = pos;
        if (src.charAt(pos) == '0' && pos + 1 < src.length()
                && "xXoObB".indexOf(src.charAt(pos + 1)) >= 0) {
            pos += 2;
            while (pos < src.length() && (isAsciiAlnum(src.charAt(pos)) || src.charAt(pos) == '_')) {
                pos++;
            }
        } else {
            while (pos < src.length() && (isAsciiDigit(src.charAt(pos)) || src.charAt(pos) == '_')) pos++;
            if (pos < src.length() && src.charAt(pos) == '.') {
                pos++;
                while (pos < src.length() && (isAsciiDigit(src.charAt(pos)) || src.charAt(pos) == '_')) pos++;
            }
            if (pos < src.length() && (src.charAt(pos) == 'e' || src.charAt(pos) == 'E')) {
                int save = pos;
                pos++;
                if (pos < src.length() && (src.charAt(pos) == '+' || src.charAt(pos) == '-')) pos++;
                if (pos < src.length() && isAsciiDigit(src.charAt(pos))) {
                    while (pos < src.length() && (isAsciiDigit(src.charAt(pos)) || src.charAt(pos) == '_')) pos++;
                } else {
                    pos = save;
                }
            }
            if (pos < src.length() && (src.charAt(pos) == 'j' || src.charAt(pos) == 'J')) pos++;
        }
        if (pos < src.length() && (Character.isLetter(src.charAt(pos)) || src.charAt(pos) == '_')) {
            throw error("invalid decimal literal");
        }
        tokens.add(new Token(Token.Type.NUMBER, src.substring(start, pos), line));
    }

    private void readName() {
        int start = pos;
        while (pos < src.length() && (Character.isLetterOrDigit(src.charAt(pos)) || src.charAt(pos) == '_')) pos++;
        tokens.add(new Token(Token.Type.NAME, src.substring(start, pos), line));
    }

    private void readOperator() {
        for (String op : OPERATORS) {
            if (src.startsWith(op, pos)) {
                trackBracket(op);
                pos += op.length();
                tokens.add(new Token(Token.Type.OP, op, line));
                return;
            }
        }
        throw error("invalid character '" + src.charAt(pos) + "'");
    }

    private void trackBracket(String op) {
        switch (op) {
            case "(", "[", "{" -> brackets.push(op.charAt(0));
            case ")", "]", "}" -> {
                char open = op.equals(")") ? '(' : op.equals("]") ? '[' : '{';
                if (brackets.isEmpty()) {
                    throw error("unmatched '" + op + "'");
                }
                if (brackets.peek() != open) {
                    throw error("closing parenthesis '" + op + "' does not match opening parenthesis '"
                            + brackets.peek() + "'");
                }
                brackets.pop();
            }
            default -> { }
        }
    }

    private static boolean isAsciiDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isAsciiAlnum(char c) {
        return isAsciiDigit(c) || (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private SourceSyntaxException error(String message) {
        return new SourceSyntaxException(message + " (line " + line + ")");
    }
}
