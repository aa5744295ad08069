package com.plexus.core.ast;

import com.plexus.core.error.SourceSyntaxException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static com.plexus.core.ast.Token.Type.*;
import static org.junit.jupiter.api.Assertions.*;

class TokenizerTest {

    private static List<Token.Type> types(String source) {
        return new Tokenizer(source).tokenize().stream().map(Token::type).collect(Collectors.toList());
    }

    @Test
    void indentedBlockProducesIndentAndDedent() {
        assertEquals(List.of(NAME, NAME, OP, NEWLINE, INDENT, NAME, OP, NUMBER, NEWLINE, DEDENT,
                        NAME, OP, NUMBER, NEWLINE, EOF),
                types("if x:\n    y = 1\nz = 2"));
    }

    @Test
    void newlinesInsideBracketsAreJoined() {
        assertEquals(List.of(NAME, OP, OP, NUMBER, OP, NUMBER, OP, NEWLINE, EOF),
                types("x = [1,\n     2]"));
    }

    @Test
    void blankAndCommentLinesAreSkipped() {
        assertEquals(List.of(NAME, OP, NUMBER, NEWLINE, NAME, OP, NUMBER, NEWLINE, EOF),
                types("x = 1\n\n   # note\ny = 2  # trailing\n   "));
    }

    @Test
    void backslashContinuesLine() {
        List<Token> tokens = new Tokenizer("x = 1 + \\\n    2\ny = 3").tokenize();
        assertEquals(2, tokens.stream().filter(t -> t.type() == NEWLINE).count());
        assertEquals(3, tokens.stream().filter(t -> t.isName("y")).findFirst().orElseThrow().line());
    }

    @Test
    void longestOperatorWins() {
        List<Token> tokens = new Tokenizer("a >= b").tokenize();
        assertTrue(tokens.get(1).isOp(">="));
    }

    @Test
    void stringTokensKeepPrefixAndQuotes() {
        List<Token> tokens = new Tokenizer("s = r'\\d' + '''a\nb'''").tokenize();
        assertEquals("r'\\d'", tokens.get(2).text());
        assertEquals("'''a\nb'''", tokens.get(4).text());
    }

    @Test
    void lexicalErrorsCarryLineNumber() {
        SourceSyntaxException unterminated = assertThrows(SourceSyntaxException.class,
                () -> new Tokenizer("x = 1\nmessage = 'missing quote").tokenize());
        assertTrue(unterminated.getMessage().contains("(line 2)"));

        assertThrows(SourceSyntaxException.class, () -> new Tokenizer("if x:\n    y = 1\n  z = 2").tokenize());
        assertThrows(SourceSyntaxException.class, () -> new Tokenizer("x = (1, 2").tokenize());
        assertThrows(SourceSyntaxException.class, () -> new Tokenizer("x = 1)").tokenize());
        assertThrows(SourceSyntaxException.class, () -> new Tokenizer("x = $").tokenize());
    }

    @Test
    void onlyAsciiDigitsStartNumbers() {
        assertThrows(SourceSyntaxException.class, () -> new Tokenizer("x = \u0663").tokenize());
        assertThrows(SourceSyntaxException.class, () -> new Tokenizer("x = 0x\u0663").tokenize());
        assertEquals(List.of(NAME, OP, NAME, NEWLINE, EOF), types("x = a\u0663"));
    }

    @Test
    void stringPrefixMustBeAValidCombination() {
        assertEquals(List.of(STRING, NEWLINE, EOF), types("u'x'"));
        assertEquals(List.of(STRING, NEWLINE, EOF), types("Rb'x'"));
        assertEquals(List.of(STRING, NEWLINE, EOF), types("fR'x'"));
        assertEquals(List.of(NAME, STRING, NEWLINE, EOF), types("uu'x'"));
        assertEquals(List.of(NAME, STRING, NEWLINE, EOF), types("bu'x'"));
        assertEquals(List.of(NAME, STRING, NEWLINE, EOF), types("ur'x'"));
    }
}
