package com.viffx.Expr.Lexer;

import com.viffx.Expr.Symbols.Token;
import org.junit.Test;

import java.io.IOException;
import java.io.StringReader;
import java.util.List;

import static com.viffx.Expr.Symbols.TokenType.*;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.Assert.assertEquals;

public class TaggedTokenLexerTest {

    private static List<Token> scan(String text) throws IOException {
        return new TaggedTokenLexer(new StringReader(text)).tokenize();
    }

    @Test
    public void readsPairsWithTheirPositions() throws IOException {
        assertThat(scan("<2, NUM> <+, PLUS>\n<(, LPAREN>"), is(List.of(
                new Token(NUM, "2", 1, 1),
                new Token(PLUS, "+", 1, 10),
                new Token(LPAREN, "(", 2, 1),
                Token.endOfInput(2, 12))));
    }

    @Test
    public void typeTagsAreCaseInsensitive() throws IOException {
        assertEquals(STAR, scan("<*, star>").get(0).type());
    }

    @Test
    public void unknownTypeIsInvalid() throws IOException {
        Token token = scan("<-, MINUS>").get(0);
        assertEquals(INVALID, token.type());
        assertEquals("<-, MINUS>", token.lexeme());
    }

    @Test
    public void unterminatedPairIsInvalid() throws IOException {
        List<Token> tokens = scan("<2, NUM");
        assertEquals(INVALID, tokens.get(0).type());
        assertEquals("<2, NUM", tokens.get(0).lexeme());
        assertEquals(2, tokens.size());
    }

    @Test
    public void pairWithoutCommaIsInvalid() throws IOException {
        assertEquals(INVALID, scan("<2 NUM>").get(0).type());
    }

    @Test
    public void bareTextIsInvalid() throws IOException {
        Token token = scan("<1, NUM> oops <2, NUM>").get(1);
        assertEquals(new Token(INVALID, "oops", 1, 10), token);
    }

    @Test
    public void emptyInputIsJustEndOfInput() throws IOException {
        assertThat(scan(""), is(List.of(Token.endOfInput(1, 1))));
    }

    @Test
    public void lexemeMustSpellItsType() throws IOException {
        List<Token> tokens = scan("<abc, NUM> <-, PLUS> <\u0663, NUM> <+, STAR>");
        assertEquals(new Token(INVALID, "<abc, NUM>", 1, 1), tokens.get(0));
        assertEquals(new Token(INVALID, "<-, PLUS>", 1, 12), tokens.get(1));
        assertEquals(INVALID, tokens.get(2).type());
        assertEquals(INVALID, tokens.get(3).type());
    }

    @Test
    public void multiDigitNumbersAreAccepted() throws IOException {
        assertEquals(new Token(NUM, "1024", 1, 1), scan("<1024, NUM>").get(0));
    }
}
