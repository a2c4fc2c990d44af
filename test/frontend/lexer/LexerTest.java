package frontend.lexer;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class LexerTest {

    private static List<String> contents(TokenList tokenList) {
        return tokenList.tokens.stream().map(Token::getContent).collect(Collectors.toList());
    }

    private static List<TokenType> types(TokenList tokenList) {
        return tokenList.tokens.stream().map(Token::getType).collect(Collectors.toList());
    }

    @Test
    void reservedWordsAreCaseSensitive() {
        TokenList tokens = Lexer.lex("Algoritmo algoritmo ALGORITMO FinAlgoritmo");
        assertEquals(List.of(TokenType.RESERVED, TokenType.IDENT, TokenType.IDENT, TokenType.RESERVED), types(tokens));
    }

    @Test
    void everyKeywordLexesAsReserved() {
        for (Keyword keyword : Keyword.values()) {
            TokenList tokens = Lexer.lex(keyword.getText());
            assertEquals(1, tokens.size(), keyword.getText());
            assertEquals(TokenType.RESERVED, tokens.get().getType(), keyword.getText());
        }
    }

    @Test
    void identifiersTakeDigitsAndUnderscore() {
        TokenList tokens = Lexer.lex("total_2 x1");
        assertEquals(List.of("total_2", "x1"), contents(tokens));
        assertEquals(List.of(TokenType.IDENT, TokenType.IDENT), types(tokens));
    }

    @Test
    void identifierCannotStartWithUnderscore() {
        TokenList tokens = Lexer.lex("_a");
        assertEquals(List.of("_", "a"), contents(tokens));
        assertEquals(List.of(TokenType.SYMBOL, TokenType.IDENT), types(tokens));
    }

    @Test
    void numbersAreDigitRunsOnly() {
        TokenList tokens = Lexer.lex("123 4.5 -7");
        assertEquals(List.of("123", "4", ".", "5", "-", "7"), contents(tokens));
        assertEquals(List.of(TokenType.NUMBER, TokenType.NUMBER, TokenType.SYMBOL,
                TokenType.NUMBER, TokenType.OPERATOR, TokenType.NUMBER), types(tokens));
    }

    @Test
    void stringContentExcludesQuotes() {
        TokenList tokens = Lexer.lex("Escribir \"Hola mundo\"");
        assertEquals(2, tokens.size());
        Token str = tokens.tokens.get(1);
        assertEquals(TokenType.STRING, str.getType());
        assertEquals("Hola mundo", str.getContent());
    }

    @Test
    void unterminatedStringAbsorbsRestOfInput() {
        TokenList tokens = Lexer.lex("Escribir \"sin cerrar\nFinAlgoritmo");
        assertEquals(2, tokens.size());
        Token str = tokens.tokens.get(1);
        assertEquals(TokenType.STRING, str.getType());
        assertEquals("sin cerrar\nFinAlgoritmo", str.getContent());
    }

    @Test
    void twoCharOperatorsWinOverSingle() {
        TokenList tokens = Lexer.lex("x <- 1 <= 2 >= 3 == 4 != 5");
        assertEquals(List.of("x", "<-", "1", "<=", "2", ">=", "3", "==", "4", "!=", "5"), contents(tokens));
        assertEquals(TokenType.OPERATOR, tokens.tokens.get(1).getType());
    }

    @Test
    void singleCharOperatorsAndSymbols() {
        TokenList tokens = Lexer.lex("+-*/=<>(),;:!");
        assertEquals(13, tokens.size());
        for (int i = 0; i < 10; i++) {
            assertEquals(TokenType.OPERATOR, tokens.tokens.get(i).getType(), tokens.tokens.get(i).getContent());
        }
        for (int i = 10; i < 13; i++) {
            assertEquals(TokenType.SYMBOL, tokens.tokens.get(i).getType(), tokens.tokens.get(i).getContent());
        }
    }

    @Test
    void nonAsciiLettersBecomeSymbols() {
        TokenList tokens = Lexer.lex("año");
        assertEquals(List.of("a", "ñ", "o"), contents(tokens));
        assertEquals(TokenType.SYMBOL, tokens.tokens.get(1).getType());
    }

    @Test
    void commentIsDropped() {
        TokenList tokens = Lexer.lex("x <- 1 // asignar uno\ny <- 2");
        assertEquals(List.of("x", "<-", "1", "y", "<-", "2"), contents(tokens));
    }

    @Test
    void singleSlashIsOperator() {
        TokenList tokens = Lexer.lex("a / b");
        assertEquals(List.of("a", "/", "b"), contents(tokens));
        assertEquals(TokenType.OPERATOR, tokens.tokens.get(1).getType());
    }

    @Test
    void lineNumbersFollowNewlines() {
        TokenList tokens = Lexer.lex("a\nb\n\nc");
        assertEquals(1, tokens.tokens.get(0).getLineNum());
        assertEquals(2, tokens.tokens.get(1).getLineNum());
        assertEquals(4, tokens.tokens.get(2).getLineNum());
    }

    @Test
    void commentLineIsCountedTwice() {
        TokenList tokens = Lexer.lex("// nota\nx");
        assertEquals(1, tokens.size());
        assertEquals(3, tokens.get().getLineNum());
    }

    @Test
    void stringKeepsLineOfOpeningQuote() {
        TokenList tokens = Lexer.lex("\"a\nb\" c");
        assertEquals(1, tokens.tokens.get(0).getLineNum());
        assertEquals(2, tokens.tokens.get(1).getLineNum());
    }

    @Test
    void emptyAndBlankInputsGiveNoTokens() {
        assertEquals(0, Lexer.lex("").size());
        assertEquals(0, Lexer.lex(" \t\r\n\f").size());
        assertEquals(0, Lexer.lex("// solo comentario").size());
    }

    @Test
    void trailingUnterminatedConstructsTerminate() {
        assertEquals(List.of("<"), contents(Lexer.lex("<")));
        assertEquals(List.of(""), contents(Lexer.lex("\"")));
        assertEquals(List.of("/"), contents(Lexer.lex("/")));
    }
}
