package frontend.lexer;

import static frontend.lexer.TokenType.*;

/**
 * Lexer for the pseudocode dialect.
 * <p>
 * Never fails: characters that start no known token become single-character
 * {@link TokenType#SYMBOL} tokens and an unterminated string swallows the rest of the input.
 */
public class Lexer {
    private static final String[] DOUBLE_OPERATORS = {"<=", ">=", "==", "!=", "<-"};
    private static final String SINGLE_OPERATORS = "+-*/=<>(),";

    private final String source;
    private final int length;
    private final TokenList tokenList = new TokenList();
    private int pos = 0;
    private int lineNum = 1;

    private Lexer(String source) {
        this.source = source;
        this.length = source.length();
    }

    public static TokenList lex(String source) {
        Lexer lexer = new Lexer(source);
        lexer.run();
        return lexer.tokenList;
    }

    private boolean isSpace(char c) {
        return c == ' ' || c == '\t' || c == '\n' || c == '\r' || c == '\u000B' || c == '\f';
    }

    private boolean isNewline(char c) {
        return c == '\n';
    }

    private boolean isLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private boolean isDigital(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isIdentChar(char c) {
        return isLetter(c) || isDigital(c) || c == '_';
    }

    private void emit(TokenType type, String content, int line) {
        tokenList.append(new Token(type, content, line));
    }

    private void run() {
        while (pos < length) {
            char c = source.charAt(pos);
            if (isSpace(c)) {
                if (isNewline(c)) {
                    lineNum++;
                }
                pos++;
            } else if (c == '/' && pos + 1 < length && source.charAt(pos + 1) == '/') {
                lexComment();
            } else if (isLetter(c)) {
                lexWord();
            } else if (isDigital(c)) {
                lexNumber();
            } else if (c == '"') {
                lexString();
            } else {
                lexOperator();
            }
        }
    }

    // stops before the newline, which is then counted again as whitespace
    private void lexComment() {
        while (pos < length && !isNewline(source.charAt(pos))) {
            pos++;
        }
        lineNum++;
    }

    private void lexWord() {
        int start = pos;
        while (pos < length && isIdentChar(source.charAt(pos))) {
            pos++;
        }
        String word = source.substring(start, pos);
        emit(Keyword.isReserved(word) ? RESERVED : IDENT, word, lineNum);
    }

    private void lexNumber() {
        int start = pos;
        while (pos < length && isDigital(source.charAt(pos))) {
            pos++;
        }
        emit(NUMBER, source.substring(start, pos), lineNum);
    }

    private void lexString() {
        int line = lineNum;
        int start = ++pos;
        while (pos < length && source.charAt(pos) != '"') {
            if (isNewline(source.charAt(pos))) {
                lineNum++;
            }
            pos++;
        }
        emit(STRING, source.substring(start, pos), line);
        if (pos < length) {
            pos++; // closing quote
        }
    }

    private void lexOperator() {
        if (pos + 1 < length) {
            String op = source.substring(pos, pos + 2);
            for (String doubleOp : DOUBLE_OPERATORS) {
                if (doubleOp.equals(op)) {
                    emit(OPERATOR, op, lineNum);
                    pos += 2;
                    return;
                }
            }
        }
        char c = source.charAt(pos);
        emit(SINGLE_OPERATORS.indexOf(c) >= 0 ? OPERATOR : SYMBOL, String.valueOf(c), lineNum);
        pos++;
    }
}
