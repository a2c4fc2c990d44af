package frontend.lexer;

import java.util.ArrayList;

public class TokenList {
    private static final boolean ENABLE_DEBUG = false;

    // returned by get/consume once the list is exhausted
    public static final Token EOF = new Token(TokenType.UNKNOWN, "", 0);

    public final ArrayList<Token> tokens = new ArrayList<>();
    private int index = 0;

    public void append(Token token) {
        // System.err.println(token);
        tokens.add(token);
    }

    public boolean hasNext() {
        return index < tokens.size();
    }

    public int size() {
        return tokens.size();
    }

    public int getIndex() {
        return index;
    }

    public Token get() {
        return ahead(0);
    }

    public Token ahead(int count) {
        if (index + count >= tokens.size()) {
            return EOF;
        }
        return tokens.get(index + count);
    }

    // 越界时不前进, 返回 EOF
    public Token consume() {
        if (!hasNext()) {
            return EOF;
        }
        if (ENABLE_DEBUG) {
            System.err.println("consume: " + tokens.get(index));
        }
        return tokens.get(index++);
    }

    public boolean match(Keyword keyword) {
        return get().is(keyword);
    }

    // consume the current token only if it is the given keyword
    public boolean consumeIf(Keyword keyword) {
        if (match(keyword)) {
            consume();
            return true;
        }
        return false;
    }
}
