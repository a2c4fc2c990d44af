package frontend.lexer;

import java.util.HashSet;
import java.util.List;

public class Token {
    private final TokenType type;
    public final String content;
    public final int lineNum;

    public Token(final TokenType type, final String content, final int lineNum) {
        this.type = type;
        this.content = content;
        this.lineNum = lineNum;
    }

    public TokenType getType() {
        return this.type;
    }

    public String getContent() {
        return this.content;
    }

    public int getLineNum() {
        return this.lineNum;
    }

    public boolean isOf(TokenType... types) {
        return new HashSet<>(List.of(types)).contains(type);
    }

    // 按原文匹配, 不看类型
    public boolean is(Keyword keyword) {
        return content.equals(keyword.getText());
    }

    @Override
    public String toString() {
        return "<" + type + " " + content + ">";
    }
}
