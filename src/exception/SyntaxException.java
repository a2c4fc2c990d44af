package exception;

/**
 * 语法分析阶段无法恢复的内部错误, 只带消息不带位置
 */
public class SyntaxException extends Exception {
    public SyntaxException() { super(); }

    public SyntaxException(String message) { super(message); }
}
