package frontend.lexer;

public enum TokenType {
    // reserved word, see Keyword
    RESERVED,
    // [A-Za-z][A-Za-z0-9_]*
    IDENT,
    // [0-9]+, integers only
    NUMBER,
    // "..." without the quotes
    STRING,
    // <= >= == != <- and + - * / = < > ( ) ,
    OPERATOR,
    // any other single character
    SYMBOL,
    // end of input sentinel
    UNKNOWN,
    ;
}
