package util;

public class CenterControl {
    // print every token to stderr after lexing
    public static boolean _DUMP_TOKENS = false;
    // print the syntax tree to stderr after parsing
    public static boolean _DUMP_AST = false;

    public static final String TARGET_EXTENSION = ".cpp";
}
