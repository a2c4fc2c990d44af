import arg.Arg;
import backend.CodeGen;
import exception.SyntaxException;
import frontend.lexer.Lexer;
import frontend.lexer.Token;
import frontend.lexer.TokenList;
import frontend.syntax.Ast;
import frontend.syntax.AstPrinter;
import frontend.syntax.Parser;
import util.CenterControl;
import util.FileDealer;

public class PseudoCompiler {

    // lexer -> parser -> code generator, one document per call
    public static String translate(String source) throws SyntaxException {
        TokenList tokenList = Lexer.lex(source);
        if (CenterControl._DUMP_TOKENS) {
            for (Token token : tokenList.tokens) {
                System.err.println(token.lineNum + " " + token);
            }
        }
        Ast ast = new Parser(tokenList).parseAst();
        if (CenterControl._DUMP_AST) {
            System.err.print(AstPrinter.print(ast));
        }
        return new CodeGen().generate(ast);
    }

    public static void main(String[] args) {
        Arg arg = Arg.parse(args);
        CenterControl._DUMP_TOKENS = arg.dumpTokens;
        CenterControl._DUMP_AST = arg.dumpAst;

        String source = FileDealer.readAll(arg.srcFilename);
        if (source.isEmpty()) {
            System.err.println("Error: could not read the file or it is empty.");
            System.exit(1);
        }
        try {
            String code = translate(source);
            String written;
            if (arg.outputGiven) {
                written = FileDealer.outputToFile(code, arg.outFilename) ? arg.outFilename : null;
            } else {
                written = FileDealer.writeOutput(arg.outFilename, code);
            }
            if (written == null) {
                System.err.println("Error: could not write " + arg.outFilename);
                System.exit(1);
            }
            System.out.println("Compilation succeeded. C++ code generated at: " + written);
        } catch (SyntaxException e) {
            System.err.println(e.getMessage());
            System.exit(1);
        }
    }
}
