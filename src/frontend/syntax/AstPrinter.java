package frontend.syntax;

import java.util.ArrayList;

/**
 * Renders an {@link Ast} as an indented outline, one node per line, for debugging dumps.
 */
public class AstPrinter {
    private final StringBuilder sb = new StringBuilder();
    private int depth = 0;

    public static String print(Ast ast) {
        AstPrinter printer = new AstPrinter();
        printer.line("PROGRAM");
        if (ast != null && ast.getAlgorithm() != null) {
            printer.nested(() -> printer.printAlgorithm(ast.getAlgorithm()));
        }
        return printer.sb.toString();
    }

    private void line(String text) {
        sb.append("  ".repeat(depth)).append(text).append('\n');
    }

    private void nested(Runnable body) {
        depth++;
        body.run();
        depth--;
    }

    private void printAlgorithm(Ast.Algorithm algorithm) {
        line("ALGORITHM " + algorithm.getName());
        nested(() -> printStmts(algorithm.getStmts()));
    }

    private void printBlock(Ast.Block block) {
        line("BLOCK");
        nested(() -> printStmts(block.getStmts()));
    }

    private void printStmts(ArrayList<Ast.Stmt> stmts) {
        for (Ast.Stmt stmt : stmts) {
            if (stmt != null) {
                printStmt(stmt);
            }
        }
    }

    private void printStmt(Ast.Stmt stmt) {
        if (stmt instanceof Ast.Write) {
            line("WRITE");
            nested(() -> printExp(((Ast.Write) stmt).getExp()));
        } else if (stmt instanceof Ast.Read) {
            line("READ");
            nested(() -> printExp(((Ast.Read) stmt).getTarget()));
        } else if (stmt instanceof Ast.If) {
            Ast.If ifStmt = (Ast.If) stmt;
            line("IF");
            nested(() -> {
                printExp(ifStmt.getCond());
                printBlock(ifStmt.getThenBlock());
                if (ifStmt.hasElse()) {
                    printBlock(ifStmt.getElseBlock());
                }
            });
        } else if (stmt instanceof Ast.For) {
            Ast.For forStmt = (Ast.For) stmt;
            line("FOR " + forStmt.getVar());
            nested(() -> {
                printExp(forStmt.getStart());
                if (forStmt.getEnd() != null) {
                    printExp(forStmt.getEnd());
                }
                printBlock(forStmt.getBody());
            });
        } else if (stmt instanceof Ast.While) {
            Ast.While whileStmt = (Ast.While) stmt;
            line("WHILE");
            nested(() -> {
                printExp(whileStmt.getCond());
                printBlock(whileStmt.getBody());
            });
        } else if (stmt instanceof Ast.Assign) {
            Ast.Assign assign = (Ast.Assign) stmt;
            line("ASSIGN " + assign.getVar());
            nested(() -> printExp(assign.getValue()));
        }
    }

    private void printExp(Ast.Exp exp) {
        if (exp instanceof Ast.BinaryExp) {
            // a left-deep chain prints as one node listing its operators in order
            ArrayList<Ast.Exp> operands = new ArrayList<>();
            ArrayList<String> operators = new ArrayList<>();
            ((Ast.BinaryExp) exp).flatten(operands, operators);
            line("BINARY_OP " + String.join(" ", operators));
            nested(() -> {
                for (Ast.Exp operand : operands) {
                    printExp(operand);
                }
            });
        } else if (exp instanceof Ast.Number) {
            line("NUMBER " + ((Ast.Number) exp).getText());
        } else if (exp instanceof Ast.Str) {
            line("STRING \"" + ((Ast.Str) exp).getText() + "\"");
        } else if (exp instanceof Ast.Ident) {
            line("IDENTIFIER " + ((Ast.Ident) exp).getName());
        } else if (exp instanceof Ast.Unrecognized) {
            line("UNRECOGNIZED " + ((Ast.Unrecognized) exp).getText());
        }
    }
}
