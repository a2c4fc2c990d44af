package backend;

import frontend.syntax.Ast;

import java.util.ArrayList;
import java.util.HashSet;

/**
 * Emits C++ source for an {@link Ast}.
 * <p>
 * Generation is total: an absent node in any slot emits nothing. Each call to
 * {@link #generate(Ast)} starts from a fresh buffer, indentation and declared-name set.
 */
public class CodeGen {

    private static final String INDENT = "    ";

    private StringBuilder out;
    private int indentLevel;
    // 已经声明过的变量, 决定输出声明还是赋值
    private HashSet<String> declaredVars;

    public String generate(Ast ast) {
        out = new StringBuilder();
        indentLevel = 0;
        declaredVars = new HashSet<>();
        genProgram(ast);
        return out.toString();
    }

    private String indent() {
        return INDENT.repeat(indentLevel);
    }

    private void genProgram(Ast ast) {
        if (ast == null) {
            return;
        }
        out.append("#include <iostream>\n");
        out.append("#include <string>\n");
        out.append("using namespace std;\n\n");
        genAlgorithm(ast.getAlgorithm());
    }

    private void genAlgorithm(Ast.Algorithm algorithm) {
        if (algorithm == null) {
            return;
        }
        out.append("int main() {\n");
        indentLevel++;
        genStmts(algorithm.getStmts());
        indentLevel--;
        out.append(indent()).append("return 0;\n");
        out.append("}\n");
    }

    private void genBlock(Ast.Block block) {
        if (block == null) {
            return;
        }
        genStmts(block.getStmts());
    }

    private void genStmts(ArrayList<Ast.Stmt> stmts) {
        for (Ast.Stmt stmt : stmts) {
            genStmt(stmt);
        }
    }

    private void genStmt(Ast.Stmt stmt) {
        if (stmt instanceof Ast.Write) {
            genWrite((Ast.Write) stmt);
        } else if (stmt instanceof Ast.Read) {
            genRead((Ast.Read) stmt);
        } else if (stmt instanceof Ast.If) {
            genIf((Ast.If) stmt);
        } else if (stmt instanceof Ast.For) {
            genFor((Ast.For) stmt);
        } else if (stmt instanceof Ast.While) {
            genWhile((Ast.While) stmt);
        } else if (stmt instanceof Ast.Assign) {
            genAssign((Ast.Assign) stmt);
        }
        // null: skipped token
    }

    private void genWrite(Ast.Write write) {
        out.append(indent()).append("cout << ");
        genExp(write.getExp());
        out.append(" << endl;\n");
    }

    private void genRead(Ast.Read read) {
        out.append(indent()).append("cin >> ");
        genExp(read.getTarget());
        out.append(";\n");
    }

    private void genIf(Ast.If ifStmt) {
        out.append(indent()).append("if (");
        genExp(ifStmt.getCond());
        out.append(") {\n");
        genIndented(ifStmt.getThenBlock());
        out.append(indent()).append("}");
        if (ifStmt.hasElse()) {
            out.append(" else {\n");
            genIndented(ifStmt.getElseBlock());
            out.append(indent()).append("}");
        }
        out.append("\n");
    }

    // for (int i = start; i <= end; i++), bounds inclusive
    private void genFor(Ast.For forStmt) {
        String var = forStmt.getVar();
        out.append(indent()).append("for (int ").append(var).append(" = ");
        genExp(forStmt.getStart());
        out.append("; ").append(var).append(" <= ");
        genExp(forStmt.getEnd());
        out.append("; ").append(var).append("++) {\n");
        genIndented(forStmt.getBody());
        out.append(indent()).append("}\n");
    }

    private void genWhile(Ast.While whileStmt) {
        out.append(indent()).append("while (");
        genExp(whileStmt.getCond());
        out.append(") {\n");
        genIndented(whileStmt.getBody());
        out.append(indent()).append("}\n");
    }

    private void genAssign(Ast.Assign assign) {
        String var = assign.getVar();
        out.append(indent());
        if (declaredVars.add(var)) {
            out.append("int "); // the only type there is
        }
        out.append(var).append(" = ");
        genExp(assign.getValue());
        out.append(";\n");
    }

    private void genIndented(Ast.Block block) {
        indentLevel++;
        genBlock(block);
        indentLevel--;
    }

    private void genExp(Ast.Exp exp) {
        if (exp instanceof Ast.BinaryExp) {
            // operands[0] op[0] operands[1] op[1] ..., left to right
            ArrayList<Ast.Exp> operands = new ArrayList<>();
            ArrayList<String> operators = new ArrayList<>();
            ((Ast.BinaryExp) exp).flatten(operands, operators);
            genExp(operands.get(0));
            for (int i = 0; i < operators.size(); i++) {
                out.append(" ").append(operators.get(i)).append(" ");
                genExp(operands.get(i + 1));
            }
        } else if (exp instanceof Ast.Number) {
            out.append(((Ast.Number) exp).getText());
        } else if (exp instanceof Ast.Str) {
            out.append('"').append(((Ast.Str) exp).getText()).append('"');
        } else if (exp instanceof Ast.Ident) {
            out.append(((Ast.Ident) exp).getName());
        }
        // null and Unrecognized emit nothing
    }
}
