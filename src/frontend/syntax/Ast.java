package frontend.syntax;

import java.util.ArrayList;

/**
 * All syntax tree nodes.
 * <p>
 * Every node owns its children exclusively and all links point downwards, so the tree has no
 * shared subtrees and no cycles. Slots documented as nullable stay empty when the input ended
 * early or a token was skipped.
 */
public class Ast {

    // Program -> [Algorithm]
    public final Algorithm algorithm; // nullable, empty program

    // Stmt -> Write | Read | If | For | While | Assign
    public interface Stmt {
    }

    // Exp -> BinaryExp | Term
    public interface Exp {
    }

    // Algorithm -> 'Algoritmo' Ident {Stmt} ['FinAlgoritmo']
    public static class Algorithm {

        public final String name;
        public final ArrayList<Stmt> stmts; // may hold null for skipped tokens

        public Algorithm(String name, ArrayList<Stmt> stmts) {
            assert name != null;
            assert stmts != null;
            this.name = name;
            this.stmts = stmts;
        }

        public String getName() {
            return this.name;
        }

        public ArrayList<Stmt> getStmts() {
            return this.stmts;
        }
    }

    // Block -> {Stmt}
    public static class Block {

        public final ArrayList<Stmt> stmts;

        public Block(ArrayList<Stmt> stmts) {
            assert stmts != null;
            this.stmts = stmts;
        }

        public ArrayList<Stmt> getStmts() {
            return this.stmts;
        }
    }

    // Write -> 'Escribir' Exp
    public static class Write implements Stmt {

        public final Exp exp;

        public Write(Exp exp) {
            assert exp != null;
            this.exp = exp;
        }

        public Exp getExp() {
            return this.exp;
        }
    }

    // Read -> 'Leer' Ident
    public static class Read implements Stmt {

        public final Ident target;

        public Read(Ident target) {
            assert target != null;
            this.target = target;
        }

        public Ident getTarget() {
            return this.target;
        }
    }

    // If -> 'Si' Exp ['Entonces'] Block ['Sino' Block] ['FinSi']
    public static class If implements Stmt {

        public final Exp cond;
        public final Block thenBlock;
        public final Block elseBlock;

        public If(Exp cond, Block thenBlock, Block elseBlock) {
            assert cond != null;
            assert thenBlock != null;
            // assert elseBlock != null;
            this.cond = cond;
            this.thenBlock = thenBlock;
            this.elseBlock = elseBlock;
        }

        public Exp getCond() {
            return this.cond;
        }

        public Block getThenBlock() {
            return this.thenBlock;
        }

        public Block getElseBlock() {
            return this.elseBlock;
        }

        public boolean hasElse() {
            return this.elseBlock != null;
        }
    }

    // For -> 'Para' Ident ('<-'|'=') Exp ['Hasta' Exp] Block ['FinPara']
    public static class For implements Stmt {

        public final String var;
        public final Exp start;
        public final Exp end; // nullable, 'Hasta' missing
        public final Block body;

        public For(String var, Exp start, Exp end, Block body) {
            assert var != null;
            assert start != null;
            assert body != null;
            this.var = var;
            this.start = start;
            this.end = end;
            this.body = body;
        }

        public String getVar() {
            return this.var;
        }

        public Exp getStart() {
            return this.start;
        }

        public Exp getEnd() {
            return this.end;
        }

        public Block getBody() {
            return this.body;
        }
    }

    // While -> 'Mientras' Exp Block ['FinMientras']
    public static class While implements Stmt {

        public final Exp cond;
        public final Block body;

        public While(Exp cond, Block body) {
            assert cond != null;
            assert body != null;
            this.cond = cond;
            this.body = body;
        }

        public Exp getCond() {
            return this.cond;
        }

        public Block getBody() {
            return this.body;
        }
    }

    // Assign -> Ident ('<-'|'=') Exp
    public static class Assign implements Stmt {

        public final String var;
        public final Exp value;

        public Assign(String var, Exp value) {
            assert var != null;
            assert value != null;
            this.var = var;
            this.value = value;
        }

        public String getVar() {
            return this.var;
        }

        public Exp getValue() {
            return this.value;
        }
    }

    // BinaryExp -> Exp Op Term, calc from left to right
    public static class BinaryExp implements Exp {

        public final Exp left;
        public final String op;
        public final Exp right;

        public BinaryExp(Exp left, String op, Exp right) {
            assert left != null;
            assert op != null;
            assert right != null;
            this.left = left;
            this.op = op;
            this.right = right;
        }

        public Exp getLeft() {
            return this.left;
        }

        public String getOp() {
            return this.op;
        }

        public Exp getRight() {
            return this.right;
        }

        // 把左深的链展开成 first {op follow}, 用循环而不是递归
        public void flatten(ArrayList<Exp> follows, ArrayList<String> operators) {
            ArrayList<BinaryExp> chain = new ArrayList<>();
            Exp cur = this;
            while (cur instanceof BinaryExp) {
                chain.add((BinaryExp) cur);
                cur = ((BinaryExp) cur).getLeft();
            }
            follows.add(cur); // first
            for (int i = chain.size() - 1; i >= 0; i--) {
                operators.add(chain.get(i).getOp());
                follows.add(chain.get(i).getRight());
            }
        }
    }

    // Number
    public static class Number implements Exp {

        public final String text;

        public Number(String text) {
            assert text != null;
            this.text = text;
        }

        public String getText() {
            return this.text;
        }
    }

    // Str, content without the quotes
    public static class Str implements Exp {

        public final String text;

        public Str(String text) {
            assert text != null;
            this.text = text;
        }

        public String getText() {
            return this.text;
        }
    }

    // Ident
    public static class Ident implements Exp {

        public final String name;

        public Ident(String name) {
            assert name != null;
            this.name = name;
        }

        public String getName() {
            return this.name;
        }
    }

    // a term that is neither number, string nor identifier, e.g. '(' or a keyword
    public static class Unrecognized implements Exp {

        public final String text;

        public Unrecognized(String text) {
            assert text != null;
            this.text = text;
        }

        public String getText() {
            return this.text;
        }
    }

    public Ast(Algorithm algorithm) {
        this.algorithm = algorithm;
    }

    public Algorithm getAlgorithm() {
        return this.algorithm;
    }

    public boolean isEmpty() {
        return this.algorithm == null;
    }

}
