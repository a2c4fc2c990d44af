package frontend.syntax;

import exception.SyntaxException;
import frontend.lexer.Keyword;
import frontend.lexer.Token;
import frontend.lexer.TokenList;
import frontend.lexer.TokenType;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent parser for the pseudocode dialect.
 * <p>
 * One token of lookahead, no backtracking. Malformed input never raises: a token that starts
 * no statement is skipped and a missing block terminator is tolerated at end of input.
 */
public class Parser {
    // 唯一一层优先级, 左结合
    private static final List<String> BINARY_OPS = List.of("+", "-", ">", "<", "<=", ">=", "==", "!=");

    private final TokenList tokenList;

    public Parser(TokenList tokenList) {
        this.tokenList = tokenList;
    }

    public Ast parseAst() throws SyntaxException {
        try {
            return parseProgram();
        } catch (RuntimeException | StackOverflowError e) {
            throw new SyntaxException("Syntax error: " + (e.getMessage() != null ? e.getMessage() : e.toString()));
        }
    }

    private Ast parseProgram() {
        Ast.Algorithm algorithm = null;
        if (tokenList.match(Keyword.ALGORITMO)) {
            algorithm = parseAlgorithm();
        }
        return new Ast(algorithm);
    }

    private Ast.Algorithm parseAlgorithm() {
        tokenList.consume(); // Algoritmo
        Token name = tokenList.consume();
        ArrayList<Ast.Stmt> stmts = new ArrayList<>();
        while (!tokenList.match(Keyword.FIN_ALGORITMO) && tokenList.hasNext()) {
            stmts.add(parseStmt()); // null is kept for a skipped token
        }
        tokenList.consumeIf(Keyword.FIN_ALGORITMO);
        return new Ast.Algorithm(name.getContent(), stmts);
    }

    // stops before any of the terminators or at end of input, skipped tokens leave no trace
    private Ast.Block parseBlock(Keyword... terminators) {
        ArrayList<Ast.Stmt> stmts = new ArrayList<>();
        while (tokenList.hasNext() && !atAnyOf(terminators)) {
            Ast.Stmt stmt = parseStmt();
            if (stmt != null) {
                stmts.add(stmt);
            }
        }
        return new Ast.Block(stmts);
    }

    private boolean atAnyOf(Keyword... keywords) {
        for (Keyword keyword : keywords) {
            if (tokenList.match(keyword)) {
                return true;
            }
        }
        return false;
    }

    // returns null after skipping a token that starts no statement
    private Ast.Stmt parseStmt() {
        Token token = tokenList.get();
        Keyword keyword = Keyword.of(token.getContent()); // by text, whatever the token type
        if (keyword != null) {
            switch (keyword) {
                case ESCRIBIR:
                    return parseWrite();
                case LEER:
                    return parseRead();
                case SI:
                    return parseIf();
                case PARA:
                    return parseFor();
                case MIENTRAS:
                    return parseWhile();
                default:
                    break;
            }
        }
        if (token.isOf(TokenType.IDENT)) {
            return parseAssign();
        }
        tokenList.consume();
        return null;
    }

    private Ast.Write parseWrite() {
        tokenList.consume(); // Escribir
        return new Ast.Write(parseExp());
    }

    private Ast.Read parseRead() {
        tokenList.consume(); // Leer
        Token target = tokenList.consume();
        return new Ast.Read(new Ast.Ident(target.getContent()));
    }

    private Ast.If parseIf() {
        tokenList.consume(); // Si
        Ast.Exp cond = parseExp();
        tokenList.consumeIf(Keyword.ENTONCES);
        Ast.Block thenBlock = parseBlock(Keyword.SINO, Keyword.FIN_SI);
        Ast.Block elseBlock = null;
        if (tokenList.consumeIf(Keyword.SINO)) {
            elseBlock = parseBlock(Keyword.FIN_SI);
        }
        tokenList.consumeIf(Keyword.FIN_SI);
        return new Ast.If(cond, thenBlock, elseBlock);
    }

    private Ast.For parseFor() {
        tokenList.consume(); // Para
        Token var = tokenList.consume();
        tokenList.consume(); // '<-' or '=', not checked
        Ast.Exp start = parseExp();
        Ast.Exp end = null;
        if (tokenList.consumeIf(Keyword.HASTA)) {
            end = parseExp();
        }
        Ast.Block body = parseBlock(Keyword.FIN_PARA);
        tokenList.consumeIf(Keyword.FIN_PARA);
        return new Ast.For(var.getContent(), start, end, body);
    }

    private Ast.While parseWhile() {
        tokenList.consume(); // Mientras
        Ast.Exp cond = parseExp();
        Ast.Block body = parseBlock(Keyword.FIN_MIENTRAS);
        tokenList.consumeIf(Keyword.FIN_MIENTRAS);
        return new Ast.While(cond, body);
    }

    private Ast.Assign parseAssign() {
        Token var = tokenList.consume();
        tokenList.consume(); // '<-' or '=', not checked
        return new Ast.Assign(var.getContent(), parseExp());
    }

    // Exp -> Term {BinOp Term}, every operator binds equally
    private Ast.Exp parseExp() {
        Ast.Exp left = parseTerm();
        while (tokenList.hasNext() && BINARY_OPS.contains(tokenList.get().getContent())) {
            Token op = tokenList.consume();
            Ast.Exp right = parseTerm();
            left = new Ast.BinaryExp(left, op.getContent(), right);
        }
        return left;
    }

    private Ast.Exp parseTerm() {
        Token token = tokenList.consume();
        switch (token.getType()) {
            case NUMBER:
                return new Ast.Number(token.getContent());
            case STRING:
                return new Ast.Str(token.getContent());
            case IDENT:
                return new Ast.Ident(token.getContent());
            default:
                return new Ast.Unrecognized(token.getContent());
        }
    }
}
