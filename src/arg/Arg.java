package arg;

import util.CenterControl;
import util.FileDealer;

public class Arg {
    public final String srcFilename; // 伪代码源文件名 e.g. "suma.psc"
    public final String outFilename; // 目标 C++ 文件名, 缺省由源文件名换扩展名得到 e.g. "suma.cpp"
    public final boolean outputGiven; // -o was passed

    // options
    public final boolean dumpTokens;
    public final boolean dumpAst;

    private Arg(String src, String out, boolean dumpTokens, boolean dumpAst) {
        this.srcFilename = src;
        this.outputGiven = !out.isEmpty();
        this.outFilename = out.isEmpty() ? FileDealer.changeExtension(src, CenterControl.TARGET_EXTENSION) : out;
        this.dumpTokens = dumpTokens;
        this.dumpAst = dumpAst;
    }

    public static Arg parse(String[] args) {
        String src = "", out = "";
        boolean dumpTokens = false, dumpAst = false;
        for (int i = 0; i < args.length; i++) {
            // detect "-o"
            if ("-o".equals(args[i])) {
                if (i + 1 < args.length) {
                    if (!out.isEmpty()) {
                        throw new RuntimeException("We got more than one output file when we expected only one.");
                    }
                    out = args[i + 1];
                    i += 1;
                    continue;
                } else {
                    printHelp();
                    throw new RuntimeException("-o expected filename");
                }
            }
            if ("--dump-tokens".equals(args[i])) {
                dumpTokens = true;
                continue;
            }
            if ("--dump-ast".equals(args[i])) {
                dumpAst = true;
                continue;
            }
            // detect illegal flags
            if (args[i].startsWith("-")) {
                printHelp();
                throw new RuntimeException("invalid flag: " + args[i]);
            }
            // source file
            if (!src.isEmpty()) {
                printHelp();
                throw new RuntimeException("We got more than one source file when we expected only one.");
            }
            src = args[i];
        }
        if (src.isEmpty()) {
            printHelp();
            throw new RuntimeException("source file should be specified.");
        }
        return new Arg(src, out, dumpTokens, dumpAst);
    }

    public static void printHelp() {
        System.err.println("Usage: PseudoCompiler [-o output.cpp] [--dump-tokens] [--dump-ast] <file.psc>");
    }
}
