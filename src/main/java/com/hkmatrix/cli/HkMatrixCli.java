package com.hkmatrix.cli;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.Random;

import com.hkmatrix.HkMatrix;
import com.hkmatrix.core.engine.CramerResult;
import com.hkmatrix.core.engine.DeterminantResult;
import com.hkmatrix.core.engine.IndependenceResult;
import com.hkmatrix.core.engine.InverseResult;
import com.hkmatrix.core.engine.MatrixGenerator;
import com.hkmatrix.core.engine.ReductionResult;
import com.hkmatrix.core.engine.ValidationError;
import com.hkmatrix.core.format.NumberFormatter;
import com.hkmatrix.core.matrix.RationalMatrix;
import com.hkmatrix.core.parse.ParseError;
import com.hkmatrix.core.rational.Rational;
import com.hkmatrix.core.steps.Step;
import com.hkmatrix.core.steps.StepLog;
import com.hkmatrix.core.steps.StepOp;
import com.hkmatrix.debug.Debug;
import com.hkmatrix.debug.DebugSink;
import com.hkmatrix.protocol.StepLogJson;

/**
 * Command-line front end: reads matrices, runs one operation, prints the trace.
 *
 * Flags:
 *   --op=rref|triu|det|inv|transpose|cramer|add|sub|mul|combo|indep|random   (required)
 *   --a=/path/a.txt      matrix A (stdin when absent)
 *   --b=/path/b.txt      matrix B, or the column b for cramer
 *   --c=/path/c.txt      square matrix C for combo with --alphaDet / --betaDet
 *   --alpha=1/2 --beta=-3
 *   --rows=3 --cols=3 --low=-9 --high=9 --seed=42     (random)
 *   --precision=2 --json --verbose   (--verbose sends debug lines to the output stream for this run)
 *
 * Exit codes: 0 ok, 1 parse/validation error, 2 usage, 3 unreadable input.
 */
public final class HkMatrixCli {

    private static final String TAG = "hkmatrix.cli";

    static final int EXIT_OK = 0;
    static final int EXIT_INPUT_ERROR = 1;
    static final int EXIT_USAGE = 2;
    static final int EXIT_IO = 3;

    private static final String USAGE =
            "Usage: HkMatrixCli --op=<rref|triu|det|inv|transpose|cramer|add|sub|mul|combo|indep|random>"
                    + " [--a=file] [--b=file] [--c=file] [--alpha=q] [--beta=q] [--alphaDet] [--betaDet]"
                    + " [--rows=n] [--cols=n] [--low=n] [--high=n] [--seed=n] [--precision=n] [--json] [--verbose]";

    public static void main(String[] args) {
        System.exit(run(args, System.in, System.out, System.err));
    }

    private HkMatrixCli() {}

    /** Runs one invocation; returns the process exit code. */
    public static int run(String[] args, InputStream stdin, PrintStream out, PrintStream err) {
        Map<String, String> flags = parseArgs(args);
        String op = flags.get("op");
        if (op == null) {
            err.println(USAGE);
            return EXIT_USAGE;
        }
        DebugSink previous = Debug.get().getSink();
        if (flags.containsKey("verbose")) Debug.get().setSink(Debug.printTo(out));
        try {
            return execute(op, flags, stdin, out, err);
        } finally {
            Debug.get().setSink(previous);
        }
    }

    private static int execute(String op, Map<String, String> flags, InputStream stdin, PrintStream out, PrintStream err) {
        final int precision;
        try {
            precision = Integer.parseInt(flags.getOrDefault("precision", String.valueOf(NumberFormatter.DEFAULT_PRECISION)));
            if (precision < 0) throw new NumberFormatException("negative precision");
        } catch (NumberFormatException e) {
            err.println("Invalid --precision: " + flags.get("precision"));
            return EXIT_USAGE;
        }
        boolean json = flags.containsKey("json");

        Inputs in = new Inputs(flags, stdin);
        try {
            Output result = dispatch(op, flags, in);
            if (result == null) {
                err.println("Unknown --op: " + op);
                err.println(USAGE);
                return EXIT_USAGE;
            }
            if (json) {
                out.println(StepLogJson.write(result.steps, precision));
            } else {
                printSteps(out, result.steps, precision);
                if (result.summary != null) out.println(result.summary);
            }
            return EXIT_OK;
        } catch (InputUnavailable e) {
            err.println(e.getMessage());
            Debug.get().e(TAG, e.getMessage(), e.getCause());
            return EXIT_IO;
        } catch (UsageError e) {
            err.println(e.getMessage());
            err.println(USAGE);
            return EXIT_USAGE;
        } catch (ParseError | ValidationError e) {
            err.println("Error: " + e.getMessage());
            Debug.get().w(TAG, op + " rejected: " + e.getMessage());
            return EXIT_INPUT_ERROR;
        }
    }

    /** Trace plus an optional text summary. */
    private static final class Output {
        final StepLog steps;
        final String summary;

        Output(StepLog steps, String summary) {
            this.steps = steps;
            this.summary = summary;
        }
    }

    private static Output dispatch(String op, Map<String, String> flags, Inputs in) {
        switch (op) {
            case "rref": {
                ReductionResult r = HkMatrix.rref(in.matrix("a"));
                return new Output(r.steps(), "Rank: " + r.rank());
            }
            case "triu":
                return new Output(HkMatrix.upperTriangularSteps(in.matrix("a")), null);
            case "det": {
                DeterminantResult d = HkMatrix.determinant(in.matrix("a"));
                return new Output(d.steps(), d.isDefined() ? "det(A) = " + d.value() : "Only defined for square matrices");
            }
            case "inv": {
                InverseResult r = HkMatrix.inverse(in.matrix("a"));
                String summary;
                if (!r.isSquare()) summary = "The matrix is not square, no inverse exists.";
                else if (r.isInvertible()) summary = "A^-1 =\n" + NumberFormatter.fmtMatrix(r.inverse(), precisionOf(flags));
                else summary = "The matrix is not invertible.";
                return new Output(r.steps(), summary);
            }
            case "transpose":
                return new Output(HkMatrix.transposeSteps(in.matrix("a")), null);
            case "cramer":
                return cramer(flags, in);
            case "add":
                return new Output(HkMatrix.addSteps(in.matrix("a"), in.matrix("b")), null);
            case "sub":
                return new Output(HkMatrix.subSteps(in.matrix("a"), in.matrix("b")), null);
            case "mul":
                return new Output(HkMatrix.multiplySteps(in.matrix("a"), in.matrix("b")), null);
            case "combo":
                return combination(flags, in);
            case "indep": {
                IndependenceResult r = HkMatrix.independence(in.vectors("a"));
                return new Output(r.steps(), r.summary());
            }
            case "random":
                return random(flags);
            default:
                return null;
        }
    }

    // [A|b] in one matrix when --b is absent
    private static Output cramer(Map<String, String> flags, Inputs in) {
        RationalMatrix a = in.matrix("a");
        RationalMatrix b;
        if (flags.containsKey("b")) {
            b = in.matrix("b");
        } else {
            int n = a.rows();
            if (a.cols() != n + 1) {
                throw new ValidationError("The augmented matrix must be n x (n+1), got " + a.shape());
            }
            b = a.columns(n, n + 1);
            a = a.columns(0, n);
        }
        CramerResult r = HkMatrix.cramerSteps(a, b);
        if (!r.hasUniqueSolution()) {
            return new Output(r.steps(), "det(A) = 0: no unique solution.");
        }
        StringBuilder sb = new StringBuilder("det(A) = ").append(r.determinant());
        for (int i = 0; i < r.columnDeterminants().size(); i++) {
            sb.append("\nx").append(i + 1).append(" = det(A_").append(i + 1).append(")/det(A) = ")
                    .append(r.columnDeterminants().get(i)).append('/').append(r.determinant())
                    .append(" = ").append(r.exactSolution().get(i));
        }
        return new Output(r.steps(), sb.toString());
    }

    private static Output combination(Map<String, String> flags, Inputs in) {
        RationalMatrix a = in.matrix("a");
        RationalMatrix b = in.matrix("b");
        Rational alpha = rationalFlag(flags, "alpha");
        Rational beta = rationalFlag(flags, "beta");
        boolean alphaDet = flags.containsKey("alphaDet");
        boolean betaDet = flags.containsKey("betaDet");
        if (alphaDet || betaDet) {
            if (!flags.containsKey("c")) throw new UsageError("--alphaDet/--betaDet need --c");
            return new Output(HkMatrix.combinationSteps(a, b, in.matrix("c"), alpha, beta, alphaDet, betaDet), null);
        }
        return new Output(HkMatrix.combinationSteps(a, b, alpha, beta), null);
    }

    private static Output random(Map<String, String> flags) {
        int rows = intFlag(flags, "rows", 3);
        int cols = intFlag(flags, "cols", 3);
        int low = intFlag(flags, "low", MatrixGenerator.DEFAULT_LOW);
        int high = intFlag(flags, "high", MatrixGenerator.DEFAULT_HIGH);
        Random random = flags.containsKey("seed") ? new Random(intFlag(flags, "seed", 0)) : new Random();
        RationalMatrix m;
        try {
            m = MatrixGenerator.randomIntegers(rows, cols, low, high, random);
        } catch (IllegalArgumentException e) {
            throw new UsageError(e.getMessage());
        }
        StepLog log = new StepLog().record("Random matrix " + m.shape() + " in [" + low + ", " + high + "]", m, StepOp.initial());
        return new Output(log, null);
    }

    // ===================== OUTPUT =====================

    private static void printSteps(PrintStream out, StepLog log, int precision) {
        int i = 1;
        for (Step s : log) {
            out.println("Step " + i++ + ": " + s.description());
            out.println(NumberFormatter.fmtMatrix(s.snapshot(), precision));
            out.println();
        }
    }

    // ===================== FLAGS =====================

    private static int precisionOf(Map<String, String> flags) {
        return Integer.parseInt(flags.getOrDefault("precision", String.valueOf(NumberFormatter.DEFAULT_PRECISION)));
    }

    private static int intFlag(Map<String, String> flags, String name, int def) {
        String v = flags.get(name);
        if (v == null) return def;
        try {
            return Integer.parseInt(v.trim());
        } catch (NumberFormatException e) {
            throw new UsageError("Invalid --" + name + ": " + v);
        }
    }

    private static Rational rationalFlag(Map<String, String> flags, String name) {
        String v = flags.get(name);
        if (v == null) return Rational.ONE;
        try {
            return Rational.parse(v);
        } catch (NumberFormatException | ArithmeticException e) {
            throw new UsageError("Invalid --" + name + ": " + v);
        }
    }

    /**
     * Minimal arg parser:
     *   --op=rref --a=/path/a.txt --precision=4
     *   --json --verbose
     */
    static Map<String, String> parseArgs(String[] args) {
        Map<String, String> out = new HashMap<>();
        for (String a : args) {
            if (a.startsWith("--") && a.contains("=")) {
                int i = a.indexOf('=');
                out.put(a.substring(2, i), a.substring(i + 1));
            } else if (a.startsWith("--")) {
                out.put(a.substring(2), "true");
            }
        }
        return out;
    }

    // ===================== INPUT =====================

    /** Reads --a/--b/--c from files; a missing --a falls back to stdin, read once. */
    private static final class Inputs {
        private final Map<String, String> flags;
        private final InputStream stdin;
        private String stdinText;

        Inputs(Map<String, String> flags, InputStream stdin) {
            this.flags = flags;
            this.stdin = stdin;
        }

        RationalMatrix matrix(String name) {
            return RationalMatrix.fromDoubles(HkMatrix.parseMatrix(text(name)));
        }

        RationalMatrix vectors(String name) {
            return RationalMatrix.fromDoubles(HkMatrix.parseVectors(text(name)));
        }

        private String text(String name) {
            String path = flags.get(name);
            if (path == null) {
                if (!name.equals("a")) throw new UsageError("Missing --" + name);
                return readStdin();
            }
            try {
                return Files.readString(Path.of(path), StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new InputUnavailable("Failed to read --" + name + " file: " + path, e);
            }
        }

        private String readStdin() {
            if (stdinText == null) {
                try {
                    ByteArrayOutputStream buf = new ByteArrayOutputStream();
                    stdin.transferTo(buf);
                    stdinText = buf.toString(StandardCharsets.UTF_8);
                } catch (IOException e) {
                    throw new InputUnavailable("Failed to read stdin", e);
                }
            }
            return stdinText;
        }
    }

    private static final class UsageError extends RuntimeException {
        UsageError(String message) { super(message); }
    }

    private static final class InputUnavailable extends RuntimeException {
        InputUnavailable(String message, Throwable cause) { super(message, cause); }
    }
}
