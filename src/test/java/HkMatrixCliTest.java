import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hkmatrix.cli.HkMatrixCli;
import com.hkmatrix.debug.Debug;
import com.hkmatrix.debug.DebugSink;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class HkMatrixCliTest {

    @TempDir
    Path dir;

    private String out;
    private String err;

    private int run(String stdin, String... args) {
        ByteArrayOutputStream o = new ByteArrayOutputStream();
        ByteArrayOutputStream e = new ByteArrayOutputStream();
        int code = HkMatrixCli.run(args,
                new ByteArrayInputStream(stdin.getBytes(StandardCharsets.UTF_8)),
                new PrintStream(o, true, StandardCharsets.UTF_8),
                new PrintStream(e, true, StandardCharsets.UTF_8));
        out = o.toString(StandardCharsets.UTF_8);
        err = e.toString(StandardCharsets.UTF_8);
        return code;
    }

    private String file(String name, String content) throws IOException {
        Path p = dir.resolve(name);
        Files.writeString(p, content, StandardCharsets.UTF_8);
        return p.toString();
    }

    @Test
    void missing_op_prints_usage() {
        assertEquals(2, run(""));
        assertTrue(err.startsWith("Usage:"), err);
    }

    @Test
    void unknown_op_is_a_usage_error() {
        assertEquals(2, run("1 2; 3 4", "--op=lu"));
        assertTrue(err.contains("Unknown --op: lu"), err);
    }

    @Test
    void rref_from_file_prints_steps_and_rank() throws IOException {
        String a = file("a.txt", "[[1, 2], [3, 4]]");
        assertEquals(0, run("", "--op=rref", "--a=" + a));

        assertTrue(out.contains("Step 1: Initial matrix"), out);
        assertTrue(out.contains("Step 3: Divide row 2 by -2"), out);
        assertTrue(out.contains("Step 5: Result: RREF\n[[1, 0]\n [0, 1]]"), out);
        assertTrue(out.contains("Rank: 2"), out);
        assertEquals("", err);
    }

    @Test
    void matrix_a_falls_back_to_stdin() {
        assertEquals(0, run("1 2; 3 4", "--op=det"));
        assertTrue(out.contains("det(A) = -2"), out);
    }

    @Test
    void precision_controls_display() {
        assertEquals(0, run("3 1", "--op=rref", "--precision=4"));
        assertTrue(out.contains("[[1, 0.3333]]"), out);

        assertEquals(2, run("3 1", "--op=rref", "--precision=x"));
    }

    @Test
    void cramer_reads_augmented_matrix() {
        assertEquals(0, run("2 1 3\n1 1 2", "--op=cramer"));
        assertTrue(out.contains("Step 1: Augmented system [A|b]"), out);
        assertTrue(out.contains("det(A) = 1"), out);
        assertTrue(out.contains("x1 = det(A_1)/det(A) = 1/1 = 1"), out);
        assertTrue(out.contains("x2 = det(A_2)/det(A) = 1/1 = 1"), out);
    }

    @Test
    void cramer_with_separate_b() throws IOException {
        String b = file("b.txt", "3; 2");
        assertEquals(0, run("2 1; 1 1", "--op=cramer", "--b=" + b));
        assertTrue(out.contains("Solution vector x"), out);

        assertEquals(1, run("2 1; 1 1; 1 1", "--op=cramer"));
        assertTrue(err.startsWith("Error: "), err);
    }

    @Test
    void add_needs_b() throws IOException {
        assertEquals(2, run("1 2", "--op=add"));
        assertTrue(err.contains("Missing --b"), err);

        String b = file("b.txt", "5 6");
        assertEquals(0, run("1 2", "--op=add", "--b=" + b));
        assertTrue(out.contains("Sum complete A + B\n[[6, 8]]"), out);
    }

    @Test
    void combo_with_rational_coefficients_and_det() throws IOException {
        String b = file("b.txt", "3 4");
        assertEquals(0, run("1 2", "--op=combo", "--b=" + b, "--alpha=1/2", "--beta=-1"));
        assertTrue(out.contains("Sum α·A + β·B\n[[-2.5, -3]]"), out);

        String c = file("c.txt", "2 0; 0 3");
        assertEquals(0, run("1 2", "--op=combo", "--b=" + b, "--c=" + c, "--alphaDet"));
        assertTrue(out.contains("Scale α·A (α = 6)"), out);

        assertEquals(2, run("1 2", "--op=combo", "--b=" + b, "--alphaDet"));
        assertEquals(2, run("1 2", "--op=combo", "--b=" + b, "--alpha=abc"));
    }

    @Test
    void independence_prints_summary() {
        assertEquals(0, run("[1, 2], [2, 4]", "--op=indep"));
        assertTrue(out.contains("Conclusion: DEPENDENT"), out);
    }

    @Test
    void random_is_reproducible_with_seed() {
        assertEquals(0, run("", "--op=random", "--rows=2", "--cols=3", "--seed=7"));
        String first = out;
        assertTrue(first.startsWith("Step 1: Random matrix (2x3) in [-9, 9]"), first);

        assertEquals(0, run("", "--op=random", "--rows=2", "--cols=3", "--seed=7"));
        assertEquals(first, out);

        assertEquals(2, run("", "--op=random", "--rows=0"));
        assertEquals(2, run("", "--op=random", "--low=5", "--high=1"));
    }

    @Test
    void inverse_of_singular_matrix_is_reported() {
        assertEquals(0, run("1 2; 2 4", "--op=inv"));
        assertTrue(out.contains("The matrix is not invertible."), out);

        assertEquals(0, run("4 7; 2 6", "--op=inv"));
        assertTrue(out.contains("A^-1 =\n[[0.6, -0.7]\n [-0.2, 0.4]]"), out);
    }

    @Test
    void parse_errors_exit_with_1() {
        assertEquals(1, run("1 2; 3", "--op=rref"));
        assertTrue(err.startsWith("Error: All rows must have the same number of columns"), err);

        assertEquals(1, run("", "--op=rref"));
        assertTrue(err.contains("Empty input"), err);
    }

    @Test
    void unreadable_file_exits_with_3() {
        assertEquals(3, run("", "--op=rref", "--a=" + dir.resolve("missing.txt")));
        assertTrue(err.startsWith("Failed to read --a file"), err);
    }

    @Test
    void verbose_logs_to_the_run_output_and_only_for_that_run() {
        DebugSink before = Debug.get().getSink();

        assertEquals(0, run("1 2; 3 4", "--op=rref", "--verbose"));
        assertTrue(out.contains("[DEBUG][hkmatrix.rref] rref (2x2) rank=2"), out);
        assertSame(before, Debug.get().getSink());

        assertEquals(0, run("1 2; 3 4", "--op=det"));
        assertFalse(out.contains("[DEBUG]"), out);
        assertTrue(out.contains("det(A) = -2"), out);
    }

    @Test
    void verbose_sink_is_removed_after_a_failed_run() {
        DebugSink before = Debug.get().getSink();

        assertEquals(1, run("1 2; 3", "--op=rref", "--verbose"));
        assertTrue(out.contains("[WARN][hkmatrix.cli] rref rejected"), out);
        assertSame(before, Debug.get().getSink());
    }

    @Test
    void json_output_is_a_step_document() throws IOException {
        assertEquals(0, run("1 2; 3 4", "--op=transpose", "--json"));
        JsonNode root = new ObjectMapper().readTree(out);
        assertEquals(2, root.get("steps").size());
        assertEquals("3", root.get("steps").get(1).get("matrix").get(0).get(1).asText());
    }
}
