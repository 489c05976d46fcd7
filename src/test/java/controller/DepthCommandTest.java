package controller;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class DepthCommandTest {

    @TempDir
    Path tempDir;

    private StringWriter out;
    private StringWriter err;
    private Path sample;

    @BeforeEach
    void setUp() throws IOException {
        out = new StringWriter();
        err = new StringWriter();
        sample = tempDir.resolve("Sample.java");
        Files.writeString(sample, "package demo;\n\nclass Sample {\n"
                + nestedMethod("five", 5)
                + nestedMethod("two", 2)
                + nestedMethod("eight", 8)
                + "}\n");
    }

    // Method whose body is a chain of depth nested ifs
    private static String nestedMethod(String name, int depth) {
        StringBuilder sb = new StringBuilder("    void " + name + "() {\n");
        for (int i = 0; i < depth; i++) {
            sb.append("if (flag) {\n");
        }
        sb.append("work();\n");
        for (int i = 0; i < depth; i++) {
            sb.append("}\n");
        }
        return sb.append("    }\n").toString();
    }

    private int run(String... args) {
        CommandLine cmd = new CommandLine(new DepthCommand());
        cmd.setOut(new PrintWriter(out, true));
        cmd.setErr(new PrintWriter(err, true));
        return cmd.execute(args);
    }

    private String[] outputLines() {
        String text = out.toString().trim();
        return text.isEmpty() ? new String[0] : text.split("\\R");
    }

    @Test
    void missingPathsIsUsageError() {
        assertThat(run()).isEqualTo(2);
        assertThat(err.toString()).contains("Missing required parameter");
        assertThat(out.toString()).isEmpty();
    }

    @Test
    void unknownOptionIsUsageError() {
        assertThat(run("-bogus", sample.toString())).isEqualTo(2);
    }

    @Test
    void printsAllDeclarationsDeepestFirst() {
        assertThat(run(sample.toString())).isZero();

        assertThat(outputLines()).containsExactly(
                "8 demo (*Sample).eight " + sample + ":24:5",
                "5 demo (*Sample).five " + sample + ":4:5",
                "2 demo (*Sample).two " + sample + ":17:5");
    }

    @Test
    void overPrintsDeeperDeclarationsAndFails() {
        assertThat(run("-over", "4", sample.toString())).isEqualTo(1);

        assertThat(outputLines()).hasSize(2);
        assertThat(outputLines()[0]).startsWith("8 demo (*Sample).eight");
        assertThat(outputLines()[1]).startsWith("5 demo (*Sample).five");
    }

    @Test
    void overAboveEveryDepthSucceedsSilently() {
        assertThat(run("-over", "10", sample.toString())).isZero();
        assertThat(outputLines()).isEmpty();
    }

    @Test
    void topLimitsLines() {
        assertThat(run("-top", "1", sample.toString())).isZero();

        assertThat(outputLines()).hasSize(1);
        assertThat(outputLines()[0]).startsWith("8 ");
    }

    @Test
    void averageIgnoresFilters() {
        assertThat(run("-avg", "-top", "1", sample.toString())).isZero();

        assertThat(outputLines()).hasSize(2);
        assertThat(outputLines()[1]).isEqualTo("Average: 5.00");
    }

    @Test
    void doubleDashSpellingsWork() {
        assertThat(run("--over=4", "--avg", sample.toString())).isEqualTo(1);
        assertThat(outputLines()).hasSize(3);
    }

    @Test
    void csvFormat() {
        assertThat(run("-format", "csv", sample.toString())).isZero();

        assertThat(outputLines()[0]).isEqualTo("depth,package,function,file,line,column");
        assertThat(outputLines()).hasSize(4);
    }

    @Test
    void jsonFormat() {
        assertThat(run("-format", "json", "-avg", sample.toString())).isZero();

        assertThat(out.toString()).contains("\"stats\"").contains("\"average\"");
    }

    @Test
    void unknownFormatIsUsageError() {
        assertThat(run("-format", "xml", sample.toString())).isEqualTo(2);
        assertThat(err.toString()).contains("xml");
    }

    @Test
    void negativeTopIsUsageError() {
        assertThat(run("-top=-5", sample.toString())).isEqualTo(2);
    }

    @Test
    void parseErrorFailsWithoutOutput() throws IOException {
        Path broken = tempDir.resolve("Broken.java");
        Files.writeString(broken, "class Broken { void f( }");

        assertThat(run(sample.toString(), broken.toString())).isEqualTo(1);
        assertThat(out.toString()).isEmpty();
        assertThat(err.toString()).contains("Broken.java");
    }

    @Test
    void directoryArgumentIsWalked() {
        assertThat(run(tempDir.toString())).isZero();
        assertThat(outputLines()).hasSize(3);
    }

    @Test
    void helpPrintsUsage() {
        assertThat(run("-h")).isZero();
        assertThat(out.toString()).contains("-over").contains("<depth> <package> <function> <file:row:column>");
    }
}
