package polyopt;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import polyopt.Util.config.Configuration;
import polyopt.session.Scop;
import polyopt.session.Scops;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MainTest {
    private static final String source = """
            #define N 8
            void kernel() {
              #pragma scop
              for (int i = 0; i < N; i++)
                A[i] = i;
              for (int i = 0; i < N; i++)
                B[i] = A[i] + 1;
              #pragma endscop
            }
            """;

    @Test
    void scriptRollsBackIllegalStepsAndGoesOn() {
        try (Scops scops = Scops.open(source, new Configuration())) {
            int rejected = Main.runScript(scops, List.of(
                    "# fuse the two loops",
                    "",
                    "0 0 fuse 0 1",
                    "0 0.0.0 partialShiftValue 0 1",
                    "0 0.0.0 skew 1",
                    "x 0 tile 4",
                    "3 0 tile 4",
                    "0 0.0.0 tile",
                    "0 7 tile 4",
                    "0 0.0.0 parallel"));
            assertEquals(6, rejected);
            Scop scop = scops.select(0);
            assertTrue(scop.isModified());
            scop.gotoPath("0.0.0");
            assertEquals("[N] -> [{ S_0[i] -> [(i)]; S_1[i] -> [(i)] }]", scop.bandExprText());
        }
    }

    @Test
    void runWritesTheTransformedSource(@TempDir Path dir) throws IOException {
        Path input = dir.resolve("kernel.c");
        Path script = dir.resolve("steps.txt");
        Path output = dir.resolve("kernel.opt.c");
        Files.writeString(input, source);
        Files.writeString(script, "0 0 fuseAll\n0 0.0.0 tile 4\n");
        Main.run(new Configuration(new String[]{"-i", input.toString(), "-t", script.toString(),
                "-o", output.toString(), "-s"}));
        String result = Files.readString(output);
        assertTrue(result.startsWith("#define N 8\nvoid kernel() {\n  #pragma scop\n"), result);
        assertTrue(result.endsWith("  #pragma endscop\n}\n"), result);
        assertTrue(result.contains("floord(N - 1, 4)"), result);
        assertTrue(result.contains("B[c1] = A[c1] + 1;"), result);
    }
}
