package polyopt.session;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import polyopt.Util.config.Configuration;
import polyopt.Util.error.NavigationError;
import polyopt.Util.error.ToolkitFailure;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ScopsTest {
    private static final String prefix = "#include <stdio.h>\n#define N 16\n\nvoid kernel(double A[N]) {\n  #pragma scop\n";
    private static final String body = "  for (int i = 0; i < N; i++)\n    A[i] = A[i] + 1;\n";
    private static final String suffix = "  #pragma endscop\n}\n";

    @Test
    void untouchedSourceComesBackByteForByte() {
        String text = prefix + body + suffix + "/* trailing */\n#pragma scop\nx = 1;\n#pragma endscop\n";
        try (Scops scops = Scops.open(text, new Configuration())) {
            assertEquals(2, scops.size());
            assertEquals(text, scops.generateCode());
        }
    }

    @Test
    void onlyModifiedRegionsAreRewritten() {
        try (Scops scops = Scops.open(prefix + body + suffix, new Configuration())) {
            Scop scop = scops.select(0);
            scop.gotoChild(0);
            scop.setParallel();
            assertEquals(prefix
                    + "  #pragma omp parallel for\n"
                    + "  for (int c0 = 0; c0 <= N - 1; c0++)\n"
                    + "    A[c0] = A[c0] + 1;\n"
                    + suffix, scops.generateCode());
        }
    }

    @Test
    void writesTheOutputFile(@TempDir Path dir) throws IOException {
        Path input = dir.resolve("in.c");
        Files.writeString(input, prefix + body + suffix);
        Path output = dir.resolve("out.c");
        try (Scops scops = Scops.open(input, new Configuration())) {
            assertEquals(0, scops.generate(output.toString()));
            assertEquals(prefix + body + suffix, Files.readString(output));
            Scop scop = scops.select(0);
            scop.gotoChild(0);
            scop.tile(4);
            assertEquals(1, scops.generate(output.toString()));
            assertEquals(scops.generateCode(), Files.readString(output));
        }
        assertThrows(ToolkitFailure.class, () -> Scops.open(dir.resolve("missing.c"), new Configuration()));
    }

    @Test
    void selectAndClose() {
        Scops scops = Scops.open(prefix + body + suffix, new Configuration());
        assertThrows(NavigationError.class, () -> scops.select(1));
        assertThrows(NavigationError.class, () -> scops.select(-1));
        Scop scop = scops.select(0);
        scops.close();
        scops.close();
        assertThrows(IllegalStateException.class, scops::size);
        assertThrows(IllegalStateException.class, scops::generateCode);
        assertThrows(IllegalStateException.class, scop::gotoRoot);
    }

    @Test
    void unbalancedPragmasFailTheFile() {
        assertThrows(ToolkitFailure.class, () -> Scops.open(prefix + body, new Configuration()));
    }
}
