package polyopt.polyhedral.extract;

import org.junit.jupiter.api.Test;
import polyopt.Util.error.ToolkitFailure;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ExtractorTest {
    private static final String source = String.join("\n",
            "#define N 100",
            "const int M = 5;",
            "void f() {",
            "    #pragma scop",
            "    for (int i = 0; i < N; i++)",
            "        A[i] = 0;",
            "    #pragma endscop",
            "#pragma scop",
            "x = 1;",
            "#pragma endscop",
            "}",
            "");

    @Test
    void findsRegions() {
        List<ScopSource> regions = Extractor.regions(source);
        assertEquals(2, regions.size());
        ScopSource first = regions.get(0);
        assertEquals(0, first.index);
        assertEquals(5, first.firstLine);
        assertEquals("    ", first.indent);
        assertEquals("    for (int i = 0; i < N; i++)\n        A[i] = 0;\n", first.text);
        assertEquals(first.text, source.substring(first.start, first.end));
        assertEquals("x = 1;\n", regions.get(1).text);
        assertEquals("", regions.get(1).indent);
    }

    @Test
    void rejectsUnbalancedPragmas() {
        assertThrows(ToolkitFailure.class, () -> Extractor.regions("#pragma scop\n#pragma scop\n#pragma endscop\n"));
        assertThrows(ToolkitFailure.class, () -> Extractor.regions("x = 1;\n#pragma endscop\n"));
        assertThrows(ToolkitFailure.class, () -> Extractor.regions("#pragma scop\nx = 1;\n"));
    }

    @Test
    void readsParameterValues() {
        Map<String, Long> values = Extractor.parameterValues(
                "#define N 100\nconst int M = 5;\nstatic long K = -3;\nint N = 7;\nint A[N];\n");
        assertEquals(100L, values.get("N"));
        assertEquals(5L, values.get("M"));
        assertEquals(-3L, values.get("K"));
        assertEquals(3, values.size());
    }

    @Test
    void syntaxErrorsNameTheScop() {
        String text = "for (int i = 0; i < N; i++\n  A[i] = 0;\n";
        ToolkitFailure failure = assertThrows(ToolkitFailure.class,
                () -> Extractor.parse(new ScopSource(3, text, 0, text.length(), 12, "")));
        assertTrue(failure.getMessage().startsWith("scop 3 (line 12)"), failure.getMessage());
    }
}
