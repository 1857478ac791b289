package ai.mapper;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.mapper.io.MapSize;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

final class MainTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @TempDir
    Path root;

    @BeforeEach
    void setUp() throws IOException {
        Files.createDirectories(root.resolve("pkg"));
        Files.writeString(root.resolve("pkg/a.py"), "def foo():\n    return 1\n", StandardCharsets.UTF_8);
        Files.writeString(root.resolve("pkg/b.py"), "from pkg.a import foo\nx = foo()\n", StandardCharsets.UTF_8);
        Files.writeString(root.resolve("pkg/test_b.py"), "import pkg.b\n", StandardCharsets.UTF_8);
    }

    @Test
    void writesVerboseMapNextToTheSources() throws IOException {
        assertEquals(0, Main.run(new String[] {root.toString(), "--threads=1", "--exclude=test_*.py"}));

        final JsonNode map = MAPPER.readTree(root.resolve(Main.DEFAULT_OUTPUT).toFile());
        assertEquals(2, map.get("metadata").get("files_total").asInt());
        assertEquals(1, map.get("global_integration_map").get("crossroads").size());
    }

    @Test
    void compactOutputDecodesBackToVerbose() throws IOException {
        assertEquals(0, Main.run(new String[] {root.toString(), "--format=compact", "--output=out/map.json"}));
        final Path compact = root.resolve("out/map.json");
        assertEquals("2.0", MAPPER.readTree(compact.toFile()).get("v").asText());

        final Path decoded = root.resolve("out/decoded.json");
        assertEquals(0, Main.run(new String[] {root.toString(), "--decode=" + compact, "--output=" + decoded}));
        final JsonNode verbose = MAPPER.readTree(decoded.toFile());
        assertEquals("function",
                verbose.get("codebase_tree").get("pkg").get("children").get("a").get("children").get("foo")
                        .get("kind").asText());
    }

    @Test
    void reportsSizeAndTokenEstimateOfTheWrittenMap() throws IOException {
        final ByteArrayOutputStream captured = new ByteArrayOutputStream();
        final PrintStream original = System.out;
        System.setOut(new PrintStream(captured, true, StandardCharsets.UTF_8));
        try {
            assertEquals(0, Main.run(new String[] {root.toString(), "--format=compact", "--output=small.json"}));
        } finally {
            System.setOut(original);
        }

        final long bytes = Files.size(root.resolve("small.json"));
        final String out = captured.toString(StandardCharsets.UTF_8);
        assertTrue(out.contains("Size: " + MapSize.ofBytes(bytes).describe()), out);
        assertTrue(out.contains("tokens"), out);
    }

    @Test
    void readsExcludesFromFile() throws IOException {
        final Path excludeFile = root.resolve("excludes.txt");
        Files.writeString(excludeFile, "# generated tests\ntest_*.py, conftest.py  # trailing\n\n",
                StandardCharsets.UTF_8);
        final List<String> excludes = new ArrayList<>();
        Main.loadExcludesFromFile(excludeFile, excludes);
        assertEquals(List.of("test_*.py", "conftest.py"), excludes);
    }

    @Test
    void usageErrorsExitWithTwo() {
        assertEquals(2, Main.run(new String[] {root.toString(), "--bogus"}));
        assertEquals(2, Main.run(new String[] {root.toString(), "--format=yaml"}));
        assertEquals(2, Main.run(new String[] {root.toString(), "--topK=many"}));
        assertEquals(2, Main.run(new String[] {root.toString(), "--boundaryDepth=0"}));
        assertEquals(2, Main.run(new String[] {root.toString(), "--excludeFile=missing.txt"}));
    }

    @Test
    void undecodableMapExitsWithOne() throws IOException {
        final Path bad = root.resolve("bad.json");
        Files.writeString(bad, "{\"v\":\"9.9\"}", StandardCharsets.UTF_8);
        assertEquals(1, Main.run(new String[] {root.toString(), "--decode=" + bad}));
        assertTrue(Files.notExists(root.resolve(Main.DEFAULT_OUTPUT)));
    }
}
