package ai.mapper.scan;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

final class SourceFinderTest {

    @TempDir
    Path root;

    private void write(String relative, String text) throws IOException {
        final Path file = root.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, text, StandardCharsets.UTF_8);
    }

    @Test
    void findsPythonFilesSortedWithSlashPaths() throws IOException {
        write("pkg/b.py", "");
        write("pkg/a.py", "");
        write("pkg/sub/c.py", "");
        write("main.py", "");
        write("README.md", "");

        assertEquals(List.of("main.py", "pkg/a.py", "pkg/b.py", "pkg/sub/c.py"), new SourceFinder(root, List.of()).find());
    }

    @Test
    void skipsToolingDirectories() throws IOException {
        write("app/core.py", "");
        write(".git/hooks/x.py", "");
        write("app/__pycache__/core.py", "");
        write(".venv/lib/site.py", "");
        write("build/lib/app/core.py", "");

        assertEquals(List.of("app/core.py"), new SourceFinder(root, List.of()).find());
    }

    @Test
    void appliesExcludeGlobsToPathsAndNames() throws IOException {
        write("app/core.py", "");
        write("app/test_core.py", "");
        write("tests/test_app.py", "");
        write("tests/conftest.py", "");

        final SourceFinder finder = new SourceFinder(root, List.of("test_*.py", "tests"));
        assertEquals(List.of("app/core.py"), finder.find());
    }

    @Test
    void loadsTextOfEveryFile() throws IOException {
        write("pkg/mod.py", "x = 'é'\n");

        final SourceFinder.Loaded loaded = new SourceFinder(root, List.of()).loadAll();
        assertEquals(1, loaded.files().size());
        assertEquals("pkg/mod.py", loaded.files().get(0).path());
        assertEquals("x = 'é'\n", loaded.files().get(0).text());
        assertTrue(loaded.errors().isEmpty());
    }
}
