package com.llmregress.expand;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CsvCaseSourceTest {

    @TempDir
    Path tempDir;

    private final CsvCaseSource source = new CsvCaseSource();

    @Test
    void shouldReadRowsAsOrderedBindings() throws Exception {
        Path csv = write("words.csv", """
                word,expected
                hello,bonjour
                "cat, black",chat noir

                thanks,merci
                """);

        List<Map<String, String>> rows = source.readRows(csv);

        assertEquals(3, rows.size());
        assertEquals(Map.of("word", "hello", "expected", "bonjour"), rows.get(0));
        assertEquals("cat, black", rows.get(1).get("word"));
        assertEquals(List.of("word", "expected"), List.copyOf(rows.get(2).keySet()));
    }

    @Test
    void shouldStripByteOrderMarkFromFirstHeader() throws Exception {
        Path csv = write("bom.csv", "\uFEFFname\nAlice\nBob\n");

        assertEquals(List.of(Map.of("name", "Alice"), Map.of("name", "Bob")), source.readRows(csv));
    }

    @Test
    void shouldFailOnMissingFile() {
        DataSourceException error = assertThrows(DataSourceException.class,
                () -> source.readRows(tempDir.resolve("absent.csv")));

        assertTrue(error.getMessage().contains("file not found"));
    }

    @Test
    void shouldFailOnEmptyFile() throws Exception {
        Path csv = write("empty.csv", "");

        assertThrows(DataSourceException.class, () -> source.readRows(csv));
    }

    @Test
    void shouldFailOnRowWidthMismatch() throws Exception {
        Path csv = write("ragged.csv", """
                word,expected
                hello,bonjour
                lonely
                """);

        DataSourceException error = assertThrows(DataSourceException.class, () -> source.readRows(csv));

        assertTrue(error.getMessage().contains("row 3"), error.getMessage());
    }

    @Test
    void shouldFailOnDuplicateHeader() throws Exception {
        Path csv = write("dup.csv", "word,word\na,b\n");

        DataSourceException error = assertThrows(DataSourceException.class, () -> source.readRows(csv));

        assertTrue(error.getMessage().contains("repeats column 'word'"));
    }

    private Path write(String name, String content) throws Exception {
        Path file = tempDir.resolve(name);
        Files.writeString(file, content);
        return file;
    }
}
