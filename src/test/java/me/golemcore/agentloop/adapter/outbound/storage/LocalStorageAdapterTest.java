package me.golemcore.agentloop.adapter.outbound.storage;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class LocalStorageAdapterTest {

    private static final String DIRECTORY = "transcripts";

    @TempDir
    Path tempDir;

    private LocalStorageAdapter adapter;

    @BeforeEach
    void setUp() {
        adapter = new LocalStorageAdapter(tempDir.toString());
        adapter.init();
    }

    @Test
    void shouldCreateFileAndDirectoryOnFirstAppend() {
        adapter.appendText(DIRECTORY, "u.jsonl", "one\n").join();

        assertTrue(Files.isDirectory(tempDir.resolve(DIRECTORY)));
        assertTrue(Files.isRegularFile(tempDir.resolve(DIRECTORY).resolve("u.jsonl")));
    }

    @Test
    void shouldAppendLines() throws Exception {
        adapter.appendText(DIRECTORY, "u.jsonl", "one\n").join();
        adapter.appendText(DIRECTORY, "u.jsonl", "two\n").join();

        List<String> lines = Files.readAllLines(tempDir.resolve(DIRECTORY).resolve("u.jsonl"),
                StandardCharsets.UTF_8);
        assertEquals(List.of("one", "two"), lines);
    }

    @Test
    void shouldKeepConcurrentAppendsLineAtomic() throws Exception {
        CompletableFuture<?>[] writes = IntStream.range(0, 50)
                .mapToObj(i -> adapter.appendText(DIRECTORY, "c.jsonl", "line-" + i + "\n"))
                .toArray(CompletableFuture[]::new);
        CompletableFuture.allOf(writes).join();

        List<String> lines = Files.readAllLines(tempDir.resolve(DIRECTORY).resolve("c.jsonl"),
                StandardCharsets.UTF_8);
        assertEquals(50, lines.size());
        assertTrue(lines.stream().allMatch(line -> line.matches("line-\\d+")));
    }

    @Test
    void shouldBlockPathTraversal() {
        CompletionException error = assertThrows(CompletionException.class,
                () -> adapter.appendText(DIRECTORY, "../../escape.txt", "x").join());

        assertInstanceOf(IllegalArgumentException.class, error.getCause());
        assertFalse(Files.exists(tempDir.getParent().resolve("escape.txt")));
    }

    @Test
    void shouldFailWhenNotInitialized() {
        LocalStorageAdapter uninitialized = new LocalStorageAdapter(tempDir.toString());

        CompletionException error = assertThrows(CompletionException.class,
                () -> uninitialized.appendText(DIRECTORY, "u.jsonl", "x").join());

        assertInstanceOf(IllegalStateException.class, error.getCause());
    }
}
