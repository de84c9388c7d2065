package com.sandstormtracker.watcher;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class LogFilesTest {

    @TempDir
    Path dir;

    @Test
    void visitsOnlyCompleteLinesWithOffsets() throws IOException {
        Path log = dir.resolve("main.log");
        Files.writeString(log, "first\nsecond\npartial", StandardCharsets.UTF_8);

        List<LogFiles.LogLine> lines = new ArrayList<>();
        long end = LogFiles.forEachLine(log, 0, Files.size(log), lines::add);

        assertThat(lines).containsExactly(
            new LogFiles.LogLine("first", 0, 6),
            new LogFiles.LogLine("second", 6, 13));
        assertThat(end).isEqualTo(13);
    }

    @Test
    void resumesFromAnOffset() throws IOException {
        Path log = dir.resolve("main.log");
        Files.writeString(log, "first\nsecond\nthird\n", StandardCharsets.UTF_8);

        List<String> texts = new ArrayList<>();
        long end = LogFiles.forEachLine(log, 6, Files.size(log), line -> texts.add(line.text()));

        assertThat(texts).containsExactly("second", "third");
        assertThat(end).isEqualTo(Files.size(log));
        assertThat(LogFiles.forEachLine(log, end, end, line -> texts.add(line.text()))).isEqualTo(end);
    }

    @Test
    void readsOpenTimestampBehindBom() throws IOException {
        Path log = dir.resolve("main.log");
        Files.writeString(log, "\uFEFFLog file open, 10/04/25 21:18:15\nLogInit: Display: Starting\n",
            StandardCharsets.UTF_8);

        assertThat(LogFiles.readOpenTimestamp(log)).contains(LocalDateTime.of(2025, 10, 4, 21, 18, 15));
    }

    @Test
    void tailReturnsLastLinesOldestFirst() throws IOException {
        Path log = dir.resolve("main.log");
        Files.writeString(log, "a\nb\r\nc\n\nd\n", StandardCharsets.UTF_8);

        assertThat(LogFiles.tail(log, 3)).containsExactly("b", "c", "d");
        assertThat(LogFiles.tail(log, 10)).containsExactly("a", "b", "c", "d");
    }
}
