package com.sandstormtracker.watcher;

import com.sandstormtracker.parser.LogTimestamps;

import java.io.BufferedInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.LocalDateTime;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

// ========== Log File Access ==========
// Byte-offset based reads. Only newline-terminated lines are returned; a partial
// last line stays in the file until the writer finishes it.
public final class LogFiles {

    private static final int TAIL_WINDOW_BYTES = 256 * 1024;
    private static final int FIRST_LINE_LIMIT = 4096;

    private LogFiles() {}

    /** A complete line, the offset of its first byte and the offset just past its newline. */
    public record LogLine(String text, long startOffset, long endOffset) {}

    @FunctionalInterface
    public interface LineVisitor {
        void visit(LogLine line) throws IOException;
    }

    /**
     * Streams the complete lines between two offsets.
     *
     * @return offset just past the last complete line visited, {@code fromOffset} if there was none
     */
    public static long forEachLine(Path path, long fromOffset, long toOffset, LineVisitor visitor) throws IOException {
        long lastEnd = fromOffset;
        if (toOffset <= fromOffset) {
            return lastEnd;
        }
        try (FileChannel channel = FileChannel.open(path, StandardOpenOption.READ)) {
            channel.position(fromOffset);
            InputStream in = new BufferedInputStream(Channels.newInputStream(channel));
            ByteArrayOutputStream current = new ByteArrayOutputStream();
            long position = fromOffset;
            while (position < toOffset) {
                int b = in.read();
                if (b < 0) {
                    break;
                }
                position++;
                if (b == '\n') {
                    visitor.visit(new LogLine(current.toString(StandardCharsets.UTF_8), lastEnd, position));
                    lastEnd = position;
                    current.reset();
                } else {
                    current.write(b);
                }
            }
        }
        return lastEnd;
    }

    public static Optional<LocalDateTime> readOpenTimestamp(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            byte[] head = in.readNBytes(FIRST_LINE_LIMIT);
            int end = 0;
            while (end < head.length && head[end] != '\n') {
                end++;
            }
            String firstLine = LogTimestamps.stripBom(new String(head, 0, end, StandardCharsets.UTF_8)).trim();
            return LogTimestamps.fromLogOpenLine(firstLine);
        }
    }

    /** Up to {@code count} complete lines from the end of the file, oldest first. */
    public static List<String> tail(Path path, int count) throws IOException {
        try (FileChannel channel = FileChannel.open(path, StandardOpenOption.READ)) {
            long size = channel.size();
            long start = Math.max(0, size - TAIL_WINDOW_BYTES);
            ByteBuffer buffer = ByteBuffer.allocate((int) (size - start));
            int read;
            do {
                read = channel.read(buffer, start + buffer.position());
            } while (read > 0 && buffer.hasRemaining());

            String text = new String(buffer.array(), 0, buffer.position(), StandardCharsets.UTF_8);
            String[] split = text.split("\r?\n");
            Deque<String> lines = new ArrayDeque<>();
            // first fragment may start mid-line when the window does not reach the file start
            int first = start > 0 ? 1 : 0;
            for (int i = split.length - 1; i >= first && lines.size() < count; i--) {
                if (!split[i].isEmpty()) {
                    lines.addFirst(split[i]);
                }
            }
            return new ArrayList<>(lines);
        }
    }
}
