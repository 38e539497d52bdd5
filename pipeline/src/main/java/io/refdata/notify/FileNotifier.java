package io.refdata.notify;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;

/** Appends one JSON object per message: {@code {"ts":..., "message":...}}. */
public class FileNotifier implements Notifier {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Path file;
    private final Clock clock;

    public FileNotifier(Path file, Clock clock) throws IOException {
        this.file = file;
        this.clock = clock;
        if (file.getParent() != null) Files.createDirectories(file.getParent());
        if (!Files.exists(file)) {
            Files.writeString(file, "", StandardCharsets.UTF_8, StandardOpenOption.CREATE);
        }
    }

    public FileNotifier(Path file) throws IOException { this(file, Clock.systemUTC()); }

    @Override
    public synchronized void send(String message) throws IOException {
        ObjectNode line = MAPPER.createObjectNode();
        line.put("ts", clock.instant().toString());
        line.put("message", message);
        Files.writeString(file, MAPPER.writeValueAsString(line) + System.lineSeparator(),
                StandardCharsets.UTF_8, StandardOpenOption.APPEND);
    }

    public Path file() { return file; }
}
