package com.controlplane.engine.logsink;

import com.controlplane.core.step.LogSinkFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * One append-only {@code <taskId>.log} file per task.
 */
public class FileLogSinkFactory implements LogSinkFactory {

    private static final Logger log = LoggerFactory.getLogger(FileLogSinkFactory.class);

    private final Path directory;

    public FileLogSinkFactory(Path directory) {
        this.directory = directory;
    }

    @Override
    public OutputStream open(String taskId) throws IOException {
        Files.createDirectories(directory);
        Path file = directory.resolve(taskId + ".log");
        log.debug("Opening log sink {}", file);
        return new BufferedOutputStream(Files.newOutputStream(file,
            StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE));
    }

    public Path pathOf(String taskId) {
        return directory.resolve(taskId + ".log");
    }
}
