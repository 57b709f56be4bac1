package com.archforge.core.planner;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads and writes {@link TaskPlanRecord}s as pretty-printed JSON.
 */
public class TaskPlanWriter {

    private static final Logger log = LoggerFactory.getLogger(TaskPlanWriter.class);
    private static final ObjectMapper JSON_MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    /**
     * Writes a plan record, creating parent directories as needed.
     *
     * @param record plan record
     * @param target destination file
     * @throws IllegalStateException if the file cannot be written
     */
    public void write(TaskPlanRecord record, Path target) {
        try {
            Path parent = target.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            JSON_MAPPER.writeValue(target.toFile(), record);
            log.info("Wrote task plan record: {} ({} tasks)", target, record.tasks().size());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write task plan: " + target, e);
        }
    }

    /**
     * Reads a plan record back.
     *
     * @param source plan file
     * @return plan record
     * @throws IllegalStateException if the file cannot be read or parsed
     */
    public TaskPlanRecord read(Path source) {
        try {
            return JSON_MAPPER.readValue(source.toFile(), TaskPlanRecord.class);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read task plan: " + source, e);
        }
    }
}
