package com.teamsmith.core.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.teamsmith.core.model.TaskAssignment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes task assignments as an output document:
 * <pre>
 * Tasks:
 * - name: One
 *   teams:
 *   - peoples:
 *     - John
 *     price: 2800
 * </pre>
 */
@Component
public class StaffingDocumentWriter {

    private static final Logger log = LoggerFactory.getLogger(StaffingDocumentWriter.class);

    private final ObjectMapper yaml = YamlMappers.create();

    public String toYaml(List<TaskAssignment> assignments) {
        try {
            return yaml.writeValueAsString(AssignmentReport.of(assignments));
        } catch (JsonProcessingException e) {
            throw new StaffingDocumentException("Failed to serialize assignments", e);
        }
    }

    public void write(List<TaskAssignment> assignments, Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (OutputStream out = Files.newOutputStream(path)) {
            yaml.writeValue(out, AssignmentReport.of(assignments));
        }
        log.info("Wrote {} task assignments to {}", assignments.size(), path);
    }
}
