package com.teamsmith.core.io;

import com.fasterxml.jackson.core.JacksonException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.teamsmith.core.model.Person;
import com.teamsmith.core.model.Staffing;
import com.teamsmith.core.model.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads an input document ({@code Tasks} and {@code Peoples}) and converts it to domain values.
 * <p>
 * Both sections are required. Every task and person needs a name and every person a
 * non-negative salary; a missing {@code skills} list reads as empty. Entries keep their
 * input order, nothing is deduplicated or sorted.
 */
@Component
public class StaffingDocumentReader {

    private static final Logger log = LoggerFactory.getLogger(StaffingDocumentReader.class);

    private final ObjectMapper yaml = YamlMappers.create();

    /**
     * @throws IOException if the file cannot be opened
     * @throws StaffingDocumentException if the content is not a valid staffing document
     */
    public Staffing read(Path path) throws IOException {
        log.debug("Reading staffing document {}", path);
        try (InputStream in = Files.newInputStream(path)) {
            return read(in);
        }
    }

    public Staffing read(InputStream in) throws IOException {
        StaffingDocument document;
        try {
            document = yaml.readValue(in, StaffingDocument.class);
        } catch (JacksonException e) {
            throw new StaffingDocumentException("Malformed staffing document: " + e.getOriginalMessage(), e);
        }
        return toStaffing(document);
    }

    public Staffing parse(String content) {
        StaffingDocument document;
        try {
            document = yaml.readValue(content, StaffingDocument.class);
        } catch (JacksonException e) {
            throw new StaffingDocumentException("Malformed staffing document: " + e.getOriginalMessage(), e);
        }
        return toStaffing(document);
    }

    Staffing toStaffing(StaffingDocument document) {
        if (document == null) {
            throw new StaffingDocumentException("Staffing document is empty");
        }
        if (document.tasks() == null) {
            throw new StaffingDocumentException("Staffing document has no 'Tasks' section");
        }
        if (document.people() == null) {
            throw new StaffingDocumentException("Staffing document has no 'Peoples' section");
        }

        var tasks = new ArrayList<Task>(document.tasks().size());
        for (int i = 0; i < document.tasks().size(); i++) {
            tasks.add(toTask(i, document.tasks().get(i)));
        }

        var people = new ArrayList<Person>(document.people().size());
        for (int i = 0; i < document.people().size(); i++) {
            people.add(toPerson(i, document.people().get(i)));
        }

        log.info("Loaded {} tasks and {} people", tasks.size(), people.size());
        return new Staffing(tasks, people);
    }

    private Task toTask(int index, StaffingDocument.TaskEntry entry) {
        String where = "Tasks[" + index + "]";
        if (entry == null) {
            throw new StaffingDocumentException(where + " is empty");
        }
        requireName(where, entry.name());
        if (entry.skills() == null || entry.skills().isEmpty()) {
            log.warn("Task {} requires no skills; no team will be formed for it", entry.name());
        }
        return new Task(entry.name(), skills(where, entry.skills()));
    }

    private Person toPerson(int index, StaffingDocument.PersonEntry entry) {
        String where = "Peoples[" + index + "]";
        if (entry == null) {
            throw new StaffingDocumentException(where + " is empty");
        }
        requireName(where, entry.name());
        BigDecimal salary = entry.salary();
        if (salary == null) {
            throw new StaffingDocumentException(where + " (" + entry.name() + ") has no salary");
        }
        if (salary.signum() < 0) {
            throw new StaffingDocumentException(
                    where + " (" + entry.name() + ") has a negative salary: " + salary);
        }
        return new Person(entry.name(), salary, skills(where, entry.skills()));
    }

    private static void requireName(String where, String name) {
        if (name == null || name.isBlank()) {
            throw new StaffingDocumentException(where + " has no name");
        }
    }

    private static List<String> skills(String where, List<String> skills) {
        if (skills == null) {
            return List.of();
        }
        for (String skill : skills) {
            if (skill == null) {
                throw new StaffingDocumentException(where + " lists an empty skill");
            }
        }
        return skills;
    }
}
