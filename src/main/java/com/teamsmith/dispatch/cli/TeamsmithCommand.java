package com.teamsmith.dispatch.cli;

import com.teamsmith.core.config.TeamsmithProperties;
import com.teamsmith.core.io.StaffingDocumentReader;
import com.teamsmith.core.io.StaffingDocumentWriter;
import com.teamsmith.core.logging.MdcContext;
import com.teamsmith.core.metrics.TeamsmithMetrics;
import com.teamsmith.core.model.Staffing;
import com.teamsmith.core.model.TaskAssignment;
import com.teamsmith.core.teams.TeamAssignmentService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: teamsmith -i &lt;inputfile&gt; -o &lt;outputfile&gt;
 * <p>
 * Reads tasks and the roster, builds the ranked teams for every task and writes
 * the result document. A missing input file is reported on stderr, but the read is
 * still attempted and its failure ends the run.
 */
@Command(
        name = "teamsmith",
        mixinStandardHelpOptions = true,
        version = "Teamsmith 0.1.0",
        description = "Builds teams whose skills cover each task and ranks them by total salary"
)
@Component
public class TeamsmithCommand implements Callable<Integer> {

    @Option(names = {"-i", "--in"}, paramLabel = "<inputfile>",
            description = "Input document with Tasks and Peoples (default: teamsmith.input, test/task.yaml)")
    private String input;

    @Option(names = {"-o", "--out"}, paramLabel = "<outputfile>",
            description = "Output document (default: teamsmith.output, result.yaml)")
    private String output;

    @Option(names = {"--print"}, description = "Also print the result document to stdout")
    private boolean print;

    private final TeamsmithProperties properties;
    private final StaffingDocumentReader reader;
    private final TeamAssignmentService assignmentService;
    private final StaffingDocumentWriter writer;
    private final TeamsmithMetrics metrics;

    public TeamsmithCommand(TeamsmithProperties properties,
                            StaffingDocumentReader reader,
                            TeamAssignmentService assignmentService,
                            StaffingDocumentWriter writer,
                            @Autowired(required = false) TeamsmithMetrics metrics) {
        this.properties = properties;
        this.reader = reader;
        this.assignmentService = assignmentService;
        this.writer = writer;
        this.metrics = metrics;
    }

    @Override
    public Integer call() throws Exception {
        String inputFile = isBlank(input) ? properties.getInput() : input;
        String outputFile = isBlank(output) ? properties.getOutput() : output;

        ConsoleOutput.info("Input file " + inputFile);
        ConsoleOutput.info("Output file " + outputFile);

        Path inputPath = Path.of(inputFile);
        if (!Files.isRegularFile(inputPath)) {
            ConsoleOutput.warn("Error: " + inputFile + " is not path to file");
        }

        MdcContext.setDocument(inputFile);
        try {
            Staffing staffing = reader.read(inputPath);
            List<TaskAssignment> assignments = assignmentService.assign(staffing.tasks(), staffing.people());
            writer.write(assignments, Path.of(outputFile));

            if (print) {
                System.out.print(writer.toYaml(assignments));
            }
            for (TaskAssignment assignment : assignments) {
                ConsoleOutput.assignment(assignment);
            }
            ConsoleOutput.success("Teams written to " + outputFile);
            recordRun("completed");
            return 0;
        } catch (Exception e) {
            recordRun("failed");
            throw e;
        } finally {
            MdcContext.clear();
        }
    }

    private void recordRun(String status) {
        if (metrics != null) {
            metrics.recordRun(status);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
