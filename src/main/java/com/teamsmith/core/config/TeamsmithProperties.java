package com.teamsmith.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "teamsmith")
public class TeamsmithProperties {

    private String input = "test/task.yaml";
    private String output = "result.yaml";

    /** Number of tasks searched concurrently; 1 searches them one after another. */
    private int parallelism = 1;

    public String getInput() {
        return input;
    }

    public void setInput(String input) {
        this.input = input;
    }

    public String getOutput() {
        return output;
    }

    public void setOutput(String output) {
        this.output = output;
    }

    public int getParallelism() {
        return parallelism;
    }

    public void setParallelism(int parallelism) {
        this.parallelism = parallelism;
    }
}
