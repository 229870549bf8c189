package com.logistics.reconciliation.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Base for commands that print their result as JSON.
 */
public abstract class JsonOutputCommand implements Callable<Integer> {

    protected final ObjectMapper objectMapper;

    @Spec
    protected CommandSpec spec;

    protected JsonOutputCommand(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    protected PrintWriter out() {
        return spec.commandLine().getOut();
    }

    protected void printJson(Object value) throws JsonProcessingException {
        out().println(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value));
        out().flush();
    }

    protected void writeJson(Path file, Object value) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), value);
        out().println("Payload written to " + file.toAbsolutePath());
        out().flush();
    }
}
