package com.logistics.reconciliation.repository;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Scanner;

/**
 * Serves the named statements kept in {@code classpath:sql/queries.sql}.
 * <p>
 * A statement starts at a {@code -- name: <key>} line and runs until the next
 * one. Other comment lines inside a block are kept as part of the statement.
 */
@Component
public class SqlTemplateLoader {

    static final String DEFAULT_LOCATION = "classpath:sql/queries.sql";
    private static final String NAME_MARKER = "-- name:";

    private final ResourceLoader resourceLoader;
    private final String location;
    private volatile Map<String, String> queries;

    @Autowired
    public SqlTemplateLoader(ResourceLoader resourceLoader) {
        this(resourceLoader, DEFAULT_LOCATION);
    }

    public SqlTemplateLoader(ResourceLoader resourceLoader, String location) {
        this.resourceLoader = resourceLoader;
        this.location = location;
    }

    public String load(String name) {
        String query = queries().get(name);
        if (query == null) {
            throw new IllegalArgumentException("SQL query not found in " + location + ": " + name);
        }
        return query;
    }

    private Map<String, String> queries() {
        Map<String, String> loaded = queries;
        if (loaded == null) {
            synchronized (this) {
                loaded = queries;
                if (loaded == null) {
                    loaded = parse();
                    queries = loaded;
                }
            }
        }
        return loaded;
    }

    private Map<String, String> parse() {
        Resource resource = resourceLoader.getResource(location);
        Map<String, String> parsed = new HashMap<>();

        try (InputStream in = resource.getInputStream(); Scanner s = new Scanner(in, StandardCharsets.UTF_8.name())) {
            String currentName = null;
            StringBuilder sb = new StringBuilder();
            while (s.hasNextLine()) {
                String line = s.nextLine();
                if (line.trim().startsWith(NAME_MARKER)) {
                    if (currentName != null) {
                        parsed.put(currentName, sb.toString().trim());
                    }
                    currentName = line.trim().substring(NAME_MARKER.length()).trim();
                    sb = new StringBuilder();
                } else if (currentName != null) {
                    sb.append(line).append('\n');
                }
            }
            if (currentName != null) {
                parsed.put(currentName, sb.toString().trim());
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load SQL queries from " + location, e);
        }
        return Collections.unmodifiableMap(parsed);
    }
}
