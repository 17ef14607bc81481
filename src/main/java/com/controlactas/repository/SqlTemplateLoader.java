package com.controlactas.repository;

import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;
import java.util.Scanner;
import java.util.TreeSet;

/**
 * Queries of the reference price store (precios and precios_log tables), kept in
 * classpath:sql/queries.sql. Each query starts with a "-- name: xyz" line.
 */
@Component
public class SqlTemplateLoader {

    static final String QUERIES_LOCATION = "classpath:sql/queries.sql";
    private static final String NAME_MARKER = "-- name:";

    private final ResourceLoader resourceLoader;
    private final Map<String, String> priceStoreQueries = new HashMap<>();

    public SqlTemplateLoader(ResourceLoader resourceLoader) {
        this.resourceLoader = resourceLoader;
    }

    public synchronized String load(String name) {
        if (priceStoreQueries.isEmpty()) {
            priceStoreQueries.putAll(parse(resourceLoader.getResource(QUERIES_LOCATION)));
        }
        String sql = priceStoreQueries.get(name);
        if (sql == null) {
            throw new IllegalArgumentException("Unknown price store query '" + name + "' (known: "
                    + new TreeSet<>(priceStoreQueries.keySet()) + ")");
        }
        return sql;
    }

    private static Map<String, String> parse(Resource resource) {
        Map<String, String> parsed = new HashMap<>();
        try (InputStream in = resource.getInputStream();
             Scanner scanner = new Scanner(in, StandardCharsets.UTF_8.name())) {
            String currentName = null;
            StringBuilder body = new StringBuilder();
            while (scanner.hasNextLine()) {
                String line = scanner.nextLine();
                String trimmed = line.trim();
                if (trimmed.startsWith(NAME_MARKER)) {
                    if (currentName != null) {
                        parsed.put(currentName, body.toString().trim());
                    }
                    currentName = trimmed.substring(NAME_MARKER.length()).trim();
                    body = new StringBuilder();
                } else if (currentName != null) {
                    body.append(line).append('\n');
                }
            }
            if (currentName != null) {
                parsed.put(currentName, body.toString().trim());
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read price store queries from " + QUERIES_LOCATION, e);
        }
        return parsed;
    }
}
