package com.example.presence.shared.service;

import com.example.presence.shared.util.SqlKeys;
import org.springframework.context.annotation.PropertySource;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Looks up the ledger's SQL statements by {@link SqlKeys} name from {@code sql/queries.properties}.
 * Statements are resolved once and reused for every later store call.
 */
@Service
@PropertySource("classpath:sql/queries.properties")
public class SqlQueryProvider {

    private static final String CATALOGUE = "sql/queries.properties";

    private final Environment environment;
    private final Map<String, String> resolved = new ConcurrentHashMap<>();

    public SqlQueryProvider(Environment environment) {
        this.environment = environment;
    }

    /**
     * @throws IllegalStateException if the catalogue has no statement under {@code key}
     */
    public String getQuery(String key) {
        return resolved.computeIfAbsent(key, this::lookup);
    }

    private String lookup(String key) {
        String sql = environment.getProperty(key);
        if (sql == null || sql.isBlank()) {
            throw new IllegalStateException("No SQL statement '" + key + "' in " + CATALOGUE);
        }
        return sql.trim();
    }
}
