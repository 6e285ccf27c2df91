package com.example.presence.tracker.leaderboard;

import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

@Slf4j
final class TextResources {

    private TextResources() {}

    /**
     * Trimmed, non-blank lines of a UTF-8 text resource. A missing resource yields no lines.
     */
    static List<String> readLines(Resource resource) {
        List<String> lines = new ArrayList<>();
        if (resource == null || !resource.exists()) {
            log.warn("Text resource {} not found, using none.", resource);
            return lines;
        }
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                String trimmed = line.strip();
                if (!trimmed.isEmpty()) {
                    lines.add(trimmed);
                }
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read " + resource, e);
        }
        return lines;
    }
}
