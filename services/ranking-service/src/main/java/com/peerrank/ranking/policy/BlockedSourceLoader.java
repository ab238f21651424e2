package com.peerrank.ranking.policy;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.yaml.snakeyaml.Yaml;

@Component
public class BlockedSourceLoader {
    private static final Logger log = LoggerFactory.getLogger(BlockedSourceLoader.class);

    public Set<String> load(String path) {
        if (path == null || path.isBlank()) {
            return Set.of();
        }
        Path resolved = resolvePath(path);
        if (!Files.exists(resolved)) {
            log.warn("blocked source list not found at {}", path);
            return Set.of();
        }

        Object parsed;
        try (InputStream input = Files.newInputStream(resolved)) {
            parsed = new Yaml().load(input);
        } catch (Exception ex) {
            log.warn("blocked source list load failed path={}", resolved, ex);
            return Set.of();
        }

        Object rawSources = parsed;
        if (parsed instanceof Map<?, ?> map) {
            rawSources = map.get("blocked_sources");
        }
        if (rawSources == null) {
            return Set.of();
        }
        if (!(rawSources instanceof List<?> list)) {
            log.warn("blocked source list malformed (expected list) path={}", resolved);
            return Set.of();
        }

        Set<String> sources = new LinkedHashSet<>();
        for (Object item : list) {
            if (item == null) {
                continue;
            }
            String value = item.toString().trim();
            if (!value.isEmpty()) {
                sources.add(value);
            }
        }
        return sources;
    }

    private Path resolvePath(String path) {
        Path direct = Path.of(path);
        if (Files.exists(direct) || direct.isAbsolute()) {
            return direct;
        }
        Path candidate = direct;
        for (int i = 0; i < 4; i++) {
            if (Files.exists(candidate)) {
                return candidate;
            }
            candidate = Path.of("..").resolve(candidate).normalize();
        }
        return direct;
    }
}
