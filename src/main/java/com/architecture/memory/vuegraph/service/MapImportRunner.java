package com.architecture.memory.vuegraph.service;

import com.architecture.memory.vuegraph.dto.ImportSummary;
import com.architecture.memory.vuegraph.model.MapGraph;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * Processes a map file named in configuration on application startup:
 * logs its node and link tables and, if enabled, imports it into Neo4j.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class MapImportRunner implements CommandLineRunner {

    private final MapImportService mapImportService;

    @Value("${vuegraph.startup.map-file:}")
    private String mapFile;

    @Value("${vuegraph.startup.import:false}")
    private boolean importOnStartup;

    @Override
    public void run(String... args) {
        if (mapFile == null || mapFile.isBlank()) {
            return;
        }

        Path path = Path.of(mapFile);
        MapGraph graph = mapImportService.extract(path);
        log.info("Graph extracted from {}:\n{}", path, mapImportService.renderTables(graph));

        if (importOnStartup) {
            ImportSummary summary = mapImportService.importGraph(graph, path.toString());
            if (summary.getVerification() != null && !summary.getVerification().isConsistent()) {
                log.warn("Import of {} finished with unequal node/link sets: {}", path, summary.getVerification());
            }
        }
    }
}
