package com.architecture.memory.vuegraph.controller;

import com.architecture.memory.vuegraph.dto.ErrorResponse;
import com.architecture.memory.vuegraph.dto.ImportSummary;
import com.architecture.memory.vuegraph.dto.MapGraphResponse;
import com.architecture.memory.vuegraph.exception.GraphStoreException;
import com.architecture.memory.vuegraph.exception.InvalidMapFileException;
import com.architecture.memory.vuegraph.exception.MapFormatException;
import com.architecture.memory.vuegraph.exception.UnknownMetadataKindException;
import com.architecture.memory.vuegraph.exception.UnresolvedLinksException;
import com.architecture.memory.vuegraph.exception.VueGraphException;
import com.architecture.memory.vuegraph.model.MapGraph;
import com.architecture.memory.vuegraph.service.MapImportService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.time.LocalDateTime;

/**
 * REST endpoints for extracting graphs from uploaded VUE maps and importing them into Neo4j.
 */
@RestController
@RequestMapping("/api/maps")
@RequiredArgsConstructor
@Slf4j
public class MapGraphController {

    private final MapImportService mapImportService;

    /**
     * Extract nodes and links without touching the database.
     */
    @PostMapping("/extract")
    public ResponseEntity<MapGraphResponse> extract(@RequestParam("file") MultipartFile file) throws IOException {
        log.info("Extracting map: {}", file.getOriginalFilename());
        try (InputStream in = file.getInputStream()) {
            MapGraph graph = mapImportService.extract(in, file.getOriginalFilename());
            return ResponseEntity.ok(MapGraphResponse.from(file.getOriginalFilename(), graph));
        }
    }

    /**
     * Node and link tables as plain text.
     */
    @PostMapping(value = "/tables", produces = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<String> tables(@RequestParam("file") MultipartFile file) throws IOException {
        try (InputStream in = file.getInputStream()) {
            MapGraph graph = mapImportService.extract(in, file.getOriginalFilename());
            return ResponseEntity.ok(mapImportService.renderTables(graph));
        }
    }

    @PostMapping("/import")
    public ResponseEntity<ImportSummary> importMap(@RequestParam("file") MultipartFile file) throws IOException {
        log.info("Importing map into Neo4j: {}", file.getOriginalFilename());
        try (InputStream in = file.getInputStream()) {
            return ResponseEntity.ok(mapImportService.importMap(in, file.getOriginalFilename()));
        }
    }

    @ExceptionHandler({MapFormatException.class, UnknownMetadataKindException.class,
            InvalidMapFileException.class, UnresolvedLinksException.class})
    public ResponseEntity<ErrorResponse> handleInvalidMap(VueGraphException e) {
        log.warn("Rejected map: {}", e.getMessage());
        return error(HttpStatus.BAD_REQUEST, e);
    }

    @ExceptionHandler(GraphStoreException.class)
    public ResponseEntity<ErrorResponse> handleStoreFailure(GraphStoreException e) {
        log.error("Graph store failure", e);
        return error(HttpStatus.BAD_GATEWAY, e);
    }

    private static ResponseEntity<ErrorResponse> error(HttpStatus status, Exception e) {
        return ResponseEntity.status(status).body(ErrorResponse.builder()
                .error(e.getClass().getSimpleName())
                .message(e.getMessage())
                .timestamp(LocalDateTime.now())
                .build());
    }
}
