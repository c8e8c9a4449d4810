package com.architecture.memory.vuegraph.service;

import com.architecture.memory.vuegraph.dto.ImportSummary;
import com.architecture.memory.vuegraph.dto.ImportVerification;
import com.architecture.memory.vuegraph.exception.UnresolvedLinksException;
import com.architecture.memory.vuegraph.model.MapGraph;
import com.architecture.memory.vuegraph.model.MapNode;
import com.architecture.memory.vuegraph.service.extraction.MapGraphExtractor;
import com.architecture.memory.vuegraph.service.extraction.VueDocumentLoader;
import com.architecture.memory.vuegraph.service.render.GraphTableRenderer;
import com.architecture.memory.vuegraph.service.store.Neo4jGraphExporter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;
import org.w3c.dom.Element;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MapImportServiceTest {

    @Mock
    private VueDocumentLoader documentLoader;

    @Mock
    private MapGraphExtractor graphExtractor;

    @Mock
    private GraphTableRenderer tableRenderer;

    @Mock
    private Neo4jGraphExporter graphExporter;

    @InjectMocks
    private MapImportService mapImportService;

    private final InputStream upload = new ByteArrayInputStream(new byte[0]);
    private final Element root = mock(Element.class);

    private final MapGraph resolved = new MapGraph(
            Map.of(1, MapNode.builder().id(1).label("A").build()), Map.of(), List.of());
    private final MapGraph dangling = new MapGraph(
            Map.of(1, MapNode.builder().id(1).label("A").build()), Map.of(), List.of(9));

    @BeforeEach
    void setUp() {
        ReflectionTestUtils.setField(mapImportService, "failOnUnresolved", false);
        ReflectionTestUtils.setField(mapImportService, "verifyImport", true);
        ReflectionTestUtils.setField(mapImportService, "maxLabelLength", 30);
        ReflectionTestUtils.setField(mapImportService, "nodeColumn", "label");
    }

    @Test
    void returnsUnresolvedLinksWhenNotStrict() {
        when(documentLoader.parse(upload, "map.vue")).thenReturn(root);
        when(graphExtractor.extract(root)).thenReturn(dangling);

        MapGraph graph = mapImportService.extract(upload, "map.vue");

        assertThat(graph.getUnresolvedLinkIds()).containsExactly(9);
    }

    @Test
    void strictModeRejectsUnresolvedLinks() {
        ReflectionTestUtils.setField(mapImportService, "failOnUnresolved", true);
        when(documentLoader.parse(upload, "map.vue")).thenReturn(root);
        when(graphExtractor.extract(root)).thenReturn(dangling);

        assertThatThrownBy(() -> mapImportService.extract(upload, "map.vue"))
                .isInstanceOf(UnresolvedLinksException.class);
    }

    @Test
    void importExportsAndVerifies() {
        when(documentLoader.parse(upload, "map.vue")).thenReturn(root);
        when(graphExtractor.extract(root)).thenReturn(resolved);
        when(graphExporter.export(resolved)).thenReturn(ImportSummary.builder().nodesMerged(1).build());
        ImportVerification verification = ImportVerification.builder()
                .expectedNodes(1).actualNodes(1).build();
        when(graphExporter.verify(resolved)).thenReturn(verification);

        ImportSummary summary = mapImportService.importMap(upload, "map.vue");

        assertThat(summary.getSource()).isEqualTo("map.vue");
        assertThat(summary.getNodesMerged()).isEqualTo(1);
        assertThat(summary.getVerification()).isSameAs(verification);
    }

    @Test
    void importsAlreadyExtractedGraphWithoutReloading() {
        when(graphExporter.export(resolved)).thenReturn(ImportSummary.builder().nodesMerged(1).build());
        when(graphExporter.verify(resolved)).thenReturn(ImportVerification.builder().build());

        ImportSummary summary = mapImportService.importGraph(resolved, "maps/ideas.vue");

        assertThat(summary.getSource()).isEqualTo("maps/ideas.vue");
        verify(documentLoader, never()).load(any());
        verify(graphExtractor, never()).extract(any());
    }

    @Test
    void importSkipsVerificationWhenDisabled() {
        ReflectionTestUtils.setField(mapImportService, "verifyImport", false);
        when(documentLoader.parse(upload, "map.vue")).thenReturn(root);
        when(graphExtractor.extract(root)).thenReturn(resolved);
        when(graphExporter.export(resolved)).thenReturn(ImportSummary.builder().build());

        ImportSummary summary = mapImportService.importMap(upload, "map.vue");

        assertThat(summary.getVerification()).isNull();
        verify(graphExporter, never()).verify(any());
    }

    @Test
    void rendersNodeAndLinkTables() {
        when(tableRenderer.renderNodes(resolved, "label")).thenReturn("nodes\n");
        when(tableRenderer.renderLinks(eq(resolved), eq(30))).thenReturn("links\n");

        assertThat(mapImportService.renderTables(resolved)).isEqualTo("nodes\n\nlinks\n");
    }
}
