package com.architecture.memory.vuegraph.service.extraction;

import com.architecture.memory.vuegraph.exception.InvalidMapFileException;
import com.architecture.memory.vuegraph.exception.MapFormatException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads a .vue file into a DOM element tree rooted at {@code LW-MAP}.
 *
 * VUE writes a block of comments and an XML declaration ahead of the map; everything before the
 * first line starting with {@code <LW-MAP} is discarded before parsing.
 */
@Component
@Slf4j
public class VueDocumentLoader {

    static final String VUE_EXTENSION = ".vue";
    private static final String ROOT_PREFIX = "<" + MapGraphExtractor.ROOT_TAG;

    public Element load(Path path) {
        String name = path.getFileName() != null ? path.getFileName().toString() : path.toString();
        requireVueFile(name);
        try (InputStream in = Files.newInputStream(path)) {
            return parse(in, name);
        } catch (IOException e) {
            throw new InvalidMapFileException("Cannot read map file: " + path, e);
        }
    }

    public Element parse(InputStream in, String sourceName) {
        requireVueFile(sourceName);
        String content;
        try {
            content = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new InvalidMapFileException("Cannot read map content: " + sourceName, e);
        }

        String xml = stripPreamble(content, sourceName);
        try {
            Document document = newDocumentBuilder().parse(new InputSource(new StringReader(xml)));
            Element root = document.getDocumentElement();
            log.debug("[vue-load] Parsed {} ({} chars of XML)", sourceName, xml.length());
            return root;
        } catch (SAXException | IOException e) {
            throw new MapFormatException("Map " + sourceName + " is not well-formed XML: " + e.getMessage(), e);
        }
    }

    static String stripPreamble(String content, String sourceName) {
        int lineStart = 0;
        while (lineStart < content.length()) {
            if (content.startsWith(ROOT_PREFIX, lineStart)) {
                return content.substring(lineStart);
            }
            int newline = content.indexOf('\n', lineStart);
            if (newline < 0) {
                break;
            }
            lineStart = newline + 1;
        }
        throw new MapFormatException("No " + ROOT_PREFIX + " element found in " + sourceName);
    }

    private static void requireVueFile(String name) {
        if (name == null || !name.endsWith(VUE_EXTENSION)) {
            throw new InvalidMapFileException("A " + VUE_EXTENSION + " file is required, got: " + name);
        }
    }

    private static DocumentBuilder newDocumentBuilder() {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
            factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
            factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
            factory.setExpandEntityReferences(false);
            return factory.newDocumentBuilder();
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser is not configurable", e);
        }
    }
}
