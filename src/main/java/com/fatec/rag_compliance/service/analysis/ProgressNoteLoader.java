package com.fatec.rag_compliance.service.analysis;

import dev.langchain4j.data.document.Document;
import dev.langchain4j.data.document.DocumentParser;
import dev.langchain4j.data.document.loader.FileSystemDocumentLoader;
import dev.langchain4j.data.document.parser.TextDocumentParser;
import dev.langchain4j.data.document.parser.apache.pdfbox.ApachePdfBoxDocumentParser;
import dev.langchain4j.data.document.parser.apache.poi.ApachePoiDocumentParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Reads a therapy progress note from disk: plain text, PDF or Word.
 */
@Component
public class ProgressNoteLoader {

    private static final Logger log = LoggerFactory.getLogger(ProgressNoteLoader.class);

    public String load(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new IllegalArgumentException("Not a file: " + path);
        }
        Document document = FileSystemDocumentLoader.loadDocument(path, parserFor(path));
        log.debug("Loaded progress note {} ({} chars)", path.getFileName(), document.text().length());
        return document.text();
    }

    private static DocumentParser parserFor(Path path) {
        String fileName = path.getFileName().toString().toLowerCase(Locale.ROOT);
        if (fileName.endsWith(".txt")) {
            return new TextDocumentParser();
        } else if (fileName.endsWith(".pdf")) {
            return new ApachePdfBoxDocumentParser();
        } else if (fileName.endsWith(".doc") || fileName.endsWith(".docx")) {
            return new ApachePoiDocumentParser();
        }
        throw new IllegalArgumentException("Unsupported progress note format: " + path.getFileName());
    }
}
