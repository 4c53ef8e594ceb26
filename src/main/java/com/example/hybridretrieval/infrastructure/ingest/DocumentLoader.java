package com.example.hybridretrieval.infrastructure.ingest;

import com.example.hybridretrieval.controller.exception.BusinessException;
import com.example.hybridretrieval.domain.model.Document;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.multipart.MultipartFile;

/**
 * Loads plain text, markdown and PDF files into {@link Document}s.
 */
@Component
public class DocumentLoader {

    private static final Logger log = LoggerFactory.getLogger(DocumentLoader.class);

    private static final Set<String> TEXT_EXTENSIONS = Set.of("txt", "md", "markdown");
    private static final String PDF_EXTENSION = "pdf";

    private final PdfExtractor pdfExtractor;

    public DocumentLoader(PdfExtractor pdfExtractor) {
        this.pdfExtractor = pdfExtractor;
    }

    public static boolean isSupported(String fileName) {
        String ext = extension(fileName);
        return TEXT_EXTENSIONS.contains(ext) || PDF_EXTENSION.equals(ext);
    }

    /**
     * Recursively loads every supported file under {@code directory}. Files that cannot be read are
     * logged and skipped.
     */
    public List<Document> loadDirectory(Path directory) {
        if (directory == null || !Files.isDirectory(directory)) {
            throw BusinessException.notFound("Directory not found: " + directory);
        }

        List<Path> files;
        try (Stream<Path> walk = Files.walk(directory)) {
            files = walk.filter(Files::isRegularFile)
                    .filter(p -> isSupported(p.getFileName().toString()))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to scan directory: " + directory, e);
        }

        Instant now = Instant.now();
        List<Document> documents = new ArrayList<>(files.size());
        for (Path file : files) {
            String source = directory.relativize(file).toString().replace('\\', '/');
            try (InputStream in = Files.newInputStream(file)) {
                String text = read(file.getFileName().toString(), in);
                documents.add(new Document(text, source, title(file.getFileName().toString()), now));
                log.info("event=document_loaded source={} chars={}", source, text.length());
            } catch (IOException | RuntimeException e) {
                log.warn("event=document_load_failed source={} err={}", source, e.toString());
            }
        }

        log.info("event=directory_loaded dir={} files={} loaded={}", directory, files.size(), documents.size());
        return documents;
    }

    public Document loadUpload(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw BusinessException.badRequest("file is required");
        }
        String name = file.getOriginalFilename() == null ? "upload.txt" : file.getOriginalFilename();
        if (!isSupported(name)) {
            throw BusinessException.badRequest("Only .txt, .md, .markdown and .pdf uploads are supported");
        }
        try (InputStream in = file.getInputStream()) {
            String text = read(name, in);
            return new Document(text, name, title(name), Instant.now());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read upload: " + name, e);
        }
    }

    private String read(String fileName, InputStream in) throws IOException {
        if (PDF_EXTENSION.equals(extension(fileName))) {
            return pdfExtractor.extractText(in);
        }
        return new String(in.readAllBytes(), StandardCharsets.UTF_8);
    }

    private static String title(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }

    private static String extension(String fileName) {
        if (fileName == null) {
            return "";
        }
        int dot = fileName.lastIndexOf('.');
        return dot < 0 ? "" : fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
