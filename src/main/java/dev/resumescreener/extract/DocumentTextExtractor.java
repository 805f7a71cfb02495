package dev.resumescreener.extract;

import dev.resumescreener.config.ScreeningConfig;
import dev.resumescreener.error.ErrorKind;
import dev.resumescreener.error.ScreeningException;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.poi.xwpf.extractor.XWPFWordExtractor;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.jsoup.Jsoup;
import org.springframework.stereotype.Service;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Set;

/**
 * Text extraction for PDF (PDFBox), DOCX (POI), HTML (Jsoup) and plain text / Markdown.
 */
@Slf4j
@Service
public class DocumentTextExtractor implements TextExtractor {

    static final Set<String> SUPPORTED_EXTENSIONS = Set.of(".pdf", ".docx", ".html", ".htm", ".txt", ".md");

    private final int minTextLength;
    private final int maxChars;

    public DocumentTextExtractor(ScreeningConfig config) {
        this.minTextLength = config.getExtraction().getMinTextLength();
        this.maxChars = config.getExtraction().getMaxChars();
    }

    @Override
    public String extractText(byte[] content, String filename) {
        String extension = extensionOf(filename);
        if (!SUPPORTED_EXTENSIONS.contains(extension)) {
            throw new ScreeningException(ErrorKind.UNSUPPORTED_FORMAT,
                    "Unsupported file format: " + (extension.isEmpty() ? filename : extension)
                            + ". Supported: " + SUPPORTED_EXTENSIONS);
        }
        if (content == null || content.length == 0) {
            throw new ScreeningException(ErrorKind.EXTRACTION_FAILED, "Empty document: " + filename);
        }

        log.debug("Extracting text from {} ({})", filename, extension);
        String raw;
        try {
            raw = switch (extension) {
                case ".pdf" -> extractPdf(content);
                case ".docx" -> extractDocx(content);
                case ".html", ".htm" -> Jsoup.parse(decode(content)).text();
                default -> decode(content);
            };
        } catch (IOException | RuntimeException e) {
            throw new ScreeningException(ErrorKind.EXTRACTION_FAILED,
                    "Text extraction failed for " + filename + ": " + e.getMessage(), e);
        }

        String text = clean(raw);
        if (text.length() < minTextLength) {
            throw new ScreeningException(ErrorKind.EXTRACTION_FAILED,
                    "Insufficient text extracted (" + text.length() + " chars). Minimum required: " + minTextLength);
        }
        log.debug("Extracted {} characters from {}", text.length(), filename);
        return truncate(text);
    }

    private String extractPdf(byte[] content) throws IOException {
        try (PDDocument document = Loader.loadPDF(content)) {
            return new PDFTextStripper().getText(document);
        }
    }

    private String extractDocx(byte[] content) throws IOException {
        try (XWPFDocument document = new XWPFDocument(new ByteArrayInputStream(content));
             XWPFWordExtractor extractor = new XWPFWordExtractor(document)) {
            return extractor.getText();
        }
    }

    /**
     * UTF-16 when a byte order mark says so, UTF-8 otherwise.
     */
    private String decode(byte[] content) {
        Charset charset = StandardCharsets.UTF_8;
        int offset = 0;
        if (content.length >= 2) {
            int b0 = content[0] & 0xFF;
            int b1 = content[1] & 0xFF;
            if (b0 == 0xFE && b1 == 0xFF) {
                charset = StandardCharsets.UTF_16BE;
                offset = 2;
            } else if (b0 == 0xFF && b1 == 0xFE) {
                charset = StandardCharsets.UTF_16LE;
                offset = 2;
            }
        }
        if (offset == 0 && content.length >= 3
                && (content[0] & 0xFF) == 0xEF && (content[1] & 0xFF) == 0xBB && (content[2] & 0xFF) == 0xBF) {
            offset = 3;
        }
        return new String(content, offset, content.length - offset, charset);
    }

    /**
     * Collapses runs of spaces and blank lines.
     */
    static String clean(String text) {
        if (text == null) {
            return "";
        }
        return text.replace('\u0000', ' ')
                .replaceAll("[ \\t\\x0B\\f\\r]+", " ")
                .replaceAll(" *\\n *", "\n")
                .replaceAll("\\n{3,}", "\n\n")
                .strip();
    }

    private String truncate(String text) {
        return text.length() > maxChars ? text.substring(0, maxChars) : text;
    }

    static String extensionOf(String filename) {
        if (filename == null) {
            return "";
        }
        int dot = filename.lastIndexOf('.');
        return dot < 0 ? "" : filename.substring(dot).toLowerCase(Locale.ROOT);
    }
}
