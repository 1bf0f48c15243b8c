package com.shelfmark.app.format;

import java.io.IOException;
import java.io.InputStream;

import org.apache.commons.lang3.StringUtils;
import org.apache.pdfbox.io.MemoryUsageSetting;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDDocumentInformation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Title, author, producer and page count from a PDF's document information dictionary.
 */
public final class PdfMetadataReader implements MetadataReader {

    private static final Logger logger = LoggerFactory.getLogger(PdfMetadataReader.class);

    private final long maxMainMemoryBytes;

    public PdfMetadataReader(long maxMainMemoryBytes) {
        this.maxMainMemoryBytes = maxMainMemoryBytes;
    }

    @Override
    public EmbeddedMetadata read(ValidationSource source) {
        try (InputStream in = source.open();
             PDDocument doc = PDDocument.load(in, MemoryUsageSetting.setupMixed(maxMainMemoryBytes))) {
            PDDocumentInformation info = doc.getDocumentInformation();
            return new EmbeddedMetadata(
                    clean(info.getTitle()),
                    clean(info.getAuthor()),
                    doc.getNumberOfPages(),
                    clean(info.getProducer()));
        } catch (IOException | RuntimeException e) {
            logger.debug("No readable PDF metadata in {}: {}", source.name(), e.toString());
            return EmbeddedMetadata.NONE;
        }
    }

    private static String clean(String value) {
        String v = StringUtils.normalizeSpace(value);
        return StringUtils.isEmpty(v) ? null : v;
    }
}
