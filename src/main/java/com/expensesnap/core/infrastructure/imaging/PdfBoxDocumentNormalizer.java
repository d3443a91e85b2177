package com.expensesnap.core.infrastructure.imaging;

import com.expensesnap.core.config.AppProperties;
import com.expensesnap.core.domain.NormalizedDocument;
import com.expensesnap.core.domain.NormalizedImage;
import com.expensesnap.core.domain.ports.DocumentNormalizer;
import com.expensesnap.core.exception.ConversionFailedException;
import com.expensesnap.core.exception.DocumentUnreadableException;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Normalizes uploads into images the extraction service accepts. PDFs are rasterised with
 * PDFBox; HEIC/HEIF and oversized images are re-encoded as JPEG through ImageIO. HEIC that no
 * installed ImageIO reader understands is decoded by {@link ExternalHeifConverter}.
 */
@Component
public class PdfBoxDocumentNormalizer implements DocumentNormalizer {

    private static final Logger log = LoggerFactory.getLogger(PdfBoxDocumentNormalizer.class);

    static final String JPEG = "image/jpeg";
    static final String PNG = "image/png";
    static final String HEIC = "image/heic";
    static final String PDF = "application/pdf";

    private static final Map<String, String> MEDIA_TYPES = Map.of(
            ".jpg", JPEG,
            ".jpeg", JPEG,
            ".png", PNG,
            ".webp", "image/webp",
            ".gif", "image/gif",
            ".heic", HEIC,
            ".heif", HEIC,
            ".pdf", PDF);

    private final AppProperties.Normalizer settings;
    private final ImageTranscoder transcoder = new ImageTranscoder();
    private final ExternalHeifConverter heifConverter;

    public PdfBoxDocumentNormalizer(AppProperties props) {
        this.settings = props.getNormalizer();
        this.heifConverter = new ExternalHeifConverter(settings);
    }

    @Override
    public NormalizedDocument normalize(byte[] content, String filename) {
        String extension = extensionOf(filename);
        String mediaType = mediaTypeFor(extension);
        log.debug("Normalizing '{}' ({} bytes) as {}", filename, content.length, mediaType);

        if (PDF.equals(mediaType)) {
            return renderPdf(content);
        }

        byte[] bytes = content;
        String previewExtension = MEDIA_TYPES.containsKey(extension) ? extension : ".jpg";

        if (HEIC.equals(mediaType)) {
            bytes = convertHeic(content);
            mediaType = JPEG;
            previewExtension = ".jpg";
        }

        if (bytes.length > settings.getCompressThresholdBytes()) {
            byte[] compressed = compress(bytes);
            if (compressed != null) {
                bytes = compressed;
                mediaType = JPEG;
                previewExtension = ".jpg";
            }
        }

        return new NormalizedDocument(List.of(new NormalizedImage(bytes, mediaType)), bytes, previewExtension);
    }

    static String extensionOf(String filename) {
        if (filename == null) {
            return "";
        }
        int dot = filename.lastIndexOf('.');
        int slash = Math.max(filename.lastIndexOf('/'), filename.lastIndexOf('\\'));
        if (dot < 0 || dot < slash) {
            return "";
        }
        return filename.substring(dot).toLowerCase(Locale.ROOT);
    }

    /** Unknown extensions are sent as JPEG. */
    static String mediaTypeFor(String extension) {
        return MEDIA_TYPES.getOrDefault(extension, JPEG);
    }

    private byte[] convertHeic(byte[] content) {
        try {
            BufferedImage image = transcoder.decode(content);
            if (image == null) {
                log.debug("No ImageIO reader for HEIC, falling back to the external converter");
                image = heifConverter.convert(content);
            }
            if (image == null) {
                throw new ConversionFailedException("Failed to convert HEIC: converter output could not be decoded");
            }
            return transcoder.encodeJpeg(image, settings.getHeicQuality());
        } catch (IOException e) {
            throw new ConversionFailedException("Failed to convert HEIC: " + e.getMessage(), e);
        }
    }

    /**
     * Best effort: returns null when the image cannot be decoded or re-encoded, in which case
     * the caller keeps the original bytes.
     */
    private byte[] compress(byte[] bytes) {
        try {
            BufferedImage image = transcoder.decode(bytes);
            if (image == null) {
                log.info("Skipping compression of {} byte image: format not decodable", bytes.length);
                return null;
            }
            byte[] out = transcoder.encodeJpeg(transcoder.fitWithin(image, settings.getMaxDimension()),
                    settings.getCompressQuality());
            log.debug("Compressed image from {} to {} bytes", bytes.length, out.length);
            return out;
        } catch (IOException | RuntimeException e) {
            log.warn("Image compression failed, sending original bytes: {}", e.getMessage());
            return null;
        }
    }

    private NormalizedDocument renderPdf(byte[] content) {
        try (PDDocument document = PDDocument.load(content)) {
            int pageCount = document.getNumberOfPages();
            if (pageCount == 0) {
                throw new DocumentUnreadableException("Failed to read PDF: document has no pages");
            }
            int pagesToRender = Math.min(pageCount, settings.getPdfMaxPages());
            if (pageCount > pagesToRender) {
                log.info("PDF has {} pages, rendering the first {}", pageCount, pagesToRender);
            }

            PDFRenderer renderer = new PDFRenderer(document);
            List<NormalizedImage> pages = new ArrayList<>(pagesToRender);
            for (int i = 0; i < pagesToRender; i++) {
                BufferedImage page = renderer.renderImageWithDPI(i, settings.getPdfDpi(), ImageType.RGB);
                pages.add(new NormalizedImage(transcoder.encodePng(page), PNG));
            }
            return new NormalizedDocument(pages, pages.get(0).bytes(), ".png");
        } catch (IOException e) {
            throw new DocumentUnreadableException("Failed to read PDF: " + e.getMessage(), e);
        }
    }
}
