package com.expensesnap.core.infrastructure.security;

import com.expensesnap.core.config.AppProperties;
import com.expensesnap.core.exception.ValidationException;
import org.apache.tika.Tika;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Set;

/**
 * Rejects uploads that are empty, too large, or whose sniffed content is neither an image
 * nor a PDF. The declared file name is not trusted for this check.
 */
@Service
public class UploadValidationService {

    private static final Logger log = LoggerFactory.getLogger(UploadValidationService.class);

    // Formats Tika cannot identify from magic bytes alone (e.g. some HEIC variants) come back as octet-stream
    private static final Set<String> ALLOWED_NON_IMAGE_TYPES = Set.of(
            "application/pdf",
            "application/octet-stream"
    );

    private final Tika tika = new Tika();
    private final long maxBytes;

    public UploadValidationService(AppProperties props) {
        this.maxBytes = props.getUpload().getMaxBytes();
        log.info("UploadValidationService initialized - max upload size: {} bytes", maxBytes);
    }

    public String validate(String filename, byte[] content) {
        if (content == null || content.length == 0) {
            log.warn("Empty upload: '{}'", filename);
            throw new ValidationException("No file uploaded");
        }
        if (content.length > maxBytes) {
            log.warn("Upload too large: '{}' - {} bytes (max: {} bytes)", filename, content.length, maxBytes);
            throw new ValidationException("File exceeds the " + (maxBytes / (1024 * 1024)) + "MB limit");
        }

        String detected = tika.detect(content, filename);
        if (!isAllowed(detected)) {
            log.warn("Rejected upload '{}' with detected type '{}'", filename, detected);
            throw new ValidationException("Only images and PDF files are accepted (detected: " + detected + ")");
        }
        log.debug("Upload '{}' accepted as {}", filename, detected);
        return detected;
    }

    static boolean isAllowed(String mediaType) {
        return mediaType != null && (mediaType.startsWith("image/") || ALLOWED_NON_IMAGE_TYPES.contains(mediaType));
    }
}
