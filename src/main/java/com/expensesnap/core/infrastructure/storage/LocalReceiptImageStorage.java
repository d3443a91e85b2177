package com.expensesnap.core.infrastructure.storage;

import com.expensesnap.core.config.AppProperties;
import com.expensesnap.core.domain.ports.ReceiptImageStoragePort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.*;
import java.util.Locale;
import java.util.UUID;

@Component
public class LocalReceiptImageStorage implements ReceiptImageStoragePort {

    private static final Logger log = LoggerFactory.getLogger(LocalReceiptImageStorage.class);
    private static final String UNASSIGNED = "unassigned";

    private final AppProperties props;

    public LocalReceiptImageStorage(AppProperties props){ this.props = props; }

    @Override
    public String store(UUID companyId, byte[] bytes, String extension) {
        // Generated name only; the client filename never reaches the filesystem
        String safeName = UUID.randomUUID() + sanitizeExtension(extension);
        String folder = companyId == null ? UNASSIGNED : companyId.toString();

        Path dir = root().resolve(folder);
        Path file = dir.resolve(safeName);
        try {
            Files.createDirectories(dir);
            Files.write(file, bytes, StandardOpenOption.CREATE_NEW);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not store receipt image", e);
        }
        log.debug("Stored receipt image {} ({} bytes)", file, bytes.length);
        return folder + "/" + safeName;
    }

    @Override
    public void delete(String reference) {
        if (reference == null || reference.isBlank()) {
            return;
        }
        Path file = root().resolve(reference).normalize();
        if (!file.startsWith(root())) {
            log.warn("Refusing to delete receipt image outside storage root: {}", reference);
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("Could not delete receipt image {}: {}", file, e.getMessage());
        }
    }

    Path resolve(String reference) {
        return root().resolve(reference).normalize();
    }

    private Path root() {
        return Path.of(props.getStorage().getBasePath()).toAbsolutePath().normalize();
    }

    private static String sanitizeExtension(String extension) {
        if (extension == null || !extension.matches("\\.[A-Za-z0-9]{1,5}")) {
            return ".jpg";
        }
        return extension.toLowerCase(Locale.ROOT);
    }
}
