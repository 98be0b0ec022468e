package com.unitutor.courseware.infra;

import com.unitutor.courseware.config.StorageProperties;
import com.unitutor.courseware.exception.DocumentStorageException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

@Slf4j
@Component
@RequiredArgsConstructor
public class DocumentFileStorage {

    private final StorageProperties storageProperties;

    public Path store(String documentId, byte[] content) {
        Path uploadDir = Path.of(storageProperties.uploadDir());
        Path target = uploadDir.resolve(documentId + ".pdf");

        Path temp = null;
        try {
            Files.createDirectories(uploadDir);
            temp = Files.createTempFile(uploadDir, documentId, ".part");
            Files.write(temp, content);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            DocumentStorageException failure = new DocumentStorageException("Failed to store document " + documentId, e);
            if (temp != null) {
                try {
                    Files.deleteIfExists(temp);
                } catch (IOException cleanupError) {
                    failure.addSuppressed(cleanupError);
                }
            }
            throw failure;
        }

        log.debug("Stored document {} at {}", documentId, target);
        return target.toAbsolutePath();
    }

    public boolean exists(String filePath) {
        return filePath != null && Files.isRegularFile(Path.of(filePath));
    }
}
