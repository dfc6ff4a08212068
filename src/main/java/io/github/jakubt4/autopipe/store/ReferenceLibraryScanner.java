package io.github.jakubt4.autopipe.store;

import io.github.jakubt4.autopipe.config.AutopipeProperties;
import io.github.jakubt4.autopipe.fits.FitsHeaderReader;
import io.github.jakubt4.autopipe.fits.InvalidFrameException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Imports calibration masters found under a library directory into the {@link MetadataStore}.
 * Light frames in the library are ignored; unreadable files are counted and reported.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReferenceLibraryScanner {

    private final AutopipeProperties properties;
    private final FitsHeaderReader headerReader;
    private final MetadataStore store;

    /**
     * @param found    FITS files seen
     * @param imported masters upserted
     * @param ignored  light frames skipped
     * @param errors   one message per unreadable file
     */
    public record ScanSummary(int found, int imported, int ignored, List<String> errors) {
    }

    public ScanSummary scan(final Path libraryRoot) throws IOException {
        final List<Path> files;
        try (Stream<Path> walk = Files.walk(libraryRoot)) {
            files = walk.filter(Files::isRegularFile)
                    .filter(properties.getWatch()::isFitsFile)
                    .sorted()
                    .toList();
        }

        var imported = 0;
        var ignored = 0;
        final var errors = new ArrayList<String>();
        for (final var file : files) {
            try {
                final var frame = headerReader.read(file);
                if (!frame.kind().isReference()) {
                    ignored++;
                    continue;
                }
                store.upsert(frame);
                imported++;
            } catch (final InvalidFrameException | MetadataStoreException e) {
                log.warn("[STORE] Skipping {}: {}", file, e.getMessage());
                errors.add(e.getMessage());
            }
        }
        log.info("[STORE] Library scan of {} | found={} imported={} ignored={} errors={}",
                libraryRoot, files.size(), imported, ignored, errors.size());
        return new ScanSummary(files.size(), imported, ignored, List.copyOf(errors));
    }
}
