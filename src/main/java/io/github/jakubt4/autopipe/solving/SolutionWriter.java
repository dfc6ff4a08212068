package io.github.jakubt4.autopipe.solving;

import io.github.jakubt4.autopipe.fits.FitsHeaderReader;
import io.github.jakubt4.autopipe.fits.FitsImageIo;
import io.github.jakubt4.autopipe.fits.InvalidFrameException;
import io.github.jakubt4.autopipe.fits.WcsKeywords;
import io.github.jakubt4.autopipe.model.FrameMetadata;
import io.github.jakubt4.autopipe.store.MetadataStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import nom.tam.fits.Header;
import nom.tam.fits.HeaderCard;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Merges a solved WCS into the target frame's header and re-syncs its store record.
 *
 * <p>Existing WCS and SIP keywords are replaced as a block. The solver's solution file
 * is deleted only after the merge is on disk; on failure it is left for inspection.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SolutionWriter {

    static final String HISTORY_LINE = "Plate solved with astrometry.net";

    private final FitsHeaderReader headerReader;
    private final FitsImageIo imageIo;
    private final MetadataStore store;

    /**
     * @return the target's metadata as re-read after the merge
     * @throws SolutionWriteException if the solution cannot be read or merged
     */
    public FrameMetadata apply(final Path target, final SolvingResult result) {
        if (!result.success() || result.solutionFile() == null) {
            throw new IllegalArgumentException("Not a successful solution: " + result.state());
        }
        final var solutionFile = result.solutionFile();

        final List<HeaderCard> solutionCards;
        try {
            solutionCards = wcsCards(headerReader.readHeader(solutionFile));
        } catch (final InvalidFrameException e) {
            throw new SolutionWriteException(target, "Cannot read solution " + solutionFile, e);
        }
        if (solutionCards.isEmpty()) {
            throw new SolutionWriteException(target, "Solution " + solutionFile + " carries no WCS keywords");
        }

        try {
            imageIo.rewriteHeader(target, header -> {
                for (final var key : wcsKeys(header)) {
                    header.deleteKey(key);
                }
                for (final var card : solutionCards) {
                    header.addLine(card);
                }
                header.insertHistory(HISTORY_LINE);
            });
        } catch (final IOException | RuntimeException e) {
            throw new SolutionWriteException(target, "Cannot write solution from " + solutionFile, e);
        }
        log.info("[WRITE-BACK] {} | WCS merged ({} keywords)", target.getFileName(), solutionCards.size());

        try {
            Files.deleteIfExists(solutionFile);
        } catch (final IOException e) {
            log.warn("[WRITE-BACK] Merged, but could not remove {}: {}", solutionFile, e.getMessage());
        }

        try {
            return resync(target);
        } catch (final RuntimeException e) {
            throw new SolutionWriteException(target, "WCS merged but store re-sync failed", e);
        }
    }

    private FrameMetadata resync(final Path target) {
        final var reread = headerReader.read(target);
        final var tracked = store.get(target);
        if (tracked.isEmpty()) {
            return reread;
        }
        final var merged = reread.toBuilder().kind(tracked.get().kind()).build();
        store.upsert(merged);
        log.info("[STORE] Re-synced {}", target.getFileName());
        return merged;
    }

    private static List<HeaderCard> wcsCards(final Header header) {
        final var cards = new ArrayList<HeaderCard>();
        final var cursor = header.iterator();
        while (cursor.hasNext()) {
            final var card = cursor.next();
            final var key = card.getKey();
            if (key != null && WcsKeywords.isWcs(key) && card.isKeyValuePair()) {
                cards.add(card);
            }
        }
        return cards;
    }

    private static List<String> wcsKeys(final Header header) {
        final var keys = new ArrayList<String>();
        final var cursor = header.iterator();
        while (cursor.hasNext()) {
            final var key = cursor.next().getKey();
            if (key != null && WcsKeywords.isWcs(key)) {
                keys.add(key);
            }
        }
        return keys;
    }
}
