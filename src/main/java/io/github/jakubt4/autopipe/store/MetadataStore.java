package io.github.jakubt4.autopipe.store;

import io.github.jakubt4.autopipe.model.FrameMetadata;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Keyed frame metadata shared with the library browser. Rows are keyed by absolute
 * path and written one at a time; no operation spans more than one row.
 */
public interface MetadataStore {

    Optional<FrameMetadata> get(Path path);

    void upsert(FrameMetadata frame);

    List<FrameMetadata> query(ReferenceQuery query);
}
