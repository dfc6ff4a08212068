package io.github.jakubt4.autopipe.store;

import io.github.jakubt4.autopipe.model.FrameKind;
import lombok.Builder;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Coarse predicate set for catalog lookups. Every {@code null} field is unconstrained.
 * The store narrows the candidate set; exact matching and tie-breaking stay with
 * {@link io.github.jakubt4.autopipe.calibration.ReferenceFrameSelector}.
 *
 * @param kind               frame kind equality (required)
 * @param binning            binning equality
 * @param filter             filter equality
 * @param gain               gain equality
 * @param offset             offset equality
 * @param minTemperature     temperature lower bound, inclusive
 * @param maxTemperature     temperature upper bound, inclusive
 * @param minExposure        exposure lower bound, inclusive
 * @param producedOnOrBefore production date upper bound, inclusive
 * @param producedOnOrAfter  production date lower bound, inclusive
 */
@Builder
public record ReferenceQuery(FrameKind kind,
                             String binning,
                             String filter,
                             Double gain,
                             Double offset,
                             Double minTemperature,
                             Double maxTemperature,
                             Double minExposure,
                             LocalDate producedOnOrBefore,
                             LocalDate producedOnOrAfter) {

    public ReferenceQuery {
        Objects.requireNonNull(kind, "kind");
    }

    public static ReferenceQuery allOf(final FrameKind kind) {
        return ReferenceQuery.builder().kind(kind).build();
    }
}
