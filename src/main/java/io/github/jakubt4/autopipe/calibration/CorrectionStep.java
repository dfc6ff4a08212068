package io.github.jakubt4.autopipe.calibration;

import io.github.jakubt4.autopipe.model.FrameKind;

import java.util.Locale;

/**
 * Calibration steps in the order they are always applied.
 */
public enum CorrectionStep {
    BIAS(FrameKind.BIAS, 'B'),
    DARK(FrameKind.DARK, 'D'),
    FLAT(FrameKind.FLAT, 'F');

    private final FrameKind referenceKind;
    private final char calstatCode;

    CorrectionStep(final FrameKind referenceKind, final char calstatCode) {
        this.referenceKind = referenceKind;
        this.calstatCode = calstatCode;
    }

    public FrameKind referenceKind() {
        return referenceKind;
    }

    /**
     * Letter recorded in the {@code CALSTAT} header keyword once the step is applied.
     */
    public char calstatCode() {
        return calstatCode;
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
