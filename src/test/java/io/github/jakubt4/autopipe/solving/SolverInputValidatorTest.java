package io.github.jakubt4.autopipe.solving;

import io.github.jakubt4.autopipe.config.AutopipeProperties;
import io.github.jakubt4.autopipe.fits.FitsImageIo;
import io.github.jakubt4.autopipe.support.TestFrames;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class SolverInputValidatorTest {

    @TempDir
    Path dir;

    private final SolverInputValidator validator = new SolverInputValidator(new FitsImageIo(), new AutopipeProperties());

    @Test
    void acceptsStarField() throws Exception {
        final var image = TestFrames.light(dir.resolve("ok.fits"), "2024-05-10T22:30:00")
                .write(TestFrames.starField(200, 150, 500f));

        assertThat(validator.validate(image)).isEmpty();
    }

    @Test
    void rejectsSmallImage() throws Exception {
        final var image = TestFrames.light(dir.resolve("small.fits"), "2024-05-10T22:30:00")
                .write(TestFrames.starField(80, 150, 500f));

        assertThat(validator.validate(image)).hasValueSatisfying(reason -> assertThat(reason).contains("too small"));
    }

    @Test
    void rejectsFlatImage() throws Exception {
        final var image = TestFrames.light(dir.resolve("flat.fits"), "2024-05-10T22:30:00")
                .write(TestFrames.constant(150, 150, 1200f));

        assertThat(validator.validate(image)).hasValueSatisfying(reason -> assertThat(reason).contains("no contrast"));
    }

    @Test
    void rejectsDarkImage() throws Exception {
        final var image = TestFrames.light(dir.resolve("dark.fits"), "2024-05-10T22:30:00")
                .write(TestFrames.starField(150, 150, -400f));

        assertThat(validator.validate(image)).hasValueSatisfying(reason -> assertThat(reason).contains("too little signal"));
    }

    @Test
    void rejectsUnreadableFile() throws Exception {
        final var image = Files.writeString(dir.resolve("broken.fits"), "not fits");

        assertThat(validator.validate(image)).isPresent();
    }
}
