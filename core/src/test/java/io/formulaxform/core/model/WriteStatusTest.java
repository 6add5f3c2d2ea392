package io.formulaxform.core.model;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

@DisplayName("WriteStatus")
class WriteStatusTest {

    @ParameterizedTest(name = "volume={0}, boundary={1} -> {2}")
    @CsvSource({
        "WRITTEN, WRITTEN, WRITTEN",
        "WRITTEN, SKIPPED, WRITTEN",
        "SKIPPED, WRITTEN, WRITTEN",
        "SKIPPED, SKIPPED, SKIPPED",
        "FAILED,  WRITTEN, FAILED",
        "FAILED,  SKIPPED, FAILED",
        "WRITTEN, FAILED,  FAILED",
        "SKIPPED, FAILED,  FAILED"
    })
    @DisplayName("a failure on either side wins, then a write")
    void combine(WriteStatus volume, WriteStatus boundary, WriteStatus expected) {
        assertThat(WriteStatus.combine(volume, boundary)).isEqualTo(expected);
    }
}
