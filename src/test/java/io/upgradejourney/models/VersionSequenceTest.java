package io.upgradejourney.models;

import io.upgradejourney.exceptions.SequenceException;
import io.upgradejourney.enums.ErrorKind;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class VersionSequenceTest {

    @Test
    void testEmptySequenceIsRejected() {
        assertThatThrownBy(() -> VersionSequence.of(List.of()))
            .isInstanceOf(SequenceException.class)
            .hasMessageContaining("non-empty")
            .satisfies(e -> assertThat(((SequenceException) e).getKind()).isEqualTo(ErrorKind.SEQUENCE));
    }

    @Test
    void testNullSequenceIsRejected() {
        assertThatThrownBy(() -> VersionSequence.of((List<String>) null))
            .isInstanceOf(SequenceException.class);
    }

    @Test
    void testBlankEntryIsRejected() {
        assertThatThrownBy(() -> VersionSequence.of(Arrays.asList("1.0", " ")))
            .isInstanceOf(SequenceException.class)
            .hasMessageContaining("position 1");
    }

    @Test
    void testOrderAndBootstrapVersion() {
        VersionSequence sequence = VersionSequence.of("1.0", "1.1", "1.2");

        assertThat(sequence.size()).isEqualTo(3);
        assertThat(sequence.bootstrapVersion()).isEqualTo("1.0");
        assertThat(sequence.get(2)).isEqualTo("1.2");
        assertThat(sequence).containsExactly("1.0", "1.1", "1.2");
        assertThat(sequence.toString()).isEqualTo("1.0 -> 1.1 -> 1.2");
    }

    @Test
    void testDuplicatesAreKept() {
        VersionSequence sequence = VersionSequence.of("1.0", "1.1", "1.1");

        assertThat(sequence).containsExactly("1.0", "1.1", "1.1");
    }

    @Test
    void testWindowIsInclusive() {
        VersionSequence sequence = VersionSequence.of("1.0", "1.1", "1.2");

        assertThat(sequence.window(0)).containsExactly("1.0");
        assertThat(sequence.window(1)).containsExactly("1.0", "1.1");
        assertThatThrownBy(() -> sequence.window(3)).isInstanceOf(IndexOutOfBoundsException.class);
    }

    @Test
    void testSequenceIsDetachedFromSourceList() {
        List<String> source = new ArrayList<>(List.of("1.0"));
        VersionSequence sequence = VersionSequence.of(source);
        source.add("1.1");

        assertThat(sequence.size()).isEqualTo(1);
        assertThatThrownBy(() -> sequence.window(0).add("2.0")).isInstanceOf(UnsupportedOperationException.class);
    }
}
