package com.phillippitts.mediatoolbox.service.job.progress;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DiagnosticBufferTest {

    @Test
    void appendsRecordsAsLines() {
        DiagnosticBuffer buffer = new DiagnosticBuffer(100);
        buffer.append("first");
        buffer.append("second");

        assertThat(buffer.text()).isEqualTo("first\nsecond\n");
        assertThat(buffer.isCapReached()).isFalse();
    }

    @Test
    void keepsOldestContentOnceCapIsReached() {
        DiagnosticBuffer buffer = new DiagnosticBuffer(10);
        buffer.append("12345");
        buffer.append("abcdefgh");
        buffer.append("later");

        assertThat(buffer.text()).isEqualTo("12345\nabcd");
        assertThat(buffer.text()).hasSize(10);
        assertThat(buffer.isCapReached()).isTrue();
    }

    @Test
    void exactFitMarksCapReached() {
        DiagnosticBuffer buffer = new DiagnosticBuffer(4);
        buffer.append("abc");
        buffer.append("d");

        assertThat(buffer.text()).isEqualTo("abc\n");
        assertThat(buffer.isCapReached()).isTrue();
    }

    @Test
    void ignoresNull() {
        DiagnosticBuffer buffer = new DiagnosticBuffer(8);
        buffer.append(null);
        assertThat(buffer.text()).isEmpty();
    }

    @Test
    void rejectsNonPositiveCap() {
        assertThatThrownBy(() -> new DiagnosticBuffer(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
