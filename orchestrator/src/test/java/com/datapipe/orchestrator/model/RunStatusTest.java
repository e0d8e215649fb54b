package com.datapipe.orchestrator.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RunStatusTest {

    @Test
    void fromValue_caseInsensitive() {
        assertThat(RunStatus.fromValue("running")).isEqualTo(RunStatus.RUNNING);
        assertThat(RunStatus.fromValue(" Completed ")).isEqualTo(RunStatus.COMPLETED);
    }

    @Test
    void fromValue_unknownOrBlank_rejected() {
        assertThatThrownBy(() -> RunStatus.fromValue("paused")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> RunStatus.fromValue(" ")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> RunStatus.fromValue(null)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void json_lowercaseOnTheWire() throws Exception {
        ObjectMapper json = new ObjectMapper();

        assertThat(json.writeValueAsString(RunStatus.FAILED)).isEqualTo("\"failed\"");
        assertThat(json.readValue("\"PENDING\"", RunStatus.class)).isEqualTo(RunStatus.PENDING);
    }

    @Test
    void terminal_onlyCompletedAndFailed() {
        assertThat(RunStatus.COMPLETED.isTerminal()).isTrue();
        assertThat(RunStatus.FAILED.isTerminal()).isTrue();
        assertThat(RunStatus.PENDING.isTerminal()).isFalse();
        assertThat(RunStatus.RUNNING.isTerminal()).isFalse();
    }
}
