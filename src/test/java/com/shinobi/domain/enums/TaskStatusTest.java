package com.shinobi.domain.enums;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class TaskStatusTest {

    @Test
    @DisplayName("wire values use snake_case and the cancelled spelling")
    void wireValues() {
        assertThat(TaskStatus.IN_PROGRESS.getValue()).isEqualTo("in_progress");
        assertThat(TaskStatus.fromValue("Cancelled")).isEqualTo(TaskStatus.CANCELLED);
        assertThatThrownBy(() -> TaskStatus.fromValue("canceled"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("cancelled");
    }

    @Test
    @DisplayName("only completed and cancelled are terminal")
    void terminal() {
        assertThat(TaskStatus.COMPLETED.isTerminal()).isTrue();
        assertThat(TaskStatus.CANCELLED.isTerminal()).isTrue();
        assertThat(TaskStatus.PENDING.isTerminal()).isFalse();
        assertThat(TaskStatus.IN_PROGRESS.isTerminal()).isFalse();
    }
}
