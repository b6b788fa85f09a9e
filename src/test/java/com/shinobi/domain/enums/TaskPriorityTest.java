package com.shinobi.domain.enums;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
@DisplayName("TaskPriority parsing")
class TaskPriorityTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    @DisplayName("accepts labels in any case and numeric levels")
    void acceptsLabelOrLevel() {
        assertThat(TaskPriority.from("HIGH")).isEqualTo(TaskPriority.HIGH);
        assertThat(TaskPriority.from(" low ")).isEqualTo(TaskPriority.LOW);
        assertThat(TaskPriority.from(2)).isEqualTo(TaskPriority.MEDIUM);
        assertThat(TaskPriority.from("3")).isEqualTo(TaskPriority.HIGH);
        assertThat(TaskPriority.from(null)).isNull();
    }

    @ParameterizedTest
    @ValueSource(strings = {"urgent", "0", "4", ""})
    @DisplayName("rejects unknown labels and out-of-range levels")
    void rejectsUnknown(String raw) {
        assertThatThrownBy(() -> TaskPriority.from(raw))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("rejects fractional and out-of-range numbers instead of truncating them")
    void rejectsNonIntegralLevels() {
        assertThatThrownBy(() -> TaskPriority.from(2.9)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> TaskPriority.from(4294967298L)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> TaskPriority.from(-1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> TaskPriority.from("4294967298")).isInstanceOf(IllegalArgumentException.class);
        assertThat(TaskPriority.from(3.0)).isEqualTo(TaskPriority.HIGH);
    }

    @Test
    @DisplayName("JSON numbers outside the levels fail to bind")
    void jsonRejectsTruncatedNumbers() {
        assertThatThrownBy(() -> objectMapper.readValue("2.9", TaskPriority.class))
                .hasRootCauseInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> objectMapper.readValue("4294967298", TaskPriority.class))
                .hasRootCauseInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("serializes as label and reads back from JSON number or string")
    void jsonShape() throws Exception {
        assertThat(objectMapper.writeValueAsString(TaskPriority.HIGH)).isEqualTo("\"high\"");
        assertThat(objectMapper.readValue("1", TaskPriority.class)).isEqualTo(TaskPriority.LOW);
        assertThat(objectMapper.readValue("\"medium\"", TaskPriority.class)).isEqualTo(TaskPriority.MEDIUM);
    }

    @Test
    @DisplayName("levels are ordered low to high")
    void levels() {
        assertThat(TaskPriority.LOW.getLevel()).isLessThan(TaskPriority.MEDIUM.getLevel());
        assertThat(TaskPriority.fromLevel(3)).isEqualTo(TaskPriority.HIGH);
    }
}
