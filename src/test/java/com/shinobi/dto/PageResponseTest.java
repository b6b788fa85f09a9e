package com.shinobi.dto;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.PageRequest;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
@DisplayName("PageResponse envelope")
class PageResponseTest {

    @Test
    @DisplayName("pages rounds up and both neighbours exist in the middle of the range")
    void middlePage() {
        PageResponse<String> response = PageResponse.of(List.of("f", "g", "h", "i", "j"), 12, 2, 5);

        assertThat(response.pages()).isEqualTo(3);
        assertThat(response.hasNext()).isTrue();
        assertThat(response.hasPrev()).isTrue();
        assertThat(response.total()).isEqualTo(12);
    }

    @Test
    @DisplayName("empty result has zero pages and no neighbours")
    void emptyResult() {
        PageResponse<String> response = PageResponse.of(List.of(), 0, 1, 10);

        assertThat(response.pages()).isZero();
        assertThat(response.hasNext()).isFalse();
        assertThat(response.hasPrev()).isFalse();
        assertThat(response.items()).isEmpty();
    }

    @Test
    @DisplayName("page past the end keeps the real total and points back")
    void pagePastTheEnd() {
        PageResponse<String> response = PageResponse.of(List.of(), 3, 5, 10);

        assertThat(response.pages()).isEqualTo(1);
        assertThat(response.hasNext()).isFalse();
        assertThat(response.hasPrev()).isTrue();
        assertThat(response.total()).isEqualTo(3);
    }

    @Test
    @DisplayName("exact multiple of size does not add an extra page")
    void exactMultiple() {
        PageResponse<String> response = PageResponse.of(List.of("a", "b"), 10, 5, 2);

        assertThat(response.pages()).isEqualTo(5);
        assertThat(response.hasNext()).isFalse();
    }

    @Test
    @DisplayName("from maps the page content and uses the page total")
    void fromSpringPage() {
        PageImpl<Integer> page = new PageImpl<>(List.of(1, 2), PageRequest.of(0, 2), 7);

        PageResponse<String> response = PageResponse.from(page, 1, 2, value -> "#" + value);

        assertThat(response.items()).containsExactly("#1", "#2");
        assertThat(response.total()).isEqualTo(7);
        assertThat(response.pages()).isEqualTo(4);
        assertThat(response.hasNext()).isTrue();
        assertThat(response.hasPrev()).isFalse();
    }
}
