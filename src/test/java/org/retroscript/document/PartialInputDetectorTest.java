package org.retroscript.document;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class PartialInputDetectorTest {

    private final PartialInputDetector detector = new PartialInputDetector();

    @Test
    void openBracketsAndCommasArePartial() {
        assertThat(detector.isPartial("click(", "")).isTrue();
        assertThat(detector.isPartial("flow main {  \t", "")).isTrue();
        assertThat(detector.isPartial("wait_any([", "")).isTrue();
        assertThat(detector.isPartial("click(1,", "")).isTrue();
    }

    @Test
    void oddQuoteCountIsPartial() {
        assertThat(detector.isPartial("type_text(\"abc);", "")).isTrue();
        assertThat(detector.isPartial("type_text(\"a\\\"b\");", "")).isFalse();
    }

    @Test
    void growingWordIsPartial() {
        assertThat(detector.isPartial("flow main { cli", "flow main { cl")).isTrue();
        assertThat(detector.isPartial("flow main { cl", "flow main { cli")).isFalse();
    }

    @Test
    void completeTextIsNotPartial() {
        assertThat(detector.isPartial("flow main { click(1, 2); }", "")).isFalse();
        assertThat(detector.isPartial("flow main {}\n", null)).isFalse();
        assertThat(detector.isPartial("", "abc")).isFalse();
    }
}
