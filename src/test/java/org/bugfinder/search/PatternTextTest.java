package org.bugfinder.search;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PatternTextTest {

    @Test
    void patternLines_stripTrailingWhitespaceButKeepLeadingSpaces() {
        assertThat(PatternText.patternLines("  ab  \r\n c\t\n"))
                .containsExactly("  ab", " c");
    }

    @Test
    void landscapeLines_keepContentVerbatim() {
        assertThat(PatternText.landscapeLines("a  \n\n b\r\nc"))
                .containsExactly("a  ", "", " b", "c");
    }

    @Test
    void landscapeLines_breakOnlyOnNewlineAndCarriageReturn() {
        assertThat(PatternText.landscapeLines("ab\nx\fy\nab\n"))
                .containsExactly("ab", "x\fy", "ab");
        assertThat(PatternText.landscapeLines("a\u2028b\u0085c\u000Bd\n"))
                .containsExactly("a\u2028b\u0085c\u000Bd");
    }

    @Test
    void splitting_emptyTextHasNoLines() {
        assertThat(PatternText.patternLines("")).isEmpty();
        assertThat(PatternText.landscapeLines(null)).isEmpty();
        assertThat(PatternText.landscapeLines("\n")).containsExactly("");
    }

    @Test
    void stripCommonIndent_removesSharedLeadingSpacesOnly() {
        assertThat(PatternText.stripCommonIndent(List.of("   ab", "", "  c d")))
                .containsExactly(" ab", "", "c d");
        assertThat(PatternText.stripCommonIndent(List.of("ab", "  c")))
                .containsExactly("ab", "  c");
    }
}
