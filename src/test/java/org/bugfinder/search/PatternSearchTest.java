package org.bugfinder.search;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PatternSearchTest {

    @Test
    void run_findsVerticallyAlignedFragments() {
        PatternSearch search = PatternSearch.run(List.of("ab", "ab"), List.of("xaby", "xaby"));

        assertThat(search.matchCount()).isEqualTo(1);
        MatchResult match = search.matches().get(0);
        assertThat(match.occurrence(0).line()).isEqualTo(1);
        assertThat(match.occurrence(0).column()).isEqualTo(2);
        assertThat(match.occurrence(1).line()).isEqualTo(2);
        assertThat(match.occurrence(1).column()).isEqualTo(2);
    }

    @Test
    void run_overlappingOccurrencesShareCharactersSoOnlyOneMatches() {
        PatternSearch search = PatternSearch.run(List.of("aa"), List.of("aaa"));

        assertThat(search.occurrences(0)).extracting(Occurrence::column).containsExactly(1, 2);
        assertThat(search.matchCount()).isEqualTo(1);
        assertThat(search.matches().get(0).column()).isEqualTo(1);
        assertThat(search.consumedCount()).isEqualTo(2);
    }

    @Test
    void run_nonAlignedFragmentsNeverMatch() {
        PatternSearch search = PatternSearch.run(
                List.of("ab", "cd"),
                List.of("ab ab ab", " cd  cd", "cd ab", " cd")
        );

        assertThat(search.occurrenceCounts()).containsExactly(4, 4);
        assertThat(search.matchCount()).isZero();
        assertThat(search.matches()).isEmpty();
    }

    @Test
    void run_wildcardsDoNotConsumeCharacters() {
        // 两个匹配在 (2,2) 位置重叠，但那是第一个匹配的通配位置
        PatternSearch search = PatternSearch.run(
                List.of("a", "b c"),
                List.of("aa", "bbcc")
        );

        assertThat(search.matchCount()).isEqualTo(2);
        assertThat(search.matches()).extracting(MatchResult::column).containsExactly(1, 2);
        assertThat(search.isConsumed(2, 2)).isTrue();
        assertThat(search.isConsumed(2, 3)).isTrue();
    }

    @Test
    void run_spaceMatchesAnyReplacementCharacter() {
        for (char c : new char[]{'x', ' ', '#', 'b', '中'}) {
            String middle = "a" + c + "b";
            PatternSearch search = PatternSearch.run(List.of("a b", "a b"), List.of(middle, middle));
            assertThat(search.matchCount()).as("wildcard replaced by '" + c + "'").isEqualTo(1);
        }
    }

    @Test
    void run_neverReusesACharacterPosition() {
        List<String> landscape = List.of(
                "#########",
                "# ## ####",
                "#########",
                "## ######",
                "#########"
        );
        PatternSearch search = PatternSearch.run(List.of("##", "# "), landscape);

        assertThat(search.matchCount()).isPositive();
        Set<String> used = new HashSet<>();
        for (MatchResult match : search.matches()) {
            for (Occurrence occurrence : match.occurrences()) {
                for (int offset : occurrence.fragment().footprint()) {
                    String position = occurrence.line() + ":" + (occurrence.column() + offset);
                    assertThat(used.add(position)).as("position reused: " + position).isTrue();
                }
            }
        }
        assertThat(used).hasSize(search.consumedCount());
    }

    @Test
    void run_isDeterministic() {
        List<String> pattern = List.of(" o ", "/|\\", "/ \\");
        List<String> landscape = Arrays.asList(
                " o  o   o ",
                "/|\\/|\\ /|\\",
                "/ \\/ \\ / \\",
                "   o      ",
                "  /|\\     ",
                "  / \\     "
        );

        PatternSearch first = PatternSearch.run(pattern, landscape);
        PatternSearch second = PatternSearch.run(pattern, landscape);

        assertThat(first.matchCount()).isEqualTo(4);
        assertThat(second.matches()).isEqualTo(first.matches());
    }

    @Test
    void run_emptyLandscapeHasZeroMatches() {
        PatternSearch search = PatternSearch.run(List.of("ab"), List.of());

        assertThat(search.matchCount()).isZero();
        assertThat(search.landscapeLineCount()).isZero();
    }

    @Test
    void loadPattern_rejectsEmptyPattern() {
        PatternSearch search = new PatternSearch();

        assertThatThrownBy(() -> search.loadPattern(List.of()))
                .isInstanceOf(InvalidPatternException.class);
        assertThatThrownBy(() -> search.loadPattern(List.of("   ", "")))
                .isInstanceOf(InvalidPatternException.class);
        assertThatThrownBy(() -> search.loadPattern(null))
                .isInstanceOf(InvalidPatternException.class);
        assertThatThrownBy(() -> search.loadPattern(Arrays.asList("ab", null)))
                .isInstanceOf(InvalidPatternException.class)
                .hasMessageContaining("第 2 行");
    }

    @Test
    void run_formFeedInsideLandscapeLineKeepsLineNumbers() {
        PatternSearch search = PatternSearch.run(List.of("ab"), PatternText.landscapeLines("ab\nx\fy\nab\n"));

        assertThat(search.landscapeLineCount()).isEqualTo(3);
        assertThat(search.matches())
                .extracting(MatchResult::line)
                .containsExactly(1, 3);
    }

    @Test
    void loadPattern_stripsTrailingBlanksAndDropsTrailingEmptyLines() {
        PatternSearch search = new PatternSearch();
        search.loadPattern(List.of(" ab  ", "c\t", "", "  "));

        assertThat(search.fragments()).extracting(Fragment::text).containsExactly(" ab", "c");
    }

    @Test
    void interiorBlankFragment_preventsAnyMatch() {
        PatternSearch search = PatternSearch.run(List.of("a", "", "a"), List.of("a", "x", "a"));

        assertThat(search.fragmentCount()).isEqualTo(3);
        assertThat(search.matchCount()).isZero();
    }

    @Test
    void callsOutOfOrder_throwPatternNotSet() {
        PatternSearch search = new PatternSearch();

        assertThatThrownBy(() -> search.scanLandscape(List.of("a")))
                .isInstanceOf(PatternNotSetException.class);
        assertThatThrownBy(search::detectMatches)
                .isInstanceOf(PatternNotSetException.class);

        search.loadPattern(List.of("a"));
        assertThatThrownBy(search::detectMatches)
                .isInstanceOf(PatternNotSetException.class);
    }

    @Test
    void scanLandscape_rejectsMissingInput() {
        PatternSearch search = new PatternSearch();
        search.loadPattern(List.of("a"));

        assertThatThrownBy(() -> search.scanLandscape(null))
                .isInstanceOf(InvalidLandscapeException.class);
        assertThatThrownBy(() -> search.scanLandscape(Arrays.asList("a", null)))
                .isInstanceOf(InvalidLandscapeException.class);
    }

    @Test
    void detectMatches_secondCallReturnsSameResults() {
        PatternSearch search = new PatternSearch();
        search.loadPattern(List.of("ab"));
        search.scanLandscape(List.of("abab"));

        List<MatchResult> first = search.detectMatches();
        List<MatchResult> second = search.detectMatches();

        assertThat(second).isEqualTo(first);
        assertThat(search.matchCount()).isEqualTo(2);
    }

    @Test
    void scanLandscape_againStartsFreshResults() {
        PatternSearch search = new PatternSearch();
        search.loadPattern(List.of("ab"));
        search.scanLandscape(List.of("abab"));
        search.detectMatches();

        search.scanLandscape(List.of("ab"));
        search.detectMatches();

        assertThat(search.matchCount()).isEqualTo(1);
        assertThat(search.occurrences(0)).hasSize(1);
    }
}
