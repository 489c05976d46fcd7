package model;

import com.github.javaparser.Position;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LexicalSpanTest {

    private static LexicalSpan span(int startLine, int startColumn, int endLine, int endColumn) {
        return new LexicalSpan(new Position(startLine, startColumn), new Position(endLine, endColumn));
    }

    @Test
    void laterSiblingIsPastEnd() {
        assertThat(span(5, 3, 7, 3).isPastEndOf(span(2, 3, 4, 3))).isTrue();
    }

    @Test
    void nestedSpanIsNotPastEnd() {
        assertThat(span(2, 5, 3, 5).isPastEndOf(span(1, 1, 4, 1))).isFalse();
    }

    @Test
    void sameSpanIsNotPastEnd() {
        assertThat(span(1, 1, 2, 1).isPastEndOf(span(1, 1, 2, 1))).isFalse();
    }

    @Test
    void columnsBreakTiesOnTheSameLine() {
        assertThat(span(1, 20, 1, 30).isPastEndOf(span(1, 5, 1, 15))).isTrue();
        assertThat(span(1, 7, 1, 12).isPastEndOf(span(1, 5, 1, 15))).isFalse();
    }
}
