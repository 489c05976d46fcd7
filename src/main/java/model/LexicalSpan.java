package model;

import com.github.javaparser.Position;
import com.github.javaparser.Range;

import java.util.Objects;

// Positions of the opening and closing delimiter of a block-delimited statement
public class LexicalSpan {

    private final Position start;
    private final Position end;

    public LexicalSpan(Position start, Position end) {
        this.start = Objects.requireNonNull(start);
        this.end = Objects.requireNonNull(end);
    }

    public static LexicalSpan of(Range range) {
        return new LexicalSpan(range.begin, range.end);
    }

    public Position getStart() {
        return start;
    }

    public Position getEnd() {
        return end;
    }

    /**
     * True when this span starts after {@code previous} started and also ends after it ended,
     * i.e. this span cannot lie inside {@code previous}.
     */
    public boolean isPastEndOf(LexicalSpan previous) {
        return start.isAfter(previous.start) && end.isAfter(previous.end);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        LexicalSpan that = (LexicalSpan) o;
        return start.equals(that.start) && end.equals(that.end);
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, end);
    }

    @Override
    public String toString() {
        return "[" + start + " - " + end + "]";
    }
}
