package com.github.crusty.error;

/**
 * Source range covered by a token or tree node.
 * <p>
 * Spans are positional metadata only. Any two spans are {@link #equals(Object) equal} so that
 * trees built from different sources (or built by hand in tests) compare structurally. Use
 * {@link #sameRange(Span)} to compare the actual positions. {@link Diagnostic} records do, so two
 * errors reported at different places are never equal.
 */
public record Span(Position start, Position end) {

    public static final Span NONE = new Span(new Position(0, 0), new Position(0, 0));

    public static Span of(int line, int column) {
        var position = new Position(line, column);
        return new Span(position, position);
    }

    public Span to(Span other) {
        if (this == NONE) {
            return other;
        }
        if (other == NONE) {
            return this;
        }
        return new Span(start, other.end);
    }

    public boolean sameRange(Span other) {
        return start.equals(other.start) && end.equals(other.end);
    }

    public int rangeHash() {
        return 31 * start.hashCode() + end.hashCode();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Span;
    }

    @Override
    public int hashCode() {
        return 0;
    }

    @Override
    public String toString() {
        return start + "-" + end;
    }
}
