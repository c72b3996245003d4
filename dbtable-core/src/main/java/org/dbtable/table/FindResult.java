package org.dbtable.table;

import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Result of a lookup, tagged by how many rows matched: none, exactly one, or many.
 *
 * @param <R> the row type
 */
public final class FindResult<R> {

    public enum Shape {
        NONE,
        ONE,
        MANY
    }

    private final List<R> rows;

    private FindResult(List<R> rows) {
        this.rows = Collections.unmodifiableList(rows);
    }

    public static <R> FindResult<R> of(List<R> rows) {
        return new FindResult<>(rows);
    }

    public Shape getShape() {
        if (rows.isEmpty()) {
            return Shape.NONE;
        }
        return rows.size() == 1 ? Shape.ONE : Shape.MANY;
    }

    public boolean isNone() {
        return getShape() == Shape.NONE;
    }

    public boolean isOne() {
        return getShape() == Shape.ONE;
    }

    public boolean isMany() {
        return getShape() == Shape.MANY;
    }

    /**
     * The matched row when exactly one matched.
     */
    public Optional<R> one() {
        return isOne() ? Optional.of(rows.get(0)) : Optional.empty();
    }

    /**
     * Every matched row, possibly empty.
     */
    public List<R> rows() {
        return rows;
    }

    @Override
    public String toString() {
        return "FindResult{" + getShape() + ", rows=" + rows + '}';
    }
}
