package org.decentmobility.model;

import lombok.Value;
import org.decentmobility.geometry.GeometryDistance;

import java.util.Objects;

/**
 * Location denoted as {@code (x, y)} coordinates on a square grid.
 */
@Value
public class GridLocation implements Location {
    double x;
    double y;

    public GridLocation(double x, double y) {
        if (!Double.isFinite(x) || !Double.isFinite(y)) {
            throw new IllegalArgumentException("grid coordinates must be finite, got (" + x + ", " + y + ")");
        }
        // +0.0 folds -0.0 so structural equality matches numeric equality
        this.x = x + 0.0d;
        this.y = y + 0.0d;
    }

    /**
     * Creates a grid location.
     */
    public static GridLocation of(double x, double y) {
        return new GridLocation(x, y);
    }

    /**
     * Returns the Euclidean (straight-line) distance to another grid location.
     */
    public double distanceTo(GridLocation other) {
        GridLocation nonNull = Objects.requireNonNull(other, "other");
        return GeometryDistance.euclideanDistance(x, y, nonNull.x, nonNull.y);
    }
}
