package com.cardiorisk.scoring;

import java.util.Objects;

/**
 * Zero-based cell of the 5x5 likelihood/impact grid.
 */
public final class HeatmapPosition {
    public final int x;
    public final int y;

    public HeatmapPosition(int x, int y) {
        this.x = x;
        this.y = y;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof HeatmapPosition)) return false;
        HeatmapPosition other = (HeatmapPosition) o;
        return x == other.x && y == other.y;
    }

    @Override
    public int hashCode() {
        return Objects.hash(x, y);
    }

    @Override
    public String toString() {
        return "(" + x + ", " + y + ")";
    }
}
