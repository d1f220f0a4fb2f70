package blockwise.coordinator.model;

import blockwise.coordinator.error.PartitionException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Immutable region of interest: an offset and a shape over a fixed number
 * of dimensions. The region covers {@code [offset, offset + shape)} in every
 * dimension.
 */
public final class Roi {

    private final long[] offset;
    private final long[] shape;

    private Roi(long[] offset, long[] shape) {
        this.offset = offset;
        this.shape = shape;
    }

    public static Roi of(long[] offset, long[] shape) {
        Objects.requireNonNull(offset, "offset is required");
        Objects.requireNonNull(shape, "shape is required");
        if (offset.length != shape.length) {
            throw new IllegalArgumentException(
                    "offset and shape differ in dimensions: " + offset.length + " vs " + shape.length);
        }
        for (long s : shape) {
            if (s < 0) {
                throw new IllegalArgumentException("shape must not be negative: " + Arrays.toString(shape));
            }
        }
        return new Roi(offset.clone(), shape.clone());
    }

    /** One-dimensional region {@code [begin, begin + length)}. */
    public static Roi of(long begin, long length) {
        return of(new long[] { begin }, new long[] { length });
    }

    /** Region starting at the origin. */
    public static Roi ofShape(long... shape) {
        return of(new long[shape.length], shape);
    }

    /** Empty region with the given number of dimensions. */
    public static Roi empty(int dims) {
        return new Roi(new long[dims], new long[dims]);
    }

    public int dims() {
        return shape.length;
    }

    public long[] offset() {
        return offset.clone();
    }

    public long[] shape() {
        return shape.clone();
    }

    public long offset(int dim) {
        return offset[dim];
    }

    public long shape(int dim) {
        return shape[dim];
    }

    /** Exclusive upper bound per dimension. */
    public long[] end() {
        long[] end = new long[shape.length];
        for (int d = 0; d < end.length; d++) {
            end[d] = offset[d] + shape[d];
        }
        return end;
    }

    public long end(int dim) {
        return offset[dim] + shape[dim];
    }

    /** Number of grid points covered. */
    public long size() {
        long size = 1;
        for (long s : shape) {
            size = Math.multiplyExact(size, s);
        }
        return size;
    }

    public boolean isEmpty() {
        for (long s : shape) {
            if (s == 0) {
                return true;
            }
        }
        return false;
    }

    /**
     * Intersection of two regions. Disjoint regions give an empty region.
     */
    public Roi intersect(Roi other) {
        requireSameDims(other);
        long[] begin = new long[dims()];
        long[] length = new long[dims()];
        for (int d = 0; d < begin.length; d++) {
            long b = Math.max(offset[d], other.offset[d]);
            long e = Math.min(end(d), other.end(d));
            if (e <= b) {
                return empty(dims());
            }
            begin[d] = b;
            length[d] = e - b;
        }
        return new Roi(begin, length);
    }

    public boolean intersects(Roi other) {
        return !intersect(other).isEmpty();
    }

    /**
     * Whether {@code other} lies completely inside this region. An empty
     * region is contained in every region.
     */
    public boolean contains(Roi other) {
        requireSameDims(other);
        if (other.isEmpty()) {
            return true;
        }
        for (int d = 0; d < dims(); d++) {
            if (other.offset[d] < offset[d] || other.end(d) > end(d)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Grow by {@code context} on both sides of every dimension.
     */
    public Roi grow(long[] context) {
        if (context.length != dims()) {
            throw new IllegalArgumentException("context has " + context.length + " dimensions, roi has " + dims());
        }
        long[] begin = new long[dims()];
        long[] length = new long[dims()];
        for (int d = 0; d < begin.length; d++) {
            begin[d] = offset[d] - context[d];
            length[d] = Math.max(0, shape[d] + 2 * context[d]);
        }
        return new Roi(begin, length);
    }

    public Roi shift(long[] by) {
        if (by.length != dims()) {
            throw new IllegalArgumentException("shift has " + by.length + " dimensions, roi has " + dims());
        }
        long[] begin = new long[dims()];
        for (int d = 0; d < begin.length; d++) {
            begin[d] = offset[d] + by[d];
        }
        return new Roi(begin, shape.clone());
    }

    /**
     * Cut this region into tiles of {@code blockShape}, row-major (the last
     * dimension varies fastest). Tiles on the upper boundary are clipped to
     * this region, so they may be smaller than {@code blockShape}.
     *
     * @throws PartitionException if the block shape has the wrong number of
     *                            dimensions or a component below 1
     */
    public List<Roi> tile(long[] blockShape) {
        long[] grid = gridShape(blockShape);
        List<Roi> tiles = new ArrayList<>();
        if (isEmpty()) {
            return tiles;
        }
        long[] position = new long[dims()];
        do {
            tiles.add(tileAt(position, blockShape));
        } while (GridCursor.advance(position, grid));
        return tiles;
    }

    /**
     * Number of tiles per dimension when cutting this region into
     * {@code blockShape} tiles.
     */
    public long[] gridShape(long[] blockShape) {
        Objects.requireNonNull(blockShape, "blockShape is required");
        if (blockShape.length != dims()) {
            throw new PartitionException(
                    "block shape " + Arrays.toString(blockShape) + " does not match " + dims() + " dimensions");
        }
        long[] grid = new long[dims()];
        for (int d = 0; d < grid.length; d++) {
            if (blockShape[d] <= 0) {
                throw new PartitionException("block shape must be positive: " + Arrays.toString(blockShape));
            }
            grid[d] = (shape[d] + blockShape[d] - 1) / blockShape[d];
        }
        return grid;
    }

    /** Tile at a grid position, clipped to this region. */
    public Roi tileAt(long[] gridPosition, long[] blockShape) {
        long[] begin = new long[dims()];
        long[] length = new long[dims()];
        for (int d = 0; d < begin.length; d++) {
            begin[d] = offset[d] + gridPosition[d] * blockShape[d];
            length[d] = Math.min(blockShape[d], end(d) - begin[d]);
        }
        return new Roi(begin, length);
    }

    private void requireSameDims(Roi other) {
        Objects.requireNonNull(other, "other roi is required");
        if (other.dims() != dims()) {
            throw new IllegalArgumentException("roi dimensions differ: " + dims() + " vs " + other.dims());
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Roi roi))
            return false;
        return Arrays.equals(offset, roi.offset) && Arrays.equals(shape, roi.shape);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(offset) + Arrays.hashCode(shape);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("[");
        for (int d = 0; d < dims(); d++) {
            if (d > 0) {
                sb.append(", ");
            }
            sb.append(offset[d]).append(':').append(end(d));
        }
        return sb.append(')').toString();
    }
}
