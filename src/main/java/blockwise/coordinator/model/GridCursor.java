package blockwise.coordinator.model;

/**
 * Row-major stepping over an N-dimensional index space.
 */
public final class GridCursor {

    private GridCursor() {
    }

    /**
     * Move {@code position} one step forward within {@code extent}, last
     * dimension fastest.
     *
     * @return false once the whole space has been visited
     */
    public static boolean advance(long[] position, long[] extent) {
        for (int d = position.length - 1; d >= 0; d--) {
            position[d]++;
            if (position[d] < extent[d]) {
                return true;
            }
            position[d] = 0;
        }
        return false;
    }
}
