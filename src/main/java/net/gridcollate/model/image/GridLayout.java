package net.gridcollate.model.image;

/**
 * Grid geometry shared by grouping and compositing.
 *
 * @param rows number of grid rows
 * @param cols number of grid columns
 * @param cellWidth working-resolution width of every cell in pixels
 * @param cellHeight working-resolution height of every cell in pixels
 */
public record GridLayout(int rows, int cols, int cellWidth, int cellHeight) {

    public GridLayout {
        if (rows <= 0 || cols <= 0) {
            throw new IllegalArgumentException("Grid must have at least one row and column: " + rows + "x" + cols);
        }
        if (cellWidth <= 0 || cellHeight <= 0) {
            throw new IllegalArgumentException("Cell size must be positive: " + cellWidth + "x" + cellHeight);
        }
    }

    /** Number of images a full batch holds. */
    public int capacity() {
        return rows * cols;
    }

    public int canvasWidth() {
        return cols * cellWidth;
    }

    public int canvasHeight() {
        return rows * cellHeight;
    }

    /** Grid row of the image at {@code index} in a batch. */
    public int rowOf(int index) {
        return index / cols;
    }

    /** Grid column of the image at {@code index} in a batch. */
    public int colOf(int index) {
        return index % cols;
    }
}
