package io.surfworks.tsetlin.core.classifier;

/**
 * Row-major matrix of 0/1 bytes, the only input shape the engine accepts.
 *
 * <p>Every factory checks that the input is rectangular, non-empty and binary.
 */
public final class BinaryMatrix {

    private final int rows;
    private final int columns;
    private final byte[] data;

    private BinaryMatrix(int rows, int columns, byte[] data) {
        this.rows = rows;
        this.columns = columns;
        this.data = data;
    }

    public static BinaryMatrix of(int[][] values) {
        int cols = checkShape(values.length, values.length == 0 ? 0 : lengthOf(values[0]));
        byte[] data = new byte[values.length * cols];
        for (int r = 0; r < values.length; r++) {
            if (values[r] == null || values[r].length != cols) {
                throw raggedRow(r, values[r] == null ? 0 : values[r].length, cols);
            }
            for (int c = 0; c < cols; c++) {
                data[r * cols + c] = toBit(values[r][c]);
            }
        }
        return new BinaryMatrix(values.length, cols, data);
    }

    public static BinaryMatrix of(byte[][] values) {
        int cols = checkShape(values.length, values.length == 0 || values[0] == null ? 0 : values[0].length);
        byte[] data = new byte[values.length * cols];
        for (int r = 0; r < values.length; r++) {
            if (values[r] == null || values[r].length != cols) {
                throw raggedRow(r, values[r] == null ? 0 : values[r].length, cols);
            }
            for (int c = 0; c < cols; c++) {
                data[r * cols + c] = toBit(values[r][c]);
            }
        }
        return new BinaryMatrix(values.length, cols, data);
    }

    /**
     * Wraps an existing row-major buffer after checking it.
     */
    public static BinaryMatrix wrap(byte[] data, int rows, int columns) {
        checkShape(rows, columns);
        if (data.length != (long) rows * columns) {
            throw ClassifierException.validation(String.format(
                    "Buffer holds %d values, expected %d x %d", data.length, rows, columns));
        }
        for (byte b : data) {
            toBit(b);
        }
        return new BinaryMatrix(rows, columns, data);
    }

    public int rows() {
        return rows;
    }

    public int columns() {
        return columns;
    }

    public byte get(int row, int column) {
        return data[row * columns + column];
    }

    /**
     * Returns the row-major backing buffer. Callers must not modify it.
     */
    public byte[] data() {
        return data;
    }

    private static int lengthOf(int[] row) {
        return row == null ? 0 : row.length;
    }

    private static int checkShape(int rows, int columns) {
        if (rows < 1) {
            throw ClassifierException.validation("Found array with 0 sample(s); at least 1 is required");
        }
        if (columns < 1) {
            throw ClassifierException.validation("Found array with 0 feature(s); at least 1 is required");
        }
        return columns;
    }

    private static byte toBit(int value) {
        if (value != 0 && value != 1) {
            throw ClassifierException.validation("Input X must be binary (contain only 0s and 1s).");
        }
        return (byte) value;
    }

    private static ClassifierException raggedRow(int row, int length, int expected) {
        return ClassifierException.validation(String.format(
                "Row %d has %d values, expected %d; X must be a 2-D matrix", row, length, expected));
    }
}
