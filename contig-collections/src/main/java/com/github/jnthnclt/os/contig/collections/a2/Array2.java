package com.github.jnthnclt.os.contig.collections.a2;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.github.jnthnclt.os.contig.collections.api.exceptions.InconsistentRowLengthException;
import com.google.common.base.Preconditions;
import java.util.AbstractList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.RandomAccess;

/**
 * Fixed size two dimensional array stored as one flat buffer in row major order.
 * <p>
 * Row and element views write through to the buffer. Sizes never change.
 */
public class Array2<T> {

    private final Object[] data;
    private final int numColumns;

    private Array2(Object[] data, int numColumns) {
        this.data = data;
        this.numColumns = numColumns;
    }

    @JsonCreator
    public Array2(@JsonProperty("numColumns") int numColumns,
        @JsonProperty("data") List<T> data) {
        Preconditions.checkArgument(numColumns >= 0, "numColumns must be >= 0, was %s", numColumns);
        Preconditions.checkNotNull(data, "data");
        Preconditions.checkArgument(numColumns == 0 ? data.isEmpty() : data.size() % numColumns == 0,
            "data length %s is not a multiple of numColumns %s", data.size(), numColumns);
        this.data = data.toArray();
        this.numColumns = numColumns;
    }

    public static <T> Array2<T> create(int numColumns, int numRows, T initValue) {
        Preconditions.checkArgument(numColumns >= 0, "numColumns must be >= 0, was %s", numColumns);
        Preconditions.checkArgument(numRows >= 0, "numRows must be >= 0, was %s", numRows);
        Object[] data = new Object[Math.multiplyExact(numColumns, numRows)];
        Arrays.fill(data, initValue);
        return new Array2<>(data, numColumns);
    }

    /**
     * @throws InconsistentRowLengthException unless every row has the length of the first
     */
    public static <T> Array2<T> fromRows(List<? extends List<? extends T>> rows) {
        Preconditions.checkNotNull(rows, "rows");
        int numColumns = rows.isEmpty() ? 0 : rows.get(0).size();
        for (int r = 0; r < rows.size(); r++) {
            int length = rows.get(r).size();
            if (length != numColumns) {
                throw new InconsistentRowLengthException(r, numColumns, length);
            }
        }
        Object[] data = new Object[Math.multiplyExact(numColumns, rows.size())];
        int i = 0;
        for (List<? extends T> row : rows) {
            for (T t : row) {
                data[i++] = t;
            }
        }
        return new Array2<>(data, numColumns);
    }

    @JsonProperty("numColumns")
    public int numColumns() {
        return numColumns;
    }

    public int numRows() {
        return numColumns == 0 ? 0 : data.length / numColumns;
    }

    public int numElements() {
        return data.length;
    }

    @JsonProperty("data")
    public List<T> elements() {
        return new Slice(0, data.length);
    }

    /**
     * @return the elements of the row at rowIndex, or null if the row is out of bounds
     */
    public List<T> row(int rowIndex) {
        if (rowIndex < 0 || rowIndex >= numRows()) {
            return null;
        }
        int start = rowIndex * numColumns;
        return new Slice(start, start + numColumns);
    }

    /**
     * @throws IndexOutOfBoundsException if the row is out of bounds
     */
    public List<T> rowAt(int rowIndex) {
        List<T> row = row(rowIndex);
        if (row == null) {
            throw new IndexOutOfBoundsException("Row index " + rowIndex + " is out of bounds");
        }
        return row;
    }

    public Iterable<List<T>> rows() {
        return () -> new Iterator<List<T>>() {
            private int r = 0;

            @Override
            public boolean hasNext() {
                return r < numRows();
            }

            @Override
            public List<T> next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                return row(r++);
            }
        };
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        Array2<?> other = (Array2<?>) obj;
        return numColumns == other.numColumns && Arrays.equals(data, other.data);
    }

    @Override
    public int hashCode() {
        int hashCode = 7;
        hashCode = 59 * hashCode + numColumns;
        hashCode = 59 * hashCode + Arrays.hashCode(data);
        return hashCode;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Array2{numColumns=").append(numColumns).append(", rows=[");
        for (int r = 0; r < numRows(); r++) {
            if (r > 0) {
                sb.append(", ");
            }
            sb.append(row(r));
        }
        return sb.append("]}").toString();
    }

    private class Slice extends AbstractList<T> implements RandomAccess {

        private final int start;
        private final int end;

        private Slice(int start, int end) {
            this.start = start;
            this.end = end;
        }

        @Override
        @SuppressWarnings("unchecked")
        public T get(int index) {
            Preconditions.checkElementIndex(index, end - start);
            return (T) data[start + index];
        }

        @Override
        @SuppressWarnings("unchecked")
        public T set(int index, T element) {
            Preconditions.checkElementIndex(index, end - start);
            T was = (T) data[start + index];
            data[start + index] = element;
            return was;
        }

        @Override
        public int size() {
            return end - start;
        }
    }
}
