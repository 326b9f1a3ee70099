package com.github.jnthnclt.os.contig.collections.a2;

import com.github.jnthnclt.os.contig.collections.api.exceptions.InconsistentRowLengthException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.testng.Assert;
import org.testng.annotations.Test;

public class Array2NGTest {

    @Test
    public void testCreate() throws Exception {
        Array2<Boolean> a2 = Array2.create(4, 2, false);
        Assert.assertEquals(a2.numColumns(), 4);
        Assert.assertEquals(a2.numRows(), 2);
        Assert.assertEquals(a2.numElements(), 8);
        Assert.assertEquals(a2.row(0), Arrays.asList(false, false, false, false));
        Assert.assertEquals(a2.row(1), Arrays.asList(false, false, false, false));
        Assert.assertNull(a2.row(2));
        Assert.assertNull(a2.row(-1));
    }

    @Test
    public void testFromRows() throws Exception {
        Array2<Integer> a2 = Array2.fromRows(Arrays.asList(Arrays.asList(1, 2, 3, 4), Arrays.asList(5, 6, 7, 8)));
        Assert.assertEquals(a2.numColumns(), 4);
        Assert.assertEquals(a2.numRows(), 2);
        Assert.assertEquals(a2.row(0), Arrays.asList(1, 2, 3, 4));
        Assert.assertEquals(a2.row(1), Arrays.asList(5, 6, 7, 8));
        Assert.assertNull(a2.row(2));
        Assert.assertEquals(a2.elements(), Arrays.asList(1, 2, 3, 4, 5, 6, 7, 8));
    }

    @Test
    public void testInconsistentRows() throws Exception {
        Assert.expectThrows(InconsistentRowLengthException.class,
            () -> Array2.fromRows(Arrays.asList(Arrays.asList(1, 2), Arrays.asList(1, 2, 3))));
    }

    @Test
    public void testNoRows() throws Exception {
        Array2<Integer> a2 = Array2.fromRows(Collections.<List<Integer>>emptyList());
        Assert.assertEquals(a2.numColumns(), 0);
        Assert.assertEquals(a2.numRows(), 0);
        Assert.assertEquals(a2.numElements(), 0);
        Assert.assertNull(a2.row(0));
        Assert.assertFalse(a2.rows().iterator().hasNext());
    }

    @Test
    public void testRowMajorOrder() throws Exception {
        List<List<Integer>> rows = new ArrayList<>();
        List<Integer> flattened = new ArrayList<>();
        int v = 0;
        for (int r = 0; r < 5; r++) {
            List<Integer> row = new ArrayList<>();
            for (int c = 0; c < 3; c++) {
                row.add(v);
                flattened.add(v);
                v++;
            }
            rows.add(row);
        }
        Array2<Integer> a2 = Array2.fromRows(rows);
        Assert.assertEquals(a2.elements(), flattened);
        for (int r = 0; r < 5; r++) {
            Assert.assertEquals(a2.row(r), flattened.subList(r * 3, r * 3 + 3));
        }

        List<List<Integer>> iterated = new ArrayList<>();
        for (List<Integer> row : a2.rows()) {
            iterated.add(new ArrayList<>(row));
        }
        Assert.assertEquals(iterated, rows);
    }

    @Test
    public void testWriteThrough() throws Exception {
        Array2<String> a2 = Array2.create(2, 2, ".");
        Assert.assertEquals(a2.row(1).set(0, "x"), ".");
        a2.rowAt(0).set(1, "y");
        Assert.assertEquals(a2.elements(), Arrays.asList(".", "y", "x", "."));
        a2.elements().set(3, "z");
        Assert.assertEquals(a2.row(1), Arrays.asList("x", "z"));
        Assert.assertEquals(a2.toString(), "Array2{numColumns=2, rows=[[., y], [x, z]]}");
    }

    @Test
    public void testRowAtOutOfBounds() throws Exception {
        Array2<Integer> a2 = Array2.create(3, 1, 0);
        IndexOutOfBoundsException x = Assert.expectThrows(IndexOutOfBoundsException.class, () -> a2.rowAt(1));
        Assert.assertEquals(x.getMessage(), "Row index 1 is out of bounds");
        Assert.expectThrows(IndexOutOfBoundsException.class, () -> a2.row(0).get(3));
        Assert.expectThrows(UnsupportedOperationException.class, () -> a2.row(0).add(1));
    }

    @Test
    public void testEquals() throws Exception {
        Array2<Integer> a = Array2.create(2, 3, 7);
        Array2<Integer> b = Array2.fromRows(Arrays.asList(Arrays.asList(7, 7), Arrays.asList(7, 7), Arrays.asList(7, 7)));
        Array2<Integer> c = Array2.create(3, 2, 7);
        Assert.assertEquals(a, b);
        Assert.assertEquals(a.hashCode(), b.hashCode());
        Assert.assertNotEquals(a, c);
    }
}
