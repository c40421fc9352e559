package dumb.quizterm;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TermMatrixTest {

    @Test
    void parse() {
        var m = TermMatrix.parse("[[1+sin(x),2,3/x],[4,5^2,6]]");
        assertEquals(2, m.rows());
        assertEquals(3, m.cols());
        assertEquals("1+sin(x)", m.get(0, 0));
        assertEquals("6", m.get(1, 2));
        assertEquals("", m.get(2, 0));
        assertEquals("", m.get(0, -1));
        assertEquals("[[1+sin(x),2,3/x],[4,5^2,6]]", m.toString());
        assertEquals(8, m.maxCellLength());
    }

    @Test
    void parseRejectsRaggedRows() {
        assertThrows(IllegalArgumentException.class, () -> TermMatrix.parse("[[1,2],[3]]"));
    }

    @Test
    void newMatrixIsZero() {
        assertEquals("[[0,0],[0,0]]", new TermMatrix(2, 2).toString());
    }

    @Test
    void constructorRejectsBadSizes() {
        assertThrows(IllegalArgumentException.class, () -> new TermMatrix(1, 0));
        assertThrows(IllegalArgumentException.class, () -> new TermMatrix(-1, 2));
        assertThrows(IllegalArgumentException.class, () -> new TermMatrix(TermMatrix.MAX_SIZE + 1, 1));
        assertEquals("\\left[\\begin{array}{|c}0\\\\\\end{array}\\right]", new TermMatrix(1, 1).toTexString(true, true));
    }

    @Test
    void setAndResize() {
        var m = TermMatrix.parse("[[1,2],[3,4]]");
        m.set(0, 1, "x");
        assertEquals("x", m.get(0, 1));
        assertThrows(IndexOutOfBoundsException.class, () -> m.set(2, 0, "y"));

        assertTrue(m.resize(3, 1, "z"));
        assertEquals("[[1],[3],[z]]", m.toString());
        assertFalse(m.resize(0, 1, "z"));
        assertFalse(m.resize(1, TermMatrix.MAX_SIZE + 1, "z"));
        assertEquals(3, m.rows());
    }

    @Test
    void tex() {
        var m = TermMatrix.parse("[[1,2],[3,4]]");
        assertEquals("\\begin{bmatrix}1&2\\\\3&4\\\\\\end{bmatrix}", m.toTexString(false, true));
        assertEquals("\\left(\\begin{array}{c|c}1&2\\\\3&4\\\\\\end{array}\\right)", m.toTexString(true, false));
        assertEquals("\\begin{pmatrix}x)&1\\\\\\end{pmatrix}", TermMatrix.parse("[[x),1]]").toTexString(false, false));
    }
}
