package dumb.quizterm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Row-major matrix of stringified terms, as entered into matrix answer fields.
 */
public class TermMatrix {
    public static final int MAX_SIZE = 50;
    private static final Logger logger = LoggerFactory.getLogger(TermMatrix.class);

    private int m, n;
    private List<String> v;

    public TermMatrix(int m, int n) {
        if (!validSize(m, n))
            throw new IllegalArgumentException("Matrix size " + m + "x" + n + " outside 1.." + MAX_SIZE);
        this.m = m;
        this.n = n;
        this.v = new ArrayList<>(Collections.nCopies(m * n, "0"));
    }

    /**
     * Parses e.g. {@code "[[1+sin(x),2,3/x],[4,5^2,6]]"}. Elements must not contain commas.
     */
    public static TermMatrix parse(String s) {
        var elements = Arrays.stream(s.replace("[", "").replace("]", "").split(",", -1))
                .map(String::trim).toList();
        var rows = s.split("],", -1).length;
        if (elements.size() % rows != 0)
            throw new IllegalArgumentException("Rows of unequal length: " + s);
        var mat = new TermMatrix(rows, elements.size() / rows);
        mat.v = new ArrayList<>(elements);
        return mat;
    }

    public int rows() {
        return m;
    }

    public int cols() {
        return n;
    }

    /** The element term, or "" when (i, j) is outside the matrix. */
    public String get(int i, int j) {
        if (i < 0 || i >= m || j < 0 || j >= n) return "";
        return v.get(i * n + j);
    }

    public void set(int i, int j, String term) {
        if (i < 0 || i >= m || j < 0 || j >= n)
            throw new IndexOutOfBoundsException("(" + i + "," + j + ") outside " + m + "x" + n);
        v.set(i * n + j, term);
    }

    /**
     * Keeps existing elements, fills new ones with {@code init}.
     *
     * @return false if either dimension is outside 1..{@value #MAX_SIZE}
     */
    public boolean resize(int m, int n, String init) {
        if (!validSize(m, n)) return false;
        var resized = new ArrayList<String>(m * n);
        for (var i = 0; i < m; i++)
            for (var j = 0; j < n; j++)
                resized.add(i < this.m && j < this.n ? get(i, j) : init);
        this.m = m;
        this.n = n;
        this.v = resized;
        return true;
    }

    private static boolean validSize(int m, int n) {
        return m >= 1 && m <= MAX_SIZE && n >= 1 && n <= MAX_SIZE;
    }

    public int maxCellLength() {
        return v.stream().mapToInt(String::length).max().orElse(0);
    }

    /**
     * @param augmented draw a bar before the last column
     * @param brackets  square brackets, else parentheses
     */
    public String toTexString(boolean augmented, boolean brackets) {
        var s = new StringBuilder();
        if (brackets) s.append(augmented ? "\\left[\\begin{array}" : "\\begin{bmatrix}");
        else s.append(augmented ? "\\left(\\begin{array}" : "\\begin{pmatrix}");
        if (augmented) s.append('{').append("c".repeat(n - 1)).append("|c}");
        for (var i = 0; i < m; i++) {
            for (var j = 0; j < n; j++) {
                if (j > 0) s.append('&');
                s.append(texElement(get(i, j)));
            }
            s.append("\\\\");
        }
        if (brackets) s.append(augmented ? "\\end{array}\\right]" : "\\end{bmatrix}");
        else s.append(augmented ? "\\end{array}\\right)" : "\\end{pmatrix}");
        return s.toString();
    }

    private static String texElement(String e) {
        try {
            return Term.parse(e).toTexString();
        } catch (TermParser.ParseException ex) {
            logger.debug("Element '{}' shown as typed: {}", e, ex.getMessage());
            return e;
        }
    }

    @Override
    public String toString() {
        var s = new StringBuilder("[");
        for (var i = 0; i < m; i++) {
            if (i > 0) s.append(',');
            s.append('[').append(String.join(",", v.subList(i * n, (i + 1) * n))).append(']');
        }
        return s.append(']').toString();
    }
}
