package dumb.quizterm;

import java.util.random.RandomGenerator;

/**
 * Immutable complex number. All term evaluation happens in this field.
 */
public record Complex(double re, double im) {

    public static final Complex ZERO = new Complex(0, 0);
    public static final Complex ONE = new Complex(1, 0);
    public static final Complex I = new Complex(0, 1);

    public static Complex of(double re) {
        return new Complex(re, 0);
    }

    /** Both parts uniform in [0,1). */
    public static Complex random(RandomGenerator random) {
        return new Complex(random.nextDouble(), random.nextDouble());
    }

    public Complex add(Complex v) {
        return new Complex(re + v.re, im + v.im);
    }

    public Complex sub(Complex v) {
        return new Complex(re - v.re, im - v.im);
    }

    public Complex mul(Complex v) {
        return new Complex(re * v.re - im * v.im, re * v.im + im * v.re);
    }

    /** No zero check: a zero denominator yields NaN or infinite parts. */
    public Complex div(Complex v) {
        var d = v.re * v.re + v.im * v.im;
        return new Complex((re * v.re + im * v.im) / d, (im * v.re - re * v.im) / d);
    }

    public Complex negate() {
        return new Complex(-re, -im);
    }

    public double abs() {
        return Math.sqrt(re * re + im * im);
    }

    public boolean near(double re, double im, double eps) {
        var dr = this.re - re;
        var di = this.im - im;
        return Math.sqrt(dr * dr + di * di) < eps;
    }

    public boolean near(Complex v, double eps) {
        return near(v.re, v.im, eps);
    }

    @Override
    public String toString() {
        return im < 0 ? re + "-" + (-im) + "i" : re + "+" + im + "i";
    }
}
