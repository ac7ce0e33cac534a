package io.surfworks.tessera.types;

/**
 * A complex scalar element.
 */
public record Complex(double re, double im) {

    public Complex plus(Complex other) {
        return new Complex(re + other.re, im + other.im);
    }

    public Complex minus(Complex other) {
        return new Complex(re - other.re, im - other.im);
    }

    public Complex times(Complex other) {
        return new Complex(re * other.re - im * other.im, re * other.im + im * other.re);
    }

    @Override
    public String toString() {
        return re + (im < 0 ? "-" : "+") + Math.abs(im) + "j";
    }
}
