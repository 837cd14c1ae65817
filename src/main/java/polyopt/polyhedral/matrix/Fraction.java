package polyopt.polyhedral.matrix;

/**
 * Exact rational, kept reduced with a positive denominator.
 */
public class Fraction {
    private final long numerator;
    private final long denominator;

    public Fraction(long numerator_, long denominator_) {
        if (denominator_ == 0) {
            throw new ArithmeticException("zero denominator");
        }
        long divisor = numerator_ == 0 ? Math.abs(denominator_) : gcd(numerator_, denominator_);
        if (denominator_ < 0) {
            divisor = -divisor;
        }
        numerator = numerator_ / divisor;
        denominator = denominator_ / divisor;
    }

    public Fraction(long value) {
        numerator = value;
        denominator = 1;
    }

    public long numerator() {
        return numerator;
    }

    public long denominator() {
        return denominator;
    }

    public static long gcd(long a, long b) {
        a = Math.abs(a);
        b = Math.abs(b);
        while (b != 0) {
            long rest = a % b;
            a = b;
            b = rest;
        }
        return a;
    }

    public static long getDenominatorLCM(long a, long b) {
        if (a == 0 || b == 0) {
            return Math.max(Math.abs(a), Math.abs(b));
        }
        return Math.abs(a / gcd(a, b) * b);
    }

    public Fraction add(Fraction other) {
        long common = getDenominatorLCM(denominator, other.denominator);
        return new Fraction(Math.addExact(Math.multiplyExact(numerator, common / denominator),
                Math.multiplyExact(other.numerator, common / other.denominator)), common);
    }

    public Fraction sub(Fraction other) {
        return add(other.neg());
    }

    public Fraction neg() {
        return new Fraction(-numerator, denominator);
    }

    public Fraction mul(Fraction other) {
        return new Fraction(Math.multiplyExact(numerator, other.numerator), Math.multiplyExact(denominator, other.denominator));
    }

    public Fraction mul(long k) {
        return mul(new Fraction(k));
    }

    public Fraction div(Fraction other) {
        if (other.numerator == 0) {
            throw new ArithmeticException("division by zero");
        }
        return mul(new Fraction(other.denominator, other.numerator));
    }

    public boolean equal(long value) {
        return denominator == 1 && numerator == value;
    }

    public boolean isInteger() {
        return denominator == 1;
    }

    public long toLong() {
        if (denominator != 1) {
            throw new ArithmeticException(this + " is not an integer");
        }
        return numerator;
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof Fraction other && numerator == other.numerator && denominator == other.denominator;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(numerator) * 31 + Long.hashCode(denominator);
    }

    @Override
    public String toString() {
        return denominator == 1 ? Long.toString(numerator) : numerator + "/" + denominator;
    }
}
