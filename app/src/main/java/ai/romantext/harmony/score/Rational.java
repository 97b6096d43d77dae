package ai.romantext.harmony.score;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;

/**
 * Exact non-negative fraction used for beats and durations.
 */
public record Rational(long numerator, long denominator) implements Comparable<Rational> {

    public static final Rational ZERO = new Rational(0, 1);
    public static final Rational ONE = new Rational(1, 1);

    public Rational {
        if (denominator <= 0) {
            throw new IllegalArgumentException("denominator must be positive");
        }
        if (numerator < 0) {
            throw new IllegalArgumentException("numerator must not be negative");
        }
        long gcd = gcd(numerator, denominator);
        numerator = numerator / gcd;
        denominator = denominator / gcd;
    }

    public static Rational of(long whole) {
        return new Rational(whole, 1);
    }

    public static Rational of(long numerator, long denominator) {
        return new Rational(numerator, denominator);
    }

    /**
     * Parses {@code "3"}, {@code "5/2"} or a decimal such as {@code "1.5"}.
     */
    public static Rational parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Rational value must be provided");
        }
        String value = raw.trim();
        try {
            int slash = value.indexOf('/');
            if (slash >= 0) {
                return new Rational(Long.parseLong(value.substring(0, slash).trim()),
                        Long.parseLong(value.substring(slash + 1).trim()));
            }
            BigDecimal decimal = new BigDecimal(value);
            if (decimal.scale() <= 0) {
                return of(decimal.longValueExact());
            }
            BigInteger unscaled = decimal.unscaledValue();
            return new Rational(unscaled.longValueExact(), BigInteger.TEN.pow(decimal.scale()).longValueExact());
        } catch (NumberFormatException | ArithmeticException ex) {
            throw new IllegalArgumentException("Invalid rational value: " + raw, ex);
        }
    }

    public Rational plus(Rational other) {
        return new Rational(numerator * other.denominator + other.numerator * denominator,
                denominator * other.denominator);
    }

    public boolean isWhole() {
        return denominator == 1;
    }

    public BigDecimal toBigDecimal(int scale) {
        return BigDecimal.valueOf(numerator).divide(BigDecimal.valueOf(denominator), scale, RoundingMode.HALF_EVEN);
    }

    @Override
    public int compareTo(Rational other) {
        return Long.compare(numerator * other.denominator, other.numerator * denominator);
    }

    @Override
    public String toString() {
        return isWhole() ? Long.toString(numerator) : numerator + "/" + denominator;
    }

    private static long gcd(long a, long b) {
        while (b != 0) {
            long t = a % b;
            a = b;
            b = t;
        }
        return a == 0 ? 1 : a;
    }
}
