package com.marketsim.core.market;

/**
 * Fixed-capacity ring of the most recent values, oldest evicted first.
 */
public class PriceWindow {

    private final double[] values;
    private int start;
    private int size;

    public PriceWindow(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.values = new double[capacity];
    }

    public void add(double value) {
        if (size < values.length) {
            values[(start + size) % values.length] = value;
            size++;
        } else {
            values[start] = value;
            start = (start + 1) % values.length;
        }
    }

    public int size() {
        return size;
    }

    public int capacity() {
        return values.length;
    }

    /**
     * @param i 0 is the oldest retained value
     */
    public double get(int i) {
        if (i < 0 || i >= size) {
            throw new IndexOutOfBoundsException(i + " of " + size);
        }
        return values[(start + i) % values.length];
    }

    public double last() {
        return size == 0 ? Double.NaN : get(size - 1);
    }

    /**
     * Mean of the newest {@code n} values (fewer if fewer are held), NaN when empty.
     */
    public double mean(int n) {
        int count = Math.min(n, size);
        if (count == 0) {
            return Double.NaN;
        }
        double sum = 0;
        for (int i = size - count; i < size; i++) {
            sum += get(i);
        }
        return sum / count;
    }

    /**
     * Mean simple return over the newest {@code n} values, 0 with fewer than {@code n}.
     */
    public double meanReturn(int n) {
        if (size < n || n < 2) {
            return 0.0;
        }
        double sum = 0;
        for (int i = size - n + 1; i < size; i++) {
            sum += get(i) / get(i - 1) - 1.0;
        }
        return sum / (n - 1);
    }

    /**
     * Population standard deviation of log returns over the newest {@code n}
     * values, NaN with fewer than three values in range.
     */
    public double logReturnStdDev(int n) {
        int count = Math.min(n, size);
        if (count < 3) {
            return Double.NaN;
        }
        int returns = count - 1;
        double[] r = new double[returns];
        double sum = 0;
        for (int i = 0; i < returns; i++) {
            int idx = size - count + i;
            r[i] = Math.log(get(idx + 1) / get(idx));
            sum += r[i];
        }
        double mean = sum / returns;
        double var = 0;
        for (double x : r) {
            var += (x - mean) * (x - mean);
        }
        return Math.sqrt(var / returns);
    }
}
