package com.stochastic.sde.noise;

/**
 * Stack of future noise pieces {@code (dt, dW, dZ)} used by Brownian-bridge
 * refinement.
 *
 * The top of the stack is always the piece immediately following the current
 * time. Entries are pooled: popping an entry does not release it, it is reused
 * by the next push, so steady-state operation does not allocate.
 */
public final class ResettableStack {
    private final int samples;
    private final boolean auxiliary;
    private Entry[] entries = new Entry[8];
    private int size;
    private int maxSize;

    public ResettableStack(int samples, boolean auxiliary) {
        this.samples = samples;
        this.auxiliary = auxiliary;
    }

    public void push(double dt, double[] dW, double[] dZ) {
        if (size == entries.length) {
            Entry[] next = new Entry[entries.length * 2];
            System.arraycopy(entries, 0, next, 0, entries.length);
            entries = next;
        }
        Entry e = entries[size];
        if (e == null) {
            e = new Entry(samples, auxiliary);
            entries[size] = e;
        }
        e.dt = dt;
        System.arraycopy(dW, 0, e.dW, 0, samples);
        if (auxiliary)
            System.arraycopy(dZ, 0, e.dZ, 0, samples);
        size++;
        if (size > maxSize)
            maxSize = size;
    }

    /** @return The top entry. It stays owned by the stack; mutate it only to shrink it in place. */
    public Entry peek() {
        if (size == 0)
            throw new IllegalStateException("Stack is empty");
        return entries[size - 1];
    }

    /** Removes the top entry. The returned object is recycled by the next push. */
    public Entry pop() {
        Entry e = peek();
        size--;
        return e;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    public int size() {
        return size;
    }

    /** @return High-water mark since construction or the last {@link #reset()}. */
    public int maxSize() {
        return maxSize;
    }

    /** Empties the stack without releasing pooled entries. */
    public void reset() {
        size = 0;
        maxSize = 0;
    }

    /** A single future noise piece. */
    public static final class Entry {
        double dt;
        final double[] dW;
        final double[] dZ;

        Entry(int samples, boolean auxiliary) {
            this.dW = new double[samples];
            this.dZ = auxiliary ? new double[samples] : null;
        }

        public double dt() {
            return dt;
        }

        public double[] dW() {
            return dW;
        }

        public double[] dZ() {
            return dZ;
        }
    }
}
