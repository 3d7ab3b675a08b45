package com.example.towermud;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Random;

/**
 * Random that replays queued values so dice rolls are known in advance.
 * Unscripted calls return 0 from nextInt and 0.999 from nextDouble, so
 * d20 rolls a 1 and chance checks fail unless a test says otherwise.
 */
class ScriptedRandom extends Random {

    private final Deque<Integer> ints = new ArrayDeque<>();
    private final Deque<Double> doubles = new ArrayDeque<>();

    /** Raw nextInt results (a die face minus one). */
    ScriptedRandom scriptInts(int... values) {
        for (int v : values) ints.add(v);
        return this;
    }

    /** Die faces as rolled, e.g. 20 for a natural twenty. */
    ScriptedRandom faces(int... faces) {
        for (int f : faces) ints.add(f - 1);
        return this;
    }

    ScriptedRandom scriptDoubles(double... values) {
        for (double v : values) doubles.add(v);
        return this;
    }

    @Override
    public int nextInt(int bound) {
        Integer v = ints.poll();
        return v == null ? 0 : Math.floorMod(v, bound);
    }

    @Override
    public double nextDouble() {
        Double v = doubles.poll();
        return v == null ? 0.999 : v;
    }

    int remainingInts() {
        return ints.size();
    }
}
