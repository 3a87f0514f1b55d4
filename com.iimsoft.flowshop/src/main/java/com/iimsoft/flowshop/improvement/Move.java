package com.iimsoft.flowshop.improvement;

import com.iimsoft.flowshop.domain.JobSequence;

/**
 * A neighborhood move. Applying it yields a new sequence; the source sequence is untouched.
 */
public final class Move {

    public enum Kind { SWAP, INSERTION }

    private final Kind kind;
    private final int first;
    private final int second;

    private Move(Kind kind, int first, int second) {
        this.kind = kind;
        this.first = first;
        this.second = second;
    }

    public static Move swap(int i, int j) {
        return new Move(Kind.SWAP, i, j);
    }

    /** Remove the job at {@code from} and reinsert it so that it lands on {@code to}. */
    public static Move insertion(int from, int to) {
        return new Move(Kind.INSERTION, from, to);
    }

    public JobSequence applyTo(JobSequence sequence) {
        return kind == Kind.SWAP ? sequence.swap(first, second) : sequence.move(first, second);
    }

    /** Positions before this one keep their jobs, so their completion rows can be reused. */
    public int firstChangedPosition() {
        return Math.min(first, second);
    }

    public Kind getKind() {
        return kind;
    }

    public int getFirst() {
        return first;
    }

    public int getSecond() {
        return second;
    }

    @Override
    public String toString() {
        return kind + "(" + first + "," + second + ")";
    }
}
