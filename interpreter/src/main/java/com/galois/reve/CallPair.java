package com.galois.reve;

/**
 * The records of running two variants of a program.
 */
public final class CallPair<K> {
    private final Call<K> first;
    private final Call<K> second;

    public CallPair(Call<K> first, Call<K> second) {
        if (first == null) throw new NullPointerException("first");
        if (second == null) throw new NullPointerException("second");
        this.first = first;
        this.second = second;
    }

    public Call<K> getFirst() {
        return first;
    }

    public Call<K> getSecond() {
        return second;
    }

    public CallPair<String> toPortable() {
        return new CallPair<String>(first.toPortable(), second.toPortable());
    }

    public String toString() {
        return "(" + first + ", " + second + ")";
    }

    public boolean equals(Object o) {
        if (!(o instanceof CallPair)) return false;
        CallPair<?> r = (CallPair<?>) o;
        return first.equals(r.first) && second.equals(r.second);
    }

    public int hashCode() {
        return first.hashCode() * 31 + second.hashCode();
    }
}
