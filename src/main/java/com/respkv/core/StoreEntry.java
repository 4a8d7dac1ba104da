package com.respkv.core;

import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable data model for stored values.
 * Holds the value bytes together with an optional expiry deadline on the
 * monotonic clock, so a single reference swap replaces both at once.
 */
public final class StoreEntry {

    private final byte[] value;
    private final boolean expiring;
    private final long expiresAtNanos; // only meaningful when expiring

    private StoreEntry(byte[] value, boolean expiring, long expiresAtNanos) {
        Objects.requireNonNull(value, "value");
        this.value = Arrays.copyOf(value, value.length);
        this.expiring = expiring;
        this.expiresAtNanos = expiresAtNanos;
    }

    /**
     * Create an entry that never expires.
     *
     * @param value the value bytes
     * @return the entry
     */
    public static StoreEntry persistent(byte[] value) {
        return new StoreEntry(value, false, 0);
    }

    /**
     * Create an entry that expires at the given monotonic deadline.
     *
     * @param value          the value bytes
     * @param expiresAtNanos deadline as read from the store's ticker
     * @return the entry
     */
    public static StoreEntry expiringAt(byte[] value, long expiresAtNanos) {
        return new StoreEntry(value, true, expiresAtNanos);
    }

    /**
     * Get a copy of the value bytes.
     *
     * @return copy of the value
     */
    public byte[] getValue() {
        return Arrays.copyOf(value, value.length);
    }

    /**
     * Get the raw value bytes without copying.
     * Use with caution - do not modify the returned array.
     *
     * @return the internal value array
     */
    public byte[] getValueUnsafe() {
        return value;
    }

    /**
     * Check if this entry has a TTL set.
     */
    public boolean hasTtl() {
        return expiring;
    }

    /**
     * Check if this entry has expired at the given instant.
     * An entry is still live at its deadline and expired once the deadline
     * is in the past. Uses overflow-safe comparison, as required for
     * {@link System#nanoTime()} values.
     *
     * @param nowNanos current ticker reading
     * @return true if the deadline has passed
     */
    public boolean isExpired(long nowNanos) {
        return expiring && nowNanos - expiresAtNanos > 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        StoreEntry that = (StoreEntry) o;
        return expiring == that.expiring &&
               expiresAtNanos == that.expiresAtNanos &&
               Arrays.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(expiring, expiresAtNanos);
        result = 31 * result + Arrays.hashCode(value);
        return result;
    }

    @Override
    public String toString() {
        return "StoreEntry{" +
               "valueLength=" + value.length +
               ", expiring=" + expiring +
               (expiring ? ", expiresAtNanos=" + expiresAtNanos : "") +
               '}';
    }
}
