package org.javai.recovery;

/**
 * Out-parameter slot filled by a {@link FaultSensitiveTester}.
 * Writes are visible across threads, since the tester may complete its work elsewhere.
 *
 * @param <T> The type of the held value
 */
public final class ResultHolder<T> {

    private volatile T value;
    private volatile boolean present;

    public static <T> ResultHolder<T> empty() {
        return new ResultHolder<>();
    }

    public void set(T value) {
        this.value = value;
        this.present = true;
    }

    /**
     * Returns the held value, or null when nothing has been set.
     */
    public T get() {
        return value;
    }

    public boolean isPresent() {
        return present;
    }

    public void clear() {
        this.present = false;
        this.value = null;
    }

    @Override
    public String toString() {
        return present ? "ResultHolder[" + value + "]" : "ResultHolder.empty";
    }
}
