package fun.fengwk.rsh.core.service.state;

/**
 * External key-value store with per-key expiry.
 *
 * <p>Every operation throws {@link StoreUnavailableException} when the store cannot be reached or answers
 * with an error.
 *
 * @author fengwk
 */
public interface StateStore extends AutoCloseable {

    /**
     * @return the value, or null if the key is missing
     */
    String get(String key);

    void set(String key, String value, long ttlSeconds);

    boolean exists(String key);

    @Override
    void close();

}
