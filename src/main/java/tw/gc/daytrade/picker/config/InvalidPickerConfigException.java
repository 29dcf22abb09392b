package tw.gc.daytrade.picker.config;

/**
 * Thrown when the picker configuration is missing a required key or holds an
 * unusable value. Raised once at load time, never retried.
 */
public class InvalidPickerConfigException extends RuntimeException {

    private final String key;

    public InvalidPickerConfigException(String key, String message) {
        super(key + ": " + message);
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
