package gitcontext.core.objects;

import java.util.Objects;

/**
 * One {@code key value} line from the header section of a commit or tag
 * object. Keys may repeat within an object (e.g. several {@code parent}
 * lines).
 */
public final class ObjectField {
    private final String key;
    private final String value;

    public ObjectField(String key, String value) {
        this.key = Objects.requireNonNull(key, "key");
        this.value = Objects.requireNonNull(value, "value");
    }

    public String getKey() {
        return key;
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ObjectField)) {
            return false;
        }
        ObjectField that = (ObjectField) o;
        return key.equals(that.key) && value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, value);
    }

    @Override
    public String toString() {
        return key + " " + value;
    }
}
