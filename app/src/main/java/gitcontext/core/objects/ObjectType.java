package gitcontext.core.objects;

/**
 * The Git object types this reader decodes. Any other type found in an
 * object header is rejected by the caller that expected one of these.
 */
public enum ObjectType {
    COMMIT("commit"),
    TAG("tag");

    private final String typeName;

    ObjectType(String typeName) {
        this.typeName = typeName;
    }

    /**
     * Checks whether a type name read from an object header names this type.
     */
    public boolean matches(String type) {
        return typeName.equals(type);
    }
}
