package json.tree;

/// The variant a {@link JsonValue} currently holds.
public enum JsonKind {
    NULL,
    BOOL,
    NUMBER,
    STRING,
    LIST,
    OBJECT
}
