/// A mutable JSON-like document tree with a hand-written lexer, a recursive
/// descent parser and a serializer.
///
/// - {@link json.tree.JsonValue} is the node type: one of null, bool, number,
///   string, list or object, switched by its setters.
/// - {@link json.tree.JsonView} is the read-only face of a node.
/// - {@link json.tree.Json} parses text into a tree and renders it back.
/// - {@link json.tree.JsonReadOptions} selects between the legacy reading rules
///   and their corrected forms.
///
/// Failures are unchecked and share the base {@link json.tree.JsonException}.
/// Logging goes through `java.util.logging` under the `json.tree` logger names.
package json.tree;
