package eu.virtualparadox.lobbymap.query.model;

/**
 * @param documentId requested document
 * @param found      {@code false} if the collection held no chunk of the document
 */
public record DeleteResult(String documentId, boolean found) {
}
