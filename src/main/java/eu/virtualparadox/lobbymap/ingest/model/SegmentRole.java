package eu.virtualparadox.lobbymap.ingest.model;

public enum SegmentRole {
    HEADING,
    BODY,
    LIST_ITEM,
    TABLE,
    /** The parser backend supplies no layout information. */
    UNSPECIFIED
}
