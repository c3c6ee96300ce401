package eu.virtualparadox.lobbymap.util;

/**
 * Field names of the chunk records stored in the Lucene collection.
 */
public class LuceneConstants {
    public static final String FIELD_VECTOR = "vector";
    public static final String FIELD_DOC_ID = "document_id";
    public static final String FIELD_CHUNK_ID = "chunk_id";
    public static final String FIELD_TEXT = "text";
    public static final String FIELD_AUTHOR = "author";
    public static final String FIELD_REGION = "region";
    /** Stored ISO date. */
    public static final String FIELD_DATE = "date";
    /** Epoch day, indexed as a point for range filters. */
    public static final String FIELD_DATE_POINT = "date_point";
    public static final String FIELD_ORDINAL = "ordinal";
    public static final String FIELD_LANGUAGE = "language";
    public static final String FIELD_TOKEN_COUNT = "token_count";
    public static final String FIELD_FROM_PAGE = "from_page";
    public static final String FIELD_TO_PAGE = "to_page";
    public static final String FIELD_UPLOAD_TIME = "upload_time";

    private LuceneConstants() {
        // prevent instantiation
    }
}
