package eu.virtualparadox.lobbymap.ingest.model;

/**
 * Backend options for parsing.
 *
 * @param device      acceleration device, {@code cpu} or {@code gpu}
 * @param threadCount worker threads a parser may use for one document
 */
public record ParserOptions(String device, int threadCount) {

    public static ParserOptions defaults() {
        return new ParserOptions("cpu", 1);
    }

    public ParserOptions {
        if (device == null || device.isBlank()) {
            device = "cpu";
        }
        if (threadCount < 1) {
            threadCount = 1;
        }
    }
}
