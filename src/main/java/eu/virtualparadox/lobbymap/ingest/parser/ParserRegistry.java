package eu.virtualparadox.lobbymap.ingest.parser;

import eu.virtualparadox.lobbymap.application.config.ApplicationConfig;
import eu.virtualparadox.lobbymap.ingest.model.ParserOptions;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Resolves the configured parser strategy and backend options.
 */
@Component
@Slf4j
public class ParserRegistry {

    private final Map<String, DocumentParser> parsersByName;
    private final DocumentParser active;
    private final ParserOptions options;

    public ParserRegistry(final List<DocumentParser> parsers, final ApplicationConfig config) {
        this.parsersByName = parsers.stream()
                .collect(Collectors.toUnmodifiableMap(DocumentParser::name, Function.identity()));
        final ApplicationConfig.Parser parserConfig = config.getParser();
        this.active = byName(parserConfig.getStrategy());
        this.options = new ParserOptions(parserConfig.getDevice(), parserConfig.getThreadCount());
        log.info("Parser strategy '{}' on {} with {} thread(s)", active.name(), options.device(), options.threadCount());
    }

    public DocumentParser active() {
        return active;
    }

    public ParserOptions options() {
        return options;
    }

    public DocumentParser byName(final String name) {
        final DocumentParser parser = parsersByName.get(name);
        if (parser == null) {
            throw new IllegalArgumentException("Unknown parser strategy '" + name + "', available: " + parsersByName.keySet());
        }
        return parser;
    }
}
