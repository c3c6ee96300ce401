package eu.virtualparadox.lobbymap.rag.stance;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Stance instructions with {@code {{query}}} and {@code {{author}}} placeholders.
 * The company line is dropped when the author is unknown.
 */
@Component
public class StancePromptTemplate {

    private static final String AUTHOR_LINE = "Here is the company in question:\n{{author}}\n";

    private final String template;

    public StancePromptTemplate(@Value("${lobbymap.stance.prompt-template:classpath:prompts/stance-prompt.txt}") final Resource resource) {
        try {
            this.template = resource.getContentAsString(StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to read stance prompt template " + resource, e);
        }
    }

    StancePromptTemplate(final String template) {
        this.template = template;
    }

    public String render(final String policyQuestion, final String author) {
        final String withAuthor = author == null || author.isBlank()
                ? template.replace(AUTHOR_LINE, "")
                : template.replace("{{author}}", author);
        return withAuthor.replace("{{query}}", policyQuestion);
    }
}
