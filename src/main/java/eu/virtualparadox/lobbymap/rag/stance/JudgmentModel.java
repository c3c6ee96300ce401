package eu.virtualparadox.lobbymap.rag.stance;

import eu.virtualparadox.lobbymap.exception.JudgmentParseException;

/**
 * Scores one piece of evidence against a rendered stance prompt.
 */
public interface JudgmentModel {

    /**
     * @param prompt       rendered instructions including the policy question
     * @param evidenceText the evidence to judge
     * @return schema-validated judgment
     * @throws JudgmentParseException if the model output does not match the schema
     */
    JudgmentResult judge(String prompt, String evidenceText);
}
