package com.deepansh.lineage.llm;

/**
 * Text-generation oracle the agent consults for planning, tool choice and the
 * final answer. Implementations may be slow, may time out and are not
 * deterministic; callers must treat any failure as empty text.
 */
public interface DecisionMaker {

    /**
     * @param prompt    full prompt text
     * @param maxTokens upper bound on generated tokens
     * @return generated text, possibly empty
     */
    String generate(String prompt, int maxTokens);
}
