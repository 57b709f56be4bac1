package com.archforge.core.external;

/**
 * External text-generation collaborator.
 *
 * <p>Output is untrusted: it may be prose, fenced code, or empty. Callers always
 * post-process and validate what they receive.
 */
public interface TextGenerator {

    /**
     * Returns unique identifier for this generator.
     *
     * @return identifier (e.g. "openai")
     */
    String getId();

    /**
     * Produces text for a prompt.
     *
     * @param prompt full prompt text
     * @return generated text
     * @throws TextGenerationException if the call fails
     */
    String generate(String prompt);
}
