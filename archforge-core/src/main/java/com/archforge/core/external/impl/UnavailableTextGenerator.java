package com.archforge.core.external.impl;

import com.archforge.core.external.TextGenerationException;
import com.archforge.core.external.TextGenerator;

/**
 * Text generator used when no provider is configured.
 *
 * <p>Every call fails non-retryably, so each task falls back to its stub at once.
 */
public class UnavailableTextGenerator implements TextGenerator {

    @Override
    public String getId() {
        return "none";
    }

    @Override
    public String generate(String prompt) {
        throw new TextGenerationException("No text-generation provider configured", false);
    }
}
