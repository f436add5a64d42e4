package com.jreinhal.waypoint.llm;

/**
 * Text completion backend used by the classifiers.
 *
 * <p>Implementations must be safe to call concurrently and must report failure by throwing
 * {@link LlmServiceException}; a returned string is always the model's actual output.</p>
 */
public interface LlmService {

    String generateCompletion(String prompt, CompletionOptions options);
}
