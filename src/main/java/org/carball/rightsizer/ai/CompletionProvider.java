package org.carball.rightsizer.ai;

/**
 * Text completion backend. Implementations throw {@link CompletionException} (or any other
 * runtime exception) on transport failure.
 */
public interface CompletionProvider {

    String complete(String systemPrompt, String prompt, int maxTokens);

    /**
     * Same as {@link #complete} but asks the backend for a JSON object where it supports that.
     */
    default String completeJson(String systemPrompt, String prompt, int maxTokens) {
        return complete(systemPrompt, prompt, maxTokens);
    }

    String getModel();
}
