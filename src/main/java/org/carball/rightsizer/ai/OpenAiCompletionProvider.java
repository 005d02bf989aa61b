package org.carball.rightsizer.ai;

import com.openai.client.OpenAIClient;
import com.openai.client.okhttp.OpenAIOkHttpClient;
import com.openai.errors.OpenAIException;
import com.openai.errors.OpenAIServiceException;
import com.openai.models.ResponseFormatJsonObject;
import com.openai.models.chat.completions.ChatCompletion;
import com.openai.models.chat.completions.ChatCompletionCreateParams;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class OpenAiCompletionProvider implements CompletionProvider {

    private static final double TEMPERATURE = 0.1;

    private final OpenAIClient openAiClient;
    private final String model;

    public OpenAiCompletionProvider(String apiKey, String model) {
        this.openAiClient = OpenAIOkHttpClient.builder()
                .apiKey(apiKey)
                .build();
        this.model = model;
    }

    @Override
    public String complete(String systemPrompt, String prompt, int maxTokens) {
        return send(paramsBuilder(systemPrompt, prompt, maxTokens).build());
    }

    @Override
    public String completeJson(String systemPrompt, String prompt, int maxTokens) {
        return send(paramsBuilder(systemPrompt, prompt, maxTokens)
                .responseFormat(ResponseFormatJsonObject.builder().build())
                .build());
    }

    @Override
    public String getModel() {
        return model;
    }

    private ChatCompletionCreateParams.Builder paramsBuilder(String systemPrompt, String prompt, int maxTokens) {
        return ChatCompletionCreateParams.builder()
                .model(model)
                .addSystemMessage(systemPrompt)
                .addUserMessage(prompt)
                .temperature(TEMPERATURE)
                .maxCompletionTokens(maxTokens);
    }

    private String send(ChatCompletionCreateParams params) {
        log.debug("Request model: {}", model);
        try {
            ChatCompletion completion = openAiClient.chat().completions().create(params);
            if (completion.choices().isEmpty()) {
                throw new CompletionException("OpenAI returned no choices");
            }
            String response = completion.choices().get(0).message().content().orElse("");
            log.trace("Received response: {} characters", response.length());
            return response;
        } catch (OpenAIServiceException e) {
            // keep the status code in the message so transient failures can be recognized
            throw new CompletionException("OpenAI request failed with status " + e.statusCode() + ": "
                    + e.getMessage(), e);
        } catch (OpenAIException e) {
            throw new CompletionException("OpenAI request failed: " + e.getMessage(), e);
        }
    }
}
