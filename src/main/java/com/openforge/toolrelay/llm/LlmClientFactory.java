package com.openforge.toolrelay.llm;

/**
 * Creates a streaming client for an ad-hoc provider configuration, e.g. a
 * model deployment addressed with the caller's own key.
 */
@FunctionalInterface
public interface LlmClientFactory {

    StreamingLlm create(LlmProperties.ProviderConfig config);
}
