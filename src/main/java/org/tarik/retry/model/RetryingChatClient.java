/*
 * Copyright © 2025 Taras Paruta (partarstu@gmail.com)
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.tarik.retry.model;

import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tarik.retry.RetryConfig;
import org.tarik.retry.controller.RetryController;
import org.tarik.retry.controller.RetryPolicy;
import org.tarik.retry.fallback.FallbackConsent;
import org.tarik.retry.fallback.ModelFallbackHandler;
import org.tarik.retry.fallback.ModelSelection;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

import static java.lang.Thread.currentThread;
import static java.time.Duration.between;
import static java.time.Instant.now;
import static java.util.Objects.requireNonNull;

/**
 * Sends chat requests to the currently selected model, retrying transient failures. If the policy falls back to
 * another model, the remaining attempts of the same request already go to that model.
 */
public class RetryingChatClient implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(RetryingChatClient.class);
    private final Function<String, ChatModel> chatModelProvider;
    private final ModelSelection modelSelection;
    private final RetryController retryController;
    private final RetryPolicy retryPolicy;
    private final Map<String, ChatModel> chatModelsByName = new ConcurrentHashMap<>();

    public RetryingChatClient(@NotNull Function<String, ChatModel> chatModelProvider,
                              @NotNull ModelSelection modelSelection,
                              @NotNull RetryController retryController,
                              @NotNull RetryPolicy retryPolicy) {
        this.chatModelProvider = requireNonNull(chatModelProvider);
        this.modelSelection = requireNonNull(modelSelection);
        this.retryController = requireNonNull(retryController);
        this.retryPolicy = requireNonNull(retryPolicy);
    }

    public static RetryingChatClient fromConfig(@NotNull Function<String, ChatModel> chatModelProvider,
                                                @NotNull FallbackConsent consent) {
        var modelSelection = new ModelSelection(RetryConfig.getModelName());
        var fallbackHandler = new ModelFallbackHandler(modelSelection, RetryConfig.getFallbackModelName(), consent);
        var retryPolicy = RetryPolicy.fromConfig()
                .withPersistentRateLimitHandler(fallbackHandler, RetryConfig.getAuthMode());
        return new RetryingChatClient(chatModelProvider, modelSelection, new RetryController(), retryPolicy);
    }

    public ChatResponse chat(@NotNull ChatRequest chatRequest, @NotNull String generationDescription) {
        try {
            return retryController.execute(() -> generate(chatRequest, generationDescription), retryPolicy);
        } catch (RuntimeException e) {
            throw e;
        } catch (InterruptedException e) {
            currentThread().interrupt();
            throw new CancellationException("Interrupted while retrying " + generationDescription);
        } catch (Exception e) {
            throw new IllegalStateException(e);
        }
    }

    public String chat(@NotNull String userMessage) {
        var chatRequest = ChatRequest.builder().messages(UserMessage.from(userMessage)).build();
        return chat(chatRequest, "user message").aiMessage().text();
    }

    public String getCurrentModel() {
        return modelSelection.getCurrentModel();
    }

    /**
     * Closes all the models used so far, even if some of them fail to close. The first failure is rethrown with the
     * later ones attached as suppressed.
     */
    @Override
    public void close() {
        RuntimeException closeError = null;
        for (ChatModel chatModel : chatModelsByName.values()) {
            if (chatModel instanceof AutoCloseable closeableModel) {
                try {
                    closeableModel.close();
                } catch (Exception e) {
                    LOG.warn("Couldn't close chat model {}", chatModel, e);
                    if (closeError == null) {
                        closeError = new IllegalStateException("Couldn't close all chat models", e);
                    } else {
                        closeError.addSuppressed(e);
                    }
                }
            }
        }
        chatModelsByName.clear();
        if (closeError != null) {
            throw closeError;
        }
    }

    private ChatResponse generate(ChatRequest chatRequest, String generationDescription) {
        var start = now();
        var modelName = modelSelection.getCurrentModel();
        var chatModel = chatModelsByName.computeIfAbsent(modelName,
                name -> requireNonNull(chatModelProvider.apply(name), "No chat model available for " + name));
        var response = chatModel.chat(chatRequest);
        validateAndLogResponse(generationDescription, modelName, response, start);
        return response;
    }

    private void validateAndLogResponse(String generationDescription, String modelName, ChatResponse response,
                                        Instant start) {
        requireNonNull(response, "Model response can't be null");
        requireNonNull(response.aiMessage(), "Model response message can't be null");
        LOG.debug("Done content generation for {} by {} in {} millis",
                generationDescription, modelName, between(start, now()).toMillis());
    }
}
