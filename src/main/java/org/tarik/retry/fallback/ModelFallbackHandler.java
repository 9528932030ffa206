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
package org.tarik.retry.fallback;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tarik.retry.controller.AuthMode;
import org.tarik.retry.controller.PersistentRateLimitHandler;

import static com.google.common.base.Preconditions.checkArgument;
import static java.lang.Thread.currentThread;
import static java.util.Objects.requireNonNull;
import static org.tarik.retry.utils.CommonUtils.isNotBlank;

/**
 * Switches the session to a cheaper model once the current one keeps being rate limited, provided the switch is
 * approved by the {@link FallbackConsent}.
 */
public class ModelFallbackHandler implements PersistentRateLimitHandler {
    private static final Logger LOG = LoggerFactory.getLogger(ModelFallbackHandler.class);
    private final ModelSelection modelSelection;
    private final String fallbackModel;
    private final FallbackConsent consent;

    public ModelFallbackHandler(@NotNull ModelSelection modelSelection, @NotNull String fallbackModel,
                                @NotNull FallbackConsent consent) {
        checkArgument(isNotBlank(fallbackModel), "Fallback model name can't be blank");
        this.modelSelection = requireNonNull(modelSelection);
        this.fallbackModel = fallbackModel;
        this.consent = requireNonNull(consent);
    }

    @Override
    @Nullable
    public String onPersistentRateLimit(@NotNull AuthMode authMode, @NotNull Throwable lastError) {
        if (!authMode.allowsEscalation()) {
            LOG.debug("Model fallback isn't available for auth mode '{}'", authMode.getValue());
            return null;
        }

        var currentModel = modelSelection.getCurrentModel();
        if (fallbackModel.equals(currentModel)) {
            LOG.debug("Already using the fallback model '{}'", fallbackModel);
            return null;
        }

        boolean approved;
        try {
            approved = consent.approve(currentModel, fallbackModel, lastError);
        } catch (InterruptedException e) {
            currentThread().interrupt();
            LOG.warn("Interrupted while waiting for the approval of switching to '{}'", fallbackModel);
            return null;
        } catch (Exception e) {
            LOG.warn("Couldn't get the approval of switching from '{}' to '{}'", currentModel, fallbackModel, e);
            return null;
        }

        if (!approved) {
            LOG.info("Switching from '{}' to '{}' was declined", currentModel, fallbackModel);
            return null;
        }

        modelSelection.switchTo(fallbackModel);
        LOG.info("Switched from '{}' to '{}' for the rest of this session because of persistent rate limiting",
                currentModel, fallbackModel);
        return fallbackModel;
    }

    public String getFallbackModel() {
        return fallbackModel;
    }
}
