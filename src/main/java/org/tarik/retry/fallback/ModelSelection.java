package org.tarik.retry.fallback;

import org.jetbrains.annotations.NotNull;

import java.util.concurrent.atomic.AtomicReference;

import static com.google.common.base.Preconditions.checkArgument;
import static org.tarik.retry.utils.CommonUtils.isNotBlank;

/**
 * The model the session currently talks to. Shared by the fallback handler, which switches it, and the chat client,
 * which reads it before every attempt.
 */
public class ModelSelection {
    private final AtomicReference<String> currentModel;

    public ModelSelection(@NotNull String initialModel) {
        checkArgument(isNotBlank(initialModel), "Model name can't be blank");
        this.currentModel = new AtomicReference<>(initialModel);
    }

    public String getCurrentModel() {
        return currentModel.get();
    }

    public void switchTo(@NotNull String model) {
        checkArgument(isNotBlank(model), "Model name can't be blank");
        currentModel.set(model);
    }
}
