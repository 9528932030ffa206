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
package org.tarik.retry.checkpoint;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.hash.Hashing;
import org.apache.commons.io.FileUtils;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tarik.retry.RetryConfig;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;
import static java.nio.charset.StandardCharsets.UTF_8;
import static org.tarik.retry.utils.CommonUtils.isNotBlank;

/**
 * Stores each checkpoint as a pretty printed JSON array in {@code checkpoint-<tag>.json}. The directory is created
 * lazily by the first operation which needs it.
 */
public class FileCheckpointStore implements CheckpointStore {
    private static final Logger LOG = LoggerFactory.getLogger(FileCheckpointStore.class);
    private static final String CHECKPOINT_FILE_PREFIX = "checkpoint-";
    private static final String CHECKPOINT_FILE_SUFFIX = ".json";
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    private static final TypeReference<List<ChatContent>> CONVERSATION_TYPE = new TypeReference<>() {
    };

    private final Path checkpointDir;
    private volatile boolean initialized;

    public FileCheckpointStore(@Nullable Path checkpointDir) {
        this.checkpointDir = checkpointDir;
    }

    /**
     * Creates a store in a directory dedicated to the given project, so that checkpoints of different projects never
     * collide.
     */
    public static FileCheckpointStore forProject(@NotNull Path projectRoot) {
        var projectHash = Hashing.sha256()
                .hashString(projectRoot.toAbsolutePath().normalize().toString(), UTF_8)
                .toString();
        return new FileCheckpointStore(RetryConfig.getCheckpointRootDir().resolve(projectHash));
    }

    /**
     * Creates the checkpoint directory if it's not there yet. Safe to call any number of times, also concurrently.
     *
     * @return whether the store can be used.
     */
    public boolean initialize() {
        if (initialized) {
            return true;
        }
        if (checkpointDir == null) {
            return false;
        }
        try {
            FileUtils.forceMkdir(checkpointDir.toFile());
            initialized = true;
        } catch (IOException e) {
            LOG.error("Couldn't create checkpoint directory {}", checkpointDir, e);
        }
        return initialized;
    }

    @Override
    public void save(@NotNull String tag, @NotNull List<ChatContent> conversation) {
        if (!initialize()) {
            LOG.error("Checkpoint store isn't initialized, can't save checkpoint '{}'", tag);
            return;
        }
        var checkpointPath = getCheckpointPath(tag);
        try {
            var json = OBJECT_MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(conversation);
            FileUtils.writeStringToFile(checkpointPath.toFile(), json, UTF_8);
            LOG.debug("Saved checkpoint '{}' with {} entries", tag, conversation.size());
        } catch (IOException e) {
            LOG.error("Error writing to checkpoint file {}", checkpointPath, e);
        }
    }

    @Override
    public List<ChatContent> load(@NotNull String tagOrPath) {
        initialize();
        var pathToLoad = Path.of(tagOrPath).isAbsolute() ? Path.of(tagOrPath) : getCheckpointPath(tagOrPath);
        try {
            var content = OBJECT_MAPPER.readTree(FileUtils.readFileToString(pathToLoad.toFile(), UTF_8));
            if (content == null || !content.isArray()) {
                LOG.warn("Checkpoint file at {} is not a valid JSON array. Returning empty checkpoint.", pathToLoad);
                return List.of();
            }
            return OBJECT_MAPPER.convertValue(content, CONVERSATION_TYPE);
        } catch (NoSuchFileException | FileNotFoundException e) {
            LOG.debug("No checkpoint file at {}", pathToLoad);
            return List.of();
        } catch (IOException | IllegalArgumentException e) {
            LOG.error("Failed to read or parse checkpoint file {}", pathToLoad, e);
            return List.of();
        }
    }

    @Override
    public List<String> list() {
        if (checkpointDir == null || !Files.isDirectory(checkpointDir)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(checkpointDir)) {
            return files
                    .map(file -> file.getFileName().toString())
                    .filter(name -> name.startsWith(CHECKPOINT_FILE_PREFIX) && name.endsWith(CHECKPOINT_FILE_SUFFIX))
                    .map(name -> name.substring(CHECKPOINT_FILE_PREFIX.length(),
                            name.length() - CHECKPOINT_FILE_SUFFIX.length()))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            LOG.warn("Couldn't list checkpoints in {}", checkpointDir, e);
            return List.of();
        }
    }

    @Nullable
    public Path getCheckpointDir() {
        return checkpointDir;
    }

    private Path getCheckpointPath(String tag) {
        checkArgument(isNotBlank(tag), "No checkpoint tag specified.");
        checkState(checkpointDir != null, "Checkpoint file path not set.");
        return checkpointDir.resolve(CHECKPOINT_FILE_PREFIX + tag + CHECKPOINT_FILE_SUFFIX);
    }
}
