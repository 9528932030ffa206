package org.tarik.retry.checkpoint;

import java.util.List;

/**
 * Persists conversations under a tag so that they can be resumed later.
 */
public interface CheckpointStore {

    void save(String tag, List<ChatContent> conversation);

    /**
     * @param tagOrPath either a checkpoint tag or an absolute path to a checkpoint file.
     * @return the stored conversation, or an empty list if there is none or it can't be read.
     */
    List<ChatContent> load(String tagOrPath);

    List<String> list();
}
