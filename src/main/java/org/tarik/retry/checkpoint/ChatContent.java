package org.tarik.retry.checkpoint;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import org.jetbrains.annotations.Nullable;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A single turn of a conversation as persisted in checkpoints. Properties other than the role and the text of the
 * parts (function calls, inline data etc.) are kept as raw JSON, so that a loaded checkpoint can be saved again
 * without losing anything.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ChatContent {
    public static final String USER_ROLE = "user";
    public static final String MODEL_ROLE = "model";

    private final String role;
    private final List<Part> parts;
    private final Map<String, JsonNode> otherProperties = new LinkedHashMap<>();

    @JsonCreator
    public ChatContent(@JsonProperty("role") @Nullable String role, @JsonProperty("parts") @Nullable List<Part> parts) {
        this.role = role;
        this.parts = parts;
    }

    public static ChatContent of(String role, String... texts) {
        return new ChatContent(role, Arrays.stream(texts).map(Part::new).toList());
    }

    @JsonProperty("role")
    public String role() {
        return role;
    }

    @JsonProperty("parts")
    public List<Part> parts() {
        return parts;
    }

    @JsonAnyGetter
    public Map<String, JsonNode> getOtherProperties() {
        return otherProperties;
    }

    @JsonAnySetter
    void setOtherProperty(String name, JsonNode value) {
        otherProperties.put(name, value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ChatContent that)) {
            return false;
        }
        return Objects.equals(role, that.role) && Objects.equals(parts, that.parts)
                && otherProperties.equals(that.otherProperties);
    }

    @Override
    public int hashCode() {
        return Objects.hash(role, parts, otherProperties);
    }

    @Override
    public String toString() {
        return "ChatContent[role=%s, parts=%s, otherProperties=%s]".formatted(role, parts, otherProperties);
    }

    /**
     * A part of a conversation turn. Only the text is typed, anything else is carried over as is.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static final class Part {
        private final String text;
        private final Map<String, JsonNode> otherProperties = new LinkedHashMap<>();

        @JsonCreator
        public Part(@JsonProperty("text") @Nullable String text) {
            this.text = text;
        }

        @JsonProperty("text")
        public String text() {
            return text;
        }

        @JsonAnyGetter
        public Map<String, JsonNode> getOtherProperties() {
            return otherProperties;
        }

        @JsonAnySetter
        void setOtherProperty(String name, JsonNode value) {
            otherProperties.put(name, value);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof Part that)) {
                return false;
            }
            return Objects.equals(text, that.text) && otherProperties.equals(that.otherProperties);
        }

        @Override
        public int hashCode() {
            return Objects.hash(text, otherProperties);
        }

        @Override
        public String toString() {
            return "Part[text=%s, otherProperties=%s]".formatted(text, otherProperties);
        }
    }
}
