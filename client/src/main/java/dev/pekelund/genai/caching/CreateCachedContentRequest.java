package dev.pekelund.genai.caching;

import com.fasterxml.jackson.annotation.JsonInclude;
import dev.pekelund.genai.content.Content;
import dev.pekelund.genai.content.Part;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import org.springframework.util.Assert;
import org.springframework.util.StringUtils;

/**
 * Body of a create call. Use {@link #builder(String)}; either a TTL or an absolute expiry may be
 * given, not both.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public final class CreateCachedContentRequest {

    static final int MAX_DISPLAY_NAME_LENGTH = 128;

    private final String model;
    private final String displayName;
    private final Content systemInstruction;
    private final List<Content> contents;
    private final String ttl;
    private final String expireTime;

    private CreateCachedContentRequest(Builder builder) {
        this.model = builder.model.contains("/") ? builder.model : "models/" + builder.model;
        this.displayName = builder.displayName;
        this.systemInstruction = builder.systemInstruction;
        this.contents = Collections.unmodifiableList(new ArrayList<>(builder.contents));
        this.ttl = builder.ttl != null ? formatDuration(builder.ttl) : null;
        this.expireTime = builder.expireTime != null ? builder.expireTime.toString() : null;
    }

    public static Builder builder(String model) {
        return new Builder(model);
    }

    /**
     * Protobuf JSON form of a duration, for example {@code 3600s}.
     */
    static String formatDuration(Duration duration) {
        if (duration.getNano() == 0) {
            return duration.getSeconds() + "s";
        }
        return String.format(Locale.ROOT, "%d.%09ds", duration.getSeconds(), duration.getNano());
    }

    public String getModel() {
        return model;
    }

    public String getDisplayName() {
        return displayName;
    }

    public Content getSystemInstruction() {
        return systemInstruction;
    }

    public List<Content> getContents() {
        return contents;
    }

    public String getTtl() {
        return ttl;
    }

    public String getExpireTime() {
        return expireTime;
    }

    public static final class Builder {

        private final String model;
        private String displayName;
        private Content systemInstruction;
        private final List<Content> contents = new ArrayList<>();
        private Duration ttl;
        private Instant expireTime;

        private Builder(String model) {
            Assert.hasText(model, "Model name must not be empty");
            this.model = model;
        }

        public Builder displayName(String displayName) {
            this.displayName = displayName;
            return this;
        }

        public Builder systemInstruction(Content systemInstruction) {
            this.systemInstruction = systemInstruction;
            return this;
        }

        public Builder systemInstruction(String systemInstruction) {
            this.systemInstruction = StringUtils.hasText(systemInstruction)
                ? new Content(null, List.of(Part.fromText(systemInstruction)))
                : null;
            return this;
        }

        public Builder contents(List<Content> contents) {
            if (contents != null) {
                this.contents.addAll(contents);
            }
            return this;
        }

        public Builder ttl(Duration ttl) {
            this.ttl = ttl;
            return this;
        }

        public Builder expireTime(Instant expireTime) {
            this.expireTime = expireTime;
            return this;
        }

        /**
         * @throws IllegalArgumentException when both a TTL and an expiry are set, or the display
         *     name is too long
         */
        public CreateCachedContentRequest build() {
            if (ttl != null && expireTime != null) {
                throw new IllegalArgumentException(
                    "Exclusive arguments: Please provide either `ttl` or `expireTime`, not both.");
            }
            if (displayName != null && displayName.codePointCount(0, displayName.length()) > MAX_DISPLAY_NAME_LENGTH) {
                throw new IllegalArgumentException(
                    "`displayName` must be no more than " + MAX_DISPLAY_NAME_LENGTH + " unicode characters.");
            }
            return new CreateCachedContentRequest(this);
        }
    }
}
