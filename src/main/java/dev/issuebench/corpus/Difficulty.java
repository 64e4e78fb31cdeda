package dev.issuebench.corpus;

import com.fasterxml.jackson.annotation.JsonProperty;

/** How hard an issue is. */
public enum Difficulty {
    @JsonProperty("easy")
    EASY("easy"),
    @JsonProperty("medium")
    MEDIUM("medium"),
    @JsonProperty("hard")
    HARD("hard");

    private final String tag;

    Difficulty(String tag) {
        this.tag = tag;
    }

    /** The corpus spelling of this difficulty, also used as the partition key in summaries. */
    public String tag() {
        return tag;
    }
}
