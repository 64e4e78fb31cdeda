package dev.issuebench.corpus;

import com.fasterxml.jackson.annotation.JsonProperty;

/** What kind of work an issue asks for. */
public enum TaskType {
    @JsonProperty("bug_fix")
    BUG_FIX("bug_fix"),
    @JsonProperty("feature")
    FEATURE("feature"),
    @JsonProperty("refactor")
    REFACTOR("refactor"),
    @JsonProperty("test")
    TEST("test"),
    @JsonProperty("documentation")
    DOCUMENTATION("documentation");

    private final String tag;

    TaskType(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }
}
