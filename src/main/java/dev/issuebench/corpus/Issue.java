package dev.issuebench.corpus;

import java.util.List;
import java.util.Objects;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * A catalogued coding problem.
 *
 * <p>Issues are produced by a corpus loader and are read-only for the evaluation engine. Only
 * {@code id}, the three classification tags and the evaluation fields are consulted while
 * scoring; the remaining fields travel with the issue for the harness that runs the agent.
 *
 * @param id unique identifier, e.g. {@code express-auth-bug-001}
 * @param title human-readable title
 * @param description what needs to be done
 * @param difficulty difficulty tier
 * @param taskType kind of work
 * @param language primary language, free-form ({@code go}, {@code python}, ...)
 * @param prompt the prompt handed to the coding agent
 * @param repoUrl repository to clone
 * @param repoRef branch, tag or commit to check out
 * @param issueUrl link to the upstream issue, if any
 * @param evalMethod raw evaluation method tag, see {@link EvalMethod#fromTag}
 * @param testCommand check command for the test suite method; language default when empty
 * @param successCriteria what defines success for the judge
 * @param checkScript shell script body for the custom check method
 * @param expectedFiles files a good solution should touch
 * @param contextFiles files handed to the agent as context
 * @param tags free-form tags for selection
 */
public record Issue(
        @Nonnull String id,
        @Nullable String title,
        @Nullable String description,
        @Nonnull Difficulty difficulty,
        @Nonnull TaskType taskType,
        @Nonnull String language,
        @Nullable String prompt,
        @Nullable String repoUrl,
        @Nullable String repoRef,
        @Nullable String issueUrl,
        @Nullable String evalMethod,
        @Nullable String testCommand,
        @Nullable String successCriteria,
        @Nullable String checkScript,
        @Nonnull List<String> expectedFiles,
        @Nonnull List<String> contextFiles,
        @Nonnull List<String> tags) {

    public Issue {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(difficulty, "difficulty");
        Objects.requireNonNull(taskType, "taskType");
        Objects.requireNonNull(language, "language");
        expectedFiles = expectedFiles == null ? List.of() : List.copyOf(expectedFiles);
        contextFiles = contextFiles == null ? List.of() : List.copyOf(contextFiles);
        tags = tags == null ? List.of() : List.copyOf(tags);
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    /** Builder for issues, mostly used by loaders and tests. */
    public static final class Builder {
        private final String id;
        private @Nullable String title;
        private @Nullable String description;
        private Difficulty difficulty = Difficulty.MEDIUM;
        private TaskType taskType = TaskType.BUG_FIX;
        private String language = "";
        private @Nullable String prompt;
        private @Nullable String repoUrl;
        private @Nullable String repoRef;
        private @Nullable String issueUrl;
        private @Nullable String evalMethod;
        private @Nullable String testCommand;
        private @Nullable String successCriteria;
        private @Nullable String checkScript;
        private List<String> expectedFiles = List.of();
        private List<String> contextFiles = List.of();
        private List<String> tags = List.of();

        private Builder(String id) {
            this.id = Objects.requireNonNull(id);
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder difficulty(@Nonnull Difficulty difficulty) {
            this.difficulty = Objects.requireNonNull(difficulty);
            return this;
        }

        public Builder taskType(@Nonnull TaskType taskType) {
            this.taskType = Objects.requireNonNull(taskType);
            return this;
        }

        public Builder language(@Nonnull String language) {
            this.language = Objects.requireNonNull(language);
            return this;
        }

        public Builder prompt(String prompt) {
            this.prompt = prompt;
            return this;
        }

        public Builder repo(String repoUrl, String repoRef) {
            this.repoUrl = repoUrl;
            this.repoRef = repoRef;
            return this;
        }

        public Builder issueUrl(String issueUrl) {
            this.issueUrl = issueUrl;
            return this;
        }

        public Builder evalMethod(String evalMethod) {
            this.evalMethod = evalMethod;
            return this;
        }

        public Builder evalMethod(@Nonnull EvalMethod evalMethod) {
            return evalMethod(evalMethod.tag());
        }

        public Builder testCommand(String testCommand) {
            this.testCommand = testCommand;
            return this;
        }

        public Builder successCriteria(String successCriteria) {
            this.successCriteria = successCriteria;
            return this;
        }

        public Builder checkScript(String checkScript) {
            this.checkScript = checkScript;
            return this;
        }

        public Builder expectedFiles(String... files) {
            this.expectedFiles = List.of(files);
            return this;
        }

        public Builder contextFiles(String... files) {
            this.contextFiles = List.of(files);
            return this;
        }

        public Builder tags(String... tags) {
            this.tags = List.of(tags);
            return this;
        }

        public Issue build() {
            return new Issue(
                    id,
                    title,
                    description,
                    difficulty,
                    taskType,
                    language,
                    prompt,
                    repoUrl,
                    repoRef,
                    issueUrl,
                    evalMethod,
                    testCommand,
                    successCriteria,
                    checkScript,
                    expectedFiles,
                    contextFiles,
                    tags);
        }
    }
}
