package dev.issuebench.eval;

import dev.issuebench.corpus.Issue;

/** The fixed-shape prompt handed to the judge process. */
final class JudgePrompt {
    private static final String TEMPLATE =
            """
            You are evaluating if an AI assistant successfully solved a coding task.

            ## Task Description
            %s

            ## Success Criteria
            %s

            ## Changes Made (git diff)
            %s

            ## Assistant's Output
            %s

            ## Evaluation Instructions
            1. Did the assistant make appropriate code changes?
            2. Do the changes address the problem described?
            3. Are there any obvious bugs or issues in the solution?

            Rate the solution on a scale of 0-100 and explain your reasoning.
            Format your response as:
            SCORE: [number]
            REASON: [explanation]
            """;

    static String build(
            Issue issue, String diff, String agentOutput, int diffLimit, int outputLimit) {
        var description = issue.description() == null ? "" : issue.description();
        return TEMPLATE.formatted(
                description,
                criteria(issue),
                Outputs.truncate(diff, diffLimit),
                Outputs.truncate(agentOutput, outputLimit));
    }

    static String criteria(Issue issue) {
        var criteria = issue.successCriteria();
        if (criteria == null || criteria.isBlank()) {
            var description = issue.description() == null ? "" : issue.description();
            return "The code changes successfully address: " + description;
        }
        return criteria;
    }

    private JudgePrompt() {}
}
