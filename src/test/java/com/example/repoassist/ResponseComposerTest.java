package com.example.repoassist;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class ResponseComposerTest {

    private final ResponseComposer composer = new ResponseComposer();

    @Test
    public void patchModeExtractsTheDiffBlock() {
        String text = "Reject empty passwords before hashing [E1].\n\n"
                + "```diff\n--- a/auth/login.py\n+++ b/auth/login.py\n@@ -4,2 +4,4 @@\n+    if not password:\n+        return None\n```\n";

        ResponseComposer.Composed c = composer.compose(text, AssistMode.PATCH);

        assertThat(c.getPatchDiff()).startsWith("--- a/auth/login.py").contains("+    if not password:");
        assertThat(c.getAnswer()).isEqualTo("Reject empty passwords before hashing [E1].");
    }

    @Test
    public void patchModeAcceptsABareUnifiedDiff() {
        String text = "Here is the change [E2].\n--- a/x.py\n+++ b/x.py\n@@ -1 +1 @@\n-a\n+b\n";

        ResponseComposer.Composed c = composer.compose(text, AssistMode.PATCH);

        assertThat(c.getPatchDiff()).isEqualTo("--- a/x.py\n+++ b/x.py\n@@ -1 +1 @@\n-a\n+b");
        assertThat(c.getAnswer()).isEqualTo("Here is the change [E2].");
    }

    @Test
    public void otherModesLeaveDiffsInTheAnswer() {
        String text = "```diff\n--- a/x\n+++ b/x\n```";
        ResponseComposer.Composed c = composer.compose(text, AssistMode.EXPLAIN);

        assertThat(c.getPatchDiff()).isNull();
        assertThat(c.getAnswer()).isEqualTo(text);
    }

    @Test
    public void extractsNextActions() {
        String text = "Fix the login bug first [E1].\n\nNext Actions:\n- Add tests for authenticate\n- Hash with bcrypt [E2]\n";

        ResponseComposer.Composed c = composer.compose(text, AssistMode.SUGGEST);

        assertThat(c.getNextActions()).containsExactly("Add tests for authenticate", "Hash with bcrypt [E2]");
        assertThat(c.getAnswer()).isEqualTo("Fix the login bug first [E1].");
    }

    @Test
    public void extractsNumberedNextStepsUnderAHeading() {
        String text = "Summary [E1].\n\n## Next Steps\n1. Split the module\n2) Document the API\n";

        ResponseComposer.Composed c = composer.compose(text, AssistMode.EXPLAIN);

        assertThat(c.getNextActions()).containsExactly("Split the module", "Document the API");
        assertThat(c.getAnswer()).isEqualTo("Summary [E1].");
    }

    @Test
    public void answersWithoutActionsAreUntouched() {
        ResponseComposer.Composed c = composer.compose("  Plain answer [E1].  ", AssistMode.LOCATE);
        assertThat(c.getNextActions()).isEmpty();
        assertThat(c.getAnswer()).isEqualTo("Plain answer [E1].");
    }
}
