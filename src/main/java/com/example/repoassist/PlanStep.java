package com.example.repoassist;

/**
 * One pending tool invocation, tagged with the intent it serves. A dependent step has no request
 * of its own: it opens the n-th ranked hit of the search step it depends on, and only runs after
 * that step has finished.
 */
public final class PlanStep {

    private final Intent intent;
    private final ToolRequest request;
    private final PlanStep dependsOn;
    private final int hitRank;

    private PlanStep(Intent intent, ToolRequest request, PlanStep dependsOn, int hitRank) {
        this.intent = intent;
        this.request = request;
        this.dependsOn = dependsOn;
        this.hitRank = hitRank;
    }

    public static PlanStep of(Intent intent, ToolRequest request) {
        return new PlanStep(intent, request, null, 0);
    }

    /** Open the {@code hitRank}-th (1-based) file hit of {@code search}. */
    public static PlanStep openHit(Intent intent, PlanStep search, int hitRank) {
        if (search.getTool() != ToolName.SEARCH_REPO) {
            throw new IllegalArgumentException("open_file can only depend on a search_repo step");
        }
        return new PlanStep(intent, null, search, hitRank);
    }

    public Intent getIntent() { return intent; }
    public ToolRequest getRequest() { return request; }
    public PlanStep getDependsOn() { return dependsOn; }
    public int getHitRank() { return hitRank; }

    public boolean isDependent() {
        return dependsOn != null;
    }

    public ToolName getTool() {
        return request != null ? request.getName() : ToolName.OPEN_FILE;
    }

    @Override
    public String toString() {
        return request != null ? request.toString() : "open_file{hit " + hitRank + " of " + dependsOn.getRequest() + "}";
    }
}
