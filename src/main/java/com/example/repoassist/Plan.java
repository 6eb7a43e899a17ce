package com.example.repoassist;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Ordered pending tool invocations for one request. Only the orchestrator changes it. */
public class Plan {

    private final Intent intent;
    private final List<PlanStep> steps = new ArrayList<>();

    public Plan(Intent intent) {
        this.intent = intent;
    }

    public Plan add(PlanStep step) {
        steps.add(step);
        return this;
    }

    /** Drops steps past {@code max}, together with anything depending on a dropped step. */
    public void truncate(int max) {
        while (steps.size() > Math.max(0, max)) steps.remove(steps.size() - 1);
        steps.removeIf(s -> s.isDependent() && !steps.contains(s.getDependsOn()));
    }

    public List<ToolRequest> requests() {
        List<ToolRequest> out = new ArrayList<>();
        for (PlanStep s : steps) if (s.getRequest() != null) out.add(s.getRequest());
        return out;
    }

    public Intent getIntent() { return intent; }
    public List<PlanStep> getSteps() { return Collections.unmodifiableList(steps); }
    public int size() { return steps.size(); }
    public boolean isEmpty() { return steps.isEmpty(); }

    @Override
    public String toString() {
        return intent + steps.toString();
    }
}
