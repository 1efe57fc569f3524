package com.monitoring.platform.orchestrator;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedDeque;

/**
 * In-memory store of the last N cycle summaries for the REST API, newest first.
 */
@Component
public class RecentCyclesStore implements CycleSummaryListener {

    static final int MAX_RECENT = 50;
    private final ConcurrentLinkedDeque<CycleSummary> recent = new ConcurrentLinkedDeque<>();

    @Override
    public void onCycleCompleted(CycleSummary summary) {
        recent.addFirst(summary);
        while (recent.size() > MAX_RECENT) recent.removeLast();
    }

    public List<CycleSummary> getRecent(int limit) {
        List<CycleSummary> out = new ArrayList<>();
        for (CycleSummary s : recent) {
            if (out.size() >= limit) break;
            out.add(s);
        }
        return out;
    }
}
