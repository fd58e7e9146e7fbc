package net.cratedigger.service.review;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedQueue;
import net.cratedigger.domain.recommendation.Recommendation;
import org.springframework.stereotype.Component;

/**
 * Hand-off between the review workflow and the next pipeline run: items released
 * from the review queue wait here until a run drains them into its result.
 */
@Component
public class PendingImportBuffer {

    private final ConcurrentLinkedQueue<Recommendation> pending = new ConcurrentLinkedQueue<>();

    public void addAll(Collection<Recommendation> items) {
        if (items != null) {
            items.forEach(pending::add);
        }
    }

    public List<Recommendation> drain() {
        List<Recommendation> drained = new ArrayList<>();
        Recommendation next;
        while ((next = pending.poll()) != null) {
            drained.add(next);
        }
        return drained;
    }

    public int size() {
        return pending.size();
    }
}
