package com.tracescope.query;

import com.tracescope.domain.IndexedTraceId;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Conjunction of several slice results.
 */
public final class TraceIdIntersector {
    
    private TraceIdIntersector() {
    }
    
    /**
     * Keep the trace ids present in every hit list. Each surviving id is
     * stamped with the latest timestamp it was seen at in any list.
     * 
     * The result follows the order in which ids first appear in the first
     * list; it is not re-sorted by timestamp.
     * 
     * @param idLists One hit list per slice; a list may repeat an id
     * @return The intersected hits, one per trace id
     */
    public static List<IndexedTraceId> intersect(List<List<IndexedTraceId>> idLists) {
        if (idLists.isEmpty()) {
            return List.of();
        }
        
        List<Map<Long, Long>> latestById = new ArrayList<>(idLists.size());
        for (List<IndexedTraceId> ids : idLists) {
            Map<Long, Long> latest = new LinkedHashMap<>();
            for (IndexedTraceId id : ids) {
                latest.merge(id.getTraceId(), id.getTimestamp(), Math::max);
            }
            latestById.add(latest);
        }
        
        List<IndexedTraceId> common = new ArrayList<>();
        for (Map.Entry<Long, Long> candidate : latestById.get(0).entrySet()) {
            long traceId = candidate.getKey();
            long timestamp = candidate.getValue();
            boolean inAll = true;
            for (int i = 1; i < latestById.size() && inAll; i++) {
                Long other = latestById.get(i).get(traceId);
                if (other == null) {
                    inAll = false;
                } else {
                    timestamp = Math.max(timestamp, other);
                }
            }
            if (inAll) {
                common.add(new IndexedTraceId(traceId, timestamp));
            }
        }
        return common;
    }
}
