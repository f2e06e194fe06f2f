package com.iimsoft.sequencer.domain;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.optaplanner.core.api.score.buildin.hardsoft.HardSoftScore;

/**
 * 一次排序请求的全部资源及其评分。
 */
public class SequencingPlan {

    private final Map<String, Resource> resourceById = new LinkedHashMap<>();
    private HardSoftScore score;

    public Resource addResource(Resource resource) {
        Resource previous = resourceById.putIfAbsent(resource.getId(), resource);
        if (previous != null) {
            throw new IllegalArgumentException("Duplicate resource id " + resource.getId());
        }
        return resource;
    }

    public Resource getResource(String id) {
        return resourceById.get(id);
    }

    public List<Resource> getResourceList() {
        return new ArrayList<>(resourceById.values());
    }

    public HardSoftScore getScore() {
        return score;
    }

    public void setScore(HardSoftScore score) {
        this.score = score;
    }
}
