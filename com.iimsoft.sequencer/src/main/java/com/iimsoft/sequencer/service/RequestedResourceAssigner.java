package com.iimsoft.sequencer.service;

import java.util.List;

import com.iimsoft.sequencer.api.dto.SequenceRequest;

/**
 * 使用请求里指定的资源；未指定且只有一个资源时使用该资源。
 */
public class RequestedResourceAssigner implements ResourceAssigner {

    @Override
    public String assign(SequenceRequest.TaskDto task, List<SequenceRequest.ResourceDto> resources) {
        if (task.resourceId != null && !task.resourceId.isBlank()) {
            return task.resourceId.trim();
        }
        if (resources.size() == 1) {
            return resources.get(0).id;
        }
        throw new IllegalArgumentException("task " + task.id + " 未指定 resourceId，且存在多个资源");
    }
}
