package com.iimsoft.sequencer.service;

import java.util.List;

import com.iimsoft.sequencer.api.dto.SequenceRequest;

/**
 * Decides which resource runs a task. The portfolio-wide assignment model lives outside this
 * module; it plugs in here.
 */
public interface ResourceAssigner {

    /**
     * @return id of one of {@code resources}
     * @throws IllegalArgumentException when no resource can be chosen
     */
    String assign(SequenceRequest.TaskDto task, List<SequenceRequest.ResourceDto> resources);
}
