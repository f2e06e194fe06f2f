package com.iimsoft.sequencer.service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import com.iimsoft.sequencer.api.dto.SequenceRequest;
import com.iimsoft.sequencer.api.dto.SequenceResponse;
import com.iimsoft.sequencer.config.SequencerConfig;
import com.iimsoft.sequencer.config.SequencerConfig.InsertMode;
import com.iimsoft.sequencer.domain.Resource;
import com.iimsoft.sequencer.domain.SequencingPlan;
import com.iimsoft.sequencer.domain.Task;
import com.iimsoft.sequencer.domain.solver.ImprovementResult;
import com.iimsoft.sequencer.score.SequenceScoreCalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class SequencingService {

    private static final Logger LOGGER = LoggerFactory.getLogger(SequencingService.class);

    private final SequencerConfig config;
    private final ResourceAssigner resourceAssigner;
    private final Clock clock;
    private final SequenceScoreCalculator scoreCalculator = new SequenceScoreCalculator();

    public SequencingService() {
        this(SequencerConfig.load(), new RequestedResourceAssigner());
    }

    public SequencingService(SequencerConfig config, ResourceAssigner resourceAssigner) {
        this(config, resourceAssigner, Clock.systemUTC());
    }

    /**
     * @param clock time source of the improvement budget
     */
    public SequencingService(SequencerConfig config, ResourceAssigner resourceAssigner, Clock clock) {
        this.config = Objects.requireNonNull(config, "config");
        this.resourceAssigner = Objects.requireNonNull(resourceAssigner, "resourceAssigner");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public SequenceResponse solve(SequenceRequest request) {
        Objects.requireNonNull(request, "request");
        validateRequest(request);
        Options options = resolveOptions(request.options);
        Instant deadline = Instant.now(clock).plus(Duration.ofSeconds(options.timeLimitSeconds));
        LOGGER.info("Sequencing {} tasks on {} resources ({})", request.tasks.size(), request.resources.size(), options);

        // 1) 资源 + 任务上链
        // 分支 merge 后链上是副本节点，所以按 资源 -> task.id 回查请求数据
        Map<String, Map<String, SequenceRequest.TaskDto>> dtoByResource = new HashMap<>();
        SequencingPlan plan = buildPlan(request, options, dtoByResource);

        // 2) 逐资源局部优化；截止时间由这里控制，引擎内部不做超时
        Map<String, Integer> improvementByResource = new HashMap<>();
        boolean complete = true;
        if (options.improve) {
            for (Resource resource : plan.getResourceList()) {
                if (Instant.now(clock).isAfter(deadline)) {
                    LOGGER.warn("Time limit of {}s reached, resource {} is left unimproved",
                            options.timeLimitSeconds, resource.getId());
                    complete = false;
                    continue;
                }
                improvementByResource.put(resource.getId(), improve(resource, options.branchImprove));
            }
        }

        // 3) 评分 + 组装 response
        plan.setScore(scoreCalculator.calculateScore(plan));
        LOGGER.info("Sequencing finished with score {}", plan.getScore());
        return buildResponse(plan, dtoByResource, improvementByResource, complete);
    }

    private static void validateRequest(SequenceRequest request) {
        if (request.resources == null || request.resources.isEmpty()) {
            throw new IllegalArgumentException("request.resources 不能为空");
        }
        Set<String> resourceIds = new HashSet<>();
        for (SequenceRequest.ResourceDto r : request.resources) {
            if (r == null || r.id == null || r.id.isBlank()) {
                throw new IllegalArgumentException("resource.id 不能为空");
            }
            if (!resourceIds.add(r.id)) {
                throw new IllegalArgumentException("resource.id 重复：" + r.id);
            }
        }
        if (request.tasks == null || request.tasks.isEmpty()) {
            throw new IllegalArgumentException("request.tasks 不能为空");
        }
        for (SequenceRequest.TaskDto t : request.tasks) {
            if (t == null || t.id == null || t.id.isBlank()) {
                throw new IllegalArgumentException("task.id 不能为空");
            }
            if (t.duration < 1) {
                throw new IllegalArgumentException("task " + t.id + " 的 duration 必须 ≥ 1，实际为 " + t.duration);
            }
            if (t.target < 0) {
                throw new IllegalArgumentException("task " + t.id + " 的 target 必须 ≥ 0，实际为 " + t.target);
            }
            if (t.minMarginBefore < 0) {
                throw new IllegalArgumentException("task " + t.id + " 的 minMarginBefore 必须 ≥ 0，实际为 " + t.minMarginBefore);
            }
        }
        if (request.options != null && request.options.insertMode != null) {
            parseInsertMode(request.options.insertMode);
        }
    }

    private Options resolveOptions(SequenceRequest.OptionsDto dto) {
        Options options = new Options();
        options.improve = config.isImprove();
        options.branchImprove = config.isBranchImprove();
        options.insertMode = config.getInsertMode();
        options.timeLimitSeconds = config.getTimeLimitSeconds();
        if (dto != null) {
            if (dto.improve != null) options.improve = dto.improve;
            if (dto.branchImprove != null) options.branchImprove = dto.branchImprove;
            if (dto.insertMode != null) options.insertMode = parseInsertMode(dto.insertMode);
            if (dto.timeLimitSeconds != null) options.timeLimitSeconds = dto.timeLimitSeconds;
        }
        if (options.timeLimitSeconds <= 0) {
            options.timeLimitSeconds = 10;
        }
        return options;
    }

    private static InsertMode parseInsertMode(String value) {
        try {
            return InsertMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("options.insertMode 只能是 APPEND 或 BEST，实际为 " + value, e);
        }
    }

    private SequencingPlan buildPlan(SequenceRequest request, Options options,
                                     Map<String, Map<String, SequenceRequest.TaskDto>> dtoByResource) {
        SequencingPlan plan = new SequencingPlan();
        for (SequenceRequest.ResourceDto r : request.resources) {
            plan.addResource(new Resource(r.id, r.name == null ? r.id : r.name));
        }

        for (SequenceRequest.TaskDto dto : request.tasks) {
            String resourceId = resourceAssigner.assign(dto, request.resources);
            Resource resource = plan.getResource(resourceId);
            if (resource == null) {
                throw new IllegalArgumentException("task " + dto.id + " 指向不存在的资源 " + resourceId);
            }
            Map<String, SequenceRequest.TaskDto> dtoById = dtoByResource.computeIfAbsent(resourceId, k -> new HashMap<>());
            if (dtoById.putIfAbsent(dto.id, dto) != null) {
                throw new IllegalArgumentException("资源 " + resourceId + " 上 task.id 重复：" + dto.id);
            }

            Task task = new Task(dto.id, dto.duration, dto.target, dto.minMarginBefore);
            if (options.insertMode == InsertMode.BEST) {
                resource.insertBest(task);
            } else {
                resource.addTail(task);
            }
        }

        for (Resource resource : plan.getResourceList()) {
            LOGGER.debug("Resource {} placed: {} (lateness {})", resource.getId(), resource, resource.score());
        }
        return plan;
    }

    /**
     * @return the improvement that ended up in the committed chain
     */
    private int improve(Resource resource, boolean branch) {
        if (!branch) {
            int improvement = resource.improve();
            LOGGER.info("Resource {}: improvement {}, lateness {}", resource.getId(), improvement, resource.score());
            return improvement;
        }
        int before = resource.score();
        ImprovementResult result = resource.improve(true);
        if (result.getImprovement() < 0 && result.isBranch()) {
            result.getTask().merge();
            LOGGER.info("Resource {}: merged branch, lateness {} -> {}", resource.getId(), before, resource.score());
            return result.getImprovement();
        }
        LOGGER.info("Resource {}: branch brought no improvement, discarded", resource.getId());
        return 0;
    }

    private SequenceResponse buildResponse(SequencingPlan plan,
                                           Map<String, Map<String, SequenceRequest.TaskDto>> dtoByResource,
                                           Map<String, Integer> improvementByResource, boolean complete) {
        SequenceResponse resp = new SequenceResponse();
        resp.score = plan.getScore() == null ? null : plan.getScore().toString();
        resp.complete = complete;

        List<SequenceResponse.TaskResult> tasks = new ArrayList<>();
        List<SequenceResponse.ResourceSummary> summaries = new ArrayList<>();
        for (Resource resource : plan.getResourceList()) {
            Map<String, SequenceRequest.TaskDto> dtoById = dtoByResource.getOrDefault(resource.getId(), Map.of());
            int count = 0;
            for (Task task : resource.iterTasks()) {
                SequenceRequest.TaskDto dto = dtoById.get(task.getId());

                SequenceResponse.TaskResult r = new SequenceResponse.TaskResult();
                r.projectId = dto == null ? null : dto.projectId;
                r.taskId = task.getId();
                r.resourceId = resource.getId();
                r.resourceName = resource.getName();
                r.start = task.getStart();
                r.end = task.getEnd();
                r.lateness = task.getLateness();
                tasks.add(r);
                count++;
            }

            SequenceResponse.ResourceSummary s = new SequenceResponse.ResourceSummary();
            s.resourceId = resource.getId();
            s.name = resource.getName();
            s.taskCount = count;
            s.lateness = resource.score();
            s.improvement = improvementByResource.getOrDefault(resource.getId(), 0);
            s.improved = improvementByResource.containsKey(resource.getId());
            summaries.add(s);
        }
        resp.tasks = tasks;
        resp.resources = summaries;
        return resp;
    }

    private static class Options {
        boolean improve;
        boolean branchImprove;
        InsertMode insertMode;
        int timeLimitSeconds;

        @Override
        public String toString() {
            return "improve=" + improve + ", branchImprove=" + branchImprove + ", insertMode=" + insertMode
                    + ", timeLimitSeconds=" + timeLimitSeconds;
        }
    }
}
