package com.iimsoft.sequencer.api.dto;

import java.util.List;

public class SequenceResponse {

    /** HardSoftScore：hard = 校验违规数，soft = 迟期之和 */
    public String score;

    /** false 表示时间预算用完，部分资源未做优化 */
    public boolean complete;

    /** 每个任务的排序结果（按资源、链顺序） */
    public List<TaskResult> tasks;

    public List<ResourceSummary> resources;

    public static class TaskResult {
        public String projectId;
        public String taskId;
        public String resourceId;
        public String resourceName;

        public int start;
        public int end;
        public int lateness;
    }

    public static class ResourceSummary {
        public String resourceId;
        public String name;
        public int taskCount;
        public int lateness;
        public int improvement;
        public boolean improved;
    }
}
