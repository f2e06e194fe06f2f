package com.iimsoft.sequencer.api.dto;

import java.util.List;

public class SequenceRequest {

    public List<ResourceDto> resources;
    public List<TaskDto> tasks;

    /** 可选：覆盖 sequencer-config.json 中的默认值 */
    public OptionsDto options;

    public static class ResourceDto {
        public String id;
        public String name;
    }

    public static class TaskDto {
        public String projectId;
        public String id;
        /** 为空时交给 ResourceAssigner 决定 */
        public String resourceId;
        public int duration;          // 天，≥ 1
        public int target;            // 期望开工日
        public int minMarginBefore;   // 与前一任务结束之间的最小间隔
    }

    public static class OptionsDto {
        public Boolean improve;
        public Boolean branchImprove;
        public String insertMode;     // APPEND/BEST
        public Integer timeLimitSeconds;
    }
}
