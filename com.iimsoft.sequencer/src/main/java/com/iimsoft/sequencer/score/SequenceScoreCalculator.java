package com.iimsoft.sequencer.score;

import java.util.List;

import com.iimsoft.sequencer.domain.Resource;
import com.iimsoft.sequencer.domain.SequencingPlan;
import org.optaplanner.core.api.score.buildin.hardsoft.HardSoftScore;
import org.optaplanner.core.api.score.calculator.EasyScoreCalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 全部资源的评分：
 * - hard：链校验发现的违规数（正常应为 0）
 * - soft：所有任务正迟期之和
 */
public class SequenceScoreCalculator implements EasyScoreCalculator<SequencingPlan, HardSoftScore> {

    private static final Logger LOGGER = LoggerFactory.getLogger(SequenceScoreCalculator.class);

    @Override
    public HardSoftScore calculateScore(SequencingPlan plan) {
        int hardScore = 0;
        int softScore = 0;
        for (Resource resource : plan.getResourceList()) {
            List<ChainValidator.Violation> violations = ChainValidator.validate(resource);
            if (!violations.isEmpty()) {
                LOGGER.warn("Resource {} has {} violations: {}", resource.getId(), violations.size(), violations);
            }
            hardScore -= violations.size();
            softScore -= resource.score();
        }
        return HardSoftScore.of(hardScore, softScore);
    }
}
