package com.processsentinel.core.alert.rule;

import com.processsentinel.core.alert.AlertRequest;
import com.processsentinel.core.model.AnalysisResult;
import com.processsentinel.core.model.Sample;

import java.util.Optional;

/**
 * A per-process alert condition evaluated after each analysis.
 *
 * <p>
 * Rules are stateless. Deduplication is handled by the engine through the
 * cooldown key carried on the returned request.
 * </p>
 *
 * @since 1.0.0
 */
public interface ProcessAlertRule {

    /**
     * @param sample   the sample just analyzed
     * @param analysis its analysis result; may be {@code null}
     * @return an alert request if the condition holds
     */
    Optional<AlertRequest> evaluate(Sample sample, AnalysisResult analysis);

    String getName();

    /** @return deduplication key for {@code processId} under this rule */
    static String cooldownKey(String processId, String kind) {
        return cooldownPrefix(processId) + kind;
    }

    /** @return prefix shared by every cooldown key of {@code processId} */
    static String cooldownPrefix(String processId) {
        return "process:" + processId + ":";
    }
}
