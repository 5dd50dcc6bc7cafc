package com.buildsync.pipeline;

import com.buildsync.reconcile.api.BuildProjectWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;

/**
 * Generates code for a persisted prompt-UDF rule: examples first, then code generation,
 * each followed by the settle delay.
 */
public final class PromptUdfCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(PromptUdfCodeGenerator.class);

    private final Sleeper sleeper;
    private final Duration settleDelay;

    public PromptUdfCodeGenerator(Sleeper sleeper, Duration settleDelay) {
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.settleDelay = Objects.requireNonNull(settleDelay, "settleDelay");
    }

    public void generate(BuildProjectWriter target, String projectId, String ruleId) {
        log.info("Generating prompt UDF code project={} rule={}", projectId, ruleId);
        target.triggerExamples(projectId, ruleId);
        sleeper.sleep(settleDelay);
        target.triggerCodeGeneration(projectId, ruleId);
        sleeper.sleep(settleDelay);
    }
}
