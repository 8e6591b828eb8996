package org.persoftware.seta.engine;

/**
 * Termination bounds of the symbolic engines.
 *
 * @param maxSimplifyPasses   rebuild passes before the simplifier stops looking for a fixed point
 * @param maxIntegrationSteps rule applications one integral may spend before it is given up
 * @param maxIntegrationDepth nesting of recursive integrals before a branch is given up
 * @param maxByPartsDepth     nested integrations by parts allowed within one integral
 */
public record EngineConfig(
    int maxSimplifyPasses,
    int maxIntegrationSteps,
    int maxIntegrationDepth,
    int maxByPartsDepth
) {
    public static final EngineConfig DEFAULT = new EngineConfig(
        8,
        2_000,
        16,
        1
    );

    public EngineConfig {
        if (maxSimplifyPasses < 1 || maxIntegrationSteps < 1 || maxIntegrationDepth < 1 || maxByPartsDepth < 0) {
            throw new IllegalArgumentException("Engine limits must be positive (by-parts depth may be zero)");
        }
    }
}
