package com.purchasingpower.fanout.routing;

/**
 * Engine tiers produced by routing. L1 engines are the first choice for an operator,
 * L3 engines are specialist sources worth trying when recall matters more than cost.
 *
 * @since 1.0.0
 */
public enum EngineLayer {
    L1,
    L2,
    L3
}
