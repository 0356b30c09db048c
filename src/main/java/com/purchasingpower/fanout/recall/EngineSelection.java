package com.purchasingpower.fanout.recall;

/**
 * Which engines a round should dispatch to.
 */
public enum EngineSelection {

    /** First-layer engines only. */
    PRIMARY,

    /** Every routed and configured engine. */
    ALL
}
