package com.sdkforge.core.model;

/**
 * Difficulty tiers used to group usage examples.
 */
public enum Difficulty {
    /** Learning the basics */
    BEGINNER,

    /** Combining calls */
    INTERMEDIATE,

    /** Complex patterns */
    ADVANCED
}
