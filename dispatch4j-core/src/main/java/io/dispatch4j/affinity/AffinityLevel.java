package io.dispatch4j.affinity;

/**
 * How strongly a job must stick to the robot holding its prior state.
 */
public enum AffinityLevel {
    /** Any robot. */
    NONE,
    /** Prefer a robot with state, fall back to any robot. */
    SOFT,
    /** Only a robot with state; queue while none is available. */
    HARD,
    /** The whole workflow chain stays on the robot its session is pinned to. */
    SESSION
}
