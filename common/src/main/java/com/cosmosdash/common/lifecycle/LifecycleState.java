package com.cosmosdash.common.lifecycle;

/**
 * Lifecycle shared by workers and the scheduler. Transitions only move
 * forward: IDLE, RUNNING, STOPPING, STOPPED. IDLE may jump straight to STOPPED.
 */
public enum LifecycleState {
    IDLE,
    RUNNING,
    STOPPING,
    STOPPED
}
