package com.vitals.analytics.consumer;

/** STOPPED -> RUNNING -> STOPPING -> STOPPED. */
public enum ConsumerState {
    STOPPED,
    RUNNING,
    STOPPING
}
