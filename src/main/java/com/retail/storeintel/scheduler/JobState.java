package com.retail.storeintel.scheduler;

public enum JobState {
    IDLE,
    RUNNING
}
