package com.chapterbus.stage;

public enum StageStatus {
    SUCCESS,
    PARTIAL,
    FAILURE
}
