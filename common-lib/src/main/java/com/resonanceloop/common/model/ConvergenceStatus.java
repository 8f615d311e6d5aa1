package com.resonanceloop.common.model;

public enum ConvergenceStatus {
    SUCCESS,
    FAILURE,
    ERROR
}
