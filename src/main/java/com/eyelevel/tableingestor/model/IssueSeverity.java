package com.eyelevel.tableingestor.model;

public enum IssueSeverity {
    WARNING,
    ERROR
}
