package com.fightsync.domain.model;

public enum AuditLevel {
    INFO,
    WARNING,
    ERROR
}
