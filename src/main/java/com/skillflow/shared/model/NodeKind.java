package com.skillflow.shared.model;

public enum NodeKind {
    SKILL,
    START,
    END
}
