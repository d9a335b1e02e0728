package com.controlplane.core.model;

public enum NodeRole {
    MASTER,
    WORKER
}
