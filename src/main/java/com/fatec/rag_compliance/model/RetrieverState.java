package com.fatec.rag_compliance.model;

public enum RetrieverState {
    UNINITIALIZED,
    INITIALIZING,
    READY
}
