package com.fatec.rag_compliance.service.retrieval;

public enum RetrievalSignal {
    LEXICAL,
    DENSE
}
