package io.feedloom.model;

public enum TaskKind {
    INSIGHT,
    TRANSLATION,
    DIGEST,
    INGEST
}
