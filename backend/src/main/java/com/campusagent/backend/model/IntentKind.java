package com.campusagent.backend.model;

/**
 * Outcome recorded for an assistant query.
 */
public enum IntentKind {
    SEARCH, // Catalog retrieval was performed
    CASUAL_CHAT, // Answered directly by the classifier
    FAILED // Classification backend was unavailable
}
