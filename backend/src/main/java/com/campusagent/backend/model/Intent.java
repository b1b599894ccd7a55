package com.campusagent.backend.model;

/**
 * Classified purpose of a user query.
 * Produced once per request and never re-derived downstream.
 */
public sealed interface Intent permits Intent.Search, Intent.CasualChat {

    /**
     * Text the classifier wants shown to the user.
     */
    String message();

    IntentKind kind();

    record Search(String searchPhrase, String draftMessage) implements Intent {

        public Search {
            searchPhrase = searchPhrase != null ? searchPhrase : "";
            draftMessage = draftMessage != null ? draftMessage : "";
        }

        @Override
        public String message() {
            return draftMessage;
        }

        @Override
        public IntentKind kind() {
            return IntentKind.SEARCH;
        }
    }

    record CasualChat(String message) implements Intent {

        public CasualChat {
            message = message != null ? message : "";
        }

        @Override
        public IntentKind kind() {
            return IntentKind.CASUAL_CHAT;
        }
    }
}
