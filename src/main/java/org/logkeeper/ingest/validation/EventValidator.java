package org.logkeeper.ingest.validation;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.logkeeper.ingest.api.errors.ValidationException;
import org.logkeeper.ingest.api.events.ActionEvent;
import org.logkeeper.ingest.api.events.IngestEvent;
import org.logkeeper.ingest.api.events.MessageEvent;
import org.logkeeper.ingest.utils.JsonPayloads;

import java.util.Map;

/**
 * Checks a single event before it is written. A failure concerns only that event.
 */
public class EventValidator {

    static final int MAX_ID_LENGTH = 64;

    private final int maxContentLength;

    public EventValidator(int maxContentLength) {
        this.maxContentLength = maxContentLength;
    }

    /**
     * @param event The event to check.
     * @throws ValidationException naming the first offending field.
     */
    public void validate(IngestEvent event) throws ValidationException {
        requireText("id", event.id());
        if (event.id().length() > MAX_ID_LENGTH) {
            throw new ValidationException("id", "longer than " + MAX_ID_LENGTH + " characters");
        }
        requireText("scopeId", event.scopeId());
        if (event.occurredAt() == null) {
            throw new ValidationException("occurredAt", "missing");
        }

        if (event instanceof MessageEvent) {
            validateMessage((MessageEvent) event);
        } else if (event instanceof ActionEvent) {
            validateAction((ActionEvent) event);
        } else {
            throw new ValidationException("kind", "unsupported event type " + event.getClass().getSimpleName());
        }
    }

    private void validateMessage(MessageEvent message) throws ValidationException {
        requireText("authorId", message.authorId());
        if (message.content() != null && message.content().length() > maxContentLength) {
            throw new ValidationException("content", "longer than " + maxContentLength + " characters");
        }
        if (message.editedAt() != null && message.editedAt().isBefore(message.occurredAt())) {
            throw new ValidationException("editedAt", "before occurredAt");
        }
        requireSerializable("attributes", message.attributes());
    }

    private void validateAction(ActionEvent action) throws ValidationException {
        if (action.actionType() == null) {
            throw new ValidationException("actionType", "missing");
        }
        requireSerializable("actionData", action.actionData());
        requireSerializable("beforeData", action.beforeData());
        requireSerializable("afterData", action.afterData());
    }

    private static void requireText(String field, String value) throws ValidationException {
        if (value == null || value.isBlank()) {
            throw new ValidationException(field, "missing or blank");
        }
    }

    private static void requireSerializable(String field, Map<String, Object> payload) throws ValidationException {
        try {
            JsonPayloads.toJson(payload);
        } catch (JsonProcessingException e) {
            throw new ValidationException(field, "not serializable to JSON: " + e.getOriginalMessage(), e);
        }
    }
}
