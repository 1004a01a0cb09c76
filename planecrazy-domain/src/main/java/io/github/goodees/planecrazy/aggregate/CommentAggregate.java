package io.github.goodees.planecrazy.aggregate;

/*-
 * #%L
 * planecrazy
 * %%
 * Copyright (C) 2017 Patrik Duditš
 * %%
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * 
 *      http://www.apache.org/licenses/LICENSE-2.0
 * 
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * #L%
 */

import io.github.goodees.planecrazy.core.aggregate.AggregateRoot;
import io.github.goodees.planecrazy.core.matching.TypeSwitch;
import io.github.goodees.planecrazy.event.CommentAddedEvent;
import io.github.goodees.planecrazy.event.CommentDeletedEvent;
import io.github.goodees.planecrazy.event.CommentEditedEvent;
import io.github.goodees.planecrazy.event.CommentEvent;

import java.time.Instant;
import java.util.function.Predicate;

/**
 * A comment on an entity. It is created once, may be edited while active, and deleted once. Deleted comment stays
 * in history and cannot be changed anymore.
 */
public class CommentAggregate extends AggregateRoot<CommentEvent> {

    public enum State {
        NON_EXISTENT, ACTIVE, DELETED
    }

    private State state = State.NON_EXISTENT;
    private String entityType;
    private String entityId;
    private String text;
    private Instant createdAt;
    private Instant updatedAt;

    private final TypeSwitch transitions = TypeSwitch.builder()
            .on(CommentAddedEvent.class, this::added)
            .on(CommentEditedEvent.class, this::edited)
            .on(CommentDeletedEvent.class, this::deleted)
            .build();

    public CommentAggregate(String commentId) {
        super(commentId);
    }

    /**
     * Selection of the events of single comment.
     * @param commentId id of the comment
     * @return predicate matching its substream
     */
    public static Predicate<CommentEvent> streamOf(String commentId) {
        return e -> commentId.equals(e.getCommentId());
    }

    public void add(String entityType, String entityId, String text, String user) {
        if (state != State.NON_EXISTENT) {
            throw invalidState("Comment already exists.");
        }
        raise(CommentAddedEvent.builder()
                .commentId(getId())
                .entityType(entityType)
                .entityId(entityId)
                .text(text)
                .user(user)
                .build());
    }

    public void edit(String newText, String user) {
        if (state == State.NON_EXISTENT) {
            throw invalidState("Comment does not exist.");
        }
        if (state == State.DELETED) {
            throw invalidState("Cannot edit a deleted comment.");
        }
        raise(CommentEditedEvent.builder()
                .commentId(getId())
                .entityType(entityType)
                .entityId(entityId)
                .text(newText)
                .previousText(text)
                .user(user)
                .build());
    }

    public void delete(String reason, String user) {
        if (state == State.NON_EXISTENT) {
            throw invalidState("Comment does not exist.");
        }
        if (state == State.DELETED) {
            throw invalidState("Comment is already deleted.");
        }
        raise(CommentDeletedEvent.builder()
                .commentId(getId())
                .entityType(entityType)
                .entityId(entityId)
                .reason(reason)
                .user(user)
                .build());
    }

    @Override
    protected void updateState(CommentEvent event) {
        if (!transitions.executeMatching(event)) {
            logger.debug("Comment {} ignores event of type {}", getId(), event.getType());
        }
    }

    private void added(CommentAddedEvent event) {
        state = State.ACTIVE;
        entityType = event.getEntityType();
        entityId = event.getEntityId();
        text = event.getText();
        createdAt = event.getOccurredAt();
    }

    private void edited(CommentEditedEvent event) {
        text = event.getText();
        updatedAt = event.getOccurredAt();
    }

    private void deleted(CommentDeletedEvent event) {
        state = State.DELETED;
        updatedAt = event.getOccurredAt();
    }

    public State getState() {
        return state;
    }

    public boolean isDeleted() {
        return state == State.DELETED;
    }

    public String getEntityType() {
        return entityType;
    }

    public String getEntityId() {
        return entityId;
    }

    public String getText() {
        return text;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }
}
