package io.github.goodees.planecrazy.projection;

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

import io.github.goodees.planecrazy.core.Event;
import io.github.goodees.planecrazy.core.matching.TypeSwitch;
import io.github.goodees.planecrazy.core.projection.AbstractProjection;
import io.github.goodees.planecrazy.core.store.EventLog;
import io.github.goodees.planecrazy.event.CommentAddedEvent;
import io.github.goodees.planecrazy.event.CommentDeletedEvent;
import io.github.goodees.planecrazy.event.CommentEditedEvent;
import io.github.goodees.planecrazy.event.CommentEvent;
import io.github.goodees.planecrazy.event.EntityKey;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static java.util.stream.Collectors.toList;

/**
 * Comments per entity. Deleted comments are kept, marked as deleted, and excluded from active comment queries.
 * Comments are listed in order of creation, comments created at the same instant in order they were added.
 */
public class CommentProjection extends AbstractProjection {
    public static final String NAME = "Comments";

    private static final Comparator<CommentView> BY_CREATION = Comparator.comparing(CommentView::getCreatedAt);

    // insertion order is the tie-break of equal creation times
    private final Map<String, CommentView> comments = new LinkedHashMap<>();

    private final TypeSwitch fold = TypeSwitch.builder()
            .on(CommentAddedEvent.class, this::added)
            .on(CommentEditedEvent.class, this::edited)
            .on(CommentDeletedEvent.class, this::deleted)
            .build();

    public CommentProjection(EventLog log) {
        super(NAME, log);
    }

    @Override
    protected boolean handle(Event event) {
        return fold.executeMatching(event);
    }

    private void added(CommentAddedEvent event) {
        if (comments.containsKey(event.getCommentId())) {
            logger.debug("Comment {} is already known, ignoring repeated {}", event.getCommentId(), event.getType());
            return;
        }
        comments.put(event.getCommentId(), new CommentView.Builder()
                .id(event.getCommentId())
                .entityType(event.getEntityType())
                .entityId(event.getEntityId())
                .text(event.getText())
                .createdBy(event.getUser())
                .createdAt(event.getOccurredAt())
                .deleted(false)
                .build());
    }

    private void edited(CommentEditedEvent event) {
        CommentView existing = comments.get(event.getCommentId());
        if (existing == null) {
            logger.debug("Edit of unknown comment {} ignored", event.getCommentId());
            return;
        }
        comments.put(event.getCommentId(), new CommentView.Builder().from(existing)
                .text(event.getText())
                .updatedBy(event.getUser())
                .updatedAt(event.getOccurredAt())
                .build());
    }

    private void deleted(CommentDeletedEvent event) {
        CommentView existing = comments.get(event.getCommentId());
        if (existing == null) {
            logger.debug("Delete of unknown comment {} ignored", event.getCommentId());
            return;
        }
        comments.put(event.getCommentId(), new CommentView.Builder().from(existing)
                .deleted(true)
                .deletedBy(event.getUser())
                .deletedAt(event.getOccurredAt())
                .deleteReason(event.getReason())
                .build());
    }

    @Override
    protected void clear() {
        comments.clear();
    }

    @Override
    protected void clearEntity(String entityType, String entityId) {
        comments.values().removeIf(c -> c.getEntityType().equals(entityType) && c.getEntityId().equals(entityId));
    }

    @Override
    protected boolean concerns(Event event, String entityType, String entityId) {
        return event instanceof CommentEvent && ((CommentEvent) event).subject().is(entityType, entityId);
    }

    /**
     * Active comments of an entity.
     * @param entityType type of entity
     * @param entityId id of entity
     * @return comments that are not deleted, oldest first
     */
    public List<CommentView> getActiveComments(String entityType, String entityId) {
        return query(() -> commentsOf(entityType, entityId, false));
    }

    /**
     * All comments of an entity, deleted ones included.
     * @param entityType type of entity
     * @param entityId id of entity
     * @return comments, oldest first
     */
    public List<CommentView> getComments(String entityType, String entityId) {
        return query(() -> commentsOf(entityType, entityId, true));
    }

    /**
     * Find comment, deleted or not.
     * @param commentId id of the comment
     * @return the comment
     */
    public Optional<CommentView> getCommentById(String commentId) {
        return query(() -> Optional.ofNullable(comments.get(commentId)));
    }

    public int getActiveCommentCount(String entityType, String entityId) {
        return query(() -> commentsOf(entityType, entityId, false).size());
    }

    /**
     * Entities having active comments, most commented first.
     * @return map from entity to count of its active comments, in iteration order
     */
    public Map<EntityKey, Integer> getEntitiesWithComments() {
        return query(() -> {
            Map<EntityKey, Integer> counts = new LinkedHashMap<>();
            for (CommentView comment : comments.values()) {
                if (!comment.isDeleted()) {
                    counts.merge(EntityKey.of(comment.getEntityType(), comment.getEntityId()), 1, Integer::sum);
                }
            }
            List<Map.Entry<EntityKey, Integer>> entries = new ArrayList<>(counts.entrySet());
            entries.sort(Map.Entry.<EntityKey, Integer>comparingByValue().reversed()
                    .thenComparing(e -> e.getKey().getType())
                    .thenComparing(e -> e.getKey().getId()));
            Map<EntityKey, Integer> result = new LinkedHashMap<>();
            for (Map.Entry<EntityKey, Integer> entry : entries) {
                result.put(entry.getKey(), entry.getValue());
            }
            return result;
        });
    }

    private List<CommentView> commentsOf(String entityType, String entityId, boolean includeDeleted) {
        return comments.values().stream()
                .filter(c -> c.getEntityType().equals(entityType) && c.getEntityId().equals(entityId))
                .filter(c -> includeDeleted || !c.isDeleted())
                .sorted(BY_CREATION)
                .collect(toList());
    }
}
