package io.github.goodees.planecrazy.handler;

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

import io.github.goodees.planecrazy.command.AddCommentCommand;
import io.github.goodees.planecrazy.command.DeleteCommentCommand;
import io.github.goodees.planecrazy.command.EditCommentCommand;
import io.github.goodees.planecrazy.core.Event;
import io.github.goodees.planecrazy.core.command.CommandResult;
import io.github.goodees.planecrazy.core.dispatch.EventDispatcher;
import io.github.goodees.planecrazy.core.store.EventLog;
import io.github.goodees.planecrazy.core.store.EventStoreException;
import io.github.goodees.planecrazy.core.store.file.FileSystemEventStore;
import io.github.goodees.planecrazy.event.CommentAddedEvent;
import io.github.goodees.planecrazy.event.CommentEditedEvent;
import io.github.goodees.planecrazy.event.DomainEvents;
import io.github.goodees.planecrazy.event.EntityKey;
import io.github.goodees.planecrazy.projection.CommentProjection;
import io.github.goodees.planecrazy.projection.CommentView;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.IOException;
import java.util.List;

import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.instanceOf;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.assertTrue;

public class CommentCommandHandlerTest {
    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private FileSystemEventStore store;
    private CommentProjection comments;
    private AddCommentHandler add;
    private EditCommentHandler edit;
    private DeleteCommentHandler delete;

    @Before
    public void setUp() throws IOException {
        store = new FileSystemEventStore(folder.newFolder("events").toPath(), DomainEvents.serialization());
        comments = new CommentProjection(store);
        EventDispatcher dispatcher = new EventDispatcher(store).register(comments);
        add = new AddCommentHandler(store, dispatcher, comments);
        edit = new EditCommentHandler(store, dispatcher, comments);
        delete = new DeleteCommentHandler(store, dispatcher, comments);
    }

    private List<Event> events() throws EventStoreException {
        try (EventLog.StoredEvents<Event> events = store.readAll()) {
            return events.toList();
        }
    }

    private AddCommentCommand addComment(String text) {
        return AddCommentCommand.builder()
                .entityType("Aircraft")
                .entityId("ABC123")
                .text(text)
                .user("spotter")
                .build();
    }

    @Test
    public void added_comment_is_stored_and_active() throws EventStoreException {
        CommandResult result = add.handle(addComment("Nice livery"));

        assertTrue(result.isAccepted());
        List<Event> events = events();
        assertThat(events, hasSize(1));
        assertThat(events.get(0), instanceOf(CommentAddedEvent.class));
        List<CommentView> active = comments.getActiveComments("Aircraft", "ABC123");
        assertThat(active, hasSize(1));
        assertEquals("Nice livery", active.get(0).getText());
        assertEquals("spotter", active.get(0).getCreatedBy().get());
        assertEquals(1, comments.getActiveCommentCount("Aircraft", "ABC123"));
    }

    @Test
    public void deleted_comment_keeps_its_last_text() throws EventStoreException {
        AddCommentCommand added = addComment("Original");
        add.handle(added);
        String id = added.getCommentId();

        assertTrue(edit.handle(EditCommentCommand.builder().commentId(id).text("Updated").build()).isAccepted());
        assertTrue(delete.handle(DeleteCommentCommand.builder().commentId(id).reason("Duplicate").build())
                .isAccepted());

        assertThat(comments.getActiveComments("Aircraft", "ABC123"), empty());
        CommentView view = comments.getCommentById(id).get();
        assertEquals("Updated", view.getText());
        assertTrue(view.isDeleted());
        assertEquals("Duplicate", view.getDeleteReason().get());
        assertThat(comments.getComments("Aircraft", "ABC123"), hasSize(1));
        assertThat(events(), hasSize(3));
    }

    @Test
    public void edit_records_previous_text() throws EventStoreException {
        AddCommentCommand added = addComment("Original");
        add.handle(added);

        CommandResult result = edit.handle(EditCommentCommand.builder()
                .commentId(added.getCommentId()).text("Second").issuedBy("editor").build());

        CommentEditedEvent edited = (CommentEditedEvent) result.getEvents().get(0);
        assertEquals("Original", edited.getPreviousText().get());
        assertEquals("editor", edited.getUser().get());
        assertEquals("editor", comments.getCommentById(added.getCommentId()).get().getUpdatedBy().get());
    }

    @Test
    public void invalid_comment_is_not_stored() throws EventStoreException {
        CommandResult result = add.handle(AddCommentCommand.builder()
                .entityType("Ship")
                .entityId("")
                .text("  ")
                .build());

        assertEquals(CommandResult.Status.INVALID, result.getStatus());
        assertThat(result.getMessages(), contains(
                "Entity type must be one of: Aircraft, Type, Airport (found 'Ship')",
                "EntityId cannot be empty",
                "Comment text cannot be empty"));
        assertThat(events(), empty());
    }

    @Test
    public void edit_of_missing_comment_is_rejected() throws EventStoreException {
        CommandResult result = edit.handle(EditCommentCommand.builder().commentId("missing").text("x").build());

        assertEquals(CommandResult.Status.REJECTED, result.getStatus());
        assertEquals("Comment does not exist.", result.getMessage());
        assertThat(events(), empty());
    }

    @Test
    public void deleted_comment_cannot_be_edited_or_deleted_again() throws EventStoreException {
        AddCommentCommand added = addComment("Original");
        add.handle(added);
        delete.handle(DeleteCommentCommand.builder().commentId(added.getCommentId()).build());

        CommandResult editResult = edit.handle(EditCommentCommand.builder()
                .commentId(added.getCommentId()).text("Too late").build());
        CommandResult deleteResult = delete.handle(DeleteCommentCommand.builder()
                .commentId(added.getCommentId()).build());

        assertEquals("Cannot edit a deleted comment.", editResult.getMessage());
        assertEquals("Comment is already deleted.", deleteResult.getMessage());
        assertThat(events(), hasSize(2));
    }

    @Test
    public void comment_id_cannot_be_reused() throws EventStoreException {
        AddCommentCommand added = addComment("First");
        add.handle(added);

        CommandResult again = add.handle(AddCommentCommand.builder().from(added).text("Second").build());

        assertEquals(CommandResult.Status.REJECTED, again.getStatus());
        assertEquals("Comment already exists.", again.getMessage());
    }

    @Test
    public void entity_type_is_stored_in_canonical_form() throws EventStoreException {
        add.handle(AddCommentCommand.builder().entityType("airport").entityId("EGLL").text("Busy").build());

        assertThat(comments.getActiveComments("Airport", "EGLL"), hasSize(1));
        assertFalse(comments.getEntitiesWithComments().isEmpty());
    }

    @Test
    public void entity_code_is_stored_upper_case() throws EventStoreException {
        add.handle(AddCommentCommand.builder().entityType("Aircraft").entityId(" abc123 ").text("Low pass").build());
        add.handle(AddCommentCommand.builder().entityType("aircraft").entityId("ABC123").text("Again").build());

        assertThat(comments.getActiveComments("Aircraft", "ABC123"), hasSize(2));
        assertEquals(Integer.valueOf(2), comments.getEntitiesWithComments().get(EntityKey.of("Aircraft", "ABC123")));
        assertEquals(1, comments.getEntitiesWithComments().size());
    }
}
