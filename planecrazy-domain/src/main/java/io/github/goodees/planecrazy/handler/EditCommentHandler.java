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

import io.github.goodees.planecrazy.aggregate.CommentAggregate;
import io.github.goodees.planecrazy.command.EditCommentCommand;
import io.github.goodees.planecrazy.core.dispatch.EventDispatcher;
import io.github.goodees.planecrazy.core.store.EventLog;
import io.github.goodees.planecrazy.projection.CommentProjection;

public class EditCommentHandler extends CommentCommandHandler<EditCommentCommand> {

    public EditCommentHandler(EventLog log, EventDispatcher dispatcher, CommentProjection projection) {
        super(log, dispatcher, projection);
    }

    @Override
    protected void execute(CommentAggregate aggregate, EditCommentCommand command) {
        aggregate.edit(command.getText(), command.effectiveUser());
    }
}
