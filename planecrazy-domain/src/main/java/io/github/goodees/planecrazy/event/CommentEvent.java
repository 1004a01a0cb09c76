package io.github.goodees.planecrazy.event;

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

import java.util.Optional;

/**
 * Events of the comment lifecycle. The substream of one comment consists of events sharing its comment id.
 */
public interface CommentEvent extends DomainEvent {
    String getCommentId();

    String getEntityType();

    String getEntityId();

    /**
     * @return user that performed the change
     */
    Optional<String> getUser();

    @Override
    default EntityKey subject() {
        return EntityKey.of(getEntityType(), getEntityId());
    }
}
