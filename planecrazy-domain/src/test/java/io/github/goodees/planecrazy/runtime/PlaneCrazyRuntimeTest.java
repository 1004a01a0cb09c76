package io.github.goodees.planecrazy.runtime;

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
import io.github.goodees.planecrazy.command.FavouriteAircraftCommand;
import io.github.goodees.planecrazy.core.command.CommandResult;
import io.github.goodees.planecrazy.core.store.EventStoreException;
import io.github.goodees.planecrazy.tracking.AircraftObservation;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.TimeUnit;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class PlaneCrazyRuntimeTest {
    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private PlaneCrazyConfiguration configuration(Path directory) {
        return PlaneCrazyConfiguration.builder()
                .eventDirectory(directory)
                .commandThreads(2)
                .commandTimeoutMs(5000)
                .build();
    }

    @Test
    public void state_survives_restart() throws Exception {
        Path directory = folder.newFolder("events").toPath();
        String commentId;
        try (PlaneCrazyRuntime runtime = new PlaneCrazyRuntime(configuration(directory)).start()) {
            AddCommentCommand add = AddCommentCommand.builder().entityType("Aircraft").entityId("4CA7B5")
                    .text("Seen over Dublin").build();
            commentId = add.getCommentId();
            CommandResult added = runtime.submit(add).get(5, TimeUnit.SECONDS);
            CommandResult favourited = runtime.submit(FavouriteAircraftCommand.builder().icao24("4CA7B5").build())
                    .get(5, TimeUnit.SECONDS);
            assertTrue(added.isAccepted());
            assertTrue(favourited.isAccepted());
            runtime.getTrackingRecorder().record(AircraftObservation.builder().icao24("4CA7B5")
                    .latitude(53.4).longitude(-6.2).build());
        }

        try (PlaneCrazyRuntime restarted = new PlaneCrazyRuntime(configuration(directory)).start()) {
            assertEquals("Seen over Dublin", restarted.getComments().getCommentById(commentId).get().getText());
            assertTrue(restarted.getFavourites().isFavourited("Aircraft", "4CA7B5"));
            assertEquals(1, restarted.getAircraft().count());
        }
    }

    @Test
    public void corrupt_record_does_not_prevent_start() throws Exception {
        Path directory = folder.newFolder("events").toPath();
        try (PlaneCrazyRuntime runtime = new PlaneCrazyRuntime(configuration(directory)).start()) {
            runtime.submit(FavouriteAircraftCommand.builder().icao24("ABCDEF").build()).get(5, TimeUnit.SECONDS);
        }
        Files.write(directory.resolve("99999999999999999-9999999999-truncated.json"),
                "{\"eventType\":\"AircraftFavourited\",\"payloadVersion\":1,\"data\":{\"icao".getBytes(
                        StandardCharsets.UTF_8));

        try (PlaneCrazyRuntime restarted = new PlaneCrazyRuntime(configuration(directory)).start()) {
            assertTrue(restarted.getFavourites().isFavourited("Aircraft", "ABCDEF"));
            assertEquals(1, restarted.getDiagnostics().getSkippedRecords().size());
            assertEquals("99999999999999999-9999999999-truncated.json",
                    restarted.getDiagnostics().getSkippedRecords().get(0).getRecord());
        }
    }

    @Test(expected = EventStoreException.class)
    public void strict_runtime_refuses_corrupt_log() throws Exception {
        Path directory = folder.newFolder("events").toPath();
        Files.write(directory.resolve("00000000000000000-0000000001-broken.json"),
                "garbage".getBytes(StandardCharsets.UTF_8));
        PlaneCrazyConfiguration strict = PlaneCrazyConfiguration.builder().eventDirectory(directory)
                .strictReads(true).build();
        try (PlaneCrazyRuntime runtime = new PlaneCrazyRuntime(strict)) {
            runtime.start();
        }
    }
}
