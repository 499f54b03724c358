package org.areaflow.engine.reaction;

import org.areaflow.engine.domain.model.AreaEventLog;
import org.areaflow.engine.domain.model.enums.AreaEventType;
import org.areaflow.engine.domain.repository.AreaEventLogRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class LogEventReactionTest {

    @Mock
    private AreaEventLogRepository eventLogRepository;

    @Test
    void shouldRecordTriggeredEvent() {
        LogEventReaction reaction = new LogEventReaction(eventLogRepository,
                Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC));
        UUID areaId = UUID.randomUUID();

        reaction.execute("u1", Map.of("note", "hello"),
                new TriggerEvent(areaId, "spotify_has_likes", "t1", Map.of("SPOTIFY_LIKED_SONG_ID", "t1")));

        ArgumentCaptor<AreaEventLog> saved = ArgumentCaptor.forClass(AreaEventLog.class);
        verify(eventLogRepository).save(saved.capture());
        assertThat(saved.getValue().getEventType()).isEqualTo(AreaEventType.AREA_TRIGGERED);
        assertThat(saved.getValue().getAreaId()).isEqualTo(areaId);
        assertThat(saved.getValue().getSignalId()).isEqualTo("t1");
        assertThat(saved.getValue().getDetails()).containsEntry("action", "spotify_has_likes");
    }
}
