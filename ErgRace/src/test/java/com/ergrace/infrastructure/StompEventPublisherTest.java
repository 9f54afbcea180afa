package com.ergrace.infrastructure;

import com.ergrace.domain.BotDifficulty;
import com.ergrace.domain.CoordinatorEvent.Countdown;
import com.ergrace.domain.CoordinatorEvent.LobbyList;
import com.ergrace.domain.CoordinatorEvent.RaceUpdate;
import com.ergrace.domain.EquipmentType;
import com.ergrace.domain.RaceParticipantSnapshot;
import com.ergrace.domain.RaceSnapshot;
import com.ergrace.domain.RaceStatus;
import com.ergrace.dto.CountdownMessage;
import com.ergrace.dto.LobbyListMessage;
import com.fasterxml.jackson.databind.json.JsonMapper;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.messaging.Message;
import org.springframework.messaging.converter.MappingJackson2MessageConverter;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.messaging.simp.SimpMessagingTemplate;

import static org.junit.jupiter.api.Assertions.*;

class StompEventPublisherTest {

  @Test
  void send_addressesTheSessionsEventQueue() {
    List<Message<?>> sent = new ArrayList<>();
    SimpMessagingTemplate template =
        new SimpMessagingTemplate((message, timeout) -> sent.add(message));
    MappingJackson2MessageConverter converter = new MappingJackson2MessageConverter();
    converter.setObjectMapper(JsonMapper.builder().findAndAddModules().build());
    template.setMessageConverter(converter);

    RaceSnapshot race =
        new RaceSnapshot("r1", "l1", RaceStatus.RACING, Instant.EPOCH, 500,
            List.of(new RaceParticipantSnapshot("bot-1", "RoboRower (easy)", "", EquipmentType.SKI,
                true, BotDifficulty.EASY, 120.5, 150, 120, false, null, null)),
            0);
    new StompEventPublisher(template).send("sess-1", new RaceUpdate(race));

    assertEquals(1, sent.size());
    Message<?> m = sent.get(0);
    assertEquals("/user/sess-1/queue/events", SimpMessageHeaderAccessor.getDestination(m.getHeaders()));
    assertEquals("sess-1", SimpMessageHeaderAccessor.getSessionId(m.getHeaders()));

    String json = new String((byte[]) m.getPayload(), StandardCharsets.UTF_8);
    assertTrue(json.contains("\"type\":\"race_update\""), json);
    assertTrue(json.contains("\"status\":\"racing\""), json);
    assertTrue(json.contains("\"isBot\":true"), json);
    assertTrue(json.contains("\"isFinished\":false"), json);
    assertTrue(json.contains("\"equipmentType\":\"ski\""), json);
    assertTrue(json.contains("\"botDifficulty\":\"easy\""), json);
  }

  @Test
  void toMessage_mapsEveryEventToItsWireType() {
    CountdownMessage c =
        (CountdownMessage) StompEventPublisher.toMessage(new Countdown("l1", "r1", 3));
    LobbyListMessage l = (LobbyListMessage) StompEventPublisher.toMessage(new LobbyList(List.of()));

    assertEquals(new CountdownMessage("countdown", "l1", "r1", 3), c);
    assertEquals("lobby_list", l.type());
    assertTrue(l.lobbies().isEmpty());
  }
}
