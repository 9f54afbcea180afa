package com.ergrace.interfaces.rest;

import com.ergrace.support.Harness;
import com.jayway.jsonpath.JsonPath;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class RestApiTest {
  @Autowired MockMvc mvc;

  private ResultActions postJson(String path, String body) throws Exception {
    return mvc.perform(post(path).contentType(MediaType.APPLICATION_JSON).content(body));
  }

  private String createLobby(String creator, int max) throws Exception {
    String body =
        postJson(
                "/api/lobby",
                "{\"creatorId\":\"" + creator + "\",\"raceDistance\":500,\"entryFee\":\"0.5\","
                    + "\"payoutMode\":\"top_three\",\"maxParticipants\":" + max
                    + ",\"minParticipants\":2}")
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.status").value("waiting"))
            .andExpect(jsonPath("$.payoutMode").value("top_three"))
            .andReturn()
            .getResponse()
            .getContentAsString();
    return JsonPath.read(body, "$.id");
  }

  @Test
  void lobbyToRace_overRest() throws Exception {
    String lobby = createLobby("alice", 2);

    postJson("/api/lobby/" + lobby + "/join",
            "{\"id\":\"alice\",\"displayName\":\"Alice\",\"equipmentType\":\"bike\"}")
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.participantCount").value(1))
        .andExpect(jsonPath("$.participants[0].status").value("deposited"))
        .andExpect(jsonPath("$.participants[0].equipmentType").value("bike"))
        .andExpect(jsonPath("$.participants[0].isBot").value(false));
    postJson("/api/lobby/" + lobby + "/bot", "{\"difficulty\":\"elite\"}")
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.participants[1].isBot").value(true))
        .andExpect(jsonPath("$.participants[1].botDifficulty").value("elite"))
        .andExpect(jsonPath("$.participants[1].status").value("ready"));
    postJson("/api/lobby/" + lobby + "/ready", "{\"participantId\":\"alice\"}")
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.participants[0].status").value("ready"));

    String race =
        mvc.perform(post("/api/lobby/" + lobby + "/start"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("pending"))
            .andExpect(jsonPath("$.targetDistance").value(500))
            .andReturn()
            .getResponse()
            .getContentAsString();
    String raceId = JsonPath.read(race, "$.id");

    mvc.perform(get("/api/race/" + raceId))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.lobbyId").value(lobby));
    mvc.perform(get("/api/lobby/" + lobby))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("in_progress"))
        .andExpect(jsonPath("$.raceId").value(raceId));
    mvc.perform(post("/api/lobby/" + lobby + "/start")).andExpect(status().isConflict());

    Harness.await(() -> "racing".equals(raceStatus(raceId)));
    postJson("/api/race/" + raceId + "/update",
            "{\"participantId\":\"alice\",\"distance\":520,\"pace\":110,\"watts\":240}")
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("racing"))
        .andExpect(jsonPath("$.participants[0].isFinished").value(true))
        .andExpect(jsonPath("$.participants[0].position").value(1))
        .andExpect(jsonPath("$.participants[0].distance").value(500.0));
  }

  private String raceStatus(String raceId) {
    try {
      String body =
          mvc.perform(get("/api/race/" + raceId)).andReturn().getResponse().getContentAsString();
      return JsonPath.read(body, "$.status");
    } catch (Exception e) {
      throw new IllegalStateException(e);
    }
  }

  @Test
  void lobbies_filteredByUser() throws Exception {
    String mine = createLobby("lobby-owner-1", 4);
    createLobby("lobby-owner-2", 4);

    mvc.perform(get("/api/lobbies").param("userId", "lobby-owner-1"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.length()").value(1))
        .andExpect(jsonPath("$[0].id").value(mine));
  }

  @Test
  void unknownIds_are404() throws Exception {
    mvc.perform(get("/api/lobby/nope"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.type").value("error"))
        .andExpect(jsonPath("$.reason").value("not_found"))
        .andExpect(jsonPath("$.message").value("Lobby not found"));
    mvc.perform(get("/api/race/nope")).andExpect(status().isNotFound());
    mvc.perform(get("/api/users/u1/profile")).andExpect(status().isNotFound());
  }

  @Test
  void fullLobby_is409() throws Exception {
    String lobby = createLobby("carol", 2);
    postJson("/api/lobby/" + lobby + "/bot", "{}").andExpect(status().isOk());
    postJson("/api/lobby/" + lobby + "/bot", "{}").andExpect(status().isOk());

    postJson("/api/lobby/" + lobby + "/join", "{\"id\":\"dan\",\"displayName\":\"Dan\"}")
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.reason").value("conflict"))
        .andExpect(jsonPath("$.message").value("Lobby full"));
  }

  @Test
  void cancel_byCreatorOnly() throws Exception {
    String lobby = createLobby("erin", 4);

    mvc.perform(post("/api/lobby/" + lobby + "/cancel").param("requesterId", "frank"))
        .andExpect(status().isConflict());
    mvc.perform(post("/api/lobby/" + lobby + "/cancel").param("requesterId", "erin"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("cancelled"));
    mvc.perform(post("/api/lobby/" + lobby + "/cancel")).andExpect(status().isBadRequest());
  }

  @Test
  void malformedRequests_are400() throws Exception {
    postJson("/api/lobby", "{\"creatorId\":\"a\",\"raceDistance\":0}")
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.reason").value("invalid"));
    postJson("/api/lobby", "{\"creatorId\":\"a\",\"raceDistance\":500,\"entryFee\":\"ten\"}")
        .andExpect(status().isBadRequest());
    postJson("/api/lobby", "{not json").andExpect(status().isBadRequest());
    postJson("/api/race/r1/update",
            "{\"participantId\":\"a\",\"distance\":10,\"pace\":700,\"watts\":100}")
        .andExpect(status().isBadRequest());
    postJson("/api/race/r1/update",
            "{\"participantId\":\"a\",\"distance\":10,\"pace\":100,\"watts\":2500}")
        .andExpect(status().isBadRequest());
    mvc.perform(put("/api/users/u1/profile").contentType(MediaType.APPLICATION_JSON)
            .content("{\"email\":\"not-an-email\"}"))
        .andExpect(status().isBadRequest());
  }

  @Test
  void statusAndConfig() throws Exception {
    mvc.perform(get("/"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("running"));
    mvc.perform(get("/config"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.countdownFrom").value(5))
        .andExpect(jsonPath("$.maxWatts").value(2000));
  }
}
