package com.example.strategicpawns.controller;

import com.example.strategicpawns.model.domain.GameStatus;
import com.example.strategicpawns.service.GameService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class GameControllerTest {

    @Mock
    private GameService gameService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        mockMvc = MockMvcBuilders.standaloneSetup(new GameController(gameService)).build();
    }

    @Test
    void testStatusOfLiveGame() throws Exception {
        when(gameService.getGameStatus("ABCD1234")).thenReturn(new GameStatus(true, true, false));

        mockMvc.perform(get("/api/game/ABCD1234/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.exists").value(true))
                .andExpect(jsonPath("$.scheduledForCleanup").value(false));
    }

    @Test
    void testUnknownGameIsNotFound() throws Exception {
        when(gameService.getGameStatus("NOPE0000")).thenReturn(GameStatus.missing());

        mockMvc.perform(get("/api/game/NOPE0000/status"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.exists").value(false));
    }
}
