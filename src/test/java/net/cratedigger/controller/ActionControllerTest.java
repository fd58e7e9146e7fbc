package net.cratedigger.controller;

import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.Map;
import net.cratedigger.application.review.ActionResult;
import net.cratedigger.application.review.ReviewActionHandler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class ActionControllerTest {

    @Mock
    private ReviewActionHandler actionHandler;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new ActionController(actionHandler)).build();
    }

    @Test
    void should_ReturnOk_When_GroupedActionSucceeds() throws Exception {
        when(actionHandler.handle(eq("review/accept"), eq(Map.of("artist", "Yes", "album", "Fragile"))))
            .thenReturn(new ActionResult.StatusUpdate(true, null));

        mockMvc.perform(post("/api/actions/review/accept").param("artist", "Yes").param("album", "Fragile"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.ok").value(true))
            .andExpect(jsonPath("$.error").doesNotExist());
    }

    @Test
    void should_ReturnBadRequest_When_ActionUnknown() throws Exception {
        when(actionHandler.handle(eq("review/explode"), eq(Map.of())))
            .thenReturn(new ActionResult.Failure("Unknown action: review/explode"));

        mockMvc.perform(post("/api/actions/review/explode"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Unknown action: review/explode"));
    }

    @Test
    void should_DispatchUngroupedAction_When_SingleSegmentPath() throws Exception {
        when(actionHandler.handle(eq("testconnection"), eq(Map.of())))
            .thenReturn(new ActionResult.Connection(true, "openai:test"));

        mockMvc.perform(post("/api/actions/testconnection"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.ok").value(true))
            .andExpect(jsonPath("$.provider").value("openai:test"));
    }
}
