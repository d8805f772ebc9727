package co.fanki.flowengine.layout.application;

import co.fanki.flowengine.layout.domain.LayoutOptions;
import co.fanki.flowengine.layout.domain.TidyOptions;
import co.fanki.flowengine.shared.DomainException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;

import static org.hamcrest.Matchers.hasSize;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Web layer tests for {@link LayoutController}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class LayoutControllerTest {

    private static final String NODES = """
            "nodes": [
              {"id": "s", "type": "start", "position": {"x": 0, "y": 0},
               "data": {}},
              {"id": "e", "type": "end", "position": {"x": 0, "y": 0},
               "data": {}}
            ]
            """;

    private LayoutService layoutService;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        layoutService = mock(LayoutService.class);
        mockMvc = MockMvcBuilders.standaloneSetup(
                new LayoutController(layoutService)).build();
    }

    @Test
    void whenArranging_givenNodesAndEdges_shouldReturnPositionedNodes()
            throws Exception {
        final LayoutService real = new LayoutService(
                LayoutOptions.defaults(), TidyOptions.defaults());
        mockMvc = MockMvcBuilders.standaloneSetup(
                new LayoutController(real)).build();

        mockMvc.perform(post("/api/layout/full")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{" + NODES + ", \"edges\": [{\"id\": \"x\","
                                + " \"source\": \"s\", \"target\": \"e\"}]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.nodes", hasSize(2)))
                .andExpect(jsonPath("$.nodes[1].id").value("e"))
                .andExpect(jsonPath("$.nodes[1].position.x").value(400.0));
    }

    @Test
    void whenTidying_givenPiledNodes_shouldPassOverridesAlong()
            throws Exception {
        when(layoutService.tidy(anyList(), eq("TB"), eq(40.0)))
                .thenReturn(List.of());

        mockMvc.perform(post("/api/layout/tidy")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{" + NODES + ", \"direction\": \"TB\","
                                + " \"gridSize\": 40}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.nodes", hasSize(0)));
    }

    @Test
    void whenArranging_givenInvalidOverride_shouldReturnBadRequest()
            throws Exception {
        when(layoutService.arrange(anyList(), anyList(), eq("diagonal"),
                isNull(), isNull()))
                .thenThrow(new DomainException("Unknown layout direction:"
                        + " diagonal", DomainException.INVALID_LAYOUT));

        mockMvc.perform(post("/api/layout/full")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{" + NODES + ", \"direction\":"
                                + " \"diagonal\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("INVALID_LAYOUT"));
    }

    @Test
    void whenTidying_givenNodesThatAreNotAnArray_shouldReturnBadRequest()
            throws Exception {
        mockMvc.perform(post("/api/layout/tidy")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"nodes\": {\"id\": \"s\"}}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode")
                        .value("INVALID_FLOW_JSON"));
    }
}
