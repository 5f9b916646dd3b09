package com.purchasingpower.codegraph.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.codegraph.exception.GraphStoreUnavailableException;
import com.purchasingpower.codegraph.model.graph.NodeKind;
import com.purchasingpower.codegraph.model.retrieval.RetrievedNode;
import com.purchasingpower.codegraph.model.retrieval.SearchType;
import com.purchasingpower.codegraph.retrieval.RetrievalService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Web layer tests for SearchController; retrieval itself is mocked.
 */
@WebMvcTest(SearchController.class)
class SearchControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private RetrievalService retrievalService;

    @Test
    void search_returnsResultsWithWireNames() throws Exception {
        // Given
        RetrievedNode foo = RetrievedNode.builder()
            .type(NodeKind.FUNCTION)
            .name("foo")
            .summary("Returns foo")
            .code("def foo(): ...")
            .lineno(3)
            .score(1.0)
            .searchType(SearchType.HYBRID)
            .build();
        when(retrievalService.retrieveTopK("foo", 5, "demo")).thenReturn(List.of(foo));

        SearchRequest request = SearchRequest.builder().query("foo").repository("demo").build();

        // When / Then
        mockMvc.perform(post("/api/v1/search")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request)))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.success").value(true))
            .andExpect(jsonPath("$.results[0].type").value("FunctionNode"))
            .andExpect(jsonPath("$.results[0].name").value("foo"))
            .andExpect(jsonPath("$.results[0].search_type").value("hybrid"))
            .andExpect(jsonPath("$.results[0].score").value(1.0))
            .andExpect(jsonPath("$.results[0].relation").doesNotExist());
    }

    @Test
    void search_semanticOnlyWhenMultiStrategyDisabled() throws Exception {
        when(retrievalService.retrieveSemantic("parse yaml", 3, null)).thenReturn(List.of());

        SearchRequest request = SearchRequest.builder().query("parse yaml").k(3).multiStrategy(false).build();

        mockMvc.perform(post("/api/v1/search")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request)))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.results").isEmpty());

        verify(retrievalService).retrieveSemantic("parse yaml", 3, null);
    }

    @Test
    void search_blankQueryIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/v1/search")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"query\": \"  \"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.success").value(false))
            .andExpect(jsonPath("$.error").value("Query is required"));

        verifyNoInteractions(retrievalService);
    }

    @Test
    void search_nonPositiveKIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/v1/search")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"query\": \"foo\", \"k\": 0}"))
            .andExpect(status().isBadRequest());
    }

    @Test
    void search_storeUnavailableIs503() throws Exception {
        when(retrievalService.retrieveTopK(anyString(), anyInt(), any()))
            .thenThrow(new GraphStoreUnavailableException("Neo4j is unavailable", null));

        mockMvc.perform(post("/api/v1/search")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"query\": \"foo\"}"))
            .andExpect(status().isServiceUnavailable())
            .andExpect(jsonPath("$.success").value(false));
    }
}
