package com.mondayBi.biAgent.gateway.controller;

import com.mondayBi.biAgent.board.exception.BoardDataException;
import com.mondayBi.biAgent.board.model.BoardColumn;
import com.mondayBi.biAgent.board.model.BoardSchema;
import com.mondayBi.biAgent.cleaning.model.QualityReport;
import com.mondayBi.biAgent.gateway.dto.QueryRequest;
import com.mondayBi.biAgent.gateway.dto.QueryResponse;
import com.mondayBi.biAgent.gateway.exception.InvalidBoardException;
import com.mondayBi.biAgent.gateway.exception.RateLimitExceededException;
import com.mondayBi.biAgent.gateway.service.GatewayService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

public class QueryControllerTest {

    private GatewayService gatewayService;
    private MockMvc mockMvc;

    @BeforeEach
    public void setUp() {
        this.gatewayService = mock(GatewayService.class);
        this.mockMvc = MockMvcBuilders.standaloneSetup(new QueryController(gatewayService))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    public void shouldReturnAnswerTraceAndQualityReport() throws Exception {
        QualityReport report = QualityReport.builder().totalItems(3).unparseableNumbers(1).build();
        QueryResponse response = QueryResponse.builder()
                .answer("Pipeline is 1.7Cr")
                .actionTrace(List.of("Fetching board schemas from Monday.com...", "Response generated successfully"))
                .dataQualityReport(report)
                .build();
        when(gatewayService.processQuery(any(), eq("client-1"), anyString())).thenReturn(response);

        mockMvc.perform(post("/api/v1/query")
                        .header("X-Client-ID", "client-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"message\": \"Pipeline?\", \"history\": [{\"role\": \"user\", \"content\": \"Hi\"}]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.answer").value("Pipeline is 1.7Cr"))
                .andExpect(jsonPath("$.action_trace[1]").value("Response generated successfully"))
                .andExpect(jsonPath("$.data_quality_report.total_items").value(3))
                .andExpect(jsonPath("$.data_quality_report.unparseable_numbers").value(1));

        ArgumentCaptor<QueryRequest> request = ArgumentCaptor.forClass(QueryRequest.class);
        verify(gatewayService).processQuery(request.capture(), eq("client-1"), anyString());
        assertEquals("Pipeline?", request.getValue().getMessage());
        assertEquals("Hi", request.getValue().getHistory().get(0).getContent());
    }

    @Test
    public void shouldRejectBlankMessage() throws Exception {
        mockMvc.perform(post("/api/v1/query")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"message\": \"  \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));

        verifyNoInteractions(gatewayService);
    }

    @Test
    public void shouldMapRateLimitTo429() throws Exception {
        when(gatewayService.processQuery(any(), any(), any()))
                .thenThrow(new RateLimitExceededException("Rate limit exceeded. Please try again later."));

        mockMvc.perform(post("/api/v1/query")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"message\": \"Pipeline?\"}"))
                .andExpect(status().isTooManyRequests())
                .andExpect(jsonPath("$.code").value("RATE_LIMIT_EXCEEDED"));
    }

    @Test
    public void shouldReturnBoardSchema() throws Exception {
        when(gatewayService.getBoardSchema("deals")).thenReturn(BoardSchema.builder()
                .boardName("Deals")
                .columns(List.of(new BoardColumn("numbers", "Masked Deal value", "numbers")))
                .build());

        mockMvc.perform(get("/api/v1/boards/schema").param("board", "deals"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.board_name").value("Deals"))
                .andExpect(jsonPath("$.columns[0].title").value("Masked Deal value"));
    }

    @Test
    public void shouldMapBoardErrors() throws Exception {
        when(gatewayService.getBoardSchema("invoices")).thenThrow(new InvalidBoardException("Board must be 'deals' or 'workorders'"));
        when(gatewayService.getBoardSchema("deals")).thenThrow(new BoardDataException("monday.com API request failed"));

        mockMvc.perform(get("/api/v1/boards/schema").param("board", "invoices"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_BOARD"));
        mockMvc.perform(get("/api/v1/boards/schema").param("board", "deals"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.code").value("BOARD_SERVICE_ERROR"));
    }

    @Test
    public void shouldReportHealth() throws Exception {
        mockMvc.perform(get("/api/v1/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ok"))
                .andExpect(jsonPath("$.service").value("monday-bi-agent"));
    }
}
