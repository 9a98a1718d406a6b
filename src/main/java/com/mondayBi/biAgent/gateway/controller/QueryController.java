package com.mondayBi.biAgent.gateway.controller;

import com.mondayBi.biAgent.board.model.BoardGroup;
import com.mondayBi.biAgent.board.model.BoardSchema;
import com.mondayBi.biAgent.gateway.dto.QueryRequest;
import com.mondayBi.biAgent.gateway.dto.QueryResponse;
import com.mondayBi.biAgent.gateway.service.GatewayService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Gateway REST controller - thin HTTP layer for questions and board lookups.
 */
@RestController
@RequestMapping("/api/v1")
@CrossOrigin(origins = {"http://localhost:5173", "http://localhost:3000"})
@RequiredArgsConstructor
public class QueryController {

    private static final String CLIENT_ID_HEADER = "X-Client-ID";
    private static final String SERVICE_NAME = "monday-bi-agent";

    private final GatewayService gatewayService;

    /**
     * Answers a business question over the boards.
     *
     * @param request        Question and conversation history
     * @param clientIdHeader Optional client id used for rate limiting
     * @return Answer, action trace and data quality report
     */
    @PostMapping("/query")
    public ResponseEntity<QueryResponse> query(
            @Valid @RequestBody QueryRequest request,
            @RequestHeader(value = CLIENT_ID_HEADER, required = false) String clientIdHeader,
            HttpServletRequest httpRequest) {

        QueryResponse response = gatewayService.processQuery(request, clientIdHeader, httpRequest.getRemoteAddr());
        return ResponseEntity.ok(response);
    }

    @GetMapping("/boards/schema")
    public ResponseEntity<BoardSchema> boardSchema(@RequestParam("board") String board) {
        return ResponseEntity.ok(gatewayService.getBoardSchema(board));
    }

    @GetMapping("/boards/groups")
    public ResponseEntity<List<BoardGroup>> boardGroups(@RequestParam("board") String board) {
        return ResponseEntity.ok(gatewayService.getBoardGroups(board));
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, String>> health() {
        Map<String, String> response = new LinkedHashMap<>();
        response.put("status", "ok");
        response.put("service", SERVICE_NAME);
        return ResponseEntity.ok(response);
    }
}
