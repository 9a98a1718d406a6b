package com.mondayBi.biAgent.gateway.service;

import com.mondayBi.biAgent.board.client.BoardDataService;
import com.mondayBi.biAgent.board.model.BoardGroup;
import com.mondayBi.biAgent.board.model.BoardSchema;
import com.mondayBi.biAgent.board.model.BoardTag;
import com.mondayBi.biAgent.config.BoardProperties;
import com.mondayBi.biAgent.gateway.dto.QueryRequest;
import com.mondayBi.biAgent.gateway.dto.QueryResponse;
import com.mondayBi.biAgent.gateway.exception.InvalidBoardException;
import com.mondayBi.biAgent.gateway.exception.RateLimitExceededException;
import com.mondayBi.biAgent.gateway.util.ClientIdMasker;
import com.mondayBi.biAgent.orchestrator.service.OrchestratorService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Gateway service - handles all business logic for the gateway.
 *
 * Responsibilities:
 * - Resolve the client id used for rate limiting
 * - Generate correlationId
 * - Enforce rate limiting
 * - Forward questions to the orchestrator and board lookups to the board data service
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GatewayService {

    private static final String ANONYMOUS_CLIENT = "anonymous";

    private final CorrelationIdService correlationIdService;
    private final RateLimiter rateLimiter;
    private final OrchestratorService orchestratorService;
    private final BoardDataService boardDataService;
    private final BoardProperties boardProperties;

    /**
     * Processes a question through the gateway.
     *
     * @param request        Question with the caller's conversation history
     * @param clientIdHeader Client id from the X-Client-ID header, may be null
     * @param remoteAddress  Remote address, used when no client id header is sent
     * @return Answer with action trace and data quality report
     * @throws RateLimitExceededException if the client exceeded its per-minute limit
     */
    public QueryResponse processQuery(QueryRequest request, String clientIdHeader, String remoteAddress) {
        String clientId = resolveClientId(clientIdHeader, remoteAddress);
        String correlationId = correlationIdService.generateCorrelationId();

        if (!rateLimiter.isAllowed(clientId)) {
            log.warn("Rate limit exceeded for clientId: {} (correlationId: {})",
                    ClientIdMasker.mask(clientId), correlationId);
            throw new RateLimitExceededException("Rate limit exceeded. Please try again later.");
        }

        log.info("Query received - correlationId: {}, clientId: {}, message length: {}, history turns: {}",
                correlationId, ClientIdMasker.mask(clientId), request.getMessage().length(),
                request.getHistory() != null ? request.getHistory().size() : 0);

        return orchestratorService.orchestrate(request.getMessage().trim(), request.getHistory(), correlationId);
    }

    /**
     * Live schema of a configured board.
     *
     * @param board Board tag, "deals" or "workorders"
     * @throws InvalidBoardException if the tag is unknown
     */
    public BoardSchema getBoardSchema(String board) {
        return boardDataService.getBoardSchema(boardId(board));
    }

    public List<BoardGroup> getBoardGroups(String board) {
        return boardDataService.getBoardGroups(boardId(board));
    }

    private String boardId(String board) {
        BoardTag tag = BoardTag.fromTag(board)
                .orElseThrow(() -> new InvalidBoardException("Board must be 'deals' or 'workorders'"));
        return boardProperties.get(tag).getId();
    }

    private static String resolveClientId(String clientIdHeader, String remoteAddress) {
        if (clientIdHeader != null && !clientIdHeader.isBlank()) {
            return clientIdHeader.trim();
        }
        return remoteAddress != null && !remoteAddress.isBlank() ? remoteAddress : ANONYMOUS_CLIENT;
    }
}
