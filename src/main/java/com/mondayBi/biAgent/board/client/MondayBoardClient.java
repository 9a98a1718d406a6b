package com.mondayBi.biAgent.board.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mondayBi.biAgent.board.exception.BoardDataException;
import com.mondayBi.biAgent.board.model.BoardColumn;
import com.mondayBi.biAgent.board.model.BoardGroup;
import com.mondayBi.biAgent.board.model.BoardSchema;
import com.mondayBi.biAgent.board.model.ItemGroup;
import com.mondayBi.biAgent.board.model.RawItem;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Client for the monday.com GraphQL API.
 *
 * Every call makes a fresh request; nothing is cached between calls.
 */
@Slf4j
@Service
public class MondayBoardClient implements BoardDataService {

    private static final String ITEM_FIELDS = """
                id
                name
                group {
                    id
                    title
                }
                column_values {
                    id
                    column {
                        title
                    }
                    text
                    value
                }
            """;

    private static final String SCHEMA_QUERY = """
            query ($boardId: [ID!]!) {
                boards(ids: $boardId) {
                    name
                    columns {
                        id
                        title
                        type
                    }
                }
            }
            """;

    private static final String GROUPS_QUERY = """
            query ($boardId: [ID!]!) {
                boards(ids: $boardId) {
                    groups {
                        id
                        title
                        color
                    }
                }
            }
            """;

    private final ObjectMapper objectMapper;
    private RestClient restClient;

    @Value("${monday.api.url:https://api.monday.com/v2}")
    private String apiUrl;

    @Value("${monday.api.token:}")
    private String apiToken;

    @Value("${monday.api.version:2024-10}")
    private String apiVersion;

    @Value("${monday.api.page-size:500}")
    private int pageSize;

    public MondayBoardClient(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Gets or initializes the RestClient instance.
     */
    private RestClient getRestClient() {
        if (restClient == null) {
            this.restClient = RestClient.builder()
                    .baseUrl(apiUrl)
                    .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                    .defaultHeader("API-Version", apiVersion)
                    .build();
        }
        return restClient;
    }

    @Override
    public BoardSchema getBoardSchema(String boardId) {
        log.info("Fetching board schema - boardId: {}", boardId);
        JsonNode board = firstBoard(execute(SCHEMA_QUERY, Map.of("boardId", List.of(boardId))), boardId);

        List<BoardColumn> columns = new ArrayList<>();
        for (JsonNode column : board.path("columns")) {
            columns.add(BoardColumn.builder()
                    .id(column.path("id").asText())
                    .title(column.path("title").asText())
                    .type(column.path("type").asText())
                    .build());
        }
        return BoardSchema.builder()
                .boardName(board.path("name").asText())
                .columns(columns)
                .build();
    }

    /**
     * Fetches every item of a board, following the items_page cursor until it runs out.
     */
    @Override
    public List<RawItem> getAllItems(String boardId) {
        String firstPageQuery = """
                query ($boardId: [ID!]!) {
                    boards(ids: $boardId) {
                        items_page(limit: %d) {
                            cursor
                            items {
                %s
                            }
                        }
                    }
                }
                """.formatted(pageSize, ITEM_FIELDS);
        String nextPageQuery = """
                query ($cursor: String!) {
                    next_items_page(cursor: $cursor, limit: %d) {
                        cursor
                        items {
                %s
                        }
                    }
                }
                """.formatted(pageSize, ITEM_FIELDS);

        List<JsonNode> collected = new ArrayList<>();
        JsonNode page = firstBoard(execute(firstPageQuery, Map.of("boardId", List.of(boardId))), boardId)
                .path("items_page");
        String cursor = collectPage(page, collected);
        int pages = 1;

        while (cursor != null) {
            page = execute(nextPageQuery, Map.of("cursor", cursor)).path("next_items_page");
            cursor = collectPage(page, collected);
            pages++;
        }

        log.info("Fetched board items - boardId: {}, items: {}, pages: {}", boardId, collected.size(), pages);
        return collected.stream().map(MondayBoardClient::toRawItem).toList();
    }

    @Override
    public List<BoardGroup> getBoardGroups(String boardId) {
        JsonNode board = firstBoard(execute(GROUPS_QUERY, Map.of("boardId", List.of(boardId))), boardId);
        List<BoardGroup> groups = new ArrayList<>();
        for (JsonNode group : board.path("groups")) {
            groups.add(BoardGroup.builder()
                    .id(group.path("id").asText())
                    .title(group.path("title").asText())
                    .color(group.path("color").asText(null))
                    .build());
        }
        return groups;
    }

    /**
     * Maps a monday.com item node to a raw item: column title (or column id when the
     * title is missing) to display text, with empty text as null.
     */
    static RawItem toRawItem(JsonNode item) {
        Map<String, String> columns = new LinkedHashMap<>();
        for (JsonNode columnValue : item.path("column_values")) {
            JsonNode titleNode = columnValue.path("column").path("title");
            String title = titleNode.isTextual() ? titleNode.asText() : columnValue.path("id").asText("unknown");
            JsonNode textNode = columnValue.path("text");
            String text = textNode.isTextual() ? textNode.asText() : null;
            columns.put(title, text == null || text.isEmpty() ? null : text);
        }

        JsonNode group = item.path("group");
        return RawItem.builder()
                .id(item.path("id").asText(null))
                .name(item.path("name").asText(null))
                .group(ItemGroup.builder()
                        .id(group.path("id").asText(""))
                        .title(group.path("title").asText(""))
                        .build())
                .columns(columns)
                .build();
    }

    private static String collectPage(JsonNode page, List<JsonNode> collected) {
        page.path("items").forEach(collected::add);
        JsonNode cursor = page.path("cursor");
        return cursor.isTextual() && !cursor.asText().isBlank() ? cursor.asText() : null;
    }

    private static JsonNode firstBoard(JsonNode data, String boardId) {
        JsonNode boards = data.path("boards");
        if (!boards.isArray() || boards.isEmpty()) {
            throw new BoardDataException("Board with ID " + boardId + " not found");
        }
        return boards.get(0);
    }

    /**
     * Executes a GraphQL query and returns its {@code data} node.
     */
    private JsonNode execute(String query, Map<String, Object> variables) {
        if (apiToken == null || apiToken.isBlank()) {
            throw new IllegalStateException("monday.com API token is not configured. Set monday.api.token in application.yaml");
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("query", query);
        payload.put("variables", variables);

        JsonNode response;
        try {
            String body = getRestClient().post()
                    .header(HttpHeaders.AUTHORIZATION, apiToken)
                    .body(payload)
                    .retrieve()
                    .body(String.class);
            response = objectMapper.readTree(body == null ? "{}" : body);
        } catch (RestClientException e) {
            log.error("monday.com API request failed", e);
            throw new BoardDataException("monday.com API request failed: " + e.getMessage(), e);
        } catch (Exception e) {
            log.error("monday.com API returned an unreadable response", e);
            throw new BoardDataException("monday.com API returned an unreadable response: " + e.getMessage(), e);
        }

        JsonNode errors = response.path("errors");
        if (errors.isArray() && !errors.isEmpty()) {
            List<String> messages = new ArrayList<>();
            errors.forEach(error -> messages.add(error.path("message").asText(error.toString())));
            log.error("monday.com API errors: {}", messages);
            throw new BoardDataException("monday.com API errors: " + String.join("; ", messages));
        }
        return response.path("data");
    }
}
