package com.mondayBi.biAgent.board.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mondayBi.biAgent.board.model.RawItem;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class MondayBoardClientTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    public void shouldMapColumnTitlesToDisplayText() throws Exception {
        String item = """
                {
                  "id": "987",
                  "name": "Solar Farm",
                  "group": {"id": "topics", "title": "Active Deals"},
                  "column_values": [
                    {"id": "numbers", "column": {"title": "Masked Deal value"}, "text": "1.2Cr", "value": "\\"1.2Cr\\""},
                    {"id": "status", "column": {"title": "Deal Status"}, "text": "", "value": null},
                    {"id": "date4", "column": null, "text": "2026-02-27", "value": null},
                    {"id": "people", "column": {"title": "Owner"}, "text": null, "value": null}
                  ]
                }
                """;

        RawItem raw = MondayBoardClient.toRawItem(objectMapper.readTree(item));

        assertEquals("987", raw.getId());
        assertEquals("Solar Farm", raw.getName());
        assertEquals("topics", raw.getGroup().getId());
        assertEquals("Active Deals", raw.getGroup().getTitle());
        assertEquals("1.2Cr", raw.getColumns().get("Masked Deal value"));
        assertTrue(raw.getColumns().containsKey("Deal Status"));
        assertNull(raw.getColumns().get("Deal Status"));
        assertEquals("2026-02-27", raw.getColumns().get("date4"));
        assertNull(raw.getColumns().get("Owner"));
        assertEquals(4, raw.getColumns().size());
    }

    @Test
    public void shouldDefaultMissingGroupToEmpty() throws Exception {
        RawItem raw = MondayBoardClient.toRawItem(objectMapper.readTree("{\"id\": \"1\", \"name\": \"Bare\"}"));

        assertEquals("", raw.getGroup().getId());
        assertEquals("", raw.getGroup().getTitle());
        assertTrue(raw.getColumns().isEmpty());
    }

    @Test
    public void shouldRefuseToCallWithoutToken() {
        MondayBoardClient client = new MondayBoardClient(objectMapper);

        assertThrows(IllegalStateException.class, () -> client.getBoardSchema("1001"));
    }
}
