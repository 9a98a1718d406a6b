package com.mondayBi.biAgent.board.client;

import com.mondayBi.biAgent.board.model.BoardGroup;
import com.mondayBi.biAgent.board.model.BoardSchema;
import com.mondayBi.biAgent.board.model.RawItem;

import java.util.List;

/**
 * Source of board schemas and items. Results are complete: any pagination is
 * resolved by the implementation.
 */
public interface BoardDataService {

    /**
     * @param boardId Board id
     * @return Board name and columns
     * @throws com.mondayBi.biAgent.board.exception.BoardDataException if the board cannot be read
     */
    BoardSchema getBoardSchema(String boardId);

    /**
     * @param boardId Board id
     * @return Every item of the board
     * @throws com.mondayBi.biAgent.board.exception.BoardDataException if the board cannot be read
     */
    List<RawItem> getAllItems(String boardId);

    /**
     * @param boardId Board id
     * @return Groups of the board
     * @throws com.mondayBi.biAgent.board.exception.BoardDataException if the board cannot be read
     */
    List<BoardGroup> getBoardGroups(String boardId);
}
