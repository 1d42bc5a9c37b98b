package com.trelloreport.weekly.exception;

/**
 * A list required by the report does not exist on the board.
 */
public class ListNotFoundException extends RuntimeException {

    private final String boardId;
    private final String listName;

    public ListNotFoundException(String boardId, String listName) {
        super("List \"" + listName + "\" not found on board " + boardId);
        this.boardId = boardId;
        this.listName = listName;
    }

    public String getBoardId() {
        return boardId;
    }

    public String getListName() {
        return listName;
    }
}
