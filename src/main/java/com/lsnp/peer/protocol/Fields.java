package com.lsnp.peer.protocol;

/**
 * Well-known header keys.
 */
public final class Fields {

    private Fields() {}

    public static final String TYPE = "TYPE";
    public static final String MESSAGE_ID = "MESSAGE_ID";
    public static final String TOKEN = "TOKEN";
    public static final String TIMESTAMP = "TIMESTAMP";
    public static final String STATUS = "STATUS";

    // Identity
    public static final String USER_ID = "USER_ID";
    public static final String FROM = "FROM";
    public static final String TO = "TO";
    public static final String DISPLAY_NAME = "DISPLAY_NAME";

    // Social
    public static final String CONTENT = "CONTENT";
    public static final String ACTION = "ACTION";
    public static final String GROUP_ID = "GROUP_ID";

    // Game
    public static final String GAME_ID = "GAMEID";
    public static final String SYMBOL = "SYMBOL";
    public static final String POSITION = "POSITION";
    public static final String TURN = "TURN";
    public static final String RESULT = "RESULT";
    public static final String WINNING_LINE = "WINNING_LINE";

    // File transfer
    public static final String FILE_ID = "FILEID";
    public static final String FILENAME = "FILENAME";
    public static final String FILESIZE = "FILESIZE";
    public static final String FILETYPE = "FILETYPE";
    public static final String DESCRIPTION = "DESCRIPTION";
    public static final String TOTAL_CHUNKS = "TOTAL_CHUNKS";
    public static final String CHUNK_SIZE = "CHUNK_SIZE";
    public static final String CHUNK_INDEX = "CHUNK_INDEX";
    public static final String DATA = "DATA";
}
