package botupdates.jdbc;

import java.util.Objects;

/**
 * Default table names and table name validation shared by the JDBC stores.
 */
public final class TableNames {
  public static final String BOT = "bot";
  public static final String CURSOR = "bot_update_cursor";
  public static final String CHAT = "bot_chat";
  public static final String CHAT_MEMBER = "bot_chat_member";

  private static final String TABLE_NAME_PATTERN = "[a-zA-Z_][a-zA-Z0-9_]*";

  private TableNames() {}

  public static String validate(String tableName) {
    Objects.requireNonNull(tableName, "tableName");
    if (!tableName.matches(TABLE_NAME_PATTERN)) {
      throw new IllegalArgumentException("Invalid table name: " + tableName);
    }
    return tableName;
  }
}
