package db.migration;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import org.flywaydb.core.api.migration.BaseJavaMigration;
import org.flywaydb.core.api.migration.Context;

/**
 * Brings an opportunities table that predates V1 in line with the close-reason pairing. V1 only
 * creates tables that are missing, so a database baselined at version 0 keeps its old rows and
 * lacks the guard constraint; fresh databases get the constraint from V1 and this is a no-op.
 */
public class V2__clear_inconsistent_close_fields extends BaseJavaMigration {
  private static final String CONSTRAINT_NAME = "opportunities_close_reason_only_when_closed";

  @Override
  public void migrate(Context context) throws Exception {
    try (Statement statement = context.getConnection().createStatement()) {
      statement.executeUpdate(
          "UPDATE opportunities "
              + "SET close_reason = NULL, date_closed = NULL "
              + "WHERE stage <> 'Closed' "
              + "AND (close_reason IS NOT NULL OR date_closed IS NOT NULL)");
      statement.executeUpdate(
          "UPDATE opportunities "
              + "SET next_action = NULL, next_action_date = NULL "
              + "WHERE stage = 'Closed' "
              + "AND (next_action IS NOT NULL OR next_action_date IS NOT NULL)");
    }

    if (!constraintExists(context.getConnection())) {
      try (Statement statement = context.getConnection().createStatement()) {
        statement.executeUpdate(
            "ALTER TABLE opportunities "
                + "ADD CONSTRAINT "
                + CONSTRAINT_NAME
                + " "
                + "CHECK (close_reason IS NULL OR stage = 'Closed')");
      }
    }
  }

  private boolean constraintExists(Connection connection) throws SQLException {
    String sql =
        "SELECT 1 FROM information_schema.table_constraints "
            + "WHERE LOWER(table_name) = 'opportunities' "
            + "AND LOWER(constraint_name) = ?";
    try (PreparedStatement ps = connection.prepareStatement(sql)) {
      ps.setString(1, CONSTRAINT_NAME.toLowerCase());
      try (ResultSet rs = ps.executeQuery()) {
        return rs.next();
      }
    }
  }
}
