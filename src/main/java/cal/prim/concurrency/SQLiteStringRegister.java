package cal.prim.concurrency;

import cal.prim.PreconditionFailed;
import org.checkerframework.checker.calledmethods.qual.EnsuresCalledMethods;
import org.checkerframework.checker.mustcall.qual.Owning;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Objects;

/**
 * A <code>StringRegister</code> implementation atop a SQLite database in a local file.
 *
 * <p>One database file can hold any number of registers; each is a row keyed by the
 * register's name.  Every instance opens its own connection, so separate processes on the
 * same machine can share registers through the file.  SQLite serializes the writers; a
 * busy database is waited on for up to {@link #BUSY_TIMEOUT_MILLIS}.
 */
public class SQLiteStringRegister implements StringRegister, Closeable {

  static final int BUSY_TIMEOUT_MILLIS = 30_000;

  @Owning
  private final Connection conn;
  private final Path filename;
  private final String registerName;

  public SQLiteStringRegister(Path filename, String registerName) throws IOException {
    Objects.requireNonNull(registerName, "register name may not be null");
    Path parent = filename.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }

    Connection conn;
    try {
      conn = DriverManager.getConnection("jdbc:sqlite:" + filename.toAbsolutePath());
    } catch (SQLException e) {
      throw new IOException(e);
    }
    try {
      conn.setAutoCommit(true);
      try (Statement stmt = conn.createStatement()) {
        stmt.executeUpdate("PRAGMA busy_timeout = " + BUSY_TIMEOUT_MILLIS);
        stmt.executeUpdate("CREATE TABLE IF NOT EXISTS registers (name TEXT PRIMARY KEY, value TEXT NOT NULL) WITHOUT ROWID");
      }
      try (PreparedStatement stmt = conn.prepareStatement("INSERT OR IGNORE INTO registers (name, value) VALUES (?, '')")) {
        stmt.setString(1, registerName);
        stmt.executeUpdate();
      }
    } catch (SQLException e) {
      try {
        conn.close();
      } catch (SQLException onClose) {
        e.addSuppressed(onClose);
      }
      throw new IOException(e);
    }

    this.conn = conn;
    this.filename = filename;
    this.registerName = registerName;
  }

  @Override
  public synchronized String read() throws IOException {
    try (PreparedStatement stmt = conn.prepareStatement("SELECT value FROM registers WHERE name=? LIMIT 1")) {
      stmt.setString(1, registerName);
      try (ResultSet rs = stmt.executeQuery()) {
        if (rs.next()) {
          String result = rs.getString(1);
          if (result != null) {
            return result;
          }
        }
      }
    } catch (SQLException e) {
      throw new IOException(e);
    }
    return "";
  }

  @Override
  public synchronized void write(String expectedValue, String newValue) throws IOException, PreconditionFailed {
    Objects.requireNonNull(expectedValue, "expected value may not be null");
    Objects.requireNonNull(newValue, "new value may not be null");
    try (PreparedStatement stmt = conn.prepareStatement("UPDATE registers SET value=? WHERE name=? AND value=?")) {
      stmt.setString(1, newValue);
      stmt.setString(2, registerName);
      stmt.setString(3, expectedValue);
      int rowsChanged = stmt.executeUpdate();
      switch (rowsChanged) {
        case 1:
          return;
        case 0:
          throw new PreconditionFailed("register " + this + " does not hold '" + expectedValue + '\'');
        default:
          throw new IllegalStateException("updated " + rowsChanged + " rows; should have been 0 or 1!");
      }
    } catch (SQLException e) {
      throw new IOException(e);
    }
  }

  @Override
  public String toString() {
    return "sqlite:" + filename + '#' + registerName;
  }

  @Override
  @EnsuresCalledMethods(value = "conn", methods = {"close"})
  public synchronized void close() throws IOException {
    try {
      conn.close();
    } catch (SQLException e) {
      throw new IOException(e);
    }
  }

}
