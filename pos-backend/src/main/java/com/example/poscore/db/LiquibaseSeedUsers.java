package com.example.poscore.db;

import liquibase.change.custom.CustomTaskChange;
import liquibase.database.Database;
import liquibase.database.jvm.JdbcConnection;
import liquibase.exception.CustomChangeException;
import liquibase.exception.SetupException;
import liquibase.exception.ValidationErrors;
import liquibase.resource.ResourceAccessor;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;

/**
 * Seeds the default {@code admin} and {@code cashier} accounts when no admin
 * exists yet. Passwords come from DEFAULT_ADMIN_PASSWORD and
 * DEFAULT_CASHIER_PASSWORD.
 */
public class LiquibaseSeedUsers implements CustomTaskChange {

    private static final String ADMIN = "admin";
    private static final String CASHIER = "cashier";
    private static final String INSERT_USER =
            "insert into app_user (username, password, role, can_manage_ledger) values (?, ?, ?, ?)";

    @Override
    public void execute(Database database) throws CustomChangeException {
        try {
            Connection conn = ((JdbcConnection) database.getConnection()).getUnderlyingConnection();

            try (PreparedStatement ps = conn.prepareStatement("select count(*) from app_user where username = ?")) {
                ps.setString(1, ADMIN);
                try (ResultSet rs = ps.executeQuery()) {
                    if (rs.next() && rs.getInt(1) > 0) {
                        return;
                    }
                }
            }

            BCryptPasswordEncoder enc = new BCryptPasswordEncoder();
            String adminPass = System.getenv().getOrDefault("DEFAULT_ADMIN_PASSWORD", "admin123");
            String cashierPass = System.getenv().getOrDefault("DEFAULT_CASHIER_PASSWORD", "cashier123");

            insert(conn, ADMIN, enc.encode(adminPass), ADMIN, true);
            insert(conn, CASHIER, enc.encode(cashierPass), CASHIER, false);
        } catch (SQLException e) {
            throw new CustomChangeException("Failed to seed users: " + e.getMessage(), e);
        }
    }

    private static void insert(Connection conn, String username, String hash, String role, boolean manageLedger)
            throws SQLException {
        try (PreparedStatement ins = conn.prepareStatement(INSERT_USER)) {
            ins.setString(1, username);
            ins.setString(2, hash);
            ins.setString(3, role);
            ins.setBoolean(4, manageLedger);
            ins.executeUpdate();
        }
    }

    @Override
    public String getConfirmationMessage() {
        return "Seeded default users (admin, cashier) if absent";
    }

    @Override
    public void setUp() throws SetupException {
        // nothing to set up
    }

    @Override
    public void setFileOpener(ResourceAccessor resourceAccessor) {
        // not needed
    }

    @Override
    public ValidationErrors validate(Database database) {
        return new ValidationErrors();
    }
}
