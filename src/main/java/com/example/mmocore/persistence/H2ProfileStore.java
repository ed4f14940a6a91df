package com.example.mmocore.persistence;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Profile store on an H2 database via plain JDBC.
 */
public class H2ProfileStore implements ProfileStore {
    private static final Logger logger = LoggerFactory.getLogger(H2ProfileStore.class);

    private static final String USER = "sa";
    private static final String PASS = "";

    private final String url;

    public H2ProfileStore(String url) {
        this.url = url;
        ensureTable();
    }

    private void ensureTable() {
        try (Connection c = DriverManager.getConnection(url, USER, PASS);
             Statement s = c.createStatement()) {
            s.execute("""
                CREATE TABLE IF NOT EXISTS player_profile (
                    player_id VARCHAR(320) PRIMARY KEY,
                    str INT NOT NULL DEFAULT 1,
                    agi INT NOT NULL DEFAULT 1,
                    vit INT NOT NULL DEFAULT 1,
                    intel INT NOT NULL DEFAULT 1,
                    dex INT NOT NULL DEFAULT 1,
                    luck INT NOT NULL DEFAULT 1,
                    stat_points INT NOT NULL DEFAULT 0,
                    updated_at BIGINT NOT NULL
                )
            """);
            logger.info("[profiles] table ensured at {}", url);
        } catch (SQLException e) {
            throw new ProfileStoreException("Failed to create player_profile table", e);
        }
    }

    @Override
    public void save(ProfileSnapshot snapshot) {
        try (Connection c = DriverManager.getConnection(url, USER, PASS);
             PreparedStatement ps = c.prepareStatement(
                     "MERGE INTO player_profile (player_id, str, agi, vit, intel, dex, luck, stat_points, updated_at) " +
                     "KEY(player_id) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)")) {
            ps.setString(1, snapshot.playerId());
            ps.setInt(2, snapshot.str());
            ps.setInt(3, snapshot.agi());
            ps.setInt(4, snapshot.vit());
            ps.setInt(5, snapshot.intel());
            ps.setInt(6, snapshot.dex());
            ps.setInt(7, snapshot.luck());
            ps.setInt(8, snapshot.statPoints());
            ps.setLong(9, System.currentTimeMillis());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new ProfileStoreException("Failed to save profile for " + snapshot.playerId(), e);
        }
    }

    /**
     * Read back a stored profile.
     * @return the snapshot, or null if none is stored
     */
    public ProfileSnapshot find(String playerId) {
        try (Connection c = DriverManager.getConnection(url, USER, PASS);
             PreparedStatement ps = c.prepareStatement(
                     "SELECT str, agi, vit, intel, dex, luck, stat_points FROM player_profile WHERE player_id = ?")) {
            ps.setString(1, playerId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return null;
                return new ProfileSnapshot(playerId,
                        rs.getInt("str"), rs.getInt("agi"), rs.getInt("vit"),
                        rs.getInt("intel"), rs.getInt("dex"), rs.getInt("luck"),
                        rs.getInt("stat_points"));
            }
        } catch (SQLException e) {
            throw new ProfileStoreException("Failed to read profile for " + playerId, e);
        }
    }
}
