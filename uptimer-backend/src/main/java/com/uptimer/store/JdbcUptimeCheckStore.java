package com.uptimer.store;

import com.uptimer.model.CheckResult;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;

@Component
public class JdbcUptimeCheckStore implements UptimeCheckStore {

    static final String INSERT_SQL =
            "INSERT INTO uptime_checks (website_id, status, response_time, status_code) VALUES (?, ?, ?, ?)";

    private final DataSource dataSource;

    public JdbcUptimeCheckStore(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public void insert(CheckResult result) throws SQLException {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(INSERT_SQL)) {
            ps.setObject(1, result.getWebsiteId());
            ps.setString(2, result.getStatus().value());
            ps.setLong(3, result.getResponseTimeMs());
            ps.setInt(4, result.getStatusCode());
            ps.executeUpdate();
        }
    }
}
