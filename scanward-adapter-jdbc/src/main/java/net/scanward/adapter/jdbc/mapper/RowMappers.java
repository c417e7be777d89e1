package net.scanward.adapter.jdbc.mapper;

import net.scanward.adapter.jdbc.JdbcUtil;
import net.scanward.core.model.Scan;
import net.scanward.core.model.ScanResult;
import net.scanward.core.model.ScanStatus;

import java.sql.ResultSet;
import java.sql.SQLException;

public final class RowMappers {
    private RowMappers() {}

    // --- Scan ---
    public static Scan toScan(ResultSet rs) throws SQLException {
        return new Scan(
                JdbcUtil.getUuid(rs, "ID"),
                rs.getString("TARGET"),
                ScanStatus.from(rs.getString("STATUS")),
                rs.getTimestamp("CREATED_AT").toInstant(),
                JdbcUtil.toInstant(rs.getTimestamp("STARTED_AT")),
                JdbcUtil.toInstant(rs.getTimestamp("COMPLETED_AT")),
                JdbcUtil.toInstant(rs.getTimestamp("DISPATCHED_AT")),
                rs.getInt("DISPATCH_ATTEMPTS")
        );
    }

    // --- ScanResult ---
    public static ScanResult toScanResult(ResultSet rs) throws SQLException {
        return new ScanResult(
                rs.getLong("ID"),
                JdbcUtil.getUuid(rs, "SCAN_ID"),
                rs.getString("TEST_ID"),
                rs.getString("TEST_NAME"),
                rs.getString("CATEGORY"),
                rs.getString("SEVERITY"),
                rs.getBoolean("PASSED"),
                rs.getString("MESSAGE"),
                rs.getString("REFERENCE"),
                rs.getString("REMEDIATION"),
                rs.getString("METADATA")
        );
    }
}
