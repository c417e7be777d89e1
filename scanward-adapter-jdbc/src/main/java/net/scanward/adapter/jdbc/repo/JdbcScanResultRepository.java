package net.scanward.adapter.jdbc.repo;

import net.scanward.adapter.jdbc.JdbcUtil;
import net.scanward.adapter.jdbc.TxContext;
import net.scanward.adapter.jdbc.mapper.RowMappers;
import net.scanward.core.model.ScanResult;
import net.scanward.core.spi.ScanResultRepository;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

public final class JdbcScanResultRepository implements ScanResultRepository {
    /** 커넥션은 TxRunner 가 바인딩한 것만 사용 */
    private Connection mustConn() {
        return TxContext.require();
    }

    /** FK(SCAN_ID) 위반이면 SQLException 그대로 전파 */
    @Override
    public long insert(ScanResult r) throws Exception {
        try (PreparedStatement ps = mustConn().prepareStatement(
                """
                INSERT INTO TB_SCAN_RESULT (SCAN_ID, TEST_ID, TEST_NAME, CATEGORY, SEVERITY, PASSED,
                                            MESSAGE, REFERENCE, REMEDIATION, METADATA, CREATED_AT)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, CURRENT_TIMESTAMP)
                """,
                Statement.RETURN_GENERATED_KEYS
        )) {
            bind(ps, r);
            ps.executeUpdate();
            try (ResultSet k = ps.getGeneratedKeys()) {
                if (!k.next()) throw new SQLException("no key generated for TB_SCAN_RESULT");
                return k.getLong(1);
            }
        }
    }

    /** (SCAN_ID, TEST_ID) 기준 멱등 insert. 호출 측이 스캔 행 잠금을 잡고 있다는 전제 */
    @Override
    public boolean insertIfAbsent(ScanResult r) throws Exception {
        try (PreparedStatement ps = mustConn().prepareStatement(
                """
                INSERT INTO TB_SCAN_RESULT (SCAN_ID, TEST_ID, TEST_NAME, CATEGORY, SEVERITY, PASSED,
                                            MESSAGE, REFERENCE, REMEDIATION, METADATA, CREATED_AT)
                SELECT ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, CURRENT_TIMESTAMP
                 WHERE NOT EXISTS (
                       SELECT 1 FROM TB_SCAN_RESULT WHERE SCAN_ID = ? AND TEST_ID = ?
                 )
                """
        )) {
            bind(ps, r);
            JdbcUtil.setUuid(ps, 11, r.scanId());
            ps.setString(12, r.testId());
            return ps.executeUpdate() == 1;
        }
    }

    private static void bind(PreparedStatement ps, ScanResult r) throws SQLException {
        JdbcUtil.setUuid(ps, 1, r.scanId());
        ps.setString(2, r.testId());
        ps.setString(3, r.name());
        ps.setString(4, r.category());
        ps.setString(5, r.severity());
        ps.setBoolean(6, r.passed());
        ps.setString(7, r.message());
        ps.setString(8, r.reference());
        ps.setString(9, r.remediation());
        ps.setString(10, r.metadata());
    }

    @Override
    public List<ScanResult> findAllByScan(UUID scanId) throws Exception {
        try (PreparedStatement ps = mustConn().prepareStatement("SELECT * FROM TB_SCAN_RESULT WHERE SCAN_ID=? ORDER BY ID")) {
            JdbcUtil.setUuid(ps, 1, scanId);
            try (ResultSet rs = ps.executeQuery()) {
                var out = new ArrayList<ScanResult>();
                while (rs.next()) out.add(RowMappers.toScanResult(rs));
                return out;
            }
        }
    }
}
