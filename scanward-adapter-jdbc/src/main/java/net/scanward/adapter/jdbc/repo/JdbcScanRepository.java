package net.scanward.adapter.jdbc.repo;

import net.scanward.adapter.jdbc.JdbcUtil;
import net.scanward.adapter.jdbc.TxContext;
import net.scanward.adapter.jdbc.mapper.RowMappers;
import net.scanward.core.model.Scan;
import net.scanward.core.model.ScanStatus;
import net.scanward.core.spi.ScanRepository;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public final class JdbcScanRepository implements ScanRepository {
    /** 커넥션은 TxRunner 가 바인딩한 것만 사용 */
    private Connection mustConn() {
        return TxContext.require();
    }

    @Override
    public void insert(Scan scan) throws Exception {
        try (PreparedStatement ps = mustConn().prepareStatement(
                """
                INSERT INTO TB_SCAN (ID, TARGET, STATUS, CREATED_AT, STARTED_AT, COMPLETED_AT,
                                     DISPATCHED_AT, DISPATCH_ATTEMPTS, UPDATED_AT)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, CURRENT_TIMESTAMP)
                """
        )) {
            JdbcUtil.setUuid(ps, 1, scan.id());
            ps.setString(2, scan.target());
            ps.setString(3, scan.status().code());
            ps.setTimestamp(4, JdbcUtil.ts(scan.createdAt()));
            ps.setTimestamp(5, JdbcUtil.ts(scan.startedAt()));
            ps.setTimestamp(6, JdbcUtil.ts(scan.completedAt()));
            ps.setTimestamp(7, JdbcUtil.ts(scan.dispatchedAt()));
            ps.setInt(8, scan.dispatchAttempts());
            ps.executeUpdate();
        }
    }

    @Override
    public Optional<Scan> findById(UUID id) throws Exception {
        return selectOne("SELECT * FROM TB_SCAN WHERE ID=?", id);
    }

    /** 행 잠금: 같은 스캔에 대한 동시 제출은 여기서 직렬화된다 */
    @Override
    public Optional<Scan> lockById(UUID id) throws Exception {
        return selectOne("SELECT * FROM TB_SCAN WHERE ID=? FOR UPDATE", id);
    }

    private Optional<Scan> selectOne(String sql, UUID id) throws Exception {
        try (PreparedStatement ps = mustConn().prepareStatement(sql)) {
            JdbcUtil.setUuid(ps, 1, id);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(RowMappers.toScan(rs)) : Optional.empty();
            }
        }
    }

    /** PENDING일 때만 RUNNING 전환 + STARTED_AT 최초 세팅 */
    @Override
    public boolean markRunningIfPending(UUID id, Instant startedAt) throws Exception {
        try (PreparedStatement ps = mustConn().prepareStatement(
                """
                UPDATE TB_SCAN
                   SET STATUS     = 'RUNNING',
                       STARTED_AT = COALESCE(STARTED_AT, ?),
                       UPDATED_AT = CURRENT_TIMESTAMP
                 WHERE ID = ?
                   AND STATUS = 'PENDING'
                """
        )) {
            ps.setTimestamp(1, JdbcUtil.ts(startedAt));
            JdbcUtil.setUuid(ps, 2, id);
            return ps.executeUpdate() == 1;
        }
    }

    /** 종료 마킹: COMPLETED/FAILED + COMPLETED_AT, 아직 종료 전인 행만 */
    @Override
    public boolean finalizeIfActive(UUID id, ScanStatus terminal, Instant startedAt, Instant completedAt) throws Exception {
        if (!terminal.isTerminal()) throw new IllegalArgumentException("not a terminal status: " + terminal);
        try (PreparedStatement ps = mustConn().prepareStatement(
                """
                UPDATE TB_SCAN
                   SET STATUS       = ?,
                       STARTED_AT   = COALESCE(STARTED_AT, ?),
                       COMPLETED_AT = ?,
                       UPDATED_AT   = CURRENT_TIMESTAMP
                 WHERE ID = ?
                   AND STATUS IN ('PENDING', 'RUNNING')
                """
        )) {
            ps.setString(1, terminal.code());
            ps.setTimestamp(2, JdbcUtil.ts(startedAt));
            ps.setTimestamp(3, JdbcUtil.ts(completedAt));
            JdbcUtil.setUuid(ps, 4, id);
            return ps.executeUpdate() == 1;
        }
    }

    @Override
    public long countByStatus(ScanStatus status) throws Exception {
        try (PreparedStatement ps = mustConn().prepareStatement("SELECT COUNT(*) FROM TB_SCAN WHERE STATUS=?")) {
            ps.setString(1, status.code());
            try (ResultSet rs = ps.executeQuery()) {
                rs.next();
                return rs.getLong(1);
            }
        }
    }

    @Override
    public void markDispatched(UUID id, Instant at) throws Exception {
        try (PreparedStatement ps = mustConn().prepareStatement(
                """
                UPDATE TB_SCAN
                   SET DISPATCHED_AT = COALESCE(DISPATCHED_AT, ?),
                       UPDATED_AT    = CURRENT_TIMESTAMP
                 WHERE ID = ?
                """
        )) {
            ps.setTimestamp(1, JdbcUtil.ts(at));
            JdbcUtil.setUuid(ps, 2, id);
            ps.executeUpdate();
        }
    }

    @Override
    public int recordDispatchAttempt(UUID id) throws Exception {
        try (PreparedStatement ps = mustConn().prepareStatement(
                """
                UPDATE TB_SCAN
                   SET DISPATCH_ATTEMPTS = DISPATCH_ATTEMPTS + 1,
                       UPDATED_AT        = CURRENT_TIMESTAMP
                 WHERE ID = ?
                """
        )) {
            JdbcUtil.setUuid(ps, 1, id);
            if (ps.executeUpdate() == 0) return 0;
        }
        try (PreparedStatement ps = mustConn().prepareStatement("SELECT DISPATCH_ATTEMPTS FROM TB_SCAN WHERE ID=?")) {
            JdbcUtil.setUuid(ps, 1, id);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        }
    }

    @Override
    public List<Scan> findPendingUndispatched(Instant createdBefore, int limit) throws Exception {
        try (PreparedStatement ps = mustConn().prepareStatement(
                """
                SELECT *
                  FROM TB_SCAN
                 WHERE STATUS = 'PENDING'
                   AND DISPATCHED_AT IS NULL
                   AND CREATED_AT < ?
                 ORDER BY CREATED_AT ASC, ID ASC
                 LIMIT ?
                """
        )) {
            ps.setTimestamp(1, JdbcUtil.ts(createdBefore));
            ps.setInt(2, limit);
            try (ResultSet rs = ps.executeQuery()) {
                var out = new ArrayList<Scan>();
                while (rs.next()) out.add(RowMappers.toScan(rs));
                return out;
            }
        }
    }
}
