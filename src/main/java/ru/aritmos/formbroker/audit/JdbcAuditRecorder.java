package ru.aritmos.formbroker.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micronaut.scheduling.annotation.Scheduled;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ru.aritmos.formbroker.config.FormBrokerProperties;
import ru.aritmos.formbroker.core.ErrorType;
import ru.aritmos.formbroker.core.FormBrokerException;
import ru.aritmos.formbroker.core.SensitiveDataSanitizer;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Журнал аудита в реляционной БД (таблицы {@code fb_api_log} и {@code fb_submission_log}).
 * <p>
 * Ошибки записи логируются и не пробрасываются. Записи старше срока хранения
 * удаляются периодической очисткой.
 */
@Singleton
public class JdbcAuditRecorder implements AuditRecorder {

    private static final Logger log = LoggerFactory.getLogger(JdbcAuditRecorder.class);

    static final int MAX_LIMIT = 500;

    private static final String API_COLUMNS = "id, created_at, method, path, status_code, duration_ms, request_body, response_body, "
            + "error_message, context_id, form_id, user_agent, ip_address";
    private static final String SUBMISSION_COLUMNS = "id, created_at, form_id, context_id, tracking_id, business_record_ids, "
            + "relationship_ids, form_data, mapping_rules, success, is_duplicate, error_message, warning_message, duration_ms";

    private final DataSource dataSource;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final boolean enabled;
    private final Duration retention;
    private final int maxBodyLength;

    public JdbcAuditRecorder(DataSource dataSource, ObjectMapper objectMapper, FormBrokerProperties properties, Clock clock) {
        this.dataSource = dataSource;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.enabled = properties.getAudit().isEnabled();
        this.retention = Duration.ofHours(properties.getAudit().getRetentionHours());
        this.maxBodyLength = Math.max(100, properties.getAudit().getMaxBodyLength());
    }

    @Override
    public void recordSubmission(AuditModels.SubmissionAudit a) {
        if (!enabled) {
            return;
        }
        String sql = "INSERT INTO fb_submission_log (created_at, form_id, context_id, tracking_id, business_record_ids, relationship_ids, "
                + "form_data, mapping_rules, success, is_duplicate, error_message, warning_message, duration_ms) "
                + "VALUES (?,?,?,?,?,?,?,?,?,?,?,?,?)";
        try (Connection c = dataSource.getConnection();
             PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setTimestamp(1, Timestamp.from(clock.instant()));
            ps.setString(2, shorten(a.formId(), 255));
            ps.setString(3, shorten(a.contextId(), 255));
            ps.setString(4, shorten(a.trackingId(), 64));
            ps.setString(5, toJson(a.businessRecords()));
            ps.setString(6, toJson(a.relationshipIds()));
            ps.setString(7, toJson(a.formData()));
            ps.setString(8, toJson(a.mappingRules()));
            ps.setBoolean(9, a.success());
            ps.setBoolean(10, a.duplicate());
            ps.setString(11, shorten(SensitiveDataSanitizer.sanitizeText(a.errorMessage()), 2000));
            ps.setString(12, shorten(SensitiveDataSanitizer.sanitizeText(a.warningMessage()), 2000));
            ps.setLong(13, a.durationMs());
            ps.executeUpdate();
        } catch (SQLException e) {
            log.warn("[AUDIT] не удалось записать отправку formId={} contextId={}: {}", a.formId(), a.contextId(), e.getMessage());
        }
    }

    @Override
    public void recordApiCall(AuditModels.ApiCallAudit a) {
        if (!enabled) {
            return;
        }
        String sql = "INSERT INTO fb_api_log (created_at, method, path, status_code, duration_ms, request_body, response_body, "
                + "error_message, context_id, form_id, user_agent, ip_address) VALUES (?,?,?,?,?,?,?,?,?,?,?,?)";
        try (Connection c = dataSource.getConnection();
             PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setTimestamp(1, Timestamp.from(clock.instant()));
            ps.setString(2, shorten(a.method(), 16));
            ps.setString(3, shorten(a.path(), 1000));
            ps.setInt(4, a.statusCode());
            ps.setLong(5, a.durationMs());
            ps.setString(6, body(a.requestBody()));
            ps.setString(7, body(a.responseBody()));
            ps.setString(8, shorten(SensitiveDataSanitizer.sanitizeText(a.errorMessage()), 2000));
            ps.setString(9, shorten(a.contextId(), 255));
            ps.setString(10, shorten(a.formId(), 255));
            ps.setString(11, shorten(a.userAgent(), 512));
            ps.setString(12, shorten(a.ipAddress(), 64));
            ps.executeUpdate();
        } catch (SQLException e) {
            log.warn("[AUDIT] не удалось записать вызов API {} {}: {}", a.method(), a.path(), e.getMessage());
        }
    }

    public List<AuditModels.SubmissionLogRow> recentSubmissions(int limit) {
        return querySubmissions("SELECT " + SUBMISSION_COLUMNS + " FROM fb_submission_log ORDER BY created_at DESC, id DESC", List.of(), limit);
    }

    public List<AuditModels.SubmissionLogRow> submissionsByForm(String formId, int limit) {
        return querySubmissions("SELECT " + SUBMISSION_COLUMNS + " FROM fb_submission_log WHERE form_id = ? ORDER BY created_at DESC, id DESC",
                List.of(formId), limit);
    }

    public List<AuditModels.SubmissionLogRow> submissionsByContext(String contextId, int limit) {
        return querySubmissions("SELECT " + SUBMISSION_COLUMNS + " FROM fb_submission_log WHERE context_id = ? ORDER BY created_at DESC, id DESC",
                List.of(contextId), limit);
    }

    /**
     * Отправки, в которых созданы бизнес-записи, но не создано ни одной записи связи.
     */
    public List<AuditModels.SubmissionLogRow> failedRelationships(int limit) {
        return querySubmissions("SELECT " + SUBMISSION_COLUMNS + " FROM fb_submission_log "
                        + "WHERE business_record_ids IS NOT NULL AND business_record_ids <> '[]' "
                        + "AND (relationship_ids IS NULL OR relationship_ids = '[]') ORDER BY created_at DESC, id DESC",
                List.of(), limit);
    }

    /**
     * Вызовы API, завершившиеся ошибкой (статус 400 и выше или текст ошибки).
     */
    public List<AuditModels.ApiLogRow> errors(int limit) {
        String sql = "SELECT " + API_COLUMNS + " FROM fb_api_log WHERE status_code >= 400 OR error_message IS NOT NULL "
                + "ORDER BY created_at DESC, id DESC";
        List<AuditModels.ApiLogRow> out = new ArrayList<>();
        try (Connection c = dataSource.getConnection();
             PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setMaxRows(clamp(limit));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new AuditModels.ApiLogRow(
                            rs.getLong(1),
                            iso(rs.getTimestamp(2)),
                            rs.getString(3),
                            rs.getString(4),
                            nullableInt(rs, 5),
                            nullableLong(rs, 6),
                            rs.getString(7),
                            rs.getString(8),
                            rs.getString(9),
                            rs.getString(10),
                            rs.getString(11),
                            rs.getString(12),
                            rs.getString(13)
                    ));
                }
            }
        } catch (SQLException e) {
            throw queryFailed(e);
        }
        return out;
    }

    /**
     * Удалить записи старше срока хранения.
     *
     * @return количество удалённых записей в обеих таблицах
     */
    public int sweep() {
        Instant cutoff = clock.instant().minus(retention);
        int removed = 0;
        try (Connection c = dataSource.getConnection()) {
            for (String table : List.of("fb_api_log", "fb_submission_log")) {
                try (PreparedStatement ps = c.prepareStatement("DELETE FROM " + table + " WHERE created_at < ?")) {
                    ps.setTimestamp(1, Timestamp.from(cutoff));
                    removed += ps.executeUpdate();
                }
            }
        } catch (SQLException e) {
            log.warn("[AUDIT] очистка журнала не выполнена: {}", e.getMessage());
            return removed;
        }
        if (removed > 0) {
            log.info("[AUDIT] очистка журнала: удалено {} записей старше {} ч", removed, retention.toHours());
        }
        return removed;
    }

    @Scheduled(fixedDelay = "${formbroker.audit.sweep-interval:1h}", initialDelay = "${formbroker.audit.sweep-interval:1h}")
    void scheduledSweep() {
        sweep();
    }

    private List<AuditModels.SubmissionLogRow> querySubmissions(String sql, List<String> params, int limit) {
        List<AuditModels.SubmissionLogRow> out = new ArrayList<>();
        try (Connection c = dataSource.getConnection();
             PreparedStatement ps = c.prepareStatement(sql)) {
            for (int i = 0; i < params.size(); i++) {
                ps.setString(i + 1, params.get(i));
            }
            ps.setMaxRows(clamp(limit));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new AuditModels.SubmissionLogRow(
                            rs.getLong(1),
                            iso(rs.getTimestamp(2)),
                            rs.getString(3),
                            rs.getString(4),
                            rs.getString(5),
                            rs.getString(6),
                            rs.getString(7),
                            rs.getString(8),
                            rs.getString(9),
                            rs.getBoolean(10),
                            rs.getBoolean(11),
                            rs.getString(12),
                            rs.getString(13),
                            nullableLong(rs, 14)
                    ));
                }
            }
        } catch (SQLException e) {
            throw queryFailed(e);
        }
        return out;
    }

    private String body(Object value) {
        if (value == null) {
            return null;
        }
        String text = value instanceof String s ? s : toJson(value);
        return shorten(SensitiveDataSanitizer.sanitizeText(text), maxBodyLength);
    }

    private String toJson(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.debug("[AUDIT] значение не сериализовано в JSON: {}", e.getOriginalMessage());
            return String.valueOf(value);
        }
    }

    private static FormBrokerException queryFailed(SQLException e) {
        return new FormBrokerException(ErrorType.INTERNAL_ERROR, "AUDIT_QUERY_FAILED",
                "Не удалось прочитать журнал аудита", Map.of("sqlState", String.valueOf(e.getSQLState())), e);
    }

    private static int clamp(int limit) {
        return Math.min(Math.max(1, limit), MAX_LIMIT);
    }

    private static String shorten(String s, int max) {
        if (s == null) {
            return null;
        }
        return s.length() <= max ? s : s.substring(0, max);
    }

    private static String iso(Timestamp ts) {
        return ts == null ? null : ts.toInstant().toString();
    }

    private static Integer nullableInt(ResultSet rs, int idx) throws SQLException {
        int v = rs.getInt(idx);
        return rs.wasNull() ? null : v;
    }

    private static Long nullableLong(ResultSet rs, int idx) throws SQLException {
        long v = rs.getLong(idx);
        return rs.wasNull() ? null : v;
    }
}
