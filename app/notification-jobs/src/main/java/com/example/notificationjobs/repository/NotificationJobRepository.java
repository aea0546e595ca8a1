/*
 * どこで: NotificationJobs データアクセス
 * 何を: notification_jobs の登録/claim/状態遷移/一覧/保持期間削除を担う
 * なぜ: 状態更新をすべて条件付き UPDATE にし、終端状態の行を上書きしないため
 */
package com.example.notificationjobs.repository;

import static com.example.common.JdbcTimestampUtils.toInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.notificationjobs.model.NotificationJob;
import com.example.notificationjobs.model.NotificationJobFilter;
import com.example.notificationjobs.model.NotificationJobStatus;
import com.example.notificationjobs.model.NotificationTarget;
import java.sql.Array;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.SqlArrayValue;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class NotificationJobRepository {

  private static final String SELECT_COLUMNS =
      """
      job_id, title, body, payload_json::text AS payload_json_text, user_ids, all_users,
      scheduled_time, created_at, created_by, attempts, max_attempts, status, error,
      processed_at, next_attempt_at
      """;

  // PENDING かつ予定時刻到来、試行回数に余りがあり、バックオフ待ちが明けている行
  private static final String ELIGIBLE_PREDICATE =
      """
      status = 'PENDING'
        AND scheduled_time <= :now
        AND attempts < max_attempts
        AND (next_attempt_at IS NULL OR next_attempt_at <= :now)
      """;

  private static final String TERMINAL_STATUSES = "('COMPLETED', 'FAILED', 'CANCELLED')";

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public String insert(NotificationJob job) {
    final String sql =
        """
        INSERT INTO notification_jobs (
          job_id,
          title,
          body,
          payload_json,
          user_ids,
          all_users,
          scheduled_time,
          created_at,
          created_by,
          attempts,
          max_attempts,
          status,
          error,
          processed_at,
          next_attempt_at
        ) VALUES (
          :jobId,
          :title,
          :body,
          :payloadJson::jsonb,
          :userIds::text[],
          :allUsers,
          :scheduledTime,
          :createdAt,
          :createdBy,
          :attempts,
          :maxAttempts,
          :status,
          :error,
          :processedAt,
          :nextAttemptAt
        )
        """;
    final NotificationTarget target = job.target();
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("jobId", job.jobId())
            .addValue("title", job.title())
            .addValue("body", job.body())
            .addValue("payloadJson", job.payloadJson() == null ? "{}" : job.payloadJson())
            .addValue(
                "userIds",
                target.allUsers() ? null : new SqlArrayValue("text", target.userIds().toArray()))
            .addValue("allUsers", target.allUsers())
            .addValue("scheduledTime", toTimestamp(job.scheduledTime()))
            .addValue("createdAt", toTimestamp(job.createdAt()))
            .addValue("createdBy", job.createdBy())
            .addValue("attempts", job.attempts())
            .addValue("maxAttempts", job.maxAttempts())
            .addValue("status", job.status().name())
            .addValue("error", job.error())
            .addValue("processedAt", toTimestamp(job.processedAt()))
            .addValue("nextAttemptAt", toTimestamp(job.nextAttemptAt()));
    jdbcTemplate.update(sql, params);
    return job.jobId();
  }

  public Optional<NotificationJob> findById(String jobId) {
    final String sql = "SELECT " + SELECT_COLUMNS + " FROM notification_jobs WHERE job_id = :jobId";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("jobId", jobId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  /** 読み取りのみの取得。返した行は {@link #markProcessing} まで PENDING のまま。 */
  public List<NotificationJob> findReady(int limit, Instant now) {
    final String sql =
        "SELECT "
            + SELECT_COLUMNS
            + " FROM notification_jobs WHERE "
            + ELIGIBLE_PREDICATE
            + " ORDER BY scheduled_time, created_at, job_id LIMIT :limit";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("now", toTimestamp(now)).addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  /**
   * claim と PROCESSING への更新を 1 文で行い、2 つの processor が同じ行を取らないようにする。
   * 返すスナップショットは加算済みの試行回数を持つ。
   */
  public List<NotificationJob> claimReady(int limit, Instant now) {
    final String sql =
        """
        WITH cte AS (
          SELECT job_id
          FROM notification_jobs
          WHERE %s
          ORDER BY scheduled_time, created_at, job_id
          LIMIT :limit
          FOR UPDATE SKIP LOCKED
        )
        UPDATE notification_jobs j
        SET status = 'PROCESSING',
            attempts = j.attempts + 1,
            processing_started_at = :now
        FROM cte
        WHERE j.job_id = cte.job_id
        RETURNING j.job_id, j.title, j.body, j.payload_json::text AS payload_json_text,
                  j.user_ids, j.all_users, j.scheduled_time, j.created_at, j.created_by,
                  j.attempts, j.max_attempts, j.status, j.error, j.processed_at,
                  j.next_attempt_at
        """
            .formatted(ELIGIBLE_PREDICATE);
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("now", toTimestamp(now)).addValue("limit", limit);
    final List<NotificationJob> claimed = new ArrayList<>(jdbcTemplate.query(sql, params, this::mapRow));
    // RETURNING の順序は保証されないため並べ直す
    claimed.sort(
        (left, right) -> {
          final int byTime = left.scheduledTime().compareTo(right.scheduledTime());
          if (byTime != 0) {
            return byTime;
          }
          final int byCreated = left.createdAt().compareTo(right.createdAt());
          return byCreated != 0 ? byCreated : left.jobId().compareTo(right.jobId());
        });
    return claimed;
  }

  /** 送信前に試行回数を加算し、送信途中で落ちても試行回数を消費させる。 */
  public int markProcessing(String jobId, Instant now) {
    final String sql =
        """
        UPDATE notification_jobs
        SET status = 'PROCESSING',
            attempts = attempts + 1,
            processing_started_at = :now
        WHERE job_id = :jobId
          AND status = 'PENDING'
          AND attempts < max_attempts
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("jobId", jobId).addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }

  public int markCompleted(String jobId, Instant processedAt) {
    final String sql =
        """
        UPDATE notification_jobs
        SET status = 'COMPLETED',
            processed_at = :processedAt,
            next_attempt_at = NULL
        WHERE job_id = :jobId
          AND status = 'PROCESSING'
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("jobId", jobId)
            .addValue("processedAt", toTimestamp(processedAt));
    return jdbcTemplate.update(sql, params);
  }

  /**
   * 配信失敗を記録する。試行回数を使い切っていれば FAILED、そうでなければ
   * {@code nextAttemptAt} 以降に再取得される PENDING に戻す (null は次のポーリング)。
   *
   * @return 更新後の状態。行が既に PROCESSING でなければ空
   */
  public Optional<NotificationJobStatus> markFailed(
      String jobId, String error, Instant now, Instant nextAttemptAt) {
    final String sql =
        """
        UPDATE notification_jobs
        SET error = :error,
            status = CASE WHEN attempts >= max_attempts THEN 'FAILED' ELSE 'PENDING' END,
            processed_at = CASE
              WHEN attempts >= max_attempts THEN CAST(:now AS TIMESTAMPTZ)
              ELSE NULL
            END,
            next_attempt_at = CASE
              WHEN attempts >= max_attempts THEN NULL
              ELSE CAST(:nextAttemptAt AS TIMESTAMPTZ)
            END
        WHERE job_id = :jobId
          AND status = 'PROCESSING'
        RETURNING status
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("jobId", jobId)
            .addValue("error", error)
            .addValue("now", toTimestamp(now))
            .addValue("nextAttemptAt", toTimestamp(nextAttemptAt));
    return jdbcTemplate
        .query(sql, params, (rs, rowNum) -> NotificationJobStatus.valueOf(rs.getString("status")))
        .stream()
        .findFirst();
  }

  public int cancel(String jobId, Instant now) {
    final String sql =
        """
        UPDATE notification_jobs
        SET status = 'CANCELLED',
            processed_at = :now,
            next_attempt_at = NULL
        WHERE job_id = :jobId
          AND status IN ('PENDING', 'PROCESSING')
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("jobId", jobId).addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }

  public Map<NotificationJobStatus, Long> countByStatus() {
    final String sql = "SELECT status, COUNT(*) AS cnt FROM notification_jobs GROUP BY status";
    final Map<NotificationJobStatus, Long> counts = new EnumMap<>(NotificationJobStatus.class);
    jdbcTemplate.query(
        sql,
        new MapSqlParameterSource(),
        rs -> {
          counts.put(NotificationJobStatus.valueOf(rs.getString("status")), rs.getLong("cnt"));
        });
    return counts;
  }

  public List<NotificationJob> findPage(NotificationJobFilter filter, int limit, int offset) {
    final MapSqlParameterSource params = new MapSqlParameterSource();
    final String sql =
        "SELECT "
            + SELECT_COLUMNS
            + " FROM notification_jobs"
            + whereClause(filter, params)
            + " ORDER BY created_at DESC, job_id DESC LIMIT :limit OFFSET :offset";
    params.addValue("limit", limit).addValue("offset", offset);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public long countMatching(NotificationJobFilter filter) {
    final MapSqlParameterSource params = new MapSqlParameterSource();
    final String sql = "SELECT COUNT(*) FROM notification_jobs" + whereClause(filter, params);
    final Long count = jdbcTemplate.queryForObject(sql, params, Long.class);
    return count == null ? 0L : count;
  }

  public long countCreatedSince(Instant since) {
    final String sql = "SELECT COUNT(*) FROM notification_jobs WHERE created_at >= :since";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("since", toTimestamp(since));
    final Long count = jdbcTemplate.queryForObject(sql, params, Long.class);
    return count == null ? 0L : count;
  }

  public int deleteTerminalProcessedBefore(Instant threshold) {
    final String sql =
        """
        DELETE FROM notification_jobs
        WHERE status IN %s
          AND processed_at < :threshold
        """
            .formatted(TERMINAL_STATUSES);
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("threshold", toTimestamp(threshold));
    return jdbcTemplate.update(sql, params);
  }

  /** 閾値より前に PROCESSING になった行。送信途中で processor が停止した可能性が高い。 */
  public int countStaleProcessing(Instant threshold) {
    final String sql =
        """
        SELECT COUNT(*)
        FROM notification_jobs
        WHERE status = 'PROCESSING'
          AND processing_started_at < :threshold
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("threshold", toTimestamp(threshold));
    final Integer count = jdbcTemplate.queryForObject(sql, params, Integer.class);
    return count == null ? 0 : count;
  }

  private String whereClause(NotificationJobFilter filter, MapSqlParameterSource params) {
    final List<String> conditions = new ArrayList<>();
    if (filter.status() != null) {
      conditions.add("status = :status");
      params.addValue("status", filter.status().name());
    }
    if (filter.createdBy() != null) {
      conditions.add("created_by = :createdBy");
      params.addValue("createdBy", filter.createdBy());
    }
    return conditions.isEmpty() ? "" : " WHERE " + String.join(" AND ", conditions);
  }

  private NotificationJob mapRow(ResultSet rs, int rowNum) throws SQLException {
    final boolean allUsers = rs.getBoolean("all_users");
    return new NotificationJob(
        rs.getString("job_id"),
        rs.getString("title"),
        rs.getString("body"),
        rs.getString("payload_json_text"),
        allUsers ? NotificationTarget.broadcast() : NotificationTarget.users(readUserIds(rs)),
        toInstant(rs.getTimestamp("scheduled_time")),
        toInstant(rs.getTimestamp("created_at")),
        rs.getString("created_by"),
        rs.getInt("attempts"),
        rs.getInt("max_attempts"),
        NotificationJobStatus.valueOf(rs.getString("status")),
        rs.getString("error"),
        toInstant(rs.getTimestamp("processed_at")),
        toInstant(rs.getTimestamp("next_attempt_at")));
  }

  private List<String> readUserIds(ResultSet rs) throws SQLException {
    final Array array = rs.getArray("user_ids");
    if (array == null) {
      return List.of();
    }
    try {
      return List.of((String[]) array.getArray());
    } finally {
      array.free();
    }
  }
}
