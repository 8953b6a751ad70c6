/*
 * Where: Scheduler data access
 * What: Schema checks, registration, session adoption and the zombie sweep on the primary session
 * Why: The agent id is the backend pid of that session, so these cannot use the pool
 */
package com.jobagent.scheduler.repository;

import com.jobagent.scheduler.db.PrimaryConnection;
import com.jobagent.scheduler.model.SchemaSanity;
import com.jobagent.scheduler.model.ZombieReapResult;
import java.util.Optional;
import org.springframework.jdbc.core.namedparam.EmptySqlParameterSource;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.stereotype.Repository;

@Repository
public class AgentRepository {

  public SchemaSanity checkSanity(PrimaryConnection connection) {
    final String sql =
        """
        SELECT to_regclass('pgagent.pga_job') IS NOT NULL AS job_table_present,
               pg_backend_pid() AS backend_pid
        """;
    return connection
        .jdbc()
        .queryForObject(
            sql,
            EmptySqlParameterSource.INSTANCE,
            (rs, rowNum) ->
                new SchemaSanity(rs.getBoolean("job_table_present"), rs.getInt("backend_pid")));
  }

  public boolean hasSchemaVersionFunction(PrimaryConnection connection) {
    final String sql =
        """
        SELECT count(*)
        FROM pg_catalog.pg_proc p
        JOIN pg_catalog.pg_namespace n ON n.oid = p.pronamespace
        WHERE n.nspname = 'pgagent'
          AND p.proname = 'pgagent_schema_version'
        """;
    final Integer count =
        connection.jdbc().queryForObject(sql, EmptySqlParameterSource.INSTANCE, Integer.class);
    return count != null && count > 0;
  }

  public Optional<Integer> findSchemaVersion(PrimaryConnection connection) {
    final String sql = "SELECT pgagent.pgagent_schema_version()::int4";
    return Optional.ofNullable(
        connection.jdbc().queryForObject(sql, EmptySqlParameterSource.INSTANCE, Integer.class));
  }

  public int register(PrimaryConnection connection, String station) {
    final String sql =
        """
        INSERT INTO pgagent.pga_jobagent (jagpid, jagstation)
        SELECT pg_backend_pid(), :station
        """;
    return connection.jdbc().update(sql, new MapSqlParameterSource().addValue("station", station));
  }

  /**
   * Moves the claims of an earlier session of this process to the current backend pid and drops
   * its registration, so the zombie sweep leaves its running jobs alone. Returns the moved claims.
   */
  public int adoptSession(PrimaryConnection connection, int previousPid) {
    final String sql =
        """
        WITH moved AS (
          UPDATE pgagent.pga_job
          SET jobagentid = pg_backend_pid()
          WHERE jobagentid = :previousPid
          RETURNING jobid
        ), removed AS (
          DELETE FROM pgagent.pga_jobagent
          WHERE jagpid = :previousPid
        )
        SELECT count(*)::int4 FROM moved
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("previousPid", previousPid);
    final Integer moved = connection.jdbc().queryForObject(sql, params, Integer.class);
    return moved == null ? 0 : moved;
  }

  /**
   * Cleans up after agents whose backend is gone. Every step is a CTE of one statement, so a
   * concurrent agent sees either all of a sweep or none of it.
   */
  public ZombieReapResult reapZombies(PrimaryConnection connection) {
    final String sql =
        """
        WITH zombies AS (
          SELECT a.jagpid
          FROM pgagent.pga_jobagent a
          LEFT JOIN pg_catalog.pg_stat_activity s ON s.pid = a.jagpid
          WHERE s.pid IS NULL
        ),
        aborted_logs AS (
          UPDATE pgagent.pga_joblog l
          SET jlgstatus = 'd'
          FROM pgagent.pga_job j
          JOIN zombies z ON z.jagpid = j.jobagentid
          WHERE l.jlgjobid = j.jobid
            AND l.jlgstatus = 'r'
          RETURNING l.jlgid, l.jlgjobid
        ),
        aborted_steps AS (
          UPDATE pgagent.pga_jobsteplog sl
          SET jslstatus = 'd'
          FROM aborted_logs al
          WHERE sl.jsljlgid = al.jlgid
            AND sl.jslstatus = 'r'
          RETURNING sl.jslid
        ),
        released_jobs AS (
          UPDATE pgagent.pga_job j
          SET jobagentid = NULL,
              jobnextrun = NULL
          FROM zombies z
          WHERE j.jobagentid = z.jagpid
          RETURNING j.jobid
        ),
        removed_agents AS (
          DELETE FROM pgagent.pga_jobagent a
          USING zombies z
          WHERE a.jagpid = z.jagpid
          RETURNING a.jagpid
        )
        SELECT (SELECT count(*) FROM removed_agents) AS removed_agents,
               (SELECT count(*) FROM aborted_logs) AS aborted_runs,
               (SELECT count(*) FROM aborted_steps) AS aborted_steps,
               (SELECT count(*) FROM released_jobs) AS released_jobs,
               (SELECT min(jlgjobid)::text FROM aborted_logs) AS first_aborted_job_id
        """;
    return connection
        .jdbc()
        .queryForObject(
            sql,
            EmptySqlParameterSource.INSTANCE,
            (rs, rowNum) ->
                new ZombieReapResult(
                    rs.getInt("removed_agents"),
                    rs.getInt("aborted_runs"),
                    rs.getInt("aborted_steps"),
                    rs.getInt("released_jobs"),
                    rs.getString("first_aborted_job_id")));
  }
}
