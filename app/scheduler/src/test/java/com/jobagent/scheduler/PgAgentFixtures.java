/*
 * Where: Scheduler test infrastructure
 * What: Inserts and clears rows of the job schema for repository tests
 * Why: Several test classes need the same jobs, runs and agents set up by hand
 */
package com.jobagent.scheduler;

import org.springframework.jdbc.core.namedparam.EmptySqlParameterSource;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

public final class PgAgentFixtures {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public PgAgentFixtures(NamedParameterJdbcTemplate jdbcTemplate) {
    this.jdbcTemplate = jdbcTemplate;
  }

  public void clear() {
    for (String table :
        new String[] {
          "pga_job_status_event",
          "pga_job_notification",
          "pga_jobsteplog",
          "pga_joblog",
          "pga_jobstep",
          "pga_job",
          "pga_jobagent"
        }) {
      jdbcTemplate.update("DELETE FROM pgagent." + table, EmptySqlParameterSource.INSTANCE);
    }
  }

  /** {@code nextRunOffset} is a PostgreSQL interval relative to now(), e.g. "-1 minute". */
  public String insertJob(String name, String hostAgent, boolean enabled, String nextRunOffset) {
    final String sql =
        """
        INSERT INTO pgagent.pga_job (jobname, jobhostagent, jobenabled, jobnextrun)
        VALUES (:name, :hostAgent, :enabled, now() + CAST(:offset AS interval))
        RETURNING jobid::text
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("name", name)
            .addValue("hostAgent", hostAgent)
            .addValue("enabled", enabled)
            .addValue("offset", nextRunOffset);
    return jdbcTemplate.queryForObject(sql, params, String.class);
  }

  public String insertStep(String jobId, String name, String code, String onError) {
    final String sql =
        """
        INSERT INTO pgagent.pga_jobstep (jstjobid, jstname, jstcode, jstonerror)
        VALUES (CAST(:jobId AS int4), :name, :code, :onError)
        RETURNING jstid::text
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("jobId", jobId)
            .addValue("name", name)
            .addValue("code", code)
            .addValue("onError", onError);
    return jdbcTemplate.queryForObject(sql, params, String.class);
  }

  public void insertAgent(int pid, String station) {
    jdbcTemplate.update(
        "INSERT INTO pgagent.pga_jobagent (jagpid, jagstation) VALUES (:pid, :station)",
        new MapSqlParameterSource().addValue("pid", pid).addValue("station", station));
  }

  public void assignAgent(String jobId, int pid) {
    jdbcTemplate.update(
        "UPDATE pgagent.pga_job SET jobagentid = :pid WHERE jobid = CAST(:jobId AS int4)",
        new MapSqlParameterSource().addValue("pid", pid).addValue("jobId", jobId));
  }

  public String queryString(String sql, MapSqlParameterSource params) {
    return jdbcTemplate.queryForObject(sql, params, String.class);
  }

  public int count(String sql, MapSqlParameterSource params) {
    final Integer result = jdbcTemplate.queryForObject(sql, params, Integer.class);
    return result == null ? 0 : result;
  }

  public static MapSqlParameterSource params(String name, Object value) {
    return new MapSqlParameterSource().addValue(name, value);
  }
}
