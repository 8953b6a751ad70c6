/*
 * Where: Scheduler data access
 * What: Due-job lookup plus the claim, run-log and release statements of a job run
 * Why: Claiming with "jobagentid IS NULL" keeps two agents from running the same job
 */
package com.jobagent.scheduler.repository;

import com.jobagent.scheduler.model.JobStep;
import java.util.Collection;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class JobRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public List<String> findDueJobIds(String hostName) {
    final String sql =
        """
        SELECT j.jobid::text AS job_id
        FROM pgagent.pga_job j
        WHERE j.jobenabled
          AND j.jobagentid IS NULL
          AND j.jobnextrun <= now()
          AND (j.jobhostagent = '' OR j.jobhostagent = :hostName)
        ORDER BY j.jobnextrun
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("hostName", hostName);
    return jdbcTemplate.query(sql, params, (rs, rowNum) -> rs.getString("job_id"));
  }

  public int claim(String jobId, int agentPid) {
    final String sql =
        """
        UPDATE pgagent.pga_job
        SET jobagentid = :agentPid,
            joblastrun = now()
        WHERE jobid = CAST(:jobId AS int4)
          AND jobagentid IS NULL
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("agentPid", agentPid).addValue("jobId", jobId);
    return jdbcTemplate.update(sql, params);
  }

  public long startRunLog(String jobId) {
    final String sql =
        """
        INSERT INTO pgagent.pga_joblog (jlgjobid, jlgstatus)
        VALUES (CAST(:jobId AS int4), 'r')
        RETURNING jlgid
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("jobId", jobId);
    final Long logId = jdbcTemplate.queryForObject(sql, params, Long.class);
    if (logId == null) {
      throw new IllegalStateException("pga_joblog insert returned no id jobId=" + jobId);
    }
    return logId;
  }

  public int finishRunLog(long logId, String statusCode) {
    final String sql =
        """
        UPDATE pgagent.pga_joblog
        SET jlgstatus = :status,
            jlgduration = now() - jlgstart
        WHERE jlgid = :logId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("status", statusCode).addValue("logId", logId);
    return jdbcTemplate.update(sql, params);
  }

  public int release(String jobId, Collection<Integer> agentPids) {
    // jobnextrun = NULL lets the schedule trigger compute the next run
    final String sql =
        """
        UPDATE pgagent.pga_job
        SET jobagentid = NULL,
            jobnextrun = NULL
        WHERE jobid = CAST(:jobId AS int4)
          AND jobagentid IN (:agentPids)
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("jobId", jobId).addValue("agentPids", agentPids);
    return jdbcTemplate.update(sql, params);
  }

  public List<JobStep> findEnabledSteps(String jobId) {
    final String sql =
        """
        SELECT jstid::text AS step_id, jstname, jstkind, jstcode, jstonerror
        FROM pgagent.pga_jobstep
        WHERE jstjobid = CAST(:jobId AS int4)
          AND jstenabled
        ORDER BY jstname, jstid
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("jobId", jobId);
    return jdbcTemplate.query(
        sql,
        params,
        (rs, rowNum) ->
            new JobStep(
                rs.getString("step_id"),
                rs.getString("jstname"),
                rs.getString("jstkind"),
                rs.getString("jstcode"),
                rs.getString("jstonerror")));
  }

  public long startStepLog(long logId, String stepId) {
    final String sql =
        """
        INSERT INTO pgagent.pga_jobsteplog (jsljlgid, jsljstid, jslstatus)
        VALUES (:logId, CAST(:stepId AS int4), 'r')
        RETURNING jslid
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("logId", logId).addValue("stepId", stepId);
    final Long stepLogId = jdbcTemplate.queryForObject(sql, params, Long.class);
    if (stepLogId == null) {
      throw new IllegalStateException("pga_jobsteplog insert returned no id stepId=" + stepId);
    }
    return stepLogId;
  }

  public int finishStepLog(long stepLogId, String statusCode, int result, String output) {
    final String sql =
        """
        UPDATE pgagent.pga_jobsteplog
        SET jslstatus = :status,
            jslresult = :result,
            jslduration = now() - jslstart,
            jsloutput = :output
        WHERE jslid = :stepLogId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("status", statusCode)
            .addValue("result", result)
            .addValue("output", output)
            .addValue("stepLogId", stepLogId);
    return jdbcTemplate.update(sql, params);
  }
}
