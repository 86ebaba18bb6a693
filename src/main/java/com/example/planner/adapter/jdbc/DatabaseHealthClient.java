package com.example.planner.adapter.jdbc;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

/**
 * Round trip against the relational store used by the readiness probe.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DatabaseHealthClient {

  private final JdbcTemplate jdbcTemplate;

  public DatabaseHealth checkHealth() {
    long startTime = System.nanoTime();
    try {
      Integer one = jdbcTemplate.queryForObject("SELECT 1", Integer.class);
      long responseTimeMs = (System.nanoTime() - startTime) / 1_000_000;
      if (one == null || one != 1) {
        return new DatabaseHealth(false, responseTimeMs, "Unexpected probe result: " + one);
      }
      return new DatabaseHealth(true, responseTimeMs, null);
    } catch (DataAccessException e) {
      log.error("Database health check failed", e);
      return new DatabaseHealth(false, 0, e.getMostSpecificCause().getMessage());
    }
  }

  public record DatabaseHealth(boolean healthy, long responseTimeMs, String error) {
  }
}
