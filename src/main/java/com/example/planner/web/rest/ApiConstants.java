package com.example.planner.web.rest;

public final class ApiConstants {

  public static final class ApiPath {
    // Base paths
    public static final String AUTH_BASE = "/auth";
    public static final String API_BASE = "/api";
    public static final String HEALTH_BASE = "/health";

    // Auth paths
    public static final String LOGIN = "/login";
    public static final String LOGOUT = "/logout";
    public static final String REFRESH = "/refresh";

    // Session paths
    public static final String SESSIONS = "/sessions";
    public static final String ACTIVE = "/active";
    public static final String HISTORY = "/history";
    public static final String SESSION_ID = "/{sessionId}";

    // Analytics paths
    public static final String ANALYTICS = "/analytics";
    public static final String HELP_ANALYTICS = "/help/{childId}";
    public static final String HELP_PATTERNS = HELP_ANALYTICS + "/patterns";
    public static final String HELP_SUGGESTIONS = HELP_ANALYTICS + "/suggestions";
    public static final String PROGRESS = "/progress/{childId}";
    public static final String CACHE_STATS = "/cache/stats";

    // Activity paths
    public static final String ACTIVITIES = "/activities";
    public static final String PROGRESS_WRITE = "/progress";
    public static final String PAGE_ACCESS = "/page-access";
    public static final String HELP_REQUESTS = "/help-requests";
    public static final String HELP_REQUEST_RESPONSE = "/{id}/response";
    public static final String HELP_REQUEST_RESOLVE = "/{id}/resolve";
    public static final String HELP_REQUEST_REPORT = "/{id}/report";

    // Health paths
    public static final String LIVE = "/live";
    public static final String READY = "/ready";

    private ApiPath() {}
  }

  public static final class Headers {
    public static final String FORWARDED_FOR = "X-Forwarded-For";
    public static final String BEARER_PREFIX = "Bearer ";

    private Headers() {}
  }

  private ApiConstants() {}
}
