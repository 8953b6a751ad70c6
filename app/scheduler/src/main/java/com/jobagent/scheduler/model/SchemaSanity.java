package com.jobagent.scheduler.model;

/** Result of the startup sanity check on the primary connection. */
public record SchemaSanity(boolean jobTablePresent, int backendPid) {}
