package com.kickahead.jobs;

import org.json.JSONObject;

/**
 * Destination for the messages produced by the reminder jobs.
 */
@FunctionalInterface
public interface Outbox {

    void send(JSONObject message) throws Exception;
}
