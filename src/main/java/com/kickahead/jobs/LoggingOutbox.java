package com.kickahead.jobs;

import org.json.JSONObject;

import java.util.logging.Logger;

// Outbox that only logs each message; used by the demo application
public class LoggingOutbox implements Outbox {
    private static final Logger logger = Logger.getLogger(LoggingOutbox.class.getName());

    @Override
    public void send(JSONObject message) {
        logger.info("Outgoing message: " + message.toString());
    }
}
