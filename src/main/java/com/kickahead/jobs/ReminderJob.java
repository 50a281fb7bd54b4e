package com.kickahead.jobs;

import com.kickahead.core.BaseJob;

import org.json.JSONObject;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Sends a reminder message to a recipient.
 *
 * <p>Arguments: {@code [recipient, subject]}. When the reminder missed its window and the
 * job type uses the hook strategy, a "missed reminder" notice is sent instead, carrying the
 * original schedule time.</p>
 */
public class ReminderJob extends BaseJob {
    private static final Logger logger = Logger.getLogger(ReminderJob.class.getName());

    public static final String TYPE = "ReminderJob";

    private final Outbox outbox;

    public ReminderJob(Outbox outbox) {
        this.outbox = Objects.requireNonNull(outbox, "outbox");
    }

    @Override
    public void perform(List<Object> args) throws Exception {
        JSONObject message = buildMessage(args);
        message.put("kind", "reminder");
        outbox.send(message);
        logger.info("Reminder sent to " + message.getString("to"));
    }

    @Override
    public void outOfTimeHook(Instant scheduledAt, List<Object> args) throws Exception {
        JSONObject message = buildMessage(args);
        message.put("kind", "missed_reminder");
        message.put("scheduledAt", scheduledAt.toString());
        outbox.send(message);
        logger.warning("Reminder for " + message.getString("to") + " missed its slot at " + scheduledAt);
    }

    /**
     * Build the message body shared by the on-time and missed variants.
     *
     * @param args the job arguments
     * @return a message with at least "to" and "subject"
     */
    protected JSONObject buildMessage(List<Object> args) {
        String recipient = arg(args, 0, String.class);
        if (recipient == null || recipient.isEmpty()) {
            throw new IllegalArgumentException("Reminder recipient is required");
        }

        JSONObject json = new JSONObject();
        json.put("to", recipient);
        json.put("subject", arg(args, 1, String.class));
        return json;
    }
}
