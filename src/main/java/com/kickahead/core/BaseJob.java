package com.kickahead.core;

import com.google.gson.Gson;
import com.google.gson.JsonElement;

import java.util.List;

/**
 * Abstract base class for job implementations providing common functionality.
 *
 * <p>Arguments that went through a persistent repository come back loosely typed
 * (a number stored as {@code 42} may be read back as a {@code Long}, an object as a
 * {@code Map}). This class converts them to the type the job expects.</p>
 *
 * <p><b>Usage:</b></p>
 * <pre>{@code
 * public class MyJob extends BaseJob {
 *     public void perform(List<Object> args) throws Exception {
 *         String recipient = arg(args, 0, String.class);
 *         MyData data = arg(args, 1, MyData.class);
 *         // ... process data
 *     }
 * }
 * }</pre>
 *
 * @see Job
 */
public abstract class BaseJob implements Job {
    // Shared Gson instance - thread-safe
    private static final Gson gson = new Gson();

    /**
     * Convert the argument at {@code index} to the given type.
     *
     * @param args the job arguments
     * @param index position of the argument
     * @param type the target type
     * @param <T> the type of the argument
     * @return the converted argument, or null if the stored value is null
     * @throws IllegalArgumentException if there is no argument at {@code index}
     */
    protected <T> T arg(List<Object> args, int index, Class<T> type) {
        if (index < 0 || index >= args.size()) {
            throw new IllegalArgumentException(
                getClass().getSimpleName() + " expected an argument at position " + index
                    + " but got " + args.size() + " argument(s)");
        }
        Object value = args.get(index);
        if (value == null) {
            return null;
        }
        if (type.isInstance(value)) {
            return type.cast(value);
        }
        JsonElement tree = gson.toJsonTree(value);
        return gson.fromJson(tree, type);
    }
}
