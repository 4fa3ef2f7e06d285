package com.deepansh.kernel.session;

import com.deepansh.kernel.model.Message;

import java.util.List;

/**
 * Persistence for message history between turns. The kernel is the only writer
 * during a turn.
 */
public interface SessionStore {

    /** Empty list when the session does not exist or has expired. */
    List<Message> load(String sessionId);

    void save(String sessionId, List<Message> messages);

    void delete(String sessionId);
}
