package com.openforge.toolrelay.agent.channel;

import com.openforge.toolrelay.llm.model.Attachment;

/**
 * A named, closable progress section of the visible response.
 *
 * Once closed or failed, further calls are ignored.
 */
public interface Stage {

    String name();

    void appendContent(String text);

    void addAttachment(Attachment attachment);

    /** Marks the stage completed. */
    void close();

    /** Marks the stage failed; content already emitted stays visible. */
    void fail();
}
