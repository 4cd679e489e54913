package com.triagebot.core.model;

import java.io.Serializable;

/**
 * An issue report as delivered by the tracker. Identity is {@code number}.
 */
public record Issue(
    int number,
    String title,
    String body
) implements Serializable {

    public Issue {
        title = title != null ? title : "";
        body = body != null ? body : "";
    }

    /**
     * Title and body joined by a single space, the text that is classified and embedded.
     */
    public String combinedText() {
        return title + " " + body;
    }
}
