package io.workline.core.conversation;

/**
 * The language model was unreachable or answered with something other than the expected JSON.
 */
public class MalformedReplyException extends Exception {
    public MalformedReplyException(String message) {
        super(message);
    }

    public MalformedReplyException(String message, Throwable cause) {
        super(message, cause);
    }
}
