package io.github.reugn.snapshot4j.error;

import java.util.List;

/**
 * Thrown by the code formatter when the text it is given is not well formed, such as
 * unbalanced brackets or an unterminated literal.
 */
public class FormattingException extends SnapshotException {

    public FormattingException(String reason) {
        super("Formatting error: " + reason, List.of(), null);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.FORMATTING_FAILURE;
    }
}
