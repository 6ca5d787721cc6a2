package vn.legaldoc.structure.batch;

/**
 * Runtime exception for a document that could not be read, parsed or written.
 */
public class ParseJobException extends RuntimeException {

    public ParseJobException(String message) {
        super(message);
    }

    public ParseJobException(String message, Throwable cause) {
        super(message, cause);
    }
}
