package github.sarthakdev143.hdr_studio.exception;

public abstract class HdrPipelineException extends RuntimeException {

    protected HdrPipelineException(String message) {
        super(message);
    }

    protected HdrPipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
