package github.sarthakdev143.hdr_studio.exception;

public class ExportException extends HdrPipelineException {

    public ExportException(String message) {
        super(message);
    }

    public ExportException(String message, Throwable cause) {
        super(message, cause);
    }
}
