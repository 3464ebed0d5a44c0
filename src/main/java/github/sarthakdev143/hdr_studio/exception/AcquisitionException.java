package github.sarthakdev143.hdr_studio.exception;

public class AcquisitionException extends HdrPipelineException {

    public AcquisitionException(String message) {
        super(message);
    }

    public AcquisitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
