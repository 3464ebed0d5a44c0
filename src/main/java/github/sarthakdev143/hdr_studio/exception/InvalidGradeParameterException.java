package github.sarthakdev143.hdr_studio.exception;

public class InvalidGradeParameterException extends HdrPipelineException {

    public InvalidGradeParameterException(String message) {
        super(message);
    }
}
